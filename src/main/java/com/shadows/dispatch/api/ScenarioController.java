package com.shadows.dispatch.api;

import com.shadows.core.balance.GenerationProperties;
import com.shadows.core.generator.ScenarioGenerator;
import com.shadows.core.model.Difficulty;
import com.shadows.core.model.Scenario;
import com.shadows.core.repair.AutoFixResult;
import com.shadows.core.repair.ScenarioAutoFixer;
import com.shadows.core.repair.ValidatedScenario;
import com.shadows.core.repair.ValidatedScenarioGenerator;
import com.shadows.core.validation.ValidationResult;
import com.shadows.core.validation.WinnabilityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for scenario generation, validation and repair.
 */
@RestController
@RequestMapping("/api/v1/scenarios")
public class ScenarioController {

    private static final Logger log = LoggerFactory.getLogger(ScenarioController.class);

    private final ValidatedScenarioGenerator validatedGenerator;
    private final ScenarioGenerator generator;
    private final WinnabilityValidator validator;
    private final ScenarioAutoFixer autoFixer;
    private final GenerationProperties generationProperties;

    public ScenarioController(ValidatedScenarioGenerator validatedGenerator,
                              ScenarioGenerator generator,
                              WinnabilityValidator validator,
                              ScenarioAutoFixer autoFixer,
                              GenerationProperties generationProperties) {
        this.validatedGenerator = validatedGenerator;
        this.generator = generator;
        this.validator = validator;
        this.autoFixer = autoFixer;
        this.generationProperties = generationProperties;
    }

    /**
     * POST /api/v1/scenarios: Generate a scenario that passes validation.
     */
    @PostMapping
    public ResponseEntity<?> generate(@RequestBody(required = false) GenerateScenarioRequest request) {
        Difficulty difficulty;
        try {
            difficulty = request != null && request.difficulty() != null
                    ? Difficulty.fromLabel(request.difficulty())
                    : Difficulty.NORMAL;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Invalid difficulty: " + request.difficulty()));
        }

        int maxAttempts = request != null && request.maxAttempts() != null
                ? request.maxAttempts()
                : generationProperties.getMaxAttempts();
        if (maxAttempts < 1) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "max_attempts must be at least 1"));
        }

        Optional<ValidatedScenario> result = validatedGenerator.generateValidatedScenario(difficulty, maxAttempts);
        if (result.isEmpty()) {
            log.warn("No winnable {} scenario after {} attempts", difficulty.label(), maxAttempts);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Could not generate a winnable scenario after "
                            + maxAttempts + " attempts"));
        }

        ValidatedScenario validated = result.get();
        String summary = validator.getValidationSummary(validated.validation());
        return ResponseEntity.status(HttpStatus.CREATED).body(ScenarioResponse.from(validated, summary));
    }

    /**
     * GET /api/v1/scenarios/pool: Generate a mission-selection pool, each entry with its verdict.
     */
    @GetMapping("/pool")
    public ResponseEntity<?> pool(@RequestParam(name = "difficulty", defaultValue = "Normal") String difficultyLabel,
                                  @RequestParam(name = "count", required = false) Integer count) {
        Difficulty difficulty;
        try {
            difficulty = Difficulty.fromLabel(difficultyLabel);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid difficulty: " + difficultyLabel));
        }
        int size = count != null ? count : generationProperties.getPoolSize();
        if (size < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "count must not be negative"));
        }

        List<PoolEntryResponse> entries = generator.generateScenarioPool(difficulty, size).stream()
                .map(this::toPoolEntry)
                .toList();
        return ResponseEntity.ok(entries);
    }

    /**
     * POST /api/v1/scenarios/validate: Full winnability check of a client-supplied scenario.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@RequestBody Scenario scenario) {
        ValidationResult result = validator.validateScenarioWinnability(scenario);
        return ResponseEntity.ok(new ValidationResponse(
                result,
                validator.getValidationSummary(result),
                validator.isScenarioBasicallyWinnable(scenario)));
    }

    /**
     * POST /api/v1/scenarios/autofix: Apply the deterministic repairs to a scenario.
     */
    @PostMapping("/autofix")
    public ResponseEntity<AutoFixResult> autofix(@RequestBody Scenario scenario) {
        return ResponseEntity.ok(autoFixer.autoFixScenario(scenario));
    }

    private PoolEntryResponse toPoolEntry(Scenario scenario) {
        ValidationResult result = validator.validateScenarioWinnability(scenario);
        return new PoolEntryResponse(scenario, result, validator.getValidationSummary(result));
    }
}
