package com.shadows.core.repair;

import com.shadows.core.balance.GenerationProperties;
import com.shadows.core.events.EventBus;
import com.shadows.core.events.ShadowsEvent;
import com.shadows.core.generator.ScenarioGenerator;
import com.shadows.core.logging.MdcContext;
import com.shadows.core.metrics.ShadowsMetrics;
import com.shadows.core.model.Difficulty;
import com.shadows.core.model.Scenario;
import com.shadows.core.validation.ValidationResult;
import com.shadows.core.validation.WinnabilityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Generate, validate, repair, retry. Gives up after a fixed number of generator calls
 * and reports exhaustion as an empty result.
 */
@Service
public class ValidatedScenarioGenerator {

    private static final Logger log = LoggerFactory.getLogger(ValidatedScenarioGenerator.class);

    private final ScenarioGenerator generator;
    private final WinnabilityValidator validator;
    private final ScenarioAutoFixer autoFixer;
    private final GenerationProperties properties;
    private final ShadowsMetrics metrics;
    private final EventBus eventBus;

    public ValidatedScenarioGenerator(ScenarioGenerator generator,
                                      WinnabilityValidator validator,
                                      ScenarioAutoFixer autoFixer,
                                      GenerationProperties properties,
                                      ShadowsMetrics metrics,
                                      EventBus eventBus) {
        this.generator = generator;
        this.validator = validator;
        this.autoFixer = autoFixer;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public Optional<ValidatedScenario> generateValidatedScenario(Difficulty difficulty) {
        return generateValidatedScenario(difficulty, properties.getMaxAttempts());
    }

    public Optional<ValidatedScenario> generateValidatedScenario(Difficulty difficulty, int maxAttempts) {
        if (difficulty == null) {
            throw new IllegalArgumentException("difficulty must not be null");
        }
        return generateValidatedScenario(() -> generator.generateRandomScenario(difficulty), maxAttempts);
    }

    /**
     * Runs the validated-generation loop over an arbitrary scenario source.
     *
     * @param source      called once per attempt
     * @param maxAttempts hard cap on calls to {@code source}, at least 1
     * @return the first scenario that validates, possibly auto-fixed, or empty once attempts run out
     */
    public Optional<ValidatedScenario> generateValidatedScenario(Supplier<Scenario> source, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        long start = System.currentTimeMillis();
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                Scenario candidate = source.get();
                if (candidate == null) {
                    log.warn("Scenario source returned nothing on attempt {}", attempt);
                    continue;
                }
                MdcContext.setScenario(candidate.id());
                MdcContext.setAttempt(attempt);

                var accepted = tryAccept(candidate, attempt);
                if (accepted.isPresent()) {
                    var result = accepted.get();
                    log.info("Accepted scenario {} after {} attempt(s){}", result.scenario().id(), attempt,
                            result.wasFixed() ? " (auto-fixed)" : "");
                    String difficulty = result.scenario().difficulty() != null
                            ? result.scenario().difficulty().label() : "unknown";
                    metrics.recordScenarioGenerated(difficulty, result.wasFixed());
                    metrics.recordGenerationAttempts(attempt);
                    eventBus.publish(ShadowsEvent.of("scenario.generated", result.scenario().id(), null,
                            Map.of("attempts", attempt, "fixed", result.wasFixed(),
                                    "confidence", result.validation().confidence())));
                    return accepted;
                }
                log.debug("Discarded scenario {} on attempt {}", candidate.id(), attempt);
                eventBus.publish(ShadowsEvent.of("scenario.rejected", candidate.id(), null,
                        Map.of("attempt", attempt)));
            }
            log.warn("No winnable scenario after {} attempt(s)", maxAttempts);
            metrics.recordGenerationExhausted();
            return Optional.empty();
        } finally {
            metrics.recordGenerationDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    private Optional<ValidatedScenario> tryAccept(Scenario candidate, int attempt) {
        if (validator.isScenarioBasicallyWinnable(candidate)) {
            ValidationResult validation = validator.validateScenarioWinnability(candidate);
            metrics.recordValidation(validation.winnable(), validation.confidence());
            if (validation.winnable()) {
                return Optional.of(new ValidatedScenario(candidate, validation, attempt, false, null));
            }
        }

        AutoFixResult fix = autoFixer.autoFixScenario(candidate);
        if (!fix.changed()) {
            return Optional.empty();
        }
        metrics.recordAutoFix(fix.changes().size());
        eventBus.publish(ShadowsEvent.of("scenario.fixed", candidate.id(), null, Map.of("changes", fix.changes())));
        ValidationResult revalidation = validator.validateScenarioWinnability(fix.fixed());
        metrics.recordValidation(revalidation.winnable(), revalidation.confidence());
        if (!revalidation.winnable()) {
            return Optional.empty();
        }
        return Optional.of(new ValidatedScenario(fix.fixed(), revalidation, attempt, true, fix.changes()));
    }
}
