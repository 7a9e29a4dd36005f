package com.shadows.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadows.core.TestScenarios;
import com.shadows.core.balance.GenerationProperties;
import com.shadows.core.generator.ScenarioGenerator;
import com.shadows.core.model.Difficulty;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.repair.AutoFixResult;
import com.shadows.core.repair.ScenarioAutoFixer;
import com.shadows.core.repair.ValidatedScenario;
import com.shadows.core.repair.ValidatedScenarioGenerator;
import com.shadows.core.validation.ValidationResult;
import com.shadows.core.validation.WinnabilityValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static com.shadows.core.TestScenarios.required;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScenarioController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ScenarioControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ValidatedScenarioGenerator validatedGenerator;

    @MockitoBean
    private ScenarioGenerator generator;

    @MockitoBean
    private WinnabilityValidator validator;

    @MockitoBean
    private ScenarioAutoFixer autoFixer;

    @MockitoBean
    private GenerationProperties generationProperties;

    private final Scenario scenario = TestScenarios.builder()
            .id("gen_1_abcdefg_1")
            .objective(required("obj_key", ObjectiveType.FIND_ITEM, "iron_key", null))
            .event(TestScenarios.boss(3, "shoggoth"))
            .build();

    private final ValidationResult winnable = new ValidationResult(true, 100, List.of(), null);

    @BeforeEach
    void setUp() {
        when(generationProperties.getMaxAttempts()).thenReturn(10);
        when(generationProperties.getPoolSize()).thenReturn(3);
        when(validator.getValidationSummary(any())).thenReturn("Scenario is winnable (100% confidence)");
    }

    // ── POST /api/v1/scenarios ───────────────────────────────────────

    @Test
    @DisplayName("POST /scenarios returns 201 with the validated scenario")
    void generateScenario() throws Exception {
        when(validatedGenerator.generateValidatedScenario(Difficulty.HARD, 10))
                .thenReturn(Optional.of(new ValidatedScenario(scenario, winnable, 2, true,
                        List.of("Moved boss event to doom 4"))));

        mockMvc.perform(post("/api/v1/scenarios")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"difficulty":"Hard"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.scenario.id").value("gen_1_abcdefg_1"))
                .andExpect(jsonPath("$.validation.isWinnable").value(true))
                .andExpect(jsonPath("$.attempts").value(2))
                .andExpect(jsonPath("$.was_fixed").value(true))
                .andExpect(jsonPath("$.fix_changes", hasSize(1)))
                .andExpect(jsonPath("$.summary", containsString("winnable")));
    }

    @Test
    @DisplayName("POST /scenarios without a body defaults to Normal")
    void generateDefaultsToNormal() throws Exception {
        when(validatedGenerator.generateValidatedScenario(Difficulty.NORMAL, 10))
                .thenReturn(Optional.of(new ValidatedScenario(scenario, winnable, 1, false, List.of())));

        mockMvc.perform(post("/api/v1/scenarios"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.was_fixed").value(false));
    }

    @Test
    @DisplayName("POST /scenarios honours max_attempts")
    void generateWithMaxAttempts() throws Exception {
        when(validatedGenerator.generateValidatedScenario(Difficulty.NIGHTMARE, 25))
                .thenReturn(Optional.of(new ValidatedScenario(scenario, winnable, 25, false, List.of())));

        mockMvc.perform(post("/api/v1/scenarios")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"difficulty":"Nightmare","max_attempts":25}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.attempts").value(25));
    }

    @Test
    @DisplayName("POST /scenarios with invalid difficulty returns 400")
    void generateBadDifficulty() throws Exception {
        mockMvc.perform(post("/api/v1/scenarios")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"difficulty":"Easy"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("Invalid difficulty")));

        verify(validatedGenerator, never()).generateValidatedScenario(any(Difficulty.class), anyInt());
    }

    @Test
    @DisplayName("POST /scenarios with max_attempts below 1 returns 400")
    void generateBadAttempts() throws Exception {
        mockMvc.perform(post("/api/v1/scenarios")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"max_attempts":0}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("max_attempts")));
    }

    @Test
    @DisplayName("POST /scenarios returns 503 when every attempt fails")
    void generateExhausted() throws Exception {
        when(validatedGenerator.generateValidatedScenario(eq(Difficulty.NORMAL), anyInt()))
                .thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/scenarios")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error", containsString("after 10 attempts")));
    }

    // ── GET /api/v1/scenarios/pool ───────────────────────────────────

    @Test
    @DisplayName("GET /scenarios/pool returns one verdict per scenario")
    void pool() throws Exception {
        when(generator.generateScenarioPool(Difficulty.NORMAL, 3)).thenReturn(List.of(scenario, scenario, scenario));
        when(validator.validateScenarioWinnability(any())).thenReturn(winnable);

        mockMvc.perform(get("/api/v1/scenarios/pool"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].scenario.id").value("gen_1_abcdefg_1"))
                .andExpect(jsonPath("$[0].validation.confidence").value(100));
    }

    @Test
    @DisplayName("GET /scenarios/pool with count=0 returns an empty list")
    void emptyPool() throws Exception {
        when(generator.generateScenarioPool(Difficulty.HARD, 0)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/scenarios/pool").param("difficulty", "Hard").param("count", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("GET /scenarios/pool rejects bad input")
    void poolBadInput() throws Exception {
        mockMvc.perform(get("/api/v1/scenarios/pool").param("difficulty", "Easy"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("Invalid difficulty")));

        mockMvc.perform(get("/api/v1/scenarios/pool").param("count", "-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("count")));
    }

    // ── validate / autofix ───────────────────────────────────────────

    @Test
    @DisplayName("POST /scenarios/validate returns the full verdict")
    void validate() throws Exception {
        when(validator.validateScenarioWinnability(any())).thenReturn(winnable);
        when(validator.isScenarioBasicallyWinnable(any())).thenReturn(true);

        mockMvc.perform(post("/api/v1/scenarios/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(scenario)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validation.isWinnable").value(true))
                .andExpect(jsonPath("$.basically_winnable").value(true))
                .andExpect(jsonPath("$.summary").isNotEmpty());
    }

    @Test
    @DisplayName("POST /scenarios/autofix returns the repaired scenario and change list")
    void autofix() throws Exception {
        Scenario fixed = scenario.withStartDoom(14);
        when(autoFixer.autoFixScenario(any()))
                .thenReturn(new AutoFixResult(fixed, List.of("Raised start doom to 14")));

        mockMvc.perform(post("/api/v1/scenarios/autofix")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(scenario)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fixed.startDoom").value(14))
                .andExpect(jsonPath("$.changes[0]").value("Raised start doom to 14"));
    }
}
