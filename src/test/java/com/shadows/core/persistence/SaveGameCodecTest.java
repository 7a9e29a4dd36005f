package com.shadows.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadows.core.TestScenarios;
import com.shadows.core.balance.SpawnProperties;
import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.ObjectiveType;
import com.shadows.core.model.Scenario;
import com.shadows.core.objectives.DoomEventScheduler;
import com.shadows.core.spawn.ObjectiveSpawnService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static com.shadows.core.TestScenarios.hidden;
import static com.shadows.core.TestScenarios.required;
import static org.junit.jupiter.api.Assertions.*;

class SaveGameCodecTest {

    private final SaveGameCodec codec = new SaveGameCodec(new ObjectMapper());

    private final Scenario scenario = TestScenarios.builder()
            .id("manor_escape")
            .objective(required("obj_key", ObjectiveType.FIND_ITEM, "iron_key", null))
            .objective(hidden("obj_exit", ObjectiveType.FIND_TILE, "exit_door", "obj_key"))
            .event(TestScenarios.enemies(9, "cultist", 2))
            .event(TestScenarios.boss(3, "shoggoth"))
            .build();

    @Test
    void scenarioSurvivesJson() {
        Scenario restored = codec.readScenario(codec.writeScenario(scenario));

        assertEquals(scenario, restored);
    }

    @Test
    void saveGameKeepsTriggeredEventsAndPityCounter() {
        Scenario played = new DoomEventScheduler().onDoomChanged(scenario, 8).updatedScenario();
        ObjectiveSpawnState state = new ObjectiveSpawnService(new SpawnProperties(), new Random(3))
                .initializeObjectiveSpawns(played)
                .withCounters(5, 0, 3);
        SaveGame save = new SaveGame(played, state, 8, 4);

        SaveGame restored = codec.readSaveGame(codec.writeSaveGame(save));

        assertEquals(save, restored);
        assertTrue(restored.scenario().doomEvents().get(0).triggered());
        assertFalse(restored.scenario().doomEvents().get(1).triggered());
        assertEquals(3, restored.spawnState().tilesSinceLastSpawn());
    }

    @Test
    void writesAndReadsFiles(@TempDir Path dir) {
        Path file = dir.resolve("saves/slot-1.json");
        SaveGame save = new SaveGame(scenario, ObjectiveSpawnState.empty(), 12, 0);

        codec.writeSaveGame(save, file);

        assertTrue(Files.exists(file));
        assertEquals(save, codec.readSaveGame(file));
    }

    @Test
    void spawnStateSurvivesJson() {
        ObjectiveSpawnState state = new ObjectiveSpawnService(new SpawnProperties(), new Random(3))
                .initializeObjectiveSpawns(scenario);

        assertEquals(state, codec.readSpawnState(codec.writeSpawnState(state)));
    }

    @Test
    void malformedDocumentRaisesSaveGameException() {
        var error = assertThrows(SaveGameException.class, () -> codec.readScenario("{not json"));

        assertTrue(error.getMessage().startsWith("Invalid Scenario document"));
    }

    @Test
    void missingFileRaisesSaveGameException(@TempDir Path dir) {
        assertThrows(SaveGameException.class, () -> codec.readScenario(dir.resolve("absent.json")));
    }
}
