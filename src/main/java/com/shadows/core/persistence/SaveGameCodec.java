package com.shadows.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON reader/writer for scenarios, spawn states and full save games.
 */
@Component
public class SaveGameCodec {

    private static final Logger log = LoggerFactory.getLogger(SaveGameCodec.class);

    private final ObjectMapper mapper;

    public SaveGameCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String writeScenario(Scenario scenario) {
        return write(scenario);
    }

    public Scenario readScenario(String json) {
        return read(json, Scenario.class);
    }

    public String writeSpawnState(ObjectiveSpawnState state) {
        return write(state);
    }

    public ObjectiveSpawnState readSpawnState(String json) {
        return read(json, ObjectiveSpawnState.class);
    }

    public String writeSaveGame(SaveGame save) {
        return write(save);
    }

    public SaveGame readSaveGame(String json) {
        return read(json, SaveGame.class);
    }

    public void writeScenario(Scenario scenario, Path file) {
        writeFile(writeScenario(scenario), file);
    }

    public Scenario readScenario(Path file) {
        return readScenario(readFile(file));
    }

    public void writeSaveGame(SaveGame save, Path file) {
        writeFile(writeSaveGame(save), file);
        log.info("Saved game for scenario {} to {}", save.scenario().id(), file);
    }

    public SaveGame readSaveGame(Path file) {
        return readSaveGame(readFile(file));
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SaveGameException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SaveGameException("Invalid " + type.getSimpleName() + " document: " + e.getOriginalMessage(), e);
        }
    }

    private static void writeFile(String content, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new SaveGameException("Cannot write " + file, e);
        }
    }

    private static String readFile(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new SaveGameException("Cannot read " + file, e);
        }
    }
}
