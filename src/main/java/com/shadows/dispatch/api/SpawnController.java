package com.shadows.dispatch.api;

import com.shadows.core.model.ObjectiveSpawnState;
import com.shadows.core.model.Scenario;
import com.shadows.core.spawn.ObjectiveSpawnService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller exposing the objective spawn runtime to the browser client.
 * The client owns the spawn state and sends it back with each request.
 */
@RestController
@RequestMapping("/api/v1/spawns")
public class SpawnController {

    private final ObjectiveSpawnService spawnService;

    public SpawnController(ObjectiveSpawnService spawnService) {
        this.spawnService = spawnService;
    }

    @PostMapping("/initialize")
    public ResponseEntity<ObjectiveSpawnState> initialize(@RequestBody Scenario scenario) {
        return ResponseEntity.ok(spawnService.initializeObjectiveSpawns(scenario));
    }

    @PostMapping("/status")
    public ResponseEntity<?> status(@RequestBody SpawnStatusRequest request) {
        if (request.scenario() == null || request.state() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "scenario and state are required"));
        }
        return ResponseEntity.ok(new SpawnStatusResponse(
                spawnService.getSpawnStatus(request.state(), request.scenario()),
                spawnService.getObjectiveProgress(request.state(), request.scenario())));
    }
}
