package com.shlawgathon.faceguard.backend.controller;

import com.shlawgathon.faceguard.backend.websocket.RealtimeHub;
import com.shlawgathon.faceguard.backend.websocket.RealtimeStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Realtime", description = "Dashboard WebSocket feed")
public class RealtimeController {

    private final RealtimeHub hub;

    public RealtimeController(RealtimeHub hub) {
        this.hub = hub;
    }

    @GetMapping("/api/realtime/stats")
    @Operation(summary = "Realtime statistics", description = "Connection and message counters for this node")
    public ResponseEntity<RealtimeStats> stats() {
        return ResponseEntity.ok(hub.stats());
    }
}
