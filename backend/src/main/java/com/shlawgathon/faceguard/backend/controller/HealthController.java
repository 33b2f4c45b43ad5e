package com.shlawgathon.faceguard.backend.controller;

import com.shlawgathon.faceguard.backend.dto.HealthResponse;
import com.shlawgathon.faceguard.backend.service.SystemStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health")
public class HealthController {

    private final SystemStatusService systemStatusService;

    public HealthController(SystemStatusService systemStatusService) {
        this.systemStatusService = systemStatusService;
    }

    @GetMapping("/api/health")
    @Operation(summary = "Service health")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "All components healthy"),
            @ApiResponse(responseCode = "503", description = "Index snapshot corrupt or alert rules unavailable")
    })
    public ResponseEntity<HealthResponse> health() {
        HealthResponse health = systemStatusService.health();
        return ResponseEntity.status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(health);
    }
}
