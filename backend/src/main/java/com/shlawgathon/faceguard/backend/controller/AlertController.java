package com.shlawgathon.faceguard.backend.controller;

import com.shlawgathon.faceguard.backend.dto.AlertActionRequest;
import com.shlawgathon.faceguard.backend.dto.AlertEngineStats;
import com.shlawgathon.faceguard.backend.dto.AlertInstanceResponse;
import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.AlertStatus;
import com.shlawgathon.faceguard.backend.service.AlertDecisionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/alerts")
@Tag(name = "Alerts", description = "Alert instance lifecycle")
public class AlertController {

    private static final String ANONYMOUS_OPERATOR = "operator";

    private final AlertDecisionEngine alertDecisionEngine;

    public AlertController(AlertDecisionEngine alertDecisionEngine) {
        this.alertDecisionEngine = alertDecisionEngine;
    }

    @GetMapping
    @Operation(summary = "List alerts", description = "Most recent alert instances, optionally filtered by status")
    public ResponseEntity<List<AlertInstanceResponse>> listAlerts(
            @Parameter(description = "TRIGGERED, ACKNOWLEDGED or RESOLVED") @RequestParam(required = false) AlertStatus status,
            @Parameter(description = "Maximum instances to return") @RequestParam(defaultValue = "100") int limit) {
        List<AlertInstanceResponse> alerts = alertDecisionEngine.findAll(status, limit).stream()
                .map(this::toAlertResponse)
                .toList();
        return ResponseEntity.ok(alerts);
    }

    @GetMapping("/stats")
    @Operation(summary = "Alert engine statistics")
    public ResponseEntity<AlertEngineStats> stats() {
        return ResponseEntity.ok(alertDecisionEngine.stats());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get alert")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alert found"),
            @ApiResponse(responseCode = "404", description = "Alert not found")
    })
    public ResponseEntity<AlertInstanceResponse> getAlert(@Parameter(description = "Alert ID") @PathVariable String id) {
        return ResponseEntity.ok(toAlertResponse(alertDecisionEngine.get(id)));
    }

    @PostMapping("/{id}/acknowledge")
    @Operation(summary = "Acknowledge alert", description = "Idempotent; stops escalation")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alert acknowledged"),
            @ApiResponse(responseCode = "404", description = "Alert not found"),
            @ApiResponse(responseCode = "409", description = "Alert already resolved")
    })
    public ResponseEntity<AlertInstanceResponse> acknowledge(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @Valid @RequestBody(required = false) AlertActionRequest request) {
        return ResponseEntity.ok(toAlertResponse(alertDecisionEngine.acknowledge(id, actor(request))));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolve alert", description = "Idempotent; final state")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alert resolved"),
            @ApiResponse(responseCode = "404", description = "Alert not found")
    })
    public ResponseEntity<AlertInstanceResponse> resolve(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @Valid @RequestBody(required = false) AlertActionRequest request) {
        return ResponseEntity.ok(toAlertResponse(alertDecisionEngine.resolve(id, actor(request))));
    }

    private static String actor(AlertActionRequest request) {
        return request != null && request.getBy() != null && !request.getBy().isBlank()
                ? request.getBy()
                : ANONYMOUS_OPERATOR;
    }

    private AlertInstanceResponse toAlertResponse(AlertInstance instance) {
        return AlertInstanceResponse.builder()
                .id(instance.getId())
                .ruleId(instance.getRuleId())
                .ruleName(instance.getRuleName())
                .subjectPersonId(instance.getSubjectPersonId())
                .priority(instance.getPriority())
                .status(instance.getStatus())
                .message(instance.getMessage())
                .triggerPayload(instance.getTriggerPayload())
                .notificationChannels(instance.getNotificationChannels())
                .triggeredAt(instance.getTriggeredAt())
                .acknowledgedAt(instance.getAcknowledgedAt())
                .acknowledgedBy(instance.getAcknowledgedBy())
                .resolvedAt(instance.getResolvedAt())
                .resolvedBy(instance.getResolvedBy())
                .notificationCount(instance.getNotificationCount())
                .escalated(instance.isEscalated())
                .escalatedFromId(instance.getEscalatedFromId())
                .build();
    }
}
