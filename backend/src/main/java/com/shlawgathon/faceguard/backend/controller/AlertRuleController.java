package com.shlawgathon.faceguard.backend.controller;

import com.shlawgathon.faceguard.backend.client.RecordStoreClient;
import com.shlawgathon.faceguard.backend.model.AlertRule;
import com.shlawgathon.faceguard.backend.service.AlertRuleCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Alert rule CRUD, proxied to the record store. Every change refreshes the
 * local rule cache so the next sighting sees it.
 */
@RestController
@RequestMapping("/api/alert-rules")
@Tag(name = "Alert Rules", description = "Alert rule management")
public class AlertRuleController {

    private final RecordStoreClient recordStoreClient;
    private final AlertRuleCache ruleCache;

    public AlertRuleController(RecordStoreClient recordStoreClient, AlertRuleCache ruleCache) {
        this.recordStoreClient = recordStoreClient;
        this.ruleCache = ruleCache;
    }

    @GetMapping
    @Operation(summary = "List alert rules")
    public ResponseEntity<List<AlertRule>> listRules() {
        return ResponseEntity.ok(recordStoreClient.listAlertRules());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get alert rule")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rule found"),
            @ApiResponse(responseCode = "404", description = "Rule not found")
    })
    public ResponseEntity<AlertRule> getRule(@Parameter(description = "Rule ID") @PathVariable String id) {
        return ResponseEntity.ok(recordStoreClient.getAlertRule(id));
    }

    @PostMapping
    @Operation(summary = "Create alert rule")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Rule created"),
            @ApiResponse(responseCode = "400", description = "Invalid rule"),
            @ApiResponse(responseCode = "502", description = "Record store rejected the rule")
    })
    public ResponseEntity<AlertRule> createRule(@Valid @RequestBody AlertRule rule) {
        AlertRule created = recordStoreClient.createAlertRule(rule);
        ruleCache.refresh();
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update alert rule")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rule updated"),
            @ApiResponse(responseCode = "404", description = "Rule not found")
    })
    public ResponseEntity<AlertRule> updateRule(
            @Parameter(description = "Rule ID") @PathVariable String id,
            @Valid @RequestBody AlertRule rule) {
        AlertRule updated = recordStoreClient.updateAlertRule(id, rule);
        ruleCache.refresh();
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete alert rule")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Rule deleted"),
            @ApiResponse(responseCode = "404", description = "Rule not found")
    })
    public ResponseEntity<Void> deleteRule(@Parameter(description = "Rule ID") @PathVariable String id) {
        recordStoreClient.deleteAlertRule(id);
        ruleCache.refresh();
        return ResponseEntity.noContent().build();
    }
}
