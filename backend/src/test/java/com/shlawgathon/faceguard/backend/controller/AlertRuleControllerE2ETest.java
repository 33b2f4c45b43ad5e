package com.shlawgathon.faceguard.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.BaseE2ETest;
import com.shlawgathon.faceguard.backend.client.RecordNotFoundException;
import com.shlawgathon.faceguard.backend.client.RecordStoreClient;
import com.shlawgathon.faceguard.backend.client.RecordStoreException;
import com.shlawgathon.faceguard.backend.client.UpstreamUnavailableException;
import com.shlawgathon.faceguard.backend.model.AlertRule;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class AlertRuleControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RecordStoreClient recordStoreClient;

    @Test
    void shouldCreateRuleAndRefreshCache() throws Exception {
        // Given
        AlertRule created = AlertRule.builder().id("r-new").ruleName("Lobby watch").build();
        when(recordStoreClient.createAlertRule(any())).thenReturn(created);
        when(recordStoreClient.listAlertRules()).thenReturn(List.of(created));

        // When / Then
        mockMvc.perform(post("/api/alert-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rule_name\": \"Lobby watch\", \"priority\": \"high\","
                                + " \"trigger_conditions\": {\"location_ids\": [\"hq-lobby\"]}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("r-new"))
                .andExpect(jsonPath("$.rule_name").value("Lobby watch"));

        verify(recordStoreClient, atLeastOnce()).listAlertRules();
    }

    @Test
    void shouldRejectRuleWithoutName() throws Exception {
        mockMvc.perform(post("/api/alert-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priority\": \"low\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("validation_error"));
    }

    @Test
    void shouldMapMissingRuleToNotFound() throws Exception {
        when(recordStoreClient.getAlertRule("gone"))
                .thenThrow(new RecordNotFoundException("/notifications/alert-rules/gone",
                        objectMapper.createObjectNode().put("detail", "Alert rule not found")));

        mockMvc.perform(get("/api/alert-rules/{id}", "gone"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_kind").value("not_found"))
                .andExpect(jsonPath("$.details.detail").value("Alert rule not found"));
    }

    @Test
    void shouldSurfaceUpstreamErrorWithPayload() throws Exception {
        when(recordStoreClient.getAlertRule("bad"))
                .thenThrow(new RecordStoreException(422, "Record store error: invalid rule",
                        objectMapper.createObjectNode().put("message", "invalid rule")));

        mockMvc.perform(get("/api/alert-rules/{id}", "bad"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error_kind").value("upstream_error"))
                .andExpect(jsonPath("$.details.upstream_status").value(422));
    }

    @Test
    void shouldReportUnavailableRecordStore() throws Exception {
        when(recordStoreClient.listAlertRules())
                .thenThrow(new UpstreamUnavailableException("Record store unavailable", new IOException("refused")));

        mockMvc.perform(get("/api/alert-rules"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_kind").value("upstream_unavailable"));
    }

    @Test
    void shouldDeleteRule() throws Exception {
        mockMvc.perform(delete("/api/alert-rules/{id}", "r-1"))
                .andExpect(status().isNoContent());

        verify(recordStoreClient).deleteAlertRule("r-1");
    }
}
