package com.shlawgathon.faceguard.backend.controller;

import com.shlawgathon.faceguard.backend.BaseE2ETest;
import com.shlawgathon.faceguard.backend.client.RecordStoreClient;
import com.shlawgathon.faceguard.backend.service.AlertRuleCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class HealthControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AlertRuleCache alertRuleCache;

    @MockBean
    private RecordStoreClient recordStoreClient;

    @Test
    void shouldReportHealthyWithFreshRules() throws Exception {
        // Given
        when(recordStoreClient.listAlertRules()).thenReturn(List.of());
        alertRuleCache.refresh();

        // When / Then
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.components.index").value("healthy"));
    }

    @Test
    void shouldServeRealtimeStats() throws Exception {
        mockMvc.perform(get("/api/realtime/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeConnections").value(0));
    }

    @Test
    void shouldServeApiDocsWithoutAuth() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }
}
