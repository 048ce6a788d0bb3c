package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.engine.AnomalyEngine;
import com.costwatch.anomaly.engine.CheckRegistry;
import com.costwatch.anomaly.model.AnomalySettings;
import com.costwatch.anomaly.model.AnomalySettingsPatch;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnomalyEngine engine;

    @Test
    void getSettings_success() throws Exception {
        when(engine.getSettings()).thenReturn(AnomalySettings.defaults());

        mockMvc.perform(get("/api/v1/config/anomaly-settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alertThresholds.yoyDeviationPercent").value(20.0))
                .andExpect(jsonPath("$.alertThresholds.zScoreThreshold").value(2.0))
                .andExpect(jsonPath("$.enabledChecks.length()").value(8))
                .andExpect(jsonPath("$.maxAlertsPerDay").value(50))
                .andExpect(jsonPath("$.digestHour").value(8));
    }

    @Test
    void updateSettings_success() throws Exception {
        AnomalySettings merged = AnomalySettings.defaults().merge(AnomalySettingsPatch.builder()
                .maxAlertsPerDay(10)
                .build());
        when(engine.updateSettings(any())).thenReturn(merged);

        mockMvc.perform(put("/api/v1/config/anomaly-settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "maxAlertsPerDay", 10,
                                "alertThresholds", Map.of("yoyDeviationPercent", 25.0)
                        ))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxAlertsPerDay").value(10));

        verify(engine).updateSettings(argThat(p -> p.getMaxAlertsPerDay() == 10
                && p.getAlertThresholds().getYoyDeviationPercent() == 25.0
                && p.getAlertThresholds().getMomDeviationPercent() == null));
    }

    @Test
    void updateSettings_nonPositiveZScore_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/anomaly-settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "alertThresholds", Map.of("zScoreThreshold", 0.0)
                        ))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("alertThresholds.zScoreThreshold"));

        verify(engine, never()).updateSettings(any());
    }

    @Test
    void updateSettings_invalidDigestHour_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/anomaly-settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("digestHour", 24))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("digestHour"));
    }

    @Test
    void updateSettings_zeroMaxAlerts_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/anomaly-settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("maxAlertsPerDay", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void updateSettings_unknownCheckId_returns400() throws Exception {
        when(engine.getRegistry()).thenReturn(CheckRegistry.defaultRegistry());

        mockMvc.perform(put("/api/v1/config/anomaly-settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "enabledChecks", List.of("yoy_deviation", "made_up")))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("enabledChecks"));
    }
}
