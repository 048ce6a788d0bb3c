package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.engine.AnomalyEngine;
import com.costwatch.anomaly.engine.CheckRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CheckController.class)
class CheckControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyEngine engine;

    @BeforeEach
    void setUp() {
        when(engine.getRegistry()).thenReturn(CheckRegistry.defaultRegistry());
        when(engine.isCheckEnabled(anyString())).thenReturn(true);
    }

    @Test
    void listChecks_success() throws Exception {
        mockMvc.perform(get("/api/v1/checks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(8))
                .andExpect(jsonPath("$[0].id").value("yoy_deviation"))
                .andExpect(jsonPath("$[0].allCostTypes").value(true))
                .andExpect(jsonPath("$[0].minHistoricalMonths").value(12))
                .andExpect(jsonPath("$[2].id").value("price_per_unit_spike"))
                .andExpect(jsonPath("$[2].allCostTypes").value(false))
                .andExpect(jsonPath("$[2].applicableCostTypes[0]").value("electricity"))
                .andExpect(jsonPath("$[7].enabled").value(true));
    }

    @Test
    void getCheck_notFound() throws Exception {
        mockMvc.perform(get("/api/v1/checks/unknown"))
                .andExpect(status().isNotFound());
    }

    @Test
    void disableCheck_success() throws Exception {
        when(engine.isCheckEnabled("seasonal_anomaly")).thenReturn(false);

        mockMvc.perform(post("/api/v1/checks/seasonal_anomaly/disable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("seasonal_anomaly"))
                .andExpect(jsonPath("$.enabled").value(false));

        verify(engine).disableCheck("seasonal_anomaly");
    }

    @Test
    void enableCheck_success() throws Exception {
        mockMvc.perform(post("/api/v1/checks/seasonal_anomaly/enable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true));

        verify(engine).enableCheck("seasonal_anomaly");
    }

    @Test
    void enableCheck_unknownId_returns404() throws Exception {
        mockMvc.perform(post("/api/v1/checks/not_a_check/enable"))
                .andExpect(status().isNotFound());

        verify(engine, never()).enableCheck(anyString());
    }
}
