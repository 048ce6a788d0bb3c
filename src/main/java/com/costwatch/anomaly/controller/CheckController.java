package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.engine.AnomalyCheck;
import com.costwatch.anomaly.engine.AnomalyEngine;
import com.costwatch.anomaly.model.CheckInfo;
import com.costwatch.anomaly.model.CostType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/checks")
@Tag(name = "Checks", description = "List anomaly checks and enable/disable them")
public class CheckController {

    private final AnomalyEngine engine;

    public CheckController(AnomalyEngine engine) {
        this.engine = engine;
    }

    @Operation(summary = "List all anomaly checks",
            description = "Returns every registered check in execution order with its enabled flag.")
    @GetMapping
    public ResponseEntity<List<CheckInfo>> listChecks() {
        return ResponseEntity.ok(engine.getRegistry().getAll().stream()
                .map(this::toInfo)
                .toList());
    }

    @Operation(summary = "Get a specific check by ID")
    @GetMapping("/{checkId}")
    public ResponseEntity<CheckInfo> getCheck(
            @Parameter(description = "Check ID", example = "yoy_deviation")
            @PathVariable String checkId) {
        return engine.getRegistry().getById(checkId)
                .map(check -> ResponseEntity.ok(toInfo(check)))
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Enable a check", description = "Idempotent. Applies to detections started afterwards.")
    @PostMapping("/{checkId}/enable")
    public ResponseEntity<CheckInfo> enableCheck(
            @Parameter(description = "Check ID", example = "seasonal_anomaly")
            @PathVariable String checkId) {
        if (!engine.getRegistry().contains(checkId)) {
            return ResponseEntity.notFound().build();
        }
        engine.enableCheck(checkId);
        return getCheck(checkId);
    }

    @Operation(summary = "Disable a check", description = "Idempotent. Applies to detections started afterwards.")
    @PostMapping("/{checkId}/disable")
    public ResponseEntity<CheckInfo> disableCheck(
            @Parameter(description = "Check ID", example = "seasonal_anomaly")
            @PathVariable String checkId) {
        if (!engine.getRegistry().contains(checkId)) {
            return ResponseEntity.notFound().build();
        }
        engine.disableCheck(checkId);
        return getCheck(checkId);
    }

    private CheckInfo toInfo(AnomalyCheck check) {
        return CheckInfo.builder()
                .id(check.getId())
                .name(check.getName())
                .description(check.getDescription())
                .allCostTypes(check.getApplicableCostTypes().equals(AnomalyCheck.ALL_COST_TYPES))
                .applicableCostTypes(check.getApplicableCostTypes().stream().sorted().toList())
                .minHistoricalMonths(check.getMinHistoricalMonths())
                .enabled(engine.isCheckEnabled(check.getId()))
                .build();
    }
}
