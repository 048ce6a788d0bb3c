package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.engine.AnomalyEngine;
import com.costwatch.anomaly.model.AnomalySettings;
import com.costwatch.anomaly.model.AnomalySettingsPatch;
import com.costwatch.anomaly.model.ThresholdsPatch;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify the anomaly detection settings")
public class ConfigController {

    private final AnomalyEngine engine;

    public ConfigController(AnomalyEngine engine) {
        this.engine = engine;
    }

    @Operation(summary = "Get the current anomaly settings")
    @GetMapping("/anomaly-settings")
    public ResponseEntity<AnomalySettings> getSettings() {
        return ResponseEntity.ok(engine.getSettings());
    }

    @Operation(summary = "Update anomaly settings",
            description = "Partial update. Top-level fields replace, thresholds merge field by field. "
                    + "Changes apply to detections started afterwards and reset on restart.")
    @PutMapping("/anomaly-settings")
    public ResponseEntity<?> updateSettings(@RequestBody AnomalySettingsPatch patch) {
        ThresholdsPatch thresholds = patch.getAlertThresholds();
        if (thresholds != null) {
            if (notPositive(thresholds.getYoyDeviationPercent()))
                return badRequest("yoyDeviationPercent must be > 0", "alertThresholds.yoyDeviationPercent");
            if (notPositive(thresholds.getMomDeviationPercent()))
                return badRequest("momDeviationPercent must be > 0", "alertThresholds.momDeviationPercent");
            if (notPositive(thresholds.getPricePerUnitDeviationPercent()))
                return badRequest("pricePerUnitDeviationPercent must be > 0", "alertThresholds.pricePerUnitDeviationPercent");
            if (notPositive(thresholds.getZScoreThreshold()))
                return badRequest("zScoreThreshold must be > 0", "alertThresholds.zScoreThreshold");
            if (notPositive(thresholds.getBudgetExceededPercent()))
                return badRequest("budgetExceededPercent must be > 0", "alertThresholds.budgetExceededPercent");
        }
        if (patch.getMaxAlertsPerDay() != null && patch.getMaxAlertsPerDay() <= 0) {
            return badRequest("maxAlertsPerDay must be > 0", "maxAlertsPerDay");
        }
        if (patch.getDigestHour() != null && (patch.getDigestHour() < 0 || patch.getDigestHour() > 23)) {
            return badRequest("digestHour must be in [0, 23]", "digestHour");
        }
        if (patch.getEnabledChecks() != null) {
            for (String checkId : patch.getEnabledChecks()) {
                if (!engine.getRegistry().contains(checkId)) {
                    return badRequest("Unknown check id: " + checkId, "enabledChecks");
                }
            }
        }

        return ResponseEntity.ok(engine.updateSettings(patch));
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private static boolean notPositive(Double value) {
        return value != null && !(value > 0);
    }
}
