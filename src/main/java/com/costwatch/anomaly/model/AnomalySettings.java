package com.costwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable detection settings. One instance is a consistent snapshot for a whole
 * detection call; changes produce a new instance.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Anomaly detection settings")
public class AnomalySettings {

    public static final List<String> ALL_CHECK_IDS = List.of(
            "yoy_deviation",
            "mom_deviation",
            "price_per_unit_spike",
            "statistical_outlier",
            "duplicate_detection",
            "missing_period",
            "seasonal_anomaly",
            "budget_exceeded");

    @Builder.Default
    AlertThresholds alertThresholds = AlertThresholds.defaults();

    @Schema(description = "Ids of the checks that run by default")
    @Builder.Default
    List<String> enabledChecks = ALL_CHECK_IDS;

    @Schema(example = "50")
    @Builder.Default
    int maxAlertsPerDay = 50;

    @Builder.Default
    boolean digestEnabled = false;

    @Schema(description = "Hour of day (0-23) at which the digest is sent", example = "8")
    @Builder.Default
    int digestHour = 8;

    public static AnomalySettings defaults() {
        return AnomalySettings.builder().build();
    }

    public boolean isCheckEnabled(String checkId) {
        return enabledChecks.contains(checkId);
    }

    public AnomalySettings enableCheck(String checkId) {
        if (enabledChecks.contains(checkId)) {
            return this;
        }
        List<String> ids = new ArrayList<>(enabledChecks);
        ids.add(checkId);
        return withEnabledChecks(List.copyOf(ids));
    }

    public AnomalySettings disableCheck(String checkId) {
        if (!enabledChecks.contains(checkId)) {
            return this;
        }
        return withEnabledChecks(enabledChecks.stream()
                .filter(id -> !id.equals(checkId))
                .toList());
    }

    /**
     * Shallow merge of the top-level fields, deep merge of {@code alertThresholds}.
     */
    public AnomalySettings merge(AnomalySettingsPatch patch) {
        if (patch == null) {
            return this;
        }
        return AnomalySettings.builder()
                .alertThresholds(alertThresholds.merge(patch.getAlertThresholds()))
                .enabledChecks(patch.getEnabledChecks() != null
                        ? patch.getEnabledChecks().stream().distinct().toList()
                        : enabledChecks)
                .maxAlertsPerDay(patch.getMaxAlertsPerDay() != null ? patch.getMaxAlertsPerDay() : maxAlertsPerDay)
                .digestEnabled(patch.getDigestEnabled() != null ? patch.getDigestEnabled() : digestEnabled)
                .digestHour(patch.getDigestHour() != null ? patch.getDigestHour() : digestHour)
                .build();
    }
}
