package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Trigger thresholds used by the deviation, outlier and budget checks")
public class AlertThresholds {

    @Schema(description = "Year-over-year deviation in percent", example = "20")
    @Builder.Default
    double yoyDeviationPercent = 20.0;

    @Schema(description = "Month-over-month deviation in percent", example = "30")
    @Builder.Default
    double momDeviationPercent = 30.0;

    @Schema(description = "Price per unit increase in percent", example = "10")
    @Builder.Default
    double pricePerUnitDeviationPercent = 10.0;

    @Schema(description = "Absolute z-score above which an amount is an outlier", example = "2.0")
    @Builder.Default
    double zScoreThreshold = 2.0;

    @Schema(description = "Budget overrun in percent", example = "10")
    @Builder.Default
    double budgetExceededPercent = 10.0;

    @JsonProperty("zScoreThreshold")
    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    public static AlertThresholds defaults() {
        return AlertThresholds.builder().build();
    }

    public AlertThresholds merge(ThresholdsPatch patch) {
        if (patch == null) {
            return this;
        }
        return AlertThresholds.builder()
                .yoyDeviationPercent(valueOr(patch.getYoyDeviationPercent(), yoyDeviationPercent))
                .momDeviationPercent(valueOr(patch.getMomDeviationPercent(), momDeviationPercent))
                .pricePerUnitDeviationPercent(valueOr(patch.getPricePerUnitDeviationPercent(), pricePerUnitDeviationPercent))
                .zScoreThreshold(valueOr(patch.getZScoreThreshold(), zScoreThreshold))
                .budgetExceededPercent(valueOr(patch.getBudgetExceededPercent(), budgetExceededPercent))
                .build();
    }

    private static double valueOr(Double value, double current) {
        return value != null ? value : current;
    }
}
