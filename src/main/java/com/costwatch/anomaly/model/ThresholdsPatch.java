package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial threshold update. Null fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdsPatch {
    private Double yoyDeviationPercent;
    private Double momDeviationPercent;
    private Double pricePerUnitDeviationPercent;
    @JsonProperty("zScoreThreshold")
    private Double zScoreThreshold;
    private Double budgetExceededPercent;

    @JsonProperty("zScoreThreshold")
    public Double getZScoreThreshold() {
        return zScoreThreshold;
    }

    @JsonProperty("zScoreThreshold")
    public void setZScoreThreshold(Double zScoreThreshold) {
        this.zScoreThreshold = zScoreThreshold;
    }
}
