package com.costwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial settings update. Top-level fields replace, alertThresholds is merged field by field.")
public class AnomalySettingsPatch {
    private ThresholdsPatch alertThresholds;
    private List<String> enabledChecks;
    private Integer maxAlertsPerDay;
    private Boolean digestEnabled;
    private Integer digestHour;
}
