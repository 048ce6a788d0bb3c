package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Anomalies found for one cost record, plus the per-check trace")
public class DetectionResult {

    String costRecordId;

    List<DetectedAnomaly> anomalies;

    List<CheckExecution> checkResults;

    @JsonProperty("isBackfill")
    boolean backfill;
}
