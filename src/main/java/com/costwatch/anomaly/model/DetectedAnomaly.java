package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "An anomaly found for a cost record")
public class DetectedAnomaly {

    @Schema(example = "rec-2024-03")
    String costRecordId;

    @Schema(description = "Id of the check that produced it", example = "yoy_deviation")
    String type;

    @Schema(example = "critical")
    AnomalySeverity severity;

    String message;

    Map<String, Object> details;

    @Schema(description = "True for historical imports; stored but never alerted")
    @JsonProperty("isBackfill")
    boolean backfill;
}
