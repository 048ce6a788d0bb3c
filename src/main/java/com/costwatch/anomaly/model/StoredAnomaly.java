package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A persisted anomaly with its review lifecycle")
public class StoredAnomaly {

    @Schema(example = "0b6f1f8e-5a43-4b1c-9a55-44e8c3f2a9d1")
    private String id;

    private String costRecordId;

    @Schema(example = "budget_exceeded")
    private String type;

    private AnomalySeverity severity;

    @Builder.Default
    private AnomalyStatus status = AnomalyStatus.NEW;

    private String message;

    private Map<String, Object> details;

    @JsonProperty("isBackfill")
    private boolean backfill;

    private Instant detectedAt;
}
