package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A cost record together with the data needed to judge it. The caller assembles
 * this from storage before asking for detection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A cost record plus its comparison context")
public class DetectionRequest {

    private CostRecordToCheck record;

    private LocationContext location;

    private SupplierContext supplier;

    @Schema(description = "Past records of the same supplier, typically the last 12-24 months")
    @Builder.Default
    private List<HistoricalCostRecord> historicalRecords = new ArrayList<>();

    private ContractContext contract;

    private BudgetContext budget;

    @Schema(description = "Historical import: anomalies are stored but not alerted")
    @JsonProperty("isBackfill")
    private boolean backfill;

    @Schema(description = "Restrict the run to these check ids")
    private List<String> checkIds;
}
