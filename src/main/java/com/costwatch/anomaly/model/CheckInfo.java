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
@Schema(description = "A registered anomaly check")
public class CheckInfo {

    @Schema(example = "price_per_unit_spike")
    private String id;

    @Schema(example = "Price per unit spike")
    private String name;

    private String description;

    @Schema(description = "True if the check applies to every cost type")
    private boolean allCostTypes;

    @Schema(description = "Cost types the check applies to")
    private List<CostType> applicableCostTypes;

    @Schema(description = "Months of history required; 0 if none", example = "3")
    private int minHistoricalMonths;

    @Schema(description = "Whether the check is enabled in the current settings")
    private boolean enabled;
}
