package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Budget for one cost type. A null month means a yearly budget.")
public class BudgetContext {

    String id;

    CostType costType;

    @Schema(example = "2024")
    int year;

    @Schema(description = "Month 1-12 for a monthly budget, null for a yearly one", example = "3")
    Integer month;

    @Schema(description = "Budget amount in EUR", example = "5000")
    double amount;

    @JsonIgnore
    public boolean isMonthly() {
        return month != null;
    }
}
