package com.costwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Read-only projection of a past cost record, used as comparison baseline.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A past cost record of the same location and supplier")
public class HistoricalCostRecord {

    String id;
    CostType costType;
    double amount;
    Double quantity;
    String unit;
    Double pricePerUnit;
    LocalDate periodStart;
    LocalDate periodEnd;
    String supplierId;
    String invoiceNumber;
}
