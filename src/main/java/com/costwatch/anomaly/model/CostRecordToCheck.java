package com.costwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "The cost record under evaluation")
public class CostRecordToCheck {

    @Schema(description = "Cost record identifier", example = "rec-2024-03")
    String id;

    @Schema(description = "Location identifier", example = "loc-hq")
    String locationId;

    @Schema(description = "Supplier identifier", example = "sup-stadtwerke")
    String supplierId;

    @Schema(description = "Cost category", example = "electricity")
    CostType costType;

    @Schema(description = "Invoice amount in EUR", example = "1300.00")
    double amount;

    @Schema(description = "Consumed quantity, if known", example = "4200")
    Double quantity;

    @Schema(description = "Unit of the quantity", example = "kWh")
    String unit;

    @Schema(description = "Price per unit in EUR, if known", example = "0.31")
    Double pricePerUnit;

    @Schema(description = "First day of the billing period", example = "2024-03-01")
    LocalDate periodStart;

    @Schema(description = "Last day of the billing period", example = "2024-03-31")
    LocalDate periodEnd;

    @Schema(description = "Invoice number as printed on the document", example = "INV-2024-0311")
    String invoiceNumber;
}
