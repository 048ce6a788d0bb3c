package com.costwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Supply contract terms known for the supplier. Optional in every context.
 */
@Value
@Builder
@Jacksonized
public class ContractContext {
    String id;
    String supplierId;
    Double pricePerUnit;
    Double minQuantity;
    Double maxQuantity;
    LocalDate validFrom;
    LocalDate validTo;
}
