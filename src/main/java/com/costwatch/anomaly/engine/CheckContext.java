package com.costwatch.anomaly.engine;

import com.costwatch.anomaly.model.AnomalySettings;
import com.costwatch.anomaly.model.BudgetContext;
import com.costwatch.anomaly.model.ContractContext;
import com.costwatch.anomaly.model.HistoricalCostRecord;
import com.costwatch.anomaly.model.LocationContext;
import com.costwatch.anomaly.model.SupplierContext;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Read-only data bundle handed to every check for one cost record.
 * The historical records are copied on construction, so callers may reuse
 * their own lists without affecting a detection in flight.
 */
@Value
@With
public class CheckContext {

    LocationContext location;

    SupplierContext supplier;

    // Past records of the same supplier, most callers pass the last 12-24 months
    List<HistoricalCostRecord> historicalRecords;

    // Optional
    ContractContext contract;

    // Optional; budget_exceeded only runs when present
    BudgetContext budget;

    AnomalySettings settings;

    @Builder(toBuilder = true)
    private CheckContext(LocationContext location,
                         SupplierContext supplier,
                         List<HistoricalCostRecord> historicalRecords,
                         ContractContext contract,
                         BudgetContext budget,
                         AnomalySettings settings) {
        this.location = location;
        this.supplier = supplier;
        this.historicalRecords = historicalRecords == null ? List.of() : List.copyOf(historicalRecords);
        this.contract = contract;
        this.budget = budget;
        this.settings = settings == null ? AnomalySettings.defaults() : settings;
    }
}
