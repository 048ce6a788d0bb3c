package com.costwatch.anomaly.testutil;

import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final String SUPPLIER_ID = "SUP-1";
    public static final String LOCATION_ID = "LOC-1";

    private TestDataFactory() {}

    public static CostRecordToCheck createRecord(String id, CostType costType, double amount, LocalDate periodStart) {
        return CostRecordToCheck.builder()
                .id(id)
                .locationId(LOCATION_ID)
                .supplierId(SUPPLIER_ID)
                .costType(costType)
                .amount(amount)
                .periodStart(periodStart)
                .periodEnd(periodStart.plusMonths(1).minusDays(1))
                .invoiceNumber("INV-" + id)
                .build();
    }

    public static CostRecordToCheck createPricedRecord(String id, CostType costType, double quantity,
                                                       double pricePerUnit, LocalDate periodStart) {
        return createRecord(id, costType, quantity * pricePerUnit, periodStart).toBuilder()
                .quantity(quantity)
                .pricePerUnit(pricePerUnit)
                .unit("kWh")
                .build();
    }

    public static HistoricalCostRecord createHistorical(String id, CostType costType, double amount, LocalDate periodStart) {
        return HistoricalCostRecord.builder()
                .id(id)
                .supplierId(SUPPLIER_ID)
                .costType(costType)
                .amount(amount)
                .periodStart(periodStart)
                .periodEnd(periodStart.plusMonths(1).minusDays(1))
                .invoiceNumber("INV-" + id)
                .build();
    }

    public static HistoricalCostRecord createPricedHistorical(String id, CostType costType, double pricePerUnit,
                                                              LocalDate periodStart) {
        return createHistorical(id, costType, 1000 * pricePerUnit, periodStart).toBuilder()
                .quantity(1000.0)
                .pricePerUnit(pricePerUnit)
                .unit("kWh")
                .build();
    }

    /**
     * One record per consecutive month starting at {@code firstStart}.
     */
    public static List<HistoricalCostRecord> createMonthlyHistory(CostType costType, LocalDate firstStart,
                                                                  double... amounts) {
        List<HistoricalCostRecord> records = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            records.add(createHistorical("H-" + costType.getId() + "-" + i, costType, amounts[i],
                    firstStart.plusMonths(i)));
        }
        return records;
    }

    public static CheckContext createContext(List<HistoricalCostRecord> history) {
        return CheckContext.builder()
                .historicalRecords(history)
                .settings(AnomalySettings.defaults())
                .build();
    }

    public static CheckContext createContext(List<HistoricalCostRecord> history, AnomalySettings settings) {
        return CheckContext.builder()
                .historicalRecords(history)
                .settings(settings)
                .build();
    }

    public static BudgetContext createMonthlyBudget(CostType costType, int year, int month, double amount) {
        return BudgetContext.builder()
                .id("BUD-" + costType.getId() + "-" + year + "-" + month)
                .costType(costType)
                .year(year)
                .month(month)
                .amount(amount)
                .build();
    }

    public static BudgetContext createYearlyBudget(CostType costType, int year, double amount) {
        return BudgetContext.builder()
                .id("BUD-" + costType.getId() + "-" + year)
                .costType(costType)
                .year(year)
                .amount(amount)
                .build();
    }

    public static AnomalySettings settingsWithThresholds(ThresholdsPatch thresholds) {
        return AnomalySettings.defaults().merge(AnomalySettingsPatch.builder()
                .alertThresholds(thresholds)
                .build());
    }

    public static DetectedAnomaly createDetectedAnomaly(String costRecordId, String type, AnomalySeverity severity,
                                                        boolean backfill) {
        return DetectedAnomaly.builder()
                .costRecordId(costRecordId)
                .type(type)
                .severity(severity)
                .message("Test anomaly " + type)
                .details(Map.of("method", "test"))
                .backfill(backfill)
                .build();
    }

    public static StoredAnomaly createStoredAnomaly(String id, String type, AnomalySeverity severity, boolean backfill) {
        return StoredAnomaly.builder()
                .id(id)
                .costRecordId("REC-1")
                .type(type)
                .severity(severity)
                .status(AnomalyStatus.NEW)
                .message("Test anomaly " + type)
                .backfill(backfill)
                .build();
    }
}
