package com.costwatch.anomaly.engine.checks;

import com.costwatch.anomaly.engine.AnomalyCheck;
import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.AnomalySeverity;
import com.costwatch.anomaly.model.CheckResult;
import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.CostType;
import com.costwatch.anomaly.model.HistoricalCostRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.costwatch.anomaly.engine.checks.CheckSupport.format;

/**
 * Detects price-per-unit increases against the average of recent billing periods.
 *
 * Logic: baseline = mean pricePerUnit of the 6 most recent earlier records
 * (at least 3 required). Only increases trigger: deviation% > pricePerUnitDeviationPercent.
 *
 * Example: six periods averaging 0.30 EUR/kWh, now 0.34 -> +13.3%, warning at threshold 10.
 */
@Component
@Order(3)
public class PricePerUnitSpikeCheck implements AnomalyCheck {

    public static final String ID = "price_per_unit_spike";

    static final int MAX_SAMPLES = 6;
    static final int MIN_SAMPLES = 3;

    private static final Set<CostType> APPLICABLE_COST_TYPES = Collections.unmodifiableSet(EnumSet.of(
            CostType.ELECTRICITY,
            CostType.NATURAL_GAS,
            CostType.WATER,
            CostType.FUEL_DIESEL,
            CostType.FUEL_PETROL,
            CostType.DISTRICT_HEATING));

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Price per unit spike";
    }

    @Override
    public String getDescription() {
        return "Detects unusual increases of the price per unit";
    }

    @Override
    public Set<CostType> getApplicableCostTypes() {
        return APPLICABLE_COST_TYPES;
    }

    @Override
    public int getMinHistoricalMonths() {
        return 3;
    }

    @Override
    public CheckResult check(CostRecordToCheck record, CheckContext context) {
        Double price = record.getPricePerUnit();
        Double quantity = record.getQuantity();
        if (price == null || price == 0 || quantity == null || quantity == 0) {
            return CheckResult.notTriggered();
        }

        List<Double> recentPrices = CheckSupport.sameTypeBefore(record, context)
                .filter(r -> r.getPricePerUnit() != null && r.getPricePerUnit() > 0)
                .sorted(Comparator.comparing(HistoricalCostRecord::getPeriodStart).reversed())
                .limit(MAX_SAMPLES)
                .map(HistoricalCostRecord::getPricePerUnit)
                .toList();

        if (recentPrices.size() < MIN_SAMPLES) {
            return CheckResult.notTriggered();
        }

        double avgPrice = CheckSupport.mean(recentPrices);
        if (avgPrice == 0) {
            return CheckResult.notTriggered();
        }

        double deviation = (price - avgPrice) / avgPrice * 100.0;
        double threshold = context.getSettings().getAlertThresholds().getPricePerUnitDeviationPercent();

        // Price decreases never trigger
        if (deviation <= threshold) {
            return CheckResult.notTriggered();
        }

        double priceIncrease = price - avgPrice;
        String unit = record.getUnit() != null ? record.getUnit() : "unit";
        String message = format("Price per unit +%.1f%% above %d-period average (+€%.4f/%s)",
                deviation, recentPrices.size(), priceIncrease, unit);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedValue", avgPrice);
        details.put("actualValue", price);
        details.put("deviationPercent", deviation);
        details.put("priceIncrease", priceIncrease);
        details.put("unit", record.getUnit());
        details.put("samplesUsed", recentPrices.size());
        details.put("threshold", threshold);
        details.put("method", "price_per_unit_avg");

        return CheckResult.triggered(AnomalySeverity.escalate(deviation, threshold), message, details);
    }
}
