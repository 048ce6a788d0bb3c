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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.costwatch.anomaly.engine.checks.CheckSupport.format;

/**
 * Compares the amount with a seasonally adjusted expectation:
 * overall historical average times a fixed multiplier for the billing month.
 *
 * Triggers when the amount is more than 50% above or below that expectation.
 * Always informational.
 */
@Component
@Order(7)
public class SeasonalAnomalyCheck implements AnomalyCheck {

    public static final String ID = "seasonal_anomaly";

    static final int MIN_SAMPLES = 12;
    static final double SEASONAL_THRESHOLD = 0.5;

    // Relative consumption by month, January first. 1.0 = yearly average.
    private static final double[] HEATING_PATTERN =
            {1.4, 1.3, 1.1, 0.8, 0.6, 0.5, 0.5, 0.5, 0.6, 0.9, 1.2, 1.4};
    private static final double[] ELECTRICITY_PATTERN =
            {1.1, 1.1, 1.0, 0.9, 0.9, 1.0, 1.1, 1.1, 1.0, 0.95, 1.0, 1.1};
    private static final double[] WATER_PATTERN =
            {0.9, 0.9, 1.0, 1.0, 1.1, 1.2, 1.2, 1.2, 1.1, 1.0, 0.9, 0.9};

    private static final Map<CostType, double[]> SEASONAL_PATTERNS = new EnumMap<>(CostType.class);

    static {
        SEASONAL_PATTERNS.put(CostType.NATURAL_GAS, HEATING_PATTERN);
        SEASONAL_PATTERNS.put(CostType.DISTRICT_HEATING, HEATING_PATTERN);
        SEASONAL_PATTERNS.put(CostType.ELECTRICITY, ELECTRICITY_PATTERN);
        SEASONAL_PATTERNS.put(CostType.WATER, WATER_PATTERN);
    }

    private static final Set<CostType> SEASONAL_COST_TYPES =
            Collections.unmodifiableSet(SEASONAL_PATTERNS.keySet());

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Seasonal anomaly";
    }

    @Override
    public String getDescription() {
        return "Detects unusual deviations from seasonal patterns";
    }

    @Override
    public Set<CostType> getApplicableCostTypes() {
        return SEASONAL_COST_TYPES;
    }

    @Override
    public int getMinHistoricalMonths() {
        return 12;
    }

    @Override
    public CheckResult check(CostRecordToCheck record, CheckContext context) {
        double[] pattern = SEASONAL_PATTERNS.get(record.getCostType());
        if (pattern == null) {
            return CheckResult.notTriggered();
        }

        List<Double> amounts = CheckSupport.sameTypeBefore(record, context)
                .map(HistoricalCostRecord::getAmount)
                .toList();
        if (amounts.size() < MIN_SAMPLES) {
            return CheckResult.notTriggered();
        }

        double overallAverage = CheckSupport.mean(amounts);
        if (overallAverage == 0) {
            return CheckResult.notTriggered();
        }

        int month = record.getPeriodStart().getMonthValue();
        double seasonalMultiplier = pattern[month - 1];
        double expectedAmount = overallAverage * seasonalMultiplier;
        double deviation = (record.getAmount() - expectedAmount) / expectedAmount;

        if (Math.abs(deviation) <= SEASONAL_THRESHOLD) {
            return CheckResult.notTriggered();
        }

        String season = seasonName(month);
        String message = deviation > 0
                ? format("Unusually high costs for %s (+%.1f%% above seasonal expectation)", season, deviation * 100)
                : format("Unusually low costs for %s (%.1f%% below seasonal expectation)", season, Math.abs(deviation) * 100);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedValue", expectedAmount);
        details.put("actualValue", record.getAmount());
        details.put("overallAverage", overallAverage);
        details.put("seasonalMultiplier", seasonalMultiplier);
        details.put("deviationPercent", deviation * 100);
        details.put("month", month);
        details.put("season", season);
        details.put("samplesUsed", amounts.size());
        details.put("method", "seasonal_pattern");

        return CheckResult.triggered(AnomalySeverity.INFO, message, details);
    }

    static String seasonName(int month) {
        if (month >= 3 && month <= 5) return "spring";
        if (month >= 6 && month <= 8) return "summer";
        if (month >= 9 && month <= 11) return "autumn";
        return "winter";
    }
}
