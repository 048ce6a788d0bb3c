package com.costwatch.anomaly.engine.checks;

import com.costwatch.anomaly.engine.AnomalyCheck;
import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.AnomalySeverity;
import com.costwatch.anomaly.model.CheckResult;
import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.HistoricalCostRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.costwatch.anomaly.engine.checks.CheckSupport.format;

/**
 * Z-score test of the amount against all earlier amounts of the same cost type.
 *
 * Logic: z = (amount - mean) / stddev (population). Triggers when |z| > zScoreThreshold.
 * Severity is critical when |z| > 3, independent of the configured threshold.
 *
 * Guards: at least 6 earlier amounts; a zero standard deviation never triggers.
 */
@Component
@Order(4)
public class StatisticalOutlierCheck implements AnomalyCheck {

    public static final String ID = "statistical_outlier";

    static final int MIN_SAMPLES = 6;
    static final double CRITICAL_Z_SCORE = 3.0;

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Statistical outlier";
    }

    @Override
    public String getDescription() {
        return "Detects statistically unusual amounts using the z-score";
    }

    @Override
    public int getMinHistoricalMonths() {
        return 6;
    }

    @Override
    public CheckResult check(CostRecordToCheck record, CheckContext context) {
        List<Double> amounts = CheckSupport.sameTypeBefore(record, context)
                .map(HistoricalCostRecord::getAmount)
                .toList();

        if (amounts.size() < MIN_SAMPLES) {
            return CheckResult.notTriggered();
        }

        double mean = CheckSupport.mean(amounts);
        double stdDev = CheckSupport.standardDeviation(amounts, mean);
        if (stdDev == 0) {
            return CheckResult.notTriggered();
        }

        double zScore = (record.getAmount() - mean) / stdDev;
        double threshold = context.getSettings().getAlertThresholds().getZScoreThreshold();

        if (Math.abs(zScore) <= threshold) {
            return CheckResult.notTriggered();
        }

        AnomalySeverity severity = Math.abs(zScore) > CRITICAL_Z_SCORE
                ? AnomalySeverity.CRITICAL
                : AnomalySeverity.WARNING;
        String message = format("Statistically unusual: %.1f standard deviations from the mean", zScore);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedValue", mean);
        details.put("actualValue", record.getAmount());
        details.put("zScore", zScore);
        details.put("standardDeviation", stdDev);
        details.put("deviationAbsolute", record.getAmount() - mean);
        details.put("samplesUsed", amounts.size());
        details.put("threshold", threshold);
        details.put("method", "zscore");

        return CheckResult.triggered(severity, message, details);
    }
}
