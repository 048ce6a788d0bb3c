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
import java.util.Map;
import java.util.Optional;

import static com.costwatch.anomaly.engine.checks.CheckSupport.format;
import static com.costwatch.anomaly.engine.checks.CheckSupport.signed;
import static com.costwatch.anomaly.engine.checks.CheckSupport.signedEuro;

/**
 * Compares the record with the same calendar month of the previous year.
 *
 * Logic: deviation% = (amount - lastYear) / lastYear * 100. Triggers when
 * |deviation%| > yoyDeviationPercent; critical above twice the threshold.
 *
 * Example: last year 1000, now 1300, threshold 20 -> +30.0%, warning.
 */
@Component
@Order(1)
public class YoyDeviationCheck implements AnomalyCheck {

    public static final String ID = "yoy_deviation";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Year-over-year deviation";
    }

    @Override
    public String getDescription() {
        return "Compares with the same month of the previous year";
    }

    @Override
    public int getMinHistoricalMonths() {
        return 12;
    }

    @Override
    public CheckResult check(CostRecordToCheck record, CheckContext context) {
        Optional<HistoricalCostRecord> match = context.getHistoricalRecords().stream()
                .filter(r -> r.getCostType() == record.getCostType())
                .filter(r -> r.getPeriodStart().getMonth() == record.getPeriodStart().getMonth())
                .filter(r -> r.getPeriodStart().getYear() == record.getPeriodStart().getYear() - 1)
                .findFirst();

        if (match.isEmpty()) {
            return CheckResult.notTriggered();
        }

        HistoricalCostRecord lastYear = match.get();
        if (lastYear.getAmount() == 0) {
            return CheckResult.notTriggered();
        }

        double deviation = (record.getAmount() - lastYear.getAmount()) / lastYear.getAmount() * 100.0;
        double threshold = context.getSettings().getAlertThresholds().getYoyDeviationPercent();

        if (Math.abs(deviation) <= threshold) {
            return CheckResult.notTriggered();
        }

        double deviationAbsolute = record.getAmount() - lastYear.getAmount();
        String message = format("%s%.1f%% vs. same month last year (%s)",
                signed(deviation), Math.abs(deviation), signedEuro(deviationAbsolute));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedValue", lastYear.getAmount());
        details.put("actualValue", record.getAmount());
        details.put("deviationPercent", deviation);
        details.put("deviationAbsolute", deviationAbsolute);
        details.put("comparisonPeriod", lastYear.getPeriodStart().toString());
        details.put("comparisonRecordId", lastYear.getId());
        details.put("threshold", threshold);
        details.put("method", "yoy_comparison");

        return CheckResult.triggered(AnomalySeverity.escalate(Math.abs(deviation), threshold), message, details);
    }
}
