package com.costwatch.anomaly.engine.checks;

import com.costwatch.anomaly.engine.AnomalyCheck;
import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.AnomalySeverity;
import com.costwatch.anomaly.model.CheckResult;
import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.HistoricalCostRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.costwatch.anomaly.engine.checks.CheckSupport.format;
import static com.costwatch.anomaly.engine.checks.CheckSupport.signed;
import static com.costwatch.anomaly.engine.checks.CheckSupport.signedEuro;

/**
 * Compares the record with the most recent earlier record of the same cost type.
 * Triggers when |deviation%| > momDeviationPercent; critical above twice the threshold.
 */
@Component
@Order(2)
public class MomDeviationCheck implements AnomalyCheck {

    public static final String ID = "mom_deviation";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Month-over-month deviation";
    }

    @Override
    public String getDescription() {
        return "Compares with the previous billing period";
    }

    @Override
    public int getMinHistoricalMonths() {
        return 1;
    }

    @Override
    public CheckResult check(CostRecordToCheck record, CheckContext context) {
        Optional<HistoricalCostRecord> previous = CheckSupport.sameTypeBefore(record, context)
                .max(Comparator.comparing(HistoricalCostRecord::getPeriodStart));

        if (previous.isEmpty() || previous.get().getAmount() == 0) {
            return CheckResult.notTriggered();
        }

        HistoricalCostRecord lastMonth = previous.get();
        double deviation = (record.getAmount() - lastMonth.getAmount()) / lastMonth.getAmount() * 100.0;
        double threshold = context.getSettings().getAlertThresholds().getMomDeviationPercent();

        if (Math.abs(deviation) <= threshold) {
            return CheckResult.notTriggered();
        }

        double deviationAbsolute = record.getAmount() - lastMonth.getAmount();
        String message = format("%s%.1f%% vs. previous month (%s)",
                signed(deviation), Math.abs(deviation), signedEuro(deviationAbsolute));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedValue", lastMonth.getAmount());
        details.put("actualValue", record.getAmount());
        details.put("deviationPercent", deviation);
        details.put("deviationAbsolute", deviationAbsolute);
        details.put("comparisonPeriod", lastMonth.getPeriodStart().toString());
        details.put("comparisonRecordId", lastMonth.getId());
        details.put("threshold", threshold);
        details.put("method", "mom_comparison");

        return CheckResult.triggered(AnomalySeverity.escalate(Math.abs(deviation), threshold), message, details);
    }
}
