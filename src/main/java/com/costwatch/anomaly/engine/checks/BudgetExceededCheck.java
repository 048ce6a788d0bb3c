package com.costwatch.anomaly.engine.checks;

import com.costwatch.anomaly.engine.AnomalyCheck;
import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.AnomalySeverity;
import com.costwatch.anomaly.model.BudgetContext;
import com.costwatch.anomaly.model.CheckResult;
import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.HistoricalCostRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.costwatch.anomaly.engine.checks.CheckSupport.format;

/**
 * Compares the month-to-date total of the cost type (including this record)
 * with the monthly budget, or one twelfth of a yearly budget.
 *
 * Two mutually exclusive outcomes:
 * - over budget by more than budgetExceededPercent: warning, critical above twice the threshold;
 * - otherwise, 90-100% of the budget used: info.
 */
@Component
@Order(8)
public class BudgetExceededCheck implements AnomalyCheck {

    public static final String ID = "budget_exceeded";

    static final double APPROACHING_LOWER_PERCENT = 90.0;
    static final double APPROACHING_UPPER_PERCENT = 100.0;

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Budget exceeded";
    }

    @Override
    public String getDescription() {
        return "Detects budget overruns";
    }

    @Override
    public CheckResult check(CostRecordToCheck record, CheckContext context) {
        BudgetContext budget = context.getBudget();
        if (budget == null) {
            return CheckResult.notTriggered();
        }
        if (budget.getCostType() != null && budget.getCostType() != record.getCostType()) {
            return CheckResult.notTriggered();
        }

        double budgetAmount = budget.isMonthly() ? budget.getAmount() : budget.getAmount() / 12.0;
        String budgetPeriod = budget.isMonthly() ? "monthly" : "yearly (per month)";
        if (budgetAmount <= 0) {
            return CheckResult.notTriggered();
        }

        int month = record.getPeriodStart().getMonthValue();
        int year = record.getPeriodStart().getYear();

        // The record itself is added once, even if the caller left it in the history
        double monthlyTotal = context.getHistoricalRecords().stream()
                .filter(r -> !record.getId().equals(r.getId()))
                .filter(r -> r.getCostType() == record.getCostType())
                .filter(r -> r.getPeriodStart().getMonthValue() == month && r.getPeriodStart().getYear() == year)
                .mapToDouble(HistoricalCostRecord::getAmount)
                .sum() + record.getAmount();

        double threshold = context.getSettings().getAlertThresholds().getBudgetExceededPercent();
        double overBudget = monthlyTotal - budgetAmount;
        double overBudgetPercent = overBudget / budgetAmount * 100.0;

        if (overBudgetPercent > threshold) {
            Map<String, Object> details = baseDetails(budget, budgetAmount, budgetPeriod, monthlyTotal, record);
            details.put("overBudgetAmount", overBudget);
            details.put("overBudgetPercent", overBudgetPercent);
            details.put("threshold", threshold);
            details.put("month", month);
            details.put("year", year);
            details.put("method", "budget_comparison");

            return CheckResult.triggered(
                    AnomalySeverity.escalate(overBudgetPercent, threshold),
                    format("Budget exceeded by €%.2f (+%.1f%%)", overBudget, overBudgetPercent),
                    details);
        }

        double budgetUsagePercent = monthlyTotal / budgetAmount * 100.0;
        if (budgetUsagePercent >= APPROACHING_LOWER_PERCENT && budgetUsagePercent <= APPROACHING_UPPER_PERCENT) {
            Map<String, Object> details = baseDetails(budget, budgetAmount, budgetPeriod, monthlyTotal, record);
            details.put("budgetUsagePercent", budgetUsagePercent);
            details.put("remainingBudget", budgetAmount - monthlyTotal);
            details.put("month", month);
            details.put("year", year);
            details.put("method", "budget_warning");

            return CheckResult.triggered(
                    AnomalySeverity.INFO,
                    format("%.1f%% of budget used", budgetUsagePercent),
                    details);
        }

        return CheckResult.notTriggered();
    }

    private static Map<String, Object> baseDetails(BudgetContext budget, double budgetAmount, String budgetPeriod,
                                                   double monthlyTotal, CostRecordToCheck record) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("budgetAmount", budgetAmount);
        details.put("budgetPeriod", budgetPeriod);
        details.put("budgetId", budget.getId());
        details.put("actualAmount", monthlyTotal);
        details.put("currentRecordAmount", record.getAmount());
        return details;
    }
}
