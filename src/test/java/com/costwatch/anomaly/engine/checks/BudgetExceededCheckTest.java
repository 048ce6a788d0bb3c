package com.costwatch.anomaly.engine.checks;

import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.*;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.costwatch.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BudgetExceededCheckTest {

    private final BudgetExceededCheck check = new BudgetExceededCheck();

    private static final LocalDate MARCH_5 = LocalDate.of(2024, 3, 5);
    private static final LocalDate MARCH_20 = LocalDate.of(2024, 3, 20);

    // Earlier March invoice of 3000; the record under test adds to it
    private final List<HistoricalCostRecord> history =
            List.of(createHistorical("H-1", CostType.ELECTRICITY, 3000, MARCH_5));

    private CheckContext contextWith(BudgetContext budget) {
        return createContext(history).withBudget(budget);
    }

    @Test
    void check_twelvePercentOver_triggersWarning() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2600, MARCH_20);

        CheckResult result = check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)));

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
        assertThat((double) result.getDetails().get("overBudgetPercent")).isCloseTo(12.0, within(0.001));
        assertThat((double) result.getDetails().get("actualAmount")).isCloseTo(5600.0, within(0.001));
        assertThat(result.getDetails().get("method")).isEqualTo("budget_comparison");
        assertThat(result.getMessage()).isEqualTo("Budget exceeded by €600.00 (+12.0%)");
    }

    @Test
    void check_nineteenPercentOver_staysWarning() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2950, MARCH_20);

        CheckResult result = check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)));

        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
    }

    @Test
    void check_moreThanTwiceThresholdOver_triggersCritical() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 3100, MARCH_20);

        CheckResult result = check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)));

        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
    }

    @Test
    void check_approachingBudget_triggersInfo() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 1600, MARCH_20);

        CheckResult result = check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)));

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.INFO);
        assertThat(result.getDetails().get("method")).isEqualTo("budget_warning");
        assertThat((double) result.getDetails().get("budgetUsagePercent")).isCloseTo(92.0, within(0.001));
        assertThat((double) result.getDetails().get("remainingBudget")).isCloseTo(400.0, within(0.001));
    }

    @Test
    void check_slightlyOverButBelowThreshold_notTriggered() {
        // 106% used: not over threshold and outside the 90-100% band
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2300, MARCH_20);

        assertThat(check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)))
                .isTriggered()).isFalse();
    }

    @Test
    void check_wellUnderBudget_notTriggered() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 1000, MARCH_20);

        assertThat(check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)))
                .isTriggered()).isFalse();
    }

    @Test
    void check_yearlyBudget_usesOneTwelfth() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2600, MARCH_20);

        CheckResult result = check.check(record, contextWith(createYearlyBudget(CostType.ELECTRICITY, 2024, 60000)));

        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
        assertThat((double) result.getDetails().get("budgetAmount")).isCloseTo(5000.0, within(0.001));
        assertThat(result.getDetails().get("budgetPeriod")).isEqualTo("yearly (per month)");
    }

    @Test
    void check_recordAlreadyInHistory_countedOnce() {
        List<HistoricalCostRecord> withSelf = List.of(
                createHistorical("H-1", CostType.ELECTRICITY, 3000, MARCH_5),
                createHistorical("REC-1", CostType.ELECTRICITY, 2600, MARCH_20));
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2600, MARCH_20);
        CheckContext context = createContext(withSelf).withBudget(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000));

        CheckResult result = check.check(record, context);

        assertThat((double) result.getDetails().get("actualAmount")).isCloseTo(5600.0, within(0.001));
    }

    @Test
    void check_exactlyFullBudget_isApproachingNotExceeded() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2000, MARCH_20);

        CheckResult result = check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)));

        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.INFO);
        assertThat(result.getDetails().get("method")).isEqualTo("budget_warning");
        assertThat(result.getDetails()).doesNotContainKey("overBudgetPercent");
    }

    @Test
    void check_overByExactlyThreshold_triggersNeitherPath() {
        // 110% used: not more than 10% over, and above the approaching band
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2500, MARCH_20);

        assertThat(check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)))
                .isTriggered()).isFalse();
    }

    @Test
    void check_overBudget_reportsOnlyComparison() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2600, MARCH_20);

        CheckResult result = check.check(record, contextWith(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000)));

        assertThat(result.getDetails().get("method")).isEqualTo("budget_comparison");
        assertThat(result.getDetails()).doesNotContainKey("budgetUsagePercent");
    }

    @Test
    void check_historyEntryWithoutId_isCounted() {
        List<HistoricalCostRecord> noId = List.of(
                createHistorical("H-1", CostType.ELECTRICITY, 3000, MARCH_5).toBuilder().id(null).build());
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 2600, MARCH_20);
        CheckContext context = createContext(noId).withBudget(createMonthlyBudget(CostType.ELECTRICITY, 2024, 3, 5000));

        CheckResult result = check.check(record, context);

        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
        assertThat((double) result.getDetails().get("actualAmount")).isCloseTo(5600.0, within(0.001));
    }

    @Test
    void check_noBudget_notTriggered() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 100_000, MARCH_20);

        assertThat(check.check(record, createContext(history)).isTriggered()).isFalse();
    }

    @Test
    void check_budgetForOtherCostType_notTriggered() {
        CostRecordToCheck record = createRecord("REC-1", CostType.ELECTRICITY, 100_000, MARCH_20);

        assertThat(check.check(record, contextWith(createMonthlyBudget(CostType.WATER, 2024, 3, 5000)))
                .isTriggered()).isFalse();
    }
}
