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

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.costwatch.anomaly.engine.checks.CheckSupport.format;

/**
 * Detects gaps in recurring costs. The next invoice is expected to start the day
 * after the last known period ended; a gap of more than 45 days triggers.
 *
 * Always informational. Estimated missing invoices assume monthly billing.
 */
@Component
@Order(6)
public class MissingPeriodCheck implements AnomalyCheck {

    public static final String ID = "missing_period";

    static final long GAP_THRESHOLD_DAYS = 45;
    static final long DAYS_PER_INVOICE = 30;

    private static final Set<CostType> RECURRING_COST_TYPES = Collections.unmodifiableSet(EnumSet.of(
            CostType.ELECTRICITY,
            CostType.NATURAL_GAS,
            CostType.DISTRICT_HEATING,
            CostType.WATER,
            CostType.TELECOM_MOBILE,
            CostType.TELECOM_LANDLINE,
            CostType.TELECOM_INTERNET,
            CostType.INSURANCE,
            CostType.RENT));

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Missing period";
    }

    @Override
    public String getDescription() {
        return "Detects gaps in recurring costs";
    }

    @Override
    public Set<CostType> getApplicableCostTypes() {
        return RECURRING_COST_TYPES;
    }

    @Override
    public int getMinHistoricalMonths() {
        return 2;
    }

    @Override
    public CheckResult check(CostRecordToCheck record, CheckContext context) {
        Optional<HistoricalCostRecord> last = context.getHistoricalRecords().stream()
                .filter(r -> r.getCostType() == record.getCostType())
                .filter(r -> r.getSupplierId() != null && r.getSupplierId().equals(record.getSupplierId()))
                .filter(r -> r.getPeriodEnd().isBefore(record.getPeriodStart()))
                .max(Comparator.comparing(HistoricalCostRecord::getPeriodEnd));

        if (last.isEmpty()) {
            return CheckResult.notTriggered();
        }

        HistoricalCostRecord lastRecord = last.get();
        LocalDate expectedNextStart = lastRecord.getPeriodEnd().plusDays(1);
        long gapDays = ChronoUnit.DAYS.between(expectedNextStart, record.getPeriodStart());

        if (gapDays <= GAP_THRESHOLD_DAYS) {
            return CheckResult.notTriggered();
        }

        long estimatedMissingInvoices = gapDays / DAYS_PER_INVOICE;
        String message = format("%d days gap since last invoice (%d invoice(s) possibly missing)",
                gapDays, estimatedMissingInvoices);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lastPeriodEnd", lastRecord.getPeriodEnd().toString());
        details.put("lastRecordId", lastRecord.getId());
        details.put("currentPeriodStart", record.getPeriodStart().toString());
        details.put("expectedNextStart", expectedNextStart.toString());
        details.put("gapDays", gapDays);
        details.put("estimatedMissingInvoices", estimatedMissingInvoices);
        details.put("method", "period_gap");

        return CheckResult.triggered(AnomalySeverity.INFO, message, details);
    }
}
