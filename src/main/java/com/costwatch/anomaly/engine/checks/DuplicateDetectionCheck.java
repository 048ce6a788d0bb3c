package com.costwatch.anomaly.engine.checks;

import com.costwatch.anomaly.engine.AnomalyCheck;
import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.AnomalySeverity;
import com.costwatch.anomaly.model.CheckResult;
import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.HistoricalCostRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.costwatch.anomaly.engine.checks.CheckSupport.format;

/**
 * Flags possible duplicate invoices: same supplier, period start within 45 days,
 * and an amount that is equal or differs by less than 1% of the larger amount.
 *
 * Severity is critical when a candidate carries the same invoice number.
 */
@Component
@Order(5)
public class DuplicateDetectionCheck implements AnomalyCheck {

    public static final String ID = "duplicate_detection";

    static final long WINDOW_DAYS = 45;
    static final double AMOUNT_TOLERANCE = 0.01;

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Duplicate detection";
    }

    @Override
    public String getDescription() {
        return "Detects possible duplicate invoices";
    }

    @Override
    public CheckResult check(CostRecordToCheck record, CheckContext context) {
        List<HistoricalCostRecord> candidates = context.getHistoricalRecords().stream()
                .filter(r -> !record.getId().equals(r.getId()))
                .filter(r -> r.getSupplierId() != null && r.getSupplierId().equals(record.getSupplierId()))
                .filter(r -> amountsMatch(r.getAmount(), record.getAmount()))
                .filter(r -> daysApart(r, record) <= WINDOW_DAYS)
                .toList();

        if (candidates.isEmpty()) {
            return CheckResult.notTriggered();
        }

        boolean sameInvoiceNumber = candidates.stream()
                .anyMatch(d -> hasText(d.getInvoiceNumber())
                        && hasText(record.getInvoiceNumber())
                        && d.getInvoiceNumber().equals(record.getInvoiceNumber()));

        List<Map<String, Object>> duplicateCandidates = new ArrayList<>();
        for (HistoricalCostRecord d : candidates) {
            Map<String, Object> candidate = new LinkedHashMap<>();
            candidate.put("id", d.getId());
            candidate.put("invoiceNumber", d.getInvoiceNumber());
            candidate.put("periodStart", d.getPeriodStart().toString());
            candidate.put("amount", d.getAmount());
            candidate.put("daysDifference", daysApart(d, record));
            duplicateCandidates.add(candidate);
        }

        String message = sameInvoiceNumber
                ? "Invoice with the same invoice number already exists"
                : format("%d possible duplicate(s) found", candidates.size());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("duplicateCandidates", List.copyOf(duplicateCandidates));
        details.put("sameInvoiceNumber", sameInvoiceNumber);
        details.put("method", "exact_match");

        return CheckResult.triggered(
                sameInvoiceNumber ? AnomalySeverity.CRITICAL : AnomalySeverity.WARNING, message, details);
    }

    /**
     * Symmetric: the difference is measured against the larger of the two amounts,
     * and a difference of exactly 1% does not match.
     */
    static boolean amountsMatch(double a, double b) {
        double diff = Math.abs(a - b);
        if (diff == 0) {
            return true;
        }
        double larger = Math.max(Math.abs(a), Math.abs(b));
        return diff / larger < AMOUNT_TOLERANCE;
    }

    private static long daysApart(HistoricalCostRecord candidate, CostRecordToCheck record) {
        return Math.abs(ChronoUnit.DAYS.between(candidate.getPeriodStart(), record.getPeriodStart()));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
