package com.costwatch.anomaly.engine.checks;

import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.HistoricalCostRecord;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Helpers shared by the check implementations.
 */
final class CheckSupport {

    private CheckSupport() {}

    /**
     * Historical records of the record's cost type whose period starts strictly before it.
     */
    static Stream<HistoricalCostRecord> sameTypeBefore(CostRecordToCheck record, CheckContext context) {
        return context.getHistoricalRecords().stream()
                .filter(r -> r.getCostType() == record.getCostType())
                .filter(r -> r.getPeriodStart().isBefore(record.getPeriodStart()));
    }

    static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Population standard deviation (divides by n).
     */
    static double standardDeviation(List<Double> values, double mean) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += Math.pow(v - mean, 2);
        }
        return Math.sqrt(sumSquares / values.size());
    }

    static String signed(double value) {
        return value > 0 ? "+" : value < 0 ? "-" : "";
    }

    /** Formats an amount as "+€300.00" / "-€250.00". */
    static String signedEuro(double value) {
        return signed(value) + "€" + format("%.2f", Math.abs(value));
    }

    static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
