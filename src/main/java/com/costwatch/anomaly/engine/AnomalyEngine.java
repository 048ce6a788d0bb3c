package com.costwatch.anomaly.engine;

import com.costwatch.anomaly.model.AnomalySettings;
import com.costwatch.anomaly.model.AnomalySettingsPatch;
import com.costwatch.anomaly.model.CheckExecution;
import com.costwatch.anomaly.model.CheckResult;
import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.DetectedAnomaly;
import com.costwatch.anomaly.model.DetectionOptions;
import com.costwatch.anomaly.model.DetectionResult;
import com.costwatch.anomaly.model.HistoricalCostRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the applicable anomaly checks against one cost record.
 *
 * Flow:
 * 1. Select checks: enabled in settings, optional id filter, applicable to the cost type
 * 2. Gate each check on the months of history available
 * 3. Run each check in isolation; a failing check is recorded as skipped
 * 4. Collect triggered results as anomalies, in registration order
 *
 * The engine performs no I/O. Settings are an immutable snapshot swapped atomically,
 * so a detection call always sees one consistent version even while settings change.
 */
public class AnomalyEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEngine.class);

    static final long DAYS_PER_MONTH = 30;

    public static final String CHECK_FAILED_PREFIX = "Check failed: ";

    private final CheckRegistry registry;
    private final AtomicReference<AnomalySettings> settings;

    public AnomalyEngine(CheckRegistry registry, AnomalySettings initialSettings) {
        this.registry = registry;
        this.settings = new AtomicReference<>(
                initialSettings != null ? initialSettings : AnomalySettings.defaults());
    }

    public DetectionResult detect(CostRecordToCheck record, CheckContext context) {
        return detect(record, context, DetectionOptions.defaults());
    }

    /**
     * Run anomaly detection on a cost record.
     *
     * @param record  the record under evaluation
     * @param context historical and reference data; its settings are replaced by the engine's
     * @param options backfill flag and optional check id filter
     * @return anomalies plus a trace entry for every selected check
     */
    public DetectionResult detect(CostRecordToCheck record, CheckContext context, DetectionOptions options) {
        DetectionOptions opts = options != null ? options : DetectionOptions.defaults();
        AnomalySettings snapshot = settings.get();
        CheckContext checkContext = context.withSettings(snapshot);

        List<AnomalyCheck> checksToRun = registry.getChecksToRun(
                record.getCostType(), snapshot.getEnabledChecks(), opts.getCheckIds());
        long historicalMonths = calculateHistoricalMonths(checkContext.getHistoricalRecords());

        List<CheckExecution> checkResults = new ArrayList<>();
        List<DetectedAnomaly> anomalies = new ArrayList<>();

        for (AnomalyCheck check : checksToRun) {
            int required = check.getMinHistoricalMonths();
            if (required > 0 && historicalMonths < required) {
                log.debug("Skipping check {} for record {}: {} months of history, need {}",
                        check.getId(), record.getId(), historicalMonths, required);
                checkResults.add(CheckExecution.skipped(check.getId(), check.getName(),
                        String.format(Locale.ROOT, "Insufficient historical data (%d months, need %d)", historicalMonths, required)));
                continue;
            }

            CheckResult result;
            try {
                result = check.check(record, checkContext);
            } catch (Exception e) {
                log.error("Error running check {} for cost record {}: {}",
                        check.getId(), record.getId(), e.getMessage(), e);
                // One failing check must not block the others
                checkResults.add(CheckExecution.skipped(check.getId(), check.getName(),
                        CHECK_FAILED_PREFIX + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())));
                continue;
            }

            if (result == null) {
                result = CheckResult.notTriggered();
            }
            checkResults.add(CheckExecution.ran(check.getId(), check.getName(), result));

            if (result.isReportable()) {
                log.debug("Check triggered: {} for record {} - severity={}, message={}",
                        check.getId(), record.getId(), result.getSeverity(), result.getMessage());
                anomalies.add(DetectedAnomaly.builder()
                        .costRecordId(record.getId())
                        .type(check.getId())
                        .severity(result.getSeverity())
                        .message(result.getMessage())
                        .details(result.getDetails() != null ? result.getDetails() : Map.of())
                        .backfill(opts.isBackfill())
                        .build());
            }
        }

        return DetectionResult.builder()
                .costRecordId(record.getId())
                .anomalies(List.copyOf(anomalies))
                .checkResults(List.copyOf(checkResults))
                .backfill(opts.isBackfill())
                .build();
    }

    /**
     * Whole 30-day months between the earliest and latest period start.
     * Sparse or irregular histories undercount.
     */
    static long calculateHistoricalMonths(List<HistoricalCostRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        LocalDate min = records.stream().map(HistoricalCostRecord::getPeriodStart)
                .min(Comparator.naturalOrder()).orElseThrow();
        LocalDate max = records.stream().map(HistoricalCostRecord::getPeriodStart)
                .max(Comparator.naturalOrder()).orElseThrow();
        return ChronoUnit.DAYS.between(min, max) / DAYS_PER_MONTH;
    }

    // ── Settings ──

    public AnomalySettings getSettings() {
        return settings.get();
    }

    public boolean isCheckEnabled(String checkId) {
        return settings.get().isCheckEnabled(checkId);
    }

    public void enableCheck(String checkId) {
        AnomalySettings updated = settings.updateAndGet(s -> s.enableCheck(checkId));
        log.info("Enabled anomaly check {} (enabled: {})", checkId, updated.getEnabledChecks());
    }

    public void disableCheck(String checkId) {
        AnomalySettings updated = settings.updateAndGet(s -> s.disableCheck(checkId));
        log.info("Disabled anomaly check {} (enabled: {})", checkId, updated.getEnabledChecks());
    }

    public AnomalySettings updateSettings(AnomalySettingsPatch patch) {
        AnomalySettings updated = settings.updateAndGet(s -> s.merge(patch));
        log.info("Anomaly settings updated: {}", updated);
        return updated;
    }

    public CheckRegistry getRegistry() {
        return registry;
    }
}
