package com.costwatch.anomaly.service;

import com.costwatch.anomaly.config.AnomalyProperties;
import com.costwatch.anomaly.engine.AnomalyEngine;
import com.costwatch.anomaly.model.AnomalySeverity;
import com.costwatch.anomaly.model.StoredAnomaly;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Decides which stored anomalies become live alerts.
 *
 * Rules, in order:
 * 1. Backfill anomalies are never alerted
 * 2. The severity must be routed (notifyOnCritical / notifyOnWarning / notifyOnInfo)
 * 3. At most maxAlertsPerDay alerts per calendar day; the count resets at midnight
 *    in the clock's zone
 */
@Component
public class AlertPolicy {

    private final AnomalyProperties properties;
    private final AnomalyEngine engine;
    private final Clock clock;

    private LocalDate currentDay;
    private int dispatchedToday;

    public AlertPolicy(AnomalyProperties properties, AnomalyEngine engine, Clock clock) {
        this.properties = properties;
        this.engine = engine;
        this.clock = clock;
    }

    public AlertDecision evaluate(StoredAnomaly anomaly) {
        if (anomaly.isBackfill()) {
            return AlertDecision.SUPPRESSED_BACKFILL;
        }
        if (!shouldNotifySeverity(anomaly.getSeverity())) {
            return AlertDecision.SUPPRESSED_SEVERITY;
        }
        return tryAcquireDailySlot() ? AlertDecision.DISPATCH : AlertDecision.SUPPRESSED_DAILY_CAP;
    }

    public boolean shouldNotifySeverity(AnomalySeverity severity) {
        if (severity == null) {
            return false;
        }
        return switch (severity) {
            case CRITICAL -> properties.isNotifyOnCritical();
            case WARNING -> properties.isNotifyOnWarning();
            case INFO -> properties.isNotifyOnInfo();
        };
    }

    public synchronized int getDispatchedToday() {
        rollDay();
        return dispatchedToday;
    }

    private synchronized boolean tryAcquireDailySlot() {
        rollDay();
        if (dispatchedToday >= engine.getSettings().getMaxAlertsPerDay()) {
            return false;
        }
        dispatchedToday++;
        return true;
    }

    private void rollDay() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(currentDay)) {
            currentDay = today;
            dispatchedToday = 0;
        }
    }
}
