package com.costwatch.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetection(boolean backfill, int anomalyCount) {
        Counter.builder("anomaly.detection.count")
                .tag("backfill", String.valueOf(backfill))
                .register(registry)
                .increment();

        Counter.builder("anomaly.detected.count")
                .tag("backfill", String.valueOf(backfill))
                .register(registry)
                .increment(anomalyCount);
    }

    public void recordCheckTriggered(String checkId, String severity) {
        Counter.builder("anomaly.check.triggered.count")
                .tag("check", checkId)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordCheckSkipped(String checkId, String reason) {
        Counter.builder("anomaly.check.skipped.count")
                .tag("check", checkId)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAlertDispatched(String severity) {
        Counter.builder("anomaly.alert.dispatched.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAlertSuppressed(String reason) {
        Counter.builder("anomaly.alert.suppressed.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
