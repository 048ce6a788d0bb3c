package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalySeverity {
    INFO,
    WARNING,
    CRITICAL;

    /**
     * Escalation shared by the threshold checks: critical once the magnitude is
     * strictly greater than twice the threshold, warning otherwise.
     */
    public static AnomalySeverity escalate(double magnitude, double threshold) {
        return magnitude > threshold * 2 ? CRITICAL : WARNING;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnomalySeverity fromId(String id) {
        return valueOf(id.toUpperCase(Locale.ROOT));
    }
}
