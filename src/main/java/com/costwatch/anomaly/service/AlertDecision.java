package com.costwatch.anomaly.service;

public enum AlertDecision {
    DISPATCH("dispatch"),
    SUPPRESSED_BACKFILL("backfill"),
    SUPPRESSED_SEVERITY("severity"),
    SUPPRESSED_DAILY_CAP("daily_cap");

    private final String reason;

    AlertDecision(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public boolean isDispatch() {
        return this == DISPATCH;
    }
}
