package com.costwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DetectionOptions {

    private static final DetectionOptions DEFAULTS = DetectionOptions.builder().build();

    /** Historical import: anomalies are stored but not alerted. */
    boolean backfill;

    /** Restricts the run to these check ids. Null or empty runs every enabled check. */
    List<String> checkIds;

    public static DetectionOptions defaults() {
        return DEFAULTS;
    }
}
