package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Outcome of a single anomaly check")
public class CheckResult {

    private static final CheckResult NOT_TRIGGERED = CheckResult.builder().triggered(false).build();

    @Schema(description = "Whether the check flagged the record", example = "true")
    boolean triggered;

    @Schema(description = "Severity, present when triggered", example = "warning")
    AnomalySeverity severity;

    @Schema(description = "Human-readable explanation", example = "+30.0% vs. same month last year (+€300.00)")
    String message;

    @Schema(description = "Diagnostic fields: expected/actual values, deviation, method, samples used")
    Map<String, Object> details;

    public static CheckResult notTriggered() {
        return NOT_TRIGGERED;
    }

    public static CheckResult triggered(AnomalySeverity severity, String message, Map<String, Object> details) {
        return CheckResult.builder()
                .triggered(true)
                .severity(severity)
                .message(message)
                .details(Collections.unmodifiableMap(new LinkedHashMap<>(details)))
                .build();
    }

    /**
     * A result becomes an anomaly only when it carries both a severity and a message.
     */
    @JsonIgnore
    public boolean isReportable() {
        return triggered && severity != null && message != null;
    }
}
