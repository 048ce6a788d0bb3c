package com.costwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Trace entry for one check within a detection run")
public class CheckExecution {

    @Schema(example = "mom_deviation")
    String checkId;

    @Schema(example = "Month-over-month deviation")
    String checkName;

    CheckResult result;

    @Schema(description = "True if the check was not run or failed")
    boolean skipped;

    @Schema(example = "Insufficient historical data (0 months, need 1)")
    String skipReason;

    public static CheckExecution ran(String checkId, String checkName, CheckResult result) {
        return CheckExecution.builder()
                .checkId(checkId)
                .checkName(checkName)
                .result(result)
                .skipped(false)
                .build();
    }

    public static CheckExecution skipped(String checkId, String checkName, String reason) {
        return CheckExecution.builder()
                .checkId(checkId)
                .checkName(checkName)
                .result(CheckResult.notTriggered())
                .skipped(true)
                .skipReason(reason)
                .build();
    }
}
