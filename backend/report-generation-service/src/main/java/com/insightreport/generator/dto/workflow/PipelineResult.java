package com.insightreport.generator.dto.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.insightreport.generator.entity.report.Report;

/**
 * Outcome of a finished pipeline instance. Failures are reported here, never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResult(Report report, boolean success, String error, String errorType) {

    public static PipelineResult success(Report report) {
        return new PipelineResult(report, true, null, null);
    }

    public static PipelineResult failure(Report report, String error, String errorType) {
        return new PipelineResult(report, false, error, errorType);
    }
}
