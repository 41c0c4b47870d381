package com.insightreport.generator.exception;

/**
 * 단계 경계에서 감지된 협조적 취소
 */
public class PipelineCancelledException extends ReportPipelineException {

    public static final String ERROR_CODE = "CANCELLED_ERROR";

    public PipelineCancelledException(String reportId) {
        super(ERROR_CODE, "Workflow cancelled by user", reportId);
    }

    @Override
    public boolean isNonRetryable() {
        return true;
    }
}
