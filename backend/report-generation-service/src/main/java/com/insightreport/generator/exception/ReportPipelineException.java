package com.insightreport.generator.exception;

/**
 * 보고서 파이프라인 관련 예외 기본 클래스
 */
public class ReportPipelineException extends RuntimeException {

    private final String errorCode;
    private final String reportId;

    public ReportPipelineException(String message) {
        super(message);
        this.errorCode = "PIPELINE_ERROR";
        this.reportId = null;
    }

    public ReportPipelineException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "PIPELINE_ERROR";
        this.reportId = null;
    }

    public ReportPipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.reportId = null;
    }

    public ReportPipelineException(String errorCode, String message, String reportId) {
        super(message);
        this.errorCode = errorCode;
        this.reportId = reportId;
    }

    public ReportPipelineException(String errorCode, String message, String reportId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.reportId = reportId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getReportId() {
        return reportId;
    }

    /**
     * 재시도 없이 즉시 실패해야 하는 예외인지 여부
     */
    public boolean isNonRetryable() {
        return false;
    }
}
