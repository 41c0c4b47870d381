package com.insightreport.generator.exception;

/**
 * 잘못된 입력/설정 예외 (재시도하지 않음)
 */
public class ReportValidationException extends ReportPipelineException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    public ReportValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public ReportValidationException(String message, Throwable cause) {
        super(ERROR_CODE, message, null, cause);
    }

    @Override
    public boolean isNonRetryable() {
        return true;
    }

    /**
     * 구조화 데이터 파싱 실패
     */
    public static ReportValidationException malformedInput(String format, Throwable cause) {
        return new ReportValidationException(
                "Malformed " + format + " input: " + cause.getMessage(), cause);
    }
}
