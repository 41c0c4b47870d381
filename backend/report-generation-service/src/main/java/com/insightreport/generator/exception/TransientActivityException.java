package com.insightreport.generator.exception;

/**
 * 일시적 오류 (네트워크, rate limit, I/O). 재시도 정책에 따라 재시도된다.
 */
public class TransientActivityException extends ReportPipelineException {

    public static final String ERROR_CODE = "TRANSIENT_ERROR";

    public TransientActivityException(String message) {
        super(ERROR_CODE, message);
    }

    public TransientActivityException(String message, Throwable cause) {
        super(ERROR_CODE, message, null, cause);
    }

    protected TransientActivityException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, null, cause);
    }
}
