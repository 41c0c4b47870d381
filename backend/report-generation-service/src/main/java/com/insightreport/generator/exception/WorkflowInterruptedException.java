package com.insightreport.generator.exception;

/**
 * 워커 종료 등으로 인스턴스 스레드가 인터럽트됨.
 * 보고서를 실패 처리하지 않으며 체크포인트에서 재개된다.
 */
public class WorkflowInterruptedException extends ReportPipelineException {

    public static final String ERROR_CODE = "WORKFLOW_INTERRUPTED";

    public WorkflowInterruptedException(String message, Throwable cause) {
        super(ERROR_CODE, message, null, cause);
    }

    @Override
    public boolean isNonRetryable() {
        return true;
    }
}
