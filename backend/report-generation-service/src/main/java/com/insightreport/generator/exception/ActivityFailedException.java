package com.insightreport.generator.exception;

/**
 * Raised when an activity fails for good, either non-retryable or after the
 * last attempt. The message is the cause's message, unchanged.
 */
public class ActivityFailedException extends ReportPipelineException {

    public static final String ERROR_CODE = "ACTIVITY_FAILED";

    private final String activityName;
    private final int attempts;

    public ActivityFailedException(String activityName, int attempts, Throwable cause) {
        super(ERROR_CODE, messageOf(cause), null, cause);
        this.activityName = activityName;
        this.attempts = attempts;
    }

    public String getActivityName() {
        return activityName;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Error type of the underlying failure, e.g. {@code VALIDATION_ERROR}
     */
    public String getCauseErrorCode() {
        if (getCause() instanceof ReportPipelineException pipelineException) {
            return pipelineException.getErrorCode();
        }
        return getCause() != null ? getCause().getClass().getSimpleName() : ERROR_CODE;
    }

    private static String messageOf(Throwable cause) {
        if (cause == null || cause.getMessage() == null || cause.getMessage().isBlank()) {
            return cause != null ? cause.getClass().getSimpleName() : "Unknown error occurred";
        }
        return cause.getMessage();
    }
}
