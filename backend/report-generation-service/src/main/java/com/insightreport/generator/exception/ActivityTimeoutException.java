package com.insightreport.generator.exception;

import java.time.Duration;

/**
 * Start-to-close or heartbeat timeout of a single activity attempt. Counts as transient.
 */
public class ActivityTimeoutException extends TransientActivityException {

    public static final String ERROR_CODE = "ACTIVITY_TIMEOUT";

    public ActivityTimeoutException(String message) {
        super(ERROR_CODE, message, null);
    }

    public static ActivityTimeoutException startToClose(String activity, Duration timeout) {
        return new ActivityTimeoutException(
                "Activity " + activity + " exceeded start-to-close timeout of " + timeout);
    }

    public static ActivityTimeoutException heartbeat(String activity, Duration timeout) {
        return new ActivityTimeoutException(
                "Activity " + activity + " missed heartbeats for longer than " + timeout);
    }
}
