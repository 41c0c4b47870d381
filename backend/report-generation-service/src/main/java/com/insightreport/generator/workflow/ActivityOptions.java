package com.insightreport.generator.workflow;

import com.insightreport.generator.config.PipelineProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Timeouts and retry policy applied to one activity invocation.
 */
@Value
@Builder(toBuilder = true)
public class ActivityOptions {

    Duration startToCloseTimeout;

    /**
     * null for activities that do not heartbeat
     */
    Duration heartbeatTimeout;

    Duration initialInterval;

    double backoffCoefficient;

    Duration maximumInterval;

    int maximumAttempts;

    public static ActivityOptions from(PipelineProperties properties) {
        PipelineProperties.Retry retry = properties.getRetry();
        return ActivityOptions.builder()
                .startToCloseTimeout(properties.getStartToCloseTimeout())
                .initialInterval(retry.getInitialInterval())
                .backoffCoefficient(retry.getBackoffCoefficient())
                .maximumInterval(retry.getMaximumInterval())
                .maximumAttempts(retry.getMaximumAttempts())
                .build();
    }

    public ActivityOptions withHeartbeatTimeout(Duration timeout) {
        return toBuilder().heartbeatTimeout(timeout).build();
    }

    /**
     * Delay before the attempt following {@code failedAttempt} (1-based):
     * {@code initial * coefficient^(failedAttempt-1)}, capped at the maximum interval.
     */
    public long backoffMillis(int failedAttempt) {
        double delay = initialInterval.toMillis() * Math.pow(backoffCoefficient, failedAttempt - 1);
        return (long) Math.min(delay, maximumInterval.toMillis());
    }
}
