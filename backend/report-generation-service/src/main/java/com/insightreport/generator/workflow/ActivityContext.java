package com.insightreport.generator.workflow;

import com.insightreport.generator.dto.workflow.Heartbeat;
import lombok.extern.slf4j.Slf4j;

/**
 * Handle given to a running activity attempt for reporting liveness.
 */
@Slf4j
public class ActivityContext {

    private final String activityName;
    private final int attempt;

    private volatile long lastHeartbeatNanos;
    private volatile Heartbeat lastHeartbeat;

    public ActivityContext(String activityName, int attempt) {
        this.activityName = activityName;
        this.attempt = attempt;
        this.lastHeartbeatNanos = System.nanoTime();
    }

    public void heartbeat(Heartbeat details) {
        this.lastHeartbeat = details;
        this.lastHeartbeatNanos = System.nanoTime();
        log.debug("Heartbeat: activity={}, step={}, completed={}/{}",
                activityName, details.stepName(), details.completedCount(), details.totalCount());
    }

    public String getActivityName() {
        return activityName;
    }

    public int getAttempt() {
        return attempt;
    }

    public Heartbeat getLastHeartbeat() {
        return lastHeartbeat;
    }

    long nanosSinceLastHeartbeat() {
        return System.nanoTime() - lastHeartbeatNanos;
    }
}
