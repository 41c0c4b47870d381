package com.insightreport.generator.dto.workflow;

/**
 * Liveness signal emitted by a long-running activity.
 */
public record Heartbeat(String stepName, int completedCount, int totalCount) {
}
