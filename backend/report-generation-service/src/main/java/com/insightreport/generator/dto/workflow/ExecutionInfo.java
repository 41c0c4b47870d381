package com.insightreport.generator.dto.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Execution record of a pipeline instance as seen by the worker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionInfo(Status status, LocalDateTime startTime, LocalDateTime closeTime) {

    public enum Status {
        /** Checkpointed but not scheduled, e.g. waiting for recovery */
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED
    }
}
