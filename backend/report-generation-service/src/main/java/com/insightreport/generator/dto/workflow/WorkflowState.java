package com.insightreport.generator.dto.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.insightreport.generator.entity.report.ReportStatus;

/**
 * Live view of a pipeline instance: last assigned status, progress and step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowState(ReportStatus status, int progress, String currentStep, String error) {

    public static WorkflowState initial() {
        return new WorkflowState(ReportStatus.QUEUED, 0, "Initializing", null);
    }

    public static WorkflowState of(ReportStatus status, int progress, String currentStep) {
        return new WorkflowState(status, progress, currentStep, null);
    }

    public WorkflowState failed(String errorMessage) {
        return new WorkflowState(ReportStatus.FAILED, progress, "Failed", errorMessage);
    }
}
