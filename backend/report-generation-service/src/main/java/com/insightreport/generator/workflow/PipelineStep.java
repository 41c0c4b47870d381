package com.insightreport.generator.workflow;

import com.insightreport.generator.entity.report.ReportStatus;

/**
 * Pipeline steps in execution order, each with the status and progress it publishes.
 */
public enum PipelineStep {
    PROFILE_DATA("profileData", ReportStatus.DATA_PROFILING, 10, "Analyzing and profiling input data"),
    GENERATE_INSIGHTS("generateInsights", ReportStatus.INSIGHT_GENERATION, 30, "Generating insights with AI"),
    GENERATE_CHARTS("generateCharts", ReportStatus.CHART_GENERATION, 50, "Creating visualizations"),
    RENDER_LAYOUT("renderLayout", ReportStatus.LAYOUT_RENDERING, 70, "Rendering report layout"),
    EXPORT_FORMATS("exportFormats", ReportStatus.EXPORTING, 90, "Exporting to requested formats"),
    FINALIZE("finalizeReport", ReportStatus.COMPLETED, 100, "Report complete");

    private final String activityName;
    private final ReportStatus status;
    private final int progress;
    private final String description;

    PipelineStep(String activityName, ReportStatus status, int progress, String description) {
        this.activityName = activityName;
        this.status = status;
        this.progress = progress;
        this.description = description;
    }

    public String getActivityName() {
        return activityName;
    }

    public ReportStatus getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true when this step was completed at or after {@code lastCompleted}
     */
    public boolean isCompletedBy(PipelineStep lastCompleted) {
        return lastCompleted != null && lastCompleted.ordinal() >= ordinal();
    }
}
