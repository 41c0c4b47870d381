package com.insightreport.generator.entity.report;

/**
 * Lifecycle status of a report.
 * Declaration order is the order a successful pipeline walks through.
 */
public enum ReportStatus {
    QUEUED,
    DATA_PROFILING,
    INSIGHT_GENERATION,
    CHART_GENERATION,
    LAYOUT_RENDERING,
    EXPORTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
