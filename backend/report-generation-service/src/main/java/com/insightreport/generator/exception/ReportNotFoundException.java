package com.insightreport.generator.exception;

public class ReportNotFoundException extends ReportPipelineException {

    public ReportNotFoundException(String message, String reportId) {
        super("REPORT_NOT_FOUND", message, reportId);
    }

    public static ReportNotFoundException report(String reportId) {
        return new ReportNotFoundException("Report not found: " + reportId, reportId);
    }

    public static ReportNotFoundException instance(String instanceId) {
        return new ReportNotFoundException("Workflow instance not found: " + instanceId, null);
    }

    public static ReportNotFoundException file(String reportId, String filename) {
        return new ReportNotFoundException("Report file not found: " + filename, reportId);
    }
}
