package com.insightreport.generator.workflow;

import com.insightreport.generator.dto.report.GeneratedChart;
import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.dto.report.InputData;
import com.insightreport.generator.dto.report.ProfileResult;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.entity.report.ReportFile;
import com.insightreport.generator.entity.report.ReportStatus;

import java.util.List;

/**
 * 파이프라인 단계별 작업 단위 (activity)
 *
 * 모든 구현은 재실행해도 안전해야 한다. 파일은 이름 기준으로 덮어쓴다.
 */
public interface ReportActivities {

    ProfileResult profileData(String reportId, List<InputData> inputData);

    GeneratedNarrative generateInsights(String reportId, ProfileResult profile, ReportConfig config);

    List<GeneratedChart> generateCharts(String reportId, ProfileResult profile);

    /**
     * @return storage location of the rendered HTML layout
     */
    String renderLayout(String reportId, ReportConfig config, GeneratedNarrative narrative,
                        List<GeneratedChart> charts, DataProfile profile);

    List<ReportFile> exportFormats(ActivityContext context, String reportId, ReportConfig config,
                                   GeneratedNarrative narrative, List<GeneratedChart> charts, DataProfile profile);

    /**
     * Persists the terminal COMPLETED record with files and profile.
     */
    Report finalizeReport(String reportId, List<ReportFile> files, DataProfile profile);

    /**
     * No-op once the stored report is COMPLETED or FAILED.
     */
    void updateReportStatus(String reportId, ReportStatus status, int progress, String currentStep, String errorMessage);
}
