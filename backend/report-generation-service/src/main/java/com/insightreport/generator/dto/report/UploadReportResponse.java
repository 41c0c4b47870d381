package com.insightreport.generator.dto.report;

import com.insightreport.generator.entity.report.ReportStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 파일 업로드로 시작한 보고서의 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadReportResponse {

    private String reportId;

    private String instanceId;

    private ReportStatus status;

    private String statusUrl;

    private int filesProcessed;
}
