package com.insightreport.generator.dto.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.insightreport.generator.dto.workflow.ExecutionInfo;
import com.insightreport.generator.dto.workflow.WorkflowState;
import com.insightreport.generator.entity.report.Report;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 보고서 조회 응답
 *
 * 저장된 보고서 필드에 인스턴스의 실시간 상태(workflow)와 실행 정보(execution)를 덧붙인다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportDetailResponse {

    @JsonUnwrapped
    private Report report;

    private WorkflowState workflow;

    private ExecutionInfo execution;
}
