package com.insightreport.generator.controller;

import com.insightreport.generator.dto.workflow.WorkflowState;
import com.insightreport.generator.workflow.ReportPipelineClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 파이프라인 인스턴스 상태 조회 및 취소 API
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Workflows", description = "보고서 파이프라인 인스턴스 제어 API")
public class WorkflowController {

    private final ReportPipelineClient pipelineClient;

    @GetMapping("/{instanceId}/status")
    @Operation(summary = "인스턴스 상태 조회", description = "마지막으로 기록된 상태, 진행률, 현재 단계를 반환합니다.")
    public ResponseEntity<WorkflowState> getStatus(@PathVariable String instanceId) {
        return ResponseEntity.ok(pipelineClient.getStatus(instanceId));
    }

    /**
     * 취소 요청. 진행 중인 단계가 끝난 뒤 반영된다.
     */
    @PostMapping("/{instanceId}/cancel")
    @Operation(summary = "인스턴스 취소", description = "다음 단계 경계에서 파이프라인을 취소합니다.")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String instanceId) {
        boolean cancelled = pipelineClient.cancel(instanceId);
        log.info("Cancel requested: instanceId={}, accepted={}", instanceId, cancelled);

        return ResponseEntity.ok(Map.of(
                "instanceId", instanceId,
                "cancelled", cancelled));
    }
}
