package com.insightreport.generator.controller;

import com.insightreport.generator.dto.workflow.WorkflowState;
import com.insightreport.generator.entity.report.ReportStatus;
import com.insightreport.generator.exception.ReportNotFoundException;
import com.insightreport.generator.workflow.ReportPipelineClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.Mockito.when;

/**
 * WorkflowController 단위 테스트
 */
@WebFluxTest(WorkflowController.class)
@ActiveProfiles("test")
class WorkflowControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ReportPipelineClient pipelineClient;

    @Test
    @DisplayName("GET /api/v1/workflows/{id}/status - 현재 상태와 진행률")
    void getStatus() {
        when(pipelineClient.getStatus("report-abc"))
                .thenReturn(WorkflowState.of(ReportStatus.CHART_GENERATION, 50, "Creating visualizations"));

        webTestClient.get()
                .uri("/api/v1/workflows/report-abc/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("CHART_GENERATION")
                .jsonPath("$.progress").isEqualTo(50)
                .jsonPath("$.currentStep").isEqualTo("Creating visualizations");
    }

    @Test
    @DisplayName("POST /api/v1/workflows/{id}/cancel - 취소 수락 여부")
    void cancel() {
        when(pipelineClient.cancel("report-abc")).thenReturn(true);

        webTestClient.post()
                .uri("/api/v1/workflows/report-abc/cancel")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.instanceId").isEqualTo("report-abc")
                .jsonPath("$.cancelled").isEqualTo(true);
    }

    @Test
    @DisplayName("없는 인스턴스는 404")
    void unknownInstance() {
        when(pipelineClient.getStatus("report-missing")).thenThrow(ReportNotFoundException.instance("report-missing"));

        webTestClient.get()
                .uri("/api/v1/workflows/report-missing/status")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("REPORT_NOT_FOUND");
    }
}
