package com.insightreport.generator.controller;

import com.insightreport.generator.dto.report.CreateReportRequest;
import com.insightreport.generator.dto.report.InputData;
import com.insightreport.generator.dto.report.PipelineStartResponse;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.report.ReportDetailResponse;
import com.insightreport.generator.dto.report.StructuredInput;
import com.insightreport.generator.dto.report.UnstructuredInput;
import com.insightreport.generator.dto.workflow.ExecutionInfo;
import com.insightreport.generator.dto.workflow.PipelineResult;
import com.insightreport.generator.dto.workflow.WorkflowState;
import com.insightreport.generator.entity.cost.CostMetrics;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.entity.report.ReportStatus;
import com.insightreport.generator.entity.report.ReportStyle;
import com.insightreport.generator.exception.ReportNotFoundException;
import com.insightreport.generator.service.cost.CostTrackerService;
import com.insightreport.generator.service.profile.UploadedInputConverter;
import com.insightreport.generator.workflow.ReportPipelineClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ReportController 단위 테스트
 */
@WebFluxTest(ReportController.class)
@Import(UploadedInputConverter.class)
@ActiveProfiles("test")
class ReportControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ReportPipelineClient pipelineClient;

    @MockBean
    private CostTrackerService costTrackerService;

    @Test
    @DisplayName("POST /api/v1/reports - 생성 요청은 202 와 식별자를 반환한다")
    void createReport() {
        when(pipelineClient.start(any(CreateReportRequest.class)))
                .thenReturn(new PipelineStartResponse("abc123", "report-abc123"));

        webTestClient.post()
                .uri("/api/v1/reports")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {
                          "data": [{"type": "unstructured", "content": "Revenue rose 12% in Q1."}],
                          "config": {"title": "Q1 Review", "style": "business", "outputFormats": ["pdf", "html"]}
                        }
                        """)
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.reportId").isEqualTo("abc123")
                .jsonPath("$.instanceId").isEqualTo("report-abc123");
    }

    @Test
    @DisplayName("POST /api/v1/reports - 설정이 없으면 400")
    void createReportWithoutConfig() {
        webTestClient.post()
                .uri("/api/v1/reports")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"data\": [{\"type\": \"unstructured\", \"content\": \"text\"}]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("config"));

        verify(pipelineClient, never()).start(any(CreateReportRequest.class));
    }

    @Test
    @DisplayName("GET /api/v1/reports/{id} - 없는 보고서는 404")
    void reportNotFound() {
        when(pipelineClient.getReportDetail("missing")).thenThrow(ReportNotFoundException.report("missing"));

        webTestClient.get()
                .uri("/api/v1/reports/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("REPORT_NOT_FOUND")
                .jsonPath("$.reportId").isEqualTo("missing");
    }

    @Test
    @DisplayName("GET /api/v1/reports/{id} - 보고서 필드에 실행 중인 인스턴스 상태를 합쳐 반환한다")
    void getReport() {
        when(pipelineClient.getReportDetail("abc123")).thenReturn(ReportDetailResponse.builder()
                .report(Report.builder()
                        .id("abc123")
                        .title("Q1 Review")
                        .status(ReportStatus.EXPORTING)
                        .progress(90)
                        .build())
                .workflow(WorkflowState.of(ReportStatus.EXPORTING, 90, "Exporting to requested formats"))
                .execution(new ExecutionInfo(ExecutionInfo.Status.RUNNING, LocalDateTime.of(2024, 3, 1, 9, 0), null))
                .build());

        webTestClient.get()
                .uri("/api/v1/reports/abc123")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("abc123")
                .jsonPath("$.status").isEqualTo("EXPORTING")
                .jsonPath("$.progress").isEqualTo(90)
                .jsonPath("$.errorMessage").doesNotExist()
                .jsonPath("$.workflow.currentStep").isEqualTo("Exporting to requested formats")
                .jsonPath("$.execution.status").isEqualTo("RUNNING")
                .jsonPath("$.execution.closeTime").doesNotExist();
    }

    @Test
    @DisplayName("GET /api/v1/reports/{id}/wait - 끝난 인스턴스의 결과를 반환한다")
    void waitForCompletion() {
        when(pipelineClient.awaitResult("report-abc123")).thenReturn(CompletableFuture.completedFuture(
                PipelineResult.failure(Report.builder().id("abc123").status(ReportStatus.FAILED).build(),
                        "LLM unavailable", "TRANSIENT_ERROR")));

        webTestClient.get()
                .uri("/api/v1/reports/abc123/wait")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.errorType").isEqualTo("TRANSIENT_ERROR")
                .jsonPath("$.report.status").isEqualTo("FAILED");
    }

    @Test
    @DisplayName("GET /api/v1/reports/{id}/wait - 없는 인스턴스는 404")
    void waitForUnknownInstance() {
        when(pipelineClient.awaitResult("report-missing")).thenThrow(ReportNotFoundException.instance("report-missing"));

        webTestClient.get()
                .uri("/api/v1/reports/missing/wait")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("REPORT_NOT_FOUND");
    }

    @Test
    @DisplayName("POST /api/v1/reports/upload - 파일 종류별로 입력을 만들어 시작한다")
    @SuppressWarnings("unchecked")
    void createFromUpload() {
        // given
        when(pipelineClient.start(anyList(), any(ReportConfig.class)))
                .thenReturn(new PipelineStartResponse("abc123", "report-abc123"));

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("files", namedResource("region,revenue\nEU,10\nUS,12\n", "sales.csv"))
                .contentType(MediaType.parseMediaType("text/csv"));
        builder.part("files", namedResource("# Notes\nChurn fell in March.", "notes.md"))
                .contentType(MediaType.parseMediaType("text/markdown"));
        builder.part("title", "Q1 Review");
        builder.part("outputFormats", "pdf, html");

        // when
        webTestClient.post()
                .uri("/api/v1/reports/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.reportId").isEqualTo("abc123")
                .jsonPath("$.status").isEqualTo("QUEUED")
                .jsonPath("$.statusUrl").isEqualTo("/api/v1/reports/abc123")
                .jsonPath("$.filesProcessed").isEqualTo(2);

        // then
        ArgumentCaptor<List<InputData>> inputs = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<ReportConfig> config = ArgumentCaptor.forClass(ReportConfig.class);
        verify(pipelineClient).start(inputs.capture(), config.capture());

        assertThat(inputs.getValue()).hasSize(2);
        assertThat(inputs.getValue().get(0)).isInstanceOfSatisfying(StructuredInput.class,
                input -> assertThat(input.getFormat()).isEqualTo(StructuredInput.Format.CSV));
        assertThat(inputs.getValue().get(1)).isInstanceOfSatisfying(UnstructuredInput.class,
                input -> assertThat(input.getFormat()).isEqualTo("markdown"));
        assertThat(config.getValue().getTitle()).isEqualTo("Q1 Review");
        assertThat(config.getValue().getStyle()).isEqualTo(ReportStyle.BUSINESS);
        assertThat(config.getValue().getOutputFormats()).containsExactly(OutputFormat.PDF, OutputFormat.HTML);
    }

    @Test
    @DisplayName("POST /api/v1/reports/upload - 알 수 없는 출력 형식은 400")
    void uploadWithUnknownFormat() {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("files", namedResource("Revenue rose.", "notes.txt"))
                .contentType(MediaType.TEXT_PLAIN);
        builder.part("title", "Q1 Review");
        builder.part("outputFormats", "xls");

        webTestClient.post()
                .uri("/api/v1/reports/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

        verify(pipelineClient, never()).start(anyList(), any(ReportConfig.class));
    }

    @Test
    @DisplayName("POST /api/v1/reports/upload - 파일이 없으면 400")
    void uploadWithoutFiles() {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("title", "Q1 Review");

        webTestClient.post()
                .uri("/api/v1/reports/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

        verify(pipelineClient, never()).start(anyList(), any(ReportConfig.class));
    }

    private static ByteArrayResource namedResource(String content, String filename) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return filename;
            }
        };
    }

    @Test
    @DisplayName("GET /api/v1/reports/{id}/files - 형식별 파일을 첨부로 내려준다")
    void downloadFile() {
        byte[] pdf = "%PDF-1.7".getBytes();
        when(pipelineClient.getReportFile("abc123", OutputFormat.PDF)).thenReturn(pdf);

        webTestClient.get()
                .uri("/api/v1/reports/abc123/files?format=pdf")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.APPLICATION_PDF)
                .expectHeader().valueEquals("Content-Disposition", "attachment; filename=\"abc123.pdf\"")
                .expectBody(byte[].class).isEqualTo(pdf);
    }

    @Test
    @DisplayName("GET /api/v1/reports/{id}/files - 알 수 없는 형식은 400")
    void unknownFormat() {
        webTestClient.get()
                .uri("/api/v1/reports/abc123/files?format=xls")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

        verify(pipelineClient, never()).getReportFile(any(), any());
    }

    @Test
    @DisplayName("GET /api/v1/reports/{id}/costs - 기록이 없으면 0 을 반환한다")
    void costsDefaultToZero() {
        when(pipelineClient.getReport("abc123")).thenReturn(Report.builder().id("abc123").build());
        when(costTrackerService.getCostMetrics(eq("abc123"))).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/reports/abc123/costs")
                .exchange()
                .expectStatus().isOk()
                .expectBody(CostMetrics.class)
                .value(metrics -> assertThat(metrics.getTotalTokens()).isZero());
    }
}
