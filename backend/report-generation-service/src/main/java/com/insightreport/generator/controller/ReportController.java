package com.insightreport.generator.controller;

import com.insightreport.generator.dto.report.BatchReportRequest;
import com.insightreport.generator.dto.report.CreateReportRequest;
import com.insightreport.generator.dto.report.InputData;
import com.insightreport.generator.dto.report.PipelineStartResponse;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.report.ReportDetailResponse;
import com.insightreport.generator.dto.report.UploadReportResponse;
import com.insightreport.generator.dto.workflow.PipelineResult;
import com.insightreport.generator.entity.cost.AggregatedCosts;
import com.insightreport.generator.entity.cost.CostMetrics;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.entity.report.ReportStatus;
import com.insightreport.generator.exception.ReportValidationException;
import com.insightreport.generator.service.cost.CostTrackerService;
import com.insightreport.generator.service.profile.UploadedInputConverter;
import com.insightreport.generator.workflow.ReportPipelineClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 보고서 생성/조회/다운로드 REST API 컨트롤러
 */
@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reports", description = "보고서 생성 및 다운로드 API")
public class ReportController {

    private final ReportPipelineClient pipelineClient;
    private final CostTrackerService costTrackerService;
    private final UploadedInputConverter uploadedInputConverter;

    /**
     * 보고서 생성 요청 (비동기)
     *
     * @param request 입력 데이터와 보고서 설정
     * @return reportId, instanceId
     */
    @PostMapping
    @Operation(summary = "보고서 생성 요청", description = "파이프라인 인스턴스를 시작하고 즉시 식별자를 반환합니다.")
    public ResponseEntity<PipelineStartResponse> createReport(@Valid @RequestBody CreateReportRequest request) {
        log.info("Report generation requested: title={}, blocks={}",
                request.getConfig().getTitle(), request.getData().size());

        return ResponseEntity.accepted().body(pipelineClient.start(request));
    }

    /**
     * 파일 업로드로 보고서 생성 요청 (비동기)
     *
     * JSON/CSV/XLSX 파일은 구조화 입력, 그 외 텍스트/마크다운 파일은 비구조화 입력이 된다.
     *
     * @param outputFormats JSON 배열 또는 쉼표 구분 목록, 기본 PDF
     * @param branding Branding JSON
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "파일 업로드로 보고서 생성", description = "업로드한 파일을 입력으로 파이프라인 인스턴스를 시작합니다.")
    public Mono<ResponseEntity<UploadReportResponse>> createFromUpload(
            @RequestPart("files") Flux<FilePart> files,
            @RequestPart(value = "title", required = false) String title,
            @RequestPart(value = "style", required = false) String style,
            @RequestPart(value = "outputFormats", required = false) String outputFormats,
            @RequestPart(value = "branding", required = false) String branding
    ) {
        return files.concatMap(this::readUpload)
                .collectList()
                .map(inputData -> {
                    if (inputData.isEmpty()) {
                        throw new ReportValidationException("No files uploaded");
                    }
                    ReportConfig config = uploadedInputConverter.toConfig(title, style, outputFormats, branding);
                    PipelineStartResponse started = pipelineClient.start(inputData, config);

                    log.info("Report generation started from upload: reportId={}, files={}",
                            started.getReportId(), inputData.size());
                    return ResponseEntity.accepted().body(UploadReportResponse.builder()
                            .reportId(started.getReportId())
                            .instanceId(started.getInstanceId())
                            .status(ReportStatus.QUEUED)
                            .statusUrl("/api/v1/reports/" + started.getReportId())
                            .filesProcessed(inputData.size())
                            .build());
                });
    }

    @PostMapping("/batch")
    @Operation(summary = "보고서 일괄 생성 요청", description = "최대 50건의 보고서 생성을 한 번에 시작합니다.")
    public ResponseEntity<List<PipelineStartResponse>> createBatch(@Valid @RequestBody BatchReportRequest request) {
        log.info("Batch report generation requested: count={}", request.getRequests().size());

        return ResponseEntity.accepted().body(pipelineClient.startBatch(request));
    }

    @GetMapping
    @Operation(summary = "보고서 목록", description = "최근 생성 순으로 보고서를 조회합니다.")
    public ResponseEntity<List<Report>> listReports() {
        return ResponseEntity.ok(pipelineClient.listReports());
    }

    @GetMapping("/costs/summary")
    @Operation(summary = "전체 비용 요약", description = "모든 보고서의 토큰 사용량과 추정 비용을 집계합니다.")
    public ResponseEntity<AggregatedCosts> getCostSummary() {
        return ResponseEntity.ok(costTrackerService.getAggregatedCosts());
    }

    /**
     * 보고서 상태 조회
     *
     * @param reportId 보고서 ID
     */
    @GetMapping("/{reportId}")
    @Operation(summary = "보고서 조회", description = "보고서의 상태, 진행률, 생성된 파일 목록과 실행 중인 인스턴스의 상태를 조회합니다.")
    public ResponseEntity<ReportDetailResponse> getReport(@PathVariable String reportId) {
        return ResponseEntity.ok(pipelineClient.getReportDetail(reportId));
    }

    /**
     * 보고서 생성 완료까지 대기
     *
     * @return 파이프라인 결과 (실패/취소도 200 으로 결과에 담긴다)
     */
    @GetMapping("/{reportId}/wait")
    @Operation(summary = "보고서 완료 대기", description = "인스턴스가 끝날 때까지 기다린 뒤 결과를 반환합니다.")
    public Mono<ResponseEntity<PipelineResult>> waitForCompletion(@PathVariable String reportId) {
        // 연결이 끊겨도 인스턴스의 결과 future 는 취소되지 않도록 복사본을 구독한다
        return Mono.defer(() -> Mono.fromFuture(
                        pipelineClient.awaitResult(ReportPipelineClient.instanceIdOf(reportId)).copy()))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{reportId}/costs")
    @Operation(summary = "보고서 비용 조회")
    public ResponseEntity<CostMetrics> getReportCosts(@PathVariable String reportId) {
        pipelineClient.getReport(reportId);
        return ResponseEntity.ok(costTrackerService.getCostMetrics(reportId)
                .orElseGet(() -> CostMetrics.zero(reportId)));
    }

    /**
     * 생성된 보고서 파일 다운로드
     *
     * @param reportId 보고서 ID
     * @param format pdf, docx, html
     */
    @GetMapping("/{reportId}/files")
    @Operation(summary = "보고서 파일 다운로드", description = "요청한 형식의 보고서 파일을 내려받습니다.")
    public ResponseEntity<byte[]> downloadFile(@PathVariable String reportId,
                                               @RequestParam(defaultValue = "pdf") String format) {
        OutputFormat outputFormat = parseFormat(format);
        byte[] bytes = pipelineClient.getReportFile(reportId, outputFormat);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(outputFormat.getContentType()));
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(outputFormat.fileName(reportId))
                .build());
        headers.setContentLength(bytes.length);

        log.info("Report file downloaded: reportId={}, format={}, size={}", reportId, outputFormat, bytes.length);
        return ResponseEntity.ok()
                .headers(headers)
                .body(bytes);
    }

    private Mono<InputData> readUpload(FilePart file) {
        return DataBufferUtils.join(file.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return uploadedInputConverter.toInputData(file.filename(), file.headers().getContentType(), bytes);
                });
    }

    private static OutputFormat parseFormat(String format) {
        try {
            return OutputFormat.fromValue(format);
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException(e.getMessage(), e);
        }
    }
}
