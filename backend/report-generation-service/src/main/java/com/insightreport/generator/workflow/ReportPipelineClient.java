package com.insightreport.generator.workflow;

import com.insightreport.generator.dto.report.BatchReportRequest;
import com.insightreport.generator.dto.report.CreateReportRequest;
import com.insightreport.generator.dto.report.InputData;
import com.insightreport.generator.dto.report.PipelineStartResponse;
import com.insightreport.generator.dto.report.ReportDetailResponse;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.report.StructuredInput;
import com.insightreport.generator.dto.workflow.ExecutionInfo;
import com.insightreport.generator.dto.workflow.PipelineResult;
import com.insightreport.generator.dto.workflow.WorkflowState;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.entity.report.ReportStatus;
import com.insightreport.generator.exception.PipelineCancelledException;
import com.insightreport.generator.exception.ReportNotFoundException;
import com.insightreport.generator.exception.ReportPipelineException;
import com.insightreport.generator.exception.ReportValidationException;
import com.insightreport.generator.service.profile.InputNormalizer;
import com.insightreport.generator.service.storage.ReportStorage;
import com.insightreport.generator.util.IdGenerator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 보고서 파이프라인 클라이언트
 *
 * 시작/상태 조회/취소/결과 대기. 실행 중인 인스턴스가 없으면 체크포인트를 본다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportPipelineClient {

    public static final int MAX_BATCH_SIZE = 50;
    private static final String INSTANCE_PREFIX = "report-";

    private final ReportPipelineWorker pipelineWorker;
    private final WorkflowCheckpointStore checkpointStore;
    private final ReportStorage reportStorage;
    private final InputNormalizer inputNormalizer;
    private final Validator validator;

    public PipelineStartResponse start(List<InputData> inputData, ReportConfig config) {
        return start(CreateReportRequest.builder().data(inputData).config(config).build());
    }

    /**
     * 요청을 검증하고 QUEUED 보고서를 만든 뒤 인스턴스를 실행한다.
     *
     * @throws ReportValidationException if the request is malformed; nothing is persisted then
     */
    public PipelineStartResponse start(CreateReportRequest request) {
        validate(request);
        return launch(request);
    }

    /**
     * 전체 요청을 먼저 검증한 뒤 순서대로 시작한다
     */
    public List<PipelineStartResponse> startBatch(BatchReportRequest batch) {
        List<CreateReportRequest> requests = batch != null ? batch.getRequests() : null;
        if (requests == null || requests.isEmpty() || requests.size() > MAX_BATCH_SIZE) {
            throw new ReportValidationException(
                    "Batch must contain between 1 and " + MAX_BATCH_SIZE + " requests");
        }

        for (int i = 0; i < requests.size(); i++) {
            try {
                validate(requests.get(i));
            } catch (ReportValidationException e) {
                throw new ReportValidationException("requests[" + i + "]: " + e.getMessage(), e);
            }
        }

        List<PipelineStartResponse> responses = new ArrayList<>();
        for (CreateReportRequest request : requests) {
            responses.add(launch(request));
        }
        log.info("Batch started: count={}", responses.size());
        return responses;
    }

    public WorkflowState getStatus(String instanceId) {
        Optional<ReportGenerationWorkflow> live = pipelineWorker.getLiveInstance(instanceId);
        if (live.isPresent()) {
            return live.get().getStatus();
        }
        WorkflowCheckpoint checkpoint = checkpointStore.load(instanceId)
                .orElseThrow(() -> ReportNotFoundException.instance(instanceId));
        return checkpoint.getState() != null ? checkpoint.getState() : WorkflowState.initial();
    }

    public int getProgress(String instanceId) {
        return getStatus(instanceId).progress();
    }

    /**
     * @return false when the instance already finished
     */
    public boolean cancel(String instanceId) {
        Optional<ReportGenerationWorkflow> live = pipelineWorker.getLiveInstance(instanceId);
        if (live.isPresent()) {
            return live.get().cancel();
        }

        // 실행 중이 아니면 체크포인트에 기록해 복구 시 반영한다
        WorkflowCheckpoint checkpoint = checkpointStore.update(instanceId, cp -> {
            if (!cp.isFinished()) {
                cp.setCancelRequested(true);
            }
        }).orElseThrow(() -> ReportNotFoundException.instance(instanceId));

        if (checkpoint.isFinished()) {
            return false;
        }
        log.info("Cancellation recorded for pending instance: instanceId={}", instanceId);
        return true;
    }

    /**
     * 결과를 기다린다. 이미 끝난 인스턴스는 체크포인트의 결과를 돌려준다.
     */
    public CompletableFuture<PipelineResult> awaitResult(String instanceId) {
        Optional<ReportGenerationWorkflow> live = pipelineWorker.getLiveInstance(instanceId);
        if (live.isPresent()) {
            return live.get().result();
        }

        WorkflowCheckpoint checkpoint = checkpointStore.load(instanceId)
                .orElseThrow(() -> ReportNotFoundException.instance(instanceId));
        if (checkpoint.isFinished()) {
            return CompletableFuture.completedFuture(checkpoint.getResult());
        }
        throw new ReportPipelineException("INSTANCE_NOT_RUNNING",
                "Workflow instance is neither running nor finished: " + instanceId, checkpoint.getReportId());
    }

    public Report getReport(String reportId) {
        return reportStorage.getReport(reportId)
                .orElseThrow(() -> ReportNotFoundException.report(reportId));
    }

    /**
     * 저장된 보고서에 인스턴스의 실시간 상태와 실행 정보를 합친다.
     * 보고서와 체크포인트가 모두 없을 때만 REPORT_NOT_FOUND.
     */
    public ReportDetailResponse getReportDetail(String reportId) {
        String instanceId = instanceIdOf(reportId);
        Optional<Report> report = reportStorage.getReport(reportId);
        Optional<WorkflowCheckpoint> checkpoint = checkpointStore.load(instanceId);
        if (report.isEmpty() && checkpoint.isEmpty()) {
            throw ReportNotFoundException.report(reportId);
        }

        Optional<ReportGenerationWorkflow> live = pipelineWorker.getLiveInstance(instanceId);
        WorkflowState workflow = live.map(ReportGenerationWorkflow::getStatus)
                .orElseGet(() -> checkpoint.map(WorkflowCheckpoint::getState).orElse(null));
        ExecutionInfo execution = checkpoint.map(cp -> executionOf(cp, live.isPresent())).orElse(null);

        return ReportDetailResponse.builder()
                .report(report.orElseGet(() -> Report.builder().id(reportId).build()))
                .workflow(workflow)
                .execution(execution)
                .build();
    }

    public List<Report> listReports() {
        return reportStorage.listReports();
    }

    public byte[] getReportFile(String reportId, OutputFormat format) {
        getReport(reportId);
        String filename = format.fileName(reportId);
        return reportStorage.getOutputFile(reportId, filename)
                .orElseThrow(() -> ReportNotFoundException.file(reportId, filename));
    }

    public static String instanceIdOf(String reportId) {
        return INSTANCE_PREFIX + reportId;
    }

    private static ExecutionInfo executionOf(WorkflowCheckpoint checkpoint, boolean live) {
        ExecutionInfo.Status status;
        if (live) {
            status = ExecutionInfo.Status.RUNNING;
        } else if (!checkpoint.isFinished()) {
            status = ExecutionInfo.Status.PENDING;
        } else if (checkpoint.getResult().success()) {
            status = ExecutionInfo.Status.COMPLETED;
        } else if (PipelineCancelledException.ERROR_CODE.equals(checkpoint.getResult().errorType())) {
            status = ExecutionInfo.Status.CANCELLED;
        } else {
            status = ExecutionInfo.Status.FAILED;
        }
        LocalDateTime closeTime = !live && checkpoint.isFinished() ? checkpoint.getUpdatedAt() : null;
        return new ExecutionInfo(status, checkpoint.getCreatedAt(), closeTime);
    }

    private PipelineStartResponse launch(CreateReportRequest request) {
        String reportId = IdGenerator.reportId();
        String instanceId = instanceIdOf(reportId);
        ReportConfig config = request.getConfig().toBuilder()
                .outputFormats(new ArrayList<>(new LinkedHashSet<>(request.getConfig().getOutputFormats())))
                .build();
        LocalDateTime now = LocalDateTime.now();

        reportStorage.saveReport(reportId, Report.builder()
                .id(reportId)
                .title(config.getTitle())
                .style(config.getStyle())
                .status(ReportStatus.QUEUED)
                .outputFormats(new LinkedHashSet<>(config.getOutputFormats()))
                .progress(0)
                .currentStep(WorkflowState.initial().currentStep())
                .createdAt(now)
                .files(new ArrayList<>())
                .branding(config.getBranding())
                .authorName(config.getAuthorName())
                .build());

        WorkflowCheckpoint checkpoint = WorkflowCheckpoint.builder()
                .instanceId(instanceId)
                .reportId(reportId)
                .inputData(request.getData())
                .config(config)
                .state(WorkflowState.initial())
                .createdAt(now)
                .build();
        checkpointStore.save(checkpoint);
        pipelineWorker.submit(checkpoint);

        log.info("Report pipeline started: reportId={}, instanceId={}, formats={}",
                reportId, instanceId, config.getOutputFormats());
        return PipelineStartResponse.builder()
                .reportId(reportId)
                .instanceId(instanceId)
                .build();
    }

    private void validate(CreateReportRequest request) {
        if (request == null) {
            throw new ReportValidationException("Request body is required");
        }

        Set<ConstraintViolation<CreateReportRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new ReportValidationException(message);
        }

        // 구조화 입력은 시작 시점에 한 번 파싱해 형식 오류를 바로 돌려준다
        for (InputData block : request.getData()) {
            if (block instanceof StructuredInput structured) {
                inputNormalizer.parse(structured);
            }
        }
    }
}
