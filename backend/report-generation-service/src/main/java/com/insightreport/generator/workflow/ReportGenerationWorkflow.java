package com.insightreport.generator.workflow;

import com.insightreport.generator.dto.report.GeneratedChart;
import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.dto.report.ProfileResult;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.workflow.PipelineResult;
import com.insightreport.generator.dto.workflow.WorkflowState;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.entity.report.ReportFile;
import com.insightreport.generator.entity.report.ReportStatus;
import com.insightreport.generator.exception.ActivityFailedException;
import com.insightreport.generator.exception.PipelineCancelledException;
import com.insightreport.generator.exception.ReportPipelineException;
import com.insightreport.generator.exception.WorkflowInterruptedException;
import com.insightreport.generator.service.storage.ReportStorage;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 보고서 한 건의 생성 파이프라인 상태 머신
 *
 * <pre>
 * QUEUED → DATA_PROFILING(10) → INSIGHT_GENERATION(30) → CHART_GENERATION(50)
 *        → LAYOUT_RENDERING(70) → EXPORTING(90) → COMPLETED(100)
 * </pre>
 *
 * 단계마다 체크포인트를 남기고, 복구 시 마지막으로 완료된 단계 다음부터 재개한다.
 * 취소는 단계 사이에서만 확인한다. 실행 중인 단계는 끝까지 수행된다.
 * 모든 실패는 {@link #run()} 의 최상위에서 한 번만 잡혀 FAILED 결과로 변환된다.
 */
@Slf4j
public class ReportGenerationWorkflow {

    private static final String STATUS_ACTIVITY = "updateReportStatus";

    private final WorkflowCheckpoint checkpoint;
    private final ReportActivities activities;
    private final ActivityExecutor activityExecutor;
    private final WorkflowCheckpointStore checkpointStore;
    private final ReportStorage reportStorage;
    private final ActivityOptions options;
    private final Duration heartbeatTimeout;

    private final ReentrantLock lock;
    private final AtomicBoolean cancelRequested;
    private final CompletableFuture<PipelineResult> result = new CompletableFuture<>();

    private volatile WorkflowState state;

    public ReportGenerationWorkflow(WorkflowCheckpoint checkpoint,
                                    ReportActivities activities,
                                    ActivityExecutor activityExecutor,
                                    WorkflowCheckpointStore checkpointStore,
                                    ReportStorage reportStorage,
                                    ActivityOptions options,
                                    Duration heartbeatTimeout) {
        this.checkpoint = checkpoint;
        this.activities = activities;
        this.activityExecutor = activityExecutor;
        this.checkpointStore = checkpointStore;
        this.reportStorage = reportStorage;
        this.options = options;
        this.heartbeatTimeout = heartbeatTimeout;
        this.lock = checkpointStore.lockFor(checkpoint.getInstanceId());
        this.cancelRequested = new AtomicBoolean(checkpoint.isCancelRequested());
        this.state = checkpoint.getState() != null ? checkpoint.getState() : WorkflowState.initial();
    }

    public String getInstanceId() {
        return checkpoint.getInstanceId();
    }

    public String getReportId() {
        return checkpoint.getReportId();
    }

    /**
     * 현재 상태 조회. 실행 중인 단계를 막지 않는다.
     */
    public WorkflowState getStatus() {
        return state;
    }

    public int getProgress() {
        return state.progress();
    }

    public CompletableFuture<PipelineResult> result() {
        return result;
    }

    /**
     * 취소 신호. 다음 단계 경계에서 반영된다.
     *
     * @return false if the instance already finished
     */
    public boolean cancel() {
        lock.lock();
        try {
            if (result.isDone()) {
                return false;
            }
            cancelRequested.set(true);
            persist();
            log.info("Cancellation requested: instanceId={}", getInstanceId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 파이프라인을 끝까지 실행한다. 실패는 결과로 반환된다.
     *
     * @throws WorkflowInterruptedException only when the worker is shut down mid-step
     */
    public PipelineResult run() {
        String reportId = getReportId();
        ReportConfig config = checkpoint.getConfig();
        log.info("Workflow started: instanceId={}, reportId={}, resumeAfter={}",
                getInstanceId(), reportId, checkpoint.getLastCompletedStep());

        try {
            if (!PipelineStep.PROFILE_DATA.isCompletedBy(checkpoint.getLastCompletedStep())) {
                ProfileResult profile = runStep(PipelineStep.PROFILE_DATA, options,
                        context -> activities.profileData(reportId, checkpoint.getInputData()));
                checkpoint.setProfile(profile);
                completed(PipelineStep.PROFILE_DATA);
            }

            if (!PipelineStep.GENERATE_INSIGHTS.isCompletedBy(checkpoint.getLastCompletedStep())) {
                GeneratedNarrative narrative = runStep(PipelineStep.GENERATE_INSIGHTS, options,
                        context -> activities.generateInsights(reportId, checkpoint.getProfile(), config));
                checkpoint.setNarrative(narrative);
                completed(PipelineStep.GENERATE_INSIGHTS);
            }

            if (!PipelineStep.GENERATE_CHARTS.isCompletedBy(checkpoint.getLastCompletedStep())) {
                List<GeneratedChart> charts = runStep(PipelineStep.GENERATE_CHARTS, options,
                        context -> activities.generateCharts(reportId, checkpoint.getProfile()));
                checkpoint.setCharts(charts);
                completed(PipelineStep.GENERATE_CHARTS);
            }

            if (!PipelineStep.RENDER_LAYOUT.isCompletedBy(checkpoint.getLastCompletedStep())) {
                String location = runStep(PipelineStep.RENDER_LAYOUT, options,
                        context -> activities.renderLayout(reportId, config, checkpoint.getNarrative(),
                                checkpoint.getCharts(), checkpoint.getProfile().getProfile()));
                checkpoint.setLayoutLocation(location);
                completed(PipelineStep.RENDER_LAYOUT);
            }

            if (!PipelineStep.EXPORT_FORMATS.isCompletedBy(checkpoint.getLastCompletedStep())) {
                List<ReportFile> files = runStep(PipelineStep.EXPORT_FORMATS, options.withHeartbeatTimeout(heartbeatTimeout),
                        context -> activities.exportFormats(context, reportId, config, checkpoint.getNarrative(),
                                checkpoint.getCharts(), checkpoint.getProfile().getProfile()));
                checkpoint.setFiles(files);
                completed(PipelineStep.EXPORT_FORMATS);
            }

            Report report = finalizeReport(reportId);
            return finish(PipelineResult.success(report));
        } catch (WorkflowInterruptedException e) {
            // 종료 중 중단: 실패로 기록하지 않고 체크포인트를 남겨 재시작 시 복구한다
            log.warn("Workflow interrupted, left for recovery: instanceId={}, lastCompleted={}",
                    getInstanceId(), checkpoint.getLastCompletedStep());
            result.completeExceptionally(e);
            throw e;
        } catch (Exception e) {
            return fail(reportId, e);
        }
    }

    private <T> T runStep(PipelineStep step, ActivityOptions stepOptions, Function<ActivityContext, T> body) {
        checkCancelled();
        transition(WorkflowState.of(step.getStatus(), step.getProgress(), step.getDescription()));
        activityExecutor.execute(STATUS_ACTIVITY, options, context -> {
            activities.updateReportStatus(getReportId(), step.getStatus(), step.getProgress(), step.getDescription(), null);
            return null;
        });

        log.info("Step started: instanceId={}, step={}", getInstanceId(), step.getActivityName());
        return activityExecutor.execute(step.getActivityName(), stepOptions, body);
    }

    private Report finalizeReport(String reportId) {
        checkCancelled();
        PipelineStep step = PipelineStep.FINALIZE;

        Report report;
        if (step.isCompletedBy(checkpoint.getLastCompletedStep())) {
            report = reportStorage.getReport(reportId).orElseThrow(() -> new ReportPipelineException(
                    "REPORT_NOT_FOUND", "Finalized report missing from storage: " + reportId));
        } else {
            List<ReportFile> files = checkpoint.getFiles() != null ? checkpoint.getFiles() : new ArrayList<>();
            report = activityExecutor.execute(step.getActivityName(), options,
                    context -> activities.finalizeReport(reportId, files, checkpoint.getProfile().getProfile()));
        }

        // finalizeReport 가 COMPLETED 를 기록한 뒤에만 라이브 상태를 완료로 바꾼다
        state = WorkflowState.of(step.getStatus(), step.getProgress(), step.getDescription());
        completed(step);
        return report;
    }

    private void checkCancelled() {
        if (cancelRequested.get()) {
            throw new PipelineCancelledException(getReportId());
        }
    }

    private void transition(WorkflowState next) {
        state = next;
        persist();
    }

    private void completed(PipelineStep step) {
        checkpoint.setLastCompletedStep(step);
        persist();
        log.debug("Step completed: instanceId={}, step={}", getInstanceId(), step.getActivityName());
    }

    private PipelineResult fail(String reportId, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String errorType = errorTypeOf(e);

        if (e instanceof PipelineCancelledException) {
            log.info("Workflow cancelled: instanceId={}, lastCompleted={}", getInstanceId(), checkpoint.getLastCompletedStep());
        } else {
            log.error("Workflow failed: instanceId={}, reportId={}, errorType={}, error={}",
                    getInstanceId(), reportId, errorType, message, e);
        }

        state = state.failed(message);
        try {
            activityExecutor.execute(STATUS_ACTIVITY, options, context -> {
                activities.updateReportStatus(reportId, ReportStatus.FAILED, state.progress(), "Failed", message);
                return null;
            });
        } catch (ReportPipelineException updateError) {
            log.error("Failed to record failure status: reportId={}, error={}", reportId, updateError.getMessage());
        }

        return finish(PipelineResult.failure(failedReport(reportId, message), message, errorType));
    }

    private Report failedReport(String reportId, String message) {
        Report stored = null;
        try {
            stored = reportStorage.getReport(reportId).orElse(null);
        } catch (ReportPipelineException e) {
            log.warn("Could not load report for failure result: reportId={}, error={}", reportId, e.getMessage());
        }
        Report base = stored != null ? stored : Report.builder()
                .id(reportId)
                .title(checkpoint.getConfig().getTitle())
                .style(checkpoint.getConfig().getStyle())
                .build();
        return base.toBuilder()
                .status(ReportStatus.FAILED)
                .errorMessage(message)
                .files(base.getFiles() != null ? base.getFiles() : new ArrayList<>())
                .build();
    }

    private PipelineResult finish(PipelineResult pipelineResult) {
        lock.lock();
        try {
            checkpoint.setResult(pipelineResult);
            persist();
        } catch (ReportPipelineException e) {
            log.error("Failed to persist workflow result: instanceId={}, error={}", getInstanceId(), e.getMessage());
        } finally {
            lock.unlock();
        }
        result.complete(pipelineResult);
        log.info("Workflow finished: instanceId={}, success={}", getInstanceId(), pipelineResult.success());
        return pipelineResult;
    }

    private void persist() {
        lock.lock();
        try {
            checkpoint.setState(state);
            checkpoint.setCancelRequested(cancelRequested.get());
            checkpointStore.save(checkpoint);
        } finally {
            lock.unlock();
        }
    }

    static String errorTypeOf(Throwable e) {
        if (e instanceof ActivityFailedException failed) {
            return failed.getCauseErrorCode();
        }
        if (e instanceof ReportPipelineException pipelineException) {
            return pipelineException.getErrorCode();
        }
        return e.getClass().getSimpleName();
    }
}
