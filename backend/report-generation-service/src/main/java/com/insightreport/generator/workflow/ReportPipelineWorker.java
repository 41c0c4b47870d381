package com.insightreport.generator.workflow;

import com.insightreport.generator.config.PipelineProperties;
import com.insightreport.generator.dto.workflow.PipelineResult;
import com.insightreport.generator.exception.PipelineCancelledException;
import com.insightreport.generator.exception.ReportPipelineException;
import com.insightreport.generator.exception.WorkflowInterruptedException;
import com.insightreport.generator.service.storage.ReportStorage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 파이프라인 인스턴스 실행기
 *
 * 인스턴스를 workflowExecutor 에 올리고, 실행 중인 인스턴스를 추적한다.
 * 기동 시 완료되지 않은 체크포인트를 다시 실행한다.
 */
@Service
@Slf4j
public class ReportPipelineWorker {

    private final ReportActivities activities;
    private final ActivityExecutor activityExecutor;
    private final WorkflowCheckpointStore checkpointStore;
    private final ReportStorage reportStorage;
    private final PipelineProperties pipelineProperties;
    private final TaskExecutor workflowExecutor;
    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, ReportGenerationWorkflow> liveInstances = new ConcurrentHashMap<>();
    private final AtomicInteger activeInstancesGauge = new AtomicInteger(0);

    private Counter startedCounter;
    private Counter completedCounter;
    private Counter failedCounter;
    private Counter cancelledCounter;
    private Timer durationTimer;

    public ReportPipelineWorker(ReportActivities activities,
                                ActivityExecutor activityExecutor,
                                WorkflowCheckpointStore checkpointStore,
                                ReportStorage reportStorage,
                                PipelineProperties pipelineProperties,
                                @Qualifier("workflowExecutor") TaskExecutor workflowExecutor,
                                MeterRegistry meterRegistry) {
        this.activities = activities;
        this.activityExecutor = activityExecutor;
        this.checkpointStore = checkpointStore;
        this.reportStorage = reportStorage;
        this.pipelineProperties = pipelineProperties;
        this.workflowExecutor = workflowExecutor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        startedCounter = Counter.builder("report.pipeline.started")
                .description("Number of pipeline instances started")
                .register(meterRegistry);

        completedCounter = Counter.builder("report.pipeline.completed")
                .description("Number of pipeline instances completed")
                .register(meterRegistry);

        failedCounter = Counter.builder("report.pipeline.failed")
                .description("Number of pipeline instances failed")
                .register(meterRegistry);

        cancelledCounter = Counter.builder("report.pipeline.cancelled")
                .description("Number of pipeline instances cancelled")
                .register(meterRegistry);

        durationTimer = Timer.builder("report.pipeline.duration")
                .description("Time from instance start to terminal state")
                .register(meterRegistry);

        meterRegistry.gauge("report.pipeline.active", activeInstancesGauge);
    }

    /**
     * 체크포인트로부터 인스턴스를 만들어 실행을 예약한다
     */
    public ReportGenerationWorkflow submit(WorkflowCheckpoint checkpoint) {
        ReportGenerationWorkflow workflow = new ReportGenerationWorkflow(
                checkpoint,
                activities,
                activityExecutor,
                checkpointStore,
                reportStorage,
                ActivityOptions.from(pipelineProperties),
                pipelineProperties.getHeartbeatTimeout());

        ReportGenerationWorkflow existing = liveInstances.putIfAbsent(workflow.getInstanceId(), workflow);
        if (existing != null) {
            log.debug("Instance already running: instanceId={}", workflow.getInstanceId());
            return existing;
        }

        startedCounter.increment();
        activeInstancesGauge.incrementAndGet();
        try {
            workflowExecutor.execute(() -> execute(workflow));
        } catch (RuntimeException e) {
            liveInstances.remove(workflow.getInstanceId());
            activeInstancesGauge.decrementAndGet();
            throw new ReportPipelineException("WORKER_UNAVAILABLE",
                    "Could not schedule pipeline instance " + workflow.getInstanceId() + ": " + e.getMessage(),
                    workflow.getReportId(), e);
        }
        return workflow;
    }

    public Optional<ReportGenerationWorkflow> getLiveInstance(String instanceId) {
        return Optional.ofNullable(liveInstances.get(instanceId));
    }

    public int getActiveInstanceCount() {
        return activeInstancesGauge.get();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverUnfinished() {
        if (!pipelineProperties.isRecoverOnStartup()) {
            log.info("Workflow recovery disabled");
            return;
        }

        List<WorkflowCheckpoint> unfinished = checkpointStore.listUnfinished();
        if (unfinished.isEmpty()) {
            return;
        }

        log.info("Recovering unfinished workflows: count={}", unfinished.size());
        for (WorkflowCheckpoint checkpoint : unfinished) {
            try {
                submit(checkpoint);
                log.info("Workflow recovered: instanceId={}, resumeAfter={}",
                        checkpoint.getInstanceId(), checkpoint.getLastCompletedStep());
            } catch (ReportPipelineException e) {
                log.error("Failed to recover workflow: instanceId={}, error={}",
                        checkpoint.getInstanceId(), e.getMessage(), e);
            }
        }
    }

    private void execute(ReportGenerationWorkflow workflow) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            PipelineResult result = workflow.run();
            record(result);
        } catch (WorkflowInterruptedException e) {
            log.warn("Workflow interrupted by shutdown: instanceId={}", workflow.getInstanceId());
        } finally {
            sample.stop(durationTimer);
            liveInstances.remove(workflow.getInstanceId());
            activeInstancesGauge.decrementAndGet();
        }
    }

    private void record(PipelineResult result) {
        if (result.success()) {
            completedCounter.increment();
        } else if (PipelineCancelledException.ERROR_CODE.equals(result.errorType())) {
            cancelledCounter.increment();
        } else {
            failedCounter.increment();
        }
    }
}
