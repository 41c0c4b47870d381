package com.insightreport.generator.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreport.generator.config.PipelineProperties;
import com.insightreport.generator.config.StorageProperties;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.workflow.PipelineResult;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.exception.ReportPipelineException;
import com.insightreport.generator.service.storage.ReportStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * ReportPipelineWorker 단위 테스트
 *
 * 인스턴스 추적, 결과별 메트릭, 기동 시 복구를 검증합니다.
 */
@ExtendWith(MockitoExtension.class)
class ReportPipelineWorkerTest {

    @TempDir
    Path tempDir;

    @Mock
    private ReportActivities activities;

    @Mock
    private ReportStorage reportStorage;

    private SimpleMeterRegistry meterRegistry;
    private WorkflowCheckpointStore checkpointStore;
    private ActivityExecutor activityExecutor;
    private PipelineProperties pipelineProperties;

    @BeforeEach
    void setUp() {
        StorageProperties storageProperties = new StorageProperties();
        storageProperties.setBasePath(tempDir.toString());
        checkpointStore = new WorkflowCheckpointStore(storageProperties, new ObjectMapper().findAndRegisterModules());
        checkpointStore.init();
        meterRegistry = new SimpleMeterRegistry();
        activityExecutor = new ActivityExecutor(new SimpleAsyncTaskExecutor("activity-test-"), meterRegistry, millis -> { });
        pipelineProperties = new PipelineProperties();
    }

    private ReportPipelineWorker worker(TaskExecutor workflowExecutor) {
        ReportPipelineWorker worker = new ReportPipelineWorker(activities, activityExecutor, checkpointStore,
                reportStorage, pipelineProperties, workflowExecutor, meterRegistry);
        worker.initMetrics();
        return worker;
    }

    private WorkflowCheckpoint cancelledCheckpoint(String reportId) {
        return WorkflowCheckpoint.builder()
                .instanceId(ReportPipelineClient.instanceIdOf(reportId))
                .reportId(reportId)
                .inputData(List.of())
                .config(ReportConfig.builder().title("Q1").build())
                .cancelRequested(true)
                .build();
    }

    @Test
    @DisplayName("실행이 끝나면 인스턴스를 목록에서 빼고 결과별 카운터를 올린다")
    void recordsOutcome() {
        ReportPipelineWorker worker = worker(new SyncTaskExecutor());

        ReportGenerationWorkflow workflow = worker.submit(cancelledCheckpoint("a1"));

        assertThat(workflow.result()).isDone();
        assertThat(worker.getLiveInstance("report-a1")).isEmpty();
        assertThat(worker.getActiveInstanceCount()).isZero();
        assertThat(meterRegistry.counter("report.pipeline.started").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("report.pipeline.cancelled").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("report.pipeline.failed").count()).isZero();
        assertThat(meterRegistry.timer("report.pipeline.duration").count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("실행을 예약할 수 없으면 WORKER_UNAVAILABLE")
    void rejectedSubmission() {
        ReportPipelineWorker worker = worker(task -> {
            throw new TaskRejectedException("pool shut down");
        });

        assertThatThrownBy(() -> worker.submit(cancelledCheckpoint("b1")))
                .isInstanceOfSatisfying(ReportPipelineException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo("WORKER_UNAVAILABLE"));
        assertThat(worker.getLiveInstance("report-b1")).isEmpty();
        assertThat(worker.getActiveInstanceCount()).isZero();
    }

    @Test
    @DisplayName("기동 시 끝나지 않은 체크포인트만 다시 실행한다")
    void recoversUnfinishedCheckpoints() {
        WorkflowCheckpoint finished = cancelledCheckpoint("done");
        finished.setResult(PipelineResult.success(Report.builder().id("done").build()));
        checkpointStore.save(finished);
        checkpointStore.save(cancelledCheckpoint("pending"));
        ReportPipelineWorker worker = worker(new SyncTaskExecutor());

        worker.recoverUnfinished();

        assertThat(meterRegistry.counter("report.pipeline.started").count()).isEqualTo(1.0);
        assertThat(checkpointStore.load("report-pending").orElseThrow().isFinished()).isTrue();
        assertThat(checkpointStore.listUnfinished()).isEmpty();
    }

    @Test
    @DisplayName("복구가 꺼져 있으면 체크포인트를 건드리지 않는다")
    void recoveryDisabled() {
        pipelineProperties.setRecoverOnStartup(false);
        checkpointStore.save(cancelledCheckpoint("pending"));
        ReportPipelineWorker worker = worker(new SyncTaskExecutor());

        worker.recoverUnfinished();

        assertThat(checkpointStore.listUnfinished()).hasSize(1);
        verify(activities, never()).updateReportStatus(any(), any(), anyInt(), any(), any());
    }
}
