package com.insightreport.generator.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreport.generator.config.StorageProperties;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.report.UnstructuredInput;
import com.insightreport.generator.dto.workflow.WorkflowState;
import com.insightreport.generator.entity.report.ReportStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowCheckpointStore 단위 테스트
 */
class WorkflowCheckpointStoreTest {

    @TempDir
    Path tempDir;

    private WorkflowCheckpointStore store;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setBasePath(tempDir.toString());
        store = new WorkflowCheckpointStore(properties, new ObjectMapper().findAndRegisterModules());
        store.init();
    }

    private static WorkflowCheckpoint checkpoint(String reportId) {
        return WorkflowCheckpoint.builder()
                .instanceId("report-" + reportId)
                .reportId(reportId)
                .inputData(List.of(UnstructuredInput.builder().content("notes").build()))
                .config(ReportConfig.builder().title("Q1").build())
                .state(WorkflowState.initial())
                .build();
    }

    @Test
    @DisplayName("저장한 체크포인트를 입력 블록 유형까지 복원한다")
    void savesAndLoads() {
        WorkflowCheckpoint original = checkpoint("a1");
        original.setLastCompletedStep(PipelineStep.GENERATE_INSIGHTS);

        store.save(original);
        WorkflowCheckpoint loaded = store.load("report-a1").orElseThrow();

        assertThat(loaded.getUpdatedAt()).isNotNull();
        assertThat(loaded.getLastCompletedStep()).isEqualTo(PipelineStep.GENERATE_INSIGHTS);
        assertThat(loaded.getState().status()).isEqualTo(ReportStatus.QUEUED);
        assertThat(loaded.getInputData()).singleElement().isInstanceOf(UnstructuredInput.class);
    }

    @Test
    @DisplayName("update 는 잠금 안에서 변경 후 저장한다")
    void updateMutatesUnderLock() {
        store.save(checkpoint("a1"));

        store.update("report-a1", cp -> cp.setCancelRequested(true));

        assertThat(store.load("report-a1").orElseThrow().isCancelRequested()).isTrue();
        assertThat(store.update("report-none", cp -> cp.setCancelRequested(true))).isEmpty();
    }

    @Test
    @DisplayName("읽을 수 없는 파일은 건너뛴다")
    void skipsUnreadableCheckpoints() throws Exception {
        store.save(checkpoint("a1"));
        Files.writeString(tempDir.resolve("workflows").resolve("broken.json"), "{not json");

        assertThat(store.listUnfinished()).extracting(WorkflowCheckpoint::getReportId).containsExactly("a1");
    }

    @Test
    @DisplayName("디렉터리를 벗어나는 인스턴스 ID 는 거부한다")
    void rejectsTraversal() {
        assertThatThrownBy(() -> store.load("../reports/a1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
