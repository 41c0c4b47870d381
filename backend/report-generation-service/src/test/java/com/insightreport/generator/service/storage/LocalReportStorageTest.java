package com.insightreport.generator.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreport.generator.config.StorageProperties;
import com.insightreport.generator.entity.cost.CostMetrics;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.entity.report.ReportStatus;
import com.insightreport.generator.entity.report.ReportStyle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LocalReportStorage 단위 테스트
 */
class LocalReportStorageTest {

    @TempDir
    Path tempDir;

    private LocalReportStorage storage;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setBasePath(tempDir.toString());
        storage = new LocalReportStorage(properties, new ObjectMapper().findAndRegisterModules());
        storage.init();
    }

    @Nested
    @DisplayName("보고서 레코드")
    class Reports {

        @Test
        @DisplayName("부분 레코드는 null 이 아닌 필드만 병합된다")
        void mergesPartialRecords() {
            // given
            storage.saveReport("r1", Report.builder()
                    .title("Quarterly")
                    .style(ReportStyle.BUSINESS)
                    .status(ReportStatus.QUEUED)
                    .outputFormats(Set.of(OutputFormat.PDF))
                    .progress(0)
                    .build());

            // when
            Report merged = storage.saveReport("r1", Report.builder()
                    .status(ReportStatus.DATA_PROFILING)
                    .progress(10)
                    .build());

            // then
            assertThat(merged.getId()).isEqualTo("r1");
            assertThat(merged.getTitle()).isEqualTo("Quarterly");
            assertThat(merged.getStatus()).isEqualTo(ReportStatus.DATA_PROFILING);
            assertThat(merged.getProgress()).isEqualTo(10);
            assertThat(merged.getCreatedAt()).isNotNull();
            assertThat(storage.getReport("r1")).hasValueSatisfying(stored -> {
                assertThat(stored.getTitle()).isEqualTo("Quarterly");
                assertThat(stored.getOutputFormats()).containsExactly(OutputFormat.PDF);
                assertThat(stored.getStatus()).isEqualTo(ReportStatus.DATA_PROFILING);
            });
        }

        @Test
        @DisplayName("목록은 최근 생성 순")
        void listsNewestFirst() {
            storage.saveReport("old", Report.builder().title("old").createdAt(LocalDateTime.of(2024, 1, 1, 0, 0)).build());
            storage.saveReport("new", Report.builder().title("new").createdAt(LocalDateTime.of(2024, 6, 1, 0, 0)).build());

            List<Report> reports = storage.listReports();

            assertThat(reports).extracting(Report::getId).containsExactly("new", "old");
        }

        @Test
        @DisplayName("생성 시각이 없는 레코드는 목록 끝에 온다")
        void undatedReportsLast() throws Exception {
            Files.writeString(tempDir.resolve("reports").resolve("legacy.json"),
                    "{\"id\":\"legacy\",\"title\":\"legacy\"}", StandardCharsets.UTF_8);
            storage.saveReport("old", Report.builder().title("old").createdAt(LocalDateTime.of(2024, 1, 1, 0, 0)).build());
            storage.saveReport("new", Report.builder().title("new").createdAt(LocalDateTime.of(2024, 6, 1, 0, 0)).build());

            List<Report> reports = storage.listReports();

            assertThat(reports).extracting(Report::getId).containsExactly("new", "old", "legacy");
        }

        @Test
        @DisplayName("없는 보고서는 빈 결과")
        void missingReport() {
            assertThat(storage.getReport("nope")).isEmpty();
        }
    }

    @Nested
    @DisplayName("출력 파일")
    class OutputFiles {

        @Test
        @DisplayName("같은 이름으로 다시 저장하면 덮어쓴다")
        void overwritesByName() {
            storage.saveOutputFile("r1", "r1.html", "first".getBytes(StandardCharsets.UTF_8));
            storage.saveOutputFile("r1", "r1.html", "second!".getBytes(StandardCharsets.UTF_8));

            assertThat(storage.fileExists("r1", "r1.html")).isTrue();
            assertThat(storage.getFileSize("r1", "r1.html")).isEqualTo(7);
            assertThat(storage.getOutputFile("r1", "r1.html"))
                    .hasValueSatisfying(bytes -> assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("second!"));
        }

        @Test
        @DisplayName("보고서 디렉터리 밖의 경로는 거부한다")
        void rejectsTraversal() {
            assertThatThrownBy(() -> storage.getOutputFilePath("r1", "../r2/r2.pdf"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("차트 이미지는 charts 디렉터리에 저장된다")
        void savesCharts() {
            String location = storage.saveChart("r1", "chart00001", new byte[]{1, 2, 3});

            assertThat(Path.of(location)).exists();
            assertThat(Path.of(location).getParent().getFileName().toString()).isEqualTo("r1");
        }
    }

    @Test
    @DisplayName("비용 원장을 저장하고 전체 목록으로 읽는다")
    void costLedger() throws Exception {
        storage.saveCostMetrics(CostMetrics.builder().reportId("a").totalTokens(10).estimatedCost(0.01).build());
        storage.saveCostMetrics(CostMetrics.builder().reportId("b").totalTokens(20).estimatedCost(0.02).build());

        assertThat(storage.getCostMetrics("a")).hasValueSatisfying(m -> assertThat(m.getTotalTokens()).isEqualTo(10));
        assertThat(storage.listCostMetrics()).extracting(CostMetrics::getReportId).containsExactly("a", "b");
        try (var files = Files.list(tempDir.resolve("costs"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactlyInAnyOrder("a-costs.json", "b-costs.json");
        }
    }
}
