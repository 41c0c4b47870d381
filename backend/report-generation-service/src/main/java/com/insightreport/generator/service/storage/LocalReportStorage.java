package com.insightreport.generator.service.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreport.generator.config.StorageProperties;
import com.insightreport.generator.entity.cost.CostMetrics;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.util.StripedLocks;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * 로컬 파일시스템 저장소
 *
 * <pre>
 * {basePath}/reports/{reportId}.json
 * {basePath}/outputs/{reportId}/{filename}
 * {basePath}/charts/{reportId}/{chartId}.png
 * {basePath}/costs/{reportId}-costs.json
 * </pre>
 *
 * 모든 쓰기는 임시 파일에 쓴 뒤 원자적으로 이동한다.
 */
@Service
@Slf4j
public class LocalReportStorage implements ReportStorage {

    private static final String JSON = ".json";
    private static final String COSTS_SUFFIX = "-costs.json";

    private final StorageProperties properties;
    private final ObjectMapper objectMapper;

    private final StripedLocks reportLocks = new StripedLocks();

    private Path reportsPath;
    private Path outputsPath;
    private Path chartsPath;
    private Path costsPath;

    public LocalReportStorage(StorageProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        Path root = Paths.get(properties.getBasePath());
        this.reportsPath = root.resolve(properties.getReportsDir());
        this.outputsPath = root.resolve(properties.getOutputsDir());
        this.chartsPath = root.resolve(properties.getChartsDir());
        this.costsPath = root.resolve(properties.getCostsDir());
        try {
            for (Path dir : List.of(reportsPath, outputsPath, chartsPath, costsPath)) {
                Files.createDirectories(dir);
            }
            log.info("Report storage initialized at: {}", root.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Could not initialize report storage at " + root.toAbsolutePath(), e);
        }
    }

    @Override
    public Report saveReport(String reportId, Report partial) {
        ReentrantLock lock = reportLocks.get(reportId);
        lock.lock();
        try {
            Path file = reportsPath.resolve(reportId + JSON);
            Report merged;
            if (Files.exists(file)) {
                Report existing = objectMapper.readValue(file.toFile(), Report.class);
                // null 필드는 직렬화되지 않으므로 기존 값이 유지된다
                JsonNode update = objectMapper.valueToTree(partial);
                merged = objectMapper.readerForUpdating(existing).readValue(update);
            } else {
                merged = partial.toBuilder().build();
                if (merged.getCreatedAt() == null) {
                    merged.setCreatedAt(LocalDateTime.now());
                }
            }
            merged.setId(reportId);
            merged.setUpdatedAt(LocalDateTime.now());
            writeAtomically(file, objectMapper.writeValueAsBytes(merged));
            return merged;
        } catch (IOException e) {
            throw new StorageException("Failed to save report " + reportId + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Report> getReport(String reportId) {
        return readJson(reportsPath.resolve(reportId + JSON), Report.class);
    }

    @Override
    public List<Report> listReports() {
        List<Report> reports = new ArrayList<>();
        for (Path file : listFiles(reportsPath, JSON)) {
            readJson(file, Report.class).ifPresent(reports::add);
        }
        reports.sort(Comparator.comparing(Report::getCreatedAt,
                Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())));
        return reports;
    }

    @Override
    public String saveChart(String reportId, String chartId, byte[] image) {
        Path file = chartsPath.resolve(reportId).resolve(chartId + ".png");
        write(file, image);
        return file.toString();
    }

    @Override
    public String saveOutputFile(String reportId, String filename, byte[] data) {
        Path file = getOutputFilePath(reportId, filename);
        write(file, data);
        log.debug("Output file saved: reportId={}, file={}, size={}", reportId, filename, data.length);
        return file.toString();
    }

    @Override
    public Optional<byte[]> getOutputFile(String reportId, String filename) {
        Path file = getOutputFilePath(reportId, filename);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Path getOutputFilePath(String reportId, String filename) {
        Path reportDir = outputsPath.resolve(reportId).normalize();
        Path file = reportDir.resolve(filename).normalize();
        if (!reportDir.startsWith(outputsPath.normalize()) || !file.startsWith(reportDir)) {
            throw new IllegalArgumentException("Invalid output file name: " + filename);
        }
        return file;
    }

    @Override
    public boolean fileExists(String reportId, String filename) {
        return Files.exists(getOutputFilePath(reportId, filename));
    }

    @Override
    public long getFileSize(String reportId, String filename) {
        try {
            return Files.size(getOutputFilePath(reportId, filename));
        } catch (IOException e) {
            throw new StorageException("Failed to stat " + filename + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void saveCostMetrics(CostMetrics metrics) {
        try {
            writeAtomically(costsPath.resolve(metrics.getReportId() + COSTS_SUFFIX),
                    objectMapper.writeValueAsBytes(metrics));
        } catch (IOException e) {
            throw new StorageException("Failed to save cost metrics for " + metrics.getReportId(), e);
        }
    }

    @Override
    public Optional<CostMetrics> getCostMetrics(String reportId) {
        return readJson(costsPath.resolve(reportId + COSTS_SUFFIX), CostMetrics.class);
    }

    @Override
    public List<CostMetrics> listCostMetrics() {
        List<CostMetrics> metrics = new ArrayList<>();
        for (Path file : listFiles(costsPath, COSTS_SUFFIX)) {
            readJson(file, CostMetrics.class).ifPresent(metrics::add);
        }
        return metrics;
    }

    // ===== 헬퍼 메서드 =====

    private <T> Optional<T> readJson(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private List<Path> listFiles(Path dir, String suffix) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(suffix)).sorted().toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list " + dir + ": " + e.getMessage(), e);
        }
    }

    private void write(Path file, byte[] data) {
        try {
            writeAtomically(file, data);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    static void writeAtomically(Path file, byte[] data) throws IOException {
        Files.createDirectories(file.getParent());
        Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, data);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
