package com.insightreport.generator.service.storage;

import com.insightreport.generator.entity.cost.CostMetrics;
import com.insightreport.generator.entity.report.Report;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 보고서 레코드, 산출물, 비용 원장을 위한 저장소
 */
public interface ReportStorage {

    /**
     * Merges the non-null fields of {@code partial} into the stored report, creating it if absent.
     */
    Report saveReport(String reportId, Report partial);

    Optional<Report> getReport(String reportId);

    /**
     * All stored reports, newest first
     */
    List<Report> listReports();

    /**
     * @return storage location of the PNG image
     */
    String saveChart(String reportId, String chartId, byte[] image);

    /**
     * Idempotent by file name; an existing file is overwritten.
     *
     * @return storage location of the file
     */
    String saveOutputFile(String reportId, String filename, byte[] data);

    Optional<byte[]> getOutputFile(String reportId, String filename);

    Path getOutputFilePath(String reportId, String filename);

    boolean fileExists(String reportId, String filename);

    long getFileSize(String reportId, String filename);

    void saveCostMetrics(CostMetrics metrics);

    Optional<CostMetrics> getCostMetrics(String reportId);

    List<CostMetrics> listCostMetrics();
}
