package com.insightreport.generator.entity.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * An artifact produced by the export step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportFile {

    private OutputFormat format;

    /**
     * Download location exposed to clients
     */
    private String url;

    /**
     * Size in bytes
     */
    private Long size;

    private LocalDateTime generatedAt;
}
