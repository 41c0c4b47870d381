package com.insightreport.generator.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Handle returned when a pipeline instance is started.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineStartResponse {

    private String reportId;

    private String instanceId;
}
