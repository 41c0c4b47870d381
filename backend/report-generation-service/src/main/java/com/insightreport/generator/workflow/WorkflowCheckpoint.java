package com.insightreport.generator.workflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.insightreport.generator.dto.report.GeneratedChart;
import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.dto.report.InputData;
import com.insightreport.generator.dto.report.ProfileResult;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.workflow.PipelineResult;
import com.insightreport.generator.dto.workflow.WorkflowState;
import com.insightreport.generator.entity.report.ReportFile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Persisted state of one pipeline instance: its input, the output of every
 * completed step, the cancel flag, the live state and, once finished, the result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowCheckpoint {

    private String instanceId;

    private String reportId;

    private List<InputData> inputData;

    private ReportConfig config;

    private boolean cancelRequested;

    /**
     * null until the first step completes
     */
    private PipelineStep lastCompletedStep;

    private ProfileResult profile;

    private GeneratedNarrative narrative;

    private List<GeneratedChart> charts;

    private String layoutLocation;

    private List<ReportFile> files;

    private WorkflowState state;

    private PipelineResult result;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isFinished() {
        return result != null;
    }
}
