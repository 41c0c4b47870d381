package com.insightreport.generator.entity.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.insightreport.generator.entity.profile.DataProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Identity and lifecycle record for one report generation request.
 * Created as QUEUED when a pipeline starts, mutated only by the pipeline,
 * and frozen once it reaches COMPLETED or FAILED.
 *
 * Every field is nullable so that an instance can also serve as a partial
 * update for {@link com.insightreport.generator.service.storage.ReportStorage#saveReport}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Report {

    private String id;

    private String title;

    private ReportStyle style;

    private ReportStatus status;

    private Set<OutputFormat> outputFormats;

    /**
     * 0-100
     */
    private Integer progress;

    private String currentStep;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;

    private String errorMessage;

    private List<ReportFile> files;

    private DataProfile dataProfile;

    private Branding branding;

    private String authorName;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
