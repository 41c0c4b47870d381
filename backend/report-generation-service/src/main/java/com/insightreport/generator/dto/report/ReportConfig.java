package com.insightreport.generator.dto.report;

import com.insightreport.generator.entity.report.Branding;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.ReportStyle;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 보고서 생성 설정
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReportConfig {

    @NotBlank
    @Size(max = 200)
    private String title;

    @NotNull
    @Builder.Default
    private ReportStyle style = ReportStyle.BUSINESS;

    /**
     * 중복은 시작 시점에 첫 등장 순서로 정리된다
     */
    @NotEmpty
    @Builder.Default
    private List<@NotNull OutputFormat> outputFormats = new ArrayList<>(List.of(OutputFormat.PDF));

    @Valid
    private Branding branding;

    private List<String> sectionsToInclude;

    private List<String> sectionsToExclude;

    private String authorName;

    @Size(max = 1000)
    private String customPromptInstructions;

    /**
     * 표지 이미지 생성 여부 (이미지 생성 API 호출)
     */
    private boolean generateCoverImage;
}
