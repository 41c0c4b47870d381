package com.insightreport.generator.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * AI 가 생성한 보고서 본문
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedNarrative {

    private String executiveSummary;

    @Builder.Default
    private List<GeneratedInsight> sections = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private List<String> keyFindings = new ArrayList<>();

    /**
     * PNG/JPEG 표지 이미지 (선택)
     */
    private byte[] coverImage;
}
