package com.insightreport.generator.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedInsight {

    private String sectionId;

    private String sectionTitle;

    private String content;

    private int order;
}
