package com.insightreport.generator.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A rendered chart: the data it was built from and its PNG image.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedChart {

    private String id;

    private ChartData config;

    private byte[] imageBytes;

    /**
     * Storage location of the image
     */
    private String imagePath;
}
