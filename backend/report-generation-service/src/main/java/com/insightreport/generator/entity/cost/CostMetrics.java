package com.insightreport.generator.entity.cost;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Per-report AI usage ledger. Only ever grows.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CostMetrics {

    private String reportId;

    private LocalDateTime updatedAt;

    private long promptTokens;

    private long completionTokens;

    /**
     * promptTokens + completionTokens
     */
    private long totalTokens;

    private long imagesGenerated;

    /**
     * USD, four decimal places
     */
    private double estimatedCost;

    public static CostMetrics zero(String reportId) {
        return CostMetrics.builder().reportId(reportId).build();
    }
}
