package com.insightreport.generator.entity.cost;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Usage summary across all report ledgers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregatedCosts {

    private long totalReports;

    private long totalTokens;

    private double totalCost;

    private double averageCostPerReport;
}
