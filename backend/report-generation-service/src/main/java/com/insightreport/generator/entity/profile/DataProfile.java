package com.insightreport.generator.entity.profile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Derived description of a normalized record set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataProfile {

    private int rowCount;

    private int columnCount;

    @Builder.Default
    private List<ColumnProfile> columns = new ArrayList<>();

    /**
     * 0-100
     */
    private int dataQualityScore;

    /**
     * At most eight, in priority order
     */
    @Builder.Default
    private List<ChartSuggestion> suggestedCharts = new ArrayList<>();

    public static DataProfile empty() {
        return DataProfile.builder().build();
    }
}
