package com.insightreport.generator.entity.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Statistics for one input field.
 *
 * Only the fields matching {@link #type} are populated:
 * numeric columns carry min/max/mean/median/stdDev, categorical and text
 * columns carry {@link #topValues}, datetime columns carry ISO min/max dates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnProfile {

    private String name;

    private ColumnType type;

    private long nullCount;

    /**
     * Distinct non-null values
     */
    private long uniqueCount;

    private Double min;

    private Double max;

    private Double mean;

    private Double median;

    private Double stdDev;

    private String minDate;

    private String maxDate;

    private List<TopValue> topValues;
}
