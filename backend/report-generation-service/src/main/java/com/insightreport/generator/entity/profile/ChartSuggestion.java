package com.insightreport.generator.entity.profile;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A visualization proposed by the profiler.
 * {@code yAxis} holds one field for simple charts and several for stacked bars.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class ChartSuggestion {

    private ChartType type;

    private String title;

    private String xAxis;

    private List<String> yAxis;

    /**
     * Human-readable justification, never parsed
     */
    private String reason;

    public String primaryYAxis() {
        return yAxis == null || yAxis.isEmpty() ? null : yAxis.get(0);
    }
}
