package com.insightreport.generator.service.profile;

import com.insightreport.generator.entity.profile.ChartSuggestion;
import com.insightreport.generator.entity.profile.ChartType;
import com.insightreport.generator.entity.profile.ColumnProfile;
import com.insightreport.generator.entity.profile.ColumnType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 컬럼 프로파일을 바탕으로 차트를 제안한다.
 *
 * 규칙은 고정된 순서(시계열 → 카테고리 비교 → 분포 → 다중 지표 → 요약 표)로 적용되며
 * 최대 {@value #MAX_SUGGESTIONS}개를 넘는 제안은 뒤에서부터 잘린다.
 */
@Component
public class ChartSuggestionEngine {

    public static final int MAX_SUGGESTIONS = 8;

    private static final int MAX_TIME_SERIES = 3;
    private static final int MAX_CATEGORY_COLUMNS = 2;
    private static final int MAX_BAR_METRICS = 2;
    private static final int MAX_PIE_SLICES = 8;
    private static final int MAX_STACKED_METRICS = 3;

    public List<ChartSuggestion> suggest(List<ColumnProfile> columns, int recordCount) {
        List<ColumnProfile> dateColumns = ofType(columns, ColumnType.DATETIME);
        List<ColumnProfile> numericColumns = ofType(columns, ColumnType.NUMERIC);
        List<ColumnProfile> categoricalColumns = ofType(columns, ColumnType.CATEGORICAL);

        List<ChartSuggestion> suggestions = new ArrayList<>();

        // 1. 시계열
        if (!dateColumns.isEmpty()) {
            String xAxis = dateColumns.get(0).getName();
            for (ColumnProfile numCol : head(numericColumns, MAX_TIME_SERIES)) {
                suggestions.add(ChartSuggestion.builder()
                        .type(ChartType.LINE)
                        .title(numCol.getName() + " Over Time")
                        .xAxis(xAxis)
                        .yAxis(List.of(numCol.getName()))
                        .reason("Time-series data detected - line chart recommended for trend visualization")
                        .build());
            }
        }

        // 2. 카테고리 비교
        for (ColumnProfile catCol : head(categoricalColumns, MAX_CATEGORY_COLUMNS)) {
            for (ColumnProfile numCol : head(numericColumns, MAX_BAR_METRICS)) {
                suggestions.add(ChartSuggestion.builder()
                        .type(ChartType.BAR)
                        .title(numCol.getName() + " by " + catCol.getName())
                        .xAxis(catCol.getName())
                        .yAxis(List.of(numCol.getName()))
                        .reason("Categorical grouping detected - bar chart recommended for comparison")
                        .build());
            }
        }

        // 3. 분포
        for (ColumnProfile catCol : head(categoricalColumns, MAX_CATEGORY_COLUMNS)) {
            if (catCol.getUniqueCount() <= MAX_PIE_SLICES) {
                suggestions.add(ChartSuggestion.builder()
                        .type(ChartType.PIE)
                        .title(catCol.getName() + " Distribution")
                        .xAxis(catCol.getName())
                        .reason("Low-cardinality categorical data - pie chart recommended for distribution")
                        .build());
            }
        }

        // 4. 다중 지표 비교
        if (numericColumns.size() >= 2 && !categoricalColumns.isEmpty()) {
            suggestions.add(ChartSuggestion.builder()
                    .type(ChartType.STACKED_BAR)
                    .title("Multi-Metric Comparison")
                    .xAxis(categoricalColumns.get(0).getName())
                    .yAxis(head(numericColumns, MAX_STACKED_METRICS).stream().map(ColumnProfile::getName).toList())
                    .reason("Multiple numeric metrics with categories - stacked bar recommended")
                    .build());
        }

        // 5. 요약 표 (항상 마지막)
        if (recordCount > 0) {
            suggestions.add(ChartSuggestion.builder()
                    .type(ChartType.TABLE)
                    .title("Key Metrics Summary")
                    .reason("Tabular summary of key statistics")
                    .build());
        }

        return suggestions.size() > MAX_SUGGESTIONS
                ? new ArrayList<>(suggestions.subList(0, MAX_SUGGESTIONS))
                : suggestions;
    }

    private static List<ColumnProfile> ofType(List<ColumnProfile> columns, ColumnType type) {
        return columns.stream().filter(c -> c.getType() == type).toList();
    }

    private static List<ColumnProfile> head(List<ColumnProfile> columns, int n) {
        return columns.subList(0, Math.min(n, columns.size()));
    }
}
