package com.insightreport.generator.service.report;

import com.insightreport.generator.dto.report.ChartData;
import com.insightreport.generator.entity.profile.ChartSuggestion;
import com.insightreport.generator.entity.profile.ChartType;
import com.insightreport.generator.service.profile.ValueTypes;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 차트 제안 + 레코드 → 차트 데이터
 *
 * 렌더링과 분리된 순수 변환이다. 표(table) 제안은 이미지가 없으므로 null 을 반환한다.
 */
@Component
public class ChartDataBuilder {

    static final int MAX_BAR_CATEGORIES = 10;
    static final int MAX_PIE_SLICES = 8;

    private static final DateTimeFormatter DATE_LABEL = DateTimeFormatter.ISO_LOCAL_DATE;

    public ChartData build(ChartSuggestion suggestion, List<Map<String, Object>> records) {
        return switch (suggestion.getType()) {
            case LINE, AREA -> timeSeries(suggestion, records);
            case BAR -> bar(suggestion, records);
            case STACKED_BAR -> stackedBar(suggestion, records);
            case PIE, DONUT -> distribution(suggestion, records);
            case TABLE -> null;
        };
    }

    /**
     * 라인/영역: x 날짜 기준 정렬
     */
    private ChartData timeSeries(ChartSuggestion suggestion, List<Map<String, Object>> records) {
        String xAxis = suggestion.getXAxis();
        String yAxis = suggestion.primaryYAxis();

        List<Map<String, Object>> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(
                (Map<String, Object> row) -> ValueTypes.toDateTime(row.get(xAxis)).orElse(null),
                Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder())));

        List<String> labels = sorted.stream().map(row -> formatLabel(row.get(xAxis))).toList();
        List<Double> values = sorted.stream().map(row -> numberOrZero(row.get(yAxis))).toList();

        return ChartData.single(suggestion.getType(), suggestion.getTitle(), xAxis, yAxis, labels, yAxis, values);
    }

    /**
     * 막대: 카테고리별 합계, 큰 값 순 상위 10개
     */
    private ChartData bar(ChartSuggestion suggestion, List<Map<String, Object>> records) {
        String xAxis = suggestion.getXAxis();
        String yAxis = suggestion.primaryYAxis();

        Map<String, Double> sums = new LinkedHashMap<>();
        for (Map<String, Object> row : records) {
            sums.merge(String.valueOf(row.get(xAxis)), numberOrZero(row.get(yAxis)), Double::sum);
        }
        List<Map.Entry<String, Double>> top = largestFirst(sums, MAX_BAR_CATEGORIES);

        return ChartData.single(ChartType.BAR, suggestion.getTitle(), xAxis, yAxis,
                top.stream().map(Map.Entry::getKey).toList(), yAxis,
                top.stream().map(Map.Entry::getValue).toList());
    }

    /**
     * 누적 막대: 지표별 시리즈, 카테고리는 등장 순서
     */
    private ChartData stackedBar(ChartSuggestion suggestion, List<Map<String, Object>> records) {
        String xAxis = suggestion.getXAxis();
        List<String> yAxes = suggestion.getYAxis() != null ? suggestion.getYAxis() : List.of();

        List<String> categories = records.stream().map(row -> String.valueOf(row.get(xAxis))).distinct().toList();

        List<ChartData.DataSeries> series = new ArrayList<>();
        for (String yAxis : yAxes) {
            Map<String, Double> sums = new LinkedHashMap<>();
            categories.forEach(c -> sums.put(c, 0.0));
            for (Map<String, Object> row : records) {
                sums.merge(String.valueOf(row.get(xAxis)), numberOrZero(row.get(yAxis)), Double::sum);
            }
            series.add(new ChartData.DataSeries(yAxis, new ArrayList<>(sums.values())));
        }

        return ChartData.builder()
                .chartType(ChartType.STACKED_BAR)
                .title(suggestion.getTitle())
                .xAxisLabel(xAxis)
                .labels(categories)
                .series(series)
                .build();
    }

    /**
     * 파이/도넛: 카테고리별 건수, 상위 8개
     */
    private ChartData distribution(ChartSuggestion suggestion, List<Map<String, Object>> records) {
        String xAxis = suggestion.getXAxis();

        Map<String, Double> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : records) {
            counts.merge(String.valueOf(row.get(xAxis)), 1.0, Double::sum);
        }
        List<Map.Entry<String, Double>> top = largestFirst(counts, MAX_PIE_SLICES);

        return ChartData.single(suggestion.getType(), suggestion.getTitle(), xAxis, null,
                top.stream().map(Map.Entry::getKey).toList(), "Distribution",
                top.stream().map(Map.Entry::getValue).toList());
    }

    private static List<Map.Entry<String, Double>> largestFirst(Map<String, Double> values, int limit) {
        return values.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(limit)
                .toList();
    }

    private static double numberOrZero(Object value) {
        return ValueTypes.toDouble(value).orElse(0.0);
    }

    private static String formatLabel(Object value) {
        Optional<LocalDateTime> date = ValueTypes.toDateTime(value);
        return date.map(d -> d.format(DATE_LABEL)).orElseGet(() -> String.valueOf(value));
    }
}
