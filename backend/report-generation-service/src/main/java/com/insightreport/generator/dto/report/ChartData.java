package com.insightreport.generator.dto.report;

import com.insightreport.generator.entity.profile.ChartType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 차트 데이터 DTO - 서버 사이드 차트 생성용
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartData {

    /**
     * 차트 유형
     */
    private ChartType chartType;

    /**
     * 차트 제목
     */
    private String title;

    /**
     * X축 라벨
     */
    private String xAxisLabel;

    /**
     * Y축 라벨
     */
    private String yAxisLabel;

    /**
     * 카테고리/시간 라벨 목록
     */
    @Builder.Default
    private List<String> labels = new ArrayList<>();

    /**
     * 시리즈 목록 (단일 시리즈 차트도 하나의 시리즈로 표현)
     */
    @Builder.Default
    private List<DataSeries> series = new ArrayList<>();

    /**
     * 차트 너비 (픽셀)
     */
    @Builder.Default
    private int width = 800;

    /**
     * 차트 높이 (픽셀)
     */
    @Builder.Default
    private int height = 500;

    /**
     * 데이터 시리즈
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DataSeries {
        private String name;
        private List<Double> data;
    }

    // ===== 빌더 헬퍼 메서드 =====

    /**
     * 단일 시리즈 차트 생성 헬퍼
     */
    public static ChartData single(ChartType type, String title, String xLabel, String yLabel,
                                   List<String> labels, String seriesName, List<Double> values) {
        return ChartData.builder()
                .chartType(type)
                .title(title)
                .xAxisLabel(xLabel)
                .yAxisLabel(yLabel)
                .labels(labels)
                .series(new ArrayList<>(List.of(new DataSeries(seriesName, values))))
                .build();
    }
}
