package com.insightreport.generator.service.report;

import com.insightreport.generator.dto.report.ChartData;
import com.insightreport.generator.dto.report.GeneratedChart;
import com.insightreport.generator.entity.profile.ChartSuggestion;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.service.storage.ReportStorage;
import com.insightreport.generator.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.CategoryLabelPositions;
import org.jfree.chart.plot.CategoryPlot;
import org.jfree.chart.plot.PiePlot;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.RingPlot;
import org.jfree.chart.renderer.category.BarRenderer;
import org.jfree.chart.renderer.category.LineAndShapeRenderer;
import org.jfree.chart.renderer.category.StandardBarPainter;
import org.jfree.data.category.DefaultCategoryDataset;
import org.jfree.data.general.DefaultPieDataset;
import org.springframework.stereotype.Service;

import java.awt.*;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 서버 사이드 차트 생성 서비스
 *
 * JFreeChart를 사용하여 보고서에 삽입할 PNG 차트를 생성합니다.
 * 개별 차트 실패는 기록 후 건너뛰며 단계 전체를 실패시키지 않습니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartGenerationService {

    // 색상 팔레트
    static final Color[] DEFAULT_COLORS = {
            new Color(59, 130, 246),   // Blue
            new Color(16, 185, 129),   // Green
            new Color(245, 158, 11),   // Yellow/Orange
            new Color(239, 68, 68),    // Red
            new Color(139, 92, 246),   // Purple
            new Color(236, 72, 153),   // Pink
            new Color(20, 184, 166),   // Teal
            new Color(249, 115, 22),   // Orange
    };

    private static final Color BACKGROUND_COLOR = Color.WHITE;
    private static final Color TEXT_COLOR = new Color(30, 41, 59);
    private static final Color GRID_COLOR = new Color(226, 232, 240);
    private static final Font TITLE_FONT = new Font("SansSerif", Font.BOLD, 16);

    // 라벨이 많으면 x축 라벨을 기울인다
    private static final int ROTATE_LABELS_OVER = 8;

    private final ChartDataBuilder chartDataBuilder;
    private final ReportStorage reportStorage;

    /**
     * 제안 목록을 차트 이미지로 렌더링하고 저장한다
     */
    public List<GeneratedChart> render(String reportId,
                                       List<ChartSuggestion> suggestions,
                                       List<Map<String, Object>> records,
                                       DataProfile profile) {
        List<GeneratedChart> charts = new ArrayList<>();
        for (ChartSuggestion suggestion : suggestions) {
            ChartData chartData = chartDataBuilder.build(suggestion, records);
            if (chartData == null || chartData.getLabels().isEmpty()) {
                continue;
            }
            String chartId = IdGenerator.chartId();
            try {
                byte[] image = generateChart(chartData);
                String path = reportStorage.saveChart(reportId, chartId, image);
                charts.add(GeneratedChart.builder()
                        .id(chartId)
                        .config(chartData)
                        .imageBytes(image)
                        .imagePath(path)
                        .build());
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to render chart, skipping: reportId={}, title='{}', error={}",
                        reportId, suggestion.getTitle(), e.getMessage());
            }
        }
        log.info("Charts generated: reportId={}, rendered={}, suggested={}, rows={}",
                reportId, charts.size(), suggestions.size(), profile.getRowCount());
        return charts;
    }

    /**
     * ChartData 타입에 따라 적절한 차트 생성
     */
    public byte[] generateChart(ChartData chartData) throws IOException {
        return switch (chartData.getChartType()) {
            case PIE -> generatePieChart(chartData, false);
            case DONUT -> generatePieChart(chartData, true);
            case BAR -> generateBarChart(chartData, false);
            case STACKED_BAR -> generateBarChart(chartData, true);
            case LINE -> generateLineChart(chartData);
            case AREA -> generateAreaChart(chartData);
            case TABLE -> throw new IllegalArgumentException("Table suggestions have no chart image");
        };
    }

    /**
     * 파이/도넛 차트 생성
     */
    byte[] generatePieChart(ChartData chartData, boolean ring) throws IOException {
        DefaultPieDataset<String> dataset = new DefaultPieDataset<>();
        List<String> labels = chartData.getLabels();
        List<Double> values = chartData.getSeries().get(0).getData();
        for (int i = 0; i < labels.size(); i++) {
            dataset.setValue(labels.get(i), values.get(i));
        }

        JFreeChart chart = ring
                ? ChartFactory.createRingChart(chartData.getTitle(), dataset, true, false, false)
                : ChartFactory.createPieChart(chartData.getTitle(), dataset, true, false, false);
        styleTitle(chart);

        @SuppressWarnings("unchecked")
        PiePlot<String> plot = (PiePlot<String>) chart.getPlot();
        plot.setBackgroundPaint(BACKGROUND_COLOR);
        plot.setOutlineVisible(false);
        plot.setShadowPaint(null);
        plot.setLabelFont(new Font("SansSerif", Font.PLAIN, 12));
        plot.setLabelPaint(TEXT_COLOR);
        if (plot instanceof RingPlot ringPlot) {
            ringPlot.setSectionDepth(0.4);
        }
        for (int i = 0; i < labels.size(); i++) {
            plot.setSectionPaint(labels.get(i), DEFAULT_COLORS[i % DEFAULT_COLORS.length]);
        }

        return chartToBytes(chart, chartData.getWidth(), chartData.getHeight());
    }

    /**
     * 막대/누적 막대 차트 생성
     */
    byte[] generateBarChart(ChartData chartData, boolean stacked) throws IOException {
        DefaultCategoryDataset dataset = toCategoryDataset(chartData);
        boolean legend = chartData.getSeries().size() > 1;

        JFreeChart chart = stacked
                ? ChartFactory.createStackedBarChart(chartData.getTitle(), chartData.getXAxisLabel(),
                        chartData.getYAxisLabel(), dataset, PlotOrientation.VERTICAL, legend, false, false)
                : ChartFactory.createBarChart(chartData.getTitle(), chartData.getXAxisLabel(),
                        chartData.getYAxisLabel(), dataset, PlotOrientation.VERTICAL, legend, false, false);
        styleTitle(chart);

        CategoryPlot plot = styleCategoryPlot(chart, chartData);
        BarRenderer renderer = (BarRenderer) plot.getRenderer();
        renderer.setBarPainter(new StandardBarPainter());
        renderer.setDrawBarOutline(false);
        renderer.setShadowVisible(false);
        for (int i = 0; i < dataset.getRowCount(); i++) {
            renderer.setSeriesPaint(i, DEFAULT_COLORS[i % DEFAULT_COLORS.length]);
        }

        return chartToBytes(chart, chartData.getWidth(), chartData.getHeight());
    }

    /**
     * 라인 차트 생성
     */
    byte[] generateLineChart(ChartData chartData) throws IOException {
        DefaultCategoryDataset dataset = toCategoryDataset(chartData);

        JFreeChart chart = ChartFactory.createLineChart(chartData.getTitle(), chartData.getXAxisLabel(),
                chartData.getYAxisLabel(), dataset, PlotOrientation.VERTICAL, true, false, false);
        styleTitle(chart);

        CategoryPlot plot = styleCategoryPlot(chart, chartData);
        LineAndShapeRenderer renderer = new LineAndShapeRenderer(true, true);
        for (int i = 0; i < dataset.getRowCount(); i++) {
            renderer.setSeriesPaint(i, DEFAULT_COLORS[i % DEFAULT_COLORS.length]);
            renderer.setSeriesStroke(i, new BasicStroke(2.0f));
        }
        plot.setRenderer(renderer);

        return chartToBytes(chart, chartData.getWidth(), chartData.getHeight());
    }

    /**
     * 영역 차트 생성
     */
    byte[] generateAreaChart(ChartData chartData) throws IOException {
        DefaultCategoryDataset dataset = toCategoryDataset(chartData);

        JFreeChart chart = ChartFactory.createAreaChart(chartData.getTitle(), chartData.getXAxisLabel(),
                chartData.getYAxisLabel(), dataset, PlotOrientation.VERTICAL, false, false, false);
        styleTitle(chart);

        CategoryPlot plot = styleCategoryPlot(chart, chartData);
        plot.setForegroundAlpha(0.65f);
        plot.getRenderer().setSeriesPaint(0, DEFAULT_COLORS[0]);

        return chartToBytes(chart, chartData.getWidth(), chartData.getHeight());
    }

    private DefaultCategoryDataset toCategoryDataset(ChartData chartData) {
        DefaultCategoryDataset dataset = new DefaultCategoryDataset();
        List<String> labels = chartData.getLabels();
        for (ChartData.DataSeries series : chartData.getSeries()) {
            List<Double> data = series.getData();
            for (int i = 0; i < labels.size() && i < data.size(); i++) {
                // 같은 라벨이 반복되면 (예: 같은 날짜) 값이 덮어쓰이지 않도록 위치를 붙인다
                String key = labels.indexOf(labels.get(i)) == i ? labels.get(i) : labels.get(i) + " #" + (i + 1);
                dataset.addValue(data.get(i), series.getName(), key);
            }
        }
        return dataset;
    }

    private CategoryPlot styleCategoryPlot(JFreeChart chart, ChartData chartData) {
        CategoryPlot plot = chart.getCategoryPlot();
        plot.setBackgroundPaint(BACKGROUND_COLOR);
        plot.setRangeGridlinePaint(GRID_COLOR);
        plot.setOutlineVisible(false);
        if (chartData.getLabels().size() > ROTATE_LABELS_OVER) {
            plot.getDomainAxis().setCategoryLabelPositions(CategoryLabelPositions.UP_45);
        }
        return plot;
    }

    private void styleTitle(JFreeChart chart) {
        chart.setBackgroundPaint(BACKGROUND_COLOR);
        chart.getTitle().setPaint(TEXT_COLOR);
        chart.getTitle().setFont(TITLE_FONT);
    }

    /**
     * JFreeChart를 PNG 바이트 배열로 변환
     */
    private byte[] chartToBytes(JFreeChart chart, int width, int height) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ChartUtils.writeChartAsPNG(baos, chart, width, height);
        return baos.toByteArray();
    }
}
