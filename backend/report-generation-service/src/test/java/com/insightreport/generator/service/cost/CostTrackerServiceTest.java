package com.insightreport.generator.service.cost;

import com.insightreport.generator.config.CostTrackingProperties;
import com.insightreport.generator.entity.cost.AggregatedCosts;
import com.insightreport.generator.entity.cost.CostMetrics;
import com.insightreport.generator.entity.cost.TokenUsage;
import com.insightreport.generator.service.storage.ReportStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

/**
 * CostTrackerService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class CostTrackerServiceTest {

    @Mock
    private ReportStorage reportStorage;

    private CostTrackingProperties properties;
    private CostTrackerService costTrackerService;

    private final Map<String, CostMetrics> ledger = new HashMap<>();

    @BeforeEach
    void setUp() {
        properties = new CostTrackingProperties();
        costTrackerService = new CostTrackerService(reportStorage, properties);
    }

    private void useInMemoryLedger() {
        when(reportStorage.getCostMetrics(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(ledger.get(invocation.<String>getArgument(0))));
        doAnswer(invocation -> {
            CostMetrics metrics = invocation.getArgument(0);
            ledger.put(metrics.getReportId(), metrics);
            return null;
        }).when(reportStorage).saveCostMetrics(any(CostMetrics.class));
    }

    @Test
    @DisplayName("연속 호출은 누적 합계로 비용을 다시 계산한다")
    void accumulatesUsage() {
        // given
        useInMemoryLedger();

        // when
        costTrackerService.trackUsage("r1", TokenUsage.builder().promptTokens(100L).build());
        CostMetrics metrics = costTrackerService.trackUsage("r1", TokenUsage.builder().completionTokens(50L).build());

        // then
        assertThat(metrics.getPromptTokens()).isEqualTo(100);
        assertThat(metrics.getCompletionTokens()).isEqualTo(50);
        assertThat(metrics.getTotalTokens()).isEqualTo(150);
        assertThat(metrics.getEstimatedCost()).isEqualTo(costTrackerService.calculateCost(100, 50, 0));
        assertThat(metrics.getEstimatedCost()).isEqualTo(0.0013);
    }

    @Test
    @DisplayName("이미지 생성 건수도 누적된다")
    void tracksImages() {
        useInMemoryLedger();

        costTrackerService.trackUsage("r2", TokenUsage.ofImages(1));
        CostMetrics metrics = costTrackerService.trackUsage("r2", TokenUsage.ofImages(1));

        assertThat(metrics.getImagesGenerated()).isEqualTo(2);
        assertThat(metrics.getEstimatedCost()).isEqualTo(0.08);
    }

    @Test
    @DisplayName("비용 추적이 꺼져 있으면 비용은 0 이지만 토큰은 기록된다")
    void disabledTrackingKeepsTokens() {
        useInMemoryLedger();
        properties.setEnabled(false);

        CostMetrics metrics = costTrackerService.trackUsage("r3", TokenUsage.ofTokens(1000, 1000));

        assertThat(metrics.getTotalTokens()).isEqualTo(2000);
        assertThat(metrics.getEstimatedCost()).isZero();
    }

    @Test
    @DisplayName("비용은 소수점 넷째 자리에서 반올림한다")
    void roundsToFourDecimals() {
        assertThat(costTrackerService.calculateCost(1, 0, 0)).isEqualTo(0.0);
        assertThat(costTrackerService.calculateCost(10, 0, 0)).isEqualTo(0.0001);
        assertThat(costTrackerService.calculateCost(1234, 567, 0)).isEqualTo(0.0147);
    }

    @Test
    @DisplayName("전체 집계는 보고서가 없으면 평균 0")
    void aggregateWithoutReports() {
        when(reportStorage.listCostMetrics()).thenReturn(List.of());

        AggregatedCosts costs = costTrackerService.getAggregatedCosts();

        assertThat(costs.getTotalReports()).isZero();
        assertThat(costs.getAverageCostPerReport()).isZero();
    }

    @Test
    @DisplayName("전체 집계는 토큰과 비용을 합산하고 평균을 낸다")
    void aggregateAcrossReports() {
        when(reportStorage.listCostMetrics()).thenReturn(List.of(
                CostMetrics.builder().reportId("a").totalTokens(100).estimatedCost(0.01).build(),
                CostMetrics.builder().reportId("b").totalTokens(300).estimatedCost(0.02).build()));

        AggregatedCosts costs = costTrackerService.getAggregatedCosts();

        assertThat(costs.getTotalReports()).isEqualTo(2);
        assertThat(costs.getTotalTokens()).isEqualTo(400);
        assertThat(costs.getTotalCost()).isEqualTo(0.03);
        assertThat(costs.getAverageCostPerReport()).isEqualTo(0.015);
    }
}
