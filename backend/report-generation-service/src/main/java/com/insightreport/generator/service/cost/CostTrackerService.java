package com.insightreport.generator.service.cost;

import com.insightreport.generator.config.CostTrackingProperties;
import com.insightreport.generator.entity.cost.AggregatedCosts;
import com.insightreport.generator.entity.cost.CostMetrics;
import com.insightreport.generator.entity.cost.TokenUsage;
import com.insightreport.generator.service.storage.ReportStorage;
import com.insightreport.generator.util.StripedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 보고서별 AI 사용량 원장
 *
 * 각 호출의 사용량을 누적하고 누적 합계로부터 비용을 다시 계산한다.
 * 같은 보고서에 대한 읽기-수정-쓰기는 보고서별 잠금으로 직렬화된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostTrackerService {

    private static final int COST_SCALE = 4;

    private final ReportStorage reportStorage;
    private final CostTrackingProperties properties;

    private final StripedLocks locks = new StripedLocks();

    /**
     * 사용량 누적
     */
    public CostMetrics trackUsage(String reportId, TokenUsage usage) {
        ReentrantLock lock = locks.get(reportId);
        lock.lock();
        try {
            CostMetrics existing = reportStorage.getCostMetrics(reportId).orElseGet(() -> CostMetrics.zero(reportId));

            long promptTokens = existing.getPromptTokens() + orZero(usage.getPromptTokens());
            long completionTokens = existing.getCompletionTokens() + orZero(usage.getCompletionTokens());
            long images = existing.getImagesGenerated() + orZero(usage.getImagesGenerated());

            CostMetrics updated = CostMetrics.builder()
                    .reportId(reportId)
                    .updatedAt(LocalDateTime.now())
                    .promptTokens(promptTokens)
                    .completionTokens(completionTokens)
                    .totalTokens(promptTokens + completionTokens)
                    .imagesGenerated(images)
                    .estimatedCost(calculateCost(promptTokens, completionTokens, images))
                    .build();

            reportStorage.saveCostMetrics(updated);
            log.info("Cost tracked: reportId={}, tokens={}, cost={}",
                    reportId, updated.getTotalTokens(), updated.getEstimatedCost());
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CostMetrics> getCostMetrics(String reportId) {
        return reportStorage.getCostMetrics(reportId);
    }

    /**
     * 전체 보고서 비용 집계
     */
    public AggregatedCosts getAggregatedCosts() {
        List<CostMetrics> all = reportStorage.listCostMetrics();

        long totalTokens = all.stream().mapToLong(CostMetrics::getTotalTokens).sum();
        double totalCost = round(all.stream().mapToDouble(CostMetrics::getEstimatedCost).sum());
        double average = all.isEmpty() ? 0 : round(totalCost / all.size());

        return AggregatedCosts.builder()
                .totalReports(all.size())
                .totalTokens(totalTokens)
                .totalCost(totalCost)
                .averageCostPerReport(average)
                .build();
    }

    double calculateCost(long promptTokens, long completionTokens, long images) {
        if (!properties.isEnabled()) {
            return 0;
        }
        double inputCost = (promptTokens / 1000.0) * properties.getInputCostPer1k();
        double outputCost = (completionTokens / 1000.0) * properties.getOutputCostPer1k();
        double imageCost = images * properties.getImageCostPerImage();
        return round(inputCost + outputCost + imageCost);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(COST_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
