package com.insightreport.generator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * AI 사용 비용 단가 (USD)
 */
@Configuration
@ConfigurationProperties(prefix = "report.cost-tracking")
@Data
public class CostTrackingProperties {

    private boolean enabled = true;

    /**
     * 입력 토큰 1K 당 비용
     */
    private double inputCostPer1k = 0.005;

    /**
     * 출력 토큰 1K 당 비용
     */
    private double outputCostPer1k = 0.015;

    /**
     * 이미지 1장 당 비용
     */
    private double imageCostPerImage = 0.040;
}
