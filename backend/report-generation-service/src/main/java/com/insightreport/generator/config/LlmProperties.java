package com.insightreport.generator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI-compatible endpoint used for narratives and cover images.
 */
@Configuration
@ConfigurationProperties(prefix = "report.llm")
@Data
public class LlmProperties {

    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey;

    private String model = "gpt-4o";

    private String imageModel = "dall-e-3";

    private int maxTokens = 4096;

    private double temperature = 0.7;

    private int timeoutSeconds = 120;

    /**
     * Records sampled into the narrative prompt
     */
    private int sampleRecords = 50;
}
