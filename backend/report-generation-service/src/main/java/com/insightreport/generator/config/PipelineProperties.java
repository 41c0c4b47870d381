package com.insightreport.generator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Execution limits of the report pipeline.
 *
 * Two independent caps bound resource usage: the number of pipeline
 * instances coordinating at once and the number of activities (AI calls,
 * chart and document rendering) executing at once.
 */
@Configuration
@ConfigurationProperties(prefix = "report.pipeline")
@Data
public class PipelineProperties {

    private int maxConcurrentInstances = 10;

    private int maxConcurrentActivities = 20;

    /**
     * Upper bound for a single activity attempt
     */
    private Duration startToCloseTimeout = Duration.ofMinutes(10);

    /**
     * How often multi-part activities report liveness
     */
    private Duration heartbeatInterval = Duration.ofSeconds(5);

    /**
     * Grace window after which a silent heartbeating activity is treated as crashed
     */
    private Duration heartbeatTimeout = Duration.ofSeconds(30);

    /**
     * Resume unfinished instances found in the checkpoint store at start-up
     */
    private boolean recoverOnStartup = true;

    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private Duration initialInterval = Duration.ofSeconds(1);
        private double backoffCoefficient = 2.0;
        private Duration maximumInterval = Duration.ofSeconds(30);
        private int maximumAttempts = 3;
    }
}
