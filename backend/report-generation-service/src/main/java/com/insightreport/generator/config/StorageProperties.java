package com.insightreport.generator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Local storage layout. Sub-directories are resolved against {@code basePath}.
 */
@Configuration
@ConfigurationProperties(prefix = "report.storage")
@Data
public class StorageProperties {

    private String basePath = "./storage";

    private String reportsDir = "reports";

    private String outputsDir = "outputs";

    private String chartsDir = "charts";

    private String costsDir = "costs";

    private String workflowsDir = "workflows";
}
