package com.insightreport.generator.entity.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional corporate identity applied by the document renderers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Branding {

    private String companyName;

    /**
     * Hex colour such as {@code #1a365d}
     */
    private String primaryColor;

    private String secondaryColor;

    private String logoUrl;
}
