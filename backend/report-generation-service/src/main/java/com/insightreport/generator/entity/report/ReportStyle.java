package com.insightreport.generator.entity.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Narrative and visual style of a report.
 */
public enum ReportStyle {
    BUSINESS("business"),
    RESEARCH("research"),
    TECHNICAL("technical");

    private final String value;

    ReportStyle(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ReportStyle fromValue(String value) {
        for (ReportStyle style : values()) {
            if (style.value.equalsIgnoreCase(value)) {
                return style;
            }
        }
        throw new IllegalArgumentException("Unknown report style: " + value);
    }
}
