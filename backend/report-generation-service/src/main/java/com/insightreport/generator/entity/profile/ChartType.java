package com.insightreport.generator.entity.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChartType {
    LINE("line"),
    BAR("bar"),
    STACKED_BAR("stacked_bar"),
    PIE("pie"),
    DONUT("donut"),
    AREA("area"),
    TABLE("table");

    private final String value;

    ChartType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ChartType fromValue(String value) {
        for (ChartType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown chart type: " + value);
    }
}
