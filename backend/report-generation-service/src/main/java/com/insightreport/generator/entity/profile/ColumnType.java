package com.insightreport.generator.entity.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inferred type of an input column.
 */
public enum ColumnType {
    NUMERIC("numeric"),
    CATEGORICAL("categorical"),
    DATETIME("datetime"),
    TEXT("text"),
    BOOLEAN("boolean"),
    UNKNOWN("unknown");

    private final String value;

    ColumnType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ColumnType fromValue(String value) {
        for (ColumnType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type: " + value);
    }
}
