package com.insightreport.generator.dto.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.insightreport.generator.entity.profile.ColumnType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Tabular input given as a JSON array of objects, CSV text or a base64 xlsx workbook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuredInput implements InputData {

    @Builder.Default
    private String type = "structured";

    @NotNull
    private Format format;

    /**
     * Text payload, or an already parsed JSON array
     */
    @NotNull
    private JsonNode data;

    /**
     * Column name to type, overriding inference
     */
    private Map<String, ColumnType> schemaHints;

    /**
     * xlsx only; first sheet when absent
     */
    private String sheetName;

    public enum Format {
        JSON("json"),
        CSV("csv"),
        XLSX("xlsx");

        private final String value;

        Format(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static Format fromValue(String value) {
            for (Format format : values()) {
                if (format.value.equalsIgnoreCase(value)) {
                    return format;
                }
            }
            throw new IllegalArgumentException("Unknown structured format: " + value);
        }
    }
}
