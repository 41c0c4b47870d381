package com.insightreport.generator.entity.report;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Document formats a report can be exported to.
 */
public enum OutputFormat {
    PDF("pdf", "application/pdf"),
    DOCX("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
    HTML("html", "text/html");

    private final String extension;
    private final String contentType;

    OutputFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String getExtension() {
        return extension;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * Output file name for the given report, e.g. {@code abc123.pdf}
     */
    public String fileName(String reportId) {
        return reportId + "." + extension;
    }

    /**
     * Accepts the extension or the constant name, case-insensitively.
     */
    @JsonCreator
    public static OutputFormat fromValue(String value) {
        if (value != null) {
            for (OutputFormat format : values()) {
                if (format.extension.equalsIgnoreCase(value.trim()) || format.name().equalsIgnoreCase(value.trim())) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + value);
    }
}
