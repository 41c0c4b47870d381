package com.insightreport.generator.dto.report;

import com.insightreport.generator.entity.report.OutputFormat;

/**
 * Output of a document renderer.
 */
public record RenderedDocument(OutputFormat format, byte[] bytes) {

    public long size() {
        return bytes.length;
    }
}
