package com.insightreport.generator.service.report;

import com.insightreport.generator.dto.report.RenderedDocument;
import com.insightreport.generator.entity.report.OutputFormat;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.canvas.parser.PdfTextExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PdfReportRenderer 단위 테스트
 */
class PdfReportRendererTest {

    private final PdfReportRenderer renderer = new PdfReportRenderer();

    @Test
    @DisplayName("표지 다음 페이지부터 본문이 이어지는 PDF 를 만든다")
    void rendersPdf() throws IOException {
        // given
        var narrative = ReportFixtures.narrative();
        narrative.setCoverImage(ReportFixtures.png());

        // when
        RenderedDocument document = renderer.render(ReportFixtures.report(), narrative,
                ReportFixtures.charts(), ReportFixtures.profile());

        // then
        assertThat(document.format()).isEqualTo(OutputFormat.PDF);
        assertThat(new String(document.bytes(), 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");

        try (PdfDocument pdf = new PdfDocument(new PdfReader(new ByteArrayInputStream(document.bytes())))) {
            assertThat(pdf.getNumberOfPages()).isGreaterThanOrEqualTo(2);
            String cover = PdfTextExtractor.getTextFromPage(pdf.getPage(1));
            assertThat(cover).contains("Q1 <Sales> Review");

            StringBuilder text = new StringBuilder();
            for (int page = 2; page <= pdf.getNumberOfPages(); page++) {
                text.append(PdfTextExtractor.getTextFromPage(pdf.getPage(page)));
            }
            assertThat(text.toString()).contains("Executive Summary", "Recommendations");
        }
    }
}
