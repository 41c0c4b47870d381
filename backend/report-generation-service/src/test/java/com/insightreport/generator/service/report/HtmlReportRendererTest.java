package com.insightreport.generator.service.report;

import com.insightreport.generator.dto.report.RenderedDocument;
import com.insightreport.generator.entity.report.OutputFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HtmlReportRenderer 단위 테스트
 */
class HtmlReportRendererTest {

    private final HtmlReportRenderer renderer = new HtmlReportRenderer();

    @Test
    @DisplayName("제목과 본문은 이스케이프되고 차트는 base64 로 인라인된다")
    void rendersSelfContainedPage() {
        // when
        RenderedDocument document = renderer.render(ReportFixtures.report(), ReportFixtures.narrative(),
                ReportFixtures.charts(), ReportFixtures.profile());
        String html = new String(document.bytes(), StandardCharsets.UTF_8);

        // then
        assertThat(document.format()).isEqualTo(OutputFormat.HTML);
        assertThat(document.size()).isEqualTo(document.bytes().length);
        assertThat(html).startsWith("<!DOCTYPE html>")
                .contains("Q1 &lt;Sales&gt; Review")
                .doesNotContain("<Sales>")
                .contains("Acme &amp; Co")
                .contains("data:image/png;base64,")
                .contains("Executive Summary", "Key Findings", "Trends", "Data Summary", "Recommendations")
                .contains("revenue")
                .contains("#112233");
    }

    @Test
    @DisplayName("차트와 발견 사항이 없으면 해당 섹션을 생략한다")
    void omitsEmptySections() {
        var narrative = ReportFixtures.narrative();
        narrative.setKeyFindings(List.of());

        String html = new String(renderer.render(ReportFixtures.report(), narrative, List.of(),
                ReportFixtures.profile()).bytes(), StandardCharsets.UTF_8);

        assertThat(html).doesNotContain("Visualizations").doesNotContain("Key Findings");
    }
}
