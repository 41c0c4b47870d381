package com.insightreport.generator.service.report;

import com.insightreport.generator.dto.report.GeneratedChart;
import com.insightreport.generator.dto.report.GeneratedInsight;
import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.dto.report.RenderedDocument;
import com.insightreport.generator.entity.profile.ColumnProfile;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.springframework.web.util.HtmlUtils.htmlEscape;

/**
 * 단일 파일 HTML 보고서 (차트는 base64 PNG 로 인라인)
 */
@Component
@Slf4j
public class HtmlReportRenderer implements DocumentRenderer {

    @Override
    public OutputFormat format() {
        return OutputFormat.HTML;
    }

    @Override
    public RenderedDocument render(Report report, GeneratedNarrative narrative, List<GeneratedChart> charts,
                                   DataProfile profile) {
        ReportTheme theme = ReportTheme.of(report.getStyle(), report.getBranding());
        StringBuilder html = new StringBuilder(16 * 1024);

        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n")
                .append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
                .append("<title>").append(htmlEscape(report.getTitle())).append("</title>\n")
                .append("<style>\n").append(css(theme)).append("</style>\n</head>\n<body>\n");

        appendCover(html, report, narrative);
        appendExecutiveSummary(html, narrative);
        appendKeyFindings(html, narrative.getKeyFindings());
        for (GeneratedInsight section : narrative.getSections()) {
            appendSection(html, section);
        }
        appendCharts(html, charts);
        appendDataSummary(html, profile);
        appendRecommendations(html, narrative.getRecommendations());

        html.append("<footer class=\"footer\">").append(htmlEscape(RenderSupport.companyName(report)))
                .append(" &middot; ").append(htmlEscape(RenderSupport.reportDate(report)))
                .append("</footer>\n</body>\n</html>\n");

        byte[] bytes = html.toString().getBytes(StandardCharsets.UTF_8);
        log.debug("HTML rendered: reportId={}, size={}", report.getId(), bytes.length);
        return new RenderedDocument(OutputFormat.HTML, bytes);
    }

    private void appendCover(StringBuilder html, Report report, GeneratedNarrative narrative) {
        html.append("<section class=\"cover\">\n");
        if (narrative.getCoverImage() != null) {
            html.append("<img class=\"cover-image\" alt=\"\" src=\"data:image/png;base64,")
                    .append(Base64.getEncoder().encodeToString(narrative.getCoverImage())).append("\">\n");
        }
        html.append("<span class=\"badge\">").append(htmlEscape(RenderSupport.companyName(report))).append("</span>\n")
                .append("<h1>").append(htmlEscape(report.getTitle())).append("</h1>\n")
                .append("<p class=\"meta\">").append(htmlEscape(RenderSupport.styleLabel(report.getStyle())))
                .append(" &middot; ").append(htmlEscape(RenderSupport.reportDate(report)));
        if (report.getAuthorName() != null) {
            html.append(" &middot; ").append(htmlEscape(report.getAuthorName()));
        }
        html.append("</p>\n</section>\n");
    }

    private void appendExecutiveSummary(StringBuilder html, GeneratedNarrative narrative) {
        html.append("<section>\n<h2>Executive Summary</h2>\n");
        appendParagraphs(html, narrative.getExecutiveSummary());
        html.append("</section>\n");
    }

    private void appendKeyFindings(StringBuilder html, List<String> findings) {
        if (findings.isEmpty()) {
            return;
        }
        html.append("<section>\n<h2>Key Findings</h2>\n");
        appendList(html, findings, "findings");
        html.append("</section>\n");
    }

    private void appendSection(StringBuilder html, GeneratedInsight section) {
        html.append("<section id=\"").append(htmlEscape(section.getSectionId())).append("\">\n<h2>")
                .append(htmlEscape(section.getSectionTitle())).append("</h2>\n");
        appendParagraphs(html, section.getContent());
        html.append("</section>\n");
    }

    private void appendCharts(StringBuilder html, List<GeneratedChart> charts) {
        if (charts.isEmpty()) {
            return;
        }
        html.append("<section>\n<h2>Visualizations</h2>\n");
        for (GeneratedChart chart : charts) {
            html.append("<figure class=\"chart\">\n<img alt=\"").append(htmlEscape(chart.getConfig().getTitle()))
                    .append("\" src=\"data:image/png;base64,")
                    .append(Base64.getEncoder().encodeToString(chart.getImageBytes())).append("\">\n<figcaption>")
                    .append(htmlEscape(chart.getConfig().getTitle())).append("</figcaption>\n</figure>\n");
        }
        html.append("</section>\n");
    }

    private void appendDataSummary(StringBuilder html, DataProfile profile) {
        html.append("<section>\n<h2>Data Summary</h2>\n<div class=\"stats\">")
                .append(stat(String.valueOf(profile.getRowCount()), "Records"))
                .append(stat(String.valueOf(profile.getColumnCount()), "Columns"))
                .append(stat(profile.getDataQualityScore() + "%", "Data Quality"))
                .append("</div>\n");

        List<ColumnProfile> numeric = RenderSupport.numericColumns(profile);
        if (!numeric.isEmpty()) {
            html.append("<table>\n<thead><tr>");
            RenderSupport.SUMMARY_HEADERS.forEach(h -> html.append("<th>").append(htmlEscape(h)).append("</th>"));
            html.append("</tr></thead>\n<tbody>\n");
            for (ColumnProfile column : numeric) {
                html.append("<tr>");
                RenderSupport.summaryRow(column).forEach(v -> html.append("<td>").append(htmlEscape(v)).append("</td>"));
                html.append("</tr>\n");
            }
            html.append("</tbody>\n</table>\n");
        }
        html.append("</section>\n");
    }

    private void appendRecommendations(StringBuilder html, List<String> recommendations) {
        if (recommendations.isEmpty()) {
            return;
        }
        html.append("<section>\n<h2>Recommendations</h2>\n");
        appendList(html, recommendations, "recommendations");
        html.append("</section>\n");
    }

    private void appendParagraphs(StringBuilder html, String content) {
        for (String paragraph : RenderSupport.paragraphs(content)) {
            html.append("<p>").append(htmlEscape(paragraph).replace("\n", "<br>")).append("</p>\n");
        }
    }

    private void appendList(StringBuilder html, List<String> items, String cssClass) {
        html.append("<ol class=\"").append(cssClass).append("\">\n");
        items.forEach(item -> html.append("<li>").append(htmlEscape(item)).append("</li>\n"));
        html.append("</ol>\n");
    }

    private String stat(String value, String label) {
        return "<div class=\"stat\"><span class=\"stat-value\">" + htmlEscape(value)
                + "</span><span class=\"stat-label\">" + htmlEscape(label) + "</span></div>";
    }

    private String css(ReportTheme theme) {
        return """
                :root { --color-primary: %s; --color-secondary: %s; --color-accent: %s; }
                body { font-family: 'Helvetica Neue', Arial, sans-serif; color: #1a202c; max-width: 960px; margin: 0 auto; padding: 0 24px; line-height: 1.6; }
                .cover { padding: 96px 0 64px; border-bottom: 4px solid var(--color-accent); }
                .cover h1 { color: var(--color-primary); font-size: 2.6em; margin: 16px 0; }
                .cover-image { width: 100%%; max-height: 320px; object-fit: cover; border-radius: 8px; }
                .badge { background: var(--color-secondary); color: #fff; padding: 4px 12px; border-radius: 12px; font-size: 0.85em; }
                .meta { color: #4a5568; }
                h2 { color: var(--color-primary); border-bottom: 2px solid var(--color-accent); padding-bottom: 6px; margin-top: 40px; }
                .chart { text-align: center; margin: 24px 0; }
                .chart img { max-width: 100%%; }
                figcaption { color: #4a5568; font-size: 0.9em; }
                .stats { display: flex; gap: 16px; margin: 16px 0; }
                .stat { flex: 1; background: #f7fafc; padding: 16px; text-align: center; border-radius: 8px; }
                .stat-value { display: block; font-size: 1.8em; font-weight: bold; color: var(--color-secondary); }
                .stat-label { color: #4a5568; font-size: 0.9em; }
                table { width: 100%%; border-collapse: collapse; }
                th { background: var(--color-primary); color: #fff; padding: 8px; }
                td { border-bottom: 1px solid #e2e8f0; padding: 8px; text-align: right; }
                td:first-child { text-align: left; }
                .footer { margin: 48px 0 24px; color: #718096; font-size: 0.85em; text-align: center; }
                """.formatted(theme.primary(), theme.secondary(), theme.accent());
    }
}
