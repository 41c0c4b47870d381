package com.insightreport.generator.service.report;

import com.insightreport.generator.dto.report.GeneratedChart;
import com.insightreport.generator.dto.report.GeneratedInsight;
import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.dto.report.RenderedDocument;
import com.insightreport.generator.entity.profile.ColumnProfile;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.exception.ReportPipelineException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import javax.imageio.ImageIO;

/**
 * Word(.docx) 보고서. PDF 와 같은 섹션 순서를 따른다.
 */
@Component
@Slf4j
public class DocxReportRenderer implements DocumentRenderer {

    private static final int CHART_WIDTH_PT = 450;
    private static final String TEXT_COLOR = "1A202C";
    private static final String NEUTRAL_COLOR = "6B7280";

    @Override
    public OutputFormat format() {
        return OutputFormat.DOCX;
    }

    @Override
    public RenderedDocument render(Report report, GeneratedNarrative narrative, List<GeneratedChart> charts,
                                   DataProfile profile) {
        ReportTheme theme = ReportTheme.of(report.getStyle(), report.getBranding());
        String primary = ReportTheme.bareHex(theme.primary());
        String accent = ReportTheme.bareHex(theme.accent());

        try (XWPFDocument document = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            document.getProperties().getCoreProperties().setTitle(report.getTitle());
            if (report.getAuthorName() != null) {
                document.getProperties().getCoreProperties().setCreator(report.getAuthorName());
            }

            addCover(document, report, narrative, primary, accent);

            addHeading(document, "Executive Summary", primary);
            addParagraphs(document, narrative.getExecutiveSummary());

            if (!narrative.getKeyFindings().isEmpty()) {
                addHeading(document, "Key Findings", primary);
                addNumbered(document, narrative.getKeyFindings());
            }

            for (GeneratedInsight section : narrative.getSections()) {
                addHeading(document, section.getSectionTitle(), primary);
                addParagraphs(document, section.getContent());
            }

            if (!charts.isEmpty()) {
                addHeading(document, "Visualizations", primary);
                for (GeneratedChart chart : charts) {
                    addImage(document, chart.getImageBytes(), chart.getId() + ".png", chart.getConfig().getTitle());
                }
            }

            addDataSummary(document, profile, primary);

            if (!narrative.getRecommendations().isEmpty()) {
                addHeading(document, "Recommendations", primary);
                addNumbered(document, narrative.getRecommendations());
            }

            document.write(out);
            byte[] bytes = out.toByteArray();
            log.debug("DOCX rendered: reportId={}, size={}", report.getId(), bytes.length);
            return new RenderedDocument(OutputFormat.DOCX, bytes);
        } catch (IOException e) {
            throw new ReportPipelineException("DOCX_RENDER_ERROR", "DOCX rendering failed: " + e.getMessage(),
                    report.getId(), e);
        }
    }

    private void addCover(XWPFDocument document, Report report, GeneratedNarrative narrative,
                          String primary, String accent) {
        if (narrative.getCoverImage() != null) {
            addImage(document, narrative.getCoverImage(), "cover.png", null);
        }

        XWPFRun company = document.createParagraph().createRun();
        company.setText(RenderSupport.companyName(report));
        company.setBold(true);
        company.setColor(accent);
        company.setFontSize(12);

        XWPFParagraph titleParagraph = document.createParagraph();
        titleParagraph.setSpacingAfter(300);
        XWPFRun title = titleParagraph.createRun();
        title.setText(report.getTitle());
        title.setBold(true);
        title.setFontSize(28);
        title.setColor(primary);

        XWPFRun meta = document.createParagraph().createRun();
        meta.setText(RenderSupport.styleLabel(report.getStyle()) + "  |  " + RenderSupport.reportDate(report)
                + (report.getAuthorName() != null ? "  |  " + report.getAuthorName() : ""));
        meta.setColor(NEUTRAL_COLOR);
        meta.setFontSize(11);
        meta.addBreak(BreakType.PAGE);
    }

    private void addDataSummary(XWPFDocument document, DataProfile profile, String primary) {
        addHeading(document, "Data Summary", primary);
        XWPFRun stats = document.createParagraph().createRun();
        stats.setText("Records: " + profile.getRowCount()
                + "    Columns: " + profile.getColumnCount()
                + "    Data Quality: " + profile.getDataQualityScore() + "%");
        stats.setColor(TEXT_COLOR);

        List<ColumnProfile> numeric = RenderSupport.numericColumns(profile);
        if (numeric.isEmpty()) {
            return;
        }

        XWPFTable table = document.createTable(numeric.size() + 1, RenderSupport.SUMMARY_HEADERS.size());
        table.setWidth("100%");
        XWPFTableRow header = table.getRow(0);
        for (int c = 0; c < RenderSupport.SUMMARY_HEADERS.size(); c++) {
            header.getCell(c).setColor(primary);
            XWPFRun run = header.getCell(c).getParagraphs().get(0).createRun();
            run.setText(RenderSupport.SUMMARY_HEADERS.get(c));
            run.setBold(true);
            run.setColor("FFFFFF");
        }
        for (int r = 0; r < numeric.size(); r++) {
            List<String> values = RenderSupport.summaryRow(numeric.get(r));
            XWPFTableRow row = table.getRow(r + 1);
            for (int c = 0; c < values.size(); c++) {
                row.getCell(c).setText(values.get(c));
            }
        }
    }

    private void addHeading(XWPFDocument document, String text, String primary) {
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setSpacingBefore(360);
        paragraph.setSpacingAfter(120);
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        run.setBold(true);
        run.setFontSize(16);
        run.setColor(primary);
    }

    private void addParagraphs(XWPFDocument document, String content) {
        for (String text : RenderSupport.paragraphs(content)) {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.setAlignment(ParagraphAlignment.BOTH);
            XWPFRun run = paragraph.createRun();
            String[] lines = text.split("\n");
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    run.addBreak();
                }
                run.setText(lines[i]);
            }
            run.setFontSize(11);
            run.setColor(TEXT_COLOR);
        }
    }

    private void addNumbered(XWPFDocument document, List<String> items) {
        for (int i = 0; i < items.size(); i++) {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.setIndentationLeft(360);
            XWPFRun run = paragraph.createRun();
            run.setText((i + 1) + ". " + items.get(i));
            run.setFontSize(11);
        }
    }

    private void addImage(XWPFDocument document, byte[] imageBytes, String name, String caption) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
            if (image == null) {
                log.warn("Unreadable image skipped: {}", name);
                return;
            }
            int width = Math.min(CHART_WIDTH_PT, image.getWidth());
            int height = (int) Math.round((double) image.getHeight() * width / image.getWidth());
            int pictureType = isPng(imageBytes) ? Document.PICTURE_TYPE_PNG : Document.PICTURE_TYPE_JPEG;

            XWPFParagraph paragraph = document.createParagraph();
            paragraph.setAlignment(ParagraphAlignment.CENTER);
            paragraph.createRun().addPicture(new ByteArrayInputStream(imageBytes), pictureType, name,
                    Units.toEMU(width), Units.toEMU(height));

            if (caption != null && !caption.isBlank()) {
                XWPFParagraph captionParagraph = document.createParagraph();
                captionParagraph.setAlignment(ParagraphAlignment.CENTER);
                XWPFRun run = captionParagraph.createRun();
                run.setText(caption);
                run.setFontSize(9);
                run.setColor(NEUTRAL_COLOR);
            }
        } catch (IOException | InvalidFormatException e) {
            log.warn("Failed to add image '{}': {}", name, e.getMessage());
        }
    }

    private static boolean isPng(byte[] bytes) {
        return bytes.length > 4 && (bytes[0] & 0xFF) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G';
    }
}
