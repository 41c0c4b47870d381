package com.insightreport.generator.service.report;

import com.itextpdf.io.font.PdfEncodings;
import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.io.image.ImageDataFactory;
import com.itextpdf.kernel.colors.ColorConstants;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfDocumentInfo;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.borders.Border;
import com.itextpdf.layout.borders.SolidBorder;
import com.itextpdf.layout.element.AreaBreak;
import com.itextpdf.layout.element.Cell;
import com.itextpdf.layout.element.Image;
import com.itextpdf.layout.element.List;
import com.itextpdf.layout.element.ListItem;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Table;
import com.itextpdf.layout.properties.HorizontalAlignment;
import com.itextpdf.layout.properties.ListNumberingType;
import com.itextpdf.layout.properties.TextAlignment;
import com.itextpdf.layout.properties.UnitValue;
import com.itextpdf.layout.properties.VerticalAlignment;
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
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * PDF 생성 엔진
 *
 * iText 7 레이아웃 문서로 표지, 요약, 주요 발견, 본문, 차트, 데이터 요약, 권고 순으로 구성합니다.
 */
@Component
@Slf4j
public class PdfReportRenderer implements DocumentRenderer {

    // 색상 상수
    private static final DeviceRgb NEUTRAL_COLOR = new DeviceRgb(107, 114, 128);   // Gray
    private static final DeviceRgb LIGHT_BG = new DeviceRgb(248, 250, 252);        // Light Gray BG
    private static final DeviceRgb TEXT_COLOR = new DeviceRgb(30, 41, 59);

    // 선택적 유니코드 폰트 (클래스패스)
    private static final String FONT_REGULAR = "fonts/report-regular.ttf";
    private static final String FONT_BOLD = "fonts/report-bold.ttf";

    @Override
    public OutputFormat format() {
        return OutputFormat.PDF;
    }

    @Override
    public RenderedDocument render(Report report, GeneratedNarrative narrative,
                                   java.util.List<GeneratedChart> charts, DataProfile profile) {
        ReportTheme theme = ReportTheme.of(report.getStyle(), report.getBranding());
        DeviceRgb primary = rgb(theme.primaryColor());
        DeviceRgb accent = rgb(theme.accentColor());

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PdfDocument pdf = new PdfDocument(new PdfWriter(baos));
        PdfDocumentInfo info = pdf.getDocumentInfo();
        info.setTitle(report.getTitle());
        if (report.getAuthorName() != null) {
            info.setAuthor(report.getAuthorName());
        }

        // 페이지 번호를 나중에 쓰기 위해 즉시 flush 하지 않는다
        Document document = new Document(pdf, PageSize.A4, false);
        try {
            PdfFont regularFont = loadFont(FONT_REGULAR, StandardFonts.HELVETICA);
            PdfFont boldFont = loadFont(FONT_BOLD, StandardFonts.HELVETICA_BOLD);
            document.setFont(regularFont);
            document.setMargins(50, 50, 50, 50);

            // 1. 표지
            addCoverPage(document, boldFont, report, narrative, primary, accent);

            // 2. 요약
            document.add(createSectionTitle("Executive Summary", boldFont, primary, accent));
            addParagraphs(document, narrative.getExecutiveSummary());

            // 3. 주요 발견
            if (!narrative.getKeyFindings().isEmpty()) {
                document.add(createSectionTitle("Key Findings", boldFont, primary, accent));
                document.add(createList(narrative.getKeyFindings()));
            }

            // 4. 본문
            for (GeneratedInsight section : narrative.getSections()) {
                document.add(createSectionTitle(section.getSectionTitle(), boldFont, primary, accent));
                addParagraphs(document, section.getContent());
            }

            // 5. 차트
            if (!charts.isEmpty()) {
                document.add(createSectionTitle("Visualizations", boldFont, primary, accent));
                for (GeneratedChart chart : charts) {
                    addChartImage(document, chart.getImageBytes(), chart.getConfig().getTitle());
                }
            }

            // 6. 데이터 요약
            addDataSummary(document, boldFont, regularFont, profile, primary, accent);

            // 7. 권고
            if (!narrative.getRecommendations().isEmpty()) {
                document.add(createSectionTitle("Recommendations", boldFont, primary, accent));
                document.add(createList(narrative.getRecommendations()));
            }

            addPageNumbers(document, pdf, regularFont);
        } catch (IOException e) {
            throw new ReportPipelineException("PDF_RENDER_ERROR", "PDF rendering failed: " + e.getMessage(),
                    report.getId(), e);
        } finally {
            document.close();
        }

        byte[] bytes = baos.toByteArray();
        log.debug("PDF rendered: reportId={}, size={}", report.getId(), bytes.length);
        return new RenderedDocument(OutputFormat.PDF, bytes);
    }

    /**
     * 표지 페이지 추가
     */
    private void addCoverPage(Document document, PdfFont boldFont, Report report, GeneratedNarrative narrative,
                              DeviceRgb primary, DeviceRgb accent) {
        if (narrative.getCoverImage() != null) {
            try {
                document.add(new Image(ImageDataFactory.create(narrative.getCoverImage()))
                        .setMaxWidth(UnitValue.createPercentValue(100))
                        .setMaxHeight(280)
                        .setHorizontalAlignment(HorizontalAlignment.CENTER)
                        .setMarginBottom(30));
            } catch (RuntimeException e) {
                log.warn("Failed to add cover image: reportId={}, error={}", report.getId(), e.getMessage());
            }
        } else {
            document.add(new Paragraph("\n\n\n\n\n\n"));
        }

        document.add(new Paragraph(RenderSupport.companyName(report))
                .setFont(boldFont)
                .setFontSize(12)
                .setFontColor(accent));

        document.add(new Paragraph(report.getTitle())
                .setFont(boldFont)
                .setFontSize(30)
                .setFontColor(primary)
                .setMarginBottom(20));

        String meta = RenderSupport.styleLabel(report.getStyle()) + "  |  " + RenderSupport.reportDate(report)
                + (report.getAuthorName() != null ? "  |  " + report.getAuthorName() : "");
        document.add(new Paragraph(meta)
                .setFontSize(12)
                .setFontColor(NEUTRAL_COLOR)
                .setBorderTop(new SolidBorder(accent, 3))
                .setPaddingTop(10));

        document.add(new AreaBreak());
    }

    private void addDataSummary(Document document, PdfFont boldFont, PdfFont regularFont, DataProfile profile,
                                DeviceRgb primary, DeviceRgb accent) {
        document.add(createSectionTitle("Data Summary", boldFont, primary, accent));

        Table stats = new Table(UnitValue.createPercentArray(3)).useAllAvailableWidth();
        stats.addCell(createStatCell("Records", String.valueOf(profile.getRowCount()), boldFont, regularFont, primary));
        stats.addCell(createStatCell("Columns", String.valueOf(profile.getColumnCount()), boldFont, regularFont, primary));
        stats.addCell(createStatCell("Data Quality", profile.getDataQualityScore() + "%", boldFont, regularFont, primary));
        document.add(stats.setMarginBottom(15));

        java.util.List<ColumnProfile> numeric = RenderSupport.numericColumns(profile);
        if (numeric.isEmpty()) {
            return;
        }
        Table table = new Table(UnitValue.createPercentArray(RenderSupport.SUMMARY_HEADERS.size())).useAllAvailableWidth();
        RenderSupport.SUMMARY_HEADERS.forEach(h -> table.addHeaderCell(createHeaderCell(h, boldFont, primary)));
        for (ColumnProfile column : numeric) {
            RenderSupport.summaryRow(column).forEach(v -> table.addCell(createDataCell(v, regularFont)));
        }
        document.add(table);
    }

    // ===== 헬퍼 메서드 =====

    private PdfFont loadFont(String fontPath, String fallback) throws IOException {
        try (InputStream resource = getClass().getClassLoader().getResourceAsStream(fontPath)) {
            if (resource == null) {
                return PdfFontFactory.createFont(fallback);
            }
            return PdfFontFactory.createFont(resource.readAllBytes(), PdfEncodings.IDENTITY_H);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load font from {}, using {}: {}", fontPath, fallback, e.getMessage());
            return PdfFontFactory.createFont(fallback);
        }
    }

    private Paragraph createSectionTitle(String title, PdfFont boldFont, DeviceRgb primary, DeviceRgb accent) {
        return new Paragraph(title)
                .setFont(boldFont)
                .setFontSize(18)
                .setFontColor(primary)
                .setMarginTop(20)
                .setMarginBottom(15)
                .setBorderBottom(new SolidBorder(accent, 2))
                .setPaddingBottom(10);
    }

    private void addParagraphs(Document document, String content) {
        for (String paragraph : RenderSupport.paragraphs(content)) {
            document.add(new Paragraph(paragraph)
                    .setFontSize(11)
                    .setFontColor(TEXT_COLOR)
                    .setTextAlignment(TextAlignment.JUSTIFIED)
                    .setMarginBottom(8));
        }
    }

    private List createList(java.util.List<String> items) {
        List list = new List(ListNumberingType.DECIMAL).setSymbolIndent(10).setFontSize(11);
        items.forEach(item -> list.add(new ListItem(item)));
        return list;
    }

    private Cell createStatCell(String label, String value, PdfFont boldFont, PdfFont regularFont, DeviceRgb color) {
        Cell cell = new Cell()
                .setBorder(Border.NO_BORDER)
                .setBackgroundColor(LIGHT_BG)
                .setPadding(15)
                .setTextAlignment(TextAlignment.CENTER);

        cell.add(new Paragraph(value)
                .setFont(boldFont)
                .setFontSize(22)
                .setFontColor(color));

        cell.add(new Paragraph(label)
                .setFont(regularFont)
                .setFontSize(10)
                .setFontColor(NEUTRAL_COLOR));

        return cell;
    }

    private Cell createHeaderCell(String text, PdfFont boldFont, DeviceRgb primary) {
        return new Cell()
                .add(new Paragraph(text).setFont(boldFont).setFontSize(10).setFontColor(ColorConstants.WHITE))
                .setBackgroundColor(primary)
                .setPadding(6)
                .setTextAlignment(TextAlignment.CENTER);
    }

    private Cell createDataCell(String text, PdfFont regularFont) {
        return new Cell()
                .add(new Paragraph(text != null ? text : "-").setFont(regularFont).setFontSize(10))
                .setPadding(6)
                .setTextAlignment(TextAlignment.RIGHT);
    }

    private void addChartImage(Document document, byte[] imageBytes, String caption) {
        try {
            document.add(new Image(ImageDataFactory.create(imageBytes))
                    .setMaxWidth(450)
                    .setHorizontalAlignment(HorizontalAlignment.CENTER)
                    .setMarginTop(10)
                    .setMarginBottom(10));

            if (caption != null && !caption.isBlank()) {
                document.add(new Paragraph(caption)
                        .setFontSize(10)
                        .setFontColor(NEUTRAL_COLOR)
                        .setTextAlignment(TextAlignment.CENTER)
                        .setMarginBottom(15));
            }
        } catch (RuntimeException e) {
            log.warn("Failed to add chart image '{}': {}", caption, e.getMessage());
        }
    }

    /**
     * 표지를 제외한 페이지 하단 중앙에 "n / total"
     */
    private void addPageNumbers(Document document, PdfDocument pdf, PdfFont font) {
        int numberOfPages = pdf.getNumberOfPages();
        for (int i = 2; i <= numberOfPages; i++) {
            Rectangle pageSize = pdf.getPage(i).getPageSize();
            Paragraph pageNumber = new Paragraph(String.format("%d / %d", i, numberOfPages))
                    .setFont(font)
                    .setFontSize(9)
                    .setFontColor(NEUTRAL_COLOR);
            document.showTextAligned(pageNumber, pageSize.getWidth() / 2, 30, i,
                    TextAlignment.CENTER, VerticalAlignment.BOTTOM, 0);
        }
    }

    private static DeviceRgb rgb(Color color) {
        return new DeviceRgb(color.getRed(), color.getGreen(), color.getBlue());
    }
}
