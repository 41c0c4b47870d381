package com.insightreport.generator.service.report;

import com.insightreport.generator.entity.profile.ColumnProfile;
import com.insightreport.generator.entity.profile.ColumnType;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.report.Report;
import com.insightreport.generator.entity.report.ReportStyle;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 렌더러 공통 포맷팅
 */
final class RenderSupport {

    static final List<String> SUMMARY_HEADERS = List.of("Column", "Min", "Max", "Mean", "Median", "Std Dev");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    private RenderSupport() {
    }

    static List<ColumnProfile> numericColumns(DataProfile profile) {
        return profile.getColumns().stream().filter(c -> c.getType() == ColumnType.NUMERIC).toList();
    }

    static List<String> summaryRow(ColumnProfile column) {
        return List.of(column.getName(), number(column.getMin()), number(column.getMax()),
                number(column.getMean()), number(column.getMedian()), number(column.getStdDev()));
    }

    static String number(Double value) {
        if (value == null) {
            return "-";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.format(Locale.ENGLISH, "%,d", value.longValue());
        }
        return String.format(Locale.ENGLISH, "%,.2f", value);
    }

    static String styleLabel(ReportStyle style) {
        return switch (style != null ? style : ReportStyle.BUSINESS) {
            case BUSINESS -> "Business Report";
            case RESEARCH -> "Research Report";
            case TECHNICAL -> "Technical Report";
        };
    }

    static String reportDate(Report report) {
        LocalDateTime date = report.getCreatedAt() != null ? report.getCreatedAt() : LocalDateTime.now();
        return date.format(DATE_FORMAT);
    }

    static String companyName(Report report) {
        return report.getBranding() != null && report.getBranding().getCompanyName() != null
                ? report.getBranding().getCompanyName()
                : "Insight Report";
    }

    /**
     * 빈 줄 기준 문단 분리
     */
    static List<String> paragraphs(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        return Arrays.stream(content.split("\\n\\s*\\n")).map(String::strip).filter(p -> !p.isEmpty()).toList();
    }
}
