package com.insightreport.generator.service.report;

import com.insightreport.generator.entity.report.Branding;
import com.insightreport.generator.entity.report.ReportStyle;

import java.awt.Color;

/**
 * 스타일별 색상 (브랜딩 색상이 있으면 우선)
 */
public record ReportTheme(String primary, String secondary, String accent) {

    private static final ReportTheme BUSINESS = new ReportTheme("#1a365d", "#2b6cb0", "#ed8936");
    private static final ReportTheme RESEARCH = new ReportTheme("#2d3748", "#4a5568", "#3182ce");
    private static final ReportTheme TECHNICAL = new ReportTheme("#0d1117", "#161b22", "#58a6ff");

    public static ReportTheme of(ReportStyle style, Branding branding) {
        ReportTheme base = switch (style != null ? style : ReportStyle.BUSINESS) {
            case BUSINESS -> BUSINESS;
            case RESEARCH -> RESEARCH;
            case TECHNICAL -> TECHNICAL;
        };
        if (branding == null) {
            return base;
        }
        return new ReportTheme(
                validHex(branding.getPrimaryColor()) ? branding.getPrimaryColor() : base.primary,
                validHex(branding.getSecondaryColor()) ? branding.getSecondaryColor() : base.secondary,
                base.accent);
    }

    public Color primaryColor() {
        return Color.decode(primary);
    }

    public Color secondaryColor() {
        return Color.decode(secondary);
    }

    public Color accentColor() {
        return Color.decode(accent);
    }

    /**
     * "#RRGGBB" → "RRGGBB"
     */
    public static String bareHex(String hex) {
        return hex.startsWith("#") ? hex.substring(1) : hex;
    }

    static boolean validHex(String value) {
        return value != null && value.matches("^#[0-9a-fA-F]{6}$");
    }
}
