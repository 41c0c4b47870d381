package com.insightreport.generator.service.ai;

import com.insightreport.generator.entity.report.ReportStyle;

/**
 * 보고서 생성 프롬프트
 */
final class NarrativePrompts {

    private NarrativePrompts() {
    }

    static String systemPrompt(ReportStyle style, String title, String customInstructions) {
        String extra = customInstructions != null && !customInstructions.isBlank()
                ? "\nAdditional instructions: " + customInstructions + "\n"
                : "";
        return """
                You are an expert report writer specializing in %s reports.
                %s

                Your task is to generate professional, insightful content for a report titled "%s".
                %s
                Respond with valid JSON in this exact format:
                {
                  "executiveSummary": "A concise 2-3 paragraph executive summary",
                  "sections": [
                    {
                      "sectionId": "unique-id",
                      "sectionTitle": "Section Title",
                      "content": "Section content (2-4 paragraphs)",
                      "order": 1
                    }
                  ],
                  "recommendations": ["Recommendation 1", "Recommendation 2"],
                  "keyFindings": ["Finding 1", "Finding 2", "Finding 3"]
                }
                """.formatted(style.getValue(), stylePrompt(style), title, extra);
    }

    static String userPrompt(String dataContext, ReportStyle style) {
        return """
                Based on the following data analysis, generate comprehensive report content:

                DATA PROFILE:
                %s

                Generate a complete narrative with:
                1. Executive Summary - Key takeaways for decision makers
                2. 4-6 detailed sections appropriate for a %s report
                3. 3-5 actionable recommendations
                4. 5-7 key findings

                Ensure all content is data-driven, professional, and appropriate for the %s style.
                """.formatted(dataContext, style.getValue(), style.getValue());
    }

    static String coverImagePrompt(String title, ReportStyle style) {
        String look = switch (style) {
            case BUSINESS -> "corporate, professional, clean lines, blue tones";
            case RESEARCH -> "academic, scientific, data visualization elements";
            case TECHNICAL -> "technology, engineering, circuit patterns, modern";
        };
        return "Abstract " + look + " illustration representing \"" + title + "\". "
                + "No text in image. Suitable as report cover background.";
    }

    static String imagePrompt(String prompt) {
        return "Professional business illustration: " + prompt + ". Clean, modern, corporate style.";
    }

    private static String stylePrompt(ReportStyle style) {
        return switch (style) {
            case BUSINESS -> """
                    Write in a concise, executive-friendly tone. Focus on KPIs, trends, risks, and actionable recommendations.
                    Lead with insights, put details in context. Use clear business language.""";
            case RESEARCH -> """
                    Write in a formal, structured academic tone. Include methodology considerations.
                    Be thorough in analysis, cite data points, discuss limitations. Use precise terminology.""";
            case TECHNICAL -> """
                    Write in a detailed, engineering-focused tone. Include system behaviors, metrics, and technical details.
                    Focus on performance data, error analysis, and root causes. Use technical terminology appropriately.""";
        };
    }
}
