package com.insightreport.generator.service.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.insightreport.generator.dto.report.InputData;
import com.insightreport.generator.dto.report.ReportConfig;
import com.insightreport.generator.dto.report.StructuredInput;
import com.insightreport.generator.dto.report.UnstructuredInput;
import com.insightreport.generator.entity.report.Branding;
import com.insightreport.generator.entity.report.OutputFormat;
import com.insightreport.generator.entity.report.ReportStyle;
import com.insightreport.generator.exception.ReportValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * 업로드 파일과 폼 필드를 파이프라인 입력으로 변환한다.
 *
 * <ul>
 *   <li>JSON, CSV, XLSX → structured</li>
 *   <li>markdown → unstructured(markdown), 그 외 → unstructured(text)</li>
 * </ul>
 * 형식은 Content-Type 으로 판단하고, 없거나 text/plain, octet-stream 이면 파일 확장자를 본다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadedInputConverter {

    private static final String XLSX_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private final ObjectMapper objectMapper;

    public InputData toInputData(String filename, MediaType contentType, byte[] content) {
        String kind = kindOf(filename, contentType);
        log.debug("Uploaded file classified: filename={}, contentType={}, kind={}, size={}",
                filename, contentType, kind, content.length);

        return switch (kind) {
            case "json" -> structured(StructuredInput.Format.JSON, TextNode.valueOf(utf8(content)));
            case "csv" -> structured(StructuredInput.Format.CSV, TextNode.valueOf(utf8(content)));
            case "xlsx" -> structured(StructuredInput.Format.XLSX,
                    TextNode.valueOf(Base64.getEncoder().encodeToString(content)));
            default -> UnstructuredInput.builder()
                    .format(kind)
                    .content(utf8(content))
                    .build();
        };
    }

    /**
     * 폼 필드로부터 설정을 만든다. 제목 검증은 파이프라인 시작 시 이루어진다.
     *
     * @param outputFormats JSON 배열(["PDF","HTML"]) 또는 쉼표 구분 목록(pdf,html)
     * @param branding      Branding JSON 객체
     */
    public ReportConfig toConfig(String title, String style, String outputFormats, String branding) {
        ReportConfig.ReportConfigBuilder config = ReportConfig.builder()
                .title(title)
                .outputFormats(parseOutputFormats(outputFormats))
                .branding(parseBranding(branding));
        if (StringUtils.hasText(style)) {
            config.style(parseStyle(style));
        }
        return config.build();
    }

    List<OutputFormat> parseOutputFormats(String value) {
        if (!StringUtils.hasText(value)) {
            return new ArrayList<>(List.of(OutputFormat.PDF));
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("[")) {
            try {
                return objectMapper.readValue(trimmed, new TypeReference<List<OutputFormat>>() {
                });
            } catch (JsonProcessingException e) {
                throw new ReportValidationException("Invalid outputFormats: " + e.getOriginalMessage(), e);
            }
        }
        try {
            return new ArrayList<>(Arrays.stream(trimmed.split(","))
                    .map(String::trim)
                    .filter(StringUtils::hasText)
                    .map(OutputFormat::fromValue)
                    .toList());
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException(e.getMessage(), e);
        }
    }

    private ReportStyle parseStyle(String value) {
        try {
            return ReportStyle.fromValue(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException(e.getMessage(), e);
        }
    }

    private Branding parseBranding(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return objectMapper.readValue(value, Branding.class);
        } catch (JsonProcessingException e) {
            throw new ReportValidationException("Invalid branding: " + e.getOriginalMessage(), e);
        }
    }

    private static StructuredInput structured(StructuredInput.Format format, TextNode data) {
        return StructuredInput.builder()
                .format(format)
                .data(data)
                .build();
    }

    static String kindOf(String filename, MediaType contentType) {
        if (contentType != null && !MediaType.APPLICATION_OCTET_STREAM.equalsTypeAndSubtype(contentType)) {
            String type = contentType.getType() + "/" + contentType.getSubtype();
            if (MediaType.APPLICATION_JSON.equalsTypeAndSubtype(contentType)) {
                return "json";
            }
            if ("text/csv".equals(type)) {
                return "csv";
            }
            if (XLSX_CONTENT_TYPE.equals(type)) {
                return "xlsx";
            }
            if (type.contains("markdown")) {
                return "markdown";
            }
            if (!"text/plain".equals(type)) {
                return "text";
            }
        }

        String name = filename != null ? filename.toLowerCase(Locale.ROOT) : "";
        if (name.endsWith(".json")) {
            return "json";
        }
        if (name.endsWith(".csv")) {
            return "csv";
        }
        if (name.endsWith(".xlsx")) {
            return "xlsx";
        }
        if (name.endsWith(".md") || name.endsWith(".markdown")) {
            return "markdown";
        }
        return "text";
    }

    private static String utf8(byte[] content) {
        return new String(content, StandardCharsets.UTF_8);
    }
}
