package com.insightreport.generator.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreport.generator.config.LlmProperties;
import com.insightreport.generator.dto.report.GeneratedInsight;
import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.entity.cost.TokenUsage;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.report.ReportStyle;
import com.insightreport.generator.exception.TransientActivityException;
import com.insightreport.generator.service.cost.CostTrackerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 호환 API 기반 보고서 본문/표지 이미지 생성
 */
@Service
@Slf4j
public class OpenAiNarrativeService implements NarrativeGenerator {

    private static final int MAX_TEXT_BLOCKS = 3;
    private static final int MAX_CHART_HINTS = 5;

    private final WebClient llmWebClient;
    private final LlmProperties llmProperties;
    private final CostTrackerService costTrackerService;
    private final ObjectMapper objectMapper;

    public OpenAiNarrativeService(@Qualifier("llmWebClient") WebClient llmWebClient,
                                  LlmProperties llmProperties,
                                  CostTrackerService costTrackerService,
                                  ObjectMapper objectMapper) {
        this.llmWebClient = llmWebClient;
        this.llmProperties = llmProperties;
        this.costTrackerService = costTrackerService;
        this.objectMapper = objectMapper;
    }

    @Override
    public GeneratedNarrative generateNarrative(String reportId,
                                                DataProfile profile,
                                                List<Map<String, Object>> records,
                                                List<String> textBlocks,
                                                ReportStyle style,
                                                String title,
                                                String customInstructions) {
        Map<String, Object> body = Map.of(
                "model", llmProperties.getModel(),
                "temperature", llmProperties.getTemperature(),
                "max_tokens", llmProperties.getMaxTokens(),
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", NarrativePrompts.systemPrompt(style, title, customInstructions)),
                        Map.of("role", "user", "content", NarrativePrompts.userPrompt(
                                buildDataContext(profile, records, textBlocks), style))
                )
        );

        JsonNode response = post("/chat/completions", body);

        JsonNode usage = response.path("usage");
        if (!usage.isMissingNode() && reportId != null) {
            costTrackerService.trackUsage(reportId, TokenUsage.ofTokens(
                    usage.path("prompt_tokens").asLong(), usage.path("completion_tokens").asLong()));
        }

        String content = response.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new TransientActivityException("Empty response from language model");
        }

        try {
            GeneratedNarrative narrative = clean(objectMapper.readValue(content, GeneratedNarrative.class));
            log.info("Generated narrative: reportId={}, sections={}", reportId, narrative.getSections().size());
            return narrative;
        } catch (JsonProcessingException e) {
            throw new TransientActivityException("Narrative generation failed: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public byte[] generateImage(String reportId, String prompt) {
        Map<String, Object> body = Map.of(
                "model", llmProperties.getImageModel(),
                "prompt", NarrativePrompts.imagePrompt(prompt),
                "n", 1,
                "size", "1024x1024",
                "response_format", "b64_json"
        );

        JsonNode response = post("/images/generations", body);
        String imageData = response.path("data").path(0).path("b64_json").asText("");
        if (imageData.isBlank()) {
            throw new TransientActivityException("No image data returned");
        }

        if (reportId != null) {
            costTrackerService.trackUsage(reportId, TokenUsage.ofImages(1));
        }
        log.info("Generated AI image: reportId={}", reportId);

        try {
            return Base64.getDecoder().decode(imageData);
        } catch (IllegalArgumentException e) {
            throw new TransientActivityException("Invalid image payload: " + e.getMessage(), e);
        }
    }

    /**
     * 표지 이미지 프롬프트
     */
    public static String coverImagePrompt(String title, ReportStyle style) {
        return NarrativePrompts.coverImagePrompt(title, style);
    }

    private JsonNode post(String path, Map<String, Object> body) {
        try {
            JsonNode response = llmWebClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(llmProperties.getTimeoutSeconds()))
                    .block();
            if (response == null) {
                throw new TransientActivityException("Empty response from " + path);
            }
            return response;
        } catch (TransientActivityException e) {
            throw e;
        } catch (WebClientException e) {
            log.warn("LLM call failed: path={}, error={}", path, e.getMessage());
            throw new TransientActivityException("LLM request to " + path + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // timeout 은 block() 에서 ReactiveException 으로 감싸져 전달된다
            Throwable cause = Exceptions.unwrap(e);
            log.warn("LLM call failed: path={}, error={}", path, cause.toString());
            throw new TransientActivityException("LLM request to " + path + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * 프로파일, 샘플 레코드, 텍스트 블록으로 프롬프트 문맥을 만든다
     */
    String buildDataContext(DataProfile profile, List<Map<String, Object>> records, List<String> textBlocks) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("rowCount", profile.getRowCount());
        context.put("columnCount", profile.getColumnCount());
        context.put("dataQualityScore", profile.getDataQualityScore());
        context.put("columns", profile.getColumns());
        context.put("sampleRecords", records.subList(0, Math.min(llmProperties.getSampleRecords(), records.size())));
        context.put("suggestedCharts", profile.getSuggestedCharts()
                .subList(0, Math.min(MAX_CHART_HINTS, profile.getSuggestedCharts().size())));

        StringBuilder sb = new StringBuilder();
        try {
            sb.append(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize data context", e);
        }

        if (!textBlocks.isEmpty()) {
            sb.append("\n\nTEXT CONTENT:\n");
            sb.append(String.join("\n---\n", textBlocks.subList(0, Math.min(MAX_TEXT_BLOCKS, textBlocks.size()))));
        }
        return sb.toString();
    }

    /**
     * 누락된 필드 채우기
     */
    static GeneratedNarrative clean(GeneratedNarrative narrative) {
        List<GeneratedInsight> sections = new ArrayList<>();
        List<GeneratedInsight> raw = narrative.getSections() != null ? narrative.getSections() : List.of();
        for (int i = 0; i < raw.size(); i++) {
            GeneratedInsight section = raw.get(i);
            sections.add(GeneratedInsight.builder()
                    .sectionId(section.getSectionId() != null ? section.getSectionId() : "section-" + (i + 1))
                    .sectionTitle(section.getSectionTitle() != null ? section.getSectionTitle() : "Section " + (i + 1))
                    .content(section.getContent() != null ? section.getContent() : "")
                    .order(section.getOrder() > 0 ? section.getOrder() : i + 1)
                    .build());
        }
        sections.sort(Comparator.comparingInt(GeneratedInsight::getOrder));

        return GeneratedNarrative.builder()
                .executiveSummary(narrative.getExecutiveSummary() != null
                        ? narrative.getExecutiveSummary() : "Executive summary not available.")
                .sections(sections)
                .recommendations(narrative.getRecommendations() != null ? narrative.getRecommendations() : new ArrayList<>())
                .keyFindings(narrative.getKeyFindings() != null ? narrative.getKeyFindings() : new ArrayList<>())
                .build();
    }
}
