package com.insightreport.generator.service.ai;

import com.insightreport.generator.dto.report.GeneratedNarrative;
import com.insightreport.generator.entity.profile.DataProfile;
import com.insightreport.generator.entity.report.ReportStyle;

import java.util.List;
import java.util.Map;

/**
 * AI 본문/이미지 생성기
 *
 * 구현체의 모든 실패는 재시도 가능한 일시적 오류로 전달된다.
 */
public interface NarrativeGenerator {

    GeneratedNarrative generateNarrative(String reportId,
                                         DataProfile profile,
                                         List<Map<String, Object>> records,
                                         List<String> textBlocks,
                                         ReportStyle style,
                                         String title,
                                         String customInstructions);

    /**
     * @return decoded image bytes
     */
    byte[] generateImage(String reportId, String prompt);
}
