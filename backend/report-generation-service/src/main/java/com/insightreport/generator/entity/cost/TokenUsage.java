package com.insightreport.generator.entity.cost;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Usage delta reported by one AI call. Absent fields count as zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {

    private Long promptTokens;

    private Long completionTokens;

    private Long imagesGenerated;

    public static TokenUsage ofTokens(long promptTokens, long completionTokens) {
        return TokenUsage.builder()
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    public static TokenUsage ofImages(long images) {
        return TokenUsage.builder().imagesGenerated(images).build();
    }
}
