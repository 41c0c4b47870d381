package com.insightreport.generator.dto.report;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free text or markdown passed through to the narrative step verbatim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnstructuredInput implements InputData {

    @Builder.Default
    private String type = "unstructured";

    @Builder.Default
    private String format = "text";

    @NotNull
    @Size(max = 100_000)
    private String content;
}
