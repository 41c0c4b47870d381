package com.insightreport.generator.dto.report;

import com.insightreport.generator.entity.profile.DataProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Output of the data profiling step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResult {

    private DataProfile profile;

    /**
     * Concatenated flat records of every structured block
     */
    @Builder.Default
    private List<Map<String, Object>> records = new ArrayList<>();

    /**
     * Unstructured blocks, verbatim and in input order
     */
    @Builder.Default
    private List<String> textBlocks = new ArrayList<>();
}
