package com.eyelevel.imageprocessor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.Map;

/**
 * A dry-run look at a sample of a source, taken without creating a batch.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceAnalysis(String source,
                             int sampleSize,
                             int acceptableFiles,
                             int rejectedFiles,
                             Map<String, Integer> formats,
                             Map<String, Integer> dimensions,
                             AnalysisSummary summary,
                             String error) {

    public static SourceAnalysis failed(String source, String error) {
        return new SourceAnalysis(source, 0, 0, 0, Map.of(), Map.of(), null, error);
    }
}
