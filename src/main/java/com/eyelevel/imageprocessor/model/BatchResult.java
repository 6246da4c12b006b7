package com.eyelevel.imageprocessor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The terminal output of one batch. A non-null {@code error} is the only failure signal;
 * {@code stats} holds whatever counts were gathered up to the point of failure.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResult(String batchId,
                          String source,
                          Map<String, Integer> stats,
                          String packagePath,
                          Long packageSizeBytes,
                          String reportPath,
                          String rejectedReportPath,
                          AnalysisSummary analysis,
                          Instant timestamp,
                          String error) {

    public static final String NO_VALID_IMAGES = "no valid images found";

    public BatchResult {
        stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null;
    }

    public int stat(String key) {
        return stats.getOrDefault(key, 0);
    }
}
