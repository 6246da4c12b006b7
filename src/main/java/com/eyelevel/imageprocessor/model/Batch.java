package com.eyelevel.imageprocessor.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory state of one batch while it is being processed. Owned by a single orchestrator
 * invocation and discarded when it returns; the durable trail lives in checkpoints and the report.
 */
@Getter
public class Batch {

    public static final String EXTRACTED = "extracted";
    public static final String RENAMED = "renamed";
    public static final String RENAME_FAILED = "rename_failed";
    public static final String FILTERED = "filtered";
    public static final String REJECTED = "rejected";
    public static final String CONVERTED = "converted";
    public static final String CONVERT_FAILED = "convert_failed";
    public static final String PACKAGED = "packaged";
    public static final String SUB_BATCHES = "sub_batches";

    private final String batchId;
    private final String source;
    private final Instant createdAt;
    private final List<PhaseTransition> phaseHistory = new ArrayList<>();
    private final Map<String, Integer> stats = new LinkedHashMap<>();

    public Batch(String batchId, String source) {
        this.batchId = batchId;
        this.source = source;
        this.createdAt = Instant.now();
    }

    public void recordTransition(String phaseLabel, PhaseStatus status) {
        phaseHistory.add(new PhaseTransition(phaseLabel, status, Instant.now()));
    }

    public void setStat(String key, int value) {
        stats.put(key, value);
    }

    public void addToStat(String key, int delta) {
        stats.merge(key, delta, Integer::sum);
    }

    public int stat(String key) {
        return stats.getOrDefault(key, 0);
    }

    public Map<String, Integer> statsSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    public List<PhaseTransition> getPhaseHistory() {
        return Collections.unmodifiableList(phaseHistory);
    }
}
