package com.eyelevel.imageprocessor.service.checkpoint;

import com.eyelevel.imageprocessor.model.PhaseStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Per-batch index file contents. {@code lastSequence} is the highest sequence ever issued for the batch
 * and survives pruning, so numbering stays monotonic.
 */
public record CheckpointIndex(String batchId, long lastSequence, List<Entry> entries) {

    public record Entry(long sequence, String fileName, String phaseLabel, PhaseStatus status, Instant timestamp) {
    }

    public CheckpointIndex {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    static CheckpointIndex empty(String batchId) {
        return new CheckpointIndex(batchId, 0L, List.of());
    }

    CheckpointIndex append(Entry entry) {
        final List<Entry> updated = new ArrayList<>(entries);
        updated.add(entry);
        return new CheckpointIndex(batchId, Math.max(lastSequence, entry.sequence()), updated);
    }

    Optional<Entry> lastEntry() {
        return entries.stream().max(Comparator.comparingLong(Entry::sequence));
    }
}
