package com.eyelevel.imageprocessor.service.checkpoint;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.CheckpointStoreException;
import com.eyelevel.imageprocessor.model.CheckpointPayload;
import com.eyelevel.imageprocessor.model.CheckpointRef;
import com.eyelevel.imageprocessor.model.PhaseStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Writes phase checkpoints on behalf of the orchestrator. A storage failure is logged and reported as an
 * empty result; it never aborts the batch. Recording is skipped entirely when checkpoints are disabled.
 */
@Slf4j
@Component
public class CheckpointRecorder {

    private final CheckpointStore checkpointStore;
    private final boolean enabled;

    public CheckpointRecorder(CheckpointStore checkpointStore, ImageProcessingConfig config) {
        this.checkpointStore = checkpointStore;
        this.enabled = config.checkpoint().enabled();
    }

    public Optional<CheckpointRef> started(String batchId, String phaseLabel, CheckpointPayload payload) {
        return record(batchId, phaseLabel, PhaseStatus.STARTED, payload);
    }

    public Optional<CheckpointRef> completed(String batchId, String phaseLabel, CheckpointPayload payload) {
        return record(batchId, phaseLabel, PhaseStatus.COMPLETED, payload);
    }

    public Optional<CheckpointRef> error(String batchId, String phaseLabel, CheckpointPayload payload) {
        return record(batchId, phaseLabel, PhaseStatus.ERROR, payload);
    }

    private Optional<CheckpointRef> record(String batchId, String phaseLabel, PhaseStatus status,
                                           CheckpointPayload payload) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            return Optional.of(checkpointStore.save(batchId, phaseLabel, status, payload));
        } catch (CheckpointStoreException e) {
            log.warn("[{}] Could not write checkpoint '{}' ({}); continuing without it.",
                    batchId, phaseLabel, status.getValue(), e);
            return Optional.empty();
        }
    }
}
