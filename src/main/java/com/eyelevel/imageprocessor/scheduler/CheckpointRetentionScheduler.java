package com.eyelevel.imageprocessor.scheduler;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.CheckpointStoreException;
import com.eyelevel.imageprocessor.service.checkpoint.CheckpointStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Trims the checkpoint log of every known batch to the configured number of most recent records.
 */
@Slf4j
@Component
public class CheckpointRetentionScheduler {

    private final CheckpointStore checkpointStore;
    private final ImageProcessingConfig.Checkpoint settings;

    public CheckpointRetentionScheduler(CheckpointStore checkpointStore, ImageProcessingConfig config) {
        this.checkpointStore = checkpointStore;
        this.settings = config.checkpoint();
    }

    @Scheduled(cron = "${app.scheduler.checkpoint-retention}")
    public void pruneCheckpoints() {
        if (!settings.enabled()) {
            return;
        }
        final Set<String> batchIds = checkpointStore.batchIds();
        log.info("Running checkpoint retention for {} batches, keeping {} records each.", batchIds.size(),
                settings.retention());

        int removed = 0;
        for (String batchId : batchIds) {
            try {
                removed += checkpointStore.prune(batchId, settings.retention());
            } catch (CheckpointStoreException e) {
                log.error("[{}] Failed to prune checkpoints: {}", batchId, e.getMessage(), e);
            }
        }
        log.info("Finished checkpoint retention. Removed {} records.", removed);
    }
}
