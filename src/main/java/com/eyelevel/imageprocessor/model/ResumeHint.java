package com.eyelevel.imageprocessor.model;

/**
 * Lets a caller re-run a previously started batch under the same id.
 * {@code fromCheckpoint} is informational; extraction is always redone.
 */
public record ResumeHint(String batchId, CheckpointRef fromCheckpoint) {

    public static ResumeHint ofBatch(String batchId) {
        return new ResumeHint(batchId, null);
    }
}
