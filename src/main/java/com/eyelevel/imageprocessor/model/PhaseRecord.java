package com.eyelevel.imageprocessor.model;

import java.time.Instant;

/**
 * One durable checkpoint entry. Records are written once and never mutated.
 *
 * @param batchId        the batch the record belongs to
 * @param phaseLabel     stage name, optionally suffixed with a sub-batch index (e.g. {@code convert_batch_3})
 * @param status         started, completed or error
 * @param sequenceNumber monotonic per batch, starting at 1
 * @param timestamp      when the record was written
 * @param payload        stage-specific counts and paths
 */
public record PhaseRecord(String batchId,
                          String phaseLabel,
                          PhaseStatus status,
                          long sequenceNumber,
                          Instant timestamp,
                          CheckpointPayload payload) {

    public PhaseRecord {
        if (payload == null) {
            payload = CheckpointPayload.empty();
        }
    }
}
