package com.eyelevel.imageprocessor.service.checkpoint;

import com.eyelevel.imageprocessor.model.CheckpointPayload;
import com.eyelevel.imageprocessor.model.CheckpointRef;
import com.eyelevel.imageprocessor.model.PhaseRecord;
import com.eyelevel.imageprocessor.model.PhaseStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable, append-only log of phase transitions, keyed by batch.
 * <p>
 * Writers for different batches may run concurrently. Writes for one batch are assumed to come from a
 * single thread at a time. Implementations signal storage failures with
 * {@link com.eyelevel.imageprocessor.exception.CheckpointStoreException}.
 */
public interface CheckpointStore {

    /**
     * Appends a new record with the next sequence number for the batch. Never overwrites an existing record.
     */
    CheckpointRef save(String batchId, String phaseLabel, PhaseStatus status, CheckpointPayload payload);

    /**
     * @return the record with the highest sequence number for the batch, if any.
     */
    Optional<PhaseRecord> latest(String batchId);

    /**
     * Lists records, most recent first.
     *
     * @param batchId a batch to restrict the listing to, or {@code null} for every batch in the store.
     */
    List<PhaseRecord> list(String batchId);

    /**
     * Keeps the {@code keep} most recent records for the batch and deletes the rest.
     *
     * @return how many records were removed.
     */
    int prune(String batchId, int keep);

    Optional<PhaseRecord> load(CheckpointRef ref);

    /**
     * @return every batch id that has at least one record or index in the store.
     */
    Set<String> batchIds();
}
