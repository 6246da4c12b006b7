package com.eyelevel.imageprocessor.service.record;

import com.eyelevel.imageprocessor.model.BatchStatus;
import com.eyelevel.imageprocessor.model.ImageStatus;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Durable tracking of batches and their images. Implementations never throw: a storage failure is logged
 * and the pipeline carries on without the record.
 */
public interface RecordStore {

    /**
     * Creates the batch row, or puts an existing one back into {@code PROCESSING} when a batch is resumed.
     */
    void registerBatch(String batchId, String source);

    /**
     * @return the id of the new image row, or empty when it could not be written.
     */
    Optional<Long> registerImage(String batchId, Path file);

    /**
     * Updates one image row. A {@code null} id, processed path or metadata leaves that part untouched.
     */
    void updateImage(Long imageId, ImageStatus status, String processedPath, String metadata);

    void updateBatchStatus(String batchId, BatchStatus status, String packagePath, String errorMessage);
}
