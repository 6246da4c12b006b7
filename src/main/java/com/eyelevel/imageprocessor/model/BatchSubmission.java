package com.eyelevel.imageprocessor.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * The tracked state of a batch submitted for background processing.
 *
 * @param result present once the batch has finished
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchSubmission(String batchId,
                              String source,
                              BatchStatus status,
                              Instant submittedAt,
                              BatchResult result) {

    public static BatchSubmission processing(String batchId, String source) {
        return new BatchSubmission(batchId, source, BatchStatus.PROCESSING, Instant.now(), null);
    }

    public BatchSubmission finishedWith(BatchResult batchResult) {
        final BatchStatus finalStatus;
        if (batchResult.isSuccessful()) {
            finalStatus = BatchStatus.COMPLETED;
        } else if (BatchResult.NO_VALID_IMAGES.equals(batchResult.error())) {
            finalStatus = BatchStatus.EMPTY;
        } else {
            finalStatus = BatchStatus.FAILED;
        }
        return new BatchSubmission(batchId, source, finalStatus, submittedAt, batchResult);
    }
}
