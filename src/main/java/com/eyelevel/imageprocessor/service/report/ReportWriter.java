package com.eyelevel.imageprocessor.service.report;

import com.eyelevel.imageprocessor.model.BatchResult;
import com.eyelevel.imageprocessor.model.RejectionInfo;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the human- and machine-readable outputs of a batch.
 */
public interface ReportWriter {

    /**
     * Writes the batch summary as pretty-printed JSON.
     *
     * @return the written report.
     * @throws com.eyelevel.imageprocessor.exception.ImageProcessingException if the report cannot be written.
     */
    Path writeSummary(BatchResult result);

    /**
     * Writes one CSV row per rejected file.
     *
     * @param rejected rejection details keyed by file path
     * @return the written report, or empty when nothing was rejected.
     * @throws com.eyelevel.imageprocessor.exception.ImageProcessingException if the report cannot be written.
     */
    Optional<Path> writeRejected(Map<String, RejectionInfo> rejected);

    /**
     * @return the path under which the summary report of {@code batchId} is stored.
     */
    Path summaryPathFor(String batchId);
}
