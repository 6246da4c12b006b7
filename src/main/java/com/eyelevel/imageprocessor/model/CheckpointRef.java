package com.eyelevel.imageprocessor.model;

/**
 * Points at one stored checkpoint record.
 */
public record CheckpointRef(String batchId, long sequenceNumber, String fileName) {
}
