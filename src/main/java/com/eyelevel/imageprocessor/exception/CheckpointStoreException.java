package com.eyelevel.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a checkpoint record or index cannot be written or read.
 */
public class CheckpointStoreException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = 5092871436620198734L;

    public CheckpointStoreException(String message) {
        super(message);
    }

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
