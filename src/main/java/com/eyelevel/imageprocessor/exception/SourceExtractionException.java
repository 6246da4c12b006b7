package com.eyelevel.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a source cannot be read or unpacked at all, as opposed to a single bad entry.
 */
public class SourceExtractionException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = 7724198315542104621L;

    public SourceExtractionException(String message) {
        super(message);
    }

    public SourceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
