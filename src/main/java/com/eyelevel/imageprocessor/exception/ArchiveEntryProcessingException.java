package com.eyelevel.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when one entry of an archive cannot be written to the scratch directory.
 * The surrounding extraction skips the entry and continues.
 */
public class ArchiveEntryProcessingException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = -3387410026915420457L;

    public ArchiveEntryProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
