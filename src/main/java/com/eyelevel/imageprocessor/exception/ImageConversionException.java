package com.eyelevel.imageprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a single image cannot be decoded, re-encoded or written.
 */
public class ImageConversionException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = -6150432209857742310L;

    public ImageConversionException(String message) {
        super(message);
    }

    public ImageConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
