package com.eyelevel.imageprocessor.exception;

import java.io.Serial;

/**
 * A base exception for errors that abort a stage of the image pipeline.
 */
public class ImageProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2318866915082749117L;

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
