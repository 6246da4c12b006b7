package com.eyelevel.imageprocessor.exception;

import java.io.Serial;

public class UnsupportedSourceException extends ImageProcessingException {
    @Serial
    private static final long serialVersionUID = 1953021877470336608L;

    public UnsupportedSourceException(String source) {
        super("No reader is available for source: " + source);
    }
}
