package com.eyelevel.imageprocessor.exception.json;

import java.io.Serial;

/**
 * Thrown when a checkpoint record, checkpoint index or batch summary report cannot be converted to or from
 * JSON. The checkpoint store treats it as a corrupt file and falls back to scanning record files.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2871650340915447326L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
