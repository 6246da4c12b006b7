package com.eyelevel.imageprocessor.exception;

import java.io.Serial;

public class BatchNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -812263301446652275L;

    public BatchNotFoundException(String batchId) {
        super("No batch found with id: " + batchId);
    }
}
