package com.eyelevel.imageprocessor.dto.batch;

public record PruneResponse(String batchId, int kept, int removed) {
}
