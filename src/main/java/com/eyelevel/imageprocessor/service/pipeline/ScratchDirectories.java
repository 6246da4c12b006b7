package com.eyelevel.imageprocessor.service.pipeline;

import java.nio.file.Path;

/**
 * Per-batch working directories under {@code <temp>/<batchId>}.
 */
public record ScratchDirectories(Path root, Path extracted, Path renamed, Path filtered, Path converted) {

    public static ScratchDirectories forBatch(Path tempDirectory, String batchId) {
        final Path root = tempDirectory.resolve(batchId);
        return new ScratchDirectories(root, root.resolve("extracted"), root.resolve("renamed"),
                root.resolve("filtered"), root.resolve("converted"));
    }
}
