package com.eyelevel.imageprocessor.model;

import java.nio.file.Path;

/**
 * A single file moving through the pipeline. Stages hand back a copy with a new {@code currentPath};
 * {@code originalPath} always points at the extracted file so failures can be traced to the source.
 *
 * @param originalPath the file as extracted from the source
 * @param currentPath  where the file lives after the latest stage
 * @param imageId      the record-store id, or {@code null} when records are disabled or registration failed
 * @param sequence     the rename sequence number, 0 until the item is renamed
 */
public record WorkItem(Path originalPath, Path currentPath, Long imageId, int sequence) {

    public static WorkItem extracted(Path path, Long imageId) {
        return new WorkItem(path, path, imageId, 0);
    }

    public WorkItem withCurrentPath(Path newPath) {
        return new WorkItem(originalPath, newPath, imageId, sequence);
    }

    public WorkItem renamed(Path newPath, int newSequence) {
        return new WorkItem(originalPath, newPath, imageId, newSequence);
    }
}
