package com.eyelevel.imageprocessor.service.stage;

import java.nio.file.Path;

/**
 * @param packagePath  the written archive
 * @param fileCount    image entries in the archive, not counting the metadata entry
 * @param sizeBytes    archive size on disk
 * @param deletedFiles inputs removed after the archive was written
 */
public record PackageResult(Path packagePath, int fileCount, long sizeBytes, int deletedFiles) {
}
