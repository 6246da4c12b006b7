package com.eyelevel.imageprocessor.service.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Treats a single local image file as a one-item source.
 */
@Slf4j
@Component
@Order(5)
public class SingleImageReader implements ArchiveReader {

    @Override
    public boolean supports(String source) {
        return source != null && !source.contains("://") && Files.isRegularFile(Path.of(source))
                && !ImageFiles.isArchive(source);
    }

    @Override
    public List<Path> extract(String source, Path destinationDir, ExtractionOptions options) throws IOException {
        final Path file = Path.of(source);
        if (!ImageFiles.hasImageExtension(file.getFileName().toString(), options)) {
            log.warn("Source file '{}' does not have an accepted image extension.", file);
            return List.of();
        }
        Files.createDirectories(destinationDir);
        final Path target = destinationDir.resolve(file.getFileName().toString());
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        return List.of(target);
    }
}
