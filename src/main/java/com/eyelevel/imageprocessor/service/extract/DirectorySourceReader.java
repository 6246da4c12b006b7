package com.eyelevel.imageprocessor.service.extract;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Copies the image files of a local directory tree into the scratch directory, keeping their relative paths.
 * ZIP and TAR archives in the tree are unpacked next to their location when nested extraction is enabled.
 */
@Slf4j
@Component
@Order(4)
public class DirectorySourceReader implements ArchiveReader {

    @Override
    public boolean supports(String source) {
        return source != null && !source.contains("://") && Files.isDirectory(Path.of(source));
    }

    @Override
    public List<Path> extract(String source, Path destinationDir, ExtractionOptions options) throws IOException {
        final Path root = Path.of(source).toAbsolutePath().normalize();
        final Path destination = destinationDir.toAbsolutePath().normalize();
        log.info("Collecting images from directory '{}'.", root);

        final List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> !p.startsWith(destination))
                    .sorted()
                    .toList();
        }

        final List<Path> extracted = new ArrayList<>();
        for (Path file : files) {
            final String relative = FilenameUtils.separatorsToUnix(root.relativize(file).toString());
            if (ImageFiles.isIgnored(relative)) {
                continue;
            }
            final Optional<ArchiveFormat> archiveFormat = ArchiveFormat.of(relative);
            if (archiveFormat.isPresent()) {
                if (options.extractNested()) {
                    extracted.addAll(ArchiveStreamUnpacker.unpack(file, archiveFormat.get(),
                            destination.resolve(archiveFormat.get().nestedFolder(relative)), options));
                }
                continue;
            }
            if (!ImageFiles.hasImageExtension(relative, options)) {
                continue;
            }
            final Path target = destination.resolve(relative);
            Files.createDirectories(target.getParent());
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            extracted.add(target);
        }
        log.info("Collected {} image files from '{}'.", extracted.size(), root);
        return extracted;
    }
}
