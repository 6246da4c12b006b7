package com.eyelevel.imageprocessor.service.extract;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Unpacks a local {@code .tar}, {@code .tar.gz} or {@code .tgz} archive with the same entry rules as ZIP sources.
 */
@Component
@Order(3)
public class TarArchiveReader implements ArchiveReader {

    @Override
    public boolean supports(String source) {
        if (source == null || source.contains("://")) {
            return false;
        }
        final Path path = Path.of(source);
        return tarFormatOf(path).isPresent() && Files.isRegularFile(path);
    }

    @Override
    public List<Path> extract(String source, Path destinationDir, ExtractionOptions options) throws IOException {
        final Path archive = Path.of(source);
        final ArchiveFormat format = tarFormatOf(archive)
                .orElseThrow(() -> new IllegalArgumentException("Not a TAR archive: " + source));
        return ArchiveStreamUnpacker.unpack(archive, format, destinationDir, options);
    }

    private static Optional<ArchiveFormat> tarFormatOf(Path path) {
        return ArchiveFormat.of(path.getFileName().toString()).filter(format -> format != ArchiveFormat.ZIP);
    }
}
