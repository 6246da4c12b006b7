package com.eyelevel.imageprocessor.service.extract;

import com.eyelevel.imageprocessor.exception.SourceExtractionException;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Unpacks a local ZIP archive. Entry filtering and nested archives are handled by {@link ArchiveStreamUnpacker}.
 */
@Component
@Order(2)
public class ZipArchiveReader implements ArchiveReader {

    @Override
    public boolean supports(String source) {
        if (source == null || source.contains("://")) {
            return false;
        }
        final Path path = Path.of(source);
        return ArchiveFormat.of(path.getFileName().toString()).filter(ArchiveFormat.ZIP::equals).isPresent()
                && Files.isRegularFile(path);
    }

    @Override
    public List<Path> extract(String source, Path destinationDir, ExtractionOptions options) throws IOException {
        return extractArchive(Path.of(source), destinationDir, options);
    }

    /**
     * Unpacks a ZIP file on disk.
     *
     * @throws SourceExtractionException if the archive is corrupt; not worth retrying.
     * @throws IOException               on any other read or write failure.
     */
    public List<Path> extractArchive(Path archive, Path destinationDir, ExtractionOptions options) throws IOException {
        return ArchiveStreamUnpacker.unpack(archive, ArchiveFormat.ZIP, destinationDir, options);
    }
}
