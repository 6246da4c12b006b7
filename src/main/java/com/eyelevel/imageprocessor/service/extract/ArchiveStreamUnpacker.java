package com.eyelevel.imageprocessor.service.extract;

import com.eyelevel.imageprocessor.exception.ArchiveEntryProcessingException;
import com.eyelevel.imageprocessor.exception.SourceExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.io.input.CloseShieldInputStream;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Streams ZIP and TAR archives entry by entry into a scratch directory, without holding entries in memory.
 * <p>
 * Directory entries, links, OS junk entries and non-image names are skipped. Entries whose path would escape
 * the destination directory are rejected. With nested extraction enabled, archive entries of any supported
 * format are unpacked recursively into a sub-directory named after the entry.
 */
@Slf4j
final class ArchiveStreamUnpacker {

    private static final int MAX_NESTING_DEPTH = 3;

    private ArchiveStreamUnpacker() {
    }

    /**
     * @throws SourceExtractionException if the archive is corrupt; not worth retrying.
     * @throws IOException               on any other read or write failure.
     */
    static List<Path> unpack(Path archive, ArchiveFormat format, Path destinationDir, ExtractionOptions options)
            throws IOException {
        log.info("Unpacking {} archive '{}' into '{}'.", format, archive, destinationDir);
        Files.createDirectories(destinationDir);
        final List<Path> extracted = new ArrayList<>();
        try (InputStream in = Files.newInputStream(archive)) {
            unpackStream(in, format, destinationDir.toAbsolutePath().normalize(), options, 0, extracted);
        } catch (ZipException e) {
            throw new SourceExtractionException("Invalid or corrupted ZIP archive: " + e.getMessage(), e);
        }
        log.info("Extracted {} image entries from '{}'.", extracted.size(), archive.getFileName());
        return extracted;
    }

    private static void unpackStream(InputStream stream, ArchiveFormat format, Path destinationDir,
                                     ExtractionOptions options, int depth, List<Path> extracted) throws IOException {
        try (EntryReader entries = EntryReader.open(stream, format)) {
            String entryPath;
            while ((entryPath = entries.nextFile()) != null) {
                if (ImageFiles.isIgnored(entryPath)) {
                    continue;
                }
                final Optional<ArchiveFormat> nestedFormat = ArchiveFormat.of(entryPath);
                if (nestedFormat.isPresent()) {
                    if (options.extractNested() && depth < MAX_NESTING_DEPTH) {
                        unpackNested(entries.content(), nestedFormat.get(), destinationDir, entryPath, options,
                                depth, extracted);
                    }
                    continue;
                }
                if (!ImageFiles.hasImageExtension(entryPath, options)) {
                    continue;
                }
                writeEntry(entries.content(), destinationDir, entryPath).ifPresent(extracted::add);
            }
        }
    }

    private static void unpackNested(InputStream content, ArchiveFormat format, Path destinationDir,
                                     String entryPath, ExtractionOptions options, int depth, List<Path> extracted) {
        final Path nestedDir = resolveSafely(destinationDir, format.nestedFolder(entryPath));
        if (nestedDir == null) {
            log.warn("Skipping nested archive '{}' with an unsafe path.", entryPath);
            return;
        }
        final int before = extracted.size();
        try {
            Files.createDirectories(nestedDir);
            // The shield keeps the nested reader from closing the outer stream.
            unpackStream(CloseShieldInputStream.wrap(content), format, nestedDir, options, depth + 1, extracted);
            log.debug("Nested archive '{}' yielded {} images.", entryPath, extracted.size() - before);
        } catch (IOException | SourceExtractionException e) {
            final ArchiveEntryProcessingException failure =
                    new ArchiveEntryProcessingException("Unable to unpack nested archive " + entryPath, e);
            log.warn("{}; skipping it.", failure.getMessage(), failure);
        }
    }

    private static Optional<Path> writeEntry(InputStream content, Path destinationDir, String entryPath)
            throws IOException {
        final Path target = resolveSafely(destinationDir, entryPath);
        if (target == null) {
            log.warn("Skipping archive entry '{}' that resolves outside the destination directory.", entryPath);
            return Optional.empty();
        }
        Files.createDirectories(target.getParent());
        final long size = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        if (size == 0) {
            Files.delete(target);
            return Optional.empty();
        }
        return Optional.of(target);
    }

    private static Path resolveSafely(Path destinationDir, String relativePath) {
        final Path resolved = destinationDir.resolve(relativePath).normalize();
        return resolved.startsWith(destinationDir) && !resolved.equals(destinationDir) ? resolved : null;
    }

    /**
     * Sequential view over the regular-file entries of one archive stream.
     */
    private interface EntryReader extends Closeable {

        /**
         * @return the next regular-file entry path with forward slashes, or {@code null} at the end.
         */
        String nextFile() throws IOException;

        /**
         * The content of the current entry; reads end at the entry boundary.
         */
        InputStream content();

        static EntryReader open(InputStream stream, ArchiveFormat format) {
            return switch (format) {
                case ZIP -> new ZipEntryReader(new ZipInputStream(stream));
                case TAR -> new TarEntryReader(new TarArchiveInputStream(stream));
                case TAR_GZ -> new TarEntryReader(new TarArchiveInputStream(gunzip(stream)));
            };
        }

        private static InputStream gunzip(InputStream stream) {
            try {
                return new GzipCompressorInputStream(stream);
            } catch (IOException e) {
                throw new SourceExtractionException("Invalid or corrupted gzip stream: " + e.getMessage(), e);
            }
        }
    }

    private static final class ZipEntryReader implements EntryReader {

        private final ZipInputStream zis;

        private ZipEntryReader(ZipInputStream zis) {
            this.zis = zis;
        }

        @Override
        public String nextFile() throws IOException {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                final String normalizedPath = entry.getName().replace('\\', '/');
                if (!entry.isDirectory() && !normalizedPath.endsWith("/")) {
                    return normalizedPath;
                }
            }
            return null;
        }

        @Override
        public InputStream content() {
            return zis;
        }

        @Override
        public void close() throws IOException {
            zis.close();
        }
    }

    private static final class TarEntryReader implements EntryReader {

        private final TarArchiveInputStream tis;

        private TarEntryReader(TarArchiveInputStream tis) {
            this.tis = tis;
        }

        @Override
        public String nextFile() {
            TarArchiveEntry entry;
            while ((entry = nextEntry()) != null) {
                if (entry.isFile()) {
                    return entry.getName().replace('\\', '/');
                }
            }
            return null;
        }

        private TarArchiveEntry nextEntry() {
            try {
                return tis.getNextTarEntry();
            } catch (IOException e) {
                throw new SourceExtractionException("Invalid or corrupted TAR archive: " + e.getMessage(), e);
            }
        }

        @Override
        public InputStream content() {
            return tis;
        }

        @Override
        public void close() throws IOException {
            tis.close();
        }
    }
}
