package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes the converted images of a batch into a single DEFLATE-compressed ZIP named
 * {@code <batchId>_processed_<yyyyMMdd_HHmmss>.zip}. Entries are stored under their file name only.
 * Inputs are deleted only after the archive has been fully written and closed.
 */
@Slf4j
@Component
public class Packager {

    static final String METADATA_ENTRY = "metadata.txt";
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter METADATA_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ImageProcessingConfig.Packaging packaging;
    private final Path outputDirectory;

    public Packager(ImageProcessingConfig config) {
        this.packaging = config.packaging();
        this.outputDirectory = Path.of(config.storage().outputDirectory());
    }

    public PackageResult createPackage(String batchId, List<Path> files, String contextInfo) {
        final LocalDateTime now = LocalDateTime.now();
        final Path packagePath = outputDirectory.resolve(batchId + "_processed_" + now.format(FILE_TIMESTAMP) + ".zip");
        final List<Path> regularFiles = files.stream().filter(Files::isRegularFile).toList();
        log.info("[{}] Packaging {} files into '{}'.", contextInfo, regularFiles.size(), packagePath);

        int written = 0;
        try {
            Files.createDirectories(outputDirectory);
            try (OutputStream out = Files.newOutputStream(packagePath);
                 ZipOutputStream zos = new ZipOutputStream(out)) {
                zos.setMethod(ZipOutputStream.DEFLATED);
                zos.setLevel(clampLevel(packaging.compressionLevel()));
                final Set<String> entryNames = new HashSet<>();
                for (Path file : regularFiles) {
                    final String entryName = file.getFileName().toString();
                    if (!entryNames.add(entryName)) {
                        log.warn("[{}] Skipping duplicate archive entry '{}'.", contextInfo, entryName);
                        continue;
                    }
                    zos.putNextEntry(new ZipEntry(entryName));
                    Files.copy(file, zos);
                    zos.closeEntry();
                    written++;
                }
                if (packaging.includeMetadata()) {
                    zos.putNextEntry(new ZipEntry(METADATA_ENTRY));
                    zos.write(metadata(now, written).getBytes(StandardCharsets.UTF_8));
                    zos.closeEntry();
                }
            }
        } catch (IOException e) {
            deleteQuietly(packagePath, contextInfo);
            throw new ImageProcessingException("Failed to create package " + packagePath + ": " + e.getMessage(), e);
        }

        final long size = FileUtils.sizeOf(packagePath.toFile());
        final int deleted = packaging.deleteAfterPackaging() ? deleteInputs(regularFiles, contextInfo) : 0;
        log.info("[{}] Package complete: {} entries, {} bytes, {} inputs removed.", contextInfo, written, size, deleted);
        return new PackageResult(packagePath, written, size, deleted);
    }

    private String metadata(LocalDateTime createdAt, int fileCount) {
        return "Package created: " + createdAt.format(METADATA_TIMESTAMP) + "\n"
                + "Files included: " + fileCount + "\n"
                + "Compression level: " + packaging.compressionLevel() + "\n";
    }

    private int deleteInputs(List<Path> files, String contextInfo) {
        int deleted = 0;
        for (Path file : files) {
            try {
                if (Files.deleteIfExists(file)) {
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("[{}] Could not delete packaged file '{}': {}", contextInfo, file, e.getMessage());
            }
        }
        return deleted;
    }

    private static int clampLevel(int level) {
        return Math.max(Deflater.NO_COMPRESSION, Math.min(Deflater.BEST_COMPRESSION, level));
    }

    private static void deleteQuietly(Path path, String contextInfo) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("[{}] Could not remove incomplete package '{}'.", contextInfo, path, e);
        }
    }
}
