package com.eyelevel.imageprocessor.support;

import com.eyelevel.imageprocessor.common.json.jackson.JacksonJsonParser;
import com.eyelevel.imageprocessor.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.service.dispatch.DispatchMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Shared builders for unit tests: a fully populated configuration rooted in a temp directory,
 * real image files and ZIP archives.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static ImageProcessingConfig config(Path root) {
        return ImageProcessingConfig.builder()
                .storage(new ImageProcessingConfig.Storage(root.resolve("temp").toString(),
                        root.resolve("output").toString(), root.resolve("reports").toString(), true))
                .extraction(new ImageProcessingConfig.Extraction(
                        Set.of("jpg", "jpeg", "png", "gif", "bmp", "webp", "tiff", "tif"),
                        false, false, 100, true, 100, 30, new ImageProcessingConfig.RetryConfig(0, 0)))
                .filter(new ImageProcessingConfig.Filter(800))
                .conversion(new ImageProcessingConfig.Conversion("jpg", 90, true, false, 3840, 2160))
                .naming(new ImageProcessingConfig.Naming("bid", 6))
                .packaging(new ImageProcessingConfig.Packaging(9, false, true))
                .parallel(new ImageProcessingConfig.Parallel(true, 4, DispatchMode.THREADS))
                .memory(new ImageProcessingConfig.Memory(100, 10, 80, 95))
                .checkpoint(new ImageProcessingConfig.Checkpoint(true, root.resolve("checkpoints").toString(), 20))
                .records(new ImageProcessingConfig.Records(false))
                .progress(new ImageProcessingConfig.Progress(100))
                .build();
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public static JacksonJsonParser jsonParser() {
        return new JacksonJsonParser(objectMapper());
    }

    public static JacksonJsonSerializer jsonSerializer() {
        return new JacksonJsonSerializer(objectMapper());
    }

    /**
     * Writes a solid-colour image of the given size. The format follows the file extension.
     */
    public static Path writeImage(Path file, int width, int height) throws IOException {
        Files.createDirectories(file.getParent());
        final BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        final Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(new Color(40, 120, 200));
            graphics.fillRect(0, 0, width, height);
        } finally {
            graphics.dispose();
        }
        final String name = file.getFileName().toString();
        final String format = name.substring(name.lastIndexOf('.') + 1);
        if (!ImageIO.write(image, "jpg".equals(format) ? "jpeg" : format, file.toFile())) {
            throw new IOException("No writer for " + format);
        }
        return file;
    }

    /**
     * Writes a ZIP whose entries hold the given bytes, in insertion order.
     */
    public static Path writeZip(Path zipFile, Map<String, byte[]> entries) throws IOException {
        Files.createDirectories(zipFile.getParent());
        try (OutputStream out = Files.newOutputStream(zipFile);
             ZipOutputStream zos = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zos.putNextEntry(new ZipEntry(entry.getKey()));
                zos.write(entry.getValue());
                zos.closeEntry();
            }
        }
        return zipFile;
    }

    /**
     * Writes a TAR archive, gzip-compressed when the file name ends in {@code .tar.gz} or {@code .tgz}.
     * Entry names are kept verbatim, including {@code ..} segments.
     */
    public static Path writeTar(Path tarFile, Map<String, byte[]> entries) throws IOException {
        Files.createDirectories(tarFile.getParent());
        final String name = tarFile.getFileName().toString().toLowerCase(Locale.ROOT);
        final boolean gzip = name.endsWith(".tar.gz") || name.endsWith(".tgz");
        try (OutputStream file = Files.newOutputStream(tarFile);
             OutputStream out = gzip ? new GzipCompressorOutputStream(file) : file;
             TarArchiveOutputStream tos = new TarArchiveOutputStream(out)) {
            tos.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                final TarArchiveEntry tarEntry = new TarArchiveEntry(entry.getKey(), true);
                tarEntry.setSize(entry.getValue().length);
                tos.putArchiveEntry(tarEntry);
                tos.write(entry.getValue());
                tos.closeArchiveEntry();
            }
        }
        return tarFile;
    }
}
