package com.eyelevel.imageprocessor.service.image;

import com.eyelevel.imageprocessor.exception.ImageConversionException;
import com.eyelevel.imageprocessor.model.ImageInspection;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

/**
 * {@link ImageCodec} backed by {@code javax.imageio}. Readable and writable formats are whatever ImageIO
 * plugins are on the classpath; the JDK ships JPEG, PNG, BMP, GIF, WBMP and TIFF.
 */
@Slf4j
@Component
public class ImageIoCodec implements ImageCodec {

    /**
     * Formats that cannot store an alpha channel; images are flattened onto white before writing.
     */
    private static final Set<String> OPAQUE_FORMATS = Set.of("jpeg", "bmp", "wbmp");

    @Override
    public ImageInspection inspect(Path path) {
        if (!Files.isRegularFile(path)) {
            return ImageInspection.unreadable("File not found");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                return ImageInspection.unreadable("Unable to open file");
            }
            final Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return ImageInspection.unreadable("Unrecognized image format");
            }
            final ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return ImageInspection.of(reader.getWidth(0), reader.getHeight(0),
                        reader.getFormatName().toLowerCase(Locale.ROOT), Files.size(path));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Unable to inspect '{}': {}", path, e.getMessage());
            return ImageInspection.unreadable(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    @Override
    public boolean canWrite(String format) {
        return format != null && ImageIO.getImageWritersByFormatName(normalizeFormat(format)).hasNext();
    }

    @Override
    public Path convert(Path source, Path destinationDir, ConversionOptions options) {
        final String writerFormat = normalizeFormat(options.format());
        final ImageWriter writer = findWriter(writerFormat);
        final Path target = destinationDir.resolve(
                FilenameUtils.getBaseName(source.getFileName().toString()) + "." + options.format().toLowerCase(Locale.ROOT));
        try {
            final DecodedImage decoded = decode(source, writerFormat, options.preserveMetadata());
            BufferedImage image = decoded.image();
            IIOMetadata metadata = decoded.metadata();

            if (options.resizeIfLarger() && exceeds(image, options.maxWidth(), options.maxHeight())) {
                image = resizeToFit(image, options.maxWidth(), options.maxHeight());
                metadata = null;
            }
            if (OPAQUE_FORMATS.contains(writerFormat) && image.getColorModel().hasAlpha()) {
                image = flattenToRgb(image);
                metadata = null;
            }

            Files.createDirectories(destinationDir);
            Files.deleteIfExists(target);
            write(writer, writerFormat, image, metadata, target, options.quality());
            log.debug("Converted '{}' to '{}' ({}x{}).", source.getFileName(), target.getFileName(),
                    image.getWidth(), image.getHeight());
            return target;
        } catch (IOException | RuntimeException e) {
            deleteQuietly(target);
            if (e instanceof ImageConversionException conversionException) {
                throw conversionException;
            }
            throw new ImageConversionException("Failed to convert " + source.getFileName() + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    private DecodedImage decode(Path source, String targetFormat, boolean preserveMetadata) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(source.toFile())) {
            if (input == null) {
                throw new ImageConversionException("Unable to open " + source.getFileName());
            }
            final Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new ImageConversionException("Unrecognized image format: " + source.getFileName());
            }
            final ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                final BufferedImage image = reader.read(0);
                final String sourceFormat = normalizeFormat(reader.getFormatName());
                final IIOMetadata metadata = preserveMetadata && sourceFormat.equals(targetFormat)
                        ? reader.getImageMetadata(0)
                        : null;
                return new DecodedImage(image, metadata);
            } finally {
                reader.dispose();
            }
        }
    }

    private void write(ImageWriter writer, String format, BufferedImage image, IIOMetadata metadata, Path target,
                       int quality) throws IOException {
        final ImageWriteParam param = writer.getDefaultWriteParam();
        if ("jpeg".equals(format) && param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(Math.max(0.01f, Math.min(1f, quality / 100f)));
        }
        try (ImageOutputStream output = ImageIO.createImageOutputStream(target.toFile())) {
            if (output == null) {
                throw new ImageConversionException("Unable to open output stream for " + target);
            }
            writer.setOutput(output);
            writer.write(null, new IIOImage(image, null, metadata), param);
        }
    }

    private ImageWriter findWriter(String format) {
        final Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
        if (!writers.hasNext()) {
            throw new ImageConversionException("No image writer available for format '" + format + "'");
        }
        return writers.next();
    }

    private static boolean exceeds(BufferedImage image, int maxWidth, int maxHeight) {
        return maxWidth > 0 && maxHeight > 0 && (image.getWidth() > maxWidth || image.getHeight() > maxHeight);
    }

    private static BufferedImage resizeToFit(BufferedImage image, int maxWidth, int maxHeight) {
        final double scale = Math.min((double) maxWidth / image.getWidth(), (double) maxHeight / image.getHeight());
        final int width = Math.max(1, (int) Math.round(image.getWidth() * scale));
        final int height = Math.max(1, (int) Math.round(image.getHeight() * scale));
        final int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        final BufferedImage resized = new BufferedImage(width, height, type);
        final Graphics2D g2d = resized.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.drawImage(image, 0, 0, width, height, null);
        } finally {
            g2d.dispose();
        }
        return resized;
    }

    private static BufferedImage flattenToRgb(BufferedImage image) {
        final BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        final Graphics2D g2d = rgb.createGraphics();
        try {
            g2d.setColor(Color.WHITE);
            g2d.fillRect(0, 0, image.getWidth(), image.getHeight());
            g2d.drawImage(image, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return rgb;
    }

    /**
     * Maps file-extension style names onto ImageIO format names ("jpg" to "jpeg", "tif" to "tiff").
     */
    static String normalizeFormat(String format) {
        final String lower = format.toLowerCase(Locale.ROOT);
        return switch (lower) {
            case "jpg" -> "jpeg";
            case "tif" -> "tiff";
            default -> lower;
        };
    }

    private static void deleteQuietly(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException cleanupEx) {
            log.warn("Could not remove partial output '{}'.", target, cleanupEx);
        }
    }

    private record DecodedImage(BufferedImage image, IIOMetadata metadata) {
    }
}
