package com.eyelevel.imageprocessor.service.image;

import com.eyelevel.imageprocessor.model.ImageInspection;

import java.nio.file.Path;

/**
 * Reads and re-encodes individual image files.
 */
public interface ImageCodec {

    /**
     * Reads the basic properties of an image without decoding its pixels.
     *
     * @return the inspection result, or an unreadable marker. Never throws for bad input.
     */
    ImageInspection inspect(Path path);

    /**
     * @return {@code true} when the file is a structurally valid image with positive dimensions.
     */
    default boolean isValidImage(Path path) {
        final ImageInspection inspection = inspect(path);
        return inspection.isReadable() && inspection.width() > 0 && inspection.height() > 0;
    }

    /**
     * Converts one image into {@code destinationDir}, naming the output {@code <stem>.<format>}.
     *
     * @return the path of the written file.
     * @throws com.eyelevel.imageprocessor.exception.ImageConversionException if the image cannot be converted.
     */
    Path convert(Path source, Path destinationDir, ConversionOptions options);

    /**
     * @return whether {@code format} can be written by this codec.
     */
    boolean canWrite(String format);
}
