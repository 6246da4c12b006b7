package com.eyelevel.imageprocessor.service.image;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import lombok.Builder;

/**
 * Settings for converting one image.
 *
 * @param format           target format name, also used as the output file extension (e.g. "jpg", "png")
 * @param quality          1-100; applied by encoders that support lossy compression
 * @param preserveMetadata carry the source metadata over when the source already has the target format
 * @param resizeIfLarger   scale down, keeping the aspect ratio, when the image exceeds the maximum dimensions
 * @param maxWidth         maximum output width when resizing
 * @param maxHeight        maximum output height when resizing
 */
@Builder(toBuilder = true)
public record ConversionOptions(String format,
                                int quality,
                                boolean preserveMetadata,
                                boolean resizeIfLarger,
                                int maxWidth,
                                int maxHeight) {

    public static ConversionOptions from(ImageProcessingConfig.Conversion conversion) {
        return new ConversionOptions(conversion.outputFormat(), conversion.quality(), conversion.preserveMetadata(),
                conversion.resizeIfLarger(), conversion.maxWidth(), conversion.maxHeight());
    }
}
