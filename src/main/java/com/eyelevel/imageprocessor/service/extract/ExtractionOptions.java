package com.eyelevel.imageprocessor.service.extract;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import lombok.Builder;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Controls what an extraction keeps.
 *
 * @param validExtensions image file extensions to keep, lower case and without the dot
 * @param extractNested   unpack ZIP and TAR archives found inside the source
 * @param sampleMode      cap the number of kept files at {@code maxFiles}
 * @param maxFiles        the cap applied in sample mode
 * @param sampleRandom    pick the sample at random instead of the first {@code maxFiles} in name order
 */
@Builder(toBuilder = true)
public record ExtractionOptions(Set<String> validExtensions,
                                boolean extractNested,
                                boolean sampleMode,
                                int maxFiles,
                                boolean sampleRandom) {

    public ExtractionOptions {
        validExtensions = validExtensions == null ? Set.of() : validExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static ExtractionOptions from(ImageProcessingConfig.Extraction extraction) {
        return new ExtractionOptions(extraction.validExtensions(), extraction.extractNested(),
                extraction.sampleMode(), extraction.maxFiles(), extraction.sampleRandom());
    }

    /**
     * The same options restricted to the first {@code maxFiles} valid images.
     */
    public ExtractionOptions firstN(int maxFiles) {
        return new ExtractionOptions(validExtensions, extractNested, true, maxFiles, false);
    }
}
