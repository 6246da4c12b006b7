package com.eyelevel.imageprocessor.config;

import com.eyelevel.imageprocessor.service.dispatch.DispatchMode;
import lombok.Builder;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Set;

/**
 * Binds application properties under the "app.processing" prefix to an immutable, strongly-typed
 * configuration object. It is bound once at start-up and handed to each component through its constructor.
 */
@Builder(toBuilder = true)
@ConfigurationProperties(prefix = "app.processing")
public record ImageProcessingConfig(@DefaultValue Storage storage,
                                    @DefaultValue Extraction extraction,
                                    @DefaultValue Filter filter,
                                    @DefaultValue Conversion conversion,
                                    @DefaultValue Naming naming,
                                    @DefaultValue Packaging packaging,
                                    @DefaultValue Parallel parallel,
                                    @DefaultValue Memory memory,
                                    @DefaultValue Checkpoint checkpoint,
                                    @DefaultValue Records records,
                                    @DefaultValue Progress progress) {

    @Builder(toBuilder = true)
    public record RetryConfig(@DefaultValue("2") int attempts,
                              @DefaultValue("500") long delayMs) {
    }

    /**
     * Where scratch data, packages and reports are written.
     */
    @Builder(toBuilder = true)
    public record Storage(@DefaultValue("data/temp") String tempDirectory,
                          @DefaultValue("output") String outputDirectory,
                          @DefaultValue("output/reports") String reportDirectory,
                          @DefaultValue("true") boolean cleanupScratch) {
    }

    @Builder(toBuilder = true)
    public record Extraction(@DefaultValue({"jpg", "jpeg", "png", "gif", "bmp", "webp", "tiff", "tif"})
                             Set<String> validExtensions,
                             @DefaultValue("false") boolean extractNested,
                             @DefaultValue("false") boolean sampleMode,
                             @DefaultValue("100") int maxFiles,
                             @DefaultValue("true") boolean sampleRandom,
                             @DefaultValue("100") int analysisSampleSize,
                             @DefaultValue("300") long downloadTimeoutSeconds,
                             @DefaultValue RetryConfig retry) {
    }

    @Builder(toBuilder = true)
    public record Filter(@DefaultValue("800") int minResolution) {
    }

    /**
     * Output encoding settings. {@code outputFormat} must name a format with an ImageIO writer.
     */
    @Builder(toBuilder = true)
    public record Conversion(@DefaultValue("jpg") String outputFormat,
                             @DefaultValue("90") int quality,
                             @DefaultValue("true") boolean preserveMetadata,
                             @DefaultValue("false") boolean resizeIfLarger,
                             @DefaultValue("3840") int maxWidth,
                             @DefaultValue("2160") int maxHeight) {
    }

    @Builder(toBuilder = true)
    public record Naming(@DefaultValue("bid") String prefix,
                         @DefaultValue("6") int sequenceDigits) {
    }

    @Builder(toBuilder = true)
    public record Packaging(@DefaultValue("9") int compressionLevel,
                            @DefaultValue("false") boolean includeMetadata,
                            @DefaultValue("true") boolean deleteAfterPackaging) {
    }

    /**
     * Worker pool settings for per-file work. A {@code maxWorkers} of zero means "one per available processor".
     */
    @Builder(toBuilder = true)
    public record Parallel(@DefaultValue("true") boolean enabled,
                           @DefaultValue("0") int maxWorkers,
                           @DefaultValue("THREADS") DispatchMode mode) {

        public int effectiveMaxWorkers() {
            return maxWorkers > 0 ? maxWorkers : Runtime.getRuntime().availableProcessors();
        }
    }

    @Builder(toBuilder = true)
    public record Memory(@DefaultValue("100") int batchSize,
                         @DefaultValue("10") int minBatchSize,
                         @DefaultValue("80") double pressureThresholdPercent,
                         @DefaultValue("95") double criticalThresholdPercent) {
    }

    @Builder(toBuilder = true)
    public record Checkpoint(@DefaultValue("true") boolean enabled,
                             @DefaultValue("checkpoints") String directory,
                             @DefaultValue("20") int retention) {
    }

    @Builder(toBuilder = true)
    public record Records(@DefaultValue("true") boolean enabled) {
    }

    @Builder(toBuilder = true)
    public record Progress(@DefaultValue("100") int logInterval) {
    }
}
