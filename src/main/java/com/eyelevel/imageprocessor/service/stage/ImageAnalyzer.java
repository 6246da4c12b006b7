package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.model.AnalysisSummary;
import com.eyelevel.imageprocessor.model.ImageInspection;
import com.eyelevel.imageprocessor.model.ItemOutcome;
import com.eyelevel.imageprocessor.service.dispatch.DispatchOptions;
import com.eyelevel.imageprocessor.service.dispatch.ParallelDispatcher;
import com.eyelevel.imageprocessor.service.image.ImageCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Inspects a set of images and aggregates their dimensions, formats, sizes and aspect classes.
 */
@Slf4j
@Component
public class ImageAnalyzer {

    public static final String SQUARE = "square";
    public static final String LANDSCAPE = "landscape";
    public static final String PORTRAIT = "portrait";

    private static final double BYTES_PER_MB = 1024d * 1024d;

    private final ImageCodec imageCodec;
    private final ParallelDispatcher dispatcher;
    private final ImageProcessingConfig config;

    public ImageAnalyzer(ImageCodec imageCodec, ParallelDispatcher dispatcher, ImageProcessingConfig config) {
        this.imageCodec = imageCodec;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    /**
     * Ratios between 0.9 and 1.1 inclusive count as square.
     */
    public static String aspectType(double aspectRatio) {
        if (aspectRatio >= 0.9 && aspectRatio <= 1.1) {
            return SQUARE;
        }
        return aspectRatio > 1.1 ? LANDSCAPE : PORTRAIT;
    }

    public AnalysisSummary analyze(List<Path> images, String contextInfo) {
        if (images.isEmpty()) {
            return AnalysisSummary.empty();
        }
        final List<ItemOutcome<ImageInspection>> outcomes = dispatcher.dispatch(images, imageCodec::inspect,
                DispatchOptions.from(config.parallel()));
        final List<ImageInspection> inspections = outcomes.stream()
                .map(o -> o.isSuccess() ? o.value() : ImageInspection.unreadable(o.failureReason()))
                .toList();
        final AnalysisSummary summary = summarize(inspections);
        log.info("[{}] Analyzed {} images: {} meet {}px ({}%), average {}x{} px, {} MB.", contextInfo,
                summary.total(), summary.meetResolution(), config.filter().minResolution(),
                summary.meetResolutionPercent(), summary.averageWidth(), summary.averageHeight(),
                summary.averageSizeMb());
        return summary;
    }

    AnalysisSummary summarize(List<ImageInspection> inspections) {
        final int minResolution = config.filter().minResolution();
        final Map<String, Integer> formats = new TreeMap<>();
        final Map<String, Integer> aspectTypes = new TreeMap<>();
        final Map<String, Integer> dimensions = new TreeMap<>();
        int failed = 0;
        int meetResolution = 0;
        long totalWidth = 0;
        long totalHeight = 0;
        long totalBytes = 0;

        for (ImageInspection inspection : inspections) {
            if (!inspection.isReadable()) {
                failed++;
                continue;
            }
            if (inspection.width() >= minResolution && inspection.height() >= minResolution) {
                meetResolution++;
            }
            totalWidth += inspection.width();
            totalHeight += inspection.height();
            totalBytes += inspection.fileSizeBytes();
            formats.merge(inspection.format() == null ? "unknown" : inspection.format(), 1, Integer::sum);
            if (inspection.aspectRatio() > 0) {
                aspectTypes.merge(aspectType(inspection.aspectRatio()), 1, Integer::sum);
            }
            dimensions.merge(inspection.width() + "x" + inspection.height(), 1, Integer::sum);
        }

        final int total = inspections.size();
        final int valid = total - failed;
        return AnalysisSummary.builder()
                .total(total)
                .failed(failed)
                .meetResolution(meetResolution)
                .meetResolutionPercent(total > 0 ? round(meetResolution * 100d / total, 1) : 0d)
                .averageWidth(valid > 0 ? Math.round((double) totalWidth / valid) : 0L)
                .averageHeight(valid > 0 ? Math.round((double) totalHeight / valid) : 0L)
                .averageSizeMb(valid > 0 ? round(totalBytes / (valid * BYTES_PER_MB), 2) : 0d)
                .formats(formats)
                .aspectTypes(aspectTypes)
                .dimensions(dimensions)
                .build();
    }

    static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
