package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.ItemOutcome;
import com.eyelevel.imageprocessor.model.WorkItem;
import com.eyelevel.imageprocessor.service.dispatch.DispatchOptions;
import com.eyelevel.imageprocessor.service.dispatch.ParallelDispatcher;
import com.eyelevel.imageprocessor.service.dispatch.ProgressTracker;
import com.eyelevel.imageprocessor.service.image.ConversionOptions;
import com.eyelevel.imageprocessor.service.image.ImageCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ImageConverter {

    private final ImageCodec imageCodec;
    private final ParallelDispatcher dispatcher;
    private final ImageProcessingConfig config;
    private final ConversionOptions options;

    public ImageConverter(ImageCodec imageCodec, ParallelDispatcher dispatcher, ImageProcessingConfig config) {
        this.imageCodec = imageCodec;
        this.dispatcher = dispatcher;
        this.config = config;
        this.options = ConversionOptions.from(config.conversion());
        if (!imageCodec.canWrite(options.format())) {
            log.warn("No image writer is available for output format '{}'; every conversion will fail.",
                    options.format());
        }
    }

    public ConvertResult convert(List<WorkItem> items, Path convertedDir, String contextInfo) {
        try {
            Files.createDirectories(convertedDir);
        } catch (IOException e) {
            throw new ImageProcessingException("Unable to create conversion directory " + convertedDir, e);
        }

        final ProgressTracker<Path> tracker = new ProgressTracker<>(contextInfo, "Converting", items.size(),
                config.progress().logInterval());
        final List<ItemOutcome<Path>> outcomes = dispatcher.dispatch(items,
                item -> imageCodec.convert(item.currentPath(), convertedDir, options),
                DispatchOptions.<Path>from(config.parallel()).withCallback(tracker));

        final List<WorkItem> converted = new ArrayList<>(items.size());
        final Map<String, String> failures = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            final WorkItem item = items.get(i);
            final ItemOutcome<Path> outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                converted.add(item.withCurrentPath(outcome.value()));
            } else {
                log.warn("[{}] Conversion of '{}' failed: {}", contextInfo, item.originalPath(),
                        outcome.failureReason());
                failures.put(item.originalPath().toString(), outcome.failureReason());
            }
        }
        log.info("[{}] Converted {} of {} images to {} ({} failed).", contextInfo, converted.size(), items.size(),
                options.format(), failures.size());
        return new ConvertResult(converted, failures);
    }
}
