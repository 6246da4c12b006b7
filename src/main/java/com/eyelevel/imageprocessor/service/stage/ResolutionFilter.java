package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.ImageInspection;
import com.eyelevel.imageprocessor.model.ItemOutcome;
import com.eyelevel.imageprocessor.model.RejectionInfo;
import com.eyelevel.imageprocessor.model.WorkItem;
import com.eyelevel.imageprocessor.service.dispatch.DispatchOptions;
import com.eyelevel.imageprocessor.service.dispatch.ParallelDispatcher;
import com.eyelevel.imageprocessor.service.dispatch.ProgressTracker;
import com.eyelevel.imageprocessor.service.image.ImageCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps images whose width and height both reach the configured minimum resolution.
 * Accepted files are copied into the filter directory; the decision depends only on the image dimensions.
 */
@Slf4j
@Component
public class ResolutionFilter {

    private final ImageCodec imageCodec;
    private final ParallelDispatcher dispatcher;
    private final ImageProcessingConfig config;
    private final int minResolution;

    public ResolutionFilter(ImageCodec imageCodec, ParallelDispatcher dispatcher, ImageProcessingConfig config) {
        this.imageCodec = imageCodec;
        this.dispatcher = dispatcher;
        this.config = config;
        this.minResolution = config.filter().minResolution();
    }

    public boolean meetsCriteria(ImageInspection inspection) {
        return inspection.isReadable()
                && inspection.width() >= minResolution
                && inspection.height() >= minResolution;
    }

    public boolean meetsCriteria(Path image) {
        return meetsCriteria(imageCodec.inspect(image));
    }

    public FilterResult filter(List<WorkItem> items, Path filteredDir, String contextInfo) {
        try {
            Files.createDirectories(filteredDir);
        } catch (IOException e) {
            throw new ImageProcessingException("Unable to create filter directory " + filteredDir, e);
        }

        final ProgressTracker<ImageInspection> tracker = new ProgressTracker<>(contextInfo, "Filtering",
                items.size(), config.progress().logInterval());
        final List<ItemOutcome<ImageInspection>> inspections = dispatcher.dispatch(items,
                item -> imageCodec.inspect(item.currentPath()),
                DispatchOptions.<ImageInspection>from(config.parallel()).withCallback(tracker));

        final List<WorkItem> accepted = new ArrayList<>();
        final Map<String, RejectionInfo> rejected = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            final WorkItem item = items.get(i);
            final ItemOutcome<ImageInspection> outcome = inspections.get(i);
            final String key = item.originalPath().toString();
            if (!outcome.isSuccess()) {
                rejected.put(key, RejectionInfo.unreadable(outcome.failureReason()));
                continue;
            }
            final ImageInspection inspection = outcome.value();
            if (!inspection.isReadable()) {
                rejected.put(key, RejectionInfo.unreadable(inspection.error()));
            } else if (!meetsCriteria(inspection)) {
                rejected.put(key, new RejectionInfo(
                        "Below minimum resolution of " + minResolution + "px",
                        inspection.width(), inspection.height(), inspection.format()));
            } else {
                final Path target = filteredDir.resolve(item.currentPath().getFileName());
                try {
                    Files.copy(item.currentPath(), target, StandardCopyOption.REPLACE_EXISTING);
                    accepted.add(item.withCurrentPath(target));
                } catch (IOException e) {
                    log.warn("[{}] Could not copy accepted image '{}': {}", contextInfo, item.currentPath(),
                            e.getMessage());
                    rejected.put(key, new RejectionInfo("Copy failed: " + e.getMessage(),
                            inspection.width(), inspection.height(), inspection.format()));
                }
            }
        }
        log.info("[{}] Filter kept {} of {} images ({} rejected, minimum {}px).", contextInfo, accepted.size(),
                items.size(), rejected.size(), minResolution);
        return new FilterResult(accepted, rejected);
    }
}
