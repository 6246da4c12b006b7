package com.eyelevel.imageprocessor.service.extract;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.SourceExtractionException;
import com.eyelevel.imageprocessor.exception.UnsupportedSourceException;
import com.eyelevel.imageprocessor.model.ItemOutcome;
import com.eyelevel.imageprocessor.service.dispatch.DispatchOptions;
import com.eyelevel.imageprocessor.service.dispatch.ParallelDispatcher;
import com.eyelevel.imageprocessor.service.image.ImageCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a source locator into a sorted list of valid image files under a scratch directory.
 * <p>
 * The destination directory is emptied before every attempt, so a retried extraction never sees
 * leftovers from a failed one. Files that cannot be decoded as images are removed, and in sample mode
 * only {@code maxFiles} of the valid images are kept.
 */
@Slf4j
@Service
public class SourceExtractor {

    private final ArchiveReaderFactory readerFactory;
    private final ImageCodec imageCodec;
    private final ParallelDispatcher dispatcher;
    private final ImageProcessingConfig config;

    public SourceExtractor(ArchiveReaderFactory readerFactory, ImageCodec imageCodec, ParallelDispatcher dispatcher,
                           ImageProcessingConfig config) {
        this.readerFactory = readerFactory;
        this.imageCodec = imageCodec;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    /**
     * @return the valid image files, sorted by path. Empty when the source holds no usable image.
     * @throws UnsupportedSourceException if no reader accepts the source.
     * @throws SourceExtractionException  if the source is unreadable or I/O keeps failing after retries.
     */
    @Retryable(
            retryFor = {IOException.class},
            noRetryFor = {SourceExtractionException.class},
            maxAttemptsExpression = "#{${app.processing.extraction.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.extraction.retry.delay-ms}}"),
            listeners = {"extractionRetryListener"}
    )
    public List<Path> extract(String source, Path destinationDir, ExtractionOptions options, String contextInfo)
            throws IOException {
        final ArchiveReader reader = readerFactory.getReader(source)
                .orElseThrow(() -> new UnsupportedSourceException(source));
        log.info("[{}] Extracting '{}' with {}.", contextInfo, source, reader.getClass().getSimpleName());

        resetDirectory(destinationDir);
        final List<Path> candidates = reader.extract(source, destinationDir, options);
        final List<Path> valid = keepValidImages(candidates, contextInfo);
        final List<Path> selected = applySampling(valid, options, contextInfo);

        log.info("[{}] Extraction finished: {} candidates, {} valid, {} kept.", contextInfo, candidates.size(),
                valid.size(), selected.size());
        return selected;
    }

    @Recover
    public List<Path> recoverFromIoException(IOException e, String source, Path destinationDir,
                                             ExtractionOptions options, String contextInfo) {
        final String errorMessage = "Failed to extract source after multiple retries due to a persistent I/O error.";
        log.error("[{}] {}", contextInfo, errorMessage, e);
        throw new SourceExtractionException(errorMessage, e);
    }

    @Recover
    public List<Path> recoverFromRuntimeException(RuntimeException e, String source, Path destinationDir,
                                                  ExtractionOptions options, String contextInfo) {
        log.error("[{}] Extraction of '{}' failed and was not retried: {}", contextInfo, source, e.getMessage());
        throw e;
    }

    private void resetDirectory(Path directory) throws IOException {
        if (Files.exists(directory)) {
            FileUtils.deleteDirectory(directory.toFile());
        }
        Files.createDirectories(directory);
    }

    private List<Path> keepValidImages(List<Path> candidates, String contextInfo) throws IOException {
        final List<ItemOutcome<Boolean>> checks = dispatcher.dispatch(candidates, imageCodec::isValidImage,
                DispatchOptions.from(config.parallel()));
        final List<Path> valid = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            final Path candidate = candidates.get(i);
            if (Boolean.TRUE.equals(checks.get(i).value())) {
                valid.add(candidate);
            } else {
                log.debug("[{}] Dropping '{}': not a readable image.", contextInfo, candidate.getFileName());
                Files.deleteIfExists(candidate);
            }
        }
        valid.sort(Comparator.naturalOrder());
        return valid;
    }

    private List<Path> applySampling(List<Path> valid, ExtractionOptions options, String contextInfo)
            throws IOException {
        if (!options.sampleMode() || options.maxFiles() <= 0 || valid.size() <= options.maxFiles()) {
            return valid;
        }
        final List<Path> pool = new ArrayList<>(valid);
        if (options.sampleRandom()) {
            Collections.shuffle(pool);
        }
        final List<Path> selected = new ArrayList<>(pool.subList(0, options.maxFiles()));
        selected.sort(Comparator.naturalOrder());

        final Set<Path> keep = new HashSet<>(selected);
        for (Path path : valid) {
            if (!keep.contains(path)) {
                Files.deleteIfExists(path);
            }
        }
        log.info("[{}] Sample mode kept {} of {} images ({}).", contextInfo, selected.size(), valid.size(),
                options.sampleRandom() ? "random" : "first in name order");
        return selected;
    }
}
