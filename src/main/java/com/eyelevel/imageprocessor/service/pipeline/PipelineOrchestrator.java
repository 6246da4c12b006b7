package com.eyelevel.imageprocessor.service.pipeline;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.CheckpointStoreException;
import com.eyelevel.imageprocessor.model.AnalysisSummary;
import com.eyelevel.imageprocessor.model.Batch;
import com.eyelevel.imageprocessor.model.BatchResult;
import com.eyelevel.imageprocessor.model.BatchStatus;
import com.eyelevel.imageprocessor.model.CheckpointPayload;
import com.eyelevel.imageprocessor.model.ImageStatus;
import com.eyelevel.imageprocessor.model.PhaseRecord;
import com.eyelevel.imageprocessor.model.PhaseStatus;
import com.eyelevel.imageprocessor.model.PipelineStage;
import com.eyelevel.imageprocessor.model.RejectionInfo;
import com.eyelevel.imageprocessor.model.ResumeHint;
import com.eyelevel.imageprocessor.model.WorkItem;
import com.eyelevel.imageprocessor.service.checkpoint.CheckpointRecorder;
import com.eyelevel.imageprocessor.service.checkpoint.CheckpointStore;
import com.eyelevel.imageprocessor.service.extract.ExtractionOptions;
import com.eyelevel.imageprocessor.service.extract.SourceExtractor;
import com.eyelevel.imageprocessor.service.memory.MemoryAwareBatcher;
import com.eyelevel.imageprocessor.service.memory.MemoryBudgetAdvisor;
import com.eyelevel.imageprocessor.service.record.RecordStore;
import com.eyelevel.imageprocessor.service.report.ReportWriter;
import com.eyelevel.imageprocessor.service.stage.ConvertResult;
import com.eyelevel.imageprocessor.service.stage.FilterResult;
import com.eyelevel.imageprocessor.service.stage.ImageAnalyzer;
import com.eyelevel.imageprocessor.service.stage.ImageConverter;
import com.eyelevel.imageprocessor.service.stage.PackageResult;
import com.eyelevel.imageprocessor.service.stage.Packager;
import com.eyelevel.imageprocessor.service.stage.RenameResult;
import com.eyelevel.imageprocessor.service.stage.Renamer;
import com.eyelevel.imageprocessor.service.stage.ResolutionFilter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives one batch through extract, rename, filter, convert and package.
 * <p>
 * Extracted items are processed in memory-bounded sub-batches; each sub-batch goes through rename, filter and
 * convert before the next one is cut. Every phase and every sub-batch step is bracketed by a {@code started}
 * and a {@code completed} checkpoint. Per-item failures are counted and never abort the batch.
 * <p>
 * {@link #process} never throws: any unrecovered failure is reported through {@link BatchResult#error()},
 * preceded by an {@code error} checkpoint naming the phase that failed.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final SourceExtractor sourceExtractor;
    private final Renamer renamer;
    private final ResolutionFilter resolutionFilter;
    private final ImageAnalyzer imageAnalyzer;
    private final ImageConverter imageConverter;
    private final Packager packager;
    private final MemoryAwareBatcher batcher;
    private final MemoryBudgetAdvisor memoryAdvisor;
    private final CheckpointRecorder checkpoints;
    private final CheckpointStore checkpointStore;
    private final RecordStore recordStore;
    private final ReportWriter reportWriter;
    private final BatchIdGenerator batchIdGenerator;
    private final ImageProcessingConfig config;

    public PipelineOrchestrator(SourceExtractor sourceExtractor, Renamer renamer, ResolutionFilter resolutionFilter,
                                ImageAnalyzer imageAnalyzer, ImageConverter imageConverter, Packager packager,
                                MemoryAwareBatcher batcher, MemoryBudgetAdvisor memoryAdvisor,
                                CheckpointRecorder checkpoints, CheckpointStore checkpointStore,
                                RecordStore recordStore, ReportWriter reportWriter,
                                BatchIdGenerator batchIdGenerator, ImageProcessingConfig config) {
        this.sourceExtractor = sourceExtractor;
        this.renamer = renamer;
        this.resolutionFilter = resolutionFilter;
        this.imageAnalyzer = imageAnalyzer;
        this.imageConverter = imageConverter;
        this.packager = packager;
        this.batcher = batcher;
        this.memoryAdvisor = memoryAdvisor;
        this.checkpoints = checkpoints;
        this.checkpointStore = checkpointStore;
        this.recordStore = recordStore;
        this.reportWriter = reportWriter;
        this.batchIdGenerator = batchIdGenerator;
        this.config = config;
    }

    public BatchResult process(String source) {
        return process(source, null);
    }

    /**
     * Runs a batch to completion.
     *
     * @param source     a ZIP file, directory, image file or http(s) URL
     * @param resumeHint when present, the batch keeps the hinted id; extraction is always redone
     * @return the outcome; {@code error} is set when the batch did not produce a package
     */
    public BatchResult process(String source, ResumeHint resumeHint) {
        final String batchId = resolveBatchId(resumeHint);
        if (!BatchIdGenerator.isAcceptable(batchId)) {
            log.error("Rejecting batch id '{}': only letters, digits and dashes are allowed.", batchId);
            return BatchResult.builder()
                    .batchId(batchId)
                    .source(source)
                    .timestamp(Instant.now())
                    .error("invalid batch id: " + batchId)
                    .build();
        }

        final Batch batch = new Batch(batchId, source);
        for (String key : List.of(Batch.EXTRACTED, Batch.RENAMED, Batch.FILTERED, Batch.CONVERTED, Batch.PACKAGED)) {
            batch.setStat(key, 0);
        }
        final ScratchDirectories dirs = ScratchDirectories.forBatch(Path.of(config.storage().tempDirectory()), batchId);
        final PhaseTracker phase = new PhaseTracker(batch);

        log.info("[{}] Starting batch for source '{}'.", batchId, source);
        recordStore.registerBatch(batchId, source);
        try {
            return run(batch, dirs, phase);
        } catch (IOException | RuntimeException e) {
            return fail(batch, phase.current(), e);
        } finally {
            cleanupScratch(batchId, dirs);
        }
    }

    /**
     * @return the most recent {@code completed} record of the batch, if any.
     */
    public Optional<PhaseRecord> lastCompletedPhase(String batchId) {
        return checkpointStore.list(batchId).stream()
                .filter(record -> record.status() == PhaseStatus.COMPLETED)
                .findFirst();
    }

    public Optional<PhaseRecord> latestCheckpoint(String batchId) {
        return checkpointStore.latest(batchId);
    }

    private String resolveBatchId(ResumeHint resumeHint) {
        if (resumeHint == null || resumeHint.batchId() == null) {
            return batchIdGenerator.next();
        }
        final String batchId = resumeHint.batchId();
        if (!BatchIdGenerator.isAcceptable(batchId)) {
            return batchId;
        }
        try {
            final Optional<PhaseRecord> resumeFrom = resumeHint.fromCheckpoint() != null
                    ? checkpointStore.load(resumeHint.fromCheckpoint())
                    : lastCompletedPhase(batchId);
            resumeFrom.ifPresentOrElse(
                    record -> log.info("[{}] Resuming batch; last recorded phase '{}' ({}, sequence {}). Extraction is redone.",
                            batchId, record.phaseLabel(), record.status().getValue(), record.sequenceNumber()),
                    () -> log.info("[{}] No checkpoints recorded for this batch id; processing from the start.", batchId));
        } catch (CheckpointStoreException e) {
            log.warn("[{}] Could not read checkpoints for resume; starting over.", batchId, e);
        }
        return batchId;
    }

    private BatchResult run(Batch batch, ScratchDirectories dirs, PhaseTracker phase) throws IOException {
        final String batchId = batch.getBatchId();

        // Extract
        phase.start(PipelineStage.EXTRACT.label(), CheckpointPayload.empty());
        final List<Path> extracted = sourceExtractor.extract(batch.getSource(), dirs.extracted(),
                ExtractionOptions.from(config.extraction()), batchId);
        batch.setStat(Batch.EXTRACTED, extracted.size());
        phase.complete(CheckpointPayload.ofCount(extracted.size()));

        if (extracted.isEmpty()) {
            log.warn("[{}] No valid images found in '{}'.", batchId, batch.getSource());
            recordStore.updateBatchStatus(batchId, BatchStatus.EMPTY, null, BatchResult.NO_VALID_IMAGES);
            return resultOf(batch).error(BatchResult.NO_VALID_IMAGES).build();
        }

        final List<WorkItem> items = new ArrayList<>(extracted.size());
        for (Path path : extracted) {
            items.add(WorkItem.extracted(path, recordStore.registerImage(batchId, path).orElse(null)));
        }
        final AnalysisSummary analysis = imageAnalyzer.analyze(extracted, batchId);

        // Rename, filter and convert, one memory-bounded slice at a time
        final List<WorkItem> converted = new ArrayList<>();
        final Map<String, RejectionInfo> rejected = new LinkedHashMap<>();
        final int[] nextSequence = {1};
        final int subBatches = batcher.forEachSubBatch(items, (index, slice) -> {
            nextSequence[0] = processSubBatch(batch, dirs, phase, index, slice, nextSequence[0], converted, rejected);
            memoryAdvisor.reclaim(true);
        });
        batch.setStat(Batch.SUB_BATCHES, subBatches);
        log.info("[{}] Processed {} sub-batches: {} renamed, {} filtered, {} converted.", batchId, subBatches,
                batch.stat(Batch.RENAMED), batch.stat(Batch.FILTERED), batch.stat(Batch.CONVERTED));

        // Package
        phase.start(PipelineStage.PACKAGE.label(), CheckpointPayload.builder()
                .put(CheckpointPayload.INPUT_COUNT, converted.size()).build());
        PackageResult packaged = null;
        if (converted.isEmpty()) {
            log.warn("[{}] Nothing survived conversion; no package is created.", batchId);
            phase.complete(CheckpointPayload.ofCount(0));
        } else {
            packaged = packager.createPackage(batchId,
                    converted.stream().map(WorkItem::currentPath).toList(), batchId);
            batch.setStat(Batch.PACKAGED, packaged.fileCount());
            phase.complete(CheckpointPayload.builder()
                    .put(CheckpointPayload.COUNT, packaged.fileCount())
                    .put(CheckpointPayload.PATH, packaged.packagePath().toString())
                    .build());
        }

        // Report
        final Optional<Path> rejectedReport = reportWriter.writeRejected(rejected);
        final BatchResult.BatchResultBuilder result = resultOf(batch)
                .analysis(analysis)
                .reportPath(reportWriter.summaryPathFor(batchId).toString())
                .rejectedReportPath(rejectedReport.map(Path::toString).orElse(null));
        if (packaged != null) {
            result.packagePath(packaged.packagePath().toString()).packageSizeBytes(packaged.sizeBytes());
        }
        final BatchResult finalResult = result.build();
        reportWriter.writeSummary(finalResult);

        recordStore.updateBatchStatus(batchId, BatchStatus.COMPLETED, finalResult.packagePath(), null);
        log.info("[{}] Batch completed. Stats: {}", batchId, finalResult.stats());
        return finalResult;
    }

    /**
     * @return the sequence number the next slice should start renaming from.
     */
    private int processSubBatch(Batch batch, ScratchDirectories dirs, PhaseTracker phase, int index,
                                List<WorkItem> slice, int firstSequence, List<WorkItem> convertedSink,
                                Map<String, RejectionInfo> rejectedSink) {
        final String batchId = batch.getBatchId();
        log.info("[{}] Sub-batch {}: {} items.", batchId, index, slice.size());

        phase.start(PipelineStage.RENAME.subBatchLabel(index), subBatchStart(slice.size()));
        final RenameResult renamed = renamer.rename(slice, dirs.renamed(), firstSequence, batchId);
        batch.addToStat(Batch.RENAMED, renamed.renamed().size());
        batch.addToStat(Batch.RENAME_FAILED, renamed.failed());
        markFailedRenames(slice, renamed.renamed());
        renamed.renamed().forEach(item ->
                recordStore.updateImage(item.imageId(), ImageStatus.RENAMED, item.currentPath().toString(), null));
        phase.complete(CheckpointPayload.builder()
                .put(CheckpointPayload.COUNT, renamed.renamed().size())
                .put(CheckpointPayload.FAILED, renamed.failed())
                .build());

        phase.start(PipelineStage.FILTER.subBatchLabel(index), subBatchStart(renamed.renamed().size()));
        final FilterResult filtered = resolutionFilter.filter(renamed.renamed(), dirs.filtered(), batchId);
        batch.addToStat(Batch.FILTERED, filtered.accepted().size());
        batch.addToStat(Batch.REJECTED, filtered.rejected().size());
        rejectedSink.putAll(filtered.rejected());
        for (WorkItem item : renamed.renamed()) {
            final RejectionInfo rejection = filtered.rejected().get(item.originalPath().toString());
            if (rejection != null) {
                recordStore.updateImage(item.imageId(), ImageStatus.REJECTED, null, rejection.reason());
            } else {
                recordStore.updateImage(item.imageId(), ImageStatus.ACCEPTED, null, null);
            }
        }
        phase.complete(CheckpointPayload.builder()
                .put(CheckpointPayload.COUNT, filtered.accepted().size())
                .put(CheckpointPayload.REJECTED, filtered.rejected().size())
                .build());

        phase.start(PipelineStage.CONVERT.subBatchLabel(index), subBatchStart(filtered.accepted().size()));
        final ConvertResult converted = imageConverter.convert(filtered.accepted(), dirs.converted(), batchId);
        batch.addToStat(Batch.CONVERTED, converted.converted().size());
        batch.addToStat(Batch.CONVERT_FAILED, converted.failed());
        convertedSink.addAll(converted.converted());
        converted.converted().forEach(item ->
                recordStore.updateImage(item.imageId(), ImageStatus.CONVERTED, item.currentPath().toString(), null));
        converted.failures().forEach((originalPath, reason) -> filtered.accepted().stream()
                .filter(item -> item.originalPath().toString().equals(originalPath))
                .findFirst()
                .ifPresent(item -> recordStore.updateImage(item.imageId(), ImageStatus.FAILED, null, reason)));
        phase.complete(CheckpointPayload.builder()
                .put(CheckpointPayload.COUNT, converted.converted().size())
                .put(CheckpointPayload.FAILED, converted.failed())
                .build());

        releaseIntermediates(batchId, renamed.renamed(), filtered.accepted());
        return renamed.nextSequence();
    }

    private void markFailedRenames(List<WorkItem> slice, List<WorkItem> renamed) {
        final Set<Path> survivors = renamed.stream().map(WorkItem::originalPath).collect(Collectors.toSet());
        slice.stream()
                .filter(item -> !survivors.contains(item.originalPath()))
                .forEach(item -> recordStore.updateImage(item.imageId(), ImageStatus.FAILED, null, "rename failed"));
    }

    private static CheckpointPayload subBatchStart(int inputCount) {
        return CheckpointPayload.builder()
                .put(CheckpointPayload.INPUT_COUNT, inputCount)
                .put(CheckpointPayload.SUB_BATCH_SIZE, inputCount)
                .build();
    }

    /**
     * Renamed and filtered copies are no longer needed once their slice has been converted.
     */
    private void releaseIntermediates(String batchId, List<WorkItem> renamed, List<WorkItem> filtered) {
        for (List<WorkItem> items : List.of(renamed, filtered)) {
            for (WorkItem item : items) {
                try {
                    Files.deleteIfExists(item.currentPath());
                } catch (IOException e) {
                    log.debug("[{}] Could not remove intermediate file '{}': {}", batchId, item.currentPath(),
                            e.getMessage());
                }
            }
        }
    }

    private BatchResult fail(Batch batch, String failedPhase, Exception e) {
        final String batchId = batch.getBatchId();
        final String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        log.error("[{}] Batch failed during '{}': {}", batchId, failedPhase, message, e);
        batch.recordTransition(PipelineStage.ERROR_LABEL, PhaseStatus.ERROR);
        checkpoints.error(batchId, PipelineStage.ERROR_LABEL, CheckpointPayload.builder()
                .put(CheckpointPayload.ERROR, message)
                .put(CheckpointPayload.FAILED_PHASE, failedPhase)
                .build());
        recordStore.updateBatchStatus(batchId, BatchStatus.FAILED, null, message);
        return resultOf(batch).error(message).build();
    }

    private static BatchResult.BatchResultBuilder resultOf(Batch batch) {
        return BatchResult.builder()
                .batchId(batch.getBatchId())
                .source(batch.getSource())
                .stats(batch.statsSnapshot())
                .timestamp(Instant.now());
    }

    private void cleanupScratch(String batchId, ScratchDirectories dirs) {
        if (!config.storage().cleanupScratch()) {
            return;
        }
        try {
            FileUtils.deleteDirectory(dirs.root().toFile());
            log.debug("[{}] Removed scratch directory '{}'.", batchId, dirs.root());
        } catch (IOException e) {
            log.warn("[{}] Could not remove scratch directory '{}': {}", batchId, dirs.root(), e.getMessage());
        }
    }

    /**
     * Remembers the phase in flight so a failure can name it, and keeps the batch history and the
     * checkpoint log in step.
     */
    private final class PhaseTracker {
        private final Batch batch;
        private String current = PipelineStage.EXTRACT.label();

        private PhaseTracker(Batch batch) {
            this.batch = batch;
        }

        String current() {
            return current;
        }

        void start(String label, CheckpointPayload payload) {
            current = label;
            batch.recordTransition(label, PhaseStatus.STARTED);
            checkpoints.started(batch.getBatchId(), label, payload);
        }

        void complete(CheckpointPayload payload) {
            batch.recordTransition(current, PhaseStatus.COMPLETED);
            checkpoints.completed(batch.getBatchId(), current, payload);
        }
    }
}
