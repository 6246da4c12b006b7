package com.eyelevel.imageprocessor.service.pipeline;

import com.eyelevel.imageprocessor.common.json.JsonParser;
import com.eyelevel.imageprocessor.exception.BatchNotFoundException;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.BatchResult;
import com.eyelevel.imageprocessor.model.BatchSubmission;
import com.eyelevel.imageprocessor.model.ResumeHint;
import com.eyelevel.imageprocessor.service.report.ReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs batches on the managed {@code applicationTaskExecutor} and keeps track of them for status queries.
 * <p>
 * Only running batches are held until they finish. The most recent finished outcomes stay in a bounded
 * window, which is what answers for failed batches since those never write a summary report; older
 * finished batches are looked up through their summary report.
 */
@Slf4j
@Service
public class BatchSubmissionService {

    static final int FINISHED_WINDOW = 256;

    private final PipelineOrchestrator orchestrator;
    private final BatchIdGenerator batchIdGenerator;
    private final ReportWriter reportWriter;
    private final JsonParser jsonParser;
    private final AsyncTaskExecutor taskExecutor;
    private final Map<String, BatchSubmission> running = new ConcurrentHashMap<>();
    private final Map<String, BatchSubmission> finished;

    @Autowired
    public BatchSubmissionService(PipelineOrchestrator orchestrator, BatchIdGenerator batchIdGenerator,
                                  ReportWriter reportWriter, JsonParser jsonParser,
                                  @Qualifier("applicationTaskExecutor") AsyncTaskExecutor taskExecutor) {
        this(orchestrator, batchIdGenerator, reportWriter, jsonParser, taskExecutor, FINISHED_WINDOW);
    }

    BatchSubmissionService(PipelineOrchestrator orchestrator, BatchIdGenerator batchIdGenerator,
                           ReportWriter reportWriter, JsonParser jsonParser, AsyncTaskExecutor taskExecutor,
                           int finishedWindow) {
        this.orchestrator = orchestrator;
        this.batchIdGenerator = batchIdGenerator;
        this.reportWriter = reportWriter;
        this.jsonParser = jsonParser;
        this.taskExecutor = taskExecutor;
        this.finished = Collections.synchronizedMap(new LinkedHashMap<String, BatchSubmission>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, BatchSubmission> eldest) {
                return size() > finishedWindow;
            }
        });
    }

    /**
     * Queues a new batch for the given source.
     *
     * @return the tracked submission, still in {@code PROCESSING} state.
     */
    public BatchSubmission submit(String source) {
        return start(batchIdGenerator.next(), source);
    }

    /**
     * Re-runs a batch under its existing id.
     *
     * @throws ImageProcessingException if the batch is still running or the id is not acceptable.
     */
    public BatchSubmission resume(String batchId, String source) {
        if (!BatchIdGenerator.isAcceptable(batchId)) {
            throw new ImageProcessingException("Invalid batch id: " + batchId);
        }
        return start(batchId, source);
    }

    /**
     * @throws BatchNotFoundException if the batch is neither tracked nor has a summary report.
     */
    public BatchSubmission status(String batchId) {
        final BatchSubmission inFlight = running.get(batchId);
        if (inFlight != null) {
            return inFlight;
        }
        final BatchSubmission recent = finished.get(batchId);
        if (recent != null) {
            return recent;
        }
        if (BatchIdGenerator.isAcceptable(batchId)) {
            final Path report = reportWriter.summaryPathFor(batchId);
            if (Files.isRegularFile(report)) {
                final BatchResult result = jsonParser.parseFile(report, BatchResult.class);
                return BatchSubmission.processing(batchId, result.source()).finishedWith(result);
            }
        }
        throw new BatchNotFoundException(batchId);
    }

    private BatchSubmission start(String batchId, String source) {
        final BatchSubmission submission = BatchSubmission.processing(batchId, source);
        running.compute(batchId, (id, current) -> {
            if (current != null) {
                throw new ImageProcessingException("Batch " + id + " is still processing.");
            }
            return submission;
        });
        finished.remove(batchId);
        log.info("[{}] Queuing batch for source '{}'.", batchId, source);

        final CompletableFuture<BatchResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> orchestrator.process(source, ResumeHint.ofBatch(batchId)),
                    taskExecutor);
        } catch (TaskRejectedException e) {
            running.remove(batchId, submission);
            log.warn("[{}] Batch queue is full; rejecting submission.", batchId);
            throw new ImageProcessingException("The batch queue is full. Try again later.", e);
        }
        future
                .thenAccept(result -> {
                    finish(submission, result);
                    log.info("[{}] Batch finished{}.", batchId,
                            result.isSuccessful() ? "" : " with error: " + result.error());
                })
                .exceptionally(ex -> {
                    log.error("[{}] Batch execution failed unexpectedly.", batchId, ex);
                    finish(submission, BatchResult.builder()
                            .batchId(batchId)
                            .source(source)
                            .error(ex.getMessage())
                            .build());
                    return null;
                });
        return submission;
    }

    private void finish(BatchSubmission submission, BatchResult result) {
        finished.put(submission.batchId(), submission.finishedWith(result));
        running.remove(submission.batchId(), submission);
    }
}
