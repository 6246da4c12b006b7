package com.eyelevel.imageprocessor.service.pipeline;

import com.eyelevel.imageprocessor.exception.BatchNotFoundException;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.BatchResult;
import com.eyelevel.imageprocessor.model.BatchStatus;
import com.eyelevel.imageprocessor.model.BatchSubmission;
import com.eyelevel.imageprocessor.model.ResumeHint;
import com.eyelevel.imageprocessor.service.report.FileReportWriter;
import com.eyelevel.imageprocessor.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchSubmissionServiceTest {

    @TempDir
    Path root;

    private final PipelineOrchestrator orchestrator = mock(PipelineOrchestrator.class);
    private final BatchIdGenerator batchIdGenerator = mock(BatchIdGenerator.class);
    private FileReportWriter reportWriter;

    @BeforeEach
    void setUp() {
        reportWriter = new FileReportWriter(TestFixtures.jsonSerializer(), TestFixtures.config(root));
        when(batchIdGenerator.next()).thenReturn("batch-new");
    }

    @Test
    @DisplayName("A submitted batch runs under its generated id and its final status is tracked")
    void submitTracksOutcome() {
        when(orchestrator.process(eq("/data/in.zip"), any(ResumeHint.class)))
                .thenReturn(success("batch-new", "/data/in.zip"));
        final BatchSubmissionService service = service(new TaskExecutorAdapter(Runnable::run));

        final BatchSubmission submitted = service.submit("/data/in.zip");

        assertThat(submitted.batchId()).isEqualTo("batch-new");
        assertThat(submitted.status()).isEqualTo(BatchStatus.PROCESSING);
        final BatchSubmission finished = service.status("batch-new");
        assertThat(finished.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(finished.result().packagePath()).isEqualTo("/out/batch-new.zip");
        verify(orchestrator).process("/data/in.zip", ResumeHint.ofBatch("batch-new"));
    }

    @Test
    @DisplayName("A batch without valid images ends in the EMPTY state")
    void emptyBatchStatus() {
        when(orchestrator.process(any(), any(ResumeHint.class))).thenReturn(BatchResult.builder()
                .batchId("batch-new").source("/data/empty").error(BatchResult.NO_VALID_IMAGES).build());
        final BatchSubmissionService service = service(new TaskExecutorAdapter(Runnable::run));

        service.submit("/data/empty");

        assertThat(service.status("batch-new").status()).isEqualTo(BatchStatus.EMPTY);
    }

    @Test
    @DisplayName("Resuming a batch that is still running is refused")
    void resumeWhileRunning() {
        final Executor neverRuns = task -> {
        };
        final BatchSubmissionService service = service(new TaskExecutorAdapter(neverRuns));
        service.submit("/data/in.zip");

        assertThatThrownBy(() -> service.resume("batch-new", "/data/in.zip"))
                .isInstanceOf(ImageProcessingException.class)
                .hasMessageContaining("still processing");
        assertThatThrownBy(() -> service.resume("bad/id", "/data/in.zip"))
                .isInstanceOf(ImageProcessingException.class);
    }

    @Test
    @DisplayName("A full executor queue rejects the submission and forgets it")
    void queueFull() {
        final AsyncTaskExecutor rejecting = mock(AsyncTaskExecutor.class);
        doThrow(new TaskRejectedException("full")).when(rejecting).execute(any(Runnable.class));
        final BatchSubmissionService service = service(rejecting);

        assertThatThrownBy(() -> service.submit("/data/in.zip"))
                .isInstanceOf(ImageProcessingException.class)
                .hasMessageContaining("queue is full");
        assertThatThrownBy(() -> service.status("batch-new")).isInstanceOf(BatchNotFoundException.class);
    }

    @Test
    @DisplayName("Untracked batches are answered from their summary report")
    void statusFromReport() {
        reportWriter.writeSummary(success("batch-old", "/data/old.zip"));
        final BatchSubmissionService service = service(new TaskExecutorAdapter(Runnable::run));

        final BatchSubmission status = service.status("batch-old");

        assertThat(status.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(status.source()).isEqualTo("/data/old.zip");
        assertThatThrownBy(() -> service.status("batch-unknown")).isInstanceOf(BatchNotFoundException.class);
    }

    @Test
    @DisplayName("A failed batch keeps its error status although it writes no summary report")
    void failedBatchStatusIsKept() {
        when(orchestrator.process(any(), any(ResumeHint.class))).thenReturn(BatchResult.builder()
                .batchId("batch-new").source("/data/in.zip").error("disk full").build());
        final BatchSubmissionService service = service(new TaskExecutorAdapter(Runnable::run));

        service.submit("/data/in.zip");

        final BatchSubmission status = service.status("batch-new");
        assertThat(status.status()).isEqualTo(BatchStatus.FAILED);
        assertThat(status.result().error()).isEqualTo("disk full");
    }

    @Test
    @DisplayName("Only a bounded window of finished batches stays in memory; older ones come from their reports")
    void finishedBatchesAreEvicted() {
        when(batchIdGenerator.next()).thenReturn("batch-1", "batch-2", "batch-3");
        when(orchestrator.process(eq("/data/ok.zip"), any(ResumeHint.class)))
                .thenAnswer(invocation -> {
                    final String batchId = invocation.<ResumeHint>getArgument(1).batchId();
                    final BatchResult result = success(batchId, "/data/ok.zip");
                    reportWriter.writeSummary(result);
                    return result;
                });
        when(orchestrator.process(eq("/data/bad.zip"), any(ResumeHint.class)))
                .thenReturn(BatchResult.builder().batchId("batch-1").source("/data/bad.zip").error("boom").build());
        final BatchSubmissionService service = new BatchSubmissionService(orchestrator, batchIdGenerator,
                reportWriter, TestFixtures.jsonParser(), new TaskExecutorAdapter(Runnable::run), 2);

        service.submit("/data/bad.zip");
        service.submit("/data/ok.zip");
        service.submit("/data/ok.zip");

        assertThatThrownBy(() -> service.status("batch-1")).isInstanceOf(BatchNotFoundException.class);
        assertThat(service.status("batch-2").status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(service.status("batch-3").result().packagePath()).isEqualTo("/out/batch-3.zip");
    }

    @Test
    @DisplayName("Concurrent resumes of the same batch start it exactly once")
    void concurrentResumeStartsOnce() throws Exception {
        final AtomicInteger scheduled = new AtomicInteger();
        final Executor neverRuns = task -> scheduled.incrementAndGet();
        final BatchSubmissionService service = service(new TaskExecutorAdapter(neverRuns));
        final int callers = 16;
        final CountDownLatch start = new CountDownLatch(1);
        final AtomicInteger accepted = new AtomicInteger();
        final AtomicInteger refused = new AtomicInteger();
        final ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            final List<Future<?>> calls = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                calls.add(pool.submit(() -> {
                    start.await();
                    try {
                        service.resume("batch-old", "/data/in.zip");
                        accepted.incrementAndGet();
                    } catch (ImageProcessingException e) {
                        refused.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> call : calls) {
                call.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(accepted).hasValue(1);
        assertThat(refused).hasValue(callers - 1);
        assertThat(scheduled).hasValue(1);
        assertThat(service.status("batch-old").status()).isEqualTo(BatchStatus.PROCESSING);
    }

    private BatchSubmissionService service(AsyncTaskExecutor executor) {
        return new BatchSubmissionService(orchestrator, batchIdGenerator, reportWriter, TestFixtures.jsonParser(),
                executor);
    }

    private static BatchResult success(String batchId, String source) {
        return BatchResult.builder()
                .batchId(batchId)
                .source(source)
                .stats(Map.of("extracted", 2, "converted", 2))
                .packagePath("/out/" + batchId + ".zip")
                .timestamp(Instant.now())
                .build();
    }
}
