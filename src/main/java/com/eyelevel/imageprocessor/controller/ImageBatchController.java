package com.eyelevel.imageprocessor.controller;

import com.eyelevel.imageprocessor.dto.batch.CompareBatchesRequest;
import com.eyelevel.imageprocessor.dto.batch.PruneResponse;
import com.eyelevel.imageprocessor.dto.batch.SubmitBatchRequest;
import com.eyelevel.imageprocessor.dto.common.ApiResponse;
import com.eyelevel.imageprocessor.exception.BatchNotFoundException;
import com.eyelevel.imageprocessor.model.BatchComparison;
import com.eyelevel.imageprocessor.model.BatchSubmission;
import com.eyelevel.imageprocessor.model.PhaseRecord;
import com.eyelevel.imageprocessor.model.SourceAnalysis;
import com.eyelevel.imageprocessor.service.checkpoint.CheckpointStore;
import com.eyelevel.imageprocessor.service.pipeline.BatchSubmissionService;
import com.eyelevel.imageprocessor.service.pipeline.PipelineOrchestrator;
import com.eyelevel.imageprocessor.service.report.BatchComparisonService;
import com.eyelevel.imageprocessor.service.report.SourceAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the image batch pipeline: submission, status, checkpoints and analysis.
 * All responses follow the standardized {@link ApiResponse} format. Parameter constraints are
 * declared on {@link ImageBatchApi}.
 */
@Slf4j
@RestController
@RequestMapping("/batches")
@RequiredArgsConstructor
@Validated
public class ImageBatchController implements ImageBatchApi {

    private final BatchSubmissionService batchSubmissionService;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final CheckpointStore checkpointStore;
    private final SourceAnalysisService sourceAnalysisService;
    private final BatchComparisonService batchComparisonService;

    // --- 1. BATCH ENDPOINTS ---

    @Override
    @PostMapping("/v1")
    public ResponseEntity<ApiResponse<BatchSubmission>> submitBatch(@RequestBody final SubmitBatchRequest request) {
        log.info("Submitting batch for source: {}", request.source());
        final BatchSubmission submission = batchSubmissionService.submit(request.source());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(submission, "Batch accepted for processing.", HttpStatus.ACCEPTED.value()));
    }

    @Override
    @PostMapping("/v1/{batchId}/resume")
    public ResponseEntity<ApiResponse<BatchSubmission>> resumeBatch(
            @PathVariable final String batchId,
            @RequestBody final SubmitBatchRequest request) {
        log.info("Resuming batch {} from source: {}", batchId, request.source());
        final BatchSubmission submission = batchSubmissionService.resume(batchId, request.source());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(submission, "Batch re-queued for processing.", HttpStatus.ACCEPTED.value()));
    }

    @Override
    @GetMapping("/v1/{batchId}")
    public ResponseEntity<ApiResponse<BatchSubmission>> getBatch(
            @PathVariable final String batchId) {
        final BatchSubmission submission = batchSubmissionService.status(batchId);
        return ResponseEntity.ok(ApiResponse.success(submission, "Batch retrieved successfully.", HttpStatus.OK.value()));
    }

    // --- 2. CHECKPOINT ENDPOINTS ---

    @Override
    @GetMapping("/v1/{batchId}/checkpoints")
    public ResponseEntity<ApiResponse<List<PhaseRecord>>> listCheckpoints(
            @PathVariable final String batchId) {
        final List<PhaseRecord> records = checkpointStore.list(batchId);
        return ResponseEntity.ok(ApiResponse.success(records,
                String.format("%d checkpoints found.", records.size()), HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/checkpoints")
    public ResponseEntity<ApiResponse<List<PhaseRecord>>> listAllCheckpoints() {
        final List<PhaseRecord> records = checkpointStore.list(null);
        return ResponseEntity.ok(ApiResponse.success(records,
                String.format("%d checkpoints found.", records.size()), HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/{batchId}/checkpoints/latest")
    public ResponseEntity<ApiResponse<PhaseRecord>> getLatestCheckpoint(
            @PathVariable final String batchId) {
        final PhaseRecord latest = pipelineOrchestrator.latestCheckpoint(batchId)
                .orElseThrow(() -> new BatchNotFoundException(batchId));
        return ResponseEntity.ok(ApiResponse.success(latest, "Latest checkpoint retrieved.", HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/{batchId}/resume-point")
    public ResponseEntity<ApiResponse<PhaseRecord>> getResumePoint(
            @PathVariable final String batchId) {
        final PhaseRecord completed = pipelineOrchestrator.lastCompletedPhase(batchId)
                .orElseThrow(() -> new BatchNotFoundException(batchId));
        return ResponseEntity.ok(ApiResponse.success(completed, "Last completed phase retrieved.", HttpStatus.OK.value()));
    }

    @Override
    @DeleteMapping("/v1/{batchId}/checkpoints")
    public ResponseEntity<ApiResponse<PruneResponse>> pruneCheckpoints(
            @PathVariable final String batchId,
            @RequestParam(value = "keep", defaultValue = "20") final int keep) {
        log.info("Pruning checkpoints of batch {} down to {}.", batchId, keep);
        final int removed = checkpointStore.prune(batchId, keep);
        final PruneResponse response = new PruneResponse(batchId, keep, removed);
        return ResponseEntity.ok(ApiResponse.success(response,
                String.format("Removed %d checkpoints.", removed), HttpStatus.OK.value()));
    }

    // --- 3. ANALYSIS ENDPOINTS ---

    @Override
    @PostMapping("/v1/analysis")
    public ResponseEntity<ApiResponse<SourceAnalysis>> analyzeSource(@RequestBody final SubmitBatchRequest request) {
        log.info("Analyzing source: {}", request.source());
        final SourceAnalysis analysis = sourceAnalysisService.analyze(request.source());
        final String message = analysis.error() == null ? "Source analyzed successfully." : analysis.error();
        return ResponseEntity.ok(ApiResponse.success(analysis, message, HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/comparisons")
    public ResponseEntity<ApiResponse<BatchComparison>> compareBatches(@RequestBody final CompareBatchesRequest request) {
        log.info("Comparing batch {} with {}.", request.firstBatchId(), request.secondBatchId());
        final BatchComparison comparison = batchComparisonService.compareBatches(request.firstBatchId(),
                request.secondBatchId());
        return ResponseEntity.ok(ApiResponse.success(comparison, "Batches compared successfully.", HttpStatus.OK.value()));
    }
}
