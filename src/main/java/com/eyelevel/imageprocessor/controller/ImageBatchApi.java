package com.eyelevel.imageprocessor.controller;

import com.eyelevel.imageprocessor.dto.batch.CompareBatchesRequest;
import com.eyelevel.imageprocessor.dto.batch.PruneResponse;
import com.eyelevel.imageprocessor.dto.batch.SubmitBatchRequest;
import com.eyelevel.imageprocessor.dto.common.ApiResponse;
import com.eyelevel.imageprocessor.model.BatchComparison;
import com.eyelevel.imageprocessor.model.BatchSubmission;
import com.eyelevel.imageprocessor.model.PhaseRecord;
import com.eyelevel.imageprocessor.model.SourceAnalysis;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Image Batch Pipeline", description = "Endpoints for submitting image batches, following their checkpoints and analyzing sources.")
public interface ImageBatchApi {

    String BATCH_ID_PATTERN = "[A-Za-z0-9-]{1,64}";
    String BATCH_ID_MESSAGE = "The batch id must contain only letters, digits and dashes.";

    @Operation(summary = "Submit Batch",
            description = "Queues a new batch for the given source. The batch runs in the background; poll the batch endpoint for its result.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Batch accepted for processing.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "Batch accepted for processing.",
                                        "response": {
                                            "batchId": "batch3f9c2a1b7d40",
                                            "source": "/data/incoming/photos.zip",
                                            "status": "PROCESSING",
                                            "submittedAt": "2024-05-01T10:15:30Z"
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing source or the batch queue is full.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<BatchSubmission>> submitBatch(@Valid @RequestBody SubmitBatchRequest request);

    @Operation(summary = "Resume Batch",
            description = "Re-runs a batch under its existing id. Extraction is redone from the source; checkpoints keep accumulating under the same id.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Batch re-queued.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid id, or the batch is still running.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<BatchSubmission>> resumeBatch(
            @Parameter(description = "The id of the batch to resume.", required = true, example = "batch3f9c2a1b7d40")
            @PathVariable @Pattern(regexp = BATCH_ID_PATTERN, message = BATCH_ID_MESSAGE) String batchId,
            @Valid @RequestBody SubmitBatchRequest request);

    @Operation(summary = "Get Batch", description = "Returns the state of a batch and, once it has finished, its result.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Batch found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown batch id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<BatchSubmission>> getBatch(
            @Parameter(description = "The batch id.", required = true, example = "batch3f9c2a1b7d40")
            @PathVariable @Pattern(regexp = BATCH_ID_PATTERN, message = BATCH_ID_MESSAGE) String batchId);

    @Operation(summary = "List Checkpoints",
            description = "Lists the checkpoint records of one batch, most recent first.")
    ResponseEntity<ApiResponse<List<PhaseRecord>>> listCheckpoints(
            @Parameter(description = "The batch id.", required = true, example = "batch3f9c2a1b7d40")
            @PathVariable @Pattern(regexp = BATCH_ID_PATTERN, message = BATCH_ID_MESSAGE) String batchId);

    @Operation(summary = "List All Checkpoints",
            description = "Lists the checkpoint records of every batch in the store, most recent first.")
    ResponseEntity<ApiResponse<List<PhaseRecord>>> listAllCheckpoints();

    @Operation(summary = "Get Latest Checkpoint", description = "Returns the checkpoint with the highest sequence number for a batch.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Checkpoint found.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Latest checkpoint retrieved.",
                                        "response": {
                                            "batchId": "batch3f9c2a1b7d40",
                                            "phaseLabel": "convert_batch_2",
                                            "status": "completed",
                                            "sequenceNumber": 18,
                                            "timestamp": "2024-05-01T10:16:02Z",
                                            "payload": {"count": 97, "failed": 1}
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The batch has no checkpoints.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<PhaseRecord>> getLatestCheckpoint(
            @Parameter(description = "The batch id.", required = true, example = "batch3f9c2a1b7d40")
            @PathVariable @Pattern(regexp = BATCH_ID_PATTERN, message = BATCH_ID_MESSAGE) String batchId);

    @Operation(summary = "Get Resume Point", description = "Returns the most recent completed phase of a batch.")
    ResponseEntity<ApiResponse<PhaseRecord>> getResumePoint(
            @Parameter(description = "The batch id.", required = true, example = "batch3f9c2a1b7d40")
            @PathVariable @Pattern(regexp = BATCH_ID_PATTERN, message = BATCH_ID_MESSAGE) String batchId);

    @Operation(summary = "Prune Checkpoints", description = "Keeps the most recent checkpoints of a batch and deletes the rest.")
    ResponseEntity<ApiResponse<PruneResponse>> pruneCheckpoints(
            @Parameter(description = "The batch id.", required = true, example = "batch3f9c2a1b7d40")
            @PathVariable @Pattern(regexp = BATCH_ID_PATTERN, message = BATCH_ID_MESSAGE) String batchId,
            @Parameter(description = "How many of the most recent records to keep.", example = "20")
            @RequestParam(value = "keep", defaultValue = "20") @Min(value = 0, message = "The 'keep' parameter cannot be negative.") int keep);

    @Operation(summary = "Analyze Source",
            description = "Extracts a small sample of a source and reports formats, dimensions and how many images would pass the resolution filter. No batch is created.")
    ResponseEntity<ApiResponse<SourceAnalysis>> analyzeSource(@Valid @RequestBody SubmitBatchRequest request);

    @Operation(summary = "Compare Batches",
            description = "Compares the summary reports of two finished batches and stores the comparison next to the first report.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Comparison created.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - A batch has no summary report.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<BatchComparison>> compareBatches(@Valid @RequestBody CompareBatchesRequest request);
}
