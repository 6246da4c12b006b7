package com.eyelevel.imageprocessor.dto.batch;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record CompareBatchesRequest(
        @Schema(description = "The baseline batch.", example = "batch3f9c2a1b7d40")
        @NotBlank @Pattern(regexp = "[A-Za-z0-9-]{1,64}", message = "must contain only letters, digits and dashes")
        String firstBatchId,
        @Schema(description = "The batch compared against the baseline.", example = "batch8e21c0d4aa19")
        @NotBlank @Pattern(regexp = "[A-Za-z0-9-]{1,64}", message = "must contain only letters, digits and dashes")
        String secondBatchId) {
}
