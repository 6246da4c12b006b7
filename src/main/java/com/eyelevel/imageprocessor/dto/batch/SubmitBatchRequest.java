package com.eyelevel.imageprocessor.dto.batch;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * @param source a ZIP file, directory or image path on the server, or an http(s) URL.
 */
public record SubmitBatchRequest(
        @Schema(description = "ZIP file, directory, image file or http(s) URL to process.",
                example = "/data/incoming/photos.zip")
        @NotBlank(message = "The 'source' field cannot be empty.") String source) {
}
