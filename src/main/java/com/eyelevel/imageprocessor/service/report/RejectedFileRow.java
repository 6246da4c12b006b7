package com.eyelevel.imageprocessor.service.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"file_path", "reason", "width", "height", "format"})
public record RejectedFileRow(@JsonProperty("file_path") String filePath,
                              @JsonProperty("reason") String reason,
                              @JsonProperty("width") int width,
                              @JsonProperty("height") int height,
                              @JsonProperty("format") String format) {
}
