package com.eyelevel.imageprocessor.model;

/**
 * Why an image was dropped by the filter. Dimensions are zero when the file could not be read.
 */
public record RejectionInfo(String reason, int width, int height, String format) {

    public static RejectionInfo unreadable(String reason) {
        return new RejectionInfo(reason, 0, 0, null);
    }
}
