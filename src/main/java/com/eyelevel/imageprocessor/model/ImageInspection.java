package com.eyelevel.imageprocessor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Basic properties of one image file, or the reason it could not be read.
 */
public record ImageInspection(int width,
                              int height,
                              String format,
                              long fileSizeBytes,
                              double aspectRatio,
                              String error) {

    public static ImageInspection of(int width, int height, String format, long fileSizeBytes) {
        double ratio = height > 0 ? (double) width / height : 0d;
        return new ImageInspection(width, height, format, fileSizeBytes, ratio, null);
    }

    public static ImageInspection unreadable(String error) {
        return new ImageInspection(0, 0, null, 0L, 0d, error);
    }

    @JsonIgnore
    public boolean isReadable() {
        return error == null;
    }
}
