package com.eyelevel.imageprocessor.model;

import lombok.Builder;

import java.util.Map;

/**
 * Aggregate statistics over a set of analyzed images.
 *
 * @param total                  images analyzed
 * @param failed                 images that could not be read
 * @param meetResolution         images whose width and height both reach the minimum resolution
 * @param meetResolutionPercent  {@code meetResolution} as a share of {@code total}, one decimal
 * @param averageWidth           mean width of readable images, rounded
 * @param averageHeight          mean height of readable images, rounded
 * @param averageSizeMb          mean file size of readable images in MB, two decimals
 * @param formats                count per image format
 * @param aspectTypes            count per aspect class (square, landscape, portrait)
 * @param dimensions             count per {@code <width>x<height>}
 */
@Builder
public record AnalysisSummary(int total,
                              int failed,
                              int meetResolution,
                              double meetResolutionPercent,
                              long averageWidth,
                              long averageHeight,
                              double averageSizeMb,
                              Map<String, Integer> formats,
                              Map<String, Integer> aspectTypes,
                              Map<String, Integer> dimensions) {

    public static AnalysisSummary empty() {
        return new AnalysisSummary(0, 0, 0, 0d, 0L, 0L, 0d, Map.of(), Map.of(), Map.of());
    }
}
