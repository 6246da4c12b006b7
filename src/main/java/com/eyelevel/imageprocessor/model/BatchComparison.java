package com.eyelevel.imageprocessor.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Differences between two batch reports, always expressed as second minus first.
 *
 * @param firstBatchId      the baseline batch
 * @param secondBatchId     the batch compared against the baseline
 * @param differences       absolute difference per numeric statistic present in both reports
 * @param percentChanges    relative change per statistic, two decimals, only where the baseline is positive
 * @param formatDifferences difference in image count per format, over the formats of either batch
 * @param summary           human readable highlights
 * @param comparisonPath    where the comparison was written
 */
@Builder
public record BatchComparison(String firstBatchId,
                              String secondBatchId,
                              Map<String, Long> differences,
                              Map<String, Double> percentChanges,
                              Map<String, Integer> formatDifferences,
                              List<String> summary,
                              String comparisonPath,
                              Instant timestamp) {
}
