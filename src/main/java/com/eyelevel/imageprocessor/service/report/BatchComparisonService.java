package com.eyelevel.imageprocessor.service.report;

import com.eyelevel.imageprocessor.common.json.JsonParser;
import com.eyelevel.imageprocessor.common.json.JsonSerializer;
import com.eyelevel.imageprocessor.exception.BatchNotFoundException;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.AnalysisSummary;
import com.eyelevel.imageprocessor.model.BatchComparison;
import com.eyelevel.imageprocessor.model.BatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares two batch summary reports and writes the comparison as {@code comparison_<first>_<second>.json}
 * next to the first report.
 */
@Slf4j
@Service
public class BatchComparisonService {

    static final String AVERAGE_WIDTH = "average_width";
    static final String AVERAGE_HEIGHT = "average_height";
    static final String PACKAGE_SIZE = "package_size_bytes";

    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;
    private final ReportWriter reportWriter;

    public BatchComparisonService(JsonParser jsonParser, JsonSerializer jsonSerializer, ReportWriter reportWriter) {
        this.jsonParser = jsonParser;
        this.jsonSerializer = jsonSerializer;
        this.reportWriter = reportWriter;
    }

    /**
     * Compares the summary reports of two batches.
     *
     * @throws BatchNotFoundException if either batch has no summary report.
     */
    public BatchComparison compareBatches(String firstBatchId, String secondBatchId) {
        return compare(existingReport(firstBatchId), existingReport(secondBatchId));
    }

    public BatchComparison compare(Path firstReport, Path secondReport) {
        final BatchResult first = readReport(firstReport);
        final BatchResult second = readReport(secondReport);

        final Map<String, Long> firstValues = numericValues(first);
        final Map<String, Long> secondValues = numericValues(second);
        final Map<String, Long> differences = new LinkedHashMap<>();
        final Map<String, Double> percentChanges = new LinkedHashMap<>();
        firstValues.forEach((key, before) -> {
            final Long after = secondValues.get(key);
            if (after == null) {
                return;
            }
            differences.put(key, after - before);
            if (before > 0) {
                percentChanges.put(key, BigDecimal.valueOf((after - before) * 100d / before)
                        .setScale(2, RoundingMode.HALF_UP).doubleValue());
            }
        });

        final Map<String, Integer> formatDifferences = formatDifferences(first.analysis(), second.analysis());
        final List<String> summary = summarize(first.batchId(), second.batchId(), differences);

        final Path target = firstReport.toAbsolutePath().getParent()
                .resolve("comparison_" + first.batchId() + "_" + second.batchId() + ".json");
        final BatchComparison comparison = BatchComparison.builder()
                .firstBatchId(first.batchId())
                .secondBatchId(second.batchId())
                .differences(differences)
                .percentChanges(percentChanges)
                .formatDifferences(formatDifferences)
                .summary(summary)
                .comparisonPath(target.toString())
                .timestamp(Instant.now())
                .build();
        jsonSerializer.writeToFile(comparison, target);
        log.info("Comparison of '{}' and '{}' written to '{}'.", first.batchId(), second.batchId(), target);
        summary.forEach(line -> log.info("  - {}", line));
        return comparison;
    }

    private Path existingReport(String batchId) {
        final Path report = reportWriter.summaryPathFor(batchId);
        if (!Files.isRegularFile(report)) {
            throw new BatchNotFoundException(batchId);
        }
        return report;
    }

    private BatchResult readReport(Path report) {
        if (!Files.isRegularFile(report)) {
            throw new ImageProcessingException("Report not found: " + report);
        }
        final BatchResult result = jsonParser.parseFile(report, BatchResult.class);
        if (result.batchId() == null) {
            throw new ImageProcessingException("Invalid report format: missing batch id in " + report);
        }
        return result;
    }

    private static Map<String, Long> numericValues(BatchResult result) {
        final Map<String, Long> values = new LinkedHashMap<>();
        result.stats().forEach((key, value) -> values.put(key, value.longValue()));
        if (result.analysis() != null && result.analysis().total() > 0) {
            values.put(AVERAGE_WIDTH, result.analysis().averageWidth());
            values.put(AVERAGE_HEIGHT, result.analysis().averageHeight());
        }
        if (result.packageSizeBytes() != null) {
            values.put(PACKAGE_SIZE, result.packageSizeBytes());
        }
        return values;
    }

    private static Map<String, Integer> formatDifferences(AnalysisSummary first, AnalysisSummary second) {
        final Map<String, Integer> firstFormats = first == null || first.formats() == null ? Map.of() : first.formats();
        final Map<String, Integer> secondFormats = second == null || second.formats() == null ? Map.of() : second.formats();
        final Map<String, Integer> differences = new TreeMap<>();
        final TreeSet<String> formats = new TreeSet<>(firstFormats.keySet());
        formats.addAll(secondFormats.keySet());
        for (String format : formats) {
            differences.put(format, secondFormats.getOrDefault(format, 0) - firstFormats.getOrDefault(format, 0));
        }
        return differences;
    }

    private static List<String> summarize(String firstId, String secondId, Map<String, Long> differences) {
        final List<String> summary = new ArrayList<>();
        final Long extracted = differences.get("extracted");
        if (extracted != null && extracted != 0) {
            summary.add(String.format("Batch %s has %d %s images than %s", secondId, Math.abs(extracted),
                    extracted > 0 ? "more" : "fewer", firstId));
        }
        final Long converted = differences.get("converted");
        if (converted != null && converted != 0) {
            summary.add(String.format("Batch %s processed %d %s images", secondId, Math.abs(converted),
                    converted > 0 ? "more" : "fewer"));
        }
        final Long width = differences.get(AVERAGE_WIDTH);
        final Long height = differences.get(AVERAGE_HEIGHT);
        if (width != null && height != null) {
            if (width > 0 || height > 0) {
                summary.add("Batch " + secondId + " has larger average image dimensions");
            } else if (width < 0 || height < 0) {
                summary.add("Batch " + secondId + " has smaller average image dimensions");
            }
        }
        return summary;
    }
}
