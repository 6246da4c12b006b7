package com.eyelevel.imageprocessor.service.report;

import com.eyelevel.imageprocessor.exception.BatchNotFoundException;
import com.eyelevel.imageprocessor.model.AnalysisSummary;
import com.eyelevel.imageprocessor.model.BatchComparison;
import com.eyelevel.imageprocessor.model.BatchResult;
import com.eyelevel.imageprocessor.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class BatchComparisonServiceTest {

    @TempDir
    Path root;

    private FileReportWriter reportWriter;
    private BatchComparisonService service;

    @BeforeEach
    void setUp() {
        reportWriter = new FileReportWriter(TestFixtures.jsonSerializer(), TestFixtures.config(root));
        service = new BatchComparisonService(TestFixtures.jsonParser(), TestFixtures.jsonSerializer(), reportWriter);
    }

    @Test
    @DisplayName("Differences, percent changes, format deltas and summary lines")
    void comparesTwoReports() {
        reportWriter.writeSummary(result("batch-a", 100, 80, 1000, 800, Map.of("jpeg", 60, "png", 40), 5_000L));
        reportWriter.writeSummary(result("batch-b", 150, 60, 1200, 900, Map.of("jpeg", 90, "gif", 10), 4_000L));

        final BatchComparison comparison = service.compareBatches("batch-a", "batch-b");

        assertThat(comparison.differences()).contains(
                entry("extracted", 50L), entry("converted", -20L),
                entry("average_width", 200L), entry("average_height", 100L),
                entry("package_size_bytes", -1000L));
        assertThat(comparison.percentChanges()).contains(
                entry("extracted", 50.0), entry("converted", -25.0), entry("package_size_bytes", -20.0));
        assertThat(comparison.formatDifferences()).containsExactly(
                entry("gif", 10), entry("jpeg", 30), entry("png", -40));
        assertThat(comparison.summary()).containsExactly(
                "Batch batch-b has 50 more images than batch-a",
                "Batch batch-b processed 20 fewer images",
                "Batch batch-b has larger average image dimensions");
        assertThat(Path.of(comparison.comparisonPath()))
                .exists()
                .hasFileName("comparison_batch-a_batch-b.json");
    }

    @Test
    @DisplayName("Percent changes are omitted when the baseline is zero")
    void zeroBaseline() {
        reportWriter.writeSummary(result("batch-a", 0, 0, 0, 0, Map.of(), null));
        reportWriter.writeSummary(result("batch-b", 10, 10, 900, 900, Map.of("png", 10), null));

        final BatchComparison comparison = service.compareBatches("batch-a", "batch-b");

        assertThat(comparison.differences()).containsEntry("extracted", 10L).doesNotContainKey("average_width");
        assertThat(comparison.percentChanges()).doesNotContainKey("extracted");
    }

    @Test
    @DisplayName("A missing report is reported as an unknown batch")
    void missingReport() {
        reportWriter.writeSummary(result("batch-a", 1, 1, 900, 900, Map.of(), null));

        assertThatThrownBy(() -> service.compareBatches("batch-a", "batch-missing"))
                .isInstanceOf(BatchNotFoundException.class)
                .hasMessageContaining("batch-missing");
    }

    private static BatchResult result(String batchId, int extracted, int converted, long width, long height,
                                      Map<String, Integer> formats, Long packageSize) {
        final AnalysisSummary analysis = AnalysisSummary.builder()
                .total(extracted)
                .averageWidth(width)
                .averageHeight(height)
                .formats(formats)
                .aspectTypes(Map.of())
                .dimensions(Map.of())
                .build();
        return BatchResult.builder()
                .batchId(batchId)
                .source("/data/" + batchId + ".zip")
                .stats(Map.of("extracted", extracted, "converted", converted))
                .analysis(analysis)
                .packageSizeBytes(packageSize)
                .timestamp(Instant.now())
                .build();
    }
}
