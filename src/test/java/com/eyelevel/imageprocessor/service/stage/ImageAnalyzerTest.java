package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.model.AnalysisSummary;
import com.eyelevel.imageprocessor.model.ImageInspection;
import com.eyelevel.imageprocessor.service.dispatch.ParallelDispatcher;
import com.eyelevel.imageprocessor.service.image.ImageIoCodec;
import com.eyelevel.imageprocessor.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ImageAnalyzerTest {

    @TempDir
    Path root;

    private ImageAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ImageAnalyzer(new ImageIoCodec(), new ParallelDispatcher(), TestFixtures.config(root));
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, square",
            "0.9, square",
            "1.1, square",
            "1.11, landscape",
            "1.78, landscape",
            "0.89, portrait",
            "0.5, portrait"
    })
    @DisplayName("Aspect ratios are classified with an inclusive square band")
    void aspectTypes(double ratio, String expected) {
        assertThat(ImageAnalyzer.aspectType(ratio)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Summary counts, averages and distributions over readable images")
    void summarizes() {
        final List<ImageInspection> inspections = List.of(
                ImageInspection.of(1920, 1080, "jpeg", 2 * 1024 * 1024),
                ImageInspection.of(1000, 1000, "png", 1024 * 1024),
                ImageInspection.of(600, 900, "png", 512 * 1024),
                ImageInspection.unreadable("broken"));

        final AnalysisSummary summary = analyzer.summarize(inspections);

        assertThat(summary.total()).isEqualTo(4);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.meetResolution()).isEqualTo(2);
        assertThat(summary.meetResolutionPercent()).isEqualTo(50.0);
        assertThat(summary.averageWidth()).isEqualTo(1173L);
        assertThat(summary.averageHeight()).isEqualTo(993L);
        assertThat(summary.averageSizeMb()).isEqualTo(1.17);
        assertThat(summary.formats()).containsExactly(entry("jpeg", 1), entry("png", 2));
        assertThat(summary.aspectTypes()).containsOnly(entry("landscape", 1), entry("square", 1),
                entry("portrait", 1));
        assertThat(summary.dimensions()).containsKeys("1920x1080", "1000x1000", "600x900");
    }

    @Test
    @DisplayName("Percentages round half up to one decimal")
    void roundsPercent() {
        final AnalysisSummary summary = analyzer.summarize(List.of(
                ImageInspection.of(900, 900, "png", 1),
                ImageInspection.of(100, 100, "png", 1),
                ImageInspection.of(100, 100, "png", 1)));

        assertThat(summary.meetResolutionPercent()).isEqualTo(33.3);
        assertThat(ImageAnalyzer.round(2.25, 1)).isEqualTo(2.3);
    }

    @Test
    @DisplayName("Only unreadable images give zero averages and no distributions")
    void allUnreadable() {
        final AnalysisSummary summary = analyzer.summarize(List.of(ImageInspection.unreadable("x")));

        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.averageWidth()).isZero();
        assertThat(summary.formats()).isEmpty();
    }

    @Test
    @DisplayName("Analyzing real files reads their dimensions and format")
    void analyzesFiles() throws IOException {
        final Path wide = TestFixtures.writeImage(root.resolve("wide.png"), 1600, 900);
        final Path tall = TestFixtures.writeImage(root.resolve("tall.png"), 300, 600);
        final Path junk = root.resolve("junk.png");
        Files.writeString(junk, "junk");

        final AnalysisSummary summary = analyzer.analyze(List.of(wide, tall, junk), "test");

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.meetResolution()).isEqualTo(1);
        assertThat(summary.formats()).containsOnly(entry("png", 2));
        assertThat(summary.dimensions()).containsOnly(entry("1600x900", 1), entry("300x600", 1));
    }

    @Test
    @DisplayName("An empty input gives the empty summary")
    void emptyInput() {
        assertThat(analyzer.analyze(List.of(), "test")).isEqualTo(AnalysisSummary.empty());
    }
}
