package com.eyelevel.imageprocessor.service.report;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.model.SourceAnalysis;
import com.eyelevel.imageprocessor.service.dispatch.ParallelDispatcher;
import com.eyelevel.imageprocessor.service.extract.ArchiveReaderFactory;
import com.eyelevel.imageprocessor.service.extract.DirectorySourceReader;
import com.eyelevel.imageprocessor.service.extract.SingleImageReader;
import com.eyelevel.imageprocessor.service.extract.SourceExtractor;
import com.eyelevel.imageprocessor.service.extract.TarArchiveReader;
import com.eyelevel.imageprocessor.service.extract.ZipArchiveReader;
import com.eyelevel.imageprocessor.service.image.ImageIoCodec;
import com.eyelevel.imageprocessor.service.stage.ImageAnalyzer;
import com.eyelevel.imageprocessor.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class SourceAnalysisServiceTest {

    @TempDir
    Path root;

    private SourceAnalysisService service;

    @BeforeEach
    void setUp() {
        final ImageProcessingConfig base = TestFixtures.config(root);
        final ImageProcessingConfig config = base.toBuilder()
                .extraction(base.extraction().toBuilder().analysisSampleSize(3).build())
                .build();
        final ParallelDispatcher dispatcher = new ParallelDispatcher();
        final ImageIoCodec codec = new ImageIoCodec();
        final SourceExtractor extractor = new SourceExtractor(new ArchiveReaderFactory(
                List.of(new ZipArchiveReader(), new TarArchiveReader(), new DirectorySourceReader(), new SingleImageReader())),
                codec, dispatcher, config);
        service = new SourceAnalysisService(extractor, new ImageAnalyzer(codec, dispatcher, config), config);
    }

    @Test
    @DisplayName("Only the first sample files are analyzed and the scratch copy is removed")
    void analyzesSample() throws IOException {
        final Path source = root.resolve("source");
        TestFixtures.writeImage(source.resolve("a.png"), 1000, 1000);
        TestFixtures.writeImage(source.resolve("b.png"), 400, 300);
        TestFixtures.writeImage(source.resolve("c.png"), 900, 1600);
        TestFixtures.writeImage(source.resolve("d.png"), 2000, 2000);

        final SourceAnalysis analysis = service.analyze(source.toString());

        assertThat(analysis.error()).isNull();
        assertThat(analysis.sampleSize()).isEqualTo(3);
        assertThat(analysis.acceptableFiles()).isEqualTo(2);
        assertThat(analysis.rejectedFiles()).isEqualTo(1);
        assertThat(analysis.formats()).containsOnly(entry("png", 3));
        assertThat(analysis.dimensions()).doesNotContainKey("2000x2000");
        try (Stream<Path> scratch = Files.list(root.resolve("temp"))) {
            assertThat(scratch).isEmpty();
        }
    }

    @Test
    @DisplayName("A source without images reports an error instead of throwing")
    void emptySource() throws IOException {
        final Path source = Files.createDirectories(root.resolve("empty"));

        final SourceAnalysis analysis = service.analyze(source.toString());

        assertThat(analysis.error()).isEqualTo("No files could be extracted from the source");
    }

    @Test
    @DisplayName("An unsupported source reports an error instead of throwing")
    void unsupportedSource() {
        final SourceAnalysis analysis = service.analyze(root.resolve("archive.rar").toString());

        assertThat(analysis.error()).startsWith("Error analyzing source: ");
    }
}
