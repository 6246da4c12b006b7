package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.model.ImageInspection;
import com.eyelevel.imageprocessor.model.WorkItem;
import com.eyelevel.imageprocessor.service.dispatch.ParallelDispatcher;
import com.eyelevel.imageprocessor.service.image.ImageIoCodec;
import com.eyelevel.imageprocessor.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImageConverterTest {

    @TempDir
    Path root;

    private final ImageIoCodec codec = new ImageIoCodec();

    @Test
    @DisplayName("Converts to the configured format and keeps the file stem")
    void convertsToJpeg() throws IOException {
        final Path png = TestFixtures.writeImage(root.resolve("in/bid000001.png"), 900, 900);
        final ImageConverter converter = new ImageConverter(codec, new ParallelDispatcher(), TestFixtures.config(root));

        final ConvertResult result = converter.convert(List.of(WorkItem.extracted(png, null)),
                root.resolve("converted"), "test");

        assertThat(result.failed()).isZero();
        final Path output = result.converted().get(0).currentPath();
        assertThat(output.getFileName().toString()).isEqualTo("bid000001.jpg");
        final ImageInspection inspection = codec.inspect(output);
        assertThat(inspection.format()).isEqualTo("jpeg");
        assertThat(inspection.width()).isEqualTo(900);
    }

    @Test
    @DisplayName("Oversized images shrink to fit while keeping their aspect ratio")
    void resizesWhenLarger() throws IOException {
        final Path png = TestFixtures.writeImage(root.resolve("in/big.png"), 2000, 1000);
        final ImageProcessingConfig base = TestFixtures.config(root);
        final ImageProcessingConfig config = base.toBuilder()
                .conversion(base.conversion().toBuilder().resizeIfLarger(true).maxWidth(1000).maxHeight(1000).build())
                .build();
        final ImageConverter converter = new ImageConverter(codec, new ParallelDispatcher(), config);

        final ConvertResult result = converter.convert(List.of(WorkItem.extracted(png, null)),
                root.resolve("converted"), "test");

        final ImageInspection inspection = codec.inspect(result.converted().get(0).currentPath());
        assertThat(inspection.width()).isEqualTo(1000);
        assertThat(inspection.height()).isEqualTo(500);
    }

    @Test
    @DisplayName("An undecodable file is reported under its original path and the rest still convert")
    void failuresAreIsolated() throws IOException {
        final Path good = TestFixtures.writeImage(root.resolve("in/good.png"), 820, 820);
        final Path bad = root.resolve("in/bad.png");
        Files.writeString(bad, "corrupt");
        final ImageConverter converter = new ImageConverter(codec, new ParallelDispatcher(), TestFixtures.config(root));

        final ConvertResult result = converter.convert(
                List.of(WorkItem.extracted(bad, null), WorkItem.extracted(good, null)), root.resolve("converted"),
                "test");

        assertThat(result.converted()).extracting(WorkItem::originalPath).containsExactly(good);
        assertThat(result.failures()).containsOnlyKeys(bad.toString());
        assertThat(root.resolve("converted/bad.jpg")).doesNotExist();
    }
}
