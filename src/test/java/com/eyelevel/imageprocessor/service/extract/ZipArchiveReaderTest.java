package com.eyelevel.imageprocessor.service.extract;

import com.eyelevel.imageprocessor.exception.SourceExtractionException;
import com.eyelevel.imageprocessor.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipArchiveReaderTest {

    private static final byte[] PAYLOAD = {1, 2, 3};

    @TempDir
    Path root;

    private final ZipArchiveReader reader = new ZipArchiveReader();

    private final ExtractionOptions options = ExtractionOptions.builder()
            .validExtensions(Set.of("jpg", "png"))
            .build();

    @Test
    @DisplayName("Keeps image entries, skipping system files, other extensions and empty entries")
    void filtersEntries() throws IOException {
        final Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("photos/a.jpg", PAYLOAD);
        entries.put("photos/B.PNG", PAYLOAD);
        entries.put("notes.txt", PAYLOAD);
        entries.put("__MACOSX/photos/._a.jpg", PAYLOAD);
        entries.put("photos/._hidden.jpg", PAYLOAD);
        entries.put(".DS_Store", PAYLOAD);
        entries.put("empty.jpg", new byte[0]);
        final Path zip = TestFixtures.writeZip(root.resolve("source.zip"), entries);
        final Path dest = root.resolve("out");

        final List<Path> extracted = reader.extract(zip.toString(), dest, options);

        assertThat(extracted).containsExactlyInAnyOrder(
                dest.toAbsolutePath().normalize().resolve("photos/a.jpg"),
                dest.toAbsolutePath().normalize().resolve("photos/B.PNG"));
        assertThat(dest.resolve("empty.jpg")).doesNotExist();
    }

    @Test
    @DisplayName("Entries that escape the destination are skipped")
    void guardsAgainstZipSlip() throws IOException {
        final Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("../../evil.jpg", PAYLOAD);
        entries.put("safe/../ok.jpg", PAYLOAD);
        final Path zip = TestFixtures.writeZip(root.resolve("slip.zip"), entries);
        final Path dest = root.resolve("deep/out");

        final List<Path> extracted = reader.extract(zip.toString(), dest, options);

        assertThat(extracted).extracting(path -> path.getFileName().toString()).containsExactly("ok.jpg");
        assertThat(root.resolve("evil.jpg")).doesNotExist();
    }

    @Test
    @DisplayName("Nested archives unpack into a sibling folder only when enabled")
    void nestedArchives() throws IOException {
        final Path inner = TestFixtures.writeZip(root.resolve("inner.zip"), Map.of("deep.png", PAYLOAD));
        final Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("top.jpg", PAYLOAD);
        entries.put("more/inner.zip", Files.readAllBytes(inner));
        final Path outer = TestFixtures.writeZip(root.resolve("outer.zip"), entries);

        final List<Path> flat = reader.extract(outer.toString(), root.resolve("flat"), options);
        final List<Path> nested = reader.extract(outer.toString(), root.resolve("nested"),
                options.toBuilder().extractNested(true).build());

        assertThat(flat).extracting(path -> path.getFileName().toString()).containsExactly("top.jpg");
        assertThat(nested).extracting(path -> root.resolve("nested").toAbsolutePath().normalize()
                        .relativize(path).toString().replace('\\', '/'))
                .containsExactly("top.jpg", "more/inner_zip/deep.png");
    }

    @Test
    @DisplayName("A corrupt archive fails with a non-retryable extraction error")
    void corruptArchive() throws IOException {
        final Path zip = root.resolve("broken.zip");
        final byte[] header = {'P', 'K', 3, 4, 20, 0, 8, 0, 8, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0,
                5, 0, 0, 0, 'a', '.', 'j', 'p', 'g', 'g', 'a', 'r', 'b', 'a', 'g', 'e'};
        Files.write(zip, header);

        assertThatThrownBy(() -> reader.extract(zip.toString(), root.resolve("out"), options))
                .isInstanceOf(SourceExtractionException.class);
    }

    @Test
    @DisplayName("Only existing local .zip files are supported")
    void supports() throws IOException {
        final Path zip = TestFixtures.writeZip(root.resolve("x.zip"), Map.of("a.jpg", PAYLOAD));

        assertThat(reader.supports(zip.toString())).isTrue();
        assertThat(reader.supports(root.resolve("missing.zip").toString())).isFalse();
        assertThat(reader.supports("https://example.com/x.zip")).isFalse();
        assertThat(reader.supports(root.toString())).isFalse();
    }
}
