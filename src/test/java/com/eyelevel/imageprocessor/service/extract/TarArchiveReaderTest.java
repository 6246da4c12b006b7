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

class TarArchiveReaderTest {

    private static final byte[] PAYLOAD = {1, 2, 3};

    @TempDir
    Path root;

    private final TarArchiveReader reader = new TarArchiveReader();

    private final ExtractionOptions options = ExtractionOptions.builder()
            .validExtensions(Set.of("jpg", "png"))
            .build();

    @Test
    @DisplayName("Keeps image entries of a plain TAR, skipping directories, system files and other extensions")
    void filtersEntries() throws IOException {
        final Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("photos/", new byte[0]);
        entries.put("photos/a.jpg", PAYLOAD);
        entries.put("photos/B.PNG", PAYLOAD);
        entries.put("notes.txt", PAYLOAD);
        entries.put("__MACOSX/photos/._a.jpg", PAYLOAD);
        entries.put("Thumbs.db", PAYLOAD);
        entries.put("empty.jpg", new byte[0]);
        final Path tar = TestFixtures.writeTar(root.resolve("source.tar"), entries);
        final Path dest = root.resolve("out");

        final List<Path> extracted = reader.extract(tar.toString(), dest, options);

        assertThat(extracted).containsExactlyInAnyOrder(
                dest.toAbsolutePath().normalize().resolve("photos/a.jpg"),
                dest.toAbsolutePath().normalize().resolve("photos/B.PNG"));
        assertThat(dest.resolve("empty.jpg")).doesNotExist();
    }

    @Test
    @DisplayName("Gzip-compressed archives are read and entries escaping the destination are skipped")
    void gzipAndTraversal() throws IOException {
        final Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("../../evil.jpg", PAYLOAD);
        entries.put("safe/../ok.jpg", PAYLOAD);
        entries.put("kept.png", PAYLOAD);
        final Path tgz = TestFixtures.writeTar(root.resolve("slip.tgz"), entries);
        final Path dest = root.resolve("deep/out");

        final List<Path> extracted = reader.extract(tgz.toString(), dest, options);

        assertThat(extracted).extracting(path -> path.getFileName().toString())
                .containsExactlyInAnyOrder("ok.jpg", "kept.png");
        assertThat(root.resolve("evil.jpg")).doesNotExist();
    }

    @Test
    @DisplayName("Nested ZIP and TAR archives unpack into sibling folders when enabled")
    void nestedArchivesOfEitherFormat() throws IOException {
        final Path innerZip = TestFixtures.writeZip(root.resolve("inner.zip"), Map.of("deep.png", PAYLOAD));
        final Path innerTar = TestFixtures.writeTar(root.resolve("inner.tar.gz"), Map.of("deeper.jpg", PAYLOAD));
        final Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("top.jpg", PAYLOAD);
        entries.put("more/inner.zip", Files.readAllBytes(innerZip));
        entries.put("more/inner.tar.gz", Files.readAllBytes(innerTar));
        final Path outer = TestFixtures.writeTar(root.resolve("outer.tar"), entries);
        final Path dest = root.resolve("nested");

        final List<Path> flat = reader.extract(outer.toString(), root.resolve("flat"), options);
        final List<Path> nested = reader.extract(outer.toString(), dest,
                options.toBuilder().extractNested(true).build());

        assertThat(flat).extracting(path -> path.getFileName().toString()).containsExactly("top.jpg");
        assertThat(nested).extracting(path -> relative(dest, path))
                .containsExactly("top.jpg", "more/inner_zip/deep.png", "more/inner_tar/deeper.jpg");
    }

    @Test
    @DisplayName("A ZIP source may carry TAR archives of its own")
    void tarInsideZip() throws IOException {
        final Path innerTar = TestFixtures.writeTar(root.resolve("inner.tar"), Map.of("deep.png", PAYLOAD));
        final Path outer = TestFixtures.writeZip(root.resolve("outer.zip"),
                Map.of("pack/inner.tar", Files.readAllBytes(innerTar)));
        final Path dest = root.resolve("out");

        final List<Path> extracted = new ZipArchiveReader().extract(outer.toString(), dest,
                options.toBuilder().extractNested(true).build());

        assertThat(extracted).extracting(path -> relative(dest, path)).containsExactly("pack/inner_tar/deep.png");
    }

    @Test
    @DisplayName("A corrupt nested archive is skipped while the rest of the source is kept")
    void corruptNestedArchiveIsSkipped() throws IOException {
        final Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("broken.tgz", new byte[]{'n', 'o', 't', ' ', 'g', 'z', 'i', 'p'});
        entries.put("top.jpg", PAYLOAD);
        final Path outer = TestFixtures.writeTar(root.resolve("outer.tar"), entries);

        final List<Path> extracted = reader.extract(outer.toString(), root.resolve("out"),
                options.toBuilder().extractNested(true).build());

        assertThat(extracted).extracting(path -> path.getFileName().toString()).containsExactly("top.jpg");
    }

    @Test
    @DisplayName("A compressed archive that is not gzip fails with a non-retryable extraction error")
    void corruptArchive() throws IOException {
        final Path tgz = root.resolve("broken.tar.gz");
        Files.writeString(tgz, "this is not a gzip stream");

        assertThatThrownBy(() -> reader.extract(tgz.toString(), root.resolve("out"), options))
                .isInstanceOf(SourceExtractionException.class);
    }

    @Test
    @DisplayName("Only existing local .tar, .tar.gz and .tgz files are supported")
    void supports() throws IOException {
        final Path tar = TestFixtures.writeTar(root.resolve("x.tar"), Map.of("a.jpg", PAYLOAD));
        final Path tarGz = TestFixtures.writeTar(root.resolve("x.TAR.GZ"), Map.of("a.jpg", PAYLOAD));
        final Path tgz = TestFixtures.writeTar(root.resolve("x.tgz"), Map.of("a.jpg", PAYLOAD));
        final Path zip = TestFixtures.writeZip(root.resolve("x.zip"), Map.of("a.jpg", PAYLOAD));

        assertThat(reader.supports(tar.toString())).isTrue();
        assertThat(reader.supports(tarGz.toString())).isTrue();
        assertThat(reader.supports(tgz.toString())).isTrue();
        assertThat(reader.supports(zip.toString())).isFalse();
        assertThat(reader.supports(root.resolve("missing.tar").toString())).isFalse();
        assertThat(reader.supports("https://example.com/x.tar")).isFalse();
    }

    private static String relative(Path dest, Path path) {
        return dest.toAbsolutePath().normalize().relativize(path).toString().replace('\\', '/');
    }
}
