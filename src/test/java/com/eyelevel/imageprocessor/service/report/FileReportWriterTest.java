package com.eyelevel.imageprocessor.service.report;

import com.eyelevel.imageprocessor.model.RejectionInfo;
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

import static org.assertj.core.api.Assertions.assertThat;

class FileReportWriterTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Rejected files are written as CSV with one row per file")
    void writesRejectedCsv() throws IOException {
        final FileReportWriter writer = new FileReportWriter(TestFixtures.jsonSerializer(), TestFixtures.config(root));
        final Map<String, RejectionInfo> rejected = new LinkedHashMap<>();
        rejected.put("/tmp/a.png", new RejectionInfo("Below minimum resolution of 800px", 640, 480, "png"));
        rejected.put("/tmp/b.jpg", RejectionInfo.unreadable("Unrecognized image format"));

        final Path csv = writer.writeRejected(rejected).orElseThrow();

        assertThat(csv.getFileName().toString()).matches("rejected_files_\\d{8}_\\d{6}_\\d{3}\\.csv");
        final List<String> lines = Files.readAllLines(csv);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("file_path,reason,width,height,format");
        assertThat(lines.get(1)).startsWith("/tmp/a.png,").contains("Below minimum resolution of 800px")
                .endsWith(",640,480,png");
        assertThat(lines.get(2)).startsWith("/tmp/b.jpg,").contains("Unrecognized image format").endsWith(",0,0,");
    }

    @Test
    @DisplayName("No rejections means no CSV")
    void nothingRejected() {
        final FileReportWriter writer = new FileReportWriter(TestFixtures.jsonSerializer(), TestFixtures.config(root));

        assertThat(writer.writeRejected(Map.of())).isEmpty();
        assertThat(root.resolve("reports")).doesNotExist();
    }
}
