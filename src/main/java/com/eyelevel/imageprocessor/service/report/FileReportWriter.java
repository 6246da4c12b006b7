package com.eyelevel.imageprocessor.service.report;

import com.eyelevel.imageprocessor.common.json.JsonSerializer;
import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.BatchResult;
import com.eyelevel.imageprocessor.model.RejectionInfo;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;

/**
 * Writes reports into the configured report directory: {@code <batchId>_report.json} for the summary and
 * {@code rejected_files_<timestamp>.csv} for rejected files.
 */
@Slf4j
@Component
public class FileReportWriter implements ReportWriter {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final JsonSerializer jsonSerializer;
    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema rejectedSchema;
    private final Path reportDirectory;

    public FileReportWriter(JsonSerializer jsonSerializer, ImageProcessingConfig config) {
        this.jsonSerializer = jsonSerializer;
        this.rejectedSchema = csvMapper.schemaFor(RejectedFileRow.class).withHeader();
        this.reportDirectory = Path.of(config.storage().reportDirectory());
    }

    @Override
    public Path writeSummary(BatchResult result) {
        final Path target = summaryPathFor(result.batchId());
        try {
            Files.createDirectories(reportDirectory);
        } catch (IOException e) {
            throw new ImageProcessingException("Unable to create report directory " + reportDirectory, e);
        }
        jsonSerializer.writeToFile(result, target);
        log.info("[{}] Summary report written to '{}'.", result.batchId(), target);
        return target;
    }

    @Override
    public Optional<Path> writeRejected(Map<String, RejectionInfo> rejected) {
        if (rejected == null || rejected.isEmpty()) {
            return Optional.empty();
        }
        final Path target = reportDirectory.resolve("rejected_files_" + LocalDateTime.now().format(FILE_TIMESTAMP) + ".csv");
        try {
            Files.createDirectories(reportDirectory);
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 SequenceWriter rows = csvMapper.writer(rejectedSchema).writeValues(writer)) {
                for (Map.Entry<String, RejectionInfo> entry : rejected.entrySet()) {
                    final RejectionInfo info = entry.getValue();
                    rows.write(new RejectedFileRow(entry.getKey(), info.reason(), info.width(), info.height(),
                            info.format()));
                }
            }
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to write rejected files report " + target, e);
        }
        log.info("Rejected files report with {} rows written to '{}'.", rejected.size(), target);
        return Optional.of(target);
    }

    @Override
    public Path summaryPathFor(String batchId) {
        return reportDirectory.resolve(batchId + "_report.json");
    }
}
