package com.eyelevel.imageprocessor.service.report;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.AnalysisSummary;
import com.eyelevel.imageprocessor.model.SourceAnalysis;
import com.eyelevel.imageprocessor.service.extract.ExtractionOptions;
import com.eyelevel.imageprocessor.service.extract.SourceExtractor;
import com.eyelevel.imageprocessor.service.stage.ImageAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Looks at the first few images of a source without running a batch. The sample is extracted into its own
 * scratch directory, which is removed afterwards whatever the outcome.
 */
@Slf4j
@Service
public class SourceAnalysisService {

    private final SourceExtractor sourceExtractor;
    private final ImageAnalyzer imageAnalyzer;
    private final ImageProcessingConfig config;

    public SourceAnalysisService(SourceExtractor sourceExtractor, ImageAnalyzer imageAnalyzer,
                                 ImageProcessingConfig config) {
        this.sourceExtractor = sourceExtractor;
        this.imageAnalyzer = imageAnalyzer;
        this.config = config;
    }

    public SourceAnalysis analyze(String source) {
        final String contextInfo = "analysis-" + UUID.randomUUID().toString().substring(0, 8);
        final Path scratch = Path.of(config.storage().tempDirectory()).resolve(contextInfo);
        final ExtractionOptions options = ExtractionOptions.from(config.extraction())
                .firstN(config.extraction().analysisSampleSize());
        log.info("[{}] Analyzing up to {} files of '{}'.", contextInfo, options.maxFiles(), source);
        try {
            final List<Path> sample = sourceExtractor.extract(source, scratch, options, contextInfo);
            if (sample.isEmpty()) {
                return SourceAnalysis.failed(source, "No files could be extracted from the source");
            }
            final AnalysisSummary summary = imageAnalyzer.analyze(sample, contextInfo);
            final int acceptable = summary.meetResolution();
            return SourceAnalysis.builder()
                    .source(source)
                    .sampleSize(sample.size())
                    .acceptableFiles(acceptable)
                    .rejectedFiles(summary.total() - acceptable)
                    .formats(summary.formats())
                    .dimensions(summary.dimensions())
                    .summary(summary)
                    .build();
        } catch (IOException | ImageProcessingException e) {
            log.error("[{}] Analysis of '{}' failed: {}", contextInfo, source, e.getMessage(), e);
            return SourceAnalysis.failed(source, "Error analyzing source: " + e.getMessage());
        } finally {
            FileUtils.deleteQuietly(scratch.toFile());
        }
    }
}
