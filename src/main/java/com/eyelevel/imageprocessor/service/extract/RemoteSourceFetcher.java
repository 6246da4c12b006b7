package com.eyelevel.imageprocessor.service.extract;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.SourceExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Downloads an {@code http(s)} source into the scratch directory, then unpacks it if it is a ZIP or TAR archive.
 * The downloaded file is always removed afterwards.
 */
@Slf4j
@Component
@Order(1)
public class RemoteSourceFetcher implements ArchiveReader {

    private static final String DOWNLOAD_DIR = ".download";

    private final WebClient webClient;
    private final Duration timeout;

    public RemoteSourceFetcher(WebClient.Builder webClientBuilder, ImageProcessingConfig config) {
        this.webClient = webClientBuilder.build();
        this.timeout = Duration.ofSeconds(config.extraction().downloadTimeoutSeconds());
    }

    @Override
    public boolean supports(String source) {
        return source != null && (source.startsWith("http://") || source.startsWith("https://"));
    }

    @Override
    public List<Path> extract(String source, Path destinationDir, ExtractionOptions options) throws IOException {
        final URI uri = URI.create(source);
        final String fileName = fileNameOf(uri);
        final Path downloadDir = destinationDir.resolve(DOWNLOAD_DIR);
        Files.createDirectories(downloadDir);
        final Path downloaded = downloadDir.resolve(fileName);

        try {
            download(uri, downloaded);
            final Optional<ArchiveFormat> archiveFormat = ArchiveFormat.of(fileName);
            if (archiveFormat.isPresent()) {
                return ArchiveStreamUnpacker.unpack(downloaded, archiveFormat.get(), destinationDir, options);
            }
            if (ImageFiles.hasImageExtension(fileName, options)) {
                final Path target = destinationDir.resolve(fileName);
                Files.move(downloaded, target, StandardCopyOption.REPLACE_EXISTING);
                return List.of(target);
            }
            log.warn("Downloaded source '{}' is neither an archive nor an image.", source);
            return List.of();
        } finally {
            Files.deleteIfExists(downloaded);
            Files.deleteIfExists(downloadDir);
        }
    }

    private void download(URI uri, Path target) throws IOException {
        log.info("Downloading '{}' to '{}'.", uri, target);
        try {
            final Flux<DataBuffer> body = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToFlux(DataBuffer.class);
            DataBufferUtils.write(body, target).block(timeout);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is4xxClientError()) {
                throw new SourceExtractionException("Source URL rejected with status " + e.getStatusCode(), e);
            }
            throw new IOException("Download failed with status " + e.getStatusCode(), e);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (IllegalStateException e) {
            // block() reports a timeout this way
            throw new IOException("Download of " + uri + " did not finish within " + timeout, e);
        }
        log.info("Downloaded {} bytes from '{}'.", Files.size(target), uri);
    }

    private static String fileNameOf(URI uri) {
        final String name = FilenameUtils.getName(uri.getPath() == null ? "" : uri.getPath());
        return name.isBlank() ? "download.zip" : name;
    }
}
