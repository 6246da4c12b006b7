package com.eyelevel.imageprocessor.service.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Picks the {@link ArchiveReader} for a source locator. Readers are consulted in their {@code @Order}.
 */
@Service
@Slf4j
public class ArchiveReaderFactory {

    private final List<ArchiveReader> readers;

    public ArchiveReaderFactory(List<ArchiveReader> readers) {
        this.readers = readers;
        log.info("ArchiveReaderFactory initialized with {} available readers.", readers.size());
    }

    public Optional<ArchiveReader> getReader(String source) {
        Optional<ArchiveReader> reader = readers.stream()
                .filter(r -> r.supports(source))
                .findFirst();
        log.debug("Searching for reader for source '{}'. Found: {}", source,
                reader.map(r -> r.getClass().getSimpleName()).orElse("None"));
        return reader;
    }
}
