package com.eyelevel.imageprocessor.service.extract;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Unpacks one kind of source into a scratch directory. Each implementation handles a specific source type.
 */
public interface ArchiveReader {

    /**
     * Determines if this reader can handle the given source locator.
     *
     * @param source a file path, directory path or URL.
     * @return {@code true} if this reader supports the source.
     */
    boolean supports(String source);

    /**
     * Writes every image-named file of the source into {@code destinationDir}.
     * <p>
     * Readers only filter by name; decoding and sampling are left to {@link SourceExtractor}.
     *
     * @return the written files, in no particular order.
     * @throws IOException on a transient read or write failure; the extraction may be retried.
     */
    List<Path> extract(String source, Path destinationDir, ExtractionOptions options) throws IOException;
}
