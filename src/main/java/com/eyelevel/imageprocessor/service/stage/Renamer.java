package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies each item to {@code <prefix><zero-padded sequence><extension>}.
 * <p>
 * Sequence numbers are only consumed by successful copies, so across all sub-batches of a batch the
 * renamed files are numbered 1, 2, 3... without gaps, in the order the items were handed in.
 */
@Slf4j
@Component
public class Renamer {

    private final String prefix;
    private final String sequenceFormat;

    public Renamer(ImageProcessingConfig config) {
        this.prefix = config.naming().prefix();
        this.sequenceFormat = "%0" + Math.max(1, config.naming().sequenceDigits()) + "d";
    }

    /**
     * @param firstSequence the sequence number given to the first successfully renamed item
     */
    public RenameResult rename(List<WorkItem> items, Path renamedDir, int firstSequence, String contextInfo) {
        final List<WorkItem> renamed = new ArrayList<>(items.size());
        int failed = 0;
        int sequence = firstSequence;
        try {
            Files.createDirectories(renamedDir);
        } catch (IOException e) {
            throw new ImageProcessingException("Unable to create rename directory " + renamedDir, e);
        }

        for (WorkItem item : items) {
            final Path target = renamedDir.resolve(fileNameFor(sequence, item.currentPath()));
            try {
                Files.copy(item.currentPath(), target, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.COPY_ATTRIBUTES);
                renamed.add(item.renamed(target, sequence));
                sequence++;
            } catch (IOException e) {
                failed++;
                log.warn("[{}] Could not rename '{}': {}", contextInfo, item.originalPath(), e.getMessage());
            }
        }
        log.info("[{}] Renamed {} of {} files ({} failed).", contextInfo, renamed.size(), items.size(), failed);
        return new RenameResult(renamed, failed, sequence);
    }

    String fileNameFor(int sequence, Path source) {
        final String name = source.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        final String extension = dot > 0 ? name.substring(dot) : "";
        return prefix + String.format(sequenceFormat, sequence) + extension;
    }
}
