package com.eyelevel.imageprocessor.service.memory;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Walks a list in memory-bounded slices. Before each slice the advisor is asked for the size to cut,
 * starting from the configured batch size, so a run of critical readings shrinks later slices.
 */
@Slf4j
@Component
public class MemoryAwareBatcher {

    private final MemoryBudgetAdvisor advisor;
    private final int initialBatchSize;

    public MemoryAwareBatcher(MemoryBudgetAdvisor advisor, ImageProcessingConfig config) {
        this.advisor = advisor;
        this.initialBatchSize = Math.max(1, config.memory().batchSize());
    }

    /**
     * Receives one slice at a time. Returning normally lets the batcher cut the next slice.
     */
    @FunctionalInterface
    public interface SubBatchHandler<T> {
        void handle(int subBatchIndex, List<T> subBatch);
    }

    /**
     * Feeds {@code items} to {@code handler} slice by slice, in order.
     *
     * @return the number of slices handled.
     */
    public <T> int forEachSubBatch(List<T> items, SubBatchHandler<T> handler) {
        int offset = 0;
        int subBatchIndex = 0;
        int batchSize = initialBatchSize;
        while (offset < items.size()) {
            batchSize = advisor.recommendBatchSize(batchSize);
            final int end = Math.min(items.size(), offset + batchSize);
            log.debug("Cutting sub-batch {} covering items [{}, {}) of {}.", subBatchIndex, offset, end, items.size());
            handler.handle(subBatchIndex, List.copyOf(items.subList(offset, end)));
            offset = end;
            subBatchIndex++;
        }
        return subBatchIndex;
    }
}
