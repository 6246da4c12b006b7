package com.eyelevel.imageprocessor.service.dispatch;

import com.eyelevel.imageprocessor.model.ItemOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * Completion callback that logs progress every {@code logInterval} items and once at the end.
 * Only ever called from the dispatching thread, so it keeps plain counters.
 */
@Slf4j
public class ProgressTracker<R> implements Consumer<ItemOutcome<R>> {

    private final String contextInfo;
    private final String description;
    private final int total;
    private final int logInterval;
    private int completed;
    private int failed;

    public ProgressTracker(String contextInfo, String description, int total, int logInterval) {
        this.contextInfo = contextInfo;
        this.description = description;
        this.total = total;
        this.logInterval = Math.max(1, logInterval);
    }

    @Override
    public void accept(ItemOutcome<R> outcome) {
        completed++;
        if (!outcome.isSuccess()) {
            failed++;
        }
        if (completed % logInterval == 0 || completed == total) {
            log.info("[{}] {}: {}/{} done ({} failed).", contextInfo, description, completed, total, failed);
        }
    }

    public int getCompleted() {
        return completed;
    }

    public int getFailed() {
        return failed;
    }
}
