package com.eyelevel.imageprocessor.service.memory;

/**
 * Outcome of a reclamation pass. {@code performed} is false when the pass was skipped.
 */
public record ReclaimResult(boolean performed, long beforeBytes, long afterBytes) {

    static ReclaimResult skipped(long currentBytes) {
        return new ReclaimResult(false, currentBytes, currentBytes);
    }

    public long freedBytes() {
        return Math.max(0L, beforeBytes - afterBytes);
    }
}
