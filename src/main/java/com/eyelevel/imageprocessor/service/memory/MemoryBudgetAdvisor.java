package com.eyelevel.imageprocessor.service.memory;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.model.MemorySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recommends sub-batch sizes from the current memory situation.
 * <p>
 * The advisor is stateless: each call takes a fresh {@link MemorySnapshot} and the caller's current size.
 * <ul>
 *     <li>critical: halve the size, never below the configured floor or above the current size,
 *     and force a reclamation pass</li>
 *     <li>pressure only: keep the size, run a non-forced reclamation pass</li>
 *     <li>otherwise: keep the size</li>
 * </ul>
 */
@Slf4j
@Component
public class MemoryBudgetAdvisor {

    private static final long MB = 1024L * 1024L;

    private final MemoryProbe probe;
    private final ImageProcessingConfig.Memory settings;

    public MemoryBudgetAdvisor(MemoryProbe probe, ImageProcessingConfig config) {
        this.probe = probe;
        this.settings = config.memory();
    }

    public MemorySnapshot snapshot() {
        final double usedPercent = probe.systemUsedPercent();
        return new MemorySnapshot(
                probe.processMemoryBytes(),
                usedPercent,
                usedPercent > settings.pressureThresholdPercent(),
                usedPercent > settings.criticalThresholdPercent());
    }

    public int recommendBatchSize(int currentSize) {
        final MemorySnapshot snapshot = snapshot();
        if (snapshot.critical()) {
            final int floor = Math.max(1, settings.minBatchSize());
            final int reduced = Math.min(currentSize, Math.max(floor, currentSize / 2));
            log.warn("Memory critical ({}% used). Reducing batch size from {} to {}.",
                    String.format("%.1f", snapshot.systemUsedPercent()), currentSize, reduced);
            reclaim(true);
            return Math.max(1, reduced);
        }
        if (snapshot.pressure()) {
            log.info("Memory pressure ({}% used). Keeping batch size {}.",
                    String.format("%.1f", snapshot.systemUsedPercent()), currentSize);
            reclaim(false);
        }
        return Math.max(1, currentSize);
    }

    /**
     * Runs a reclamation pass when forced or when memory is under pressure; otherwise does nothing.
     */
    public ReclaimResult reclaim(boolean force) {
        final MemorySnapshot before = snapshot();
        if (!force && !before.pressure()) {
            return ReclaimResult.skipped(before.processMemoryBytes());
        }
        probe.requestReclamation();
        final long after = probe.processMemoryBytes();
        final ReclaimResult result = new ReclaimResult(true, before.processMemoryBytes(), after);
        log.debug("Memory reclamation (force={}): {} MB -> {} MB, freed {} MB.", force,
                before.processMemoryBytes() / MB, after / MB, result.freedBytes() / MB);
        return result;
    }
}
