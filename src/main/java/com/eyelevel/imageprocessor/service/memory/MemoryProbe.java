package com.eyelevel.imageprocessor.service.memory;

/**
 * Source of raw memory readings. Separated from the advisor so tests can supply synthetic values.
 */
public interface MemoryProbe {

    /**
     * @return bytes of heap and non-heap memory currently used by this process.
     */
    long processMemoryBytes();

    /**
     * @return percentage (0-100) of the host's physical memory in use.
     */
    double systemUsedPercent();

    /**
     * Asks the runtime to reclaim unreachable memory. Best effort.
     */
    void requestReclamation();
}
