package com.eyelevel.imageprocessor.model;

/**
 * Point-in-time view of memory usage. Never cached; read fresh for every batching decision.
 *
 * @param processMemoryBytes heap plus non-heap memory used by this JVM
 * @param systemUsedPercent  physical memory used on the host, 0-100
 * @param pressure           {@code systemUsedPercent} is above the soft threshold
 * @param critical           {@code systemUsedPercent} is above the critical threshold
 */
public record MemorySnapshot(long processMemoryBytes, double systemUsedPercent, boolean pressure, boolean critical) {
}
