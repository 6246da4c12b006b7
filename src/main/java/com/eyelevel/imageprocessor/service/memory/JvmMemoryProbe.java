package com.eyelevel.imageprocessor.service.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads memory usage from the platform MX beans. System-wide figures need the
 * {@code com.sun.management} extension; without it the probe falls back to heap usage against the max heap.
 */
@Slf4j
@Component
public class JvmMemoryProbe implements MemoryProbe {

    private final MemoryMXBean memoryBean;
    private final OperatingSystemMXBean osBean;

    public JvmMemoryProbe() {
        this.memoryBean = ManagementFactory.getMemoryMXBean();
        this.osBean = ManagementFactory.getOperatingSystemMXBean();
    }

    @Override
    public long processMemoryBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed() + memoryBean.getNonHeapMemoryUsage().getUsed();
    }

    @Override
    public double systemUsedPercent() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean extended) {
            final long total = extended.getTotalMemorySize();
            if (total > 0) {
                final long free = extended.getFreeMemorySize();
                return (total - free) * 100.0 / total;
            }
        }
        final Runtime runtime = Runtime.getRuntime();
        final long used = runtime.totalMemory() - runtime.freeMemory();
        return used * 100.0 / runtime.maxMemory();
    }

    @Override
    public void requestReclamation() {
        memoryBean.gc();
    }
}
