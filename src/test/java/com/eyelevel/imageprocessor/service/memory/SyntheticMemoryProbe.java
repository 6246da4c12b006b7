package com.eyelevel.imageprocessor.service.memory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Replays scripted system-usage readings; the last reading repeats once the script runs out.
 */
class SyntheticMemoryProbe implements MemoryProbe {

    private final Deque<Double> readings = new ArrayDeque<>();
    private double last;
    private long processBytes = 512L * 1024 * 1024;
    private int reclamations;

    SyntheticMemoryProbe(double... usedPercents) {
        for (double used : usedPercents) {
            readings.add(used);
        }
        last = usedPercents.length == 0 ? 0d : usedPercents[0];
    }

    @Override
    public long processMemoryBytes() {
        return processBytes;
    }

    @Override
    public double systemUsedPercent() {
        if (!readings.isEmpty()) {
            last = readings.poll();
        }
        return last;
    }

    @Override
    public void requestReclamation() {
        reclamations++;
        processBytes -= 64L * 1024 * 1024;
    }

    int reclamations() {
        return reclamations;
    }
}
