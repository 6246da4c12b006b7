package com.eyelevel.imageprocessor.service.dispatch;

/**
 * How the dispatcher runs its workers.
 */
public enum DispatchMode {
    /**
     * A fixed pool of platform threads. Suited to I/O-bound work such as reading and writing files.
     */
    THREADS,
    /**
     * A work-stealing {@link java.util.concurrent.ForkJoinPool}, for work dominated by CPU-bound decoding.
     */
    PROCESSES
}
