package com.eyelevel.imageprocessor.service.dispatch;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.model.ItemOutcome;
import lombok.Builder;

import java.util.function.Consumer;

/**
 * Options for a single {@link ParallelDispatcher#dispatch} call.
 *
 * @param maxWorkers      upper bound on the pool size; values below 1 are treated as 1
 * @param mode            thread pool or fork-join pool
 * @param parallelEnabled when {@code false} items run sequentially on the calling thread
 * @param onItemComplete  optional progress callback, invoked once per item in completion order
 */
@Builder(toBuilder = true)
public record DispatchOptions<R>(int maxWorkers,
                                 DispatchMode mode,
                                 boolean parallelEnabled,
                                 Consumer<ItemOutcome<R>> onItemComplete) {

    public DispatchOptions {
        if (mode == null) {
            mode = DispatchMode.THREADS;
        }
    }

    public static <R> DispatchOptions<R> from(ImageProcessingConfig.Parallel parallel) {
        return new DispatchOptions<>(parallel.effectiveMaxWorkers(), parallel.mode(), parallel.enabled(), null);
    }

    public static <R> DispatchOptions<R> sequential() {
        return new DispatchOptions<>(1, DispatchMode.THREADS, false, null);
    }

    public DispatchOptions<R> withCallback(Consumer<ItemOutcome<R>> callback) {
        return new DispatchOptions<>(maxWorkers, mode, parallelEnabled, callback);
    }
}
