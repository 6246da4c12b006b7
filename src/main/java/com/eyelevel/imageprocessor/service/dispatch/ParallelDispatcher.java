package com.eyelevel.imageprocessor.service.dispatch;

import com.eyelevel.imageprocessor.exception.ImageProcessingException;
import com.eyelevel.imageprocessor.model.ItemOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs a function over a list of items on a bounded worker pool.
 * <p>
 * Guarantees:
 * <ul>
 *     <li>{@code results.get(i)} always belongs to {@code items.get(i)}, whatever order the workers finish in.</li>
 *     <li>A runtime exception thrown by the function becomes a failed {@link ItemOutcome} in that slot;
 *     the remaining items still run.</li>
 *     <li>The completion callback runs exactly once per item, on the calling thread, in completion order.</li>
 *     <li>The pool is created per call and fully shut down before {@code dispatch} returns.</li>
 * </ul>
 * With one item or fewer, or with parallelism disabled, items run in order on the calling thread.
 */
@Slf4j
@Component
public class ParallelDispatcher {

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    public <T, R> List<ItemOutcome<R>> dispatch(List<T> items, Function<T, R> fn, DispatchOptions<R> options) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        final int workers = Math.min(Math.max(1, options.maxWorkers()), items.size());
        if (items.size() <= 1 || !options.parallelEnabled() || workers == 1) {
            return runSequentially(items, fn, options.onItemComplete());
        }
        return runInPool(items, fn, options, workers);
    }

    private <T, R> List<ItemOutcome<R>> runSequentially(List<T> items, Function<T, R> fn,
                                                        Consumer<ItemOutcome<R>> callback) {
        log.debug("Dispatching {} item(s) sequentially.", items.size());
        final List<ItemOutcome<R>> results = new ArrayList<>(items.size());
        for (T item : items) {
            final ItemOutcome<R> outcome = invoke(fn, item);
            results.add(outcome);
            notifyCompletion(callback, outcome);
        }
        return results;
    }

    private <T, R> List<ItemOutcome<R>> runInPool(List<T> items, Function<T, R> fn, DispatchOptions<R> options,
                                                  int workers) {
        log.debug("Dispatching {} items across {} workers in {} mode.", items.size(), workers, options.mode());
        final ExecutorService pool = createPool(options.mode(), workers);
        try {
            final CompletionService<IndexedOutcome<R>> completionService = new ExecutorCompletionService<>(pool);
            for (int i = 0; i < items.size(); i++) {
                final int index = i;
                final T item = items.get(i);
                completionService.submit(() -> new IndexedOutcome<>(index, invoke(fn, item)));
            }

            final List<ItemOutcome<R>> results = new ArrayList<>(Collections.nCopies(items.size(), null));
            for (int completed = 0; completed < items.size(); completed++) {
                final IndexedOutcome<R> finished = completionService.take().get();
                results.set(finished.index(), finished.outcome());
                notifyCompletion(options.onItemComplete(), finished.outcome());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageProcessingException("Parallel dispatch was interrupted", e);
        } catch (ExecutionException e) {
            // invoke() converts runtime exceptions, so only Errors reach this point.
            throw new ImageProcessingException("Worker failed fatally during parallel dispatch", e.getCause());
        } finally {
            shutdown(pool);
        }
    }

    private <T, R> ItemOutcome<R> invoke(Function<T, R> fn, T item) {
        try {
            return ItemOutcome.success(fn.apply(item));
        } catch (RuntimeException e) {
            log.debug("Item '{}' failed: {}", item, e.getMessage());
            return ItemOutcome.failure(describe(e));
        }
    }

    private <R> void notifyCompletion(Consumer<ItemOutcome<R>> callback, ItemOutcome<R> outcome) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(outcome);
        } catch (RuntimeException e) {
            log.warn("Item completion callback threw an exception; ignoring.", e);
        }
    }

    private ExecutorService createPool(DispatchMode mode, int workers) {
        if (mode == DispatchMode.PROCESSES) {
            return new ForkJoinPool(workers);
        }
        return Executors.newFixedThreadPool(workers, new NamedThreadFactory("dispatch-worker"));
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Dispatch pool did not terminate within {}s; forcing shutdown.", SHUTDOWN_GRACE_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static String describe(RuntimeException e) {
        final String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private record IndexedOutcome<R>(int index, ItemOutcome<R> outcome) {
    }

    private static class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            final Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
