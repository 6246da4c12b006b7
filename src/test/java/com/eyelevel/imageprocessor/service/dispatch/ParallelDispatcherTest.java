package com.eyelevel.imageprocessor.service.dispatch;

import com.eyelevel.imageprocessor.model.ItemOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ParallelDispatcherTest {

    private final ParallelDispatcher dispatcher = new ParallelDispatcher();

    @ParameterizedTest
    @EnumSource(DispatchMode.class)
    @DisplayName("Results line up with inputs regardless of completion order")
    void preservesInputOrder(DispatchMode mode) {
        final List<Integer> items = IntStream.range(0, 200).boxed().toList();

        final List<ItemOutcome<Integer>> results = dispatcher.dispatch(items, item -> {
            sleepQuietly(ThreadLocalRandom.current().nextInt(3));
            return item * 2;
        }, new DispatchOptions<>(8, mode, true, null));

        assertThat(results).hasSize(items.size());
        for (int i = 0; i < items.size(); i++) {
            assertThat(results.get(i).isSuccess()).isTrue();
            assertThat(results.get(i).value()).isEqualTo(i * 2);
        }
    }

    @Test
    @DisplayName("A failing item becomes a failed outcome and the rest still run")
    void isolatesItemFailures() {
        final List<String> items = List.of("a", "boom", "c", "d");

        final List<ItemOutcome<String>> results = dispatcher.dispatch(items, item -> {
            if (item.equals("boom")) {
                throw new IllegalStateException("cannot process boom");
            }
            return item.toUpperCase();
        }, new DispatchOptions<>(4, DispatchMode.THREADS, true, null));

        assertThat(results).extracting(ItemOutcome::value).containsExactly("A", null, "C", "D");
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(1).failureReason()).isEqualTo("cannot process boom");
    }

    @Test
    @DisplayName("Exceptions without a message are reported by class name")
    void describesExceptionsWithoutMessage() {
        final List<ItemOutcome<Object>> results = dispatcher.dispatch(List.of(1, 2), item -> {
            throw new UnsupportedOperationException();
        }, new DispatchOptions<>(2, DispatchMode.THREADS, true, null));

        assertThat(results).allSatisfy(outcome ->
                assertThat(outcome.failureReason()).isEqualTo("UnsupportedOperationException"));
    }

    @Test
    @DisplayName("The completion callback fires once per item on the calling thread")
    void callbackRunsOncePerItemOnCaller() {
        final Thread caller = Thread.currentThread();
        final List<ItemOutcome<Integer>> seen = new ArrayList<>();
        final Set<Thread> callbackThreads = ConcurrentHashMap.newKeySet();
        final Set<Thread> workerThreads = ConcurrentHashMap.newKeySet();

        dispatcher.dispatch(IntStream.range(0, 50).boxed().toList(), item -> {
            workerThreads.add(Thread.currentThread());
            return item;
        }, new DispatchOptions<Integer>(4, DispatchMode.THREADS, true, outcome -> {
            callbackThreads.add(Thread.currentThread());
            seen.add(outcome);
        }));

        assertThat(seen).hasSize(50);
        assertThat(seen).extracting(ItemOutcome::value).containsExactlyInAnyOrderElementsOf(
                IntStream.range(0, 50).boxed().toList());
        assertThat(callbackThreads).containsExactly(caller);
        assertThat(workerThreads).doesNotContain(caller);
    }

    @Test
    @DisplayName("A throwing callback does not disturb the results")
    void callbackFailureIsIgnored() {
        final List<ItemOutcome<Integer>> results = dispatcher.dispatch(List.of(1, 2, 3), item -> item,
                new DispatchOptions<Integer>(2, DispatchMode.THREADS, true, outcome -> {
                    throw new IllegalStateException("listener broke");
                }));

        assertThat(results).extracting(ItemOutcome::value).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Disabled parallelism runs items in order on the calling thread")
    void sequentialWhenDisabled() {
        final Thread caller = Thread.currentThread();
        final List<Integer> order = new ArrayList<>();

        final List<ItemOutcome<Boolean>> results = dispatcher.dispatch(List.of(3, 1, 2), item -> {
            order.add(item);
            return Thread.currentThread() == caller;
        }, DispatchOptions.sequential());

        assertThat(order).containsExactly(3, 1, 2);
        assertThat(results).extracting(ItemOutcome::value).containsOnly(true);
    }

    @Test
    @DisplayName("Empty input returns an empty list without invoking the function")
    void emptyInput() {
        final List<ItemOutcome<Object>> results = dispatcher.dispatch(List.of(), item -> {
            throw new AssertionError("must not run");
        }, new DispatchOptions<>(4, DispatchMode.THREADS, true, null));

        assertThat(results).isEmpty();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
