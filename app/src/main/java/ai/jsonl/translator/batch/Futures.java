package ai.jsonl.translator.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Future plumbing for the translation tree. Every future produced here passes its own cancellation back
 * to the futures it was derived from, so cancelling a record reaches the gate and the translator calls.
 */
final class Futures {

    private Futures() {
    }

    /**
     * Completes with {@code combiner} applied to the values of {@code tasks}, in the order the tasks were
     * given. The first failure completes the result exceptionally with its unwrapped cause. Once the
     * result is done exceptionally, whether by failure or by cancellation from outside, every sibling
     * still running is cancelled.
     */
    static <T, R> CompletableFuture<R> gather(List<CompletableFuture<T>> tasks, Function<List<T>, R> combiner) {
        CompletableFuture<R> result = new CompletableFuture<>();
        int size = tasks.size();
        if (size == 0) {
            complete(result, combiner, List.of());
            return result;
        }
        List<T> values = new ArrayList<>(Collections.nCopies(size, null));
        AtomicInteger remaining = new AtomicInteger(size);
        for (int index = 0; index < size; index++) {
            int slot = index;
            tasks.get(index).whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                    return;
                }
                synchronized (values) {
                    values.set(slot, value);
                }
                if (remaining.decrementAndGet() == 0) {
                    List<T> snapshot;
                    synchronized (values) {
                        snapshot = new ArrayList<>(values);
                    }
                    complete(result, combiner, snapshot);
                }
            });
        }
        result.whenComplete((value, error) -> {
            if (error != null) {
                tasks.forEach(task -> task.cancel(true));
            }
        });
        return result;
    }

    /**
     * Maps the outcome of {@code source}. Every failure of {@code source}, a cancellation included, and
     * anything thrown by {@code onSuccess} goes through {@code onFailure}. Cancelling the returned
     * future cancels {@code source}; the source outcome that follows is then ignored.
     */
    static <T, R> CompletableFuture<R> transform(CompletableFuture<T> source,
                                                 Function<? super T, ? extends R> onSuccess,
                                                 Function<Throwable, ? extends Throwable> onFailure) {
        CompletableFuture<R> target = new CompletableFuture<>();
        source.whenComplete((value, error) -> {
            if (error == null) {
                try {
                    target.complete(onSuccess.apply(value));
                } catch (Throwable ex) {
                    target.completeExceptionally(onFailure.apply(ex));
                }
                return;
            }
            if (!target.isDone()) {
                target.completeExceptionally(onFailure.apply(unwrap(error)));
            }
        });
        target.whenComplete((value, error) -> {
            if (target.isCancelled()) {
                source.cancel(true);
            }
        });
        return target;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T, R> void complete(CompletableFuture<R> result, Function<List<T>, R> combiner, List<T> values) {
        try {
            result.complete(combiner.apply(values));
        } catch (Throwable ex) {
            result.completeExceptionally(ex);
        }
    }
}
