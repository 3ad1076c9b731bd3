package ai.jsonl.translator.batch;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Counting permit pool shared by every translation of one batch run.
 *
 * <p>Acquisition never blocks a thread: {@link #acquire()} returns a future that completes once a permit
 * is free. Waiters are admitted in arrival order. {@link #submit(Supplier)} is the scoped form and is what
 * callers should normally use; it guarantees that the permit goes back to the pool on every exit path.
 *
 * <p>A permit that frees up is handed to the next waiter on the admission executor, so a long queue of
 * instantly completing operations never recurses on the releasing thread's stack.
 */
public final class ConcurrencyGate {

    private final int capacity;
    private final Executor admissionExecutor;
    private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
    private int available;

    public ConcurrencyGate(int capacity) {
        this(capacity, ForkJoinPool.commonPool());
    }

    public ConcurrencyGate(int capacity, Executor admissionExecutor) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.admissionExecutor = Objects.requireNonNull(admissionExecutor, "admissionExecutor");
        this.available = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public CompletableFuture<Permit> acquire() {
        CompletableFuture<Permit> waiter = new CompletableFuture<>();
        synchronized (this) {
            if (available > 0) {
                available--;
            } else {
                waiters.addLast(waiter);
                return waiter;
            }
        }
        waiter.complete(new Permit(this));
        return waiter;
    }

    public void release(Permit permit) {
        Objects.requireNonNull(permit, "permit");
        if (permit.gate != this) {
            throw new IllegalArgumentException("permit was issued by another gate");
        }
        if (!permit.released.compareAndSet(false, true)) {
            throw new IllegalStateException("permit already released");
        }
        handOff();
    }

    /**
     * Runs {@code operation} while holding a permit. The permit is released when the operation's future
     * completes, when the operation throws (errors included), or when the returned future is cancelled. Cancelling before
     * admission means the operation never starts.
     */
    public <T> CompletableFuture<T> submit(Supplier<? extends CompletableFuture<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        CompletableFuture<T> result = new CompletableFuture<>();
        acquire().whenComplete((permit, acquireError) -> {
            if (acquireError != null) {
                result.completeExceptionally(acquireError);
                return;
            }
            if (result.isDone()) {
                release(permit);
                return;
            }
            CompletableFuture<T> call;
            try {
                call = Objects.requireNonNull(operation.get(), "operation returned null");
            } catch (Throwable ex) {
                call = CompletableFuture.failedFuture(ex);
            }
            CompletableFuture<T> inFlight = call;
            inFlight.whenComplete((value, error) -> {
                release(permit);
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    result.complete(value);
                }
            });
            result.whenComplete((value, error) -> {
                if (error instanceof CancellationException) {
                    inFlight.cancel(true);
                }
            });
        });
        return result;
    }

    synchronized int availablePermits() {
        return available;
    }

    synchronized int queuedWaiters() {
        return waiters.size();
    }

    private void handOff() {
        CompletableFuture<Permit> next;
        synchronized (this) {
            next = waiters.pollFirst();
            if (next == null) {
                available++;
                return;
            }
        }
        Permit permit = new Permit(this);
        admissionExecutor.execute(() -> {
            // a waiter cancelled while queued refuses the permit
            if (!next.complete(permit)) {
                handOff();
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Lease on one slot of the gate. Valid for exactly one release.
     */
    public static final class Permit {

        private final ConcurrencyGate gate;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(ConcurrencyGate gate) {
            this.gate = gate;
        }

        public boolean isReleased() {
            return released.get();
        }
    }
}
