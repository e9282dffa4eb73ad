package basalt.player;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One shot signal raised when the node accepted a voice session. Resetting replaces a raised
 * signal with a fresh one, so waiters only ever observe the generation they started waiting on.
 */
class ConnectionSignal {
    private final AtomicReference<CompletableFuture<Void>> current =
            new AtomicReference<>(new CompletableFuture<>());

    /**
     * @return True if this call raised the signal, false if it was already raised.
     */
    boolean raise() {
        return current.get().complete(null);
    }

    void reset() {
        current.updateAndGet(f -> f.isDone() ? new CompletableFuture<>() : f);
    }

    boolean isRaised() {
        return current.get().isDone();
    }

    void await(@Nonnull Duration timeout) throws InterruptedException, TimeoutException {
        var future = current.get();
        try {
            future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch(ExecutionException e) {
            //never completed exceptionally
            throw new AssertionError(e);
        }
    }
}
