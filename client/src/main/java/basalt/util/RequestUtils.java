package basalt.util;

import basalt.error.RemoteSessionException;
import io.vertx.core.Context;

import javax.annotation.Nonnull;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

public class RequestUtils {
    /**
     * Waits for a node request to finish. Failures are rethrown as {@link RemoteSessionException}.
     * Must not be called from an event loop thread, as the response is delivered on one.
     *
     * @param stage Pending request.
     * @param <T> Result type.
     *
     * @return The result of the request.
     */
    public static <T> T await(@Nonnull CompletionStage<T> stage) {
        if(Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Blocking on a node request from an event loop thread");
        }
        try {
            return stage.toCompletableFuture().get();
        } catch(InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteSessionException("Interrupted while waiting for the node", e);
        } catch(ExecutionException | CompletionException e) {
            throw unwrap(e.getCause() == null ? e : e.getCause());
        } catch(CancellationException e) {
            throw new RemoteSessionException("Node request was cancelled", e);
        }
    }

    @Nonnull
    static RemoteSessionException unwrap(@Nonnull Throwable t) {
        while(t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if(t instanceof RemoteSessionException) {
            return (RemoteSessionException) t;
        }
        return new RemoteSessionException("Node request failed: " + t, t);
    }
}
