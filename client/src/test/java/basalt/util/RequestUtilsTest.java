package basalt.util;

import basalt.error.RemoteSessionException;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestUtilsTest {
    @Test
    void returnsResult() {
        assertThat(RequestUtils.await(CompletableFuture.completedFuture("ok"))).isEqualTo("ok");
    }

    @Test
    void remoteFailuresAreRethrownAsIs() {
        var failure = new RemoteSessionException("rejected");

        assertThatThrownBy(() -> RequestUtils.await(CompletableFuture.failedFuture(failure))).isSameAs(failure);
    }

    @Test
    void otherFailuresAreWrapped() {
        var cause = new IOException("connection reset");

        assertThatThrownBy(() -> RequestUtils.await(CompletableFuture.failedFuture(new CompletionException(cause))))
                .isInstanceOf(RemoteSessionException.class)
                .hasCause(cause);
    }

    @Test
    void cancelledRequestsFail() {
        var future = new CompletableFuture<String>();
        future.cancel(false);

        assertThatThrownBy(() -> RequestUtils.await(future)).isInstanceOf(RemoteSessionException.class);
    }

    @Test
    void blockingOnEventLoopIsRejected() throws Exception {
        var vertx = Vertx.vertx();
        try {
            var result = new CompletableFuture<Throwable>();
            vertx.runOnContext(__ -> {
                try {
                    RequestUtils.await(new CompletableFuture<String>());
                    result.complete(null);
                } catch(Throwable t) {
                    result.complete(t);
                }
            });
            assertThat(result.get(5, TimeUnit.SECONDS)).isInstanceOf(IllegalStateException.class);
        } finally {
            vertx.close();
        }
    }
}
