package basalt.node;

import basalt.error.RemoteSessionException;
import basalt.player.PlayerUpdate;
import basalt.util.Metrics;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Controls players through the node's REST API.
 */
public class RestSessionGateway implements SessionGateway {
    private static final Logger log = LoggerFactory.getLogger(RestSessionGateway.class);

    private final WebClient client;
    private final NodeOptions options;
    private final Supplier<String> sessionId;

    public RestSessionGateway(@Nonnull WebClient client, @Nonnull NodeOptions options,
                              @Nonnull Supplier<String> sessionId) {
        this.client = client;
        this.options = options;
        this.sessionId = sessionId;
    }

    @Nonnull
    @Override
    public CompletionStage<JsonObject> updatePlayer(@Nonnull String guildId, @Nonnull PlayerUpdate update, boolean replace) {
        var session = sessionId.get();
        if(session == null) {
            return notReady("update");
        }
        var path = playerPath(session, guildId);
        log.debug("Updating player on node {}: PATCH {} noReplace={} {}", options.id(), path, !replace, update);
        return request(HttpMethod.PATCH, path)
                .addQueryParam("noReplace", String.valueOf(!replace))
                .sendJsonObject(update.toJson())
                .transform(ar -> handle("update", ar))
                .map(body -> body == null ? new JsonObject() : body)
                .toCompletionStage();
    }

    @Nonnull
    @Override
    public CompletionStage<Void> destroyPlayer(@Nonnull String guildId) {
        var session = sessionId.get();
        if(session == null) {
            return notReady("destroy");
        }
        var path = playerPath(session, guildId);
        log.debug("Destroying player on node {}: DELETE {}", options.id(), path);
        return request(HttpMethod.DELETE, path)
                .send()
                .transform(ar -> handle("destroy", ar))
                .<Void>mapEmpty()
                .toCompletionStage();
    }

    @Nonnull
    @CheckReturnValue
    static String playerPath(@Nonnull String sessionId, @Nonnull String guildId) {
        return "/v4/sessions/" + sessionId + "/players/" + guildId;
    }

    @Nonnull
    private HttpRequest<Buffer> request(@Nonnull HttpMethod method, @Nonnull String path) {
        return client.request(method, options.port(), options.host(), path)
                .ssl(options.secure())
                .putHeader("Authorization", options.password());
    }

    @Nonnull
    private Future<JsonObject> handle(@Nonnull String operation, @Nonnull AsyncResult<HttpResponse<Buffer>> ar) {
        if(ar.failed()) {
            Metrics.REMOTE_REQUESTS.labels(operation, "error").inc();
            return Future.failedFuture(new RemoteSessionException(
                    "Request to node " + options.id() + " failed: " + ar.cause(), ar.cause()));
        }
        var response = ar.result();
        var body = parseBody(response);
        if(response.statusCode() / 100 != 2) {
            Metrics.REMOTE_REQUESTS.labels(operation, "rejected").inc();
            return Future.failedFuture(RemoteSessionException.fromResponse(response.statusCode(), body));
        }
        Metrics.REMOTE_REQUESTS.labels(operation, "success").inc();
        return Future.succeededFuture(body);
    }

    @Nullable
    private static JsonObject parseBody(@Nonnull HttpResponse<Buffer> response) {
        var buffer = response.body();
        if(buffer == null || buffer.length() == 0) {
            return null;
        }
        try {
            return buffer.toJsonObject();
        } catch(DecodeException | ClassCastException e) {
            log.debug("Node responded with a non json body: {}", buffer);
            return null;
        }
    }

    @Nonnull
    private <T> CompletionStage<T> notReady(@Nonnull String operation) {
        Metrics.REMOTE_REQUESTS.labels(operation, "error").inc();
        return CompletableFuture.failedFuture(new RemoteSessionException("Node " + options.id() + " has no session yet"));
    }
}
