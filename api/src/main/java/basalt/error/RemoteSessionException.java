package basalt.error;

import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Failure reported by the remote audio node, or while talking to it.
 */
public class RemoteSessionException extends BasaltException {
    private final int status;
    private final String error;
    private final String path;

    public RemoteSessionException(@Nonnull String message) {
        this(message, -1, null, null, null);
    }

    public RemoteSessionException(@Nonnull String message, @Nullable Throwable cause) {
        this(message, -1, null, null, cause);
    }

    public RemoteSessionException(@Nonnull String message, int status, @Nullable String error,
                                  @Nullable String path, @Nullable Throwable cause) {
        super(message, cause);
        this.status = status;
        this.error = error;
        this.path = path;
    }

    /**
     * Builds an exception from the json error body returned by the node.
     *
     * @param status HTTP status of the response.
     * @param body Response body, may be null if it wasn't json.
     *
     * @return The exception describing the failure.
     */
    @Nonnull
    @CheckReturnValue
    public static RemoteSessionException fromResponse(int status, @Nullable JsonObject body) {
        if(body == null) {
            return new RemoteSessionException("Node responded with status " + status, status, null, null, null);
        }
        var message = body.getString("message", "Node responded with status " + status);
        return new RemoteSessionException(message, status, body.getString("error"), body.getString("path"), null);
    }

    /**
     * @return HTTP status returned by the node, or -1 if the request never got a response.
     */
    @CheckReturnValue
    public int status() {
        return status;
    }

    @Nullable
    @CheckReturnValue
    public String error() {
        return error;
    }

    @Nullable
    @CheckReturnValue
    public String path() {
        return path;
    }
}
