package basalt.node;

import com.typesafe.config.Config;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Address and credentials of a node, read from one entry of {@code basalt.nodes}.
 */
public final class NodeOptions {
    private final String id;
    private final String host;
    private final int port;
    private final boolean secure;
    private final String password;
    private final Duration reconnectDelay;

    public NodeOptions(@Nonnull String id, @Nonnull String host, int port, boolean secure,
                       @Nonnull String password, @Nonnull Duration reconnectDelay) {
        this.id = Objects.requireNonNull(id, "id");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.secure = secure;
        this.password = Objects.requireNonNull(password, "password");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        if(port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port " + port + " for node " + id);
        }
    }

    @Nonnull
    @CheckReturnValue
    public static NodeOptions fromConfig(@Nonnull Config config) {
        return new NodeOptions(
                config.getString("id"),
                config.getString("host"),
                config.getInt("port"),
                config.hasPath("secure") && config.getBoolean("secure"),
                config.getString("password"),
                config.hasPath("reconnect-delay") ? config.getDuration("reconnect-delay") : Duration.ofSeconds(5)
        );
    }

    @Nonnull
    @CheckReturnValue
    public String id() {
        return id;
    }

    @Nonnull
    @CheckReturnValue
    public String host() {
        return host;
    }

    @CheckReturnValue
    public int port() {
        return port;
    }

    @CheckReturnValue
    public boolean secure() {
        return secure;
    }

    @Nonnull
    @CheckReturnValue
    public String password() {
        return password;
    }

    @Nonnull
    @CheckReturnValue
    public Duration reconnectDelay() {
        return reconnectDelay;
    }

    @Override
    public String toString() {
        return "NodeOptions(" + id + " at " + (secure ? "https://" : "http://") + host + ":" + port + ")";
    }
}
