package basalt.error;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Thrown by {@code connect} when the node did not confirm the voice session in time.
 * Callers may retry the connection.
 */
public class ChannelTimeoutException extends BasaltException {
    private final String channelId;
    private final Duration timeout;

    public ChannelTimeoutException(@Nonnull String channelId, @Nonnull Duration timeout) {
        super("Unable to connect to channel " + channelId + " as it exceeded the timeout of "
                + (timeout.toMillis() / 1000.0) + " seconds");
        this.channelId = channelId;
        this.timeout = timeout;
    }

    @Nonnull
    public String channelId() {
        return channelId;
    }

    @Nonnull
    public Duration timeout() {
        return timeout;
    }
}
