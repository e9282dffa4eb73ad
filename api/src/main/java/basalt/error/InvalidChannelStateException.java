package basalt.error;

import javax.annotation.Nonnull;

/**
 * Thrown when a player operation needs a voice channel the player is not (or no longer) bound to.
 * This is a programming error and should not be retried.
 */
public class InvalidChannelStateException extends BasaltException {
    public InvalidChannelStateException(@Nonnull String message) {
        super(message);
    }
}
