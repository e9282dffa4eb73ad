package basalt.player;

import basalt.voice.VoiceChannel;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Read only view of a player, handed to event listeners.
 */
public interface BasaltPlayer {
    /**
     * Guild this player is registered for. Null until the first {@code connect}.
     *
     * @return The guild id.
     */
    @Nullable
    @CheckReturnValue
    String guildId();

    /**
     * @return The channel this player is bound to, if any.
     */
    @Nullable
    @CheckReturnValue
    VoiceChannel channel();

    @Nonnull
    @CheckReturnValue
    ConnectionState state();

    /**
     * @return True if bound to a channel and the voice gateway reported the bot as present in it.
     */
    @CheckReturnValue
    boolean connected();

    @Nullable
    @CheckReturnValue
    Track current();

    @Nullable
    @CheckReturnValue
    Track previous();

    /**
     * @return The volume, between 0 and 1000. Players start at 100.
     */
    @CheckReturnValue
    int volume();

    @CheckReturnValue
    boolean paused();

    /**
     * @return True if connected and a track is set.
     */
    @CheckReturnValue
    boolean playing();

    /**
     * Last position reported by the node, in milliseconds.
     *
     * @return The position.
     */
    @CheckReturnValue
    long position();
}
