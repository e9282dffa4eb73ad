package basalt.voice;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Connection to the voice gateway of the chat platform, implemented by the bot's gateway library.
 * The library is expected to forward voice state and voice server updates for the guild to
 * the player it created.
 */
public interface VoiceSessionClient {
    /**
     * Id of the bot user, sent to nodes when opening their websocket.
     *
     * @return The user id.
     */
    @Nonnull
    String userId();

    /**
     * Requests joining, moving or leaving a voice channel. Results are delivered asynchronously
     * as voice state/server updates.
     *
     * @param guildId Guild to update.
     * @param channelId Channel to join, or null to leave.
     * @param selfDeaf Whether the bot should be deafened.
     * @param selfMute Whether the bot should be muted.
     */
    void changeVoiceState(@Nonnull String guildId, @Nullable String channelId, boolean selfDeaf, boolean selfMute);

    /**
     * Releases any state the gateway library keeps for the voice connection of a guild.
     * Implementations should return false when there was nothing left to release, and only
     * throw for real failures.
     *
     * @param guildId Guild whose voice state should be released.
     *
     * @return True if something was released.
     */
    default boolean cleanup(@Nonnull String guildId) {
        return false;
    }
}
