package basalt.node;

import basalt.player.PlayerUpdate;
import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.concurrent.CompletionStage;

/**
 * Control API of a remote audio node. Failures are reported by completing the returned
 * stage exceptionally with a {@link basalt.error.RemoteSessionException RemoteSessionException}.
 */
public interface SessionGateway {
    /**
     * Applies a partial update to the player of a guild, creating it if needed.
     *
     * @param guildId Guild of the player.
     * @param update Fields to update.
     * @param replace Whether a track in the update should replace the one currently playing.
     *
     * @return The player state returned by the node.
     */
    @Nonnull
    @CheckReturnValue
    CompletionStage<JsonObject> updatePlayer(@Nonnull String guildId, @Nonnull PlayerUpdate update, boolean replace);

    /**
     * Destroys the player of a guild on the node.
     *
     * @param guildId Guild of the player.
     *
     * @return Stage completed once the node acknowledged.
     */
    @Nonnull
    @CheckReturnValue
    CompletionStage<Void> destroyPlayer(@Nonnull String guildId);
}
