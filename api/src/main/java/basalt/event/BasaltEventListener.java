package basalt.event;

import basalt.player.BasaltPlayer;
import basalt.player.Track;
import io.vertx.core.json.JsonObject;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public interface BasaltEventListener {
    default void onPlayerRegistered(@Nonnull String nodeId, @Nonnull BasaltPlayer player) {
    }

    default void onPlayerDestroyed(@Nonnull String nodeId, @Nonnull BasaltPlayer player) {
    }

    default void onNodeReady(@Nonnull String nodeId, @Nonnull String sessionId, boolean resumed) {
    }

    default void onTrackStart(@Nonnull BasaltPlayer player, @Nonnull Track track) {
    }

    default void onTrackEnd(@Nonnull BasaltPlayer player, @Nonnull Track track, @Nonnull String reason) {
    }

    default void onTrackException(@Nonnull BasaltPlayer player, @Nonnull Track track, @Nonnull JsonObject exception) {
    }

    default void onTrackStuck(@Nonnull BasaltPlayer player, @Nonnull Track track, @Nonnegative long thresholdMs) {
    }

    default void onWebSocketClosed(@Nonnull BasaltPlayer player, int closeCode,
                                   @Nullable String reason, boolean byRemote) {
    }
}
