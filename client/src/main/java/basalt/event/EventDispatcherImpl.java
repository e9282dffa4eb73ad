package basalt.event;

import basalt.player.BasaltPlayer;
import basalt.player.Track;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

public class EventDispatcherImpl implements EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final Set<BasaltEventListener> listeners = ConcurrentHashMap.newKeySet();

    @Override
    public void register(@Nonnull BasaltEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public void unregister(@Nonnull BasaltEventListener listener) {
        listeners.remove(listener);
    }

    public void onPlayerRegistered(@Nonnull String nodeId, @Nonnull BasaltPlayer player) {
        forEach(l -> l.onPlayerRegistered(nodeId, player));
    }

    public void onPlayerDestroyed(@Nonnull String nodeId, @Nonnull BasaltPlayer player) {
        forEach(l -> l.onPlayerDestroyed(nodeId, player));
    }

    public void onNodeReady(@Nonnull String nodeId, @Nonnull String sessionId, boolean resumed) {
        forEach(l -> l.onNodeReady(nodeId, sessionId, resumed));
    }

    public void onTrackStart(@Nonnull BasaltPlayer player, @Nonnull Track track) {
        forEach(l -> l.onTrackStart(player, track));
    }

    public void onTrackEnd(@Nonnull BasaltPlayer player, @Nonnull Track track, @Nonnull String reason) {
        forEach(l -> l.onTrackEnd(player, track, reason));
    }

    public void onTrackException(@Nonnull BasaltPlayer player, @Nonnull Track track, @Nonnull JsonObject exception) {
        forEach(l -> l.onTrackException(player, track, exception));
    }

    public void onTrackStuck(@Nonnull BasaltPlayer player, @Nonnull Track track, @Nonnegative long thresholdMs) {
        forEach(l -> l.onTrackStuck(player, track, thresholdMs));
    }

    public void onWebSocketClosed(@Nonnull BasaltPlayer player, int closeCode,
                                  @Nullable String reason, boolean byRemote) {
        forEach(l -> l.onWebSocketClosed(player, closeCode, reason, byRemote));
    }

    private void forEach(Consumer<BasaltEventListener> action) {
        for(var v : listeners) {
            try {
                action.accept(v);
            } catch(Throwable t) {
                log.error("Error dispatching event to {}: ", v, t);
            }
        }
    }
}
