package basalt.player;

import basalt.error.ChannelTimeoutException;
import basalt.error.InvalidChannelStateException;
import basalt.error.RemoteSessionException;
import basalt.node.Node;
import basalt.util.RequestUtils;
import basalt.voice.VoiceChannel;
import basalt.voice.VoiceSessionClient;
import basalt.voice.VoiceSessionDescriptor;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Controls the voice connection and playback of one guild on a node.
 *
 * <p>The gateway library must forward the guild's voice state updates to
 * {@link #onVoiceStateUpdate(String, String)} and voice server updates to
 * {@link #onVoiceServerUpdate(String, String)}. Once both arrived, the voice session is sent to the
 * node and {@link #connect(Duration, boolean, boolean, boolean) connect} returns.
 *
 * <p>All operations are serialized per player. Operations block while waiting for the node, so they
 * must not be called from an event loop thread.
 */
public class Player implements BasaltPlayer {
    private static final Logger log = LoggerFactory.getLogger(Player.class);

    public static final int MIN_VOLUME = 0;
    public static final int MAX_VOLUME = 1000;
    public static final int DEFAULT_VOLUME = 100;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final ReentrantLock lock = new ReentrantLock();
    private final VoiceSessionDescriptor voiceState = new VoiceSessionDescriptor();
    private final ConnectionSignal connectionSignal = new ConnectionSignal();
    private final VoiceSessionClient client;
    private final Node node;
    private final Duration defaultConnectTimeout;

    private volatile VoiceChannel channel;
    private volatile String guildId;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean connected;
    @GuardedBy("lock")
    private VoiceSessionDescriptor lastDispatched;

    private volatile Track current;
    private volatile Track original;
    private volatile Track previous;
    private volatile int volume = DEFAULT_VOLUME;
    private volatile boolean paused;
    private volatile long position;

    public Player(@Nonnull VoiceSessionClient client, @Nullable VoiceChannel channel, @Nonnull Node node) {
        this(client, channel, node, DEFAULT_CONNECT_TIMEOUT);
    }

    public Player(@Nonnull VoiceSessionClient client, @Nullable VoiceChannel channel,
                  @Nonnull Node node, @Nonnull Duration defaultConnectTimeout) {
        this.client = client;
        this.channel = channel;
        this.node = node;
        this.defaultConnectTimeout = defaultConnectTimeout;
    }

    @Nonnull
    @CheckReturnValue
    public Node node() {
        return node;
    }

    @Nullable
    @CheckReturnValue
    @Override
    public String guildId() {
        return guildId;
    }

    @Nullable
    @CheckReturnValue
    @Override
    public VoiceChannel channel() {
        return channel;
    }

    @Nonnull
    @CheckReturnValue
    @Override
    public ConnectionState state() {
        return state;
    }

    @CheckReturnValue
    @Override
    public boolean connected() {
        return channel != null && connected;
    }

    @Nullable
    @CheckReturnValue
    @Override
    public Track current() {
        return current;
    }

    /**
     * Track originally requested for the current logical playback. Kept when a track is queued
     * with {@code replace = false} while another one is playing.
     *
     * @return The original track.
     */
    @Nullable
    @CheckReturnValue
    public Track original() {
        return original;
    }

    @Nullable
    @CheckReturnValue
    @Override
    public Track previous() {
        return previous;
    }

    @CheckReturnValue
    @Override
    public int volume() {
        return volume;
    }

    @CheckReturnValue
    @Override
    public boolean paused() {
        return paused;
    }

    @CheckReturnValue
    @Override
    public boolean playing() {
        return connected && current != null;
    }

    @CheckReturnValue
    @Override
    public long position() {
        return position;
    }

    /**
     * Handles a voice state update for this player's guild.
     *
     * @param channelId Channel the bot is in, or null if it left.
     * @param sessionId Voice session id.
     */
    public void onVoiceStateUpdate(@Nullable String channelId, @Nullable String sessionId) {
        lock.lock();
        try {
            if(state == ConnectionState.INVALIDATED) {
                log.debug("Ignoring voice state update for destroyed player {}", this);
                return;
            }
            if(channelId == null || channelId.isEmpty()) {
                log.info("Player {} left its voice channel, destroying", this);
                destroy();
                return;
            }
            var guild = resolveGuildId();
            if(guild == null) {
                log.warn("Ignoring voice state update for player without channel or guild");
                return;
            }
            connected = true;
            voiceState.setSessionId(sessionId);
            channel = new VoiceChannel(guild, channelId);
            dispatchVoiceUpdate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Handles a voice server update for this player's guild.
     *
     * @param token Voice token.
     * @param endpoint Voice server endpoint. The gateway may send null while allocating a server.
     */
    public void onVoiceServerUpdate(@Nullable String token, @Nullable String endpoint) {
        lock.lock();
        try {
            if(state == ConnectionState.INVALIDATED) {
                log.debug("Ignoring voice server update for destroyed player {}", this);
                return;
            }
            voiceState.setToken(token);
            voiceState.setEndpoint(endpoint);
            dispatchVoiceUpdate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Connects with the default timeout, neither deafened nor muted.
     *
     * @see #connect(Duration, boolean, boolean, boolean)
     */
    public void connect() {
        connect(defaultConnectTimeout, false, false, false);
    }

    /**
     * Joins the bound channel and waits until the node accepted the voice session. On the first call
     * the player is registered on its node.
     *
     * @param timeout Maximum time to wait for the node.
     * @param reconnect Whether this is a reconnection attempt. Only used for logging.
     * @param selfDeaf Whether the bot should be deafened.
     * @param selfMute Whether the bot should be muted.
     *
     * @throws InvalidChannelStateException If there is no bound channel or the player was destroyed.
     * @throws ChannelTimeoutException If the node did not accept the session in time. The player stays
     * registered and {@code connect} may be called again.
     */
    public void connect(@Nonnull Duration timeout, boolean reconnect, boolean selfDeaf, boolean selfMute) {
        VoiceChannel target;
        lock.lock();
        try {
            target = channel;
            if(target == null) {
                throw new InvalidChannelStateException("Player tried to connect without a valid channel: " +
                        "create the player with the voice channel it should join");
            }
            if(state == ConnectionState.INVALIDATED) {
                throw new InvalidChannelStateException("Player for guild " + target.guildId() +
                        " was destroyed and cannot be reused");
            }
            if(guildId == null) {
                node.register(target.guildId(), this);
                guildId = target.guildId();
            }
            if(state != ConnectionState.CONNECTED) {
                state = ConnectionState.AWAITING_CONFIRMATION;
            }
            log.info("{} {} on node {}", reconnect ? "Reconnecting to" : "Connecting to", target, node.id());
            client.changeVoiceState(target.guildId(), target.channelId(), selfDeaf, selfMute);
        } finally {
            lock.unlock();
        }

        try {
            connectionSignal.await(timeout);
        } catch(TimeoutException e) {
            onConnectTimeout();
            throw new ChannelTimeoutException(target.channelId(), timeout);
        } catch(InterruptedException e) {
            Thread.currentThread().interrupt();
            onConnectTimeout();
            throw new ChannelTimeoutException(target.channelId(), timeout);
        }
    }

    /**
     * Plays a track with the default options.
     *
     * @see #play(Track, PlayOptions)
     */
    @Nonnull
    public Track play(@Nonnull Track track) {
        return play(track, PlayOptions.defaults());
    }

    /**
     * Plays a track. If the node rejects the request, current, original and previous track and volume
     * are restored before the error is rethrown.
     *
     * @param track Track to play.
     * @param options Replace, start, end, volume and paused settings.
     *
     * @return The track now playing.
     *
     * @throws RemoteSessionException If the node rejected the request.
     * @throws InvalidChannelStateException If the player was destroyed.
     */
    @Nonnull
    public Track play(@Nonnull Track track, @Nonnull PlayOptions options) {
        lock.lock();
        try {
            var gid = requireActive();

            var oldCurrent = current;
            var oldOriginal = original;
            var oldPrevious = previous;
            var oldVolume = volume;

            var vol = options.volume() == null ? volume : clampVolume(options.volume());
            volume = vol;
            if(options.replace() || current == null) {
                current = track;
                original = track;
            }
            previous = oldCurrent;
            var pause = options.paused() == null ? paused : options.paused();

            var update = PlayerUpdate.create()
                    .setTrack(track)
                    .setVolume(vol)
                    .setPosition(options.start())
                    .setEndTime(options.end())
                    .setPaused(pause);
            try {
                RequestUtils.await(node.gateway().updatePlayer(gid, update, options.replace()));
            } catch(RuntimeException e) {
                current = oldCurrent;
                original = oldOriginal;
                previous = oldPrevious;
                volume = oldVolume;
                throw e;
            }
            paused = pause;
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pauses or resumes the player. The local state changes only once the node accepted it.
     *
     * @param value True to pause, false to resume.
     */
    public void pause(boolean value) {
        lock.lock();
        try {
            var gid = requireActive();
            RequestUtils.await(node.gateway().updatePlayer(gid, PlayerUpdate.create().setPaused(value), false));
            paused = value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seeks to the start of the current track.
     */
    public void seek() {
        seek(0);
    }

    /**
     * Seeks the current track. Does nothing if no track is playing.
     *
     * @param position Position in milliseconds.
     *
     * @throws IllegalArgumentException If the position is negative.
     */
    public void seek(@Nonnegative long position) {
        if(position < 0) {
            throw new IllegalArgumentException("Position must not be negative");
        }
        lock.lock();
        try {
            var gid = requireActive();
            if(current == null) {
                return;
            }
            RequestUtils.await(node.gateway().updatePlayer(gid, PlayerUpdate.create().setPosition(position), false));
            this.position = position;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets the volume to {@value #DEFAULT_VOLUME}.
     */
    public void setVolume() {
        setVolume(DEFAULT_VOLUME);
    }

    /**
     * Sets the volume. Values outside [0, 1000] are clamped.
     *
     * @param value Volume, as a percentage.
     */
    public void setVolume(int value) {
        lock.lock();
        try {
            var gid = requireActive();
            var vol = clampVolume(value);
            RequestUtils.await(node.gateway().updatePlayer(gid, PlayerUpdate.create().setVolume(vol), false));
            volume = vol;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Equivalent to {@code skip(true)}.
     */
    @Nullable
    public Track skip() {
        return skip(true);
    }

    /**
     * Stops the current track. The node reports the end of the track through a track end event.
     *
     * @param force Whether looping should be bypassed. Players don't loop, so this has no effect here.
     *
     * @return The track that was playing, or null.
     */
    @Nullable
    public Track skip(boolean force) {
        lock.lock();
        try {
            var gid = requireActive();
            var old = current;
            RequestUtils.await(node.gateway().updatePlayer(gid, PlayerUpdate.create().setTrack(null), true));
            return old;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Alias of {@link #skip()}.
     */
    @Nullable
    public Track stop() {
        return skip();
    }

    /**
     * Alias of {@link #skip(boolean)}.
     */
    @Nullable
    public Track stop(boolean force) {
        return skip(force);
    }

    public void setFilter() {
        throw new UnsupportedOperationException("Filters are not supported yet");
    }

    /**
     * Leaves the voice channel and destroys the player on the node. The player must not be used
     * afterwards. Errors while destroying the remote player are logged and ignored.
     */
    public void disconnect() {
        lock.lock();
        try {
            var gid = requireGuild();
            log.info("Disconnecting player {}", this);
            destroy();
            client.changeVoiceState(gid, null, false, false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a player state update sent by the node.
     *
     * @param state State object of the update.
     */
    public void onPlayerUpdate(@Nonnull JsonObject state) {
        position = state.getLong("position", position);
    }

    /**
     * Clears the current track when the node reports it ended, unless it was replaced.
     *
     * @param track Track that ended.
     * @param reason End reason sent by the node.
     */
    public void onTrackEnd(@Nonnull Track track, @Nonnull String reason) {
        lock.lock();
        try {
            if(!"replaced".equalsIgnoreCase(reason) && track.equals(current)) {
                current = null;
            }
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void dispatchVoiceUpdate() {
        var gid = guildId;
        if(gid == null) {
            log.debug("Not dispatching voice update for unregistered player {}", this);
            return;
        }
        if(!voiceState.isComplete()) {
            return;
        }
        var snapshot = voiceState.snapshot();
        if(snapshot.equals(lastDispatched)) {
            log.debug("Voice session for guild {} was already dispatched", gid);
            return;
        }
        log.debug("Player {} is dispatching voice update {}", gid, snapshot);
        try {
            RequestUtils.await(node.gateway().updatePlayer(gid, PlayerUpdate.voice(snapshot), false));
        } catch(RemoteSessionException e) {
            log.warn("Node {} rejected the voice session for guild {}, disconnecting", node.id(), gid, e);
            disconnect();
            return;
        }
        lastDispatched = snapshot;
        state = ConnectionState.CONNECTED;
        connectionSignal.raise();
    }

    private void onConnectTimeout() {
        lock.lock();
        try {
            if(state == ConnectionState.AWAITING_CONFIRMATION) {
                state = ConnectionState.DISCONNECTED;
            }
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void destroy() {
        invalidate();
        var gid = guildId;
        if(gid == null || !node.deregister(gid, this)) {
            return;
        }
        try {
            RequestUtils.await(node.gateway().destroyPlayer(gid));
        } catch(RemoteSessionException e) {
            log.warn("Unable to destroy player for guild {} on node {}", gid, node.id(), e);
        }
    }

    @GuardedBy("lock")
    private void invalidate() {
        connected = false;
        connectionSignal.reset();
        lastDispatched = null;
        state = ConnectionState.INVALIDATED;
        var gid = resolveGuildId();
        if(gid != null && !client.cleanup(gid)) {
            log.debug("No voice state to clean up for guild {}", gid);
        }
    }

    @Nullable
    private String resolveGuildId() {
        var gid = guildId;
        if(gid != null) {
            return gid;
        }
        var c = channel;
        return c == null ? null : c.guildId();
    }

    @Nonnull
    private String requireGuild() {
        var gid = guildId;
        if(gid == null) {
            throw new IllegalStateException("Player is not registered to a guild, connect it first");
        }
        return gid;
    }

    @Nonnull
    @GuardedBy("lock")
    private String requireActive() {
        var gid = requireGuild();
        if(state == ConnectionState.INVALIDATED) {
            throw new InvalidChannelStateException("Player for guild " + gid + " was destroyed and cannot be reused");
        }
        return gid;
    }

    @CheckReturnValue
    static int clampVolume(int value) {
        return Math.max(MIN_VOLUME, Math.min(value, MAX_VOLUME));
    }

    @Override
    public String toString() {
        return "Player(" + channel + ", " + state + ")";
    }
}
