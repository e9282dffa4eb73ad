package basalt.node;

import basalt.error.InvalidChannelStateException;
import basalt.event.EventDispatcherImpl;
import basalt.player.Player;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * A remote audio node. Owns the registry of players assigned to it, keyed by guild id,
 * and the gateway used to control them.
 */
public class Node {
    private static final Logger log = LoggerFactory.getLogger(Node.class);

    private final Map<String, Player> players = new ConcurrentHashMap<>();
    private final String id;
    private final EventDispatcherImpl dispatcher;
    private volatile SessionGateway gateway;
    private volatile NodeWebSocket webSocket;
    private volatile String sessionId;
    private volatile JsonObject stats = new JsonObject();

    public Node(@Nonnull String id, @Nonnull SessionGateway gateway, @Nonnull EventDispatcherImpl dispatcher) {
        this.id = id;
        this.gateway = gateway;
        this.dispatcher = dispatcher;
    }

    private Node(@Nonnull String id, @Nonnull EventDispatcherImpl dispatcher) {
        this.id = id;
        this.dispatcher = dispatcher;
    }

    /**
     * Creates a node talking to a remote server over HTTP and opens its websocket.
     * Requests fail until the node sent its session id.
     *
     * @param vertx Vertx instance used for the connections.
     * @param options Address of the node.
     * @param userId Id of the bot user.
     * @param clientName Name sent to the node.
     * @param dispatcher Dispatcher receiving player and track events.
     * @param eventExecutor Executor running websocket payload handling, must be single threaded.
     *
     * @return The node.
     */
    @Nonnull
    public static Node connect(@Nonnull Vertx vertx, @Nonnull NodeOptions options, @Nonnull String userId,
                               @Nonnull String clientName, @Nonnull EventDispatcherImpl dispatcher,
                               @Nonnull Executor eventExecutor) {
        var node = new Node(options.id(), dispatcher);
        var webClient = WebClient.create(vertx, new WebClientOptions().setUserAgent(clientName));
        node.gateway = new RestSessionGateway(webClient, options, node::sessionId);
        node.webSocket = new NodeWebSocket(vertx, node, options, userId, clientName, eventExecutor);
        node.webSocket.open();
        return node;
    }

    @Nonnull
    @CheckReturnValue
    public String id() {
        return id;
    }

    @Nonnull
    @CheckReturnValue
    public SessionGateway gateway() {
        return gateway;
    }

    @Nonnull
    @CheckReturnValue
    public EventDispatcherImpl dispatcher() {
        return dispatcher;
    }

    /**
     * Session id sent by the node when its websocket became ready.
     *
     * @return The session id, or null if the node isn't ready yet.
     */
    @Nullable
    @CheckReturnValue
    public String sessionId() {
        return sessionId;
    }

    /**
     * @return Last stats payload sent by the node.
     */
    @Nonnull
    @CheckReturnValue
    public JsonObject stats() {
        return stats.copy();
    }

    /**
     * @return Map of guild id to player. Thread safe, updated as players register and deregister.
     */
    @Nonnull
    @CheckReturnValue
    public Map<String, Player> players() {
        return Collections.unmodifiableMap(players);
    }

    @CheckReturnValue
    public int playerCount() {
        return players.size();
    }

    @Nullable
    @CheckReturnValue
    public Player getPlayer(@Nonnull String guildId) {
        return players.get(guildId);
    }

    /**
     * Registers a player for a guild. Registering the same player twice is a no-op.
     *
     * @param guildId Guild of the player.
     * @param player Player to register.
     *
     * @throws InvalidChannelStateException If another player is already registered for the guild.
     */
    public void register(@Nonnull String guildId, @Nonnull Player player) {
        var existing = players.putIfAbsent(guildId, player);
        if(existing == null) {
            log.info("Registered player for guild {} on node {}", guildId, id);
            dispatcher.onPlayerRegistered(id, player);
        } else if(existing != player) {
            throw new InvalidChannelStateException("Guild " + guildId + " already has a player on node " + id);
        }
    }

    /**
     * Removes a player, if it's still the one registered for the guild.
     *
     * @param guildId Guild of the player.
     * @param player Player to remove.
     *
     * @return True if the player was removed, false if there was nothing to remove.
     */
    public boolean deregister(@Nonnull String guildId, @Nonnull Player player) {
        if(players.remove(guildId, player)) {
            log.info("Removed player for guild {} from node {}", guildId, id);
            dispatcher.onPlayerDestroyed(id, player);
            return true;
        }
        return false;
    }

    void onReady(@Nonnull String sessionId, boolean resumed) {
        log.info("Node {} is ready with session {} (resumed: {})", id, sessionId, resumed);
        this.sessionId = sessionId;
        dispatcher.onNodeReady(id, sessionId, resumed);
    }

    void onStats(@Nonnull JsonObject stats) {
        this.stats = stats;
    }

    void onDisconnected() {
        this.sessionId = null;
    }

    /**
     * Closes the websocket, if this node opened one. Players are left registered.
     */
    public void close() {
        var ws = webSocket;
        if(ws != null) {
            ws.close();
        }
    }

    @Override
    public String toString() {
        return "Node(" + id + ", " + players.size() + " players)";
    }
}
