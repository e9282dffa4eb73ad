package basalt;

import basalt.event.EventDispatcher;
import basalt.event.EventDispatcherImpl;
import basalt.node.Node;
import basalt.node.NodeOptions;
import basalt.node.NodePool;
import basalt.player.Player;
import basalt.util.ConfigUtil;
import basalt.util.Init;
import basalt.voice.VoiceChannel;
import basalt.voice.VoiceSessionClient;
import com.typesafe.config.Config;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point: connects to the configured nodes and creates players.
 */
public class Basalt implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Basalt.class);

    private final List<ExecutorService> executors = new CopyOnWriteArrayList<>();
    private final EventDispatcherImpl dispatcher = new EventDispatcherImpl();
    private final Vertx vertx;
    private final boolean ownsVertx;
    private final Config config;
    private final VoiceSessionClient client;
    private final NodePool pool;

    private Basalt(@Nonnull Vertx vertx, boolean ownsVertx, @Nonnull Config rootConfig,
                   @Nonnull VoiceSessionClient client) {
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.config = rootConfig.getConfig("basalt");
        this.client = client;
        this.pool = new NodePool(config.getDuration("player.connect-timeout"));
    }

    /**
     * Loads the configuration from {@code application.conf}, system properties, environment and defaults,
     * and connects to every configured node.
     *
     * @param client Voice gateway connection of the bot.
     *
     * @return The new instance.
     */
    @Nonnull
    public static Basalt create(@Nonnull VoiceSessionClient client) {
        return create(null, ConfigUtil.load(), client);
    }

    /**
     * @param vertx Vertx instance to use, or null to create one that is closed with this instance.
     * @param rootConfig Configuration containing a {@code basalt} block.
     * @param client Voice gateway connection of the bot.
     *
     * @return The new instance.
     */
    @Nonnull
    public static Basalt create(@Nullable Vertx vertx, @Nonnull Config rootConfig, @Nonnull VoiceSessionClient client) {
        Init.preInit(rootConfig.getConfig("basalt"));
        log.info("Starting basalt version {}, commit {}", Version.VERSION, Version.COMMIT);
        var basalt = new Basalt(vertx == null ? Vertx.vertx() : vertx, vertx == null, rootConfig, client);
        Init.postInit(basalt.config, basalt.dispatcher);
        for(var nodeConfig : basalt.config.getConfigList("nodes")) {
            basalt.addNode(NodeOptions.fromConfig(nodeConfig));
        }
        if(basalt.pool.nodes().isEmpty()) {
            log.warn("No nodes configured, add them with addNode before creating players");
        }
        return basalt;
    }

    /**
     * Connects to a node and adds it to the pool.
     *
     * @param options Address of the node.
     *
     * @return The node.
     */
    @Nonnull
    public Node addNode(@Nonnull NodeOptions options) {
        var executor = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "Basalt-Node-" + options.id());
            t.setDaemon(true);
            return t;
        });
        executors.add(executor);
        var clientName = config.getString("client-name") + "/" + Version.VERSION;
        var node = Node.connect(vertx, options, client.userId(), clientName, dispatcher, executor);
        pool.add(node);
        return node;
    }

    /**
     * Creates a player for a channel on the least loaded node.
     *
     * @param channel Channel the player should join.
     *
     * @return The player. Call {@link Player#connect()} to join.
     */
    @Nonnull
    @CheckReturnValue
    public Player createPlayer(@Nonnull VoiceChannel channel) {
        return pool.createPlayer(client, channel);
    }

    /**
     * Player of a guild, for forwarding voice gateway events.
     *
     * @param guildId Guild id.
     *
     * @return The player, or null.
     */
    @Nullable
    @CheckReturnValue
    public Player getPlayer(@Nonnull String guildId) {
        return pool.getPlayer(guildId);
    }

    @Nonnull
    @CheckReturnValue
    public NodePool pool() {
        return pool;
    }

    @Nonnull
    @CheckReturnValue
    public EventDispatcher dispatcher() {
        return dispatcher;
    }

    @Nonnull
    @CheckReturnValue
    public Config config() {
        return config;
    }

    @Override
    public void close() {
        pool.close();
        executors.forEach(ExecutorService::shutdown);
        if(ownsVertx) {
            vertx.close();
        }
    }
}
