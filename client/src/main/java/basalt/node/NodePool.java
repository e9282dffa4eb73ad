package basalt.node;

import basalt.player.Player;
import basalt.voice.VoiceChannel;
import basalt.voice.VoiceSessionClient;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Set of nodes players can be assigned to.
 */
public class NodePool {
    private final List<Node> nodes = new CopyOnWriteArrayList<>();
    private final Duration connectTimeout;

    public NodePool(@Nonnull Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public void add(@Nonnull Node node) {
        if(get(node.id()) != null) {
            throw new IllegalArgumentException("Node " + node.id() + " is already in the pool");
        }
        nodes.add(node);
    }

    @Nullable
    public Node remove(@Nonnull String id) {
        var node = get(id);
        if(node != null) {
            nodes.remove(node);
        }
        return node;
    }

    @Nullable
    @CheckReturnValue
    public Node get(@Nonnull String id) {
        for(var node : nodes) {
            if(node.id().equals(id)) {
                return node;
            }
        }
        return null;
    }

    @Nonnull
    @CheckReturnValue
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Node with the fewest registered players. Ties go to the node added first.
     *
     * @return The least loaded node.
     *
     * @throws IllegalStateException If the pool is empty.
     */
    @Nonnull
    @CheckReturnValue
    public Node leastLoaded() {
        return nodes.stream()
                .min(Comparator.comparingInt(Node::playerCount))
                .orElseThrow(() -> new IllegalStateException("No nodes available"));
    }

    /**
     * Player registered for a guild on any node.
     *
     * @param guildId Guild of the player.
     *
     * @return The player, or null if there is none.
     */
    @Nullable
    @CheckReturnValue
    public Player getPlayer(@Nonnull String guildId) {
        for(var node : nodes) {
            var player = node.getPlayer(guildId);
            if(player != null) {
                return player;
            }
        }
        return null;
    }

    /**
     * Creates a player for a channel, assigned to the least loaded node. The player is
     * registered on its first {@link Player#connect() connect}.
     */
    @Nonnull
    @CheckReturnValue
    public Player createPlayer(@Nonnull VoiceSessionClient client, @Nonnull VoiceChannel channel) {
        return createPlayer(client, channel, leastLoaded());
    }

    @Nonnull
    @CheckReturnValue
    public Player createPlayer(@Nonnull VoiceSessionClient client, @Nonnull VoiceChannel channel, @Nonnull Node node) {
        return new Player(client, channel, node, connectTimeout);
    }

    public void close() {
        nodes.forEach(Node::close);
    }
}
