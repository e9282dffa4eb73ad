package basalt.node;

import basalt.error.InvalidChannelStateException;
import basalt.event.BasaltEventListener;
import basalt.event.EventDispatcherImpl;
import basalt.player.BasaltPlayer;
import basalt.player.Player;
import basalt.voice.VoiceChannel;
import basalt.voice.VoiceSessionClient;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class NodeTest {
    @Mock
    private VoiceSessionClient client;
    @Mock
    private SessionGateway gateway;

    private final List<String> events = new ArrayList<>();
    private Node node;

    @BeforeEach
    void setUp() {
        var dispatcher = new EventDispatcherImpl();
        dispatcher.register(new BasaltEventListener() {
            @Override
            public void onPlayerRegistered(String nodeId, BasaltPlayer player) {
                events.add("registered:" + nodeId);
            }

            @Override
            public void onPlayerDestroyed(String nodeId, BasaltPlayer player) {
                events.add("destroyed:" + nodeId);
            }

            @Override
            public void onNodeReady(String nodeId, String sessionId, boolean resumed) {
                events.add("ready:" + sessionId + ":" + resumed);
            }
        });
        node = new Node("main", gateway, dispatcher);
    }

    @Test
    void registerIsIdempotentForSamePlayer() {
        var player = player("1");

        node.register("1", player);
        node.register("1", player);

        assertThat(node.playerCount()).isEqualTo(1);
        assertThat(node.getPlayer("1")).isSameAs(player);
        assertThat(events).containsExactly("registered:main");
    }

    @Test
    void registerRejectsSecondPlayerForGuild() {
        var first = player("1");
        node.register("1", first);

        assertThatThrownBy(() -> node.register("1", player("1")))
                .isInstanceOf(InvalidChannelStateException.class)
                .hasMessageContaining("main");
        assertThat(node.getPlayer("1")).isSameAs(first);
    }

    @Test
    void deregisterOnlyRemovesRegisteredPlayer() {
        var player = player("1");
        node.register("1", player);

        assertThat(node.deregister("1", player("1"))).isFalse();
        assertThat(node.deregister("1", player)).isTrue();
        assertThat(node.deregister("1", player)).isFalse();

        assertThat(node.players()).isEmpty();
        assertThat(events).containsExactly("registered:main", "destroyed:main");
    }

    @Test
    void playersViewIsReadOnly() {
        node.register("1", player("1"));

        assertThatThrownBy(() -> node.players().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void readyStoresSessionUntilDisconnected() {
        assertThat(node.sessionId()).isNull();

        node.onReady("abc", true);
        assertThat(node.sessionId()).isEqualTo("abc");
        assertThat(events).containsExactly("ready:abc:true");

        node.onDisconnected();
        assertThat(node.sessionId()).isNull();
    }

    @Test
    void statsAreCopied() {
        node.onStats(new JsonObject().put("players", 3));

        var stats = node.stats();
        stats.put("players", 4);

        assertThat(node.stats().getInteger("players")).isEqualTo(3);
    }

    private Player player(String guildId) {
        return new Player(client, new VoiceChannel(guildId, "10"), node);
    }
}
