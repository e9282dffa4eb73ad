package basalt.node;

import basalt.event.BasaltEventListener;
import basalt.event.EventDispatcherImpl;
import basalt.player.BasaltPlayer;
import basalt.player.Player;
import basalt.player.Track;
import basalt.voice.VoiceChannel;
import basalt.voice.VoiceSessionClient;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NodeWebSocketTest {
    private final List<String> events = new ArrayList<>();
    private Node node;
    private Player player;
    private HttpClient httpClient;
    private NodeWebSocket webSocket;

    @BeforeEach
    void setUp() {
        var dispatcher = new EventDispatcherImpl();
        dispatcher.register(new BasaltEventListener() {
            @Override
            public void onNodeReady(String nodeId, String sessionId, boolean resumed) {
                events.add("ready:" + sessionId);
            }

            @Override
            public void onTrackStart(BasaltPlayer player, Track track) {
                events.add("start:" + track.encoded());
            }

            @Override
            public void onTrackEnd(BasaltPlayer player, Track track, String reason) {
                events.add("end:" + track.encoded() + ":" + reason);
            }

            @Override
            public void onTrackException(BasaltPlayer player, Track track, JsonObject exception) {
                events.add("exception:" + exception.getString("message"));
            }

            @Override
            public void onTrackStuck(BasaltPlayer player, Track track, long thresholdMs) {
                events.add("stuck:" + thresholdMs);
            }

            @Override
            public void onWebSocketClosed(BasaltPlayer player, int closeCode, String reason, boolean byRemote) {
                events.add("closed:" + closeCode + ":" + byRemote);
            }
        });
        node = new Node("main", mock(SessionGateway.class), dispatcher);
        player = new Player(mock(VoiceSessionClient.class), new VoiceChannel("1", "10"), node);
        node.register("1", player);
        var options = new NodeOptions("main", "localhost", 2333, false, "pw", Duration.ofSeconds(1));
        var vertx = mock(Vertx.class);
        httpClient = mock(HttpClient.class);
        when(vertx.createHttpClient()).thenReturn(httpClient);
        webSocket = new NodeWebSocket(vertx, node, options, "42", "basalt/test", Runnable::run);
    }

    @Test
    void readyStoresSessionId() {
        webSocket.handle(new JsonObject().put("op", "ready").put("sessionId", "abc").put("resumed", false));

        assertThat(node.sessionId()).isEqualTo("abc");
        assertThat(events).containsExactly("ready:abc");
    }

    @Test
    void readyWithoutSessionIdIsIgnored() {
        webSocket.handle(new JsonObject().put("op", "ready"));

        assertThat(node.sessionId()).isNull();
        assertThat(events).isEmpty();
    }

    @Test
    void statsAreStored() {
        webSocket.handle(new JsonObject().put("op", "stats").put("players", 7));

        assertThat(node.stats().getInteger("players")).isEqualTo(7);
    }

    @Test
    void playerUpdateIsForwarded() {
        webSocket.handle(new JsonObject()
                .put("op", "playerUpdate")
                .put("guildId", "1")
                .put("state", new JsonObject().put("position", 1500L)));

        assertThat(player.position()).isEqualTo(1500L);
    }

    @Test
    void trackEventsAreDispatched() {
        webSocket.handle(event("TrackStartEvent"));
        webSocket.handle(event("TrackExceptionEvent")
                .put("exception", new JsonObject().put("message", "broken")));
        webSocket.handle(event("TrackStuckEvent").put("thresholdMs", 10000L));
        webSocket.handle(event("TrackEndEvent").put("reason", "finished"));
        webSocket.handle(new JsonObject()
                .put("op", "event")
                .put("type", "WebSocketClosedEvent")
                .put("guildId", "1")
                .put("code", 4006)
                .put("byRemote", true));

        assertThat(events).containsExactly(
                "start:QUFB",
                "exception:broken",
                "stuck:10000",
                "end:QUFB:finished",
                "closed:4006:true"
        );
    }

    @Test
    void eventsForUnknownGuildsAreIgnored() {
        webSocket.handle(event("TrackStartEvent").put("guildId", "2"));
        webSocket.handle(new JsonObject().put("op", "unknown"));
        webSocket.handle(new JsonObject().put("sessionId", "abc"));

        assertThat(events).isEmpty();
    }

    @Test
    void closeReleasesHttpClient() {
        webSocket.close();

        verify(httpClient).close();
    }

    private static JsonObject event(String type) {
        return new JsonObject()
                .put("op", "event")
                .put("type", type)
                .put("guildId", "1")
                .put("track", new JsonObject().put("encoded", "QUFB").put("info", new JsonObject()));
    }
}
