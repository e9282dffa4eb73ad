package basalt.node;

import basalt.player.Track;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.concurrent.Executor;

/**
 * Websocket connection to a node. Receives the session id, player state updates, stats and
 * track events, and reconnects when closed by the node.
 */
class NodeWebSocket {
    private static final Logger log = LoggerFactory.getLogger(NodeWebSocket.class);

    private final Vertx vertx;
    private final HttpClient httpClient;
    private final Node node;
    private final NodeOptions options;
    private final String userId;
    private final String clientName;
    private final Executor executor;
    private volatile WebSocket ws;
    private volatile boolean closed;

    NodeWebSocket(@Nonnull Vertx vertx, @Nonnull Node node, @Nonnull NodeOptions options,
                  @Nonnull String userId, @Nonnull String clientName, @Nonnull Executor executor) {
        this.vertx = vertx;
        this.httpClient = vertx.createHttpClient();
        this.node = node;
        this.options = options;
        this.userId = userId;
        this.clientName = clientName;
        this.executor = executor;
    }

    void open() {
        var connectOptions = new WebSocketConnectOptions()
                .setHost(options.host())
                .setPort(options.port())
                .setSsl(options.secure())
                .setURI("/v4/websocket")
                .addHeader("Authorization", options.password())
                .addHeader("User-Id", userId)
                .addHeader("Client-Name", clientName);
        log.info("Connecting to node {}", options);
        httpClient.webSocket(connectOptions).onComplete(ar -> {
            if(ar.failed()) {
                log.warn("Unable to connect to node {}", options.id(), ar.cause());
                scheduleReconnect();
                return;
            }
            var socket = ar.result();
            if(closed) {
                socket.close();
                return;
            }
            ws = socket;
            socket.textMessageHandler(text -> {
                JsonObject payload;
                try {
                    payload = new JsonObject(text);
                } catch(Exception e) {
                    log.warn("Unable to read payload from node {} as json", options.id(), e);
                    return;
                }
                executor.execute(() -> {
                    try {
                        handle(payload);
                    } catch(RuntimeException e) {
                        log.error("Error handling payload {} from node {}", payload, options.id(), e);
                    }
                });
            });
            socket.closeHandler(__ -> {
                log.warn("Websocket of node {} closed with code {} and reason {}",
                        options.id(), socket.closeStatusCode(), socket.closeReason());
                node.onDisconnected();
                ws = null;
                scheduleReconnect();
            });
        });
    }

    void close() {
        closed = true;
        var socket = ws;
        if(socket != null) {
            socket.close();
        }
        httpClient.close();
    }

    void handle(@Nonnull JsonObject payload) {
        log.debug("Received payload {} from node {}", payload, node.id());
        var op = payload.getString("op");
        if(op == null) {
            log.warn("Node {} sent a payload without op: {}", node.id(), payload);
            return;
        }
        switch(op) {
            case "ready": {
                var sessionId = payload.getString("sessionId");
                if(sessionId == null) {
                    log.warn("Node {} sent a ready payload without session id", node.id());
                    return;
                }
                node.onReady(sessionId, payload.getBoolean("resumed", false));
                break;
            }
            case "stats": {
                node.onStats(payload);
                break;
            }
            case "playerUpdate": {
                var player = node.getPlayer(payload.getString("guildId", ""));
                if(player != null) {
                    player.onPlayerUpdate(payload.getJsonObject("state", new JsonObject()));
                }
                break;
            }
            case "event": {
                handleEvent(payload);
                break;
            }
            default:
                log.debug("Ignoring unknown op {} from node {}", op, node.id());
        }
    }

    private void handleEvent(@Nonnull JsonObject payload) {
        var guildId = payload.getString("guildId", "");
        var player = node.getPlayer(guildId);
        if(player == null) {
            log.debug("Received event for guild {} without a player on node {}", guildId, node.id());
            return;
        }
        var type = payload.getString("type", "");
        var dispatcher = node.dispatcher();
        switch(type) {
            case "TrackStartEvent": {
                dispatcher.onTrackStart(player, Track.fromJson(payload.getJsonObject("track")));
                break;
            }
            case "TrackEndEvent": {
                var track = Track.fromJson(payload.getJsonObject("track"));
                var reason = payload.getString("reason", "finished");
                player.onTrackEnd(track, reason);
                dispatcher.onTrackEnd(player, track, reason);
                break;
            }
            case "TrackExceptionEvent": {
                dispatcher.onTrackException(player, Track.fromJson(payload.getJsonObject("track")),
                        payload.getJsonObject("exception", new JsonObject()));
                break;
            }
            case "TrackStuckEvent": {
                dispatcher.onTrackStuck(player, Track.fromJson(payload.getJsonObject("track")),
                        payload.getLong("thresholdMs", 0L));
                break;
            }
            case "WebSocketClosedEvent": {
                dispatcher.onWebSocketClosed(player, payload.getInteger("code", -1),
                        payload.getString("reason"), payload.getBoolean("byRemote", false));
                break;
            }
            default:
                log.debug("Ignoring unknown event type {} from node {}", type, node.id());
        }
    }

    private void scheduleReconnect() {
        if(closed) {
            return;
        }
        log.info("Reconnecting to node {} in {}", options.id(), options.reconnectDelay());
        vertx.setTimer(Math.max(1, options.reconnectDelay().toMillis()), __ -> {
            if(!closed) {
                open();
            }
        });
    }
}
