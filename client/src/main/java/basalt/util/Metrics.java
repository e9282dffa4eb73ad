package basalt.util;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

public final class Metrics {
    public static final Gauge PLAYERS = Gauge.build()
            .namespace("basalt")
            .name("players")
            .help("Number of players registered on nodes at a given point")
            .labelNames("node")
            .register();

    public static final Counter REMOTE_REQUESTS = Counter.build()
            .namespace("basalt")
            .name("remote_requests_total")
            .help("Requests sent to nodes, by operation and result")
            .labelNames("operation", "result")
            .register();

    private Metrics() {}
}
