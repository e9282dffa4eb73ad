package basalt.util;

import basalt.event.BasaltEventListener;
import basalt.event.EventDispatcher;
import basalt.player.BasaltPlayer;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.prometheus.client.hotspot.DefaultExports;
import io.prometheus.client.logback.InstrumentedAppender;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

class PrometheusUtils {
    static void setup() {
        var prometheusAppender = new InstrumentedAppender();

        var factory = (LoggerContext) LoggerFactory.getILoggerFactory();
        var root = factory.getLogger(Logger.ROOT_LOGGER_NAME);
        prometheusAppender.setContext(root.getLoggerContext());
        prometheusAppender.start();
        root.addAppender(prometheusAppender);

        DefaultExports.initialize();
    }

    static void configureMetrics(@Nonnull EventDispatcher dispatcher) {
        dispatcher.register(new BasaltEventListener() {
            @Override
            public void onPlayerRegistered(@Nonnull String nodeId, @Nonnull BasaltPlayer player) {
                Metrics.PLAYERS.labels(nodeId).inc();
            }

            @Override
            public void onPlayerDestroyed(@Nonnull String nodeId, @Nonnull BasaltPlayer player) {
                Metrics.PLAYERS.labels(nodeId).dec();
            }
        });
    }
}
