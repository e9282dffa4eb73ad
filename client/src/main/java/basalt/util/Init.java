package basalt.util;

import basalt.event.EventDispatcher;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.typesafe.config.Config;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

public class Init {
    /**
     * Applies logging and error reporting settings. Must run before any node is created.
     *
     * @param config The {@code basalt} config block.
     */
    public static void preInit(@Nonnull Config config) {
        ((Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(
                Level.valueOf(config.getString("log-level").toUpperCase())
        );
        if(config.getBoolean("prometheus.enabled")) {
            PrometheusUtils.setup();
        }
        if(config.getBoolean("sentry.enabled")) {
            SentryUtils.setup(config);
        }
    }

    public static void postInit(@Nonnull Config config, @Nonnull EventDispatcher dispatcher) {
        if(config.getBoolean("prometheus.enabled")) {
            PrometheusUtils.configureMetrics(dispatcher);
        }
        if(config.getBoolean("sentry.enabled")) {
            SentryUtils.configureWarns(dispatcher);
        }
    }
}
