package basalt.util;

import basalt.Version;
import basalt.event.BasaltEventListener;
import basalt.event.EventDispatcher;
import basalt.player.BasaltPlayer;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import com.typesafe.config.Config;
import io.sentry.Sentry;
import io.sentry.SentryClient;
import io.sentry.event.Event;
import io.sentry.event.EventBuilder;
import io.sentry.logback.SentryAppender;
import io.sentry.util.Util;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

class SentryUtils {
    private static final String SENTRY_APPENDER_NAME = "SENTRY";
    private static SentryClient client;

    static void setup(Config config) {
        var client = Sentry.init(config.getString("sentry.dsn"));
        client.setRelease(Version.VERSION);
        var tags = config.getString("sentry.tags");
        if(!tags.isEmpty()) {
            client.setTags(Util.parseTags(tags));
        }
        SentryUtils.client = client;
        var loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        var root = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);

        var sentryAppender = (SentryAppender) root.getAppender(SENTRY_APPENDER_NAME);
        if(sentryAppender == null) {
            sentryAppender = new SentryAppender();
            sentryAppender.setName(SENTRY_APPENDER_NAME);

            var warningsOrAboveFilter = new ThresholdFilter();
            warningsOrAboveFilter.setLevel(config.getString("sentry.log-level").toUpperCase());
            warningsOrAboveFilter.start();
            sentryAppender.addFilter(warningsOrAboveFilter);

            sentryAppender.setContext(loggerContext);
            sentryAppender.start();
            root.addAppender(sentryAppender);
        }
    }

    static void configureWarns(@Nonnull EventDispatcher dispatcher) {
        dispatcher.register(new BasaltEventListener() {
            @Override
            public void onWebSocketClosed(@Nonnull BasaltPlayer player, int closeCode,
                                          @Nullable String reason, boolean byRemote) {
                client.sendEvent(new EventBuilder()
                        .withLevel(byRemote ? Event.Level.WARNING : Event.Level.INFO)
                        .withMessage(byRemote ? "Voice websocket closed by server" : "Voice websocket closed by client")
                        .withExtra("code", closeCode)
                        .withExtra("reason", reason)
                        .withExtra("guild", player.guildId())
                );
            }
        });
    }
}
