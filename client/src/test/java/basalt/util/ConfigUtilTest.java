package basalt.util;

import basalt.node.NodeOptions;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigUtilTest {
    @Test
    void defaultsAreLoaded() {
        var config = ConfigUtil.load().getConfig("basalt");

        assertThat(config.getDuration("player.connect-timeout")).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getString("client-name")).isEqualTo("basalt");
        assertThat(config.getConfigList("nodes")).isEmpty();
        assertThat(config.getBoolean("prometheus.enabled")).isFalse();
        assertThat(config.getBoolean("sentry.enabled")).isFalse();
        assertThat(config.hasPath("version.string")).isTrue();
    }

    @Test
    void nodeOptionsFromConfig() {
        var options = NodeOptions.fromConfig(ConfigFactory.parseString(
                "id = main, host = localhost, port = 2333, password = youshallnotpass"));

        assertThat(options.id()).isEqualTo("main");
        assertThat(options.port()).isEqualTo(2333);
        assertThat(options.secure()).isFalse();
        assertThat(options.reconnectDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.toString()).doesNotContain("youshallnotpass");
    }

    @Test
    void nodeOptionsOverrides() {
        var options = NodeOptions.fromConfig(ConfigFactory.parseString(
                "id = eu, host = node.example.com, port = 443, secure = true, password = pw, reconnect-delay = 250ms"));

        assertThat(options.secure()).isTrue();
        assertThat(options.reconnectDelay()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void invalidNodeOptionsAreRejected() {
        assertThatThrownBy(() -> NodeOptions.fromConfig(ConfigFactory.parseString("id = main, host = localhost")))
                .isInstanceOf(ConfigException.Missing.class);
        assertThatThrownBy(() -> NodeOptions.fromConfig(ConfigFactory.parseString(
                "id = main, host = localhost, port = 0, password = pw")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
