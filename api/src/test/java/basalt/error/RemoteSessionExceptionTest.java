package basalt.error;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteSessionExceptionTest {
    @Test
    void readsErrorBody() {
        var e = RemoteSessionException.fromResponse(404, new JsonObject()
                .put("status", 404)
                .put("error", "Not Found")
                .put("message", "Session not found")
                .put("path", "/v4/sessions/abc/players/1"));

        assertThat(e.status()).isEqualTo(404);
        assertThat(e.error()).isEqualTo("Not Found");
        assertThat(e.getMessage()).isEqualTo("Session not found");
        assertThat(e.path()).isEqualTo("/v4/sessions/abc/players/1");
    }

    @Test
    void missingBodyUsesStatus() {
        var e = RemoteSessionException.fromResponse(502, null);

        assertThat(e.status()).isEqualTo(502);
        assertThat(e.getMessage()).contains("502");
        assertThat(e.error()).isNull();
    }

    @Test
    void timeoutMessageNamesChannelAndSeconds() {
        var e = new ChannelTimeoutException("123", Duration.ofMillis(2500));

        assertThat(e.getMessage()).isEqualTo("Unable to connect to channel 123 as it exceeded the timeout of 2.5 seconds");
        assertThat(e.channelId()).isEqualTo("123");
        assertThat(e).isInstanceOf(BasaltException.class);
    }
}
