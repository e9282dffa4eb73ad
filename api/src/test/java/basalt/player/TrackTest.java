package basalt.player;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackTest {
    @Test
    void readsNodeJson() {
        var track = Track.fromJson(new JsonObject()
                .put("encoded", "QUFB")
                .put("info", new JsonObject().put("title", "Song").put("identifier", "abc").put("length", 1000L)));

        assertThat(track.encoded()).isEqualTo("QUFB");
        assertThat(track.title()).isEqualTo("Song");
        assertThat(track.identifier()).isEqualTo("abc");
        assertThat(track.length()).isEqualTo(1000L);
        assertThat(track.toString()).contains("Song");
    }

    @Test
    void missingEncodedIsRejected() {
        assertThatThrownBy(() -> Track.fromJson(new JsonObject().put("info", new JsonObject())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityUsesEncodedOnly() {
        assertThat(new Track("QUFB", new JsonObject().put("title", "a")))
                .isEqualTo(new Track("QUFB"))
                .isNotEqualTo(new Track("QkJC"));
    }

    @Test
    void infoIsCopied() {
        var info = new JsonObject().put("title", "a");
        var track = new Track("QUFB", info);
        info.put("title", "b");
        track.info().put("title", "c");

        assertThat(track.title()).isEqualTo("a");
    }
}
