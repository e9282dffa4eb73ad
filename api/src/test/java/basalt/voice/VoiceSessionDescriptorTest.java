package basalt.voice;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceSessionDescriptorTest {
    @Test
    void completeOnlyWithAllFieldsPresent() {
        var descriptor = new VoiceSessionDescriptor();
        assertThat(descriptor.isComplete()).isFalse();

        descriptor.setSessionId("session");
        descriptor.setToken("token");
        assertThat(descriptor.isComplete()).isFalse();

        descriptor.setEndpoint("");
        assertThat(descriptor.isComplete()).isFalse();

        descriptor.setEndpoint("endpoint");
        assertThat(descriptor.isComplete()).isTrue();

        descriptor.setToken(null);
        assertThat(descriptor.isComplete()).isFalse();
    }

    @Test
    void snapshotIsDetached() {
        var descriptor = new VoiceSessionDescriptor("session", "token", "endpoint");
        var snapshot = descriptor.snapshot();

        descriptor.setToken("other");

        assertThat(snapshot.token()).isEqualTo("token");
        assertThat(snapshot).isNotEqualTo(descriptor);
        assertThat(snapshot).isEqualTo(new VoiceSessionDescriptor("session", "token", "endpoint"));
        assertThat(snapshot.hashCode()).isEqualTo(new VoiceSessionDescriptor("session", "token", "endpoint").hashCode());
    }

    @Test
    void jsonUsesNodeFieldNames() {
        var json = new VoiceSessionDescriptor("session", "token", "endpoint").toJson();

        assertThat(json.getString("sessionId")).isEqualTo("session");
        assertThat(json.getString("token")).isEqualTo("token");
        assertThat(json.getString("endpoint")).isEqualTo("endpoint");
    }

    @Test
    void toStringHidesToken() {
        assertThat(new VoiceSessionDescriptor("session", "secret-token", "endpoint").toString())
                .doesNotContain("secret-token")
                .contains("session");
    }
}
