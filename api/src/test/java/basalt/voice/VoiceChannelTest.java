package basalt.voice;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceChannelTest {
    @Test
    void equalityUsesGuildAndChannel() {
        assertThat(new VoiceChannel("1", "2")).isEqualTo(new VoiceChannel("1", "2"));
        assertThat(new VoiceChannel("1", "2")).isNotEqualTo(new VoiceChannel("1", "3"));
        assertThat(new VoiceChannel("1", "2").hashCode()).isEqualTo(new VoiceChannel("1", "2").hashCode());
    }
}
