package basalt.voice;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A voice channel inside a guild.
 */
public final class VoiceChannel {
    private final String guildId;
    private final String channelId;

    public VoiceChannel(@Nonnull String guildId, @Nonnull String channelId) {
        this.guildId = Objects.requireNonNull(guildId, "guildId");
        this.channelId = Objects.requireNonNull(channelId, "channelId");
    }

    @Nonnull
    @CheckReturnValue
    public String guildId() {
        return guildId;
    }

    @Nonnull
    @CheckReturnValue
    public String channelId() {
        return channelId;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof VoiceChannel)) return false;
        var other = (VoiceChannel) o;
        return guildId.equals(other.guildId) && channelId.equals(other.channelId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(guildId, channelId);
    }

    @Override
    public String toString() {
        return "VoiceChannel(" + channelId + "@" + guildId + ")";
    }
}
