package basalt.player;

import basalt.voice.VoiceSessionDescriptor;
import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Partial update of a remote player. Only the fields that were set are sent to the node,
 * fields explicitly set to null are sent as null.
 */
public final class PlayerUpdate {
    private final JsonObject payload = new JsonObject();

    @Nonnull
    @CheckReturnValue
    public static PlayerUpdate create() {
        return new PlayerUpdate();
    }

    @Nonnull
    @CheckReturnValue
    public static PlayerUpdate voice(@Nonnull VoiceSessionDescriptor descriptor) {
        return new PlayerUpdate().setVoice(descriptor);
    }

    /**
     * Sets the track to play. A null track stops the player.
     */
    @Nonnull
    public PlayerUpdate setTrack(@Nullable Track track) {
        payload.put("track", new JsonObject().put("encoded", track == null ? null : track.encoded()));
        return this;
    }

    @Nonnull
    public PlayerUpdate setPosition(long position) {
        payload.put("position", position);
        return this;
    }

    @Nonnull
    public PlayerUpdate setEndTime(@Nullable Long endTime) {
        payload.put("endTime", endTime);
        return this;
    }

    @Nonnull
    public PlayerUpdate setVolume(int volume) {
        payload.put("volume", volume);
        return this;
    }

    @Nonnull
    public PlayerUpdate setPaused(boolean paused) {
        payload.put("paused", paused);
        return this;
    }

    @Nonnull
    public PlayerUpdate setVoice(@Nonnull VoiceSessionDescriptor descriptor) {
        payload.put("voice", descriptor.toJson());
        return this;
    }

    @CheckReturnValue
    public boolean has(@Nonnull String field) {
        return payload.containsKey(field);
    }

    @Nonnull
    @CheckReturnValue
    public JsonObject toJson() {
        return payload.copy();
    }

    @Override
    public String toString() {
        //avoid leaking the voice token
        var copy = payload.copy();
        if(copy.containsKey("voice")) {
            copy.put("voice", "<hidden>");
        }
        return "PlayerUpdate" + copy.encode();
    }
}
