package basalt.player;

import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A track as encoded by the node. The encoded string is opaque to basalt, the info
 * object is kept only for display purposes.
 */
public final class Track {
    private final String encoded;
    private final JsonObject info;

    public Track(@Nonnull String encoded) {
        this(encoded, null);
    }

    public Track(@Nonnull String encoded, @Nullable JsonObject info) {
        this.encoded = Objects.requireNonNull(encoded, "encoded");
        this.info = info == null ? new JsonObject() : info.copy();
    }

    /**
     * Reads a track in the {@code {"encoded": ..., "info": {...}}} format used by the node.
     *
     * @param json Track json.
     *
     * @return The track.
     */
    @Nonnull
    @CheckReturnValue
    public static Track fromJson(@Nonnull JsonObject json) {
        var encoded = json.getString("encoded");
        if(encoded == null) {
            throw new IllegalArgumentException("Track json is missing the encoded field");
        }
        return new Track(encoded, json.getJsonObject("info"));
    }

    @Nonnull
    @CheckReturnValue
    public String encoded() {
        return encoded;
    }

    @Nonnull
    @CheckReturnValue
    public JsonObject info() {
        return info.copy();
    }

    @Nullable
    @CheckReturnValue
    public String title() {
        return info.getString("title");
    }

    @Nullable
    @CheckReturnValue
    public String identifier() {
        return info.getString("identifier");
    }

    @CheckReturnValue
    public long length() {
        return info.getLong("length", 0L);
    }

    @Nonnull
    @CheckReturnValue
    public JsonObject toJson() {
        return new JsonObject().put("encoded", encoded).put("info", info.copy());
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Track)) return false;
        return encoded.equals(((Track) o).encoded);
    }

    @Override
    public int hashCode() {
        return encoded.hashCode();
    }

    @Override
    public String toString() {
        var title = title();
        return "Track(" + (title == null ? encoded : title) + ")";
    }
}
