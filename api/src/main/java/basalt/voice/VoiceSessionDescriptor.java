package basalt.voice;

import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Voice session data assembled from the two voice gateway events. The session id comes from
 * voice state updates, the token and endpoint from voice server updates. Fields are overwritten
 * as new events arrive and are never cleared.
 */
public class VoiceSessionDescriptor {
    private volatile String sessionId;
    private volatile String token;
    private volatile String endpoint;

    public VoiceSessionDescriptor() {}

    public VoiceSessionDescriptor(@Nullable String sessionId, @Nullable String token, @Nullable String endpoint) {
        this.sessionId = sessionId;
        this.token = token;
        this.endpoint = endpoint;
    }

    @Nullable
    @CheckReturnValue
    public String sessionId() {
        return sessionId;
    }

    public void setSessionId(@Nullable String sessionId) {
        this.sessionId = sessionId;
    }

    @Nullable
    @CheckReturnValue
    public String token() {
        return token;
    }

    public void setToken(@Nullable String token) {
        this.token = token;
    }

    @Nullable
    @CheckReturnValue
    public String endpoint() {
        return endpoint;
    }

    public void setEndpoint(@Nullable String endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * @return True if session id, token and endpoint are all present and non empty.
     */
    @CheckReturnValue
    public boolean isComplete() {
        return present(sessionId) && present(token) && present(endpoint);
    }

    /**
     * @return A copy of the current values, unaffected by later updates.
     */
    @Nonnull
    @CheckReturnValue
    public VoiceSessionDescriptor snapshot() {
        return new VoiceSessionDescriptor(sessionId, token, endpoint);
    }

    @Nonnull
    @CheckReturnValue
    public JsonObject toJson() {
        return new JsonObject()
                .put("sessionId", sessionId)
                .put("token", token)
                .put("endpoint", endpoint);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof VoiceSessionDescriptor)) return false;
        var other = (VoiceSessionDescriptor) o;
        return Objects.equals(sessionId, other.sessionId)
                && Objects.equals(token, other.token)
                && Objects.equals(endpoint, other.endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, token, endpoint);
    }

    //token is a credential, keep it out of logs
    @Override
    public String toString() {
        return "VoiceSessionDescriptor(sessionId=" + sessionId + ", endpoint=" + endpoint
                + ", token=" + (token == null ? "null" : "<hidden>") + ")";
    }

    private static boolean present(@Nullable String s) {
        return s != null && !s.isEmpty();
    }
}
