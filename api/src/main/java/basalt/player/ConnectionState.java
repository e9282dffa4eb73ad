package basalt.player;

/**
 * Lifecycle of a player's voice connection.
 */
public enum ConnectionState {
    /**
     * Created, or a connection attempt timed out. {@code connect} may be called.
     */
    DISCONNECTED,
    /**
     * A join request was sent and the player is waiting for the node to accept the voice session.
     */
    AWAITING_CONFIRMATION,
    /**
     * The node accepted the voice session.
     */
    CONNECTED,
    /**
     * The player left the channel or was destroyed. Terminal, the player must not be reused.
     */
    INVALIDATED
}
