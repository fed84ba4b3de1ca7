package me.internalizable.sessionhub.servermanager.event;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.Objects;

/**
 * Event fired after a server's connection was disposed.
 *
 * <p>Resource bindings to the connection are already gone when this fires.</p>
 */
public class ServerDisconnectEvent {

    private final URI serverUrl;
    private final DisconnectReason reason;

    /**
     * Create a server disconnect event.
     *
     * @param serverUrl server URL
     * @param reason disconnect reason
     */
    public ServerDisconnectEvent(@Nonnull URI serverUrl, @Nonnull DisconnectReason reason) {
        this.serverUrl = Objects.requireNonNull(serverUrl, "serverUrl");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /**
     * Get the server URL.
     *
     * @return normalized server URL
     */
    @Nonnull
    public URI getServerUrl() {
        return serverUrl;
    }

    /**
     * Get the disconnect reason.
     *
     * @return disconnect reason
     */
    @Nonnull
    public DisconnectReason getReason() {
        return reason;
    }

    /**
     * Check if the disconnect was initiated by this process rather than the server.
     *
     * @return true for requested and shutdown disconnects
     */
    public boolean isRequested() {
        return reason == DisconnectReason.REQUESTED || reason == DisconnectReason.SHUTDOWN;
    }

    @Override
    public String toString() {
        return "ServerDisconnectEvent{serverUrl=" + serverUrl + ", reason=" + reason + '}';
    }

    /**
     * Reasons for a disconnect.
     */
    public enum DisconnectReason {
        /**
         * Disconnect requested by a caller.
         */
        REQUESTED,

        /**
         * Status refresh found the server no longer reachable.
         */
        SERVER_STOPPED,

        /**
         * Server is no longer listed in configuration or among managed servers.
         */
        REMOVED,

        /**
         * Session transport dropped the session.
         */
        SESSION_DROPPED,

        /**
         * Server manager is closing.
         */
        SHUTDOWN
    }
}
