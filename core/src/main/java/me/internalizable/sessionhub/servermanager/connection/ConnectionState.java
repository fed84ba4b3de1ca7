package me.internalizable.sessionhub.servermanager.connection;

/**
 * Bring-up state of a {@link Connection}.
 *
 * <pre>
 * UNINITIALIZED → ACQUIRING_CLIENT → ACQUIRING_SESSION → READY
 *        ↑________________ teardown ________________|
 * any state → DISCONNECTED (close)
 * </pre>
 */
public enum ConnectionState {
    /**
     * No bring-up in progress; also the state after a dropped session.
     */
    UNINITIALIZED,

    /**
     * Waiting for the credential provider to return an authenticated client.
     */
    ACQUIRING_CLIENT,

    /**
     * Client available, session being opened.
     */
    ACQUIRING_SESSION,

    /**
     * Client and session are live.
     */
    READY,

    /**
     * Closed for good. The connection cannot be brought up again.
     */
    DISCONNECTED;

    /**
     * Check if a bring-up step is in flight.
     *
     * @return true while acquiring the client or the session
     */
    public boolean isConnecting() {
        return this == ACQUIRING_CLIENT || this == ACQUIRING_SESSION;
    }
}
