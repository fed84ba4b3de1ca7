package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;

/**
 * Read-only view of one open session to one server.
 */
public interface ConnectionHandle {

    /**
     * Get the URL of the server this connection talks to.
     *
     * @return normalized server URL
     */
    @Nonnull
    URI getServerUrl();

    /**
     * Check if session bring-up has been attempted since the last teardown.
     *
     * @return true once a session attempt exists, whether or not it succeeded yet
     */
    boolean isInitialized();

    /**
     * Check if both the client and the session are live.
     *
     * @return true if connected
     */
    boolean isConnected();

    /**
     * Get the caller-supplied correlation id, e.g. the worker a connection
     * was created for.
     *
     * @return tag id, or null
     */
    @Nullable
    String getTagId();
}
