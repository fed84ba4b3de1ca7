package me.internalizable.sessionhub.servermanager.event;

import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.Objects;

/**
 * Event fired when status refresh flips a server's running flag.
 */
public class ServerStatusChangeEvent {

    private final ServerDescriptor previous;
    private final ServerDescriptor server;

    /**
     * Create a server status change event.
     *
     * @param previous descriptor before the change
     * @param server descriptor after the change
     */
    public ServerStatusChangeEvent(@Nonnull ServerDescriptor previous, @Nonnull ServerDescriptor server) {
        this.previous = Objects.requireNonNull(previous, "previous");
        this.server = Objects.requireNonNull(server, "server");
    }

    /**
     * Get the server after the change.
     *
     * @return current descriptor
     */
    @Nonnull
    public ServerDescriptor getServer() {
        return server;
    }

    /**
     * Get the server before the change.
     *
     * @return previous descriptor
     */
    @Nonnull
    public ServerDescriptor getPrevious() {
        return previous;
    }

    @Nonnull
    public URI getServerUrl() {
        return server.getUrl();
    }

    /**
     * Check if the server stopped responding.
     *
     * @return true if it was running and is not anymore
     */
    public boolean becameUnreachable() {
        return previous.isRunning() && !server.isRunning();
    }

    /**
     * Check if the server came back.
     *
     * @return true if it was not running and now is
     */
    public boolean recovered() {
        return !previous.isRunning() && server.isRunning();
    }
}
