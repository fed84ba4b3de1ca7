package me.internalizable.sessionhub.servermanager.event;

import me.internalizable.sessionhub.servermanager.connection.Connection;
import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.Objects;

/**
 * Event fired once a connection to a server is ready.
 */
public class ServerConnectEvent {

    private final ServerDescriptor server;
    private final Connection<?> connection;

    /**
     * Create a server connect event.
     *
     * @param server the server
     * @param connection the ready connection
     */
    public ServerConnectEvent(@Nonnull ServerDescriptor server, @Nonnull Connection<?> connection) {
        this.server = Objects.requireNonNull(server, "server");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Nonnull
    public ServerDescriptor getServer() {
        return server;
    }

    @Nonnull
    public URI getServerUrl() {
        return server.getUrl();
    }

    @Nonnull
    public Connection<?> getConnection() {
        return connection;
    }
}
