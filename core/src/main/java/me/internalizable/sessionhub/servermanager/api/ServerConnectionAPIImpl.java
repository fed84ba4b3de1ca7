package me.internalizable.sessionhub.servermanager.api;

import me.internalizable.sessionhub.api.servermanager.ServerConnectionAPI;
import me.internalizable.sessionhub.servermanager.ServerManager;
import me.internalizable.sessionhub.servermanager.connection.Connection;
import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;
import me.internalizable.sessionhub.servermanager.registry.ServerKind;
import me.internalizable.sessionhub.servermanager.registry.ServerRegistry;
import me.internalizable.sessionhub.servermanager.registry.ServerUrls;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Implementation of the ServerConnectionAPI for tool handlers.
 */
public class ServerConnectionAPIImpl implements ServerConnectionAPI {

    private static final List<String> MANAGED_TAGS = List.of("pip", "managed");

    private final ServerManager serverManager;

    public ServerConnectionAPIImpl(@Nonnull ServerManager serverManager) {
        this.serverManager = Objects.requireNonNull(serverManager, "serverManager");
    }

    @Override
    @Nonnull
    public Collection<ServerInfo> listServers(@Nonnull ServerConnectionAPI.ServerFilter filter) {
        Objects.requireNonNull(filter, "filter");
        return serverManager.getServers(toInternalFilter(filter)).stream()
                .map(this::toServerInfo)
                .collect(Collectors.toList());
    }

    @Override
    @Nullable
    public ServerInfo getServer(@Nonnull String url) {
        Objects.requireNonNull(url, "url");
        ServerDescriptor server = serverManager.getServer(ServerUrls.parse(url));
        return server != null ? toServerInfo(server) : null;
    }

    @Override
    @Nonnull
    public Collection<ConnectionInfo> listConnections(@Nullable String url) {
        List<Connection<?>> connections = url == null
                ? serverManager.getConnections()
                : serverManager.getConnections(ServerUrls.parse(url));

        return connections.stream()
                .map(ServerConnectionAPIImpl::toConnectionInfo)
                .collect(Collectors.toList());
    }

    @Override
    @Nonnull
    public CompletableFuture<ConnectionInfo> connect(@Nonnull String url) {
        Objects.requireNonNull(url, "url");
        return serverManager.connect(ServerUrls.parse(url))
                .thenApply(connection -> connection != null ? toConnectionInfo(connection) : null);
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> disconnect(@Nonnull String url) {
        Objects.requireNonNull(url, "url");
        return serverManager.disconnect(ServerUrls.parse(url));
    }

    @Override
    @Nonnull
    public ConnectionStats getStats() {
        ServerRegistry.RegistryStats stats = serverManager.getStats();
        return new ConnectionStatsImpl(
                stats.totalServers(),
                stats.localServers(),
                stats.remoteServers(),
                stats.runningServers(),
                stats.managedServers(),
                serverManager.getConnections().size()
        );
    }

    // ==================== Conversion Helpers ====================

    private static me.internalizable.sessionhub.servermanager.registry.ServerFilter toInternalFilter(
            ServerConnectionAPI.ServerFilter filter) {
        return new me.internalizable.sessionhub.servermanager.registry.ServerFilter()
                .setRunning(filter.getRunning())
                .setHasConnections(filter.getHasConnections())
                .setKind(filter.getKind() != null ? ServerKind.valueOf(filter.getKind()) : null)
                .setManaged(filter.getManaged());
    }

    private ServerInfo toServerInfo(ServerDescriptor server) {
        URI url = server.getUrl();
        List<ConnectionInfo> connections = serverManager.getConnections(url).stream()
                .map(ServerConnectionAPIImpl::toConnectionInfo)
                .collect(Collectors.toList());

        return new ServerInfoImpl(
                server.getKind().name(),
                url.toString(),
                server.getLabel(),
                connections.stream().anyMatch(ConnectionInfo::isConnected),
                server.isRunning(),
                connections.size(),
                server.isManaged(),
                server.isManaged() ? MANAGED_TAGS : List.of(),
                connections
        );
    }

    private static ConnectionInfo toConnectionInfo(Connection<?> connection) {
        return new ConnectionInfoImpl(
                connection.isConnected(),
                connection.isRunningCode(),
                connection.getServerUrl().toString(),
                connection.getTagId()
        );
    }

    // ==================== Record Implementations ====================

    private record ServerInfoImpl(
            String kind,
            String url,
            String label,
            boolean connected,
            boolean running,
            int connectionCount,
            boolean managed,
            List<String> tags,
            List<ConnectionInfo> connections
    ) implements ServerInfo {

        @Override
        @Nonnull
        public String getKind() {
            return kind;
        }

        @Override
        @Nonnull
        public String getUrl() {
            return url;
        }

        @Override
        @Nullable
        public String getLabel() {
            return label;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getConnectionCount() {
            return connectionCount;
        }

        @Override
        public boolean isManaged() {
            return managed;
        }

        @Override
        @Nonnull
        public List<String> getTags() {
            return tags;
        }

        @Override
        @Nonnull
        public List<ConnectionInfo> getConnections() {
            return List.copyOf(connections);
        }
    }

    private record ConnectionInfoImpl(
            boolean connected,
            boolean runningCode,
            String serverUrl,
            String tagId
    ) implements ConnectionInfo {

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public boolean isRunningCode() {
            return runningCode;
        }

        @Override
        @Nonnull
        public String getServerUrl() {
            return serverUrl;
        }

        @Override
        @Nullable
        public String getTagId() {
            return tagId;
        }
    }

    private record ConnectionStatsImpl(
            int totalServers,
            int localServers,
            int remoteServers,
            int runningServers,
            int managedServers,
            int connections
    ) implements ConnectionStats {

        @Override
        public int getTotalServers() {
            return totalServers;
        }

        @Override
        public int getLocalServers() {
            return localServers;
        }

        @Override
        public int getRemoteServers() {
            return remoteServers;
        }

        @Override
        public int getRunningServers() {
            return runningServers;
        }

        @Override
        public int getManagedServers() {
            return managedServers;
        }

        @Override
        public int getConnections() {
            return connections;
        }
    }
}
