package me.internalizable.sessionhub.api.servermanager;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * API for listing analytic servers and managing connections to them.
 *
 * <p>Results are read-only snapshots; they do not change when the
 * underlying server or connection does.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ServerConnectionAPI api = sessionHub.getServerConnections();
 *
 * // Running servers nobody is connected to yet
 * Collection<ServerInfo> idle = api.listServers(ServerFilter.builder()
 *     .running(true)
 *     .hasConnections(false)
 *     .build());
 *
 * api.connect("http://localhost:10000")
 *     .thenAccept(info -> {
 *         if (info != null) {
 *             System.out.println("Connected: " + info.getServerUrl());
 *         }
 *     });
 * }</pre>
 */
public interface ServerConnectionAPI {

    /**
     * List servers matching a filter.
     *
     * @param filter server filter
     * @return matching servers in registration order
     */
    @Nonnull
    Collection<ServerInfo> listServers(@Nonnull ServerFilter filter);

    /**
     * List every known server.
     *
     * @return all servers
     */
    @Nonnull
    default Collection<ServerInfo> listServers() {
        return listServers(ServerFilter.all());
    }

    /**
     * Get a server by URL. Loopback URLs match on port, other URLs on host.
     *
     * @param url server URL
     * @return server info, or null if no server matches
     * @throws IllegalArgumentException if the URL is malformed
     */
    @Nullable
    ServerInfo getServer(@Nonnull String url);

    /**
     * List connections.
     *
     * @param url server URL to restrict to, or null for all
     * @return connections
     */
    @Nonnull
    Collection<ConnectionInfo> listConnections(@Nullable String url);

    /**
     * Connect to a server.
     *
     * @param url server URL
     * @return future with the new connection, or null if the server is
     *         unknown, already connected, or the connection failed
     */
    @Nonnull
    CompletableFuture<ConnectionInfo> connect(@Nonnull String url);

    /**
     * Disconnect from a server. Does nothing if it has no connection.
     *
     * @param url server URL
     * @return future completing when the connection is closed
     */
    @Nonnull
    CompletableFuture<Void> disconnect(@Nonnull String url);

    /**
     * Get connection statistics.
     *
     * @return statistics
     */
    @Nonnull
    ConnectionStats getStats();

    /**
     * Server information.
     */
    interface ServerInfo {
        /**
         * Get the server kind (LOCAL or REMOTE).
         */
        @Nonnull
        String getKind();

        /**
         * Get the normalized server URL.
         */
        @Nonnull
        String getUrl();

        /**
         * Get the configured label.
         */
        @Nullable
        String getLabel();

        /**
         * Check if the server has a ready connection.
         */
        boolean isConnected();

        /**
         * Check if the last status refresh found the server reachable.
         */
        boolean isRunning();

        /**
         * Get the number of connections to the server.
         */
        int getConnectionCount();

        /**
         * Check if this process started the server.
         */
        boolean isManaged();

        /**
         * Get descriptive tags, {@code pip} and {@code managed} for managed servers.
         */
        @Nonnull
        List<String> getTags();

        /**
         * Get the server's connections.
         */
        @Nonnull
        List<ConnectionInfo> getConnections();
    }

    /**
     * Connection information.
     */
    interface ConnectionInfo {
        /**
         * Check if client and session are both live.
         */
        boolean isConnected();

        /**
         * Check if a command is in flight.
         */
        boolean isRunningCode();

        /**
         * Get the server URL.
         */
        @Nonnull
        String getServerUrl();

        /**
         * Get the caller-supplied correlation id.
         */
        @Nullable
        String getTagId();
    }

    /**
     * Criteria for listing servers. Null criteria match everything.
     */
    interface ServerFilter {
        @Nullable
        Boolean getRunning();

        @Nullable
        Boolean getHasConnections();

        /**
         * Get the kind filter (LOCAL or REMOTE).
         */
        @Nullable
        String getKind();

        @Nullable
        Boolean getManaged();

        /**
         * Create a filter matching every server.
         */
        @Nonnull
        static ServerFilter all() {
            return builder().build();
        }

        /**
         * Create a builder for server filters.
         */
        @Nonnull
        static Builder builder() {
            return new ServerFilterBuilder();
        }

        /**
         * Builder for server filters.
         */
        interface Builder {
            Builder running(@Nullable Boolean running);
            Builder hasConnections(@Nullable Boolean hasConnections);
            Builder kind(@Nullable String kind);
            Builder managed(@Nullable Boolean managed);
            ServerFilter build();
        }
    }

    /**
     * Connection statistics.
     */
    interface ConnectionStats {
        int getTotalServers();
        int getLocalServers();
        int getRemoteServers();
        int getRunningServers();
        int getManagedServers();
        int getConnections();
    }
}
