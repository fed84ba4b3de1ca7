package me.internalizable.sessionhub.servermanager;

import me.internalizable.sessionhub.servermanager.cache.SingleFlightCache;
import me.internalizable.sessionhub.servermanager.config.ServerManagerConfig;
import me.internalizable.sessionhub.servermanager.connection.Connection;
import me.internalizable.sessionhub.servermanager.connection.ConnectionFactory;
import me.internalizable.sessionhub.servermanager.connection.UnsupportedConsoleTypeException;
import me.internalizable.sessionhub.servermanager.event.ConfigLoadedEvent;
import me.internalizable.sessionhub.servermanager.event.EventChannel;
import me.internalizable.sessionhub.servermanager.event.ResourceBoundEvent;
import me.internalizable.sessionhub.servermanager.event.ServerConnectEvent;
import me.internalizable.sessionhub.servermanager.event.ServerDisconnectEvent;
import me.internalizable.sessionhub.servermanager.event.ServerDisconnectEvent.DisconnectReason;
import me.internalizable.sessionhub.servermanager.event.ServerStatusChangeEvent;
import me.internalizable.sessionhub.servermanager.event.Subscription;
import me.internalizable.sessionhub.servermanager.poll.CancellablePoll;
import me.internalizable.sessionhub.servermanager.poll.MinIntervalPoller;
import me.internalizable.sessionhub.servermanager.probe.ReachabilityProbe;
import me.internalizable.sessionhub.servermanager.registry.ResourceBindings;
import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;
import me.internalizable.sessionhub.servermanager.registry.ServerFilter;
import me.internalizable.sessionhub.servermanager.registry.ServerRegistry;
import me.internalizable.sessionhub.servermanager.registry.ServerUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Registry of known servers and their live connections.
 *
 * <p>Owns the server table, the connection cache and the status poller.
 * Every change to them goes through this class, so a server removed from
 * configuration or found unreachable always has its connection torn down.</p>
 *
 * <h2>Connections</h2>
 * <p>Connections are held in a {@link SingleFlightCache} keyed by normalized
 * server URL, so concurrent {@link #connect} calls for one server share one
 * bring-up and a server never has two connections. A failed bring-up clears
 * its slot so a later connect starts clean.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ServerManager manager = new ServerManager(connectionFactory, new HttpReachabilityProbe(timeout));
 * manager.loadServerConfig(ServerManagerConfig.load(path)).join();
 * manager.startStatusPolling();
 *
 * Connection<?> connection = manager.connect(URI.create("http://localhost:10000")).join();
 * manager.bindResource(documentUri, "python", connection).join();
 *
 * manager.close();
 * }</pre>
 */
public class ServerManager implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerManager.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ConnectionFactory connectionFactory;
    private final ReachabilityProbe reachabilityProbe;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final ServerRegistry registry = new ServerRegistry();
    private final ResourceBindings bindings = new ResourceBindings();
    private final SingleFlightCache<URI, Connection<?>> connections;
    private final MinIntervalPoller statusPoller;

    private final EventChannel<ServerConnectEvent> onConnect = new EventChannel<>("connect");
    private final EventChannel<ServerDisconnectEvent> onDisconnect = new EventChannel<>("disconnect");
    private final EventChannel<ServerStatusChangeEvent> onServerStatusChange = new EventChannel<>("serverStatusChange");
    private final EventChannel<Object> onUpdate = new EventChannel<>("update");
    private final EventChannel<ConfigLoadedEvent> onConfigLoaded = new EventChannel<>("configLoaded");
    private final EventChannel<ResourceBoundEvent> onResourceBound = new EventChannel<>("resourceBound");

    private volatile long statusPollIntervalMillis = new ServerManagerConfig().getStatusPollIntervalMillis();
    private volatile boolean hasEverUpdatedStatus = false;
    private volatile boolean closed = false;

    /**
     * Create a server manager with its own scheduler thread.
     *
     * @param connectionFactory builds connections for servers
     * @param reachabilityProbe answers status refresh
     */
    public ServerManager(@Nonnull ConnectionFactory connectionFactory, @Nonnull ReachabilityProbe reachabilityProbe) {
        this(connectionFactory, reachabilityProbe, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ServerManager-Scheduler");
            t.setDaemon(true);
            return t;
        }), true);
    }

    /**
     * Create a server manager on a caller-owned scheduler. The scheduler is
     * not shut down by {@link #close()}.
     *
     * @param connectionFactory builds connections for servers
     * @param reachabilityProbe answers status refresh
     * @param scheduler scheduler for status polling
     */
    public ServerManager(
            @Nonnull ConnectionFactory connectionFactory,
            @Nonnull ReachabilityProbe reachabilityProbe,
            @Nonnull ScheduledExecutorService scheduler) {
        this(connectionFactory, reachabilityProbe, scheduler, false);
    }

    private ServerManager(
            ConnectionFactory connectionFactory,
            ReachabilityProbe reachabilityProbe,
            ScheduledExecutorService scheduler,
            boolean ownsScheduler) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.reachabilityProbe = Objects.requireNonNull(reachabilityProbe, "reachabilityProbe");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        this.connections = new SingleFlightCache<>("connections", this::createConnection, ServerUrls::normalize);
        this.statusPoller = new MinIntervalPoller(scheduler);
    }

    private CompletableFuture<Connection<?>> createConnection(URI serverUrl) {
        ServerDescriptor server = registry.getExact(serverUrl);
        if (server == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Unknown server: " + serverUrl));
        }
        LOGGER.debug("Creating connection for {}", serverUrl);
        return connectionFactory.create(server);
    }

    // ==================== Configuration ====================

    /**
     * Rebuild the server table from configuration.
     *
     * <p>Managed servers are kept and listed first, so a configured server
     * with the same URL replaces them. Servers that survive keep their
     * status. Connections to servers that are gone are disconnected, then
     * status is refreshed.</p>
     *
     * @param config the configuration
     * @return future completing after the status refresh
     */
    @Nonnull
    public CompletableFuture<Void> loadServerConfig(@Nonnull ServerManagerConfig config) {
        checkOpen();
        Objects.requireNonNull(config, "config");

        List<ServerDescriptor> next = new ArrayList<>(registry.getManagedServers());
        next.addAll(config.toServerDescriptors());

        List<ServerDescriptor> removed = registry.replaceAll(next);
        statusPollIntervalMillis = config.getStatusPollIntervalMillis();

        LOGGER.info("Loaded server configuration: {} servers ({} removed)",
                registry.getServerCount(), removed.size());

        List<CompletableFuture<Void>> disconnects = removed.stream()
                .map(server -> disconnect(server.getUrl(), DisconnectReason.REMOVED))
                .collect(Collectors.toList());

        return allOf(disconnects)
                .thenCompose(v -> updateStatus())
                .thenRun(() -> onConfigLoaded.fireSync(new ConfigLoadedEvent(registry.getAllServers(), removed)));
    }

    /**
     * Reconcile the managed servers with the URLs of the servers this
     * process currently runs. Managed servers not listed are disconnected
     * and removed; new URLs are added with a fresh pre-shared key.
     * Configured servers are left alone.
     *
     * @param urls URLs of the running managed servers
     * @return future completing once removed servers are disconnected
     */
    @Nonnull
    public CompletableFuture<Void> syncManagedServers(@Nonnull Collection<URI> urls) {
        checkOpen();
        Objects.requireNonNull(urls, "urls");

        Set<URI> wanted = urls.stream()
                .map(ServerUrls::normalize)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        List<CompletableFuture<Void>> disconnects = new ArrayList<>();
        for (ServerDescriptor server : registry.getManagedServers()) {
            if (!wanted.contains(server.getUrl())) {
                disconnects.add(disconnect(server.getUrl(), DisconnectReason.REMOVED));
                registry.unregister(server.getUrl());
                LOGGER.info("Removed managed server: {}", server.getUrl());
            }
        }

        for (URI url : wanted) {
            if (!registry.hasServer(url)) {
                registry.register(ServerDescriptor.managed(url, null));
                LOGGER.info("Added managed server: {}", url);
            }
        }

        onUpdate.fireSync(this);
        return allOf(disconnects);
    }

    // ==================== Queries ====================

    /**
     * Resolve a URL to a known server. Loopback URLs match on port, other
     * URLs match on host only.
     *
     * @param url request URL
     * @return the server, or null if none matches
     */
    @Nullable
    public ServerDescriptor getServer(@Nonnull URI url) {
        return registry.getServer(url);
    }

    /**
     * List servers.
     *
     * @param filter criteria; unset criteria match everything
     * @return matching servers in registration order
     */
    @Nonnull
    public List<ServerDescriptor> getServers(@Nonnull ServerFilter filter) {
        Objects.requireNonNull(filter, "filter");
        return registry.getServers(server -> filter.matches(server,
                filter.needsConnectionState() && connections.has(server.getUrl())));
    }

    @Nonnull
    public List<ServerDescriptor> getServers() {
        return registry.getAllServers();
    }

    /**
     * Check if a server has a connection, ready or still being brought up.
     *
     * @param url server URL
     * @return true if a connection slot exists
     */
    public boolean hasConnection(@Nonnull URI url) {
        return connections.has(resolve(url));
    }

    /**
     * Get the connection of a server.
     *
     * @param url server URL
     * @return the connection, or null if there is none or it is still being created
     */
    @Nullable
    public Connection<?> getConnection(@Nonnull URI url) {
        CompletableFuture<Connection<?>> slot = connections.peek(resolve(url));
        if (slot == null || !slot.isDone() || slot.isCompletedExceptionally()) {
            return null;
        }
        return slot.join();
    }

    /**
     * Get every created connection.
     *
     * @return connections in creation order
     */
    @Nonnull
    public List<Connection<?>> getConnections() {
        return connections.readyValues();
    }

    /**
     * Get the connections of one server.
     *
     * @param url server URL
     * @return zero or one connection
     */
    @Nonnull
    public List<Connection<?>> getConnections(@Nonnull URI url) {
        URI key = resolve(url);
        return connections.readyValues().stream()
                .filter(c -> c.getServerUrl().equals(key))
                .collect(Collectors.toList());
    }

    // ==================== Connect / Disconnect ====================

    /**
     * Connect to a server and bring its session up.
     *
     * @param url server URL, resolved with {@link #getServer}
     * @return future with the ready connection; null if the server is
     *         unknown, already has a connection, or bring-up failed
     */
    @Nonnull
    public CompletableFuture<Connection<?>> connect(@Nonnull URI url) {
        checkOpen();
        Objects.requireNonNull(url, "url");

        ServerDescriptor server = registry.getServer(url);
        if (server == null) {
            LOGGER.warn("Cannot connect to unknown server: {}", url);
            return CompletableFuture.completedFuture(null);
        }

        URI key = server.getUrl();
        SingleFlightCache.Lookup<Connection<?>> lookup = connections.getOrCreate(key);
        if (!lookup.created()) {
            LOGGER.info("Already connected to server: {}", key);
            return CompletableFuture.completedFuture(null);
        }

        LOGGER.info("Connecting to server: {}", key);
        CompletableFuture<Connection<?>> slot = lookup.future();
        onUpdate.fireSync(this);

        return slot
                .thenCompose(connection -> {
                    // Drops during bring-up must reach the manager too
                    connection.onDisconnected(ignored -> handleSessionDropped(key, connection));
                    return connection.initSession().thenApply(v -> connection);
                })
                .handle((connection, error) -> {
                    if (error != null) {
                        abandon(key, slot);
                        return null;
                    }

                    if (connections.peek(key) != slot) {
                        // Disconnected while coming up
                        LOGGER.debug("Connection to {} was disconnected during bring-up", key);
                        return null;
                    }

                    LOGGER.info("Connected to server: {}", key);
                    onConnect.fireSync(new ServerConnectEvent(server, connection));
                    onUpdate.fireSync(this);
                    return connection;
                });
    }

    private void abandon(URI key, CompletableFuture<Connection<?>> slot) {
        LOGGER.warn("Failed to connect to server: {}", key);
        connections.invalidate(key, slot);

        if (slot.isDone() && !slot.isCompletedExceptionally()) {
            slot.join().close();
        }
        onUpdate.fireSync(this);
    }

    private void handleSessionDropped(URI key, Connection<?> connection) {
        if (getConnection(key) != connection) {
            return;
        }
        LOGGER.info("Session dropped for server: {}", key);
        disconnect(key, DisconnectReason.SESSION_DROPPED);
    }

    /**
     * Disconnect from a server. Bindings to the connection are removed
     * before it is closed.
     *
     * @param url server URL, resolved with {@link #getServer}
     * @return future completing once the connection is closed
     */
    @Nonnull
    public CompletableFuture<Void> disconnect(@Nonnull URI url) {
        Objects.requireNonNull(url, "url");
        return disconnect(resolve(url), DisconnectReason.REQUESTED);
    }

    private CompletableFuture<Void> disconnect(URI key, DisconnectReason reason) {
        CompletableFuture<Connection<?>> removed = connections.invalidate(key);
        if (removed == null) {
            return CompletableFuture.completedFuture(null);
        }

        LOGGER.info("Disconnecting from server: {} ({})", key, reason);

        return removed.handle((connection, error) -> {
            if (connection == null) {
                // Bring-up failed, there is nothing to tear down
                return null;
            }
            bindings.unbindAll(connection);
            connection.close();
            onDisconnect.fireSync(new ServerDisconnectEvent(key, reason));
            onUpdate.fireSync(this);
            return null;
        });
    }

    // ==================== Resource Bindings ====================

    /**
     * Bind a resource to a connection, replacing any previous binding.
     *
     * @param resourceId resource identifier
     * @param connection serving connection
     */
    public void bindResource(@Nonnull URI resourceId, @Nonnull Connection<?> connection) {
        Connection<?> previous = bindings.bind(resourceId, connection);
        onUpdate.fireSync(this);
        onResourceBound.fireSync(new ResourceBoundEvent(resourceId, connection, previous));
    }

    /**
     * Bind a resource after checking the connection accepts its console type.
     *
     * @param resourceId resource identifier
     * @param consoleType console type of the resource
     * @param connection serving connection
     * @return future failing with {@link UnsupportedConsoleTypeException} if
     *         the connection does not accept the type
     */
    @Nonnull
    public CompletableFuture<Void> bindResource(
            @Nonnull URI resourceId,
            @Nonnull String consoleType,
            @Nonnull Connection<?> connection) {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(consoleType, "consoleType");
        Objects.requireNonNull(connection, "connection");

        return connection.supportsConsoleType(consoleType).thenAccept(supported -> {
            if (!supported) {
                throw new UnsupportedConsoleTypeException(connection.getServerUrl(), consoleType);
            }
            bindResource(resourceId, connection);
        });
    }

    /**
     * Remove a resource's binding.
     *
     * @param resourceId resource identifier
     * @return true if it was bound
     */
    public boolean unbindResource(@Nonnull URI resourceId) {
        boolean removed = bindings.unbind(resourceId) != null;
        if (removed) {
            onUpdate.fireSync(this);
        }
        return removed;
    }

    @Nullable
    public Connection<?> getResourceConnection(@Nonnull URI resourceId) {
        return bindings.get(resourceId);
    }

    @Nonnull
    public List<URI> getBoundResources(@Nonnull Connection<?> connection) {
        return bindings.getBoundResources(connection);
    }

    public boolean hasBoundResources(@Nonnull Connection<?> connection) {
        return bindings.hasBoundResources(connection);
    }

    // ==================== Status ====================

    /**
     * Probe every server and apply status transitions.
     *
     * @return future completing once every probe was handled
     */
    @Nonnull
    public CompletableFuture<Void> updateStatus() {
        return updateStatus(null);
    }

    /**
     * Probe servers and apply status transitions.
     *
     * <p>Servers are probed concurrently; a failing probe counts as not
     * reachable and does not affect the others. A server that stops running
     * is disconnected (reason {@code SERVER_STOPPED}).</p>
     *
     * @param filterUrls servers to probe, null for all
     * @return future completing once every probe and resulting disconnect is done
     */
    @Nonnull
    public CompletableFuture<Void> updateStatus(@Nullable Collection<URI> filterUrls) {
        LOGGER.debug("Updating server statuses");

        List<ServerDescriptor> servers = registry.getAllServers();
        if (filterUrls != null) {
            Set<URI> filter = filterUrls.stream()
                    .map(ServerUrls::normalize)
                    .collect(Collectors.toSet());
            servers = servers.stream()
                    .filter(s -> filter.contains(s.getUrl()))
                    .collect(Collectors.toList());
        }

        List<CompletableFuture<Void>> refreshes = servers.stream()
                .map(this::refreshStatus)
                .collect(Collectors.toList());

        return allOf(refreshes).thenRun(() -> hasEverUpdatedStatus = true);
    }

    private CompletableFuture<Void> refreshStatus(ServerDescriptor server) {
        return probe(server).thenCompose(running -> {
            ServerDescriptor updated = registry.updateRunning(server.getUrl(), running);
            if (updated == null) {
                return CompletableFuture.completedFuture(null);
            }

            LOGGER.info("Server {} is now {}", updated.getUrl(), running ? "running" : "stopped");

            CompletableFuture<Void> disconnecting = running
                    ? CompletableFuture.completedFuture(null)
                    : disconnect(updated.getUrl(), DisconnectReason.SERVER_STOPPED);

            onUpdate.fireSync(this);
            onServerStatusChange.fireSync(new ServerStatusChangeEvent(updated.withRunning(!running), updated));
            return disconnecting;
        });
    }

    private CompletableFuture<Boolean> probe(ServerDescriptor server) {
        CompletableFuture<Boolean> result;
        try {
            result = reachabilityProbe.isReachable(server.getUrl(), server.getKind());
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        if (result == null) {
            result = CompletableFuture.completedFuture(false);
        }

        return result.handle((reachable, error) -> {
            if (error != null) {
                LOGGER.debug("Probe failed for {}: {}", server.getUrl(), error.toString());
                return false;
            }
            return Boolean.TRUE.equals(reachable);
        });
    }

    /**
     * Start refreshing status at the configured interval. Restarts polling
     * if it is already running.
     */
    public void startStatusPolling() {
        checkOpen();
        LOGGER.debug("Starting status polling every {} ms", statusPollIntervalMillis);
        statusPoller.start(this::updateStatus, statusPollIntervalMillis);
    }

    public void stopStatusPolling() {
        statusPoller.stop();
    }

    public boolean isStatusPolling() {
        return statusPoller.isRunning();
    }

    /**
     * Check if status was refreshed at least once.
     *
     * @return true after the first completed {@link #updateStatus}
     */
    public boolean hasEverUpdatedStatus() {
        return hasEverUpdatedStatus;
    }

    /**
     * Poll a server's status until it is running, for example after
     * starting a managed server.
     *
     * @param url server URL
     * @param intervalMillis minimum interval between probes
     * @param timeoutMillis optional timeout
     * @return the running poll, completing with {@code true} once the server runs
     */
    @Nonnull
    public CancellablePoll awaitServerRunning(@Nonnull URI url, long intervalMillis, @Nullable Long timeoutMillis) {
        checkOpen();
        URI key = resolve(url);
        return MinIntervalPoller.pollUntilTrue(scheduler,
                () -> updateStatus(List.of(key)).thenApply(v -> {
                    ServerDescriptor server = registry.getExact(key);
                    return server != null && server.isRunning();
                }),
                intervalMillis,
                timeoutMillis);
    }

    // ==================== Events ====================

    @Nonnull
    public Subscription onConnect(@Nonnull Consumer<ServerConnectEvent> listener) {
        return onConnect.subscribe(listener);
    }

    @Nonnull
    public Subscription onDisconnect(@Nonnull Consumer<ServerDisconnectEvent> listener) {
        return onDisconnect.subscribe(listener);
    }

    @Nonnull
    public Subscription onServerStatusChange(@Nonnull Consumer<ServerStatusChangeEvent> listener) {
        return onServerStatusChange.subscribe(listener);
    }

    /**
     * Listen for any change to servers, connections or bindings.
     *
     * @param listener change listener
     * @return subscription
     */
    @Nonnull
    public Subscription onUpdate(@Nonnull Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        return onUpdate.subscribe(ignored -> listener.run());
    }

    @Nonnull
    public Subscription onConfigLoaded(@Nonnull Consumer<ConfigLoadedEvent> listener) {
        return onConfigLoaded.subscribe(listener);
    }

    @Nonnull
    public Subscription onResourceBound(@Nonnull Consumer<ResourceBoundEvent> listener) {
        return onResourceBound.subscribe(listener);
    }

    // ==================== Lifecycle ====================

    /**
     * Get registry statistics.
     *
     * @return statistics
     */
    @Nonnull
    public ServerRegistry.RegistryStats getStats() {
        return registry.getStats();
    }

    public long getStatusPollIntervalMillis() {
        return statusPollIntervalMillis;
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Server manager closed");
        }
    }

    /**
     * Stop polling, disconnect every server and release the scheduler if
     * this manager created it.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }

        closed = true;
        LOGGER.info("Shutting down server manager...");

        statusPoller.close();

        List<CompletableFuture<Void>> disconnects = connections.keys().stream()
                .map(key -> disconnect(key, DisconnectReason.SHUTDOWN))
                .collect(Collectors.toList());

        try {
            allOf(disconnects).get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Timeout waiting for connections to close, clearing cache");
        }

        connections.dispose();
        bindings.clear();
        registry.clear();

        if (ownsScheduler) {
            scheduler.shutdown();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        LOGGER.info("Server manager shut down");
    }

    // ==================== Helpers ====================

    private URI resolve(URI url) {
        Objects.requireNonNull(url, "url");
        ServerDescriptor server = registry.getServer(url);
        return server != null ? server.getUrl() : ServerUrls.normalize(url);
    }

    private static CompletableFuture<Void> allOf(List<CompletableFuture<Void>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    }
}
