package me.internalizable.sessionhub.servermanager;

import me.internalizable.sessionhub.servermanager.config.ServerManagerConfig;
import me.internalizable.sessionhub.servermanager.config.ServerManagerConfig.ServerEntry;
import me.internalizable.sessionhub.servermanager.connection.Connection;
import me.internalizable.sessionhub.servermanager.connection.ConnectionErrors;
import me.internalizable.sessionhub.servermanager.connection.ConnectionFactory;
import me.internalizable.sessionhub.servermanager.connection.ConnectionNotifier;
import me.internalizable.sessionhub.servermanager.connection.FakeServerSession;
import me.internalizable.sessionhub.servermanager.connection.LoggingConnectionNotifier;
import me.internalizable.sessionhub.servermanager.connection.RunCodeResult;
import me.internalizable.sessionhub.servermanager.connection.ServerSession;
import me.internalizable.sessionhub.servermanager.connection.TransportException;
import me.internalizable.sessionhub.servermanager.connection.UnsupportedConsoleTypeException;
import me.internalizable.sessionhub.servermanager.event.ConfigLoadedEvent;
import me.internalizable.sessionhub.servermanager.event.ResourceBoundEvent;
import me.internalizable.sessionhub.servermanager.event.ServerConnectEvent;
import me.internalizable.sessionhub.servermanager.event.ServerDisconnectEvent;
import me.internalizable.sessionhub.servermanager.event.ServerDisconnectEvent.DisconnectReason;
import me.internalizable.sessionhub.servermanager.event.ServerStatusChangeEvent;
import me.internalizable.sessionhub.servermanager.poll.CancellablePoll;
import me.internalizable.sessionhub.servermanager.probe.ReachabilityProbe;
import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;
import me.internalizable.sessionhub.servermanager.registry.ServerFilter;
import me.internalizable.sessionhub.servermanager.registry.ServerKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ServerManagerTest {

    private static final URI LOCAL = URI.create("http://localhost:10000/");
    private static final URI LOCAL_2 = URI.create("http://localhost:10001/");
    private static final URI REMOTE = URI.create("https://gateway.example.com:8123/");

    private ScheduledExecutorService scheduler;
    private TestConnectionFactory factory;
    private TestProbe probe;
    private ServerManager manager;

    private final List<ServerConnectEvent> connects = new CopyOnWriteArrayList<>();
    private final List<ServerDisconnectEvent> disconnects = new CopyOnWriteArrayList<>();
    private final List<ServerStatusChangeEvent> statusChanges = new CopyOnWriteArrayList<>();
    private final AtomicInteger updates = new AtomicInteger();

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        factory = new TestConnectionFactory();
        probe = new TestProbe();
        manager = new ServerManager(factory, probe, scheduler);

        manager.onConnect(connects::add);
        manager.onDisconnect(disconnects::add);
        manager.onServerStatusChange(statusChanges::add);
        manager.onUpdate(updates::incrementAndGet);
    }

    @AfterEach
    void tearDown() {
        manager.close();
        scheduler.shutdownNow();
    }

    // ==================== Configuration ====================

    @Test
    void loadServerConfigRegistersServersAndRefreshesStatus() {
        List<ConfigLoadedEvent> loaded = new ArrayList<>();
        manager.onConfigLoaded(loaded::add);
        probe.setReachable(LOCAL, true);

        manager.loadServerConfig(config()).join();

        assertThat(manager.getServers()).extracting(ServerDescriptor::getUrl).containsExactly(LOCAL, REMOTE);
        assertThat(manager.getServer(LOCAL).isRunning()).isTrue();
        assertThat(manager.getServer(REMOTE).isRunning()).isFalse();
        assertThat(manager.hasEverUpdatedStatus()).isTrue();
        assertThat(manager.getStatusPollIntervalMillis()).isEqualTo(50);

        assertThat(statusChanges).singleElement().satisfies(event -> {
            assertThat(event.getServerUrl()).isEqualTo(LOCAL);
            assertThat(event.recovered()).isTrue();
        });
        assertThat(loaded).singleElement().satisfies(event -> {
            assertThat(event.getServers()).hasSize(2);
            assertThat(event.getRemoved()).isEmpty();
        });
    }

    @Test
    void reloadingConfigDisconnectsRemovedServers() {
        manager.loadServerConfig(config()).join();
        Connection<?> remote = manager.connect(REMOTE).join();

        ServerManagerConfig reduced = config();
        reduced.setRemoteServers(new ArrayList<>());
        List<ConfigLoadedEvent> loaded = new ArrayList<>();
        manager.onConfigLoaded(loaded::add);

        manager.loadServerConfig(reduced).join();

        assertThat(manager.getServers()).extracting(ServerDescriptor::getUrl).containsExactly(LOCAL);
        assertThat(remote.isClosed()).isTrue();
        assertThat(disconnects).singleElement().satisfies(event -> {
            assertThat(event.getServerUrl()).isEqualTo(REMOTE);
            assertThat(event.getReason()).isEqualTo(DisconnectReason.REMOVED);
        });
        assertThat(loaded.get(0).getRemoved()).extracting(ServerDescriptor::getUrl).containsExactly(REMOTE);
    }

    @Test
    void reloadingConfigKeepsStatusOfSurvivingServers() {
        probe.setReachable(LOCAL, true);
        manager.loadServerConfig(config()).join();
        statusChanges.clear();

        manager.loadServerConfig(config()).join();

        assertThat(manager.getServer(LOCAL).isRunning()).isTrue();
        assertThat(statusChanges).isEmpty();
    }

    @Test
    void syncManagedServersAddsAndRemovesOnlyManagedEntries() {
        manager.loadServerConfig(config()).join();

        manager.syncManagedServers(List.of(URI.create("http://localhost:10001"))).join();

        ServerDescriptor managed = manager.getServer(LOCAL_2);
        assertThat(managed.isManaged()).isTrue();
        assertThat(managed.getPsk()).isNotBlank();
        assertThat(managed.getKind()).isEqualTo(ServerKind.LOCAL);

        manager.loadServerConfig(config()).join();
        assertThat(manager.getServers()).extracting(ServerDescriptor::getUrl)
                .containsExactly(LOCAL_2, LOCAL, REMOTE);
        assertThat(manager.getServer(LOCAL_2).getPsk()).isEqualTo(managed.getPsk());

        Connection<?> connection = manager.connect(LOCAL_2).join();
        assertThat(factory.lastServer(LOCAL_2).getPsk()).isEqualTo(managed.getPsk());

        manager.syncManagedServers(List.of()).join();

        assertThat(manager.getServers()).extracting(ServerDescriptor::getUrl).containsExactly(LOCAL, REMOTE);
        assertThat(connection.isClosed()).isTrue();
        assertThat(disconnects).extracting(ServerDisconnectEvent::getReason).containsExactly(DisconnectReason.REMOVED);
    }

    // ==================== Connect / Disconnect ====================

    @Test
    void connectAndDisconnectRoundTrip() {
        manager.loadServerConfig(config()).join();

        Connection<?> first = manager.connect(URI.create("http://localhost:10000")).join();

        assertThat(first).isNotNull();
        assertThat(first.isConnected()).isTrue();
        assertThat(manager.hasConnection(LOCAL)).isTrue();
        assertThat(manager.getConnection(LOCAL)).isSameAs(first);
        assertThat(manager.getConnections()).containsExactly(first);
        assertThat(manager.getConnections(LOCAL)).containsExactly(first);
        assertThat(connects).singleElement().satisfies(event -> {
            assertThat(event.getServerUrl()).isEqualTo(LOCAL);
            assertThat(event.getConnection()).isSameAs(first);
        });

        manager.disconnect(LOCAL).join();

        assertThat(first.isClosed()).isTrue();
        assertThat(factory.session(LOCAL).getCloseCount()).isEqualTo(1);
        assertThat(manager.hasConnection(LOCAL)).isFalse();
        assertThat(manager.getConnection(LOCAL)).isNull();
        assertThat(disconnects).singleElement().satisfies(event -> {
            assertThat(event.getReason()).isEqualTo(DisconnectReason.REQUESTED);
            assertThat(event.isRequested()).isTrue();
        });

        Connection<?> second = manager.connect(LOCAL).join();

        assertThat(second).isNotNull().isNotSameAs(first);
        assertThat(factory.createCount(LOCAL)).isEqualTo(2);
    }

    @Test
    void connectToUnknownOrConnectedServerReturnsNull() {
        manager.loadServerConfig(config()).join();

        assertThat(manager.connect(URI.create("http://localhost:9999")).join()).isNull();
        assertThat(manager.connect(URI.create("https://unknown.example.com")).join()).isNull();

        assertThat(manager.connect(LOCAL).join()).isNotNull();
        assertThat(manager.connect(URI.create("http://127.0.0.1:10000")).join()).isNull();
        assertThat(factory.createCount(LOCAL)).isEqualTo(1);
    }

    @Test
    void concurrentConnectsShareOneConnection() {
        manager.loadServerConfig(config()).join();
        CompletableFuture<String> gate = new CompletableFuture<>();
        factory.clientGate = gate;

        CompletableFuture<Connection<?>> first = manager.connect(LOCAL);
        CompletableFuture<Connection<?>> second = manager.connect(LOCAL);

        assertThat(manager.hasConnection(LOCAL)).isTrue();
        assertThat(manager.getConnection(LOCAL)).isNotNull();
        assertThat(manager.getConnection(LOCAL).isConnected()).isFalse();
        assertThat(second.join()).isNull();
        assertThat(first).isNotDone();

        gate.complete("client");

        assertThat(first.join()).isNotNull();
        assertThat(factory.createCount(LOCAL)).isEqualTo(1);
        assertThat(connects).hasSize(1);
    }

    @Test
    void racingConnectsBringUpOneConnection() throws Exception {
        manager.loadServerConfig(config()).join();
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                CompletableFuture<String> gate = new CompletableFuture<>();
                factory.clientGate = gate;
                connects.clear();
                CyclicBarrier barrier = new CyclicBarrier(2);

                List<Future<CompletableFuture<Connection<?>>>> attempts = new ArrayList<>();
                for (int i = 0; i < 2; i++) {
                    attempts.add(callers.submit(() -> {
                        barrier.await(5, TimeUnit.SECONDS);
                        return manager.connect(LOCAL);
                    }));
                }
                List<CompletableFuture<Connection<?>>> results = new ArrayList<>();
                for (Future<CompletableFuture<Connection<?>>> attempt : attempts) {
                    results.add(attempt.get(5, TimeUnit.SECONDS));
                }
                gate.complete("client");

                assertThat(results).filteredOn(result -> result.join() != null).hasSize(1);
                assertThat(connects).hasSize(1);

                manager.disconnect(LOCAL).join();
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void failedConnectClearsSlotForRetry() {
        manager.loadServerConfig(config()).join();
        factory.failSessions = true;

        assertThat(manager.connect(LOCAL).join()).isNull();

        assertThat(manager.hasConnection(LOCAL)).isFalse();
        assertThat(factory.connection(LOCAL).isClosed()).isTrue();
        assertThat(connects).isEmpty();

        factory.failSessions = false;
        Connection<?> connection = manager.connect(LOCAL).join();

        assertThat(connection).isNotNull();
        assertThat(connection.isConnected()).isTrue();
        assertThat(factory.createCount(LOCAL)).isEqualTo(2);
    }

    @Test
    void failedFactoryClearsSlot() {
        manager.loadServerConfig(config()).join();
        factory.failCreate = true;

        assertThat(manager.connect(LOCAL).join()).isNull();
        assertThat(manager.hasConnection(LOCAL)).isFalse();
    }

    @Test
    void disconnectDuringBringUpDropsConnection() {
        manager.loadServerConfig(config()).join();
        CompletableFuture<String> gate = new CompletableFuture<>();
        factory.clientGate = gate;

        CompletableFuture<Connection<?>> connecting = manager.connect(LOCAL);
        manager.disconnect(LOCAL).join();
        gate.complete("client");

        assertThat(connecting.join()).isNull();
        assertThat(manager.hasConnection(LOCAL)).isFalse();
        assertThat(connects).isEmpty();
        assertThat(disconnects).extracting(ServerDisconnectEvent::getReason).containsExactly(DisconnectReason.REQUESTED);
    }

    @Test
    void disconnectOfFailedBringUpFiresNoEvent() {
        manager.loadServerConfig(config()).join();
        CompletableFuture<Void> gate = new CompletableFuture<>();
        factory.createGate = gate;

        CompletableFuture<Connection<?>> connecting = manager.connect(LOCAL);
        CompletableFuture<Void> disconnecting = manager.disconnect(LOCAL);
        gate.completeExceptionally(new IllegalStateException("no transport"));

        assertThat(connecting.join()).isNull();
        disconnecting.join();
        assertThat(disconnects).isEmpty();
        assertThat(manager.hasConnection(LOCAL)).isFalse();
    }

    @Test
    void disconnectWithoutConnectionIsNoOp() {
        manager.loadServerConfig(config()).join();

        manager.disconnect(LOCAL).join();

        assertThat(disconnects).isEmpty();
    }

    @Test
    void droppedSessionDisconnectsServer() {
        manager.loadServerConfig(config()).join();
        Connection<?> connection = manager.connect(LOCAL).join();

        factory.session(LOCAL).dropTransport();

        assertThat(manager.hasConnection(LOCAL)).isFalse();
        assertThat(connection.isClosed()).isTrue();
        assertThat(disconnects).singleElement()
                .extracting(ServerDisconnectEvent::getReason)
                .isEqualTo(DisconnectReason.SESSION_DROPPED);
    }

    @Test
    void sessionDroppedDuringBringUpIsTornDown() {
        manager.loadServerConfig(config()).join();
        factory.notifier = new ConnectionNotifier() {
            @Override
            public void info(String message) {
                if (message.startsWith("Created session")) {
                    factory.session(LOCAL).dropTransport();
                }
            }

            @Override
            public void error(String message) {
            }
        };

        Connection<?> connection = manager.connect(LOCAL).join();

        assertThat(connection).isNull();
        assertThat(manager.hasConnection(LOCAL)).isFalse();
        assertThat(factory.connection(LOCAL).isClosed()).isTrue();
        assertThat(connects).isEmpty();
        assertThat(disconnects).singleElement()
                .extracting(ServerDisconnectEvent::getReason)
                .isEqualTo(DisconnectReason.SESSION_DROPPED);

        factory.notifier = new LoggingConnectionNotifier();
        assertThat(manager.connect(LOCAL).join()).isNotNull();
    }

    @Test
    void expiredSessionDuringCommandDisconnectsServer() {
        manager.loadServerConfig(config()).join();
        Connection<?> connection = manager.connect(LOCAL).join();
        factory.session(LOCAL).respondWith(code -> CompletableFuture.failedFuture(
                new TransportException(ConnectionErrors.CODE_UNAUTHENTICATED, "expired")));

        RunCodeResult result = connection.runCode("python", "x = 1").join();

        assertThat(result.isRetryRequired()).isTrue();
        assertThat(manager.hasConnection(LOCAL)).isFalse();
        assertThat(disconnects).extracting(ServerDisconnectEvent::getReason)
                .containsExactly(DisconnectReason.SESSION_DROPPED);
    }

    // ==================== Resource Bindings ====================

    @Test
    void bindingsFollowConnectionLifecycle() {
        manager.loadServerConfig(config()).join();
        Connection<?> local = manager.connect(LOCAL).join();
        Connection<?> remote = manager.connect(REMOTE).join();
        URI notebook = URI.create("file:///work/analysis.py");
        URI cell = URI.create("vscode-notebook-cell:/work/nb.ipynb#cell1");
        List<ResourceBoundEvent> bound = new ArrayList<>();
        manager.onResourceBound(bound::add);

        manager.bindResource(notebook, "python", local).join();
        manager.bindResource(cell, local);
        manager.bindResource(notebook, remote);

        assertThat(manager.getResourceConnection(notebook)).isSameAs(remote);
        assertThat(manager.getBoundResources(local)).containsExactly(cell);
        assertThat(bound).hasSize(3);
        assertThat(bound.get(2).getPrevious()).isSameAs(local);

        List<Boolean> boundAtDisconnect = new ArrayList<>();
        manager.onDisconnect(event -> boundAtDisconnect.add(manager.hasBoundResources(local)));
        manager.disconnect(LOCAL).join();

        assertThat(boundAtDisconnect).containsExactly(false);
        assertThat(manager.getResourceConnection(cell)).isNull();
        assertThat(manager.getResourceConnection(notebook)).isSameAs(remote);

        assertThat(manager.unbindResource(notebook)).isTrue();
        assertThat(manager.unbindResource(notebook)).isFalse();
    }

    @Test
    void bindingUnsupportedConsoleTypeFails() {
        manager.loadServerConfig(config()).join();
        Connection<?> local = manager.connect(LOCAL).join();
        URI script = URI.create("file:///work/script.groovy");

        assertThatThrownBy(() -> manager.bindResource(script, "groovy", local).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(UnsupportedConsoleTypeException.class);
        assertThat(manager.getResourceConnection(script)).isNull();
        assertThat(local.isConnected()).isTrue();
    }

    // ==================== Status ====================

    @Test
    void serverStoppingDisconnectsExactlyOnce() {
        probe.setReachable(LOCAL, true);
        manager.loadServerConfig(config()).join();
        Connection<?> connection = manager.connect(LOCAL).join();
        statusChanges.clear();

        probe.setReachable(LOCAL, false);
        manager.updateStatus().join();
        manager.updateStatus().join();

        assertThat(manager.getServer(LOCAL).isRunning()).isFalse();
        assertThat(connection.isClosed()).isTrue();
        assertThat(disconnects).singleElement()
                .extracting(ServerDisconnectEvent::getReason)
                .isEqualTo(DisconnectReason.SERVER_STOPPED);
        assertThat(statusChanges).singleElement().satisfies(event -> {
            assertThat(event.becameUnreachable()).isTrue();
            assertThat(event.getPrevious().isRunning()).isTrue();
        });
    }

    @Test
    void updateStatusCanBeLimitedToSomeServers() {
        manager.loadServerConfig(config()).join();
        probe.calls.clear();
        probe.setReachable(LOCAL, true);
        probe.setReachable(REMOTE, true);

        manager.updateStatus(List.of(URI.create("https://gateway.example.com:8123"))).join();

        assertThat(probe.calls).containsExactly(REMOTE);
        assertThat(manager.getServer(REMOTE).isRunning()).isTrue();
        assertThat(manager.getServer(LOCAL).isRunning()).isFalse();
    }

    @Test
    void failingProbeDoesNotAffectOtherServers() {
        ServerManagerConfig config = config();
        config.getLocalServers().add(new ServerEntry(LOCAL_2.toString(), null, null));
        probe.setReachable(REMOTE, true);
        probe.throwing.add(LOCAL);
        probe.failing.add(LOCAL_2);

        manager.loadServerConfig(config).join();

        assertThat(manager.getServer(LOCAL).isRunning()).isFalse();
        assertThat(manager.getServer(LOCAL_2).isRunning()).isFalse();
        assertThat(manager.getServer(REMOTE).isRunning()).isTrue();
        assertThat(manager.hasEverUpdatedStatus()).isTrue();
    }

    @Test
    void statusPollingPicksUpChanges() {
        manager.loadServerConfig(config()).join();

        manager.startStatusPolling();
        assertThat(manager.isStatusPolling()).isTrue();

        probe.setReachable(REMOTE, true);
        await().atMost(Duration.ofSeconds(3)).until(() -> manager.getServer(REMOTE).isRunning());

        manager.stopStatusPolling();
        assertThat(manager.isStatusPolling()).isFalse();
    }

    @Test
    void awaitServerRunningResolvesOnceReachable() {
        manager.loadServerConfig(config()).join();
        probe.reachableAfter(LOCAL, 3);

        CancellablePoll poll = manager.awaitServerRunning(LOCAL, 10, 5_000L);

        assertThat(poll.getFuture().join()).isTrue();
        assertThat(manager.getServer(LOCAL).isRunning()).isTrue();
    }

    @Test
    void filtersServersByStateKindAndConnections() {
        probe.setReachable(LOCAL, true);
        manager.loadServerConfig(config()).join();
        manager.syncManagedServers(List.of(LOCAL_2)).join();
        manager.connect(REMOTE).join();

        assertThat(manager.getServers(ServerFilter.all())).hasSize(3);
        assertThat(manager.getServers(new ServerFilter().setRunning(true)))
                .extracting(ServerDescriptor::getUrl).containsExactly(LOCAL);
        assertThat(manager.getServers(new ServerFilter().setHasConnections(true)))
                .extracting(ServerDescriptor::getUrl).containsExactly(REMOTE);
        assertThat(manager.getServers(new ServerFilter().setKind(ServerKind.LOCAL).setManaged(false)))
                .extracting(ServerDescriptor::getUrl).containsExactly(LOCAL);
        assertThat(manager.getServers(new ServerFilter().setManaged(true)))
                .extracting(ServerDescriptor::getUrl).containsExactly(LOCAL_2);

        assertThat(manager.getStats().totalServers()).isEqualTo(3);
        assertThat(manager.getStats().managedServers()).isEqualTo(1);
    }

    // ==================== Lifecycle ====================

    @Test
    void closeDisconnectsEverythingWithShutdownReason() {
        manager.loadServerConfig(config()).join();
        Connection<?> local = manager.connect(LOCAL).join();
        Connection<?> remote = manager.connect(REMOTE).join();

        manager.close();

        assertThat(manager.isClosed()).isTrue();
        assertThat(local.isClosed()).isTrue();
        assertThat(remote.isClosed()).isTrue();
        assertThat(disconnects).extracting(ServerDisconnectEvent::getReason)
                .containsOnly(DisconnectReason.SHUTDOWN)
                .hasSize(2);
        assertThat(manager.getServers()).isEmpty();
        assertThatThrownBy(() -> manager.connect(LOCAL)).isInstanceOf(IllegalStateException.class);
        assertThat(scheduler.isShutdown()).isFalse();
    }

    @Test
    void updateListenersSeeChanges() {
        manager.loadServerConfig(config()).join();
        int before = updates.get();

        manager.connect(LOCAL).join();

        assertThat(updates.get()).isGreaterThan(before);
    }

    private static ServerManagerConfig config() {
        ServerManagerConfig config = new ServerManagerConfig();
        config.getLocalServers().add(new ServerEntry("http://localhost:10000", null, "python"));
        config.getRemoteServers().add(new ServerEntry("https://gateway.example.com:8123", "Gateway", null));
        config.setStatusPollIntervalMillis(50);
        return config;
    }

    /**
     * Builds real connections on top of in-memory sessions.
     */
    private static final class TestConnectionFactory implements ConnectionFactory {

        private final Map<URI, AtomicInteger> creates = new ConcurrentHashMap<>();
        private final Map<URI, Connection<String>> connections = new ConcurrentHashMap<>();
        private final Map<URI, FakeServerSession> sessions = new ConcurrentHashMap<>();
        private final Map<URI, ServerDescriptor> servers = new ConcurrentHashMap<>();

        private volatile CompletableFuture<Void> createGate;
        private volatile CompletableFuture<String> clientGate;
        private volatile ConnectionNotifier notifier = new LoggingConnectionNotifier();
        private volatile boolean failSessions;
        private volatile boolean failCreate;

        @Override
        public CompletableFuture<Connection<?>> create(ServerDescriptor server) {
            if (failCreate) {
                return CompletableFuture.failedFuture(new IllegalStateException("no transport"));
            }
            CompletableFuture<Void> gate = createGate;
            if (gate != null) {
                return gate.thenCompose(ignored -> build(server));
            }
            return build(server);
        }

        private CompletableFuture<Connection<?>> build(ServerDescriptor server) {
            URI url = server.getUrl();
            creates.computeIfAbsent(url, u -> new AtomicInteger()).incrementAndGet();
            servers.put(url, server);

            Connection<String> connection = new Connection<String>(
                    url,
                    null,
                    serverUrl -> clientGate != null ? clientGate : CompletableFuture.completedFuture("client"),
                    (serverUrl, client) -> openSession(serverUrl),
                    notifier);
            connections.put(url, connection);
            return CompletableFuture.completedFuture(connection);
        }

        private CompletableFuture<ServerSession> openSession(URI url) {
            if (failSessions) {
                return CompletableFuture.failedFuture(
                        new TransportException(ConnectionErrors.CODE_UNAVAILABLE, "unavailable"));
            }
            FakeServerSession session = FakeServerSession.python();
            sessions.put(url, session);
            return CompletableFuture.completedFuture(session);
        }

        int createCount(URI url) {
            AtomicInteger count = creates.get(url);
            return count != null ? count.get() : 0;
        }

        Connection<String> connection(URI url) {
            return connections.get(url);
        }

        FakeServerSession session(URI url) {
            return sessions.get(url);
        }

        ServerDescriptor lastServer(URI url) {
            return servers.get(url);
        }
    }

    /**
     * Reachability answered from a table, with injectable failures.
     */
    private static final class TestProbe implements ReachabilityProbe {

        private final Map<URI, Boolean> reachable = new ConcurrentHashMap<>();
        private final Map<URI, AtomicInteger> countdowns = new ConcurrentHashMap<>();
        private final List<URI> throwing = new CopyOnWriteArrayList<>();
        private final List<URI> failing = new CopyOnWriteArrayList<>();
        private final List<URI> calls = new CopyOnWriteArrayList<>();

        void setReachable(URI url, boolean value) {
            reachable.put(url, value);
        }

        void reachableAfter(URI url, int attempts) {
            countdowns.put(url, new AtomicInteger(attempts));
        }

        @Override
        public CompletableFuture<Boolean> isReachable(URI serverUrl, ServerKind kind) {
            calls.add(serverUrl);
            if (throwing.contains(serverUrl)) {
                throw new IllegalStateException("probe crashed");
            }
            if (failing.contains(serverUrl)) {
                return CompletableFuture.failedFuture(new IllegalStateException("connection refused"));
            }

            AtomicInteger countdown = countdowns.get(serverUrl);
            if (countdown != null) {
                return CompletableFuture.completedFuture(countdown.decrementAndGet() <= 0);
            }
            return CompletableFuture.completedFuture(reachable.getOrDefault(serverUrl, false));
        }
    }
}
