package me.internalizable.sessionhub.servermanager.connection;

import me.internalizable.sessionhub.servermanager.event.EventChannel;
import me.internalizable.sessionhub.servermanager.event.Subscription;
import me.internalizable.sessionhub.servermanager.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Client and session to one analytic server.
 *
 * <p>Bring-up runs in two steps, "acquire authenticated client" and "open
 * session", each memoized on the instance so concurrent callers share one
 * attempt. The protocol-specific parts are injected as a
 * {@link CredentialProvider} and a {@link SessionOpener}.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * UNINITIALIZED → ACQUIRING_CLIENT → ACQUIRING_SESSION → READY
 * </pre>
 * <p>A failed step, a transport disconnect or an expired session tears the
 * instance down to {@link ConnectionState#UNINITIALIZED}, from where a new
 * bring-up starts clean. {@link #close()} moves it to
 * {@link ConnectionState#DISCONNECTED} for good.</p>
 *
 * @param <C> client type produced by the credential provider
 */
public class Connection<C> implements ConnectionHandle, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);

    private final URI serverUrl;
    private final String tagId;
    private final CredentialProvider<C> credentialProvider;
    private final SessionOpener<C> sessionOpener;
    private final ConnectionNotifier notifier;
    private final Consumer<LogMessage> logSink;

    private final EventChannel<VariableChanges> onVariableChanges;
    private final EventChannel<URI> onDisconnected;

    private final Object lock = new Object();

    // Guarded by lock
    private CompletableFuture<C> clientFuture;
    private CompletableFuture<ServerSession> sessionFuture;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private boolean closed = false;

    private volatile C client;
    private volatile ServerSession session;
    private volatile ConnectionState state = ConnectionState.UNINITIALIZED;

    private final AtomicInteger runningCommands = new AtomicInteger();

    /**
     * Create a connection whose server log messages go to this class's logger.
     *
     * @param serverUrl server URL
     * @param tagId optional correlation id
     * @param credentialProvider produces the authenticated client
     * @param sessionOpener opens the session on the client
     * @param notifier receives user-facing messages
     */
    public Connection(
            @Nonnull URI serverUrl,
            @Nullable String tagId,
            @Nonnull CredentialProvider<C> credentialProvider,
            @Nonnull SessionOpener<C> sessionOpener,
            @Nonnull ConnectionNotifier notifier) {
        this(serverUrl, tagId, credentialProvider, sessionOpener, notifier, null);
    }

    /**
     * Create a connection.
     *
     * @param serverUrl server URL
     * @param tagId optional correlation id
     * @param credentialProvider produces the authenticated client
     * @param sessionOpener opens the session on the client
     * @param notifier receives user-facing messages
     * @param logSink receives server log messages above INFO; null to log them
     */
    public Connection(
            @Nonnull URI serverUrl,
            @Nullable String tagId,
            @Nonnull CredentialProvider<C> credentialProvider,
            @Nonnull SessionOpener<C> sessionOpener,
            @Nonnull ConnectionNotifier notifier,
            @Nullable Consumer<LogMessage> logSink) {
        this.serverUrl = Objects.requireNonNull(serverUrl, "serverUrl");
        this.tagId = tagId;
        this.credentialProvider = Objects.requireNonNull(credentialProvider, "credentialProvider");
        this.sessionOpener = Objects.requireNonNull(sessionOpener, "sessionOpener");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.logSink = logSink != null ? logSink : this::logServerMessage;
        this.onVariableChanges = new EventChannel<>("variableChanges:" + serverUrl);
        this.onDisconnected = new EventChannel<>("disconnected:" + serverUrl);
    }

    // ==================== Bring-up ====================

    /**
     * Get the authenticated client, acquiring it on first use.
     *
     * @return future with the client; concurrent callers share one attempt
     */
    @Nonnull
    public CompletableFuture<C> getClient() {
        CompletableFuture<C> attempt;
        boolean created = false;

        synchronized (lock) {
            checkOpen();
            if (clientFuture == null) {
                clientFuture = new CompletableFuture<>();
                state = ConnectionState.ACQUIRING_CLIENT;
                created = true;
            }
            attempt = clientFuture;
        }

        if (created) {
            acquireClient(attempt);
        }
        return attempt;
    }

    private void acquireClient(CompletableFuture<C> attempt) {
        LOGGER.info("Creating client: {}", serverUrl);

        invoke(() -> credentialProvider.authenticate(serverUrl)).whenComplete((acquired, error) -> {
            if (error == null) {
                boolean current;
                synchronized (lock) {
                    current = clientFuture == attempt;
                    if (current) {
                        client = acquired;
                    }
                }
                if (!current) {
                    closeClient(acquired);
                    attempt.completeExceptionally(new CancellationException("Connection was reset: " + serverUrl));
                    return;
                }
                attempt.complete(acquired);
                return;
            }

            if (isCurrentClient(attempt)) {
                teardown(ConnectionState.UNINITIALIZED);
                report(error, "Failed to create client: " + serverUrl);
            }
            attempt.completeExceptionally(Futures.unwrap(error));
        });
    }

    /**
     * Bring the session up, acquiring the client first if needed.
     *
     * <p>On success the connection republishes the session's variable changes,
     * tears itself down when the transport disconnects and forwards server
     * log messages. On failure the connection is torn down, the user is
     * notified and the returned future fails with the original cause.</p>
     *
     * @return future completing once the session is ready; concurrent callers share one attempt
     */
    @Nonnull
    public CompletableFuture<Void> initSession() {
        CompletableFuture<ServerSession> attempt;
        boolean created = false;

        synchronized (lock) {
            checkOpen();
            if (sessionFuture == null) {
                sessionFuture = new CompletableFuture<>();
                created = true;
            }
            attempt = sessionFuture;
        }

        if (created) {
            openSession(attempt);
        }
        return attempt.thenApply(ignored -> null);
    }

    private void openSession(CompletableFuture<ServerSession> attempt) {
        getClient()
                .thenCompose(acquired -> {
                    synchronized (lock) {
                        if (sessionFuture != attempt) {
                            throw new CancellationException("Connection was reset: " + serverUrl);
                        }
                        state = ConnectionState.ACQUIRING_SESSION;
                    }
                    LOGGER.info("Creating session: {}", serverUrl);
                    return invoke(() -> sessionOpener.openSession(serverUrl, acquired));
                })
                .whenComplete((opened, error) -> {
                    if (error != null) {
                        // A failed client step already tore down and reported
                        if (isCurrentSession(attempt)) {
                            teardown(ConnectionState.UNINITIALIZED);
                            report(error, "Failed to create session: " + serverUrl);
                        }
                        attempt.completeExceptionally(Futures.unwrap(error));
                        return;
                    }

                    if (!activate(attempt, opened)) {
                        closeSession(opened);
                        attempt.completeExceptionally(new CancellationException("Connection was reset: " + serverUrl));
                        return;
                    }

                    LOGGER.info("Session ready: {}", serverUrl);
                    notifier.info("Created session: " + serverUrl);

                    // The transport may have dropped since activation
                    if (!isCurrentSession(attempt)) {
                        attempt.completeExceptionally(new CancellationException("Session dropped: " + serverUrl));
                        return;
                    }
                    attempt.complete(opened);
                });
    }

    private boolean activate(CompletableFuture<ServerSession> attempt, ServerSession opened) {
        synchronized (lock) {
            if (closed || sessionFuture != attempt) {
                return false;
            }

            session = opened;
            state = ConnectionState.READY;

            subscriptions.add(opened.onVariableChanges(onVariableChanges::fireSync));
            subscriptions.add(opened.onDisconnect(this::handleTransportDisconnect));
            subscriptions.add(opened.onLogMessage(this::forwardLogMessage));
            return true;
        }
    }

    private void handleTransportDisconnect() {
        LOGGER.info("Session disconnected by transport: {}", serverUrl);
        teardown(ConnectionState.UNINITIALIZED);
    }

    private void forwardLogMessage(LogMessage message) {
        if (!message.isInfo()) {
            logSink.accept(message);
        }
    }

    private void logServerMessage(LogMessage message) {
        String level = message.level().toUpperCase();
        if (level.startsWith("ERR") || level.equals("FATAL")) {
            LOGGER.error("[{}] {} {}", serverUrl, message.timestamp(), message.message());
        } else if (level.startsWith("WARN")) {
            LOGGER.warn("[{}] {} {}", serverUrl, message.timestamp(), message.message());
        } else {
            LOGGER.debug("[{}] {} {} {}", serverUrl, message.timestamp(), level, message.message());
        }
    }

    // ==================== Commands ====================

    /**
     * Run code in the session, bringing it up first if there is none.
     *
     * <p>Fails with {@link UnsupportedConsoleTypeException} if the session does
     * not accept {@code consoleType}; the connection stays up. If the
     * transport reports the session as expired, the connection is torn down
     * and the result asks the caller to reconnect and retry instead of
     * failing.</p>
     *
     * @param consoleType language of the code
     * @param code source text
     * @return future with the outcome
     */
    @Nonnull
    public CompletableFuture<RunCodeResult> runCode(@Nonnull String consoleType, @Nonnull String code) {
        Objects.requireNonNull(consoleType, "consoleType");
        Objects.requireNonNull(code, "code");

        CompletableFuture<Void> ready = session != null
                ? CompletableFuture.completedFuture(null)
                : initSession();

        return ready
                .thenCompose(ignored -> supportsConsoleType(consoleType))
                .thenCompose(supported -> {
                    if (!supported) {
                        throw new UnsupportedConsoleTypeException(serverUrl, consoleType);
                    }

                    ServerSession current = session;
                    if (current == null) {
                        return CompletableFuture.completedFuture(RunCodeResult.retryRequired());
                    }

                    LOGGER.debug("Sending code to {}: {}", serverUrl, code);
                    runningCommands.incrementAndGet();
                    return invoke(() -> current.runCode(code))
                            .whenComplete((result, error) -> runningCommands.decrementAndGet())
                            .handle((result, error) -> toRunCodeResult(result, error));
                });
    }

    private RunCodeResult toRunCodeResult(CommandResult result, Throwable error) {
        if (error != null) {
            if (ConnectionErrors.isSessionExpired(error)) {
                LOGGER.warn("Session expired while running code: {}", serverUrl);
                teardown(ConnectionState.UNINITIALIZED);
                notifier.error("Session is no longer valid. Please re-run the command to reconnect.");
                return RunCodeResult.retryRequired();
            }
            return commandFailed(String.valueOf(Futures.unwrap(error)));
        }

        if (result.hasError()) {
            return commandFailed(result.error());
        }

        if (!result.changes().isEmpty()) {
            onVariableChanges.fireSync(result.changes());
        }
        return RunCodeResult.succeeded(result.changes());
    }

    private RunCodeResult commandFailed(String error) {
        LOGGER.error("Command failed on {}: {}", serverUrl, error);
        notifier.error("An error occurred when running a command");
        return RunCodeResult.failed(error);
    }

    /**
     * Get the console types the current session accepts.
     *
     * @return console types, empty if there is no session
     */
    @Nonnull
    public CompletableFuture<Set<String>> getConsoleTypes() {
        ServerSession current = session;
        if (current == null) {
            return CompletableFuture.completedFuture(Set.of());
        }
        return invoke(current::getConsoleTypes);
    }

    /**
     * Check if the current session accepts a console type.
     *
     * @param consoleType console type
     * @return false if there is no session or the type is not supported
     */
    @Nonnull
    public CompletableFuture<Boolean> supportsConsoleType(@Nonnull String consoleType) {
        Objects.requireNonNull(consoleType, "consoleType");
        return getConsoleTypes().thenApply(types -> types.contains(consoleType));
    }

    // ==================== Events ====================

    /**
     * Listen for variable changes, from commands run through this connection
     * and from server pushes.
     *
     * @param listener change listener
     * @return subscription
     */
    @Nonnull
    public Subscription onVariableChanges(@Nonnull Consumer<VariableChanges> listener) {
        return onVariableChanges.subscribe(listener);
    }

    /**
     * Listen for a live session going away, whatever the reason.
     *
     * @param listener receives the server URL
     * @return subscription
     */
    @Nonnull
    public Subscription onDisconnected(@Nonnull Consumer<URI> listener) {
        return onDisconnected.subscribe(listener);
    }

    // ==================== Teardown ====================

    private void teardown(ConnectionState next) {
        ServerSession closing;
        C releasedClient;
        List<Subscription> released;

        synchronized (lock) {
            clientFuture = null;
            sessionFuture = null;
            closing = session;
            releasedClient = client;
            session = null;
            client = null;
            released = new ArrayList<>(subscriptions);
            subscriptions.clear();
            state = next;
        }

        for (Subscription subscription : released) {
            try {
                subscription.unsubscribe();
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to release session subscription for {}", serverUrl, e);
            }
        }

        if (closing != null) {
            closeSession(closing);
        }
        closeClient(releasedClient);

        if (closing != null) {
            onDisconnected.fireSync(serverUrl);
        }
    }

    private void closeSession(ServerSession closing) {
        try {
            closing.close();
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to close session for {}", serverUrl, e);
        }
    }

    private void closeClient(@Nullable C releasing) {
        if (!(releasing instanceof AutoCloseable)) {
            return;
        }
        try {
            ((AutoCloseable) releasing).close();
        } catch (Exception e) {
            LOGGER.warn("Failed to close client for {}", serverUrl, e);
        }
    }

    /**
     * Tear the connection down for good. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        LOGGER.debug("Closing connection: {}", serverUrl);
        teardown(ConnectionState.DISCONNECTED);
        onVariableChanges.clear();
        onDisconnected.clear();
    }

    // ==================== Helpers ====================

    private void report(Throwable error, String defaultMessage) {
        Throwable cause = Futures.unwrap(error);
        LOGGER.error("{}", defaultMessage, cause);
        notifier.error(ConnectionErrors.toUserMessage(cause, serverUrl, defaultMessage));
    }

    private boolean isCurrentClient(CompletableFuture<C> attempt) {
        synchronized (lock) {
            return clientFuture == attempt;
        }
    }

    private boolean isCurrentSession(CompletableFuture<ServerSession> attempt) {
        synchronized (lock) {
            return sessionFuture == attempt;
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Connection closed: " + serverUrl);
        }
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("Collaborator returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // ==================== Getters ====================

    @Override
    @Nonnull
    public URI getServerUrl() {
        return serverUrl;
    }

    @Override
    @Nullable
    public String getTagId() {
        return tagId;
    }

    @Override
    public boolean isInitialized() {
        synchronized (lock) {
            return sessionFuture != null;
        }
    }

    @Override
    public boolean isConnected() {
        return client != null && session != null;
    }

    /**
     * Check if a command sent through {@link #runCode} has not completed yet.
     *
     * @return true while at least one command is in flight
     */
    public boolean isRunningCode() {
        return runningCommands.get() > 0;
    }

    @Nonnull
    public ConnectionState getState() {
        return state;
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    @Override
    public String toString() {
        return "Connection{" +
                "serverUrl=" + serverUrl +
                (tagId != null ? ", tagId='" + tagId + '\'' : "") +
                ", state=" + state +
                '}';
    }
}
