package me.internalizable.sessionhub.servermanager.connection;

import me.internalizable.sessionhub.servermanager.event.Subscription;

import javax.annotation.Nonnull;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Live session on an analytic server, as provided by the protocol client.
 */
public interface ServerSession {

    /**
     * Get the console types (languages) the session accepts.
     *
     * @return future with the supported console types
     */
    @Nonnull
    CompletableFuture<Set<String>> getConsoleTypes();

    /**
     * Execute code in the session.
     *
     * @param code source text
     * @return future with the command result; fails with {@link TransportException}
     *         on transport errors
     */
    @Nonnull
    CompletableFuture<CommandResult> runCode(@Nonnull String code);

    /**
     * Listen for variables the server created, updated or removed on its own.
     */
    @Nonnull
    Subscription onVariableChanges(@Nonnull Consumer<VariableChanges> listener);

    /**
     * Listen for the transport dropping the session.
     */
    @Nonnull
    Subscription onDisconnect(@Nonnull Runnable listener);

    /**
     * Listen for server log messages.
     */
    @Nonnull
    Subscription onLogMessage(@Nonnull Consumer<LogMessage> listener);

    /**
     * Close the underlying transport handle.
     */
    void close();
}
