package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens a session on an authenticated client.
 *
 * <p>Implementations should fail with {@link NoConsoleTypesException} when
 * the server offers no console to open a session on.</p>
 *
 * @param <C> client type
 */
@FunctionalInterface
public interface SessionOpener<C> {

    @Nonnull
    CompletableFuture<ServerSession> openSession(@Nonnull URI serverUrl, @Nonnull C client);
}
