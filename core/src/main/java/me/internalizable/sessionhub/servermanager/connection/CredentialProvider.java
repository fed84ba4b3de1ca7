package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Produces an authenticated client for a server.
 *
 * <p>How authentication works is up to the implementation; a
 * {@link Connection} only decides when to call it and what to do when it
 * fails.</p>
 *
 * @param <C> client type
 */
@FunctionalInterface
public interface CredentialProvider<C> {

    /**
     * Authenticate against a server.
     *
     * @param serverUrl server URL
     * @return future completing with the client, or failing if authentication failed
     */
    @Nonnull
    CompletableFuture<C> authenticate(@Nonnull URI serverUrl);
}
