package me.internalizable.sessionhub.servermanager.connection;

import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;

/**
 * Builds the connection object for a server. The returned connection is not
 * brought up yet; the caller decides when to {@link Connection#initSession()}.
 *
 * <p>Managed servers carry a pre-shared key ({@link ServerDescriptor#getPsk()})
 * that implementations hand to their credential provider.</p>
 */
@FunctionalInterface
public interface ConnectionFactory {

    @Nonnull
    CompletableFuture<Connection<?>> create(@Nonnull ServerDescriptor server);
}
