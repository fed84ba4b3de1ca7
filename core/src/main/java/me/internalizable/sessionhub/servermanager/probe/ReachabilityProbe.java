package me.internalizable.sessionhub.servermanager.probe;

import me.internalizable.sessionhub.servermanager.registry.ServerKind;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Answers "is this server up" for status refresh.
 *
 * <p>Implementations should resolve {@code false} rather than fail; a failed
 * future is treated as unreachable anyway.</p>
 */
@FunctionalInterface
public interface ReachabilityProbe {

    @Nonnull
    CompletableFuture<Boolean> isReachable(@Nonnull URI serverUrl, @Nonnull ServerKind kind);
}
