package me.internalizable.sessionhub.servermanager.poll;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A running {@link MinIntervalPoller#pollUntilTrue poll-until-true} operation.
 */
public final class CancellablePoll {

    private final CompletableFuture<Boolean> future;

    CancellablePoll(@Nonnull CompletableFuture<Boolean> future) {
        this.future = Objects.requireNonNull(future, "future");
    }

    /**
     * Get the future completing with {@code true} once the predicate held.
     *
     * @return the poll result
     */
    @Nonnull
    public CompletableFuture<Boolean> getFuture() {
        return future;
    }

    /**
     * Stop polling. The future fails with {@link PollingCancelledException}
     * unless it already completed.
     */
    public void cancel() {
        future.completeExceptionally(new PollingCancelledException());
    }

    public boolean isDone() {
        return future.isDone();
    }
}
