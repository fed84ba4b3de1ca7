package me.internalizable.sessionhub.servermanager.util;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for working with {@link java.util.concurrent.CompletableFuture} failures.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strip the {@link CompletionException}/{@link ExecutionException} wrappers
     * that future composition adds around the original failure.
     *
     * @param error failure as observed in a completion stage
     * @return the underlying cause
     */
    @Nonnull
    public static Throwable unwrap(@Nonnull Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
