package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Raw result of executing code in a session.
 *
 * @param changes variables touched by the command
 * @param error server-side error text, null or empty on success
 */
public record CommandResult(@Nonnull VariableChanges changes, @Nullable String error) {

    public CommandResult {
        Objects.requireNonNull(changes, "changes");
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }
}
