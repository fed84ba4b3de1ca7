package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Outcome of {@link Connection#runCode}.
 */
public final class RunCodeResult {

    /**
     * How a command ended.
     */
    public enum Status {
        /**
         * The command ran without error.
         */
        SUCCEEDED,

        /**
         * The server reported an error for the command.
         */
        FAILED,

        /**
         * The session had expired and was torn down. Reconnect and run the
         * command again.
         */
        RETRY_REQUIRED
    }

    private static final RunCodeResult RETRY_REQUIRED =
            new RunCodeResult(Status.RETRY_REQUIRED, VariableChanges.empty(), null);

    private final Status status;
    private final VariableChanges changes;
    private final String error;

    private RunCodeResult(@Nonnull Status status, @Nonnull VariableChanges changes, @Nullable String error) {
        this.status = status;
        this.changes = changes;
        this.error = error;
    }

    @Nonnull
    public static RunCodeResult succeeded(@Nonnull VariableChanges changes) {
        return new RunCodeResult(Status.SUCCEEDED, Objects.requireNonNull(changes, "changes"), null);
    }

    @Nonnull
    public static RunCodeResult failed(@Nonnull String error) {
        return new RunCodeResult(Status.FAILED, VariableChanges.empty(), Objects.requireNonNull(error, "error"));
    }

    @Nonnull
    public static RunCodeResult retryRequired() {
        return RETRY_REQUIRED;
    }

    @Nonnull
    public Status getStatus() {
        return status;
    }

    @Nonnull
    public VariableChanges getChanges() {
        return changes;
    }

    /**
     * Get the server error text.
     *
     * @return error, or null unless {@link Status#FAILED}
     */
    @Nullable
    public String getError() {
        return error;
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public boolean isRetryRequired() {
        return status == Status.RETRY_REQUIRED;
    }

    @Override
    public String toString() {
        return "RunCodeResult{" +
                "status=" + status +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
