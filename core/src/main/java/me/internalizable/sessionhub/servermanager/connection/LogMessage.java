package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Objects;

/**
 * Log line pushed by a server session.
 *
 * @param level server log level, e.g. {@code INFO}, {@code WARN}, {@code ERROR}
 * @param message log text
 * @param timestamp server-side timestamp
 */
public record LogMessage(@Nonnull String level, @Nonnull String message, @Nonnull Instant timestamp) {

    public LogMessage {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean isInfo() {
        return "INFO".equalsIgnoreCase(level);
    }
}
