package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;

/**
 * Receives user-facing connection messages (toasts, status lines).
 */
public interface ConnectionNotifier {

    void info(@Nonnull String message);

    void error(@Nonnull String message);
}
