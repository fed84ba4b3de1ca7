package me.internalizable.sessionhub.servermanager.connection;

import me.internalizable.sessionhub.servermanager.util.Futures;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.Set;

/**
 * Classifies connection failures into user-facing messages.
 *
 * <p>Classification only picks the text shown to the user; it never changes
 * how the failure propagates.</p>
 */
public final class ConnectionErrors {

    public static final int CODE_DEADLINE_EXCEEDED = 4;
    public static final int CODE_PERMISSION_DENIED = 7;
    public static final int CODE_UNAVAILABLE = 14;
    public static final int CODE_UNAUTHENTICATED = 16;

    private static final Set<Integer> CONNECT_FAILURE_CODES = Set.of(
            CODE_DEADLINE_EXCEEDED,
            CODE_PERMISSION_DENIED,
            CODE_UNAVAILABLE,
            CODE_UNAUTHENTICATED
    );

    private ConnectionErrors() {
    }

    /**
     * Build the message shown to the user for a bring-up failure.
     *
     * @param error the failure, possibly wrapped by future composition
     * @param serverUrl server the failure belongs to
     * @param defaultMessage message for unclassified failures
     * @return user-facing message
     */
    @Nonnull
    public static String toUserMessage(@Nonnull Throwable error, @Nonnull URI serverUrl, @Nonnull String defaultMessage) {
        Throwable cause = Futures.unwrap(error);

        if (cause instanceof NoConsoleTypesException) {
            return "No console types available for server: " + serverUrl;
        }

        if (cause instanceof TransportException) {
            int code = ((TransportException) cause).getCode();
            if (isConnectFailure(code)) {
                return "Failed to connect to server with code: " + code + " " + serverUrl;
            }
        }

        return defaultMessage;
    }

    /**
     * Check for the transport code meaning the session is no longer valid.
     *
     * @param error the failure, possibly wrapped
     * @return true if the session expired
     */
    public static boolean isSessionExpired(@Nonnull Throwable error) {
        Throwable cause = Futures.unwrap(error);
        return cause instanceof TransportException
                && ((TransportException) cause).getCode() == CODE_UNAUTHENTICATED;
    }

    /**
     * Check if a transport code stands for a network or credential problem.
     *
     * @param code transport status code
     * @return true for known connect failures
     */
    public static boolean isConnectFailure(int code) {
        return CONNECT_FAILURE_CODES.contains(code);
    }
}
