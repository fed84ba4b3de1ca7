package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nullable;

/**
 * Failure reported by the protocol transport, carrying its status code.
 */
public class TransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int code;

    /**
     * Create a transport exception.
     *
     * @param code transport status code (gRPC style)
     * @param message description
     */
    public TransportException(int code, @Nullable String message) {
        super(message);
        this.code = code;
    }

    public TransportException(int code, @Nullable String message, @Nullable Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
