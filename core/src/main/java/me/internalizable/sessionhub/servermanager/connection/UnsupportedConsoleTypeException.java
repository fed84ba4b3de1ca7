package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import java.net.URI;

/**
 * A connection was asked to work with a console type its session does not
 * support. The connection itself stays intact.
 */
public class UnsupportedConsoleTypeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String consoleType;

    public UnsupportedConsoleTypeException(@Nonnull URI serverUrl, @Nonnull String consoleType) {
        super("Connection '" + serverUrl + "' does not support '" + consoleType + "'.");
        this.consoleType = consoleType;
    }

    @Nonnull
    public String getConsoleType() {
        return consoleType;
    }
}
