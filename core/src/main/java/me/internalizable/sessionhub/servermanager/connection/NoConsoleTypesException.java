package me.internalizable.sessionhub.servermanager.connection;

/**
 * The server offers no console a session could be opened on.
 */
public class NoConsoleTypesException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NoConsoleTypesException() {
        super("No console types available");
    }
}
