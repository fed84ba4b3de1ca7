package me.internalizable.sessionhub.servermanager.registry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Criteria for listing servers. Unset criteria match everything.
 */
public class ServerFilter {

    private Boolean running;
    private Boolean hasConnections;
    private ServerKind kind;
    private Boolean managed;

    /**
     * Filter matching every server.
     *
     * @return empty filter
     */
    @Nonnull
    public static ServerFilter all() {
        return new ServerFilter();
    }

    /**
     * Check a server against this filter.
     *
     * @param server the server
     * @param connected whether the server currently has a connection
     * @return true if every set criterion matches
     */
    public boolean matches(@Nonnull ServerDescriptor server, boolean connected) {
        return (running == null || server.isRunning() == running)
                && (hasConnections == null || connected == hasConnections)
                && (kind == null || server.getKind() == kind)
                && (managed == null || server.isManaged() == managed);
    }

    /**
     * Check if this filter needs to know about connections.
     *
     * @return true if the connection criterion is set
     */
    public boolean needsConnectionState() {
        return hasConnections != null;
    }

    @Nullable
    public Boolean getRunning() {
        return running;
    }

    public ServerFilter setRunning(@Nullable Boolean running) {
        this.running = running;
        return this;
    }

    @Nullable
    public Boolean getHasConnections() {
        return hasConnections;
    }

    public ServerFilter setHasConnections(@Nullable Boolean hasConnections) {
        this.hasConnections = hasConnections;
        return this;
    }

    @Nullable
    public ServerKind getKind() {
        return kind;
    }

    public ServerFilter setKind(@Nullable ServerKind kind) {
        this.kind = kind;
        return this;
    }

    @Nullable
    public Boolean getManaged() {
        return managed;
    }

    public ServerFilter setManaged(@Nullable Boolean managed) {
        this.managed = managed;
        return this;
    }
}
