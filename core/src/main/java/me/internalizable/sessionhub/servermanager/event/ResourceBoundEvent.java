package me.internalizable.sessionhub.servermanager.event;

import me.internalizable.sessionhub.servermanager.connection.Connection;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.Objects;

/**
 * Event fired when a resource is bound to a connection.
 */
public class ResourceBoundEvent {

    private final URI resourceId;
    private final Connection<?> connection;
    private final Connection<?> previous;

    public ResourceBoundEvent(
            @Nonnull URI resourceId,
            @Nonnull Connection<?> connection,
            @Nullable Connection<?> previous) {
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.previous = previous;
    }

    @Nonnull
    public URI getResourceId() {
        return resourceId;
    }

    @Nonnull
    public Connection<?> getConnection() {
        return connection;
    }

    /**
     * Get the connection the resource was bound to before, if any.
     *
     * @return previous connection, or null
     */
    @Nullable
    public Connection<?> getPrevious() {
        return previous;
    }
}
