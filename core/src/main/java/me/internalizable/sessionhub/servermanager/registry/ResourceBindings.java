package me.internalizable.sessionhub.servermanager.registry;

import me.internalizable.sessionhub.servermanager.connection.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Associates caller resources (open documents, notebook cells) with the
 * connection serving them.
 */
public class ResourceBindings {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBindings.class);

    private final Map<URI, Connection<?>> bindings = new ConcurrentHashMap<>();

    /**
     * Bind a resource, replacing any previous binding.
     *
     * @param resourceId resource identifier
     * @param connection serving connection
     * @return the previously bound connection, or null
     */
    @Nullable
    public Connection<?> bind(@Nonnull URI resourceId, @Nonnull Connection<?> connection) {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(connection, "connection");
        Connection<?> previous = bindings.put(resourceId, connection);
        LOGGER.debug("Bound {} to {}", resourceId, connection.getServerUrl());
        return previous;
    }

    /**
     * Remove a resource's binding.
     *
     * @param resourceId resource identifier
     * @return the connection it was bound to, or null
     */
    @Nullable
    public Connection<?> unbind(@Nonnull URI resourceId) {
        Objects.requireNonNull(resourceId, "resourceId");
        return bindings.remove(resourceId);
    }

    /**
     * Remove every binding to a connection.
     *
     * @param connection the connection
     * @return resources that were bound to it
     */
    @Nonnull
    public List<URI> unbindAll(@Nonnull Connection<?> connection) {
        List<URI> resources = getBoundResources(connection);
        for (URI resource : resources) {
            bindings.remove(resource, connection);
        }
        if (!resources.isEmpty()) {
            LOGGER.debug("Unbound {} resources from {}", resources.size(), connection.getServerUrl());
        }
        return resources;
    }

    @Nullable
    public Connection<?> get(@Nonnull URI resourceId) {
        Objects.requireNonNull(resourceId, "resourceId");
        return bindings.get(resourceId);
    }

    @Nonnull
    public List<URI> getBoundResources(@Nonnull Connection<?> connection) {
        Objects.requireNonNull(connection, "connection");
        return bindings.entrySet().stream()
                .filter(e -> e.getValue() == connection)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public boolean hasBoundResources(@Nonnull Connection<?> connection) {
        Objects.requireNonNull(connection, "connection");
        return bindings.containsValue(connection);
    }

    public int size() {
        return bindings.size();
    }

    public void clear() {
        bindings.clear();
    }
}
