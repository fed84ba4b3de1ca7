package me.internalizable.sessionhub.servermanager.event;

import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Event fired after a configuration was applied and the first status refresh ran.
 */
public class ConfigLoadedEvent {

    private final List<ServerDescriptor> servers;
    private final List<ServerDescriptor> removed;

    /**
     * Create a config loaded event.
     *
     * @param servers servers now registered
     * @param removed servers dropped by the new configuration
     */
    public ConfigLoadedEvent(@Nonnull List<ServerDescriptor> servers, @Nonnull List<ServerDescriptor> removed) {
        this.servers = List.copyOf(Objects.requireNonNull(servers, "servers"));
        this.removed = List.copyOf(Objects.requireNonNull(removed, "removed"));
    }

    @Nonnull
    public List<ServerDescriptor> getServers() {
        return servers;
    }

    @Nonnull
    public List<ServerDescriptor> getRemoved() {
        return removed;
    }
}
