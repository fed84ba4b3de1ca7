package me.internalizable.sessionhub.servermanager.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory table of known servers, keyed by normalized URL.
 *
 * <p>Iteration follows registration order, which is the order servers are
 * listed and the order ties are broken in when resolving a URL.</p>
 *
 * <h2>URL resolution</h2>
 * <p>{@link #getServer(URI)} first looks for an exact match. Failing that,
 * a loopback URL matches a loopback server on the same port, with every
 * loopback name treated as equivalent; any other URL matches a server on the
 * same host whatever the port.</p>
 */
public class ServerRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerRegistry.class);

    // Guarded by this
    private final Map<URI, ServerDescriptor> servers = new LinkedHashMap<>();

    /**
     * Register a server, replacing any server with the same URL.
     *
     * @param server the server
     * @return the replaced server, or null
     */
    @Nullable
    public synchronized ServerDescriptor register(@Nonnull ServerDescriptor server) {
        Objects.requireNonNull(server, "server");
        ServerDescriptor previous = servers.put(server.getUrl(), server);
        LOGGER.debug("Registered server: {}", server.getUrl());
        return previous;
    }

    /**
     * Unregister a server.
     *
     * @param url exact server URL, normalized before lookup
     * @return the removed server, or null if not found
     */
    @Nullable
    public synchronized ServerDescriptor unregister(@Nonnull URI url) {
        Objects.requireNonNull(url, "url");
        ServerDescriptor removed = servers.remove(ServerUrls.normalize(url));
        if (removed != null) {
            LOGGER.debug("Unregistered server: {}", removed.getUrl());
        }
        return removed;
    }

    /**
     * Replace the whole table.
     *
     * <p>Servers that survive the replacement keep their current running
     * flag. When the same URL appears twice, the later entry wins.</p>
     *
     * @param next the new servers, in order
     * @return the servers that are no longer registered
     */
    @Nonnull
    public synchronized List<ServerDescriptor> replaceAll(@Nonnull Collection<ServerDescriptor> next) {
        Objects.requireNonNull(next, "next");

        Map<URI, ServerDescriptor> rebuilt = new LinkedHashMap<>();
        for (ServerDescriptor server : next) {
            ServerDescriptor previous = servers.get(server.getUrl());
            rebuilt.put(server.getUrl(), previous != null ? server.withRunning(previous.isRunning()) : server);
        }

        List<ServerDescriptor> removed = servers.values().stream()
                .filter(s -> !rebuilt.containsKey(s.getUrl()))
                .collect(Collectors.toList());

        servers.clear();
        servers.putAll(rebuilt);

        LOGGER.debug("Replaced server table: {} servers, {} removed", servers.size(), removed.size());
        return removed;
    }

    /**
     * Set the running flag of a server.
     *
     * @param url exact server URL
     * @param running new status
     * @return the updated server if the flag changed, otherwise null
     */
    @Nullable
    public synchronized ServerDescriptor updateRunning(@Nonnull URI url, boolean running) {
        URI key = ServerUrls.normalize(url);
        ServerDescriptor current = servers.get(key);
        if (current == null || current.isRunning() == running) {
            return null;
        }

        ServerDescriptor updated = current.withRunning(running);
        servers.put(key, updated);
        return updated;
    }

    /**
     * Resolve a URL to a server using the locality-aware rule.
     *
     * @param url request URL
     * @return the server, or null if nothing matches
     */
    @Nullable
    public synchronized ServerDescriptor getServer(@Nonnull URI url) {
        Objects.requireNonNull(url, "url");
        URI key = ServerUrls.normalize(url);

        ServerDescriptor exact = servers.get(key);
        if (exact != null) {
            return exact;
        }

        if (ServerUrls.isLoopback(key.getHost())) {
            int port = ServerUrls.effectivePort(key);
            for (ServerDescriptor server : servers.values()) {
                URI candidate = server.getUrl();
                if (ServerUrls.isLoopback(candidate.getHost()) && ServerUrls.effectivePort(candidate) == port) {
                    return server;
                }
            }
            return null;
        }

        String host = key.getHost().toLowerCase(Locale.ROOT);
        for (ServerDescriptor server : servers.values()) {
            if (host.equals(server.getUrl().getHost())) {
                return server;
            }
        }
        return null;
    }

    /**
     * Get a server by exact normalized URL.
     *
     * @param url server URL
     * @return the server, or null if not found
     */
    @Nullable
    public synchronized ServerDescriptor getExact(@Nonnull URI url) {
        return servers.get(ServerUrls.normalize(url));
    }

    /**
     * Check if a server with this exact URL is registered.
     *
     * @param url server URL
     * @return true if registered
     */
    public synchronized boolean hasServer(@Nonnull URI url) {
        return servers.containsKey(ServerUrls.normalize(url));
    }

    /**
     * Get all servers.
     *
     * @return snapshot in registration order
     */
    @Nonnull
    public synchronized List<ServerDescriptor> getAllServers() {
        return new ArrayList<>(servers.values());
    }

    /**
     * Get servers matching a predicate.
     *
     * @param predicate filter predicate
     * @return snapshot of matching servers
     */
    @Nonnull
    public synchronized List<ServerDescriptor> getServers(@Nonnull Predicate<ServerDescriptor> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return servers.values().stream()
                .filter(predicate)
                .collect(Collectors.toList());
    }

    @Nonnull
    public List<ServerDescriptor> getManagedServers() {
        return getServers(ServerDescriptor::isManaged);
    }

    @Nonnull
    public List<ServerDescriptor> getServersByKind(@Nonnull ServerKind kind) {
        Objects.requireNonNull(kind, "kind");
        return getServers(s -> s.getKind() == kind);
    }

    public synchronized int getServerCount() {
        return servers.size();
    }

    /**
     * Get registry statistics.
     *
     * @return statistics object
     */
    @Nonnull
    public synchronized RegistryStats getStats() {
        int local = 0;
        int remote = 0;
        int running = 0;
        int managed = 0;

        for (ServerDescriptor server : servers.values()) {
            if (server.getKind() == ServerKind.LOCAL) local++;
            else remote++;

            if (server.isRunning()) running++;
            if (server.isManaged()) managed++;
        }

        return new RegistryStats(servers.size(), local, remote, running, managed);
    }

    /**
     * Clear all registrations.
     */
    public synchronized void clear() {
        servers.clear();
        LOGGER.debug("Registry cleared");
    }

    /**
     * Registry statistics.
     */
    public record RegistryStats(
            int totalServers,
            int localServers,
            int remoteServers,
            int runningServers,
            int managedServers
    ) {}
}
