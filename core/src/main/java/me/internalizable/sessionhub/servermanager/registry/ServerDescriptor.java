package me.internalizable.sessionhub.servermanager.registry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable description of a known server.
 *
 * <p>Identity is the normalized URL. The registry replaces the instance when
 * the server's status changes rather than mutating it.</p>
 */
public final class ServerDescriptor {

    private final URI url;
    private final ServerKind kind;
    private final String label;
    private final String consoleType;
    private final boolean running;
    private final boolean managed;
    private final String psk;

    private ServerDescriptor(
            URI url,
            ServerKind kind,
            String label,
            String consoleType,
            boolean running,
            boolean managed,
            String psk) {
        this.url = ServerUrls.normalize(Objects.requireNonNull(url, "url"));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = label;
        this.consoleType = consoleType;
        this.running = running;
        this.managed = managed;
        this.psk = psk;
    }

    /**
     * Create a descriptor for a user-configured server. Status starts as not running.
     *
     * @param url server URL
     * @param kind server family
     * @param label optional display label
     * @param consoleType optional preferred console type
     * @return the descriptor
     */
    @Nonnull
    public static ServerDescriptor configured(
            @Nonnull URI url,
            @Nonnull ServerKind kind,
            @Nullable String label,
            @Nullable String consoleType) {
        return new ServerDescriptor(url, kind, label, consoleType, false, false, null);
    }

    /**
     * Create a descriptor for a server this process started, with a fresh pre-shared key.
     *
     * @param url server URL
     * @param label optional display label
     * @return the descriptor
     */
    @Nonnull
    public static ServerDescriptor managed(@Nonnull URI url, @Nullable String label) {
        return new ServerDescriptor(url, ServerKind.LOCAL, label, null, false, true,
                UUID.randomUUID().toString());
    }

    /**
     * Copy this descriptor with a different running flag.
     *
     * @param running new status
     * @return this instance if unchanged, otherwise a copy
     */
    @Nonnull
    public ServerDescriptor withRunning(boolean running) {
        if (this.running == running) {
            return this;
        }
        return new ServerDescriptor(url, kind, label, consoleType, running, managed, psk);
    }

    @Nonnull
    public URI getUrl() {
        return url;
    }

    @Nonnull
    public ServerKind getKind() {
        return kind;
    }

    /**
     * Get the display label.
     *
     * @return configured label, or null
     */
    @Nullable
    public String getLabel() {
        return label;
    }

    /**
     * Get a label suitable for display, falling back to host and port.
     *
     * @return display label
     */
    @Nonnull
    public String getDisplayLabel() {
        if (label != null && !label.isBlank()) {
            return label;
        }
        return url.getPort() == -1 ? url.getHost() : url.getHost() + ":" + url.getPort();
    }

    @Nullable
    public String getConsoleType() {
        return consoleType;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isManaged() {
        return managed;
    }

    /**
     * Get the pre-shared key of a managed server.
     *
     * @return key, or null for configured servers
     */
    @Nullable
    public String getPsk() {
        return psk;
    }

    @Override
    public String toString() {
        return "ServerDescriptor{" +
                "url=" + url +
                ", kind=" + kind +
                (label != null ? ", label='" + label + '\'' : "") +
                ", running=" + running +
                ", managed=" + managed +
                '}';
    }
}
