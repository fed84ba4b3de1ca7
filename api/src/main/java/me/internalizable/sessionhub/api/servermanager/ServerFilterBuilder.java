package me.internalizable.sessionhub.api.servermanager;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Builder implementation for server filters.
 */
public class ServerFilterBuilder implements ServerConnectionAPI.ServerFilter.Builder {

    private Boolean running;
    private Boolean hasConnections;
    private String kind;
    private Boolean managed;

    @Override
    public ServerConnectionAPI.ServerFilter.Builder running(@Nullable Boolean running) {
        this.running = running;
        return this;
    }

    @Override
    public ServerConnectionAPI.ServerFilter.Builder hasConnections(@Nullable Boolean hasConnections) {
        this.hasConnections = hasConnections;
        return this;
    }

    @Override
    public ServerConnectionAPI.ServerFilter.Builder kind(@Nullable String kind) {
        this.kind = kind != null ? kind.toUpperCase(Locale.ROOT) : null;
        return this;
    }

    @Override
    public ServerConnectionAPI.ServerFilter.Builder managed(@Nullable Boolean managed) {
        this.managed = managed;
        return this;
    }

    @Override
    public ServerConnectionAPI.ServerFilter build() {
        return new ServerFilterImpl(running, hasConnections, kind, managed);
    }

    private record ServerFilterImpl(
            Boolean running,
            Boolean hasConnections,
            String kind,
            Boolean managed
    ) implements ServerConnectionAPI.ServerFilter {

        @Override
        @Nullable
        public Boolean getRunning() {
            return running;
        }

        @Override
        @Nullable
        public Boolean getHasConnections() {
            return hasConnections;
        }

        @Override
        @Nullable
        public String getKind() {
            return kind;
        }

        @Override
        @Nullable
        public Boolean getManaged() {
            return managed;
        }
    }
}
