package me.internalizable.sessionhub.servermanager.registry;

/**
 * Defines the family of a server, which decides how it is probed.
 */
public enum ServerKind {
    /**
     * Standalone community server, usually started per port on the
     * developer's machine. Managed servers are always of this kind.
     */
    LOCAL,

    /**
     * Enterprise server reached through a gateway. The gateway port is
     * incidental to the server's identity.
     */
    REMOTE
}
