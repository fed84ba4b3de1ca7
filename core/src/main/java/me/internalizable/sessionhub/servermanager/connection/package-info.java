/**
 * Per-server client and session lifecycle.
 *
 * <p>The protocol-specific parts are supplied by the embedding tool through
 * {@link me.internalizable.sessionhub.servermanager.connection.CredentialProvider},
 * {@link me.internalizable.sessionhub.servermanager.connection.SessionOpener} and
 * {@link me.internalizable.sessionhub.servermanager.connection.ServerSession}.</p>
 *
 * @see me.internalizable.sessionhub.servermanager.connection.Connection
 */
package me.internalizable.sessionhub.servermanager.connection;
