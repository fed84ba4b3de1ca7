/**
 * API for listing analytic servers and connecting to them.
 *
 * <p>Exposes read-only views of the server table and the live connections,
 * plus connect and disconnect, for tool handlers that sit on top of the
 * connection layer.</p>
 *
 * @see me.internalizable.sessionhub.api.servermanager.ServerConnectionAPI
 */
package me.internalizable.sessionhub.api.servermanager;
