/**
 * Connection management for analytic servers.
 *
 * <p>This package tracks the configured and managed servers, refreshes
 * their status, and keeps at most one live connection per server.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.sessionhub.servermanager.ServerManager} - Main orchestrator</li>
 *   <li>{@link me.internalizable.sessionhub.servermanager.registry.ServerRegistry} - Server table and URL resolution</li>
 *   <li>{@link me.internalizable.sessionhub.servermanager.connection.Connection} - Client and session bring-up</li>
 *   <li>{@link me.internalizable.sessionhub.servermanager.cache.SingleFlightCache} - Keyed cache of in-flight values</li>
 *   <li>{@link me.internalizable.sessionhub.servermanager.poll.MinIntervalPoller} - Status refresh scheduling</li>
 * </ul>
 *
 * <h2>Server Kinds</h2>
 * <ul>
 *   <li><b>Local</b> - Community servers, identified by host and port</li>
 *   <li><b>Remote</b> - Enterprise gateways, identified by host</li>
 * </ul>
 *
 * @see me.internalizable.sessionhub.servermanager.ServerManager
 */
package me.internalizable.sessionhub.servermanager;
