/**
 * Minimum-interval polling.
 */
package me.internalizable.sessionhub.servermanager.poll;
