/**
 * Line Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between the networking implementation (Netty in
 * production, fakes in tests) and the gateway.
 *
 * <h2>What crosses this boundary</h2>
 * <ul>
 *   <li>Whole text lines as {@code String}, terminator stripped</li>
 *   <li>Connection handles as {@link com.questrail.meshgate.transport.ClientConnection}</li>
 *   <li>Connection lifecycle notifications</li>
 * </ul>
 *
 * <p>Implementations do not parse chat verbs, decode mesh JSON, or schedule
 * anything. Netty types stay inside {@code transport.tcp.netty}.</p>
 */
package com.questrail.meshgate.transport;
