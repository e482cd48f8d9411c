/**
 * Task Channel Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty WebSocket, a simulator,
 * or a test double) and the channel core.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>Text payloads as {@code String}</li>
 *   <li>Connection URIs as {@link java.net.URI}</li>
 *   <li>Open/close notifications with WebSocket close codes</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform I/O only (no JSON parsing, no frame interpretation)</li>
 *   <li>Not retry, reconnect, or schedule heartbeats</li>
 *   <li>Keep framework types inside their own package</li>
 * </ul>
 */
package com.questrail.taskchannel.transport;
