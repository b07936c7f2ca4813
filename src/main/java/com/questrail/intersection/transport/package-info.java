/**
 * Datagram Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty UDP, a test double) and the intersection runtime.
 *
 * <p>Everything above this boundary sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations perform transport I/O only. They do not decode frames or
 * messages and never call the {@code IntersectionService}.
 */
package com.questrail.intersection.transport;
