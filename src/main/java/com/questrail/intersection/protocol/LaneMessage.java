package com.questrail.intersection.protocol;

/**
 * Canonical semantic representation of an intersection protocol message.
 *
 * <p>This interface abstracts away all wire-level concerns (type bytes, CRC,
 * field layout). Those are resolved by the codec before a {@code LaneMessage}
 * is created and after one is handed over for sending.</p>
 *
 * <h2>Directionality</h2>
 * The protocol is strictly request/response:
 * <ul>
 *   <li>{@link LaneRequest}: client → intersection service</li>
 *   <li>{@link LaneResponse}: intersection service → client</li>
 * </ul>
 */
public sealed interface LaneMessage permits LaneRequest, LaneResponse {
}
