package com.questrail.intersection.protocol.codec;

/**
 * Indicates that a CRC-valid frame could not be translated into a semantic
 * message.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown type byte</li>
 *   <li>Truncated or overlong body for the message type</li>
 *   <li>Field values violating a message contract (e.g. negative counts)</li>
 * </ul>
 */
public final class LaneDecodeException extends RuntimeException
{
    public LaneDecodeException(String message) {
        super(message);
    }

    public LaneDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
