package com.questrail.intersection.protocol.codec;

/**
 * CRC validation failure. Codec-internal; always results in a dropped datagram.
 */
final class CrcException extends Exception
{
    CrcException(String message) {
        super(message);
    }
}
