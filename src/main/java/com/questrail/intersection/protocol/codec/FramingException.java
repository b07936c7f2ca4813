package com.questrail.intersection.protocol.codec;

/**
 * Datagram too short or otherwise structurally unusable. Codec-internal;
 * always results in a dropped datagram.
 */
final class FramingException extends Exception
{
    FramingException(String message) {
        super(message);
    }
}
