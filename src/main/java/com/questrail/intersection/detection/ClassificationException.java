package com.questrail.intersection.detection;

/**
 * Indicates that a vehicle could not be embedded or classified.
 *
 * <p>Always recoverable: the aggregator counts the vehicle as ordinary
 * traffic.</p>
 */
public final class ClassificationException extends Exception
{
    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
