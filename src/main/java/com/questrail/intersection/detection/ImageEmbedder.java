package com.questrail.intersection.detection;

/**
 * Turns an encoded image crop (JPEG, PNG, ...) into an embedding vector
 * suitable for a {@link VehicleClassifier}.
 */
@FunctionalInterface
public interface ImageEmbedder
{
    float[] embed(byte[] image) throws ClassificationException;
}
