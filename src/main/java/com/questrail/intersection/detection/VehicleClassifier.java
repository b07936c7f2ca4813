package com.questrail.intersection.detection;

/**
 * Maps an embedding vector to a vehicle label (e.g. {@code "car"},
 * {@code "ambulance"}).
 */
@FunctionalInterface
public interface VehicleClassifier
{
    String classify(float[] embedding) throws ClassificationException;
}
