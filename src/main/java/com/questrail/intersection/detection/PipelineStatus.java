package com.questrail.intersection.detection;

import java.util.List;

/**
 * Availability of the classification seams, for status reporting.
 *
 * @param classifierLoaded true if a {@link VehicleClassifier} is installed
 * @param embedderLoaded   true if an {@link ImageEmbedder} is installed
 * @param loadErrors       problems reported while the seams were being set up
 */
public record PipelineStatus(boolean classifierLoaded, boolean embedderLoaded, List<String> loadErrors)
{
    public PipelineStatus {
        loadErrors = List.copyOf(loadErrors);
    }
}
