package com.questrail.intersection.detection;

import java.util.List;
import java.util.Locale;

/**
 * Label vocabulary used to tell emergency vehicles from ordinary traffic.
 */
public final class VehicleLabels
{
    /**
     * A label containing any of these (case-insensitive) marks an emergency vehicle.
     */
    public static final List<String> EMERGENCY_KEYWORDS =
            List.of("ambulance", "emergency", "police", "fire");

    private VehicleLabels() {}

    public static boolean isEmergency(String label) {
        if (label == null) {
            return false;
        }
        String lower = label.toLowerCase(Locale.ROOT);
        for (String keyword : EMERGENCY_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
