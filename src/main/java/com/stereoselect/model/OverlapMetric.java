package com.stereoselect.model;

import com.stereoselect.exception.ConfigurationException;

import java.util.Locale;

/**
 * Scalar measure used to threshold an overlap
 */
public enum OverlapMetric {
    /** Absolute intersection area, in squared CRS units */
    AREA,
    /** Intersection area as a percentage of the union area */
    PERCENT;

    /**
     * Resolve a metric kind by name, case-insensitively.
     *
     * @throws ConfigurationException if the name is not a supported metric kind
     */
    public static OverlapMetric fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Overlap metric must be one of: area, percent");
        }
        try {
            return OverlapMetric.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported overlap metric: " + name
                    + " (expected area or percent)", e);
        }
    }
}
