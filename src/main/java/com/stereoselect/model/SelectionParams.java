package com.stereoselect.model;

import lombok.Builder;
import lombok.Value;
import com.stereoselect.exception.ConfigurationException;

/**
 * Immutable parameters of one selection run
 */
@Value
@Builder(toBuilder = true)
public class SelectionParams {

    @Builder.Default
    OverlapMetric metricKind = OverlapMetric.AREA;

    /** Pairs are kept only when metric &gt; minMetric */
    @Builder.Default
    double minMetric = 0;

    /** Cumulative intersection floor for multilook chains, in squared CRS units */
    @Builder.Default
    double minArea = 32_670_000;

    /** Smallest chain length emitted as a multilook group */
    @Builder.Default
    int minPairs = 3;

    boolean withinStrip;

    boolean withinInstrument;

    /** Half-width of the date window in days; null or 0 disables the window */
    Integer daysThreshold;

    @Builder.Default
    ChainRanking ranking = ChainRanking.ANCHOR_OVERLAP;

    /** Optional predicate over footprint fields applied to every candidate */
    FilterCondition attributeFilter;

    public boolean hasDateWindow() {
        return daysThreshold != null && daysThreshold > 0;
    }

    /**
     * Fail fast on parameters no run can honour.
     *
     * @throws ConfigurationException describing the first invalid parameter
     */
    public SelectionParams validate() {
        if (metricKind == null) {
            throw new ConfigurationException("Overlap metric must be one of: area, percent");
        }
        if (minPairs <= 0) {
            throw new ConfigurationException("min_pairs must be positive, got " + minPairs);
        }
        if (Double.isNaN(minMetric) || minMetric < 0) {
            throw new ConfigurationException("min_metric must be zero or positive, got " + minMetric);
        }
        if (Double.isNaN(minArea) || minArea < 0) {
            throw new ConfigurationException("min_area must be zero or positive, got " + minArea);
        }
        if (daysThreshold != null && daysThreshold < 0) {
            throw new ConfigurationException("days_threshold must be zero or positive, got " + daysThreshold);
        }
        if (ranking == null) {
            throw new ConfigurationException("Chain ranking must be set");
        }
        if (attributeFilter != null) {
            attributeFilter.validate();
        }
        return this;
    }
}
