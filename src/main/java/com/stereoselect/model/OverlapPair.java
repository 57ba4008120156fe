package com.stereoselect.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stereoselect.model.base.BaseSpatialEntity;

/**
 * Intersection of an anchor footprint with one other footprint.
 * The entity id is the pairname (anchor id, separator, other id) and the
 * geometry is the intersection polygon.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OverlapPair extends BaseSpatialEntity<String> {

    /** Anchor footprint id */
    private final String id1;

    /** Other footprint id */
    private final String id2;

    private final double metric;

    private final OverlapMetric metricKind;

    /** Date window that admitted the pair, null when no window was applied */
    private final DateWindow dateWindow;

    public String getPairname() {
        return getId();
    }
}
