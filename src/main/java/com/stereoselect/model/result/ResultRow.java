package com.stereoselect.model.result;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.locationtech.jts.geom.Geometry;

import java.util.List;
import java.util.Map;

/**
 * Flat output row handed to export and persistence collaborators
 */
@Value
@Builder
public class ResultRow {

    /** Pairname of the pair or group the row describes */
    String key;

    /** Every footprint id in the row, anchor first */
    @Singular
    List<String> memberIds;

    /** Overlap geometry of a pair, cumulative intersection of a group */
    Geometry geometry;

    /** Column name to value, in column order */
    @Singular
    Map<String, Object> properties;
}
