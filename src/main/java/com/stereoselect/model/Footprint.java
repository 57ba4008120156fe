package com.stereoselect.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stereoselect.model.base.BaseSpatialEntity;

import java.time.Instant;
import java.util.Map;

/**
 * Footprint - one scene's ground coverage with its acquisition metadata.
 * Built by a loader, read-only for the duration of a selection run.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Footprint extends BaseSpatialEntity<String> {

    /**
     * Grouping key shared by scenes of one continuous collection pass
     */
    private final String stripId;

    /**
     * Sensor code, e.g. PS2, PS2.SD, PSB.SD
     */
    private final String instrument;

    private final Instant acquired;

    /**
     * Remaining catalog columns (cloud_cover, off_nadir, ...), in source order
     */
    @Singular
    private final Map<String, Object> attributes;

    public Object getAttribute(String key) {
        return attributes.get(key);
    }
}
