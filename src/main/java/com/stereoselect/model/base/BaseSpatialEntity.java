package com.stereoselect.model.base;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.locationtech.jts.geom.Geometry;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Base spatial entity with geometry support using generics.
 * Instances are immutable once built; a selection run never mutates them.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseSpatialEntity<ID> {

    /**
     * Unique identifier for the entity
     */
    private final ID id;

    /**
     * Geometric representation of the entity, in a projected CRS
     */
    private final Geometry geometry;

    /**
     * Check if the entity carries a usable geometry: present, non-empty and
     * topologically valid. Self-intersecting rings fail overlay operations.
     */
    public boolean hasGeometry() {
        return geometry != null && !geometry.isEmpty() && geometry.isValid();
    }

    /**
     * Check if this entity intersects with another geometry
     */
    public boolean intersects(Geometry other) {
        return hasGeometry() && other != null && geometry.intersects(other);
    }
}
