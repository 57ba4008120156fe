package com.stereoselect.geometry;

import org.locationtech.jts.geom.Geometry;

/**
 * Planar polygon primitives the selection engine delegates to.
 * Implementations must be stateless and safe to share between worker threads.
 * All operands are expected in one projected, area-preserving CRS.
 */
public interface GeometryOperations {

    boolean intersects(Geometry a, Geometry b);

    /**
     * Intersection of two geometries; an empty geometry when they are disjoint
     */
    Geometry intersection(Geometry a, Geometry b);

    Geometry union(Geometry a, Geometry b);

    /**
     * Area in squared CRS units; zero for null or empty geometries
     */
    double area(Geometry geometry);

    default boolean isEmpty(Geometry geometry) {
        return geometry == null || geometry.isEmpty();
    }
}
