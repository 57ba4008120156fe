package com.stereoselect.geometry;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;
import org.springframework.stereotype.Component;

/**
 * GeometryOperations backed by JTS OverlayNG with its robust snapping
 * fallback. Overlay results are normalized so that the same pair of inputs
 * yields the same coordinate sequence whichever operand comes first.
 */
@Component
public class JtsGeometryOperations implements GeometryOperations {

    @Override
    public boolean intersects(Geometry a, Geometry b) {
        if (isEmpty(a) || isEmpty(b)) {
            return false;
        }
        return a.intersects(b);
    }

    @Override
    public Geometry intersection(Geometry a, Geometry b) {
        return OverlayNGRobust.overlay(a, b, OverlayNG.INTERSECTION).norm();
    }

    @Override
    public Geometry union(Geometry a, Geometry b) {
        return OverlayNGRobust.overlay(a, b, OverlayNG.UNION).norm();
    }

    @Override
    public double area(Geometry geometry) {
        return isEmpty(geometry) ? 0.0 : geometry.getArea();
    }
}
