package com.stereoselect.support;

import com.stereoselect.model.Footprint;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.time.Instant;

/**
 * Axis-aligned rectangle footprints for selection tests
 */
public final class TestFootprints {

    public static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private TestFootprints() {
    }

    public static Polygon rect(double minX, double minY, double maxX, double maxY) {
        return (Polygon) GEOMETRY_FACTORY.toGeometry(new Envelope(minX, maxX, minY, maxY));
    }

    public static Footprint footprint(String id, double minX, double minY, double maxX, double maxY) {
        return builder(id, minX, minY, maxX, maxY).build();
    }

    public static Footprint.FootprintBuilder<?, ?> builder(String id, double minX, double minY,
                                                           double maxX, double maxY) {
        return Footprint.builder()
                .id(id)
                .geometry(rect(minX, minY, maxX, maxY));
    }

    public static Instant day(String isoDate) {
        return Instant.parse(isoDate + "T10:15:30Z");
    }
}
