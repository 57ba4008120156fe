package com.stereoselect.config.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;

import java.io.IOException;

/**
 * Custom Jackson serializer for JTS Geometry objects, written as
 * {"wkt": ..., "type": ..., "area": ...}
 */
public class GeometrySerializer extends JsonSerializer<Geometry> {

    private final WKTWriter wktWriter = new WKTWriter();

    @Override
    public void serialize(Geometry geometry, JsonGenerator gen, SerializerProvider serializers)
            throws IOException {
        if (geometry == null) {
            gen.writeNull();
            return;
        }

        gen.writeStartObject();
        gen.writeStringField("wkt", wktWriter.write(geometry));
        gen.writeStringField("type", geometry.getGeometryType());
        gen.writeNumberField("area", geometry.getArea());
        gen.writeEndObject();
    }
}
