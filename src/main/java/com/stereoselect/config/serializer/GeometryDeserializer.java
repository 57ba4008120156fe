package com.stereoselect.config.serializer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.stereoselect.geometry.GeoJsonGeometries;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.ParseException;

import java.io.IOException;

/**
 * Custom Jackson deserializer for JTS Geometry objects.
 * Supports {"wkt": ...}, a bare WKT string, and GeoJSON geometry objects.
 */
public class GeometryDeserializer extends JsonDeserializer<Geometry> {

    private final WKTReader wktReader;
    private final GeoJsonGeometries geoJson;

    public GeometryDeserializer(GeometryFactory geometryFactory) {
        this.wktReader = new WKTReader(geometryFactory);
        this.geoJson = new GeoJsonGeometries(geometryFactory);
    }

    @Override
    public Geometry deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);

        if (node == null || node.isNull()) {
            return null;
        }

        if (node.isTextual()) {
            return readWkt(node.asText());
        }

        if (node.has("wkt")) {
            return readWkt(node.get("wkt").asText());
        }

        if (node.has("type") && node.has("coordinates")) {
            try {
                return geoJson.read(node);
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid GeoJSON geometry: " + e.getMessage(), e);
            }
        }

        throw new IOException("Unsupported geometry format. Expected WKT or a GeoJSON geometry.");
    }

    private Geometry readWkt(String wkt) throws IOException {
        try {
            return wktReader.read(wkt);
        } catch (ParseException e) {
            throw new IOException("Invalid WKT format: " + wkt, e);
        }
    }
}
