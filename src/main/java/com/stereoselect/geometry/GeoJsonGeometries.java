package com.stereoselect.geometry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Converts between JTS geometries and GeoJSON geometry objects (RFC 7946)
 * as Jackson trees.
 */
public class GeoJsonGeometries {

    private final GeometryFactory geometryFactory;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public GeoJsonGeometries(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    /**
     * @throws IllegalArgumentException for unknown types or malformed coordinates
     */
    public Geometry read(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String type = node.path("type").asText();
        JsonNode coordinates = node.path("coordinates");

        switch (type) {
            case "Point":
                return geometryFactory.createPoint(coordinate(coordinates));
            case "MultiPoint":
                return geometryFactory.createMultiPointFromCoords(coordinates(coordinates));
            case "LineString":
                return geometryFactory.createLineString(coordinates(coordinates));
            case "MultiLineString": {
                LineString[] lines = new LineString[coordinates.size()];
                for (int i = 0; i < lines.length; i++) {
                    lines[i] = geometryFactory.createLineString(coordinates(coordinates.get(i)));
                }
                return geometryFactory.createMultiLineString(lines);
            }
            case "Polygon":
                return polygon(coordinates);
            case "MultiPolygon": {
                Polygon[] polygons = new Polygon[coordinates.size()];
                for (int i = 0; i < polygons.length; i++) {
                    polygons[i] = polygon(coordinates.get(i));
                }
                return geometryFactory.createMultiPolygon(polygons);
            }
            case "GeometryCollection": {
                JsonNode members = node.path("geometries");
                Geometry[] geometries = new Geometry[members.size()];
                for (int i = 0; i < geometries.length; i++) {
                    geometries[i] = read(members.get(i));
                }
                return geometryFactory.createGeometryCollection(geometries);
            }
            default:
                throw new IllegalArgumentException("Unsupported GeoJSON geometry type: '" + type + "'");
        }
    }

    public ObjectNode write(Geometry geometry) {
        ObjectNode node = nodes.objectNode();
        if (geometry instanceof Point) {
            node.put("type", "Point");
            node.set("coordinates", position(geometry.getCoordinate()));
        } else if (geometry instanceof LineString) {
            node.put("type", "LineString");
            node.set("coordinates", positions(geometry.getCoordinates()));
        } else if (geometry instanceof Polygon) {
            node.put("type", "Polygon");
            node.set("coordinates", rings((Polygon) geometry));
        } else if (geometry instanceof MultiPoint) {
            node.put("type", "MultiPoint");
            node.set("coordinates", positions(geometry.getCoordinates()));
        } else if (geometry instanceof MultiLineString) {
            node.put("type", "MultiLineString");
            ArrayNode lines = node.putArray("coordinates");
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                lines.add(positions(geometry.getGeometryN(i).getCoordinates()));
            }
        } else if (geometry instanceof MultiPolygon) {
            node.put("type", "MultiPolygon");
            ArrayNode polygons = node.putArray("coordinates");
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                polygons.add(rings((Polygon) geometry.getGeometryN(i)));
            }
        } else if (geometry instanceof GeometryCollection) {
            node.put("type", "GeometryCollection");
            ArrayNode members = node.putArray("geometries");
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                members.add(write(geometry.getGeometryN(i)));
            }
        } else {
            throw new IllegalArgumentException("Unsupported geometry type: " + geometry.getGeometryType());
        }
        return node;
    }

    private Polygon polygon(JsonNode rings) {
        if (rings.size() == 0) {
            return geometryFactory.createPolygon();
        }
        LinearRing shell = geometryFactory.createLinearRing(coordinates(rings.get(0)));
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = geometryFactory.createLinearRing(coordinates(rings.get(i)));
        }
        return geometryFactory.createPolygon(shell, holes);
    }

    private Coordinate[] coordinates(JsonNode positions) {
        Coordinate[] coordinates = new Coordinate[positions.size()];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = coordinate(positions.get(i));
        }
        return coordinates;
    }

    private Coordinate coordinate(JsonNode position) {
        if (position == null || !position.isArray() || position.size() < 2) {
            throw new IllegalArgumentException("GeoJSON position needs at least two numbers: " + position);
        }
        return new Coordinate(position.get(0).asDouble(), position.get(1).asDouble());
    }

    private ArrayNode rings(Polygon polygon) {
        ArrayNode rings = nodes.arrayNode();
        rings.add(positions(polygon.getExteriorRing().getCoordinates()));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings.add(positions(polygon.getInteriorRingN(i).getCoordinates()));
        }
        return rings;
    }

    private ArrayNode positions(Coordinate[] coordinates) {
        ArrayNode positions = nodes.arrayNode();
        for (Coordinate coordinate : coordinates) {
            positions.add(position(coordinate));
        }
        return positions;
    }

    private ArrayNode position(Coordinate coordinate) {
        ArrayNode position = nodes.arrayNode();
        position.add(coordinate.x);
        position.add(coordinate.y);
        return position;
    }
}
