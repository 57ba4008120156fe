package com.stereoselect.export.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stereoselect.export.ExportFormat;
import com.stereoselect.export.ResultWriter;
import com.stereoselect.geometry.GeoJsonGeometries;
import com.stereoselect.model.result.ResultRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
@RequiredArgsConstructor
public class GeoJsonResultWriter implements ResultWriter {

    private final ObjectMapper objectMapper;
    private final GeoJsonGeometries geoJson;

    @Override
    public void write(List<ResultRow> rows, Path target) throws IOException {
        ObjectNode collection = objectMapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        ArrayNode features = collection.putArray("features");

        for (ResultRow row : rows) {
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            feature.put("id", row.getKey());
            if (row.getGeometry() != null) {
                feature.set("geometry", geoJson.write(row.getGeometry()));
            } else {
                feature.putNull("geometry");
            }
            // Instants become ISO-8601 strings through the JavaTimeModule
            feature.set("properties", objectMapper.valueToTree(row.getProperties()));
        }

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), collection);
    }

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.GEOJSON;
    }
}
