package com.stereoselect.loader.source.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stereoselect.geometry.GeoJsonGeometries;
import com.stereoselect.loader.source.FootprintReader;
import com.stereoselect.loader.source.FootprintRecordMapper;
import com.stereoselect.loader.source.FootprintSource;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.OutputSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a GeoJSON FeatureCollection. The footprint id is taken from the
 * {@code id} property, falling back to the feature's own id member.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeoJsonFootprintReader implements FootprintReader {

    private static final TypeReference<LinkedHashMap<String, Object>> PROPERTIES_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() { };

    private final ObjectMapper objectMapper;
    private final GeoJsonGeometries geoJson;
    private final FootprintRecordMapper recordMapper;
    private final OutputSchema schema;

    @Override
    public ReadResult read(FootprintSource source) throws IOException {
        JsonNode root = objectMapper.readTree(new File(source.getLocation()));
        if (!"FeatureCollection".equals(root.path("type").asText())) {
            throw new IOException("Not a GeoJSON FeatureCollection: " + source.getLocation());
        }

        List<Footprint> footprints = new ArrayList<>();
        long skipped = 0;
        int index = 0;
        for (JsonNode feature : root.path("features")) {
            try {
                footprints.add(toFootprint(feature));
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping feature {} in {}: {}", index, source.getLocation(), e.getMessage());
            }
            index++;
        }
        return new ReadResult(footprints, skipped);
    }

    @Override
    public boolean supports(FootprintSource.SourceType type) {
        return type == FootprintSource.SourceType.FILE_GEOJSON;
    }

    private Footprint toFootprint(JsonNode feature) {
        Map<String, Object> record = new LinkedHashMap<>();
        JsonNode properties = feature.path("properties");
        if (properties.isObject()) {
            record.putAll(objectMapper.convertValue(properties, PROPERTIES_TYPE));
        }
        JsonNode featureId = feature.path("id");
        if (record.get(schema.getId()) == null && !featureId.isMissingNode() && !featureId.isNull()) {
            record.put(schema.getId(), featureId.asText());
        }

        Geometry geometry = geoJson.read(feature.get("geometry"));
        return recordMapper.toFootprint(record, geometry);
    }
}
