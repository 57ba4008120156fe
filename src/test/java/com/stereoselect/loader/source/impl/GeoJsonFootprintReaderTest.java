package com.stereoselect.loader.source.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stereoselect.geometry.GeoJsonGeometries;
import com.stereoselect.loader.source.FootprintReader;
import com.stereoselect.loader.source.FootprintRecordMapper;
import com.stereoselect.loader.source.FootprintSource;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.OutputSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.stereoselect.support.TestFootprints.GEOMETRY_FACTORY;
import static org.junit.jupiter.api.Assertions.*;

class GeoJsonFootprintReaderTest {

    private final GeoJsonFootprintReader reader = new GeoJsonFootprintReader(new ObjectMapper(),
            new GeoJsonGeometries(GEOMETRY_FACTORY), new FootprintRecordMapper(OutputSchema.DEFAULT),
            OutputSchema.DEFAULT);

    @TempDir
    Path tempDir;

    @Test
    void readsFeaturesAndSkipsBrokenOnes() throws Exception {
        FootprintReader.ReadResult result = reader.read(fixture());

        assertEquals(3, result.getFootprints().size());
        assertEquals(2, result.getSkipped());

        Map<String, Footprint> byId = result.getFootprints().stream()
                .collect(Collectors.toMap(Footprint::getId, Function.identity()));

        Footprint a = byId.get("A");
        assertEquals("s1", a.getStripId());
        assertEquals("PS2", a.getInstrument());
        assertEquals(Instant.parse("2020-06-01T10:15:30Z"), a.getAcquired());
        assertEquals(0.05, a.getAttribute("cloud_cover"));
        assertEquals(200.0, a.getGeometry().getArea(), 1e-9);
        assertFalse(a.getAttributes().containsKey("instrument"));

        assertEquals(Instant.parse("2020-06-20T09:00:00Z"), byId.get("C").getAcquired());
    }

    @Test
    void rejectsDocumentsThatAreNotFeatureCollections() throws Exception {
        Path file = Files.writeString(tempDir.resolve("point.geojson"),
                "{\"type\":\"Point\",\"coordinates\":[0,0]}");

        assertThrows(IOException.class,
                () -> reader.read(FootprintSource.of(FootprintSource.SourceType.FILE_GEOJSON, file.toString())));
    }

    @Test
    void supportsOnlyGeoJson() {
        assertTrue(reader.supports(FootprintSource.SourceType.FILE_GEOJSON));
        assertFalse(reader.supports(FootprintSource.SourceType.FILE_CSV));
    }

    private FootprintSource fixture() throws Exception {
        Path path = Paths.get(getClass().getResource("/fixtures/footprints.geojson").toURI());
        return FootprintSource.of(FootprintSource.SourceType.FILE_GEOJSON, path.toString());
    }
}
