package com.stereoselect.loader.source.impl;

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

class CsvFootprintReaderTest {

    private final CsvFootprintReader reader = new CsvFootprintReader(GEOMETRY_FACTORY,
            new FootprintRecordMapper(OutputSchema.DEFAULT), OutputSchema.DEFAULT);

    @TempDir
    Path tempDir;

    @Test
    void readsRowsAndSkipsUnparseableOnes() throws Exception {
        Path path = Paths.get(getClass().getResource("/fixtures/footprints.csv").toURI());

        FootprintReader.ReadResult result =
                reader.read(FootprintSource.of(FootprintSource.SourceType.FILE_CSV, path.toString()));

        // D has an unparseable date, E broken WKT
        assertEquals(3, result.getFootprints().size());
        assertEquals(2, result.getSkipped());

        Map<String, Footprint> byId = result.getFootprints().stream()
                .collect(Collectors.toMap(Footprint::getId, Function.identity()));
        assertEquals(Instant.parse("2020-06-03T00:00:00Z"), byId.get("B").getAcquired());
        assertEquals(Instant.parse("2020-06-20T09:00:00Z"), byId.get("C").getAcquired());
        assertEquals("0.05", byId.get("A").getAttribute("cloud_cover"));
        assertNull(byId.get("C").getAttribute("cloud_cover"));
        assertEquals(80.0, byId.get("C").getGeometry().getArea(), 1e-9);
        assertFalse(byId.get("A").getAttributes().containsKey("geometry"));
    }

    @Test
    void acceptsWktColumnName() throws Exception {
        Path file = Files.writeString(tempDir.resolve("wkt.csv"),
                "id,WKT\nX,\"POLYGON ((0 0, 2 0, 2 2, 0 2, 0 0))\"\n");

        FootprintReader.ReadResult result =
                reader.read(FootprintSource.of(FootprintSource.SourceType.FILE_CSV, file.toString()));

        assertEquals(1, result.getFootprints().size());
        assertEquals(4.0, result.getFootprints().get(0).getGeometry().getArea(), 1e-9);
    }

    @Test
    void missingGeometryColumnFailsTheSource() throws Exception {
        Path file = Files.writeString(tempDir.resolve("nogeom.csv"), "id,strip_id\nX,s1\n");

        assertThrows(IOException.class,
                () -> reader.read(FootprintSource.of(FootprintSource.SourceType.FILE_CSV, file.toString())));
    }
}
