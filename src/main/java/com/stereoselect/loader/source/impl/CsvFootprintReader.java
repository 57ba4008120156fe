package com.stereoselect.loader.source.impl;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.stereoselect.loader.source.FootprintReader;
import com.stereoselect.loader.source.FootprintRecordMapper;
import com.stereoselect.loader.source.FootprintSource;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.OutputSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited catalog export. The first row is the header; the
 * geometry column (or a {@code wkt} column) holds the footprint as WKT.
 * Empty cells are treated as absent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvFootprintReader implements FootprintReader {

    private static final String WKT_COLUMN = "wkt";

    private final GeometryFactory geometryFactory;
    private final FootprintRecordMapper recordMapper;
    private final OutputSchema schema;

    @Override
    public ReadResult read(FootprintSource source) throws IOException {
        List<Footprint> footprints = new ArrayList<>();
        long skipped = 0;
        // WKTReader is not thread-safe
        WKTReader wktReader = new WKTReader(geometryFactory);

        try (Reader reader = Files.newBufferedReader(Paths.get(source.getLocation()), StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            String[] header = csv.readNext();
            if (header == null) {
                throw new IOException("Empty CSV file: " + source.getLocation());
            }
            for (int i = 0; i < header.length; i++) {
                header[i] = header[i].trim();
            }
            String geometryColumn = geometryColumn(header);

            String[] line;
            while ((line = csv.readNext()) != null) {
                if (line.length == 1 && line[0].isBlank()) {
                    continue;
                }
                try {
                    footprints.add(toFootprint(header, line, geometryColumn, wktReader));
                } catch (IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipping CSV line {} in {}: {}", csv.getLinesRead(), source.getLocation(), e.getMessage());
                }
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in " + source.getLocation() + ": " + e.getMessage(), e);
        }
        return new ReadResult(footprints, skipped);
    }

    @Override
    public boolean supports(FootprintSource.SourceType type) {
        return type == FootprintSource.SourceType.FILE_CSV;
    }

    private String geometryColumn(String[] header) throws IOException {
        for (String column : header) {
            if (column.equals(schema.getGeometry())) {
                return column;
            }
        }
        for (String column : header) {
            if (column.equalsIgnoreCase(WKT_COLUMN)) {
                return column;
            }
        }
        throw new IOException("CSV has no '" + schema.getGeometry() + "' or '" + WKT_COLUMN + "' column");
    }

    private Footprint toFootprint(String[] header, String[] line, String geometryColumn, WKTReader wktReader) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < header.length && i < line.length; i++) {
            String value = line[i].trim();
            record.put(header[i], value.isEmpty() ? null : value);
        }
        Object wkt = record.remove(geometryColumn);
        return recordMapper.toFootprint(record, parseWkt(wktReader, wkt));
    }

    private static Geometry parseWkt(WKTReader wktReader, Object wkt) {
        if (wkt == null) {
            return null;
        }
        try {
            return wktReader.read(wkt.toString());
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid WKT geometry: " + e.getMessage(), e);
        }
    }
}
