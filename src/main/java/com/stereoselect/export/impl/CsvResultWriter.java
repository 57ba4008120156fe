package com.stereoselect.export.impl;

import com.opencsv.CSVWriter;
import com.stereoselect.export.ExportFormat;
import com.stereoselect.export.ResultWriter;
import com.stereoselect.model.OutputSchema;
import com.stereoselect.model.result.ResultRow;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes result rows as CSV. The header is the union of the rows' columns in
 * first-seen order followed by the overlap geometry column; cells a row does
 * not have are left empty.
 */
@Component
@RequiredArgsConstructor
public class CsvResultWriter implements ResultWriter {

    private final OutputSchema schema;
    private final WKTWriter wktWriter;

    @Override
    public void write(List<ResultRow> rows, Path target) throws IOException {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.getProperties().keySet()));
        columns.add(schema.getOverlapGeometry());
        String[] headers = columns.toArray(new String[0]);

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(target, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(headers);
            for (ResultRow row : rows) {
                writer.writeNext(toRow(row, headers));
            }
        }
    }

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.CSV;
    }

    private String[] toRow(ResultRow row, String[] headers) {
        String[] values = new String[headers.length];
        for (int i = 0; i < headers.length - 1; i++) {
            values[i] = str(row.getProperties().get(headers[i]));
        }
        values[headers.length - 1] = row.getGeometry() == null ? "" : wktWriter.write(row.getGeometry());
        return values;
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
