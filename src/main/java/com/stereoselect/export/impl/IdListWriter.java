package com.stereoselect.export.impl;

import com.stereoselect.export.ExportFormat;
import com.stereoselect.export.ResultWriter;
import com.stereoselect.model.result.ResultRow;
import com.stereoselect.selection.ResultAssembler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the sorted set of footprint ids the rows reference, e.g. as an
 * order list for the scenes a selection needs
 */
@Component
@RequiredArgsConstructor
public class IdListWriter implements ResultWriter {

    private final ResultAssembler resultAssembler;

    @Override
    public void write(List<ResultRow> rows, Path target) throws IOException {
        Files.write(target, resultAssembler.uniqueIds(rows), StandardCharsets.UTF_8);
    }

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.IDS;
    }
}
