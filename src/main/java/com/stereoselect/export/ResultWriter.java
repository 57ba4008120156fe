package com.stereoselect.export;

import com.stereoselect.model.result.ResultRow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes result rows to a file in one format
 */
public interface ResultWriter {

    void write(List<ResultRow> rows, Path target) throws IOException;

    boolean supports(ExportFormat format);
}
