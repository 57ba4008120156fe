package com.stereoselect.export;

import com.stereoselect.exception.SelectionException;
import com.stereoselect.model.result.ResultRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Dispatches result rows to the writer registered for the requested format
 */
@Slf4j
@Component
public class ResultExporter {

    private final List<ResultWriter> writers;

    public ResultExporter(List<ResultWriter> writers) {
        this.writers = writers;
    }

    /**
     * @throws IllegalArgumentException if no writer supports the format
     * @throws SelectionException if the file cannot be written
     */
    public Path export(List<ResultRow> rows, ExportFormat format, Path target) {
        ResultWriter writer = writers.stream()
                .filter(candidate -> candidate.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No writer found for export format: " + format));

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer.write(rows, target);
            log.info("Exported {} rows as {} to {}", rows.size(), format, target);
            return target;
        } catch (IOException e) {
            log.error("Failed to export {} rows to {}: {}", format, target, e.getMessage(), e);
            throw new SelectionException("Export to " + target + " failed", e);
        }
    }
}
