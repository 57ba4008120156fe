package com.stereoselect.controller;

import com.stereoselect.loader.FootprintLoader;
import com.stereoselect.loader.source.FootprintSource;
import com.stereoselect.loader.source.FootprintSource.SourceType;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.result.ApiResponse;
import com.stereoselect.repository.FootprintRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST API controller for loading and inspecting the footprint pool
 */
@RestController
@RequestMapping("/api/v1/footprints")
public class FootprintController {

    private static final Logger logger = LoggerFactory.getLogger(FootprintController.class);

    @Autowired
    private FootprintLoader footprintLoader;

    @Autowired
    private FootprintRepository footprintRepository;

    /**
     * Load footprints from a GeoJSON or CSV file
     */
    @PostMapping("/load")
    public CompletableFuture<ResponseEntity<ApiResponse<Map<String, Object>>>> load(
            @RequestParam SourceType sourceType,
            @RequestParam String location) {

        logger.info("Loading footprints from {} source: {}", sourceType, location);

        return footprintLoader.loadFromSource(FootprintSource.of(sourceType, location))
                .thenApply(result -> {
                    String elapsed = result.getDurationMs() + "ms";
                    if (!result.isSuccess()) {
                        logger.error("Failed to load footprints: {}", result.getMessage());
                        return ResponseEntity.badRequest().body(ApiResponse.<Map<String, Object>>builder()
                                .ok(false)
                                .error(result.getMessage())
                                .elapsed(elapsed)
                                .build());
                    }

                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("records_loaded", result.getRecordsLoaded());
                    data.put("records_skipped", result.getRecordsSkipped());
                    data.put("message", result.getMessage());
                    return ResponseEntity.ok(ApiResponse.success(data, elapsed));
                });
    }

    /**
     * Footprint counts of the repository
     */
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<Map<String, Object>>> stats() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("footprints", footprintRepository.count());
        data.put("indexed", footprintRepository.indexedCount());
        return ResponseEntity.ok(ApiResponse.success(data, "0ms"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Footprint>> get(@PathVariable String id) {
        return footprintRepository.get(id)
                .map(footprint -> ResponseEntity.ok(ApiResponse.success(footprint, "0ms")))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.<Footprint>error("Footprint not found: " + id)));
    }

    /**
     * Remove every footprint from the repository
     */
    @DeleteMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> flush() {
        long removed = footprintRepository.count();
        footprintRepository.flushAll();
        logger.info("Flushed {} footprints", removed);
        return ResponseEntity.ok(ApiResponse.success(Map.of("removed", removed), "0ms"));
    }
}
