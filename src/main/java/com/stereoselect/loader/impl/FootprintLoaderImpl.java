package com.stereoselect.loader.impl;

import com.stereoselect.loader.FootprintLoader;
import com.stereoselect.loader.source.FootprintReader;
import com.stereoselect.loader.source.FootprintSource;
import com.stereoselect.loader.source.ReaderFactory;
import com.stereoselect.model.Footprint;
import com.stereoselect.repository.FootprintRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Loads footprint files into the repository in batches. A load never fails
 * the future; problems are reported through the LoadResult.
 */
@Component
public class FootprintLoaderImpl implements FootprintLoader {

    private static final Logger logger = LoggerFactory.getLogger(FootprintLoaderImpl.class);

    // Batch size for indexing - each bulk call invalidates the spatial index once
    private static final int BATCH_SIZE = 10000;

    @Autowired
    private FootprintRepository footprintRepository;

    @Autowired
    private ReaderFactory readerFactory;

    @Override
    public CompletableFuture<LoadResult> loadFromSource(FootprintSource source) {
        return CompletableFuture.supplyAsync(() -> {
            logger.info("Starting {} footprint load from: {}", source.getType(), source.getLocation());
            long startTime = System.currentTimeMillis();

            if (source.getType() == null || !readerFactory.isSupported(source.getType())) {
                return LoadResult.failure(0, "Unsupported source type: " + source.getType());
            }
            if (source.getLocation() == null || !new File(source.getLocation()).isFile()) {
                return LoadResult.failure(0, "File not found: " + source.getLocation());
            }

            try {
                FootprintReader reader = readerFactory.getReader(source.getType());
                FootprintReader.ReadResult read = reader.read(source);
                List<Footprint> footprints = read.getFootprints();

                for (int from = 0; from < footprints.size(); from += BATCH_SIZE) {
                    int to = Math.min(from + BATCH_SIZE, footprints.size());
                    footprintRepository.bulkIndex(footprints.subList(from, to));
                    logger.debug("Indexed batch of {} footprints, total: {}", to - from, to);
                }

                long endTime = System.currentTimeMillis();
                String message = String.format("Successfully loaded %d footprints (%d skipped) from %s in %dms",
                                               footprints.size(), read.getSkipped(), source.getLocation(),
                                               endTime - startTime);
                logger.info(message);

                return new LoadResult(true, footprints.size(), read.getSkipped(), endTime - startTime, message);

            } catch (Exception e) {
                long endTime = System.currentTimeMillis();
                String error = "Failed to load " + source.getType() + ": " + e.getMessage();
                logger.error(error, e);
                return LoadResult.failure(endTime - startTime, error);
            }
        });
    }
}
