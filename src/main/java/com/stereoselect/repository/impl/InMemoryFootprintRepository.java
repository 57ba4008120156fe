package com.stereoselect.repository.impl;

import com.stereoselect.model.Footprint;
import com.stereoselect.repository.FootprintRepository;

import org.springframework.stereotype.Repository;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory FootprintRepository using a JTS STRtree for spatial queries.
 * The tree is rebuilt lazily on the first query after a modification, so a
 * bulk load followed by a selection run builds it exactly once.
 */
@Repository
public class InMemoryFootprintRepository implements FootprintRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryFootprintRepository.class);

    private static final int STRTREE_NODE_CAPACITY = 25;

    // Single source of truth; footprints without geometry are stored but never indexed
    private final Map<String, Footprint> storage = new ConcurrentHashMap<>();

    private volatile STRtree spatialIndex;

    @Override
    public void index(Footprint footprint) {
        storage.put(footprint.getId(), footprint);
        invalidateIndex();
    }

    @Override
    public void bulkIndex(Collection<Footprint> footprints) {
        if (footprints == null || footprints.isEmpty()) {
            return;
        }

        logger.info("Starting bulk index of {} footprints", footprints.size());
        long startTime = System.currentTimeMillis();

        for (Footprint footprint : footprints) {
            storage.put(footprint.getId(), footprint);
        }
        invalidateIndex();
        buildIndexIfNeeded();

        long endTime = System.currentTimeMillis();
        logger.info("Completed bulk index in {}ms, {} footprints held", (endTime - startTime), storage.size());
    }

    @Override
    public Optional<Footprint> get(String id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Footprint> all() {
        return storage.values().stream()
                      .sorted(Comparator.comparing(Footprint::getId))
                      .collect(Collectors.toList());
    }

    @Override
    public List<Footprint> intersecting(Geometry geometry) {
        if (geometry == null || geometry.isEmpty()) {
            return Collections.emptyList();
        }

        STRtree index = buildIndexIfNeeded();
        List<Footprint> results = new ArrayList<>();
        for (Object item : index.query(geometry.getEnvelopeInternal())) {
            Footprint footprint = storage.get((String) item);
            if (footprint != null && footprint.intersects(geometry)) {
                results.add(footprint);
            }
        }

        results.sort(Comparator.comparing(Footprint::getId));
        return results;
    }

    @Override
    public boolean remove(String id) {
        Footprint removed = storage.remove(id);
        if (removed != null) {
            invalidateIndex();
            return true;
        }
        return false;
    }

    @Override
    public long count() {
        return storage.size();
    }

    @Override
    public long indexedCount() {
        return storage.values().stream().filter(Footprint::hasGeometry).count();
    }

    @Override
    public void flushAll() {
        storage.clear();
        invalidateIndex();
        logger.info("Footprint repository flushed");
    }

    private synchronized void invalidateIndex() {
        spatialIndex = null;
    }

    private STRtree buildIndexIfNeeded() {
        STRtree index = spatialIndex;
        if (index != null) {
            return index;
        }
        synchronized (this) {
            if (spatialIndex == null) {
                STRtree newIndex = new STRtree(STRTREE_NODE_CAPACITY);
                for (Footprint footprint : storage.values()) {
                    if (footprint.hasGeometry()) {
                        newIndex.insert(footprint.getGeometry().getEnvelopeInternal(), footprint.getId());
                    }
                }
                // Build the spatial index (this optimizes the tree structure)
                newIndex.build();
                spatialIndex = newIndex;
                logger.debug("Rebuilt spatial index over {} footprints", newIndex.size());
            }
            return spatialIndex;
        }
    }
}
