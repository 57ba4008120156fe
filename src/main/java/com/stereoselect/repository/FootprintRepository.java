package com.stereoselect.repository;

import com.stereoselect.model.Footprint;
import org.locationtech.jts.geom.Geometry;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the footprint candidate pool and its spatial index
 */
public interface FootprintRepository {

    /**
     * Index a single footprint, replacing any footprint with the same id
     */
    void index(Footprint footprint);

    /**
     * Bulk index multiple footprints for better performance
     */
    void bulkIndex(Collection<Footprint> footprints);

    /**
     * Get a footprint by id
     */
    Optional<Footprint> get(String id);

    /**
     * All footprints, ordered by id
     */
    List<Footprint> all();

    /**
     * Footprints whose geometry intersects the given geometry, ordered by id
     */
    List<Footprint> intersecting(Geometry geometry);

    /**
     * Remove a footprint
     */
    boolean remove(String id);

    /**
     * Number of footprints held
     */
    long count();

    /**
     * Number of footprints with a usable geometry
     */
    long indexedCount();

    /**
     * Clear all footprints and the spatial index
     */
    void flushAll();
}
