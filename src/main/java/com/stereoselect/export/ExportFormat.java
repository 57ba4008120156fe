package com.stereoselect.export;

/**
 * File formats result rows can be written in
 */
public enum ExportFormat {
    /** FeatureCollection, one feature per row keyed by pairname */
    GEOJSON,
    /** Header plus one line per row, geometry as WKT */
    CSV,
    /** Every footprint id referenced by the rows, one per line */
    IDS
}
