package com.stereoselect.loader.source;

import lombok.Builder;
import lombok.Data;

/**
 * Describes a footprint file to load
 */
@Data
@Builder
public class FootprintSource {

    /**
     * Type of footprint source
     */
    public enum SourceType {
        FILE_GEOJSON,
        FILE_CSV
    }

    private SourceType type;
    private String location; // File path

    public static FootprintSource of(SourceType type, String location) {
        return FootprintSource.builder()
                .type(type)
                .location(location)
                .build();
    }
}
