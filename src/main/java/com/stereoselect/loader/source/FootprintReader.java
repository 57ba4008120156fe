package com.stereoselect.loader.source;

import com.stereoselect.model.Footprint;

import java.io.IOException;
import java.util.List;

/**
 * Parses one kind of footprint source into footprint records
 */
public interface FootprintReader {

    /**
     * Read every record of the source. Records that cannot be parsed are
     * counted as skipped and logged; only an unreadable source throws.
     */
    ReadResult read(FootprintSource source) throws IOException;

    /**
     * Check if this reader supports the given source type
     */
    boolean supports(FootprintSource.SourceType type);

    class ReadResult {
        private final List<Footprint> footprints;
        private final long skipped;

        public ReadResult(List<Footprint> footprints, long skipped) {
            this.footprints = footprints;
            this.skipped = skipped;
        }

        public List<Footprint> getFootprints() { return footprints; }
        public long getSkipped() { return skipped; }
    }
}
