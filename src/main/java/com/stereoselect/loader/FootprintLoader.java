package com.stereoselect.loader;

import com.stereoselect.loader.source.FootprintSource;

import java.util.concurrent.CompletableFuture;

/**
 * Interface for bulk footprint loading into the repository
 */
public interface FootprintLoader {

    /**
     * Load footprints from any supported source
     */
    CompletableFuture<LoadResult> loadFromSource(FootprintSource source);

    /**
     * Result of a footprint loading operation
     */
    class LoadResult {
        private final boolean success;
        private final long recordsLoaded;
        private final long recordsSkipped;
        private final long durationMs;
        private final String message;

        public LoadResult(boolean success, long recordsLoaded, long recordsSkipped, long durationMs, String message) {
            this.success = success;
            this.recordsLoaded = recordsLoaded;
            this.recordsSkipped = recordsSkipped;
            this.durationMs = durationMs;
            this.message = message;
        }

        public static LoadResult failure(long durationMs, String message) {
            return new LoadResult(false, 0, 0, durationMs, message);
        }

        // Getters
        public boolean isSuccess() { return success; }
        public long getRecordsLoaded() { return recordsLoaded; }
        public long getRecordsSkipped() { return recordsSkipped; }
        public long getDurationMs() { return durationMs; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("LoadResult{success=%s, records=%d, skipped=%d, duration=%dms, message='%s'}",
                               success, recordsLoaded, recordsSkipped, durationMs, message);
        }
    }
}
