package com.stereoselect.model.result;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one selection run: the records, their assembled rows and the
 * anchor bookkeeping callers report to users
 */
@Value
@Builder
public class SelectionResult<T> {

    @Singular
    List<T> records;

    @Singular
    List<ResultRow> rows;

    int anchorsProcessed;

    /** Anchors skipped because their footprint was invalid */
    @Singular
    List<String> skippedAnchorIds;

    public int getAnchorsSkipped() {
        return skippedAnchorIds.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
