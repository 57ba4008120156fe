package com.stereoselect.model;

import lombok.Builder;
import lombok.Value;

/**
 * Field names and formatting rules for result rows and footprint ingestion.
 * One immutable instance is shared by the loaders, the selectors and the
 * result assembler.
 */
@Value
@Builder(toBuilder = true)
public class OutputSchema {

    public static final OutputSchema DEFAULT = OutputSchema.builder().build();

    @Builder.Default String id = "id";
    @Builder.Default String stripId = "strip_id";
    @Builder.Default String instrument = "instrument";
    @Builder.Default String instrumentName = "instrument_name";
    @Builder.Default String acquired = "acquired";
    @Builder.Default String geometry = "geometry";
    @Builder.Default String pairname = "pairname";
    @Builder.Default String overlapGeometry = "ovlp_geom";
    @Builder.Default String overlapArea = "ovlp_area";
    @Builder.Default String overlapPercent = "ovlp_perc";
    @Builder.Default String daysWindow = "days_window";
    @Builder.Default String dateDiff = "date_diff";
    @Builder.Default String srcId = "src_id";
    @Builder.Default String pairCount = "pair_count";
    @Builder.Default String area = "area";

    /** Appended to every column of the second footprint of a stereo pair */
    @Builder.Default String secondSuffix = "2";

    /** Joins footprint ids into a pairname */
    @Builder.Default String separator = "-";

    @Builder.Default String dateWindowPattern = "yyyy-MM-dd";

    public String metricField(OverlapMetric metric) {
        return metric == OverlapMetric.PERCENT ? overlapPercent : overlapArea;
    }

    public String second(String field) {
        return field + secondSuffix;
    }

    public String pairname(Iterable<String> ids) {
        return String.join(separator, ids);
    }
}
