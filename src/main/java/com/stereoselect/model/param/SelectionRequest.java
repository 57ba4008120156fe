package com.stereoselect.model.param;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stereoselect.export.ExportFormat;
import com.stereoselect.model.ChainRanking;
import com.stereoselect.model.FilterCondition;
import com.stereoselect.model.OverlapMetric;
import com.stereoselect.model.SelectionParams;

import java.util.List;

/**
 * Parameter class for stereo and multilook selection requests.
 * Every field is optional; unset fields fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelectionRequest {

    /**
     * "area" or "percent"
     */
    private String metric;

    private Double minMetric;
    private Double minArea;
    private Integer minPairs;
    private Boolean withinStrip;
    private Boolean withinInstrument;
    private Integer daysThreshold;
    private ChainRanking ranking;

    /**
     * Structured predicate over footprint fields
     */
    private FilterCondition filter;

    /**
     * Restrict multilook expansion to these anchors
     */
    private List<String> anchorIds;

    /**
     * Optional export of the result rows
     */
    private String exportPath;
    private ExportFormat exportFormat;

    /**
     * Merge this request over the given defaults
     *
     * @throws com.stereoselect.exception.ConfigurationException for an unsupported metric name
     */
    public SelectionParams toParams(SelectionParams defaults) {
        SelectionParams.SelectionParamsBuilder builder = defaults.toBuilder();
        if (metric != null) {
            builder.metricKind(OverlapMetric.fromName(metric));
        }
        if (minMetric != null) {
            builder.minMetric(minMetric);
        }
        if (minArea != null) {
            builder.minArea(minArea);
        }
        if (minPairs != null) {
            builder.minPairs(minPairs);
        }
        if (withinStrip != null) {
            builder.withinStrip(withinStrip);
        }
        if (withinInstrument != null) {
            builder.withinInstrument(withinInstrument);
        }
        if (daysThreshold != null) {
            builder.daysThreshold(daysThreshold);
        }
        if (ranking != null) {
            builder.ranking(ranking);
        }
        if (filter != null) {
            builder.attributeFilter(filter);
        }
        return builder.build();
    }

    @JsonIgnore
    public boolean hasExport() {
        return exportPath != null && !exportPath.isBlank();
    }
}
