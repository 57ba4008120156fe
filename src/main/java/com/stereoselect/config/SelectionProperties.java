package com.stereoselect.config;

import com.stereoselect.model.ChainRanking;
import com.stereoselect.model.OverlapMetric;
import com.stereoselect.model.SelectionParams;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Default selection parameters and worker pool sizing, bound from the
 * "stereo-select" section of application.yml
 */
@Component
@ConfigurationProperties(prefix = "stereo-select")
@Data
public class SelectionProperties {

    private Defaults defaults = new Defaults();

    /** Worker threads for per-anchor processing; 0 uses the available processors */
    private int threads = 0;

    @Data
    public static class Defaults {
        private OverlapMetric metric = OverlapMetric.AREA;
        private double minMetric = 0;
        private double minArea = 32_670_000;
        private int minPairs = 3;
        private boolean withinStrip = false;
        private boolean withinInstrument = false;
        private Integer daysThreshold;
        private ChainRanking ranking = ChainRanking.ANCHOR_OVERLAP;
    }

    public SelectionParams toParams() {
        return SelectionParams.builder()
                .metricKind(defaults.getMetric())
                .minMetric(defaults.getMinMetric())
                .minArea(defaults.getMinArea())
                .minPairs(defaults.getMinPairs())
                .withinStrip(defaults.isWithinStrip())
                .withinInstrument(defaults.isWithinInstrument())
                .daysThreshold(defaults.getDaysThreshold())
                .ranking(defaults.getRanking())
                .build();
    }

    public int resolvedThreads() {
        return threads > 0 ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
