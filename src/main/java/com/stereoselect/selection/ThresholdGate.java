package com.stereoselect.selection;

import com.stereoselect.model.OverlapPair;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drops overlaps whose metric does not strictly exceed the minimum
 */
@Component
public class ThresholdGate {

    /**
     * @return a new map, in input order, holding only entries with metric &gt; minMetric
     */
    public Map<String, OverlapPair> gate(Map<String, OverlapPair> pairsByCandidate, double minMetric) {
        Map<String, OverlapPair> selected = new LinkedHashMap<>();
        pairsByCandidate.forEach((candidateId, pair) -> {
            if (pair.getMetric() > minMetric) {
                selected.put(candidateId, pair);
            }
        });
        return selected;
    }
}
