package com.stereoselect.selection;

import com.stereoselect.model.OverlapMetric;
import com.stereoselect.model.OverlapPair;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdGateTest {

    private final ThresholdGate gate = new ThresholdGate();

    @Test
    void keepsOnlyMetricsStrictlyAboveMinimum() {
        Map<String, OverlapPair> pairs = new LinkedHashMap<>();
        pairs.put("C", pair("C", 80.0));
        pairs.put("B", pair("B", 100.0));
        pairs.put("D", pair("D", 0.0));

        Map<String, OverlapPair> gated = gate.gate(pairs, 80.0);

        assertEquals(List.of("B"), List.copyOf(gated.keySet()));
    }

    @Test
    void preservesInputOrder() {
        Map<String, OverlapPair> pairs = new LinkedHashMap<>();
        pairs.put("C", pair("C", 80.0));
        pairs.put("B", pair("B", 100.0));

        assertEquals(List.of("C", "B"), List.copyOf(gate.gate(pairs, 0).keySet()));
    }

    @Test
    void zeroMinimumDropsZeroMetrics() {
        Map<String, OverlapPair> pairs = Map.of("D", pair("D", 0.0));

        assertTrue(gate.gate(pairs, 0).isEmpty());
        assertEquals(1, pairs.size());
    }

    private static OverlapPair pair(String candidateId, double metric) {
        return OverlapPair.builder()
                .id("A-" + candidateId)
                .id1("A")
                .id2(candidateId)
                .metric(metric)
                .metricKind(OverlapMetric.AREA)
                .build();
    }
}
