package com.stereoselect.selection;

import com.stereoselect.geometry.GeometryOperations;
import com.stereoselect.model.DateWindow;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.OutputSchema;
import com.stereoselect.model.OverlapMetric;
import com.stereoselect.model.OverlapPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Computes the intersection and overlap metric of an anchor with each of its
 * candidates. Disjoint candidates are omitted rather than given a zero metric.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OverlapEvaluator {

    private final GeometryOperations geometryOperations;
    private final OutputSchema outputSchema;

    public Map<String, OverlapPair> evaluate(Footprint anchor, Collection<Footprint> candidates,
                                             OverlapMetric metricKind) {
        return evaluate(anchor, candidates, metricKind, null);
    }

    /**
     * @return overlap pairs keyed by candidate id, in ascending id order
     */
    public Map<String, OverlapPair> evaluate(Footprint anchor, Collection<Footprint> candidates,
                                             OverlapMetric metricKind, DateWindow dateWindow) {
        Map<String, OverlapPair> pairs = new TreeMap<>();
        for (Footprint candidate : candidates) {
            evaluatePair(anchor, candidate, metricKind, dateWindow)
                    .ifPresent(pair -> pairs.put(candidate.getId(), pair));
        }
        return pairs;
    }

    /**
     * Overlap of one anchor/candidate pair, empty when the two do not overlap,
     * when the candidate has no geometry, or when a percent metric meets a
     * zero-area union
     */
    public Optional<OverlapPair> evaluatePair(Footprint anchor, Footprint candidate,
                                              OverlapMetric metricKind, DateWindow dateWindow) {
        if (!candidate.hasGeometry()) {
            log.debug("Candidate {} of anchor {} has no geometry, skipped", candidate.getId(), anchor.getId());
            return Optional.empty();
        }
        if (!geometryOperations.intersects(anchor.getGeometry(), candidate.getGeometry())) {
            return Optional.empty();
        }

        Geometry intersection = geometryOperations.intersection(anchor.getGeometry(), candidate.getGeometry());
        if (intersection.isEmpty()) {
            return Optional.empty();
        }

        double metric;
        if (metricKind == OverlapMetric.PERCENT) {
            Geometry union = geometryOperations.union(anchor.getGeometry(), candidate.getGeometry());
            double unionArea = geometryOperations.area(union);
            if (unionArea <= 0.0) {
                log.debug("Degenerate overlap between {} and {}: zero-area union, pair dropped",
                          anchor.getId(), candidate.getId());
                return Optional.empty();
            }
            metric = percentOfUnion(geometryOperations.area(intersection), unionArea);
        } else {
            metric = geometryOperations.area(intersection);
        }

        return Optional.of(OverlapPair.builder()
                .id(outputSchema.pairname(List.of(anchor.getId(), candidate.getId())))
                .id1(anchor.getId())
                .id2(candidate.getId())
                .geometry(intersection)
                .metric(metric)
                .metricKind(metricKind)
                .dateWindow(dateWindow)
                .build());
    }

    /**
     * Intersection over union, rounded half-even to four decimals on the
     * exact binary value of the ratio, as a percentage
     */
    static double percentOfUnion(double intersectionArea, double unionArea) {
        double ratio = new BigDecimal(intersectionArea / unionArea)
                .setScale(4, RoundingMode.HALF_EVEN)
                .doubleValue();
        return ratio * 100;
    }
}
