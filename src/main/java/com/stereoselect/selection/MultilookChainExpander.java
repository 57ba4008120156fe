package com.stereoselect.selection;

import com.stereoselect.exception.ConfigurationException;
import com.stereoselect.exception.InvalidFootprintException;
import com.stereoselect.geometry.GeometryOperations;
import com.stereoselect.model.ChainRanking;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.MultilookGroup;
import com.stereoselect.model.OutputSchema;
import com.stereoselect.model.OverlapMetric;
import com.stereoselect.model.OverlapPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Grows multilook chains from a single anchor.
 *
 * <p>Candidates overlapping the anchor by more than the area floor are ranked
 * by that overlap, largest first, ties broken by ascending id. Starting from
 * the anchor geometry, each candidate in turn is intersected with the running
 * intersection. Expansion stops at the first candidate whose fold is empty or
 * no larger than the floor; candidates after it are not tried. Every prefix
 * that reaches {@code minPairs} members is emitted, so one anchor may yield
 * groups of several lengths.
 *
 * <p>Intersections never grow, so the area of successive groups from one
 * anchor is non-increasing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultilookChainExpander {

    private static final Comparator<Ranked> BY_AREA_DESC_THEN_ID =
            Comparator.comparingDouble(Ranked::area).reversed()
                      .thenComparing(ranked -> ranked.footprint().getId());

    private final GeometryOperations geometryOperations;
    private final OverlapEvaluator overlapEvaluator;
    private final OutputSchema outputSchema;

    public List<MultilookGroup> expand(Footprint anchor, Collection<Footprint> candidates,
                                       int minPairs, double minArea) {
        return expand(anchor, candidates, minPairs, minArea, ChainRanking.ANCHOR_OVERLAP);
    }

    /**
     * @return the emitted groups in chain-length order, empty when no chain
     *         reaches {@code minPairs} members above {@code minArea}
     * @throws InvalidFootprintException if the anchor has no usable geometry
     * @throws ConfigurationException if minPairs is not positive
     */
    public List<MultilookGroup> expand(Footprint anchor, Collection<Footprint> candidates,
                                       int minPairs, double minArea, ChainRanking ranking) {
        if (minPairs <= 0) {
            throw new ConfigurationException("min_pairs must be positive, got " + minPairs);
        }
        if (!anchor.hasGeometry()) {
            throw new InvalidFootprintException(anchor.getId(), "missing, empty or invalid geometry");
        }

        List<Ranked> ranked = rankAgainstAnchor(anchor, candidates, minArea);
        if (ranked.isEmpty()) {
            return Collections.emptyList();
        }
        if (ranked.size() + 1 < minPairs) {
            log.debug("Anchor {} has {} candidates above the area floor, chain cannot reach {} members",
                      anchor.getId(), ranked.size(), minPairs);
            return Collections.emptyList();
        }

        if (ranking == ChainRanking.RERANK_EACH_FOLD) {
            return expandReranking(anchor, ranked, minPairs, minArea);
        }
        return expandInAnchorOrder(anchor, ranked, minPairs, minArea);
    }

    private List<Ranked> rankAgainstAnchor(Footprint anchor, Collection<Footprint> candidates, double minArea) {
        Map<String, Footprint> byId = new HashMap<>();
        for (Footprint candidate : candidates) {
            byId.put(candidate.getId(), candidate);
        }

        Map<String, OverlapPair> overlaps = overlapEvaluator.evaluate(anchor, candidates, OverlapMetric.AREA);
        List<Ranked> ranked = new ArrayList<>();
        overlaps.forEach((candidateId, pair) -> {
            if (pair.getMetric() > minArea) {
                ranked.add(new Ranked(byId.get(candidateId), pair.getMetric()));
            }
        });
        ranked.sort(BY_AREA_DESC_THEN_ID);
        return ranked;
    }

    private List<MultilookGroup> expandInAnchorOrder(Footprint anchor, List<Ranked> ranked,
                                                     int minPairs, double minArea) {
        List<MultilookGroup> groups = new ArrayList<>();
        List<String> pairIds = new ArrayList<>();
        pairIds.add(anchor.getId());
        Geometry previous = anchor.getGeometry();

        for (Ranked next : ranked) {
            Geometry sub = geometryOperations.intersection(previous, next.footprint().getGeometry());
            if (sub.isEmpty()) {
                log.debug("No intersection with {}, chain from {} ends at {} members",
                          next.footprint().getId(), anchor.getId(), pairIds.size());
                break;
            }
            double area = geometryOperations.area(sub);
            if (area <= minArea) {
                break;
            }

            pairIds.add(next.footprint().getId());
            previous = sub;
            if (pairIds.size() >= minPairs) {
                groups.add(toGroup(anchor, pairIds, previous, area));
            }
        }
        return groups;
    }

    private List<MultilookGroup> expandReranking(Footprint anchor, List<Ranked> ranked,
                                                 int minPairs, double minArea) {
        List<MultilookGroup> groups = new ArrayList<>();
        List<String> pairIds = new ArrayList<>();
        pairIds.add(anchor.getId());
        Geometry previous = anchor.getGeometry();
        List<Footprint> remaining = new ArrayList<>();
        ranked.forEach(r -> remaining.add(r.footprint()));

        while (!remaining.isEmpty()) {
            Footprint best = null;
            Geometry bestSub = null;
            double bestArea = 0.0;
            for (Footprint candidate : remaining) {
                Geometry sub = geometryOperations.intersection(previous, candidate.getGeometry());
                double area = geometryOperations.area(sub);
                if (sub.isEmpty()) {
                    continue;
                }
                if (best == null || area > bestArea
                        || (area == bestArea && candidate.getId().compareTo(best.getId()) < 0)) {
                    best = candidate;
                    bestSub = sub;
                    bestArea = area;
                }
            }
            if (best == null || bestArea <= minArea) {
                break;
            }

            remaining.remove(best);
            pairIds.add(best.getId());
            previous = bestSub;
            if (pairIds.size() >= minPairs) {
                groups.add(toGroup(anchor, pairIds, previous, bestArea));
            }
        }
        return groups;
    }

    private MultilookGroup toGroup(Footprint anchor, List<String> pairIds, Geometry geometry, double area) {
        return MultilookGroup.builder()
                .id(outputSchema.pairname(pairIds))
                .srcId(anchor.getId())
                .pairIds(pairIds)
                .geometry(geometry)
                .area(area)
                .build();
    }

    private static final class Ranked {
        private final Footprint footprint;
        private final double area;

        Ranked(Footprint footprint, double area) {
            this.footprint = footprint;
            this.area = area;
        }

        Footprint footprint() {
            return footprint;
        }

        double area() {
            return area;
        }
    }
}
