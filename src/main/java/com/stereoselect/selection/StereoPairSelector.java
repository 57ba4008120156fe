package com.stereoselect.selection;

import com.stereoselect.exception.InvalidFootprintException;
import com.stereoselect.model.DateWindow;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.OverlapPair;
import com.stereoselect.model.SelectionParams;
import com.stereoselect.repository.FootprintRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Two-scene stereo selection for one anchor: spatial pre-query, candidate
 * filter, overlap evaluation and threshold gate. Every surviving pair is a
 * terminal result.
 */
@Component
@RequiredArgsConstructor
public class StereoPairSelector {

    private final CandidateFilter candidateFilter;
    private final OverlapEvaluator overlapEvaluator;
    private final ThresholdGate thresholdGate;

    /**
     * @return surviving pairs ordered by the other footprint's id
     * @throws InvalidFootprintException if the anchor has no usable geometry
     */
    public List<OverlapPair> selectForAnchor(Footprint anchor, FootprintRepository repository,
                                             SelectionParams params) {
        if (!anchor.hasGeometry()) {
            throw new InvalidFootprintException(anchor.getId(), "missing, empty or invalid geometry");
        }

        List<Footprint> candidates = candidateFilter.filter(
                anchor, repository.intersecting(anchor.getGeometry()), params);
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }

        DateWindow window = candidateFilter.dateWindowFor(anchor, params);
        Map<String, OverlapPair> overlaps =
                overlapEvaluator.evaluate(anchor, candidates, params.getMetricKind(), window);
        return new ArrayList<>(thresholdGate.gate(overlaps, params.getMinMetric()).values());
    }
}
