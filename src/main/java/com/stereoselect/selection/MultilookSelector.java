package com.stereoselect.selection;

import com.stereoselect.model.Footprint;
import com.stereoselect.model.MultilookGroup;
import com.stereoselect.model.SelectionParams;
import com.stereoselect.repository.FootprintRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Multilook selection for one anchor: the footprints intersecting the anchor,
 * narrowed by the candidate filter, are handed to the chain expander.
 */
@Component
@RequiredArgsConstructor
public class MultilookSelector {

    private final CandidateFilter candidateFilter;
    private final MultilookChainExpander chainExpander;

    public List<MultilookGroup> selectForAnchor(Footprint anchor, FootprintRepository repository,
                                                SelectionParams params) {
        List<Footprint> candidates = anchor.hasGeometry()
                ? candidateFilter.filter(anchor, repository.intersecting(anchor.getGeometry()), params)
                : List.of();
        return chainExpander.expand(anchor, candidates, params.getMinPairs(), params.getMinArea(),
                                    params.getRanking());
    }
}
