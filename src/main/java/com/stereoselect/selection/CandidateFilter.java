package com.stereoselect.selection;

import com.stereoselect.model.DateWindow;
import com.stereoselect.model.FilterCondition;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.SelectionParams;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Narrows a candidate pool to the plausible partners of an anchor.
 * Active predicates combine with AND; a footprint lacking the field a
 * predicate needs never passes that predicate.
 */
@Component
public class CandidateFilter {

    /**
     * Filter the pool with the predicates enabled in the run parameters
     */
    public List<Footprint> filter(Footprint anchor, Collection<Footprint> pool, SelectionParams params) {
        DateWindow window = null;
        if (params.hasDateWindow()) {
            window = dateWindowFor(anchor, params);
            if (window == null) {
                // a window is required but the anchor has no acquisition time
                return Collections.emptyList();
            }
        }
        return filter(anchor, pool, params.isWithinStrip(), params.isWithinInstrument(),
                      window, params.getAttributeFilter());
    }

    public List<Footprint> filter(Footprint anchor, Collection<Footprint> pool,
                                  boolean withinStrip, boolean withinInstrument,
                                  DateWindow dateWindow, FilterCondition attributeFilter) {
        return pool.stream()
                .filter(candidate -> !Objects.equals(candidate.getId(), anchor.getId()))
                .filter(candidate -> !withinStrip || sameNonNull(anchor.getStripId(), candidate.getStripId()))
                .filter(candidate -> !withinInstrument || sameNonNull(anchor.getInstrument(), candidate.getInstrument()))
                .filter(candidate -> dateWindow == null || dateWindow.contains(candidate.getAcquired()))
                .filter(candidate -> attributeFilter == null || attributeFilter.matches(candidate))
                .collect(Collectors.toList());
    }

    /**
     * The anchor's symmetric date window, or null when no window is configured
     * or the anchor has no acquisition time
     */
    public DateWindow dateWindowFor(Footprint anchor, SelectionParams params) {
        if (!params.hasDateWindow() || anchor.getAcquired() == null) {
            return null;
        }
        return DateWindow.around(anchor.getAcquired(), params.getDaysThreshold());
    }

    private static boolean sameNonNull(String anchorValue, String candidateValue) {
        return anchorValue != null && anchorValue.equals(candidateValue);
    }
}
