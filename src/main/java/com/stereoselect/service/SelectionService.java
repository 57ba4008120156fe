package com.stereoselect.service;

import com.stereoselect.model.MultilookGroup;
import com.stereoselect.model.OverlapPair;
import com.stereoselect.model.SelectionParams;
import com.stereoselect.model.result.SelectionResult;

import java.util.Collection;

/**
 * Runs stereo and multilook selection over the footprint repository
 */
public interface SelectionService {

    /**
     * Two-scene stereo pairs for every footprint in the repository
     */
    SelectionResult<OverlapPair> selectStereoPairs(SelectionParams params);

    /**
     * Multilook groups grown from every footprint in the repository
     */
    SelectionResult<MultilookGroup> selectMultilookGroups(SelectionParams params);

    /**
     * Multilook groups grown from the given anchors only; unknown ids are ignored
     */
    SelectionResult<MultilookGroup> selectMultilookGroups(SelectionParams params, Collection<String> anchorIds);
}
