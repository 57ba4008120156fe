package com.stereoselect.selection;

import com.stereoselect.geometry.JtsGeometryOperations;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.MultilookGroup;
import com.stereoselect.model.OutputSchema;
import com.stereoselect.model.SelectionParams;
import com.stereoselect.repository.FootprintRepository;
import com.stereoselect.repository.impl.InMemoryFootprintRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stereoselect.support.TestFootprints.builder;
import static org.junit.jupiter.api.Assertions.*;

class MultilookSelectorTest {

    private MultilookSelector selector;
    private FootprintRepository repository;

    @BeforeEach
    void setUp() {
        JtsGeometryOperations operations = new JtsGeometryOperations();
        OverlapEvaluator evaluator = new OverlapEvaluator(operations, OutputSchema.DEFAULT);
        selector = new MultilookSelector(new CandidateFilter(),
                new MultilookChainExpander(operations, evaluator, OutputSchema.DEFAULT));
        repository = new InMemoryFootprintRepository();
    }

    @Test
    void withinStripGroupsShareTheAnchorStrip() {
        Footprint a = builder("A", 0, 0, 20, 10).stripId("s1").build();
        repository.bulkIndex(List.of(a,
                builder("B", 0, 0, 10, 10).stripId("s1").build(),
                builder("C", 4.5, 0, 12.5, 10).stripId("s2").build()));

        SelectionParams params = SelectionParams.builder().minPairs(2).minArea(50).withinStrip(true).build();
        List<MultilookGroup> groups = selector.selectForAnchor(a, repository, params);

        assertEquals(1, groups.size());
        assertEquals("A-B", groups.get(0).getPairname());
    }

    @Test
    void candidatesComeFromTheSpatialIndex() {
        Footprint a = builder("A", 0, 0, 20, 10).build();
        repository.bulkIndex(List.of(a,
                builder("B", 0, 0, 10, 10).build(),
                builder("C", 4.5, 0, 12.5, 10).build(),
                builder("F", 500, 500, 510, 510).build()));

        List<MultilookGroup> groups = selector.selectForAnchor(a, repository,
                SelectionParams.builder().minPairs(3).minArea(50).build());

        assertEquals(1, groups.size());
        assertEquals("A-B-C", groups.get(0).getPairname());
    }
}
