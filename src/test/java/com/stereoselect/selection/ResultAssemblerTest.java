package com.stereoselect.selection;

import com.stereoselect.model.DateWindow;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.MultilookGroup;
import com.stereoselect.model.OutputSchema;
import com.stereoselect.model.OverlapMetric;
import com.stereoselect.model.OverlapPair;
import com.stereoselect.model.result.ResultRow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.stereoselect.support.TestFootprints.builder;
import static com.stereoselect.support.TestFootprints.day;
import static com.stereoselect.support.TestFootprints.rect;
import static org.junit.jupiter.api.Assertions.*;

class ResultAssemblerTest {

    private final ResultAssembler assembler = new ResultAssembler(OutputSchema.DEFAULT);

    private final Footprint a = builder("A", 0, 0, 20, 10)
            .stripId("s1").instrument("PS2").acquired(day("2020-06-01"))
            .attribute("cloud_cover", 0.05).build();
    private final Footprint b = builder("B", 0, 0, 10, 10)
            .stripId("s1").instrument("PSB.SD").acquired(day("2020-06-03")).build();

    @Test
    void stereoRowCarriesBothFootprintsAndPairColumns() {
        OverlapPair pair = OverlapPair.builder()
                .id("A-B").id1("A").id2("B")
                .geometry(rect(0, 0, 10, 10))
                .metric(50.0)
                .metricKind(OverlapMetric.PERCENT)
                .dateWindow(DateWindow.around(a.getAcquired(), 5))
                .build();

        ResultRow row = assembler.stereoRow(pair, a, b);
        Map<String, Object> properties = row.getProperties();

        assertEquals("A-B", row.getKey());
        assertEquals(List.of("A", "B"), row.getMemberIds());
        assertEquals("A", properties.get("id"));
        assertEquals("B", properties.get("id2"));
        assertEquals("Dove", properties.get("instrument_name"));
        assertEquals("SuperDove", properties.get("instrument_name2"));
        assertEquals(0.05, properties.get("cloud_cover"));
        assertEquals("A-B", properties.get("pairname"));
        assertEquals(50.0, properties.get("ovlp_perc"));
        assertFalse(properties.containsKey("ovlp_area"));
        assertEquals("2020-05-27 - 2020-06-06", properties.get("days_window"));
        assertEquals(2L, properties.get("date_diff"));
        assertEquals(100.0, row.getGeometry().getArea(), 1e-9);
    }

    @Test
    void secondFootprintColumnsFollowTheSchemaSuffix() {
        ResultAssembler suffixed = new ResultAssembler(OutputSchema.DEFAULT.toBuilder().secondSuffix("_b").build());
        OverlapPair pair = OverlapPair.builder()
                .id("A-B").id1("A").id2("B")
                .geometry(rect(0, 0, 10, 10))
                .metric(100.0)
                .metricKind(OverlapMetric.AREA)
                .build();

        Map<String, Object> properties = suffixed.stereoRow(pair, a, b).getProperties();

        assertEquals("B", properties.get("id_b"));
        assertEquals("s1", properties.get("strip_id_b"));
        assertEquals("SuperDove", properties.get("instrument_name_b"));
        assertFalse(properties.containsKey("id2"));
    }

    @Test
    void stereoRowWithoutWindowOmitsWindowColumn() {
        OverlapPair pair = OverlapPair.builder()
                .id("A-B").id1("A").id2("B").metric(100.0).metricKind(OverlapMetric.AREA).build();

        ResultRow row = assembler.stereoRows(List.of(pair), id -> id.equals("A") ? a : b).get(0);

        assertEquals(100.0, row.getProperties().get("ovlp_area"));
        assertFalse(row.getProperties().containsKey("days_window"));
    }

    @Test
    void multilookRowColumns() {
        MultilookGroup group = MultilookGroup.builder()
                .id("A-B-C").srcId("A").pairIds(List.of("A", "B", "C"))
                .geometry(rect(4.5, 0, 10, 10)).area(55.0).build();

        ResultRow row = assembler.multilookRow(group);

        assertEquals(List.of("src_id", "pairname", "pair_count", "area"),
                     List.copyOf(row.getProperties().keySet()));
        assertEquals(3, row.getProperties().get("pair_count"));
        assertEquals(55.0, row.getProperties().get("area"));
        assertEquals(List.of("A", "B", "C"), row.getMemberIds());
    }

    @Test
    void uniqueIdsAreSortedAndDistinct() {
        MultilookGroup first = MultilookGroup.builder()
                .id("C-A").srcId("C").pairIds(List.of("C", "A")).area(10).build();
        MultilookGroup second = MultilookGroup.builder()
                .id("A-C-B").srcId("A").pairIds(List.of("A", "C", "B")).area(5).build();

        assertEquals(List.of("A", "B", "C"),
                     List.copyOf(assembler.uniqueIds(assembler.multilookRows(List.of(first, second)))));
    }
}
