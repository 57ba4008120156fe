package com.stereoselect.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.stereoselect.support.TestFootprints.builder;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FilterCondition over footprint fields
 */
public class FilterConditionTest {

    private Footprint footprint;

    @BeforeEach
    public void setUp() {
        footprint = builder("20200601_101530_1014", 0, 0, 10, 10)
                .stripId("3512821")
                .instrument("PS2")
                .attribute("cloud_cover", 0.05)
                .attribute("off_nadir", "3.2")
                .attribute("quality_category", "standard")
                .build();
    }

    @Test
    public void testFixedFieldEquals() {
        assertTrue(FilterCondition.equalTo("instrument", "PS2").matches(footprint));
        assertTrue(FilterCondition.equalTo("strip_id", "3512821").matches(footprint));
        assertFalse(FilterCondition.equalTo("instrument", "PSB.SD").matches(footprint));
    }

    @Test
    public void testAttributeEquals() {
        assertTrue(FilterCondition.equalTo("quality_category", "standard").matches(footprint));
        assertTrue(FilterCondition.equalTo("cloud_cover", 0.05).matches(footprint));
        assertFalse(FilterCondition.equalTo("cloud_cover", 0.5).matches(footprint));
        assertFalse(FilterCondition.equalTo("missing", "value").matches(footprint));
    }

    @Test
    public void testNumericComparisons() {
        assertTrue(FilterCondition.lessThan("cloud_cover", 0.1).matches(footprint));
        assertFalse(FilterCondition.greaterThan("cloud_cover", 0.1).matches(footprint));

        // numeric text compares as a number
        assertTrue(FilterCondition.greaterThan("off_nadir", 3).matches(footprint));
        assertTrue(FilterCondition.builder()
                .key("off_nadir").operator(FilterCondition.Operator.LESS_EQUAL).value(3.2)
                .build().matches(footprint));
    }

    @Test
    public void testOrderingOnMissingOrTextValueNeverMatches() {
        assertFalse(FilterCondition.lessThan("sun_elevation", 40).matches(footprint));
        assertFalse(FilterCondition.greaterThan("quality_category", 1).matches(footprint));
    }

    @Test
    public void testInAndNotIn() {
        assertTrue(FilterCondition.in("instrument", Arrays.asList("PS2", "PS2.SD")).matches(footprint));
        assertFalse(FilterCondition.in("instrument", List.of("PSB.SD")).matches(footprint));

        FilterCondition notIn = FilterCondition.builder()
                .key("instrument")
                .operator(FilterCondition.Operator.NOT_IN)
                .values(List.of("PSB.SD"))
                .build();
        assertTrue(notIn.matches(footprint));
    }

    @Test
    public void testExistsAndStartsWith() {
        assertTrue(FilterCondition.builder().key("cloud_cover")
                .operator(FilterCondition.Operator.EXISTS).build().matches(footprint));
        assertTrue(FilterCondition.builder().key("snow_ice_percent")
                .operator(FilterCondition.Operator.NOT_EXISTS).build().matches(footprint));
        assertTrue(FilterCondition.builder().key("id")
                .operator(FilterCondition.Operator.STARTS_WITH).value("20200601").build().matches(footprint));
    }

    @Test
    public void testLogicalCombinations() {
        FilterCondition clearDove = FilterCondition.and(Arrays.asList(
                FilterCondition.equalTo("instrument", "PS2"),
                FilterCondition.lessThan("cloud_cover", 0.1)));
        assertTrue(clearDove.matches(footprint));

        FilterCondition superDoveOrCloudy = FilterCondition.or(Arrays.asList(
                FilterCondition.equalTo("instrument", "PSB.SD"),
                FilterCondition.greaterThan("cloud_cover", 0.5)));
        assertFalse(superDoveOrCloudy.matches(footprint));
    }

    @Test
    public void testMissingOperatorIsRejected() {
        FilterCondition incomplete = FilterCondition.builder().key("instrument").value("PS2").build();
        assertThrows(IllegalArgumentException.class, () -> incomplete.matches(footprint));
    }
}
