package com.stereoselect.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stereoselect.model.base.BaseSpatialEntity;

import java.util.List;

/**
 * Ordered chain of footprints whose cumulative intersection still exceeds the
 * area floor. The entity id is the pairname, which callers use as the natural
 * key when deduplicating groups across anchors.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MultilookGroup extends BaseSpatialEntity<String> {

    /** Anchor the chain was grown from, always pairIds[0] */
    private final String srcId;

    @Singular
    private final List<String> pairIds;

    /** Area of the cumulative intersection */
    private final double area;

    public String getPairname() {
        return getId();
    }

    public int getPairCount() {
        return pairIds.size();
    }
}
