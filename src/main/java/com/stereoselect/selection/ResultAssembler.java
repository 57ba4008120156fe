package com.stereoselect.selection;

import com.stereoselect.model.Footprint;
import com.stereoselect.model.Instrument;
import com.stereoselect.model.MultilookGroup;
import com.stereoselect.model.OutputSchema;
import com.stereoselect.model.OverlapPair;
import com.stereoselect.model.result.ResultRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Formats overlap pairs and multilook groups as flat rows.
 *
 * <p>A stereo row holds the anchor's columns, then the other footprint's
 * columns each suffixed with {@link OutputSchema#getSecondSuffix()}, then the
 * pair columns. A multilook row holds src_id, pairname, pair_count and area.
 */
@Component
@RequiredArgsConstructor
public class ResultAssembler {

    private final OutputSchema schema;

    public List<ResultRow> stereoRows(Collection<OverlapPair> pairs, Function<String, Footprint> lookup) {
        return pairs.stream()
                .map(pair -> stereoRow(pair, lookup.apply(pair.getId1()), lookup.apply(pair.getId2())))
                .collect(Collectors.toList());
    }

    public ResultRow stereoRow(OverlapPair pair, Footprint first, Footprint second) {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (first != null) {
            putFootprintColumns(properties, first, UnaryOperator.identity());
        }
        if (second != null) {
            putFootprintColumns(properties, second, schema::second);
        }

        properties.put(schema.getPairname(), pair.getPairname());
        properties.put(schema.metricField(pair.getMetricKind()), pair.getMetric());
        if (pair.getDateWindow() != null) {
            properties.put(schema.getDaysWindow(), pair.getDateWindow().format(schema.getDateWindowPattern()));
        }
        if (first != null && second != null && first.getAcquired() != null && second.getAcquired() != null) {
            long days = Duration.between(first.getAcquired(), second.getAcquired()).abs().toDays();
            properties.put(schema.getDateDiff(), days);
        }

        return ResultRow.builder()
                .key(pair.getPairname())
                .memberId(pair.getId1())
                .memberId(pair.getId2())
                .geometry(pair.getGeometry())
                .properties(properties)
                .build();
    }

    public List<ResultRow> multilookRows(Collection<MultilookGroup> groups) {
        return groups.stream().map(this::multilookRow).collect(Collectors.toList());
    }

    public ResultRow multilookRow(MultilookGroup group) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(schema.getSrcId(), group.getSrcId());
        properties.put(schema.getPairname(), group.getPairname());
        properties.put(schema.getPairCount(), group.getPairCount());
        properties.put(schema.getArea(), group.getArea());

        return ResultRow.builder()
                .key(group.getPairname())
                .memberIds(group.getPairIds())
                .geometry(group.getGeometry())
                .properties(properties)
                .build();
    }

    /**
     * Every footprint id referenced by the rows, sorted
     */
    public Set<String> uniqueIds(Collection<ResultRow> rows) {
        Set<String> ids = new TreeSet<>();
        rows.forEach(row -> ids.addAll(row.getMemberIds()));
        return ids;
    }

    private void putFootprintColumns(Map<String, Object> properties, Footprint footprint,
                                     UnaryOperator<String> column) {
        properties.put(column.apply(schema.getId()), footprint.getId());
        properties.put(column.apply(schema.getStripId()), footprint.getStripId());
        properties.put(column.apply(schema.getInstrument()), footprint.getInstrument());
        properties.put(column.apply(schema.getInstrumentName()),
                       Instrument.nameOf(footprint.getInstrument()).orElse(null));
        properties.put(column.apply(schema.getAcquired()), footprint.getAcquired());
        footprint.getAttributes().forEach((key, value) -> properties.put(column.apply(key), value));
    }
}
