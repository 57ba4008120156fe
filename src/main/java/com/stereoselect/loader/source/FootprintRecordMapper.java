package com.stereoselect.loader.source;

import com.stereoselect.model.Footprint;
import com.stereoselect.model.OutputSchema;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Map;

/**
 * Maps a parsed catalog record (column name to value) onto a Footprint.
 * The id, strip_id, instrument and acquired columns become fixed fields,
 * every other non-null column an attribute. Timestamps without an offset
 * are read as UTC.
 */
@Component
@RequiredArgsConstructor
public class FootprintRecordMapper {

    // date, optionally followed by 'T' or ' ', a time and an offset
    private static final DateTimeFormatter ACQUIRED_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
                .optionalStart().appendLiteral('T').optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .append(DateTimeFormatter.ISO_LOCAL_TIME)
                .optionalStart().appendOffsetId().optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private final OutputSchema schema;

    /**
     * @throws IllegalArgumentException if the record has no id or an unparseable acquisition time
     */
    public Footprint toFootprint(Map<String, ?> record, Geometry geometry) {
        Object id = record.get(schema.getId());
        if (id == null || id.toString().isBlank()) {
            throw new IllegalArgumentException("Record has no '" + schema.getId() + "' value");
        }

        Footprint.FootprintBuilder<?, ?> builder = Footprint.builder()
                .id(id.toString().trim())
                .geometry(geometry)
                .stripId(text(record.get(schema.getStripId())))
                .instrument(text(record.get(schema.getInstrument())))
                .acquired(parseInstant(text(record.get(schema.getAcquired()))));

        record.forEach((key, value) -> {
            if (value != null && !isFixedField(key)) {
                builder.attribute(key, value);
            }
        });
        return builder.build();
    }

    /**
     * Parse the timestamp layouts found in scene catalogs:
     * 2020-06-01T10:15:30.123456Z, 2020-06-01T10:15:30, 2020-06-01 10:15:30 and 2020-06-01
     */
    public Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            TemporalAccessor parsed = ACQUIRED_FORMAT.parse(value);
            if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                return OffsetDateTime.from(parsed).toInstant();
            }
            return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unparseable acquisition time: " + value, e);
        }
    }

    private boolean isFixedField(String key) {
        return key.equals(schema.getId()) || key.equals(schema.getStripId())
                || key.equals(schema.getInstrument()) || key.equals(schema.getAcquired())
                || key.equals(schema.getGeometry());
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
