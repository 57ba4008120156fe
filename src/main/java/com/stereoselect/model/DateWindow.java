package com.stereoselect.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Symmetric acquisition window [center - days, center + days] used to admit
 * temporally close candidates. Membership is tested on the open interval.
 */
@Value
public class DateWindow {

    Instant start;
    Instant end;

    public static DateWindow around(Instant center, int days) {
        Duration offset = Duration.ofDays(days);
        return new DateWindow(center.minus(offset), center.plus(offset));
    }

    /**
     * Strictly inside the window; the bounds themselves are excluded
     */
    public boolean contains(Instant instant) {
        return instant != null && instant.isAfter(start) && instant.isBefore(end);
    }

    /**
     * Render as "start - end" with the given date pattern, in UTC
     */
    public String format(String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern).withZone(ZoneOffset.UTC);
        return formatter.format(start) + " - " + formatter.format(end);
    }
}
