package com.tapas.drivertips.service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Maps an instant to the day and week bucket identifiers used as aggregate keys.
 * The write path (tip events) and the read path (queries for "now") must use these
 * same functions so that the keys line up.
 */
public final class TimeBuckets {

    public static final String DAY_PREFIX = "DAY#";
    public static final String WEEK_PREFIX = "WEEK#";

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private TimeBuckets() {
    }

    /**
     * UTC calendar date, {@code YYYY-MM-DD}.
     */
    public static String dayBucket(Instant timestamp) {
        return LocalDate.ofInstant(timestamp, ZoneOffset.UTC).format(DAY_FORMAT);
    }

    /**
     * Week number in the form {@code YYYY-Www}.
     * <p>
     * week = ceil((daysSinceJan1 + weekday + 1) / 7), where weekday is the UTC
     * day-of-week of the timestamp itself with Sunday = 0. Around the turn of the
     * year this yields values such as W53 that differ from ISO-8601; stored keys
     * depend on it, so it must not be changed.
     */
    public static String weekBucket(Instant timestamp) {
        ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
        Instant firstDay = LocalDate.of(utc.getYear(), 1, 1)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();

        long daysSinceFirstDay = Math.floorDiv(
                Duration.between(firstDay, timestamp).toMillis(),
                Duration.ofDays(1).toMillis());
        int weekday = utc.getDayOfWeek().getValue() % 7;

        long week = ceilDiv(daysSinceFirstDay + weekday + 1, 7);
        return String.format("%d-W%02d", utc.getYear(), week);
    }

    public static String dayKey(Instant timestamp) {
        return DAY_PREFIX + dayBucket(timestamp);
    }

    public static String weekKey(Instant timestamp) {
        return WEEK_PREFIX + weekBucket(timestamp);
    }

    private static long ceilDiv(long x, long y) {
        return -Math.floorDiv(-x, y);
    }
}
