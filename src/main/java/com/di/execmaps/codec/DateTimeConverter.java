package com.di.execmaps.codec;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Converts in-memory {@link Instant}s to the backend's timestamp columns and back.
 *
 * <p>Columns are {@code TIMESTAMP} without zone holding UTC wall-clock time. A missing time is
 * written as {@link #MIN_DATE_TIME} because the columns are {@code NOT NULL}, and read back as
 * {@code null}. Instants are truncated to the precision the backend keeps; a truncated instant
 * must lie after {@link #MIN_DATE_TIME} and no later than {@link #MAX_DATE_TIME}.
 */
public final class DateTimeConverter {

    /** Stand-in for "no time"; lower bound accepted by every supported backend. */
    public static final LocalDateTime MIN_DATE_TIME = LocalDateTime.of(1000, 1, 1, 0, 0);

    /** Upper bound accepted by every supported backend. */
    public static final LocalDateTime MAX_DATE_TIME = LocalDateTime.of(9999, 12, 31, 23, 59, 59, 999_999_000);

    private static final Instant MIN_INSTANT = MIN_DATE_TIME.toInstant(ZoneOffset.UTC);
    private static final Instant MAX_INSTANT = MAX_DATE_TIME.toInstant(ZoneOffset.UTC);

    private final ChronoUnit precision;

    public DateTimeConverter(ChronoUnit precision) {
        this.precision = precision;
    }

    /**
     * @throws IllegalArgumentException if the instant is at or before {@link #MIN_DATE_TIME},
     *                                  which reads back as "no time", or after {@link #MAX_DATE_TIME}
     */
    public LocalDateTime toDbDateTime(Instant instant) {
        if (instant == null) {
            return MIN_DATE_TIME;
        }
        Instant normalized = normalize(instant);
        if (!normalized.isAfter(MIN_INSTANT) || normalized.isAfter(MAX_INSTANT)) {
            throw new IllegalArgumentException(String.format(
                    "Timestamp %s is outside the storable range (%sZ, %sZ]", instant, MIN_DATE_TIME, MAX_DATE_TIME));
        }
        return LocalDateTime.ofInstant(normalized, ZoneOffset.UTC);
    }

    public Instant fromDbDateTime(LocalDateTime dateTime) {
        if (dateTime == null || dateTime.equals(MIN_DATE_TIME)) {
            return null;
        }
        return dateTime.toInstant(ZoneOffset.UTC);
    }

    /** The instant as it will read back after a write. */
    public Instant normalize(Instant instant) {
        return instant == null ? null : instant.truncatedTo(precision);
    }
}
