package com.questrail.streaming.digitizer.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Fixed-layout GPS timestamp attached to every digitizer frame.
 *
 * <p>All fields are unsigned and range-checked on construction. The year is
 * counted from 2000, so the representable span is 2000 through 2255.</p>
 *
 * @param year        years since 2000 (0-255)
 * @param dayOfYear   day of year (1-366)
 * @param hour        hour (0-23)
 * @param minute      minute (0-59)
 * @param second      second (0-59)
 * @param millisecond millisecond (0-999)
 * @param microsecond microsecond within the millisecond (0-999)
 * @param nanosecond  nanosecond within the microsecond (0-999)
 */
public record GpsTime(
        int year,
        int dayOfYear,
        int hour,
        int minute,
        int second,
        int millisecond,
        int microsecond,
        int nanosecond
) {
    /** First calendar year representable by {@link #year()} == 0. */
    public static final int EPOCH_YEAR = 2000;

    public GpsTime {
        checkRange("year", year, 0, 255);
        checkRange("dayOfYear", dayOfYear, 1, 366);
        checkRange("hour", hour, 0, 23);
        checkRange("minute", minute, 0, 59);
        checkRange("second", second, 0, 59);
        checkRange("millisecond", millisecond, 0, 999);
        checkRange("microsecond", microsecond, 0, 999);
        checkRange("nanosecond", nanosecond, 0, 999);
    }

    /**
     * Converts a UTC instant into a {@code GpsTime}.
     *
     * @throws IllegalArgumentException if the instant falls outside 2000-2255
     */
    public static GpsTime fromInstant(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        int nanos = utc.getNano();
        return new GpsTime(
                utc.getYear() - EPOCH_YEAR,
                utc.getDayOfYear(),
                utc.getHour(),
                utc.getMinute(),
                utc.getSecond(),
                nanos / 1_000_000,
                (nanos / 1_000) % 1_000,
                nanos % 1_000);
    }

    /**
     * Converts this timestamp back into a UTC instant.
     *
     * @throws java.time.DateTimeException if day 366 is used in a non-leap year
     */
    public Instant toInstant() {
        int nanoOfSecond = millisecond * 1_000_000 + microsecond * 1_000 + nanosecond;
        return LocalDate.ofYearDay(EPOCH_YEAR + year, dayOfYear)
                .atTime(hour, minute, second, nanoOfSecond)
                .toInstant(ZoneOffset.UTC);
    }

    private static void checkRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    "GpsTime " + field + " must be in range " + min + "-" + max + " (was " + value + ")");
        }
    }
}
