package com.fieldpulse.locationtracking.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;

/**
 * Named report windows. All of them are whole calendar days in the clock's zone;
 * weeks run Sunday to Saturday.
 */
public enum Timeframe {
    TODAY("today"),
    YESTERDAY("yesterday"),
    THIS_WEEK("this_week"),
    LAST_WEEK("last_week"),
    THIS_MONTH("this_month"),
    LAST_MONTH("last_month"),
    CUSTOM("custom");

    private final String value;

    Timeframe(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Timeframe fromValue(String value) {
        for (Timeframe timeframe : values()) {
            if (timeframe.value.equalsIgnoreCase(value)) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unsupported timeframe: " + value);
    }

    /**
     * @throws IllegalArgumentException for CUSTOM without both dates, or with start after end
     */
    public ReportPeriod resolve(Clock clock, LocalDate customStart, LocalDate customEnd) {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        LocalDate weekStart = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        LocalDate monthStart = today.withDayOfMonth(1);

        switch (this) {
            case TODAY:
                return days(today, today, zone);
            case YESTERDAY:
                return days(today.minusDays(1), today.minusDays(1), zone);
            case THIS_WEEK:
                return days(weekStart, weekStart.plusDays(6), zone);
            case LAST_WEEK:
                return days(weekStart.minusWeeks(1), weekStart.minusDays(1), zone);
            case THIS_MONTH:
                return days(monthStart, today.with(TemporalAdjusters.lastDayOfMonth()), zone);
            case LAST_MONTH:
                return days(monthStart.minusMonths(1), monthStart.minusDays(1), zone);
            case CUSTOM:
                if (customStart == null || customEnd == null) {
                    throw new IllegalArgumentException("Start date and end date are required for custom timeframe");
                }
                if (customStart.isAfter(customEnd)) {
                    throw new IllegalArgumentException("Start date cannot be after end date");
                }
                return days(customStart, customEnd, zone);
            default:
                throw new IllegalArgumentException("Unsupported timeframe: " + value);
        }
    }

    /** Period from the first instant of {@code first} to the last millisecond of {@code last}. */
    public static ReportPeriod days(LocalDate first, LocalDate last, ZoneId zone) {
        return new ReportPeriod(
                first.atStartOfDay(zone).toInstant(),
                last.plusDays(1).atStartOfDay(zone).toInstant().minusMillis(1));
    }
}
