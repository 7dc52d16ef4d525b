package com.codetracker.aggregation;

import com.codetracker.model.TimePeriod;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Period boundaries. Weeks follow ISO-8601 (Monday first) whatever the default locale is;
 * every end is exclusive.
 */
public final class TimeRanges {

    private TimeRanges() {
    }

    public static LocalDateTime periodStart(TimePeriod period, LocalDate referenceDate) {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(referenceDate, "referenceDate");
        return switch (period) {
            case TODAY -> referenceDate.atStartOfDay();
            case THIS_WEEK -> referenceDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay();
            case THIS_MONTH -> referenceDate.withDayOfMonth(1).atStartOfDay();
            case THIS_YEAR -> referenceDate.withDayOfYear(1).atStartOfDay();
        };
    }

    public static LocalDateTime periodEnd(TimePeriod period, LocalDate referenceDate) {
        LocalDateTime start = periodStart(period, referenceDate);
        return switch (period) {
            case TODAY -> start.plusDays(1);
            case THIS_WEEK -> start.plusWeeks(1);
            case THIS_MONTH -> start.plusMonths(1);
            case THIS_YEAR -> start.plusYears(1);
        };
    }

    public static TimeInterval rangeOf(TimePeriod period, LocalDate referenceDate) {
        return TimeInterval.of(periodStart(period, referenceDate), periodEnd(period, referenceDate));
    }

    // an end at midnight does not touch its own day
    public static LocalDate lastDayOf(TimeInterval range) {
        LocalDate endDate = range.end().toLocalDate();
        if (range.end().equals(endDate.atStartOfDay()) && range.end().isAfter(range.start())) {
            return endDate.minusDays(1);
        }
        return endDate;
    }
}
