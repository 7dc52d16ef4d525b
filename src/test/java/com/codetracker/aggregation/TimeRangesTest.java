package com.codetracker.aggregation;

import com.codetracker.model.TimePeriod;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TimeRangesTest {

    @Test
    void shouldStartWeekOnMonday() {
        LocalDate sunday = LocalDate.of(2025, 10, 12);
        assertEquals(LocalDateTime.parse("2025-10-06T00:00"), TimeRanges.periodStart(TimePeriod.THIS_WEEK, sunday));
        assertEquals(LocalDateTime.parse("2025-10-13T00:00"), TimeRanges.periodEnd(TimePeriod.THIS_WEEK, sunday));
    }

    @Test
    void shouldComputeMonthAndYearBounds() {
        LocalDate date = LocalDate.of(2024, 2, 15);
        assertEquals(LocalDateTime.parse("2024-03-01T00:00"), TimeRanges.periodEnd(TimePeriod.THIS_MONTH, date));
        assertEquals(LocalDateTime.parse("2024-01-01T00:00"), TimeRanges.periodStart(TimePeriod.THIS_YEAR, date));
    }

    @Test
    void shouldNotCountDayOfMidnightEnd() {
        TimeInterval range = TimeInterval.of(LocalDateTime.parse("2025-10-06T00:00"), LocalDateTime.parse("2025-10-08T00:00"));
        assertEquals(LocalDate.of(2025, 10, 7), TimeRanges.lastDayOf(range));
        TimeInterval partial = TimeInterval.of(LocalDateTime.parse("2025-10-06T00:00"), LocalDateTime.parse("2025-10-08T00:01"));
        assertEquals(LocalDate.of(2025, 10, 8), TimeRanges.lastDayOf(partial));
    }
}
