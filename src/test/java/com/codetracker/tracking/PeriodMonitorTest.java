package com.codetracker.tracking;

import com.codetracker.model.TimePeriod;
import com.codetracker.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodMonitorTest {

    private static final LocalDateTime NEW_YEARS_EVE = LocalDateTime.of(2023, 12, 31, 23, 59, 30);

    private LivePeriodCounters counters;
    private TrackerEvents events;
    private PeriodMonitor monitor;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at(NEW_YEARS_EVE);
        counters = new LivePeriodCounters();
        for (TimePeriod period : TimePeriod.values()) {
            counters.set(period, Duration.ofMinutes(5));
        }
        events = new TrackerEvents();
        monitor = new PeriodMonitor(new PeriodManager(clock), counters, events, clock);
    }

    @Test
    void shouldSkipTicksWithinSameMinute() {
        assertTrue(monitor.tick(NEW_YEARS_EVE).isEmpty());
        assertTrue(monitor.tick(NEW_YEARS_EVE.plusSeconds(20)).isEmpty());
        assertEquals(Duration.ofMinutes(5), counters.get(TimePeriod.TODAY));
    }

    @Test
    void shouldResetEveryPeriodWhenYearStartsOnMonday() {
        List<TimePeriod> notified = new CopyOnWriteArrayList<>();
        events.addPeriodResetListener(notified::add);

        monitor.tick(NEW_YEARS_EVE);
        List<TimePeriod> reset = monitor.tick(LocalDateTime.of(2024, 1, 1, 0, 0, 5));

        List<TimePeriod> all = List.of(TimePeriod.TODAY, TimePeriod.THIS_WEEK, TimePeriod.THIS_MONTH, TimePeriod.THIS_YEAR);
        assertEquals(all, reset);
        assertEquals(all, notified);
        for (TimePeriod period : TimePeriod.values()) {
            assertEquals(Duration.ZERO, counters.get(period));
        }
    }

    @Test
    void shouldResetOnlyDayWithinWeek() {
        monitor.tick(NEW_YEARS_EVE);
        monitor.tick(LocalDateTime.of(2024, 1, 1, 0, 0, 5));
        counters.set(TimePeriod.THIS_WEEK, Duration.ofMinutes(1));

        assertEquals(List.of(TimePeriod.TODAY), monitor.tick(LocalDateTime.of(2024, 1, 2, 0, 1)));
        assertEquals(Duration.ofMinutes(1), counters.get(TimePeriod.THIS_WEEK));
    }

    @Test
    void shouldNotifyRemainingListenersWhenOneFails() {
        List<TimePeriod> notified = new CopyOnWriteArrayList<>();
        events.addPeriodResetListener(period -> {
            throw new IllegalStateException("listener failure");
        });
        events.addPeriodResetListener(notified::add);

        monitor.tick(NEW_YEARS_EVE);
        monitor.tick(LocalDateTime.of(2024, 1, 1, 0, 0, 5));

        assertEquals(4, notified.size());
    }
}
