package com.codetracker.tracking;

import com.codetracker.aggregation.TimeRanges;
import com.codetracker.model.TimePeriod;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

public class PeriodManager {

    private final Clock clock;
    private final Map<TimePeriod, LocalDateTime> boundaries = new EnumMap<>(TimePeriod.class);

    public PeriodManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        LocalDateTime now = LocalDateTime.now(clock);
        for (TimePeriod period : TimePeriod.values()) {
            boundaries.put(period, TimeRanges.periodStart(period, now.toLocalDate()));
        }
    }

    public boolean isPeriodChanged(TimePeriod period) {
        return isPeriodChanged(period, LocalDateTime.now(clock));
    }

    public synchronized boolean isPeriodChanged(TimePeriod period, LocalDateTime now) {
        Objects.requireNonNull(period, "period");
        return !TimeRanges.periodStart(period, now.toLocalDate()).equals(boundaries.get(period));
    }

    public void resetPeriod(TimePeriod period) {
        resetPeriod(period, LocalDateTime.now(clock));
    }

    public synchronized void resetPeriod(TimePeriod period, LocalDateTime now) {
        Objects.requireNonNull(period, "period");
        boundaries.put(period, TimeRanges.periodStart(period, now.toLocalDate()));
    }

    public synchronized LocalDateTime currentStart(TimePeriod period) {
        return boundaries.get(Objects.requireNonNull(period, "period"));
    }
}
