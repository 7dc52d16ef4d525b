package com.codetracker.tracking;

import com.codetracker.model.TimePeriod;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class LivePeriodCounters {

    private final Map<TimePeriod, AtomicLong> counters = new EnumMap<>(TimePeriod.class);

    public LivePeriodCounters() {
        for (TimePeriod period : TimePeriod.values()) {
            counters.put(period, new AtomicLong());
        }
    }

    void add(long seconds) {
        if (seconds <= 0) {
            return;
        }
        counters.values().forEach(counter -> counter.addAndGet(seconds));
    }

    void reset(TimePeriod period) {
        counters.get(period).set(0L);
    }

    public void set(TimePeriod period, Duration value) {
        counters.get(period).set(Math.max(0L, value.toSeconds()));
    }

    public Duration get(TimePeriod period) {
        return Duration.ofSeconds(counters.get(period).get());
    }
}
