package com.codetracker.model;

import java.time.Duration;
import java.util.Objects;

public record HourOfDayUsage(int hourOfDay, Duration averageDuration) {

    public HourOfDayUsage {
        Objects.requireNonNull(averageDuration, "averageDuration");
        if (hourOfDay < 0 || hourOfDay > 23) {
            throw new IllegalArgumentException("hourOfDay must be within 0..23");
        }
    }
}
