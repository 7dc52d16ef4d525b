package com.codetracker.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Objects;

public record HourlyUsage(DayOfWeek dayOfWeek, int hourOfDay, Duration averageDuration) {

    public HourlyUsage {
        Objects.requireNonNull(dayOfWeek, "dayOfWeek");
        Objects.requireNonNull(averageDuration, "averageDuration");
        if (hourOfDay < 0 || hourOfDay > 23) {
            throw new IllegalArgumentException("hourOfDay must be within 0..23");
        }
    }
}
