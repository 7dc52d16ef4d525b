package com.codetracker.model;

import java.time.Duration;
import java.util.Objects;

public record TimeOfDayUsage(TimeOfDay timeOfDay, Duration duration) {

    public TimeOfDayUsage {
        Objects.requireNonNull(timeOfDay, "timeOfDay");
        Objects.requireNonNull(duration, "duration");
    }
}
