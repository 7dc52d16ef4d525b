package com.codetracker.model;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Objects;

public record DailySummary(LocalDate date, Duration totalDuration) {

    public DailySummary {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(totalDuration, "totalDuration");
    }
}
