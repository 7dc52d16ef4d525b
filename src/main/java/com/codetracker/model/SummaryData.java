package com.codetracker.model;

import java.time.Duration;
import java.util.Objects;

public record SummaryData(
        Duration today,
        Duration dailyAverage,
        Duration thisWeek,
        Duration thisMonth,
        Duration thisYear,
        Duration total
) {

    public SummaryData {
        Objects.requireNonNull(today, "today");
        Objects.requireNonNull(dailyAverage, "dailyAverage");
        Objects.requireNonNull(thisWeek, "thisWeek");
        Objects.requireNonNull(thisMonth, "thisMonth");
        Objects.requireNonNull(thisYear, "thisYear");
        Objects.requireNonNull(total, "total");
    }

    public static SummaryData empty() {
        return new SummaryData(Duration.ZERO, Duration.ZERO, Duration.ZERO,
                Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }
}
