package com.codetracker.model;

import java.time.LocalDateTime;
import java.util.Objects;

public record TimeBounds(LocalDateTime earliestStart, LocalDateTime latestEnd) {

    public TimeBounds {
        Objects.requireNonNull(earliestStart, "earliestStart");
        Objects.requireNonNull(latestEnd, "latestEnd");
    }
}
