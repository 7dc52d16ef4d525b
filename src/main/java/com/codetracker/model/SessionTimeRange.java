package com.codetracker.model;

import java.time.LocalDateTime;
import java.util.Objects;

public record SessionTimeRange(LocalDateTime startTime, LocalDateTime endTime) {

    public SessionTimeRange {
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
    }
}
