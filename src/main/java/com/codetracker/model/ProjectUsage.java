package com.codetracker.model;

import java.time.Duration;
import java.util.Objects;

public record ProjectUsage(String projectName, Duration duration) {

    public ProjectUsage {
        Objects.requireNonNull(projectName, "projectName");
        Objects.requireNonNull(duration, "duration");
    }
}
