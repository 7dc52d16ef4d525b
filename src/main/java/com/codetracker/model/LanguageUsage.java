package com.codetracker.model;

import java.time.Duration;
import java.util.Objects;

public record LanguageUsage(String language, Duration duration) {

    public LanguageUsage {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(duration, "duration");
    }
}
