package com.codetracker.activity;

import java.nio.file.Path;
import java.util.Objects;

public record ResolvedTarget(String projectKey, String projectName, String language, Path file) {

    public ResolvedTarget {
        Objects.requireNonNull(projectKey, "projectKey");
        Objects.requireNonNull(projectName, "projectName");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(file, "file");
    }
}
