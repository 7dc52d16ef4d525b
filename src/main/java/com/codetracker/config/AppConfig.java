package com.codetracker.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.codetracker.util.PathUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record AppConfig(
        int idleThresholdSeconds,
        int idleCheckIntervalSeconds,
        int periodCheckIntervalSeconds,
        int summaryInMemoryThreshold,
        int shutdownTimeoutSeconds,
        String ideName,
        SqliteStorageConfig storage,
        LoggingConfig logging,
        List<LanguageRule> languages,
        List<String> excludedPaths
) {

    private static final int DEFAULT_IDLE_THRESHOLD_SECONDS = 60;
    private static final int DEFAULT_IDLE_CHECK_INTERVAL_SECONDS = 5;
    private static final int DEFAULT_PERIOD_CHECK_INTERVAL_SECONDS = 1;
    private static final int DEFAULT_SUMMARY_IN_MEMORY_THRESHOLD = 20_000;
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final String DEFAULT_IDE_NAME = "CodeTracker CLI";

    @JsonCreator
    public static AppConfig create(
            @JsonProperty("idleThresholdSeconds") Integer idleThresholdSeconds,
            @JsonProperty("idleCheckIntervalSeconds") Integer idleCheckIntervalSeconds,
            @JsonProperty("periodCheckIntervalSeconds") Integer periodCheckIntervalSeconds,
            @JsonProperty("summaryInMemoryThreshold") Integer summaryInMemoryThreshold,
            @JsonProperty("shutdownTimeoutSeconds") Integer shutdownTimeoutSeconds,
            @JsonProperty("ideName") String ideName,
            @JsonProperty("storage") SqliteStorageConfig storage,
            @JsonProperty("logging") LoggingConfig logging,
            @JsonProperty("languages") List<LanguageRule> languages,
            @JsonProperty("excludedPaths") List<String> excludedPaths
    ) {
        Path root = PathUtils.defaultDataRoot();
        return new AppConfig(
                positiveOrDefault(idleThresholdSeconds, DEFAULT_IDLE_THRESHOLD_SECONDS),
                positiveOrDefault(idleCheckIntervalSeconds, DEFAULT_IDLE_CHECK_INTERVAL_SECONDS),
                positiveOrDefault(periodCheckIntervalSeconds, DEFAULT_PERIOD_CHECK_INTERVAL_SECONDS),
                positiveOrDefault(summaryInMemoryThreshold, DEFAULT_SUMMARY_IN_MEMORY_THRESHOLD),
                positiveOrDefault(shutdownTimeoutSeconds, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS),
                (ideName == null || ideName.isBlank()) ? DEFAULT_IDE_NAME : ideName.trim(),
                storage == null ? SqliteStorageConfig.defaults(root) : storage.withDefaults(root),
                logging == null ? LoggingConfig.defaults(root) : logging.withDefaults(root),
                languages == null ? List.of() : List.copyOf(languages),
                excludedPaths == null ? List.of() : normalizePaths(excludedPaths)
        );
    }

    public Duration idleThreshold() {
        return Duration.ofSeconds(idleThresholdSeconds);
    }

    public Duration shutdownTimeout() {
        return Duration.ofSeconds(shutdownTimeoutSeconds);
    }

    private static int positiveOrDefault(Integer value, int defaultValue) {
        return (value == null || value <= 0) ? defaultValue : value;
    }

    private static List<String> normalizePaths(List<String> entries) {
        return entries.stream()
                .filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .map(PathUtils::resolve)
                .map(Path::toString)
                .distinct()
                .toList();
    }

    public static AppConfig defaults() {
        return create(null, null, null, null, null, null, null, null, null, null);
    }
}
