package com.codetracker.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.codetracker.util.PathUtils;

import java.nio.file.Path;
import java.util.Objects;

public record SqliteStorageConfig(
        String databasePath,
        String journalMode,
        Integer busyTimeoutMillis
) {

    private static final String DEFAULT_DB_NAME = "coding_data.db";
    private static final String DEFAULT_JOURNAL_MODE = "WAL";
    private static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5000;

    @JsonCreator
    public SqliteStorageConfig(
            @JsonProperty("databasePath") String databasePath,
            @JsonProperty("journalMode") String journalMode,
            @JsonProperty("busyTimeoutMillis") Integer busyTimeoutMillis
    ) {
        this.databasePath = databasePath;
        this.journalMode = journalMode;
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    public SqliteStorageConfig withDefaults(Path defaultDir) {
        Objects.requireNonNull(defaultDir, "defaultDir");
        Path resolvedDb = PathUtils.resolveOrDefault(databasePath, defaultDir.resolve(DEFAULT_DB_NAME));
        String resolvedJournalMode = (journalMode == null || journalMode.isBlank())
                ? DEFAULT_JOURNAL_MODE
                : journalMode;
        int resolvedBusyTimeout = (busyTimeoutMillis == null || busyTimeoutMillis < 0)
                ? DEFAULT_BUSY_TIMEOUT_MILLIS
                : busyTimeoutMillis;
        return new SqliteStorageConfig(resolvedDb.toString(), resolvedJournalMode, resolvedBusyTimeout);
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + Path.of(databasePath).toAbsolutePath();
    }

    public static SqliteStorageConfig defaults(Path defaultDir) {
        return new SqliteStorageConfig(defaultDir.resolve(DEFAULT_DB_NAME).toString(),
                DEFAULT_JOURNAL_MODE,
                DEFAULT_BUSY_TIMEOUT_MILLIS);
    }
}
