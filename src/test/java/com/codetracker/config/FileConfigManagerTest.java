package com.codetracker.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileConfigManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteDefaultsWhenFileIsMissing() throws Exception {
        Path configFile = tempDir.resolve("nested/config.json");
        try (FileConfigManager manager = new FileConfigManager()) {
            AppConfig config = manager.load(configFile);

            assertTrue(Files.exists(configFile));
            assertEquals(60, config.idleThresholdSeconds());
            assertEquals(20_000, config.summaryInMemoryThreshold());
            assertEquals("WAL", config.storage().journalMode());
            assertEquals(config, manager.load(configFile));
        }
    }

    @Test
    void shouldFillMissingValuesOfPartialConfig() throws Exception {
        Path configFile = tempDir.resolve("config.json");
        Path database = tempDir.resolve("data/coding.db");
        Files.writeString(configFile, """
                {
                  "idleThresholdSeconds": 120,
                  "summaryInMemoryThreshold": -5,
                  "storage": { "databasePath": "%s" },
                  "logging": { "level": "debug" },
                  "languages": [ { "extension": ".tpl", "language": "Template" } ],
                  "unknownSetting": true
                }
                """.formatted(database.toString().replace("\\", "\\\\")));

        try (FileConfigManager manager = new FileConfigManager()) {
            AppConfig config = manager.load(configFile);

            assertEquals(120, config.idleThresholdSeconds());
            assertEquals(20_000, config.summaryInMemoryThreshold());
            assertEquals(database.toAbsolutePath().normalize().toString(), config.storage().databasePath());
            assertEquals(5000, config.storage().busyTimeoutMillis());
            assertEquals("DEBUG", config.logging().level());
            assertEquals(List.of(new LanguageRule("tpl", "Template")), config.languages());
        }
    }

    @Test
    void shouldUseDefaultsForEmptyFile() throws Exception {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "");

        try (FileConfigManager manager = new FileConfigManager()) {
            assertEquals(AppConfig.defaults(), manager.load(configFile));
        }
    }
}
