package com.codetracker.activity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileActivityWatcherTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSkipHiddenAndBuildOutputDirectories() {
        assertTrue(FileActivityWatcher.isSkipped(Path.of("project/.git")));
        assertTrue(FileActivityWatcher.isSkipped(Path.of("project/node_modules")));
        assertTrue(FileActivityWatcher.isSkipped(Path.of("project/target")));
        assertFalse(FileActivityWatcher.isSkipped(Path.of("project/src")));
    }

    @Test
    void shouldRegisterSourceTreeOnly() throws Exception {
        Files.createDirectories(tempDir.resolve("src/main"));
        Files.createDirectories(tempDir.resolve("target/classes"));
        Files.createDirectories(tempDir.resolve(".idea"));

        try (FileActivityWatcher watcher = new FileActivityWatcher(target -> { })) {
            watcher.start(List.of(tempDir));
            assertEquals(3, watcher.watchedDirectoryCount());
        }
    }

    @Test
    void shouldRejectMissingProjectDirectory() {
        try (FileActivityWatcher watcher = new FileActivityWatcher(target -> { })) {
            assertThrows(IOException.class, () -> watcher.start(List.of(tempDir.resolve("missing"))));
            assertThrows(IllegalArgumentException.class, () -> watcher.start(List.of()));
        }
    }

    @Test
    void shouldReportEditsWithProjectRoot() throws Exception {
        Path sources = Files.createDirectories(tempDir.resolve("src"));
        BlockingQueue<EditTarget> edits = new LinkedBlockingQueue<>();

        try (FileActivityWatcher watcher = new FileActivityWatcher(edits::add)) {
            watcher.start(List.of(tempDir));
            Files.writeString(sources.resolve("Main.java"), "class Main {}");

            EditTarget edit = edits.poll(30, TimeUnit.SECONDS);
            assertNotNull(edit, "Expected an edit event");
            assertEquals(sources.resolve("Main.java").toAbsolutePath().normalize().toString(), edit.location());
            assertEquals(tempDir.toAbsolutePath().normalize().toString(), edit.projectPath());
        }
    }
}
