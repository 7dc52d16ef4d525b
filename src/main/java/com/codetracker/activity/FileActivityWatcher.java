package com.codetracker.activity;

import com.codetracker.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Turns file modifications below project roots into edit targets.
 * <p>
 * Used when no editor delivers events. Hidden directories and common build output directories
 * are not watched.
 */
public class FileActivityWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileActivityWatcher.class);

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("build", "target", "out", "node_modules");

    private final Consumer<EditTarget> sink;
    private final ExecutorService watcherExecutor;
    private final Map<WatchKey, WatchedDirectory> directories = new ConcurrentHashMap<>();
    private WatchService watchService;
    private volatile boolean watching;

    public FileActivityWatcher(Consumer<EditTarget> sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.watcherExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("file-activity"));
    }

    public synchronized void start(List<Path> projectRoots) throws IOException {
        Objects.requireNonNull(projectRoots, "projectRoots");
        if (watching) {
            return;
        }
        if (projectRoots.isEmpty()) {
            throw new IllegalArgumentException("at least one project directory is required");
        }
        for (Path root : projectRoots) {
            if (!Files.isDirectory(root)) {
                throw new IOException("Not a directory: " + root);
            }
        }
        watchService = projectRoots.get(0).getFileSystem().newWatchService();
        for (Path root : projectRoots) {
            Path normalized = root.toAbsolutePath().normalize();
            registerTree(normalized, normalized);
        }
        watching = true;
        watcherExecutor.submit(this::runWatcherLoop);
        log.info("Watching {} project director{} for edits", projectRoots.size(), projectRoots.size() == 1 ? "y" : "ies");
    }

    private void runWatcherLoop() {
        while (watching) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception ex) {
                if (watching) {
                    log.warn("File watch service stopped unexpectedly", ex);
                }
                break;
            }
            WatchedDirectory directory = directories.get(key);
            if (directory != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handleEvent(directory, event);
                }
            }
            if (!key.reset()) {
                directories.remove(key);
            }
        }
    }

    private void handleEvent(WatchedDirectory directory, WatchEvent<?> event) {
        if (event.kind() == OVERFLOW || !(event.context() instanceof Path name)) {
            return;
        }
        Path child = directory.path().resolve(name);
        if (Files.isDirectory(child)) {
            if (event.kind() == ENTRY_CREATE) {
                try {
                    registerTree(child, directory.projectRoot());
                } catch (IOException ex) {
                    log.warn("Failed to watch new directory {}", child, ex);
                }
            }
            return;
        }
        if (Files.isRegularFile(child) && !isHidden(child)) {
            try {
                sink.accept(EditTarget.ofFile(child, directory.projectRoot()));
            } catch (RuntimeException ex) {
                log.error("Activity handler failed for {}", child, ex);
            }
        }
    }

    private void registerTree(Path start, Path projectRoot) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(start) && isSkipped(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY);
                directories.put(key, new WatchedDirectory(dir, projectRoot));
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static boolean isSkipped(Path dir) {
        Path name = dir.getFileName();
        if (name == null) {
            return false;
        }
        return isHidden(dir) || SKIPPED_DIRECTORIES.contains(name.toString());
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    int watchedDirectoryCount() {
        return directories.size();
    }

    @Override
    public synchronized void close() {
        watching = false;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException ex) {
                log.debug("Error closing file watch service", ex);
            }
        }
        directories.clear();
        watcherExecutor.shutdownNow();
    }

    private record WatchedDirectory(Path path, Path projectRoot) {
    }
}
