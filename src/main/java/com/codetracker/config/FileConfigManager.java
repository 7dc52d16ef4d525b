package com.codetracker.config;

import com.codetracker.util.DaemonThreadFactory;
import com.codetracker.util.ObjectMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;

public class FileConfigManager implements ConfigManager {

    private static final Logger log = LoggerFactory.getLogger(FileConfigManager.class);

    private final ObjectMapper mapper;
    private final List<ConfigListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService watcherExecutor;
    private WatchService watchService;
    private volatile boolean watching;

    public FileConfigManager() {
        this.mapper = ObjectMappers.create();
        this.watcherExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("config-watcher"));
    }

    @Override
    public AppConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        ensureParentDirectory(path);
        if (!Files.exists(path)) {
            AppConfig defaults = AppConfig.defaults();
            save(path, defaults);
            return defaults;
        }
        String content = Files.readString(path);
        AppConfig config = content.isBlank() ? null : mapper.readValue(content, AppConfig.class);
        if (config == null) {
            // empty file or a bare null
            config = AppConfig.defaults();
        }
        log.debug("Loaded configuration from {}", path);
        return config;
    }

    @Override
    public void save(Path path, AppConfig config) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(config, "config");
        ensureParentDirectory(path);
        try (var writer = Files.newBufferedWriter(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            mapper.writeValue(writer, config);
        }
        log.info("Configuration saved to {}", path);
    }

    @Override
    public void registerListener(ConfigListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void startWatching(Path configFile) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        if (watching) {
            return;
        }
        Path absolute = configFile.toAbsolutePath().normalize();
        ensureParentDirectory(absolute);
        Path dir = absolute.getParent();
        watchService = dir.getFileSystem().newWatchService();
        dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY);
        watching = true;
        watcherExecutor.submit(() -> runWatcherLoop(absolute));
        log.info("Watching configuration changes in {}", dir);
    }

    private void runWatcherLoop(Path configFile) {
        while (watching) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception ex) {
                if (watching) {
                    log.warn("Config watch service interrupted", ex);
                }
                break;
            }
            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.context() instanceof Path eventPath
                        && configFile.getParent().resolve(eventPath).equals(configFile)) {
                    changed = true;
                }
            }
            if (changed) {
                reload(configFile);
            }
            if (!key.reset()) {
                break;
            }
        }
    }

    private void reload(Path configFile) {
        try {
            AppConfig reloaded = load(configFile);
            for (ConfigListener listener : listeners) {
                try {
                    listener.onConfigReload(reloaded);
                } catch (RuntimeException ex) {
                    log.error("Configuration listener failed", ex);
                }
            }
        } catch (IOException ex) {
            log.warn("Failed to reload configuration after change", ex);
        }
    }

    @Override
    public void close() {
        watching = false;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException ex) {
                log.debug("Error closing config watch service", ex);
            }
        }
        watcherExecutor.shutdownNow();
    }

    private void ensureParentDirectory(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
