package com.codetracker.exchange;

import com.codetracker.model.CodingSession;
import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;
import com.codetracker.util.ObjectMappers;
import com.codetracker.util.Timestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * Moves sessions between the store and JSON export files.
 * <p>
 * Imports only add sessions whose UUID is not already known, so importing the same file twice is
 * harmless. A file with an unknown version or an unreadable session is rejected as a whole.
 */
public class DataExchangeService {

    private static final Logger log = LoggerFactory.getLogger(DataExchangeService.class);

    private final SessionStore store;
    private final ObjectMapper mapper;
    private final Clock clock;

    public DataExchangeService(SessionStore store, Clock clock) {
        this(store, ObjectMappers.create(), clock);
    }

    public DataExchangeService(SessionStore store, ObjectMapper mapper, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Writes all sessions, or those overlapping {@code [start, end)} when both bounds are given.
     *
     * @return number of exported sessions
     */
    public int exportToFile(Path target, LocalDateTime start, LocalDateTime end) throws IOException {
        Objects.requireNonNull(target, "target");
        List<CodingSession> sessions;
        try {
            sessions = store.findSessions(start, end);
        } catch (StorageException ex) {
            throw new IOException("Failed to read sessions for export", ex);
        }
        List<ExportSession> exported = sessions.stream().map(ExportSession::from).toList();
        ExportData data = new ExportData(
                ExportData.CURRENT_VERSION,
                Timestamps.format(LocalDateTime.now(clock)),
                exported.size(),
                exported);

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (var writer = Files.newBufferedWriter(target,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            mapper.writeValue(writer, data);
        }
        log.info("Exported {} session(s) to {}", exported.size(), target);
        return exported.size();
    }

    public ImportResult importFromFile(Path source) {
        Objects.requireNonNull(source, "source");
        ExportData data;
        try (var reader = Files.newBufferedReader(source)) {
            data = mapper.readValue(reader, ExportData.class);
        } catch (JsonProcessingException ex) {
            log.warn("Rejected import file {}: {}", source, ex.getOriginalMessage());
            return ImportResult.failure(0, 0, 0, "Invalid export file: " + ex.getOriginalMessage());
        } catch (IOException ex) {
            log.error("Failed to read import file {}", source, ex);
            return ImportResult.failure(0, 0, 0, "Cannot read " + source + ": " + ex.getMessage());
        }
        if (data == null) {
            return ImportResult.failure(0, 0, 0, "Invalid export file: empty document");
        }
        if (!ExportData.CURRENT_VERSION.equals(data.exportVersion())) {
            log.warn("Unsupported export version {} in {}", data.exportVersion(), source);
            return ImportResult.failure(data.totalSessions(), 0, 0,
                    "Unsupported export version: " + data.exportVersion());
        }

        int total = data.sessions().size();
        Set<String> known;
        try {
            known = new HashSet<>(store.findAllSessionUuids());
        } catch (StorageException ex) {
            log.error("Failed to load existing session ids", ex);
            return ImportResult.failure(total, 0, 0, "Cannot read existing sessions: " + ex.getMessage());
        }

        List<CodingSession> fresh = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < total; i++) {
            ExportSession exported = data.sessions().get(i);
            if (!known.add(exported.sessionUuid())) {
                skipped++;
                continue;
            }
            try {
                fresh.add(exported.toCodingSession());
            } catch (DateTimeParseException | IllegalArgumentException ex) {
                log.warn("Rejected import file {}: session #{} is invalid", source, i + 1, ex);
                return ImportResult.failure(total, 0, 0,
                        "Invalid session #" + (i + 1) + " (" + exported.sessionUuid() + "): " + ex.getMessage());
            }
        }

        if (fresh.isEmpty()) {
            log.info("Import of {} finished: nothing new, {} skipped", source, skipped);
            return ImportResult.completed(total, 0, skipped);
        }
        try {
            int imported = store.saveSessions(fresh).get();
            log.info("Imported {} session(s) from {}, {} skipped", imported, source, skipped);
            return ImportResult.completed(total, imported, skipped);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("Failed to import sessions from {}", source, cause);
            return ImportResult.failure(total, skipped, fresh.size(), "Import failed: " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ImportResult.failure(total, skipped, fresh.size(), "Import interrupted");
        }
    }
}
