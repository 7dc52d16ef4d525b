package com.codetracker.testing;

import com.codetracker.model.CodingSession;
import com.codetracker.model.SessionTimeRange;
import com.codetracker.model.TimeBounds;
import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;

/**
 * List-backed store for tests that do not need SQLite. Writes complete synchronously unless they
 * are held behind a latch with {@link #holdWrites(CountDownLatch)}.
 */
public class InMemorySessionStore implements SessionStore {

    private final List<CodingSession> sessions = new ArrayList<>();
    private final List<List<CodingSession>> batches = new ArrayList<>();
    private volatile boolean failWrites;
    private volatile boolean failReads;
    private volatile CountDownLatch writeGate;

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public void failReads(boolean fail) {
        this.failReads = fail;
    }

    public void holdWrites(CountDownLatch gate) {
        this.writeGate = gate;
    }

    public synchronized List<CodingSession> saved() {
        return List.copyOf(sessions);
    }

    public synchronized List<List<CodingSession>> batches() {
        return List.copyOf(batches);
    }

    @Override
    public CompletableFuture<Integer> saveSessions(List<CodingSession> batch) {
        if (failWrites) {
            return CompletableFuture.failedFuture(new StorageException("write failed"));
        }
        List<CodingSession> copy = List.copyOf(batch);
        CountDownLatch gate = writeGate;
        if (gate == null) {
            return CompletableFuture.completedFuture(record(copy));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                gate.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new CompletionException(ex);
            }
            return record(copy);
        });
    }

    private synchronized int record(List<CodingSession> batch) {
        batches.add(batch);
        sessions.addAll(batch);
        return batch.size();
    }

    @Override
    public synchronized List<CodingSession> findOverlapping(LocalDateTime start, LocalDateTime end, String projectName)
            throws StorageException {
        checkReads();
        return sessions.stream()
                .filter(s -> s.endTime().isAfter(start) && s.startTime().isBefore(end))
                .filter(s -> projectName == null || projectName.equals(s.projectName()))
                .sorted(Comparator.comparing(CodingSession::startTime))
                .toList();
    }

    @Override
    public synchronized List<CodingSession> findSessions(LocalDateTime start, LocalDateTime end) throws StorageException {
        checkReads();
        if (start == null && end == null) {
            return List.copyOf(sessions);
        }
        return findOverlapping(start, end, null);
    }

    @Override
    public synchronized List<SessionTimeRange> findAllSessionTimes() throws StorageException {
        checkReads();
        return sessions.stream().map(CodingSession::timeRange).toList();
    }

    @Override
    public synchronized Optional<TimeBounds> findTimeBounds() throws StorageException {
        checkReads();
        if (sessions.isEmpty()) {
            return Optional.empty();
        }
        LocalDateTime earliest = sessions.stream().map(CodingSession::startTime).min(Comparator.naturalOrder()).orElseThrow();
        LocalDateTime latest = sessions.stream().map(CodingSession::endTime).max(Comparator.naturalOrder()).orElseThrow();
        return Optional.of(new TimeBounds(earliest, latest));
    }

    @Override
    public synchronized long countSessions() throws StorageException {
        checkReads();
        return sessions.size();
    }

    @Override
    public synchronized long totalSeconds(String projectName) throws StorageException {
        checkReads();
        return sessions.stream()
                .filter(s -> projectName == null || projectName.equals(s.projectName()))
                .mapToLong(CodingSession::durationSeconds)
                .sum();
    }

    @Override
    public synchronized long overlapSeconds(LocalDateTime start, LocalDateTime end, String projectName)
            throws StorageException {
        long total = 0;
        for (CodingSession session : findOverlapping(start, end, projectName)) {
            LocalDateTime from = session.startTime().isAfter(start) ? session.startTime() : start;
            LocalDateTime to = session.endTime().isBefore(end) ? session.endTime() : end;
            total += ChronoUnit.SECONDS.between(from, to);
        }
        return total;
    }

    @Override
    public synchronized Optional<LocalDate> firstRecordDate() throws StorageException {
        return findTimeBounds().map(bounds -> bounds.earliestStart().toLocalDate());
    }

    @Override
    public synchronized Set<String> findAllSessionUuids() throws StorageException {
        checkReads();
        Set<String> uuids = new LinkedHashSet<>();
        sessions.forEach(s -> uuids.add(s.sessionUuid()));
        return uuids;
    }

    @Override
    public synchronized Optional<String> findAnyUserId() throws StorageException {
        checkReads();
        return sessions.stream().map(CodingSession::userId).findFirst();
    }

    @Override
    public void close() {
    }

    private void checkReads() throws StorageException {
        if (failReads) {
            throw new StorageException("read failed");
        }
    }
}
