package com.codetracker.storage;

import com.codetracker.model.CodingSession;
import com.codetracker.model.SessionTimeRange;
import com.codetracker.model.TimeBounds;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Durable storage of coding sessions.
 * <p>
 * Writes are serialized onto a single writer and complete asynchronously; each call is one
 * transaction that either commits every row or none. Reads run on the calling thread and only
 * ever see sessions that are not soft-deleted.
 */
public interface SessionStore extends AutoCloseable {

    /**
     * Inserts the sessions as one batch.
     *
     * @return future completing with the number of inserted rows, or exceptionally with a
     * {@link StorageException} after the batch was rolled back
     */
    CompletableFuture<Integer> saveSessions(List<CodingSession> sessions);

    List<CodingSession> findOverlapping(LocalDateTime start, LocalDateTime end, String projectName) throws StorageException;

    List<CodingSession> findSessions(LocalDateTime start, LocalDateTime end) throws StorageException;

    List<SessionTimeRange> findAllSessionTimes() throws StorageException;

    Optional<TimeBounds> findTimeBounds() throws StorageException;

    long countSessions() throws StorageException;

    long totalSeconds(String projectName) throws StorageException;

    /**
     * Sum of session overlaps with {@code [start, end)} in seconds, clipped inside the database.
     */
    long overlapSeconds(LocalDateTime start, LocalDateTime end, String projectName) throws StorageException;

    Optional<LocalDate> firstRecordDate() throws StorageException;

    Set<String> findAllSessionUuids() throws StorageException;

    Optional<String> findAnyUserId() throws StorageException;

    @Override
    void close();
}
