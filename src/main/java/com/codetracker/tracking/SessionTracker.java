package com.codetracker.tracking;

import com.codetracker.activity.ActivityGate;
import com.codetracker.activity.EditTarget;
import com.codetracker.activity.ResolvedTarget;
import com.codetracker.activity.TargetResolver;
import com.codetracker.model.CodingSession;
import com.codetracker.storage.SessionStore;
import com.codetracker.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns activity events into coding sessions.
 * <p>
 * Each project holds at most one live language at a time; an edit in another language flushes the
 * project's live sessions first. All live sessions are flushed once the user has been idle for the
 * configured threshold. Flushing drains the index under one lock before handing the sessions to
 * the store, so an edit arriving mid-flush always starts a fresh session. Write failures are logged
 * and the flushed sessions are not retried.
 */
public class SessionTracker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionTracker.class);

    private final SessionStore store;
    private final ActivityGate gate;
    private final TargetResolver resolver;
    private final SessionContext context;
    private final Clock clock;
    private final LivePeriodCounters counters;
    private final TrackerEvents events;
    private final Duration shutdownTimeout;

    private final Map<String, Map<String, ActiveSession>> index = new ConcurrentHashMap<>();
    private final ReentrantLock indexLock = new ReentrantLock();
    private final AtomicReference<LocalDateTime> lastActivity = new AtomicReference<>();
    private final AtomicBoolean userActive = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile Duration idleThreshold;
    private ScheduledExecutorService idleExecutor;

    public SessionTracker(SessionStore store,
                          ActivityGate gate,
                          TargetResolver resolver,
                          SessionContext context,
                          Clock clock,
                          Duration idleThreshold,
                          Duration shutdownTimeout,
                          LivePeriodCounters counters,
                          TrackerEvents events) {
        this.store = Objects.requireNonNull(store, "store");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.context = Objects.requireNonNull(context, "context");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idleThreshold = requirePositive(idleThreshold, "idleThreshold");
        this.shutdownTimeout = requirePositive(shutdownTimeout, "shutdownTimeout");
        this.counters = Objects.requireNonNull(counters, "counters");
        this.events = Objects.requireNonNull(events, "events");
    }

    public synchronized void start(Duration idleCheckInterval) {
        requirePositive(idleCheckInterval, "idleCheckInterval");
        if (idleExecutor != null || stopped.get()) {
            return;
        }
        idleExecutor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("idle-checker"));
        long intervalMillis = idleCheckInterval.toMillis();
        idleExecutor.scheduleAtFixedRate(
                () -> safeExecute(this::checkIdleStatus, "idle check"),
                intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);
    }

    public boolean onActivity(EditTarget target) {
        return onActivity(target, LocalDateTime.now(clock));
    }

    /**
     * Records an edit.
     *
     * @return whether the edit counted as coding activity
     */
    public boolean onActivity(EditTarget target, LocalDateTime now) {
        Objects.requireNonNull(now, "now");
        if (stopped.get() || !gate.isCountableActivity(target)) {
            return false;
        }
        Optional<ResolvedTarget> resolved = resolver.resolve(target);
        if (resolved.isEmpty()) {
            return false;
        }
        ResolvedTarget edit = resolved.get();

        LocalDateTime previous;
        List<ActiveSession> drained = List.of();
        indexLock.lock();
        try {
            previous = lastActivity.getAndSet(now);
            if (userActive.compareAndSet(false, true)) {
                log.debug("Coding activity started");
                events.fireActivityStarted();
            }
            Map<String, ActiveSession> sessions = index.computeIfAbsent(edit.projectKey(), key -> new ConcurrentHashMap<>());
            if (!sessions.isEmpty() && !sessions.containsKey(edit.language())) {
                drained = new ArrayList<>(sessions.values());
                sessions.clear();
            }
            ActiveSession session = sessions.get(edit.language());
            if (session == null) {
                session = new ActiveSession(UUID.randomUUID().toString(), edit.projectKey(),
                        edit.projectName(), edit.language(), now);
                sessions.put(edit.language(), session);
                log.info("Started {} session in {}", edit.language(), edit.projectName());
            } else {
                session.touch(now);
            }
        } finally {
            indexLock.unlock();
        }
        if (previous != null) {
            Duration delta = Duration.between(previous, now);
            if (!delta.isNegative() && delta.compareTo(idleThreshold) < 0) {
                counters.add(delta.toSeconds());
            }
        }

        if (!drained.isEmpty()) {
            log.info("Language switch in {} to {}", edit.projectName(), edit.language());
            persist(drained, now, "language switch");
        }
        return true;
    }

    public void checkIdleStatus() {
        checkIdleStatus(LocalDateTime.now(clock));
    }

    /**
     * Flushes every live session once the user has been idle for the threshold. All of them end at
     * the last activity plus the threshold. The idle decision and the drain share the index lock
     * with {@link #onActivity(EditTarget, LocalDateTime)}.
     */
    public void checkIdleStatus(LocalDateTime now) {
        Duration threshold = idleThreshold;
        List<ActiveSession> drained;
        LocalDateTime end;
        indexLock.lock();
        try {
            LocalDateTime last = lastActivity.get();
            if (last == null || Duration.between(last, now).compareTo(threshold) < 0) {
                return;
            }
            drained = drainLocked();
            if (drained.isEmpty()) {
                return;
            }
            end = last.plus(threshold);
            if (userActive.compareAndSet(true, false)) {
                events.fireActivityStopped();
            }
        } finally {
            indexLock.unlock();
        }
        log.info("Idle for {}s, pausing {} session(s)", threshold.toSeconds(), drained.size());
        persist(drained, end, "idle timeout");
    }

    public CompletableFuture<Integer> forcePersistSessions() {
        return persist(drainAll(), boundedEnd(LocalDateTime.now(clock)), "forced flush");
    }

    public CompletableFuture<Integer> stopProjectTracking(String projectKey) {
        Objects.requireNonNull(projectKey, "projectKey");
        List<ActiveSession> drained;
        indexLock.lock();
        try {
            Map<String, ActiveSession> sessions = index.remove(projectKey);
            drained = sessions == null ? List.of() : new ArrayList<>(sessions.values());
            if (index.isEmpty() && userActive.compareAndSet(true, false)) {
                events.fireActivityStopped();
            }
        } finally {
            indexLock.unlock();
        }
        return persist(drained, boundedEnd(LocalDateTime.now(clock)), "project close");
    }

    /**
     * Flushes everything, stops the idle ticker and waits a bounded time for the write to be
     * handed to storage.
     */
    public void stopTracking() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping session tracking");
        synchronized (this) {
            if (idleExecutor != null) {
                idleExecutor.shutdownNow();
            }
        }
        CompletableFuture<Integer> pending = persist(drainAll(), boundedEnd(LocalDateTime.now(clock)), "shutdown");
        try {
            pending.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Final session flush did not complete within {}s, abandoning it", shutdownTimeout.toSeconds());
        } catch (ExecutionException ex) {
            log.debug("Final session flush failed", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the final session flush");
        }
        userActive.set(false);
    }

    public void updateIdleThreshold(Duration threshold) {
        requirePositive(threshold, "threshold");
        if (threshold.equals(idleThreshold)) {
            return;
        }
        forcePersistSessions();
        idleThreshold = threshold;
        log.info("Idle threshold set to {}s", threshold.toSeconds());
    }

    public List<LiveSession> snapshot() {
        indexLock.lock();
        try {
            return index.values().stream()
                    .flatMap(sessions -> sessions.values().stream())
                    .map(ActiveSession::view)
                    .sorted(Comparator.comparing(LiveSession::startTime))
                    .toList();
        } finally {
            indexLock.unlock();
        }
    }

    public int liveSessionCount() {
        indexLock.lock();
        try {
            return index.values().stream().mapToInt(Map::size).sum();
        } finally {
            indexLock.unlock();
        }
    }

    public boolean isUserActive() {
        return userActive.get();
    }

    public Optional<LocalDateTime> lastActivity() {
        return Optional.ofNullable(lastActivity.get());
    }

    public Duration idleThreshold() {
        return idleThreshold;
    }

    public LivePeriodCounters counters() {
        return counters;
    }

    @Override
    public void close() {
        stopTracking();
    }

    private List<ActiveSession> drainAll() {
        indexLock.lock();
        try {
            return drainLocked();
        } finally {
            indexLock.unlock();
        }
    }

    private List<ActiveSession> drainLocked() {
        List<ActiveSession> drained = new ArrayList<>();
        index.values().forEach(sessions -> drained.addAll(sessions.values()));
        index.clear();
        return drained;
    }

    // flush time, but never past the last activity plus the threshold
    private LocalDateTime boundedEnd(LocalDateTime flushTime) {
        LocalDateTime last = lastActivity.get();
        if (last == null) {
            return flushTime;
        }
        LocalDateTime latest = last.plus(idleThreshold);
        return flushTime.isBefore(latest) ? flushTime : latest;
    }

    private CompletableFuture<Integer> persist(List<ActiveSession> drained, LocalDateTime end, String reason) {
        if (drained.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        LocalDateTime lastModified = LocalDateTime.now(clock);
        List<CodingSession> sessions = drained.stream()
                .map(session -> session.toCodingSession(context, end, lastModified))
                .toList();
        CompletableFuture<Integer> future;
        try {
            future = store.saveSessions(sessions);
        } catch (RuntimeException ex) {
            future = CompletableFuture.failedFuture(ex);
        }
        return future.whenComplete((count, error) -> {
            if (error != null) {
                log.error("Failed to persist {} session(s) on {}", sessions.size(), reason, error);
            } else {
                log.debug("Persisted {} session(s) on {}", count, reason);
            }
        });
    }

    private void safeExecute(Runnable runnable, String taskName) {
        try {
            runnable.run();
        } catch (Throwable ex) {
            log.error("Error executing {}", taskName, ex);
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
