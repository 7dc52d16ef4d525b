package com.codetracker.tracking;

import com.codetracker.activity.ActivityGate;
import com.codetracker.activity.EditTarget;
import com.codetracker.activity.LanguageResolver;
import com.codetracker.activity.TargetResolver;
import com.codetracker.model.CodingSession;
import com.codetracker.model.TimePeriod;
import com.codetracker.testing.InMemorySessionStore;
import com.codetracker.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionTrackerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 10, 6, 9, 0);
    private static final Duration IDLE = Duration.ofSeconds(60);

    @TempDir
    Path tempDir;

    private InMemorySessionStore store;
    private MutableClock clock;
    private TrackerEvents events;
    private SessionTracker tracker;
    private final AtomicInteger started = new AtomicInteger();
    private final AtomicInteger stopped = new AtomicInteger();

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        clock = MutableClock.at(T0);
        events = new TrackerEvents();
        events.addActivityListener(new ActivityListener() {
            @Override
            public void onActivityStarted() {
                started.incrementAndGet();
            }

            @Override
            public void onActivityStopped() {
                stopped.incrementAndGet();
            }
        });
        tracker = newTracker();
    }

    private SessionTracker newTracker() {
        return new SessionTracker(store,
                new ActivityGate(List.of()),
                new TargetResolver(new LanguageResolver(List.of())),
                new SessionContext("user-1", "Linux 6.1", "Test IDE"),
                clock,
                IDLE,
                Duration.ofSeconds(5),
                new LivePeriodCounters(),
                events);
    }

    @AfterEach
    void tearDown() {
        tracker.close();
    }

    private EditTarget edit(String project, String fileName) throws Exception {
        Path root = tempDir.resolve(project);
        Path file = root.resolve(fileName);
        Files.createDirectories(root);
        if (!Files.exists(file)) {
            Files.writeString(file, "content");
        }
        return EditTarget.ofFile(file, root);
    }

    private String projectKey(String project) {
        return tempDir.resolve(project).toAbsolutePath().normalize().toString();
    }

    @Test
    void shouldPersistPreviousLanguageOnSwitch() throws Exception {
        EditTarget kotlin = edit("shop", "Order.kt");
        EditTarget java = edit("shop", "Legacy.java");

        assertTrue(tracker.onActivity(kotlin, T0));
        assertTrue(tracker.onActivity(kotlin, T0.plusSeconds(10)));
        assertTrue(tracker.onActivity(java, T0.plusSeconds(20)));

        List<CodingSession> saved = store.saved();
        assertEquals(1, saved.size());
        CodingSession kotlinSession = saved.get(0);
        assertEquals("Kotlin", kotlinSession.language());
        assertEquals("shop", kotlinSession.projectName());
        assertEquals(T0, kotlinSession.startTime());
        assertEquals(T0.plusSeconds(20), kotlinSession.endTime());
        assertEquals("user-1", kotlinSession.userId());
        assertEquals("Test IDE", kotlinSession.ideName());

        List<LiveSession> live = tracker.snapshot();
        assertEquals(1, live.size());
        assertEquals("Java", live.get(0).language());
    }

    @Test
    void shouldKeepProjectsIndependent() throws Exception {
        tracker.onActivity(edit("shop", "Order.kt"), T0);
        tracker.onActivity(edit("blog", "Post.java"), T0.plusSeconds(5));

        assertTrue(store.saved().isEmpty());
        assertEquals(2, tracker.liveSessionCount());
    }

    @Test
    void shouldClampIdleSessionEndToLastActivityPlusThreshold() throws Exception {
        EditTarget kotlin = edit("shop", "Order.kt");
        tracker.onActivity(kotlin, T0);
        tracker.onActivity(kotlin, T0.plusSeconds(30));

        tracker.checkIdleStatus(T0.plusSeconds(89));
        assertTrue(store.saved().isEmpty());
        assertTrue(tracker.isUserActive());

        tracker.checkIdleStatus(T0.plusSeconds(400));

        List<CodingSession> saved = store.saved();
        assertEquals(1, saved.size());
        assertEquals(T0.plusSeconds(90), saved.get(0).endTime());
        assertEquals(0, tracker.liveSessionCount());
        assertFalse(tracker.isUserActive());
        assertEquals(1, stopped.get());
    }

    @Test
    void shouldFireStartedOncePerActivityStreak() throws Exception {
        EditTarget kotlin = edit("shop", "Order.kt");
        tracker.onActivity(kotlin, T0);
        tracker.onActivity(kotlin, T0.plusSeconds(5));
        assertEquals(1, started.get());

        tracker.checkIdleStatus(T0.plusSeconds(120));
        tracker.onActivity(kotlin, T0.plusSeconds(130));

        assertEquals(2, started.get());
        assertEquals(1, stopped.get());
    }

    @Test
    void shouldFlushOnlyClosedProject() throws Exception {
        tracker.onActivity(edit("shop", "Order.kt"), T0);
        tracker.onActivity(edit("blog", "Post.java"), T0.plusSeconds(5));
        clock.set(T0.plusSeconds(10));

        int persisted = tracker.stopProjectTracking(projectKey("shop")).get();

        assertEquals(1, persisted);
        assertEquals("shop", store.saved().get(0).projectName());
        assertEquals(T0.plusSeconds(10), store.saved().get(0).endTime());
        assertEquals(1, tracker.liveSessionCount());
        assertTrue(tracker.isUserActive());
        assertEquals(0, tracker.stopProjectTracking(projectKey("unknown")).get());
    }

    @Test
    void shouldKeepUserActiveOnForcedFlush() throws Exception {
        tracker.onActivity(edit("shop", "Order.kt"), T0);
        clock.set(T0.plusSeconds(15));

        assertEquals(1, tracker.forcePersistSessions().get());
        assertEquals(T0.plusSeconds(15), store.saved().get(0).endTime());
        assertTrue(tracker.isUserActive());
        assertEquals(0, tracker.liveSessionCount());
    }

    @Test
    void shouldCountOnlyGapsBelowIdleThreshold() throws Exception {
        EditTarget kotlin = edit("shop", "Order.kt");
        tracker.onActivity(kotlin, T0);
        tracker.onActivity(kotlin, T0.plusSeconds(10));
        tracker.onActivity(kotlin, T0.plusSeconds(100));

        for (TimePeriod period : TimePeriod.values()) {
            assertEquals(Duration.ofSeconds(10), tracker.counters().get(period));
        }
    }

    @Test
    void shouldDropSessionsWhenWriteFails() throws Exception {
        tracker.onActivity(edit("shop", "Order.kt"), T0);
        store.failWrites(true);

        CompletableFuture<Integer> flush = tracker.forcePersistSessions();

        assertThrows(ExecutionException.class, flush::get);
        assertEquals(0, tracker.liveSessionCount());
    }

    @Test
    void shouldIgnoreEditsThatAreNotActivity() throws Exception {
        EditTarget readOnly = new EditTarget(edit("shop", "Order.kt").location(), null, null, null, true);

        assertFalse(tracker.onActivity(readOnly, T0));
        assertFalse(tracker.onActivity(new EditTarget("untitled:Scratch", null, null, null, false), T0));
        assertEquals(0, started.get());
        assertTrue(tracker.lastActivity().isEmpty());
    }

    @Test
    void shouldFlushAndRejectEditsAfterStop() throws Exception {
        EditTarget kotlin = edit("shop", "Order.kt");
        tracker.onActivity(kotlin, T0);
        clock.set(T0.plusSeconds(20));

        tracker.stopTracking();

        assertEquals(1, store.saved().size());
        assertFalse(tracker.onActivity(kotlin, T0.plusSeconds(30)));
        assertFalse(tracker.isUserActive());
    }

    @Test
    void shouldFlushBeforeApplyingNewIdleThreshold() throws Exception {
        tracker.onActivity(edit("shop", "Order.kt"), T0);
        clock.set(T0.plusSeconds(5));

        tracker.updateIdleThreshold(Duration.ofSeconds(30));

        assertEquals(1, store.saved().size());
        assertEquals(Duration.ofSeconds(30), tracker.idleThreshold());
        assertThrows(IllegalArgumentException.class, () -> tracker.updateIdleThreshold(Duration.ZERO));
    }

    @Test
    void shouldEndAllIdleSessionsAtLastActivityPlusThreshold() throws Exception {
        tracker.onActivity(edit("shop", "Order.kt"), T0);
        tracker.onActivity(edit("blog", "Post.java"), T0.plusSeconds(50));

        tracker.checkIdleStatus(T0.plusSeconds(300));

        List<CodingSession> saved = store.saved();
        assertEquals(2, saved.size());
        for (CodingSession session : saved) {
            assertEquals(T0.plusSeconds(110), session.endTime());
        }
        assertEquals(T0, saved.stream().filter(s -> s.projectName().equals("shop")).findFirst().orElseThrow().startTime());
    }

    @Test
    void shouldEndSwitchedSessionAtSwitchTimeAfterLongGap() throws Exception {
        tracker.onActivity(edit("shop", "Order.kt"), T0);
        tracker.onActivity(edit("shop", "Legacy.java"), T0.plusSeconds(63));

        List<CodingSession> saved = store.saved();
        assertEquals(1, saved.size());
        assertEquals(T0.plusSeconds(63), saved.get(0).endTime());
    }

    @Test
    void shouldStayActiveWhenIdleTickFindsNoLiveSessions() throws Exception {
        tracker.onActivity(edit("shop", "Order.kt"), T0);
        clock.set(T0.plusSeconds(10));
        tracker.forcePersistSessions().get();

        tracker.checkIdleStatus(T0.plusSeconds(400));

        assertTrue(tracker.isUserActive());
        assertEquals(0, stopped.get());
        assertEquals(1, store.saved().size());
    }

    @Test
    void shouldStartFreshSessionWhileFlushIsInFlight() throws Exception {
        EditTarget kotlin = edit("shop", "Order.kt");
        CountDownLatch release = new CountDownLatch(1);
        store.holdWrites(release);

        tracker.onActivity(kotlin, T0);
        clock.set(T0.plusSeconds(15));
        CompletableFuture<Integer> flush = tracker.forcePersistSessions();
        assertTrue(tracker.onActivity(kotlin, T0.plusSeconds(20)));

        assertFalse(flush.isDone());
        List<LiveSession> live = tracker.snapshot();
        assertEquals(1, live.size());
        assertEquals(T0.plusSeconds(20), live.get(0).startTime());

        release.countDown();
        assertEquals(1, flush.get(5, TimeUnit.SECONDS));
        clock.set(T0.plusSeconds(30));
        assertEquals(1, tracker.forcePersistSessions().get(5, TimeUnit.SECONDS));

        List<CodingSession> saved = store.saved();
        assertEquals(2, saved.size());
        assertEquals(T0.plusSeconds(15), saved.get(0).endTime());
        assertEquals(T0.plusSeconds(20), saved.get(1).startTime());
        assertEquals(T0.plusSeconds(30), saved.get(1).endTime());
        assertNotEquals(saved.get(0).sessionUuid(), saved.get(1).sessionUuid());
    }

    @Test
    void shouldNotSweepConcurrentEditIntoIdleFlush() throws Exception {
        EditTarget kotlin = edit("shop", "Order.kt");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 200; i++) {
                tracker.close();
                tracker = newTracker();
                tracker.onActivity(kotlin, T0);
                LocalDateTime later = T0.plusSeconds(120);
                CountDownLatch go = new CountDownLatch(1);

                Future<?> tick = pool.submit(() -> {
                    go.await();
                    tracker.checkIdleStatus(later);
                    return null;
                });
                Future<?> typing = pool.submit(() -> {
                    go.await();
                    tracker.onActivity(kotlin, later);
                    return null;
                });
                go.countDown();
                tick.get(5, TimeUnit.SECONDS);
                typing.get(5, TimeUnit.SECONDS);

                assertTrue(tracker.isUserActive());
                assertEquals(1, tracker.liveSessionCount());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
