package com.codetracker.tracking;

import com.codetracker.model.TimePeriod;
import com.codetracker.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the clock and, once per wall-clock minute, resets the live counter of every period whose
 * boundary moved.
 */
public class PeriodMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeriodMonitor.class);

    private final PeriodManager periodManager;
    private final LivePeriodCounters counters;
    private final TrackerEvents events;
    private final Clock clock;

    private LocalDateTime lastMinute;
    private ScheduledExecutorService executor;

    public PeriodMonitor(PeriodManager periodManager, LivePeriodCounters counters, TrackerEvents events, Clock clock) {
        this.periodManager = Objects.requireNonNull(periodManager, "periodManager");
        this.counters = Objects.requireNonNull(counters, "counters");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start(Duration checkInterval) {
        Objects.requireNonNull(checkInterval, "checkInterval");
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("period-monitor"));
        long intervalMillis = Math.max(1L, checkInterval.toMillis());
        executor.scheduleAtFixedRate(
                () -> safeExecute(this::tick, "period check"),
                intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);
    }

    public List<TimePeriod> tick() {
        return tick(LocalDateTime.now(clock));
    }

    public synchronized List<TimePeriod> tick(LocalDateTime now) {
        LocalDateTime minute = now.truncatedTo(ChronoUnit.MINUTES);
        if (minute.equals(lastMinute)) {
            return List.of();
        }
        lastMinute = minute;
        List<TimePeriod> reset = new ArrayList<>();
        for (TimePeriod period : TimePeriod.values()) {
            if (periodManager.isPeriodChanged(period, now)) {
                periodManager.resetPeriod(period, now);
                counters.reset(period);
                reset.add(period);
                log.info("New {} period started at {}", period, periodManager.currentStart(period));
                events.firePeriodReset(period);
            }
        }
        return reset;
    }

    private void safeExecute(Runnable runnable, String taskName) {
        try {
            runnable.run();
        } catch (Throwable ex) {
            log.error("Error executing {}", taskName, ex);
        }
    }

    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }
}
