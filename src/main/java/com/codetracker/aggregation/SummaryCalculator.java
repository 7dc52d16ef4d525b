package com.codetracker.aggregation;

import com.codetracker.model.SummaryData;
import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Computes {@link SummaryData}, picking the strategy from the number of stored sessions.
 * <p>
 * Below the threshold all time ranges are loaded and summed in memory; at or above it the sums
 * are computed by the database. Any failure yields an all-zero summary.
 */
public class SummaryCalculator {

    private static final Logger log = LoggerFactory.getLogger(SummaryCalculator.class);

    public static final int DEFAULT_IN_MEMORY_THRESHOLD = 20_000;

    private final SessionStore store;
    private final Clock clock;
    private final SummaryStrategy inMemory;
    private final SummaryStrategy pushdown;
    private volatile int inMemoryThreshold;

    public SummaryCalculator(SessionStore store, Clock clock, int inMemoryThreshold) {
        this(store, clock, inMemoryThreshold, new InMemorySummaryStrategy(store), new PushdownSummaryStrategy(store));
    }

    SummaryCalculator(SessionStore store,
                      Clock clock,
                      int inMemoryThreshold,
                      SummaryStrategy inMemory,
                      SummaryStrategy pushdown) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.inMemory = Objects.requireNonNull(inMemory, "inMemory");
        this.pushdown = Objects.requireNonNull(pushdown, "pushdown");
        updateThreshold(inMemoryThreshold);
    }

    public SummaryData computeSummary() {
        try {
            long recordCount = store.countSessions();
            LocalDate today = LocalDate.now(clock);
            if (prefersInMemory(recordCount, inMemoryThreshold)) {
                log.debug("Computing summary in memory ({} records)", recordCount);
                return inMemory.compute(today);
            }
            log.debug("Computing summary in the database ({} records)", recordCount);
            return pushdown.compute(today);
        } catch (StorageException | RuntimeException ex) {
            log.error("Failed to compute summary statistics", ex);
            return SummaryData.empty();
        }
    }

    public static boolean prefersInMemory(long recordCount, int threshold) {
        return recordCount < threshold;
    }

    public void updateThreshold(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0");
        }
        this.inMemoryThreshold = threshold;
    }

    public int inMemoryThreshold() {
        return inMemoryThreshold;
    }
}
