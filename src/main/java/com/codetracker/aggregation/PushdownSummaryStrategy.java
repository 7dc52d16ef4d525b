package com.codetracker.aggregation;

import com.codetracker.model.SummaryData;
import com.codetracker.model.TimePeriod;
import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Objects;

public class PushdownSummaryStrategy implements SummaryStrategy {

    private final SessionStore store;

    public PushdownSummaryStrategy(SessionStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public SummaryData compute(LocalDate today) throws StorageException {
        long totalSeconds = store.totalSeconds(null);
        LocalDate firstDay = store.firstRecordDate().orElse(null);
        return new SummaryData(
                Duration.ofSeconds(periodSeconds(TimePeriod.TODAY, today)),
                Duration.ofSeconds(SummaryStrategy.dailyAverageSeconds(totalSeconds, firstDay, today)),
                Duration.ofSeconds(periodSeconds(TimePeriod.THIS_WEEK, today)),
                Duration.ofSeconds(periodSeconds(TimePeriod.THIS_MONTH, today)),
                Duration.ofSeconds(periodSeconds(TimePeriod.THIS_YEAR, today)),
                Duration.ofSeconds(totalSeconds)
        );
    }

    private long periodSeconds(TimePeriod period, LocalDate today) throws StorageException {
        TimeInterval range = TimeRanges.rangeOf(period, today);
        return store.overlapSeconds(range.start(), range.end(), null);
    }
}
