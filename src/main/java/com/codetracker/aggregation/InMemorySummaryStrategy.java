package com.codetracker.aggregation;

import com.codetracker.model.SessionTimeRange;
import com.codetracker.model.SummaryData;
import com.codetracker.model.TimePeriod;
import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class InMemorySummaryStrategy implements SummaryStrategy {

    private final SessionStore store;

    public InMemorySummaryStrategy(SessionStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public SummaryData compute(LocalDate today) throws StorageException {
        List<SessionTimeRange> sessions = store.findAllSessionTimes();
        if (sessions.isEmpty()) {
            return SummaryData.empty();
        }

        Map<TimePeriod, TimeInterval> ranges = new EnumMap<>(TimePeriod.class);
        Map<TimePeriod, Long> seconds = new EnumMap<>(TimePeriod.class);
        for (TimePeriod period : TimePeriod.values()) {
            ranges.put(period, TimeRanges.rangeOf(period, today));
            seconds.put(period, 0L);
        }

        long totalSeconds = 0;
        LocalDate firstDay = null;
        for (SessionTimeRange session : sessions) {
            TimeInterval interval = TimeInterval.of(session.startTime(), session.endTime());
            totalSeconds += interval.seconds();
            LocalDate day = session.startTime().toLocalDate();
            if (firstDay == null || day.isBefore(firstDay)) {
                firstDay = day;
            }
            for (Map.Entry<TimePeriod, TimeInterval> entry : ranges.entrySet()) {
                long overlap = interval.clip(entry.getValue()).map(TimeInterval::seconds).orElse(0L);
                seconds.merge(entry.getKey(), overlap, Long::sum);
            }
        }

        return new SummaryData(
                Duration.ofSeconds(seconds.get(TimePeriod.TODAY)),
                Duration.ofSeconds(SummaryStrategy.dailyAverageSeconds(totalSeconds, firstDay, today)),
                Duration.ofSeconds(seconds.get(TimePeriod.THIS_WEEK)),
                Duration.ofSeconds(seconds.get(TimePeriod.THIS_MONTH)),
                Duration.ofSeconds(seconds.get(TimePeriod.THIS_YEAR)),
                Duration.ofSeconds(totalSeconds)
        );
    }
}
