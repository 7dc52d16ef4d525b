package com.codetracker.aggregation;

import com.codetracker.model.SummaryData;
import com.codetracker.storage.StorageException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public interface SummaryStrategy {

    SummaryData compute(LocalDate today) throws StorageException;

    /**
     * Total divided by the days elapsed since the first recorded day, at least one.
     */
    static long dailyAverageSeconds(long totalSeconds, LocalDate firstDay, LocalDate today) {
        if (firstDay == null) {
            return 0L;
        }
        long days = Math.max(1L, ChronoUnit.DAYS.between(firstDay, today));
        return totalSeconds / days;
    }
}
