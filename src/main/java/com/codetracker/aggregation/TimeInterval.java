package com.codetracker.aggregation;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

public record TimeInterval(LocalDateTime start, LocalDateTime end) {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        start = start.truncatedTo(ChronoUnit.SECONDS);
        end = end.truncatedTo(ChronoUnit.SECONDS);
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("interval end " + end + " is before start " + start);
        }
    }

    public static TimeInterval of(LocalDateTime start, LocalDateTime end) {
        return new TimeInterval(start, end);
    }

    public long seconds() {
        return ChronoUnit.SECONDS.between(start, end);
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }

    /**
     * Intersection with {@code [rangeStart, rangeEnd)}; empty when it has no positive length.
     */
    public Optional<TimeInterval> clip(LocalDateTime rangeStart, LocalDateTime rangeEnd) {
        TimeInterval range = new TimeInterval(rangeStart, rangeEnd);
        LocalDateTime effectiveStart = start.isAfter(range.start) ? start : range.start;
        LocalDateTime effectiveEnd = end.isBefore(range.end) ? end : range.end;
        if (!effectiveStart.isBefore(effectiveEnd)) {
            return Optional.empty();
        }
        return Optional.of(new TimeInterval(effectiveStart, effectiveEnd));
    }

    public Optional<TimeInterval> clip(TimeInterval range) {
        return clip(range.start, range.end);
    }

    /**
     * Overlap in seconds of {@code [start, end)} with {@code [rangeStart, rangeEnd)}, never negative.
     */
    public static long overlapSeconds(LocalDateTime start, LocalDateTime end,
                                      LocalDateTime rangeStart, LocalDateTime rangeEnd) {
        if (end.isBefore(start)) {
            return 0L;
        }
        return new TimeInterval(start, end).clip(rangeStart, rangeEnd)
                .map(TimeInterval::seconds)
                .orElse(0L);
    }

    /**
     * Cuts the interval at every boundary produced by {@code nextBoundary}. The fragments are
     * contiguous, so their lengths sum to {@link #seconds()}.
     *
     * @param nextBoundary returns the first boundary strictly after its argument
     */
    public List<TimeInterval> splitAt(UnaryOperator<LocalDateTime> nextBoundary) {
        List<TimeInterval> fragments = new ArrayList<>();
        LocalDateTime cursor = start;
        while (cursor.isBefore(end)) {
            LocalDateTime boundary = nextBoundary.apply(cursor);
            if (!boundary.isAfter(cursor)) {
                throw new IllegalStateException("boundary function did not advance past " + cursor);
            }
            LocalDateTime fragmentEnd = boundary.isBefore(end) ? boundary : end;
            fragments.add(new TimeInterval(cursor, fragmentEnd));
            cursor = fragmentEnd;
        }
        return fragments;
    }

    public List<TimeInterval> splitByDay() {
        return splitAt(Boundaries::nextMidnight);
    }

    public List<TimeInterval> splitByHour() {
        return splitAt(Boundaries::nextHour);
    }

    public List<TimeInterval> splitByTimeOfDay() {
        return splitAt(Boundaries::nextTimeOfDay);
    }

    static final class Boundaries {

        private Boundaries() {
        }

        static LocalDateTime nextMidnight(LocalDateTime value) {
            return value.toLocalDate().plusDays(1).atStartOfDay();
        }

        static LocalDateTime nextHour(LocalDateTime value) {
            return value.truncatedTo(ChronoUnit.HOURS).plusHours(1);
        }

        static LocalDateTime nextTimeOfDay(LocalDateTime value) {
            int nextStartHour = (value.getHour() / 6 + 1) * 6;
            return value.toLocalDate().atStartOfDay().plusHours(nextStartHour);
        }
    }
}
