package com.codetracker.aggregation;

import com.codetracker.model.CodingSession;
import com.codetracker.model.CodingStreaks;
import com.codetracker.model.DailySummary;
import com.codetracker.model.HourOfDayUsage;
import com.codetracker.model.HourlyUsage;
import com.codetracker.model.LanguageUsage;
import com.codetracker.model.ProjectUsage;
import com.codetracker.model.TimeBounds;
import com.codetracker.model.TimeOfDay;
import com.codetracker.model.TimeOfDayUsage;
import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Read-only analytics over persisted sessions.
 * <p>
 * Every range is closed-open. A session only counts with its overlap
 * {@code [max(session.start, start), min(session.end, end))}; bucketed figures additionally split
 * that overlap at the bucket boundaries, so bucket totals always add up to the range total.
 * Storage failures are logged and reported as empty or zero results.
 */
public class CodingStatistics {

    private static final Logger log = LoggerFactory.getLogger(CodingStatistics.class);

    public static final int DEFAULT_RECENT_DAYS = 30;

    private final SessionStore store;
    private final Clock clock;

    public CodingStatistics(SessionStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sum of all session durations, summed by the database.
     *
     * @param projectName optional project filter, {@code null} for every project
     */
    public Duration totalCodingTime(String projectName) {
        try {
            return Duration.ofSeconds(store.totalSeconds(projectName));
        } catch (StorageException ex) {
            log.error("Failed to compute total coding time", ex);
            return Duration.ZERO;
        }
    }

    public Optional<TimeBounds> timeBounds() {
        try {
            return store.findTimeBounds();
        } catch (StorageException ex) {
            log.error("Failed to read session time bounds", ex);
            return Optional.empty();
        }
    }

    public Duration codingTimeForPeriod(LocalDateTime start, LocalDateTime end, String projectName) {
        TimeInterval range = requireRange(start, end);
        long seconds = 0;
        for (TimeInterval overlap : overlaps(range, projectName)) {
            seconds += overlap.seconds();
        }
        return Duration.ofSeconds(seconds);
    }

    public List<DailySummary> dailyCodingTimeForHeatmap(LocalDateTime start, LocalDateTime end) {
        TimeInterval range = requireRange(start, end);
        Map<LocalDate, Long> perDay = secondsPerDay(range);
        List<DailySummary> result = new ArrayList<>(perDay.size());
        perDay.forEach((date, seconds) -> result.add(new DailySummary(date, Duration.ofSeconds(seconds))));
        return result;
    }

    public List<DailySummary> recentActivity(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be > 0");
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate first = today.minusDays(days - 1L);
        TimeInterval range = TimeInterval.of(first.atStartOfDay(), today.plusDays(1).atStartOfDay());
        Map<LocalDate, Long> perDay = secondsPerDay(range);
        List<DailySummary> result = new ArrayList<>(days);
        for (LocalDate date = first; !date.isAfter(today); date = date.plusDays(1)) {
            result.add(new DailySummary(date, Duration.ofSeconds(perDay.getOrDefault(date, 0L))));
        }
        return result;
    }

    public CodingStreaks codingStreaks() {
        Optional<TimeInterval> range = implicitRange();
        if (range.isEmpty()) {
            return CodingStreaks.NONE;
        }
        return codingStreaks(range.get().start(), range.get().end());
    }

    public CodingStreaks codingStreaks(LocalDateTime start, LocalDateTime end) {
        TimeInterval range = requireRange(start, end);
        List<CodingSession> sessions = candidates(range, null);
        Set<LocalDate> activeDays = new TreeSet<>(Comparator.reverseOrder());
        for (CodingSession session : sessions) {
            Optional<TimeInterval> overlap = intervalOf(session).clip(range);
            if (overlap.isPresent()) {
                overlap.get().splitByDay().forEach(fragment -> activeDays.add(fragment.start().toLocalDate()));
            } else if (session.durationSeconds() == 0 && !session.startTime().isBefore(range.start())
                    && session.startTime().isBefore(range.end())) {
                // zero-length sessions still mark their day as active
                activeDays.add(session.startTime().toLocalDate());
            }
        }
        return computeStreaks(List.copyOf(activeDays), LocalDate.now(clock));
    }

    /**
     * Average coding time per weekday occurrence and hour.
     * <p>
     * Seconds are summed per {@code (weekday, hour)} and divided by the number of times that
     * weekday occurs in the range, so weekdays that occur more often are not over-weighted. When
     * both bounds are {@code null} the range spans the earliest to the latest recorded session.
     */
    public List<HourlyUsage> dailyHourDistribution(LocalDateTime start, LocalDateTime end) {
        Optional<TimeInterval> resolved = resolveRange(start, end);
        if (resolved.isEmpty()) {
            return List.of();
        }
        TimeInterval range = resolved.get();
        Map<DayOfWeek, Map<Integer, Long>> sums = new EnumMap<>(DayOfWeek.class);
        for (TimeInterval overlap : overlaps(range, null)) {
            for (TimeInterval fragment : overlap.splitByHour()) {
                sums.computeIfAbsent(fragment.start().getDayOfWeek(), day -> new TreeMap<>())
                        .merge(fragment.start().getHour(), fragment.seconds(), Long::sum);
            }
        }
        Map<DayOfWeek, Long> occurrences = weekdayOccurrences(range);
        List<HourlyUsage> result = new ArrayList<>();
        sums.forEach((day, hours) -> {
            long divisor = Math.max(1L, occurrences.getOrDefault(day, 0L));
            hours.forEach((hour, seconds) -> result.add(
                    new HourlyUsage(day, hour, Duration.ofSeconds(seconds).dividedBy(divisor))));
        });
        return result;
    }

    /**
     * Average coding time per hour of day, ignoring the weekday.
     * <p>
     * With an explicit range the sums are divided by the calendar days the range spans. Without
     * one they are divided by the number of distinct days that actually have coding time.
     */
    public List<HourOfDayUsage> overallHourlyDistribution(LocalDateTime start, LocalDateTime end) {
        boolean explicit = start != null || end != null;
        Optional<TimeInterval> resolved = resolveRange(start, end);
        if (resolved.isEmpty()) {
            return List.of();
        }
        TimeInterval range = resolved.get();
        Map<Integer, Long> sums = new TreeMap<>();
        Set<LocalDate> activeDays = new TreeSet<>();
        for (TimeInterval overlap : overlaps(range, null)) {
            for (TimeInterval fragment : overlap.splitByHour()) {
                sums.merge(fragment.start().getHour(), fragment.seconds(), Long::sum);
                activeDays.add(fragment.start().toLocalDate());
            }
        }
        long divisor = Math.max(1L, explicit ? calendarDays(range) : activeDays.size());
        List<HourOfDayUsage> result = new ArrayList<>(sums.size());
        sums.forEach((hour, seconds) -> result.add(
                new HourOfDayUsage(hour, Duration.ofSeconds(seconds).dividedBy(divisor))));
        return result;
    }

    public List<LanguageUsage> languageDistribution(LocalDateTime start, LocalDateTime end) {
        return groupedDistribution(start, end, CodingSession::language).entrySet().stream()
                .map(entry -> new LanguageUsage(entry.getKey(), Duration.ofSeconds(entry.getValue())))
                .sorted(Comparator.comparing(LanguageUsage::duration).reversed()
                        .thenComparing(LanguageUsage::language))
                .toList();
    }

    public List<ProjectUsage> projectDistribution(LocalDateTime start, LocalDateTime end) {
        return groupedDistribution(start, end, CodingSession::projectName).entrySet().stream()
                .map(entry -> new ProjectUsage(entry.getKey(), Duration.ofSeconds(entry.getValue())))
                .sorted(Comparator.comparing(ProjectUsage::duration).reversed()
                        .thenComparing(ProjectUsage::projectName))
                .toList();
    }

    public List<TimeOfDayUsage> timeOfDayDistribution(LocalDateTime start, LocalDateTime end) {
        Optional<TimeInterval> resolved = resolveRange(start, end);
        if (resolved.isEmpty()) {
            return List.of();
        }
        Map<TimeOfDay, Long> sums = new EnumMap<>(TimeOfDay.class);
        for (TimeInterval overlap : overlaps(resolved.get(), null)) {
            for (TimeInterval fragment : overlap.splitByTimeOfDay()) {
                sums.merge(TimeOfDay.of(fragment.start().toLocalTime()), fragment.seconds(), Long::sum);
            }
        }
        List<TimeOfDayUsage> result = new ArrayList<>(sums.size());
        sums.forEach((bucket, seconds) -> result.add(new TimeOfDayUsage(bucket, Duration.ofSeconds(seconds))));
        return result;
    }

    static CodingStreaks computeStreaks(List<LocalDate> daysDescending, LocalDate today) {
        if (daysDescending.isEmpty()) {
            return CodingStreaks.NONE;
        }
        int maxStreak = 1;
        int run = 1;
        for (int i = 1; i < daysDescending.size(); i++) {
            if (daysDescending.get(i - 1).minusDays(1).equals(daysDescending.get(i))) {
                run++;
                maxStreak = Math.max(maxStreak, run);
            } else {
                run = 1;
            }
        }

        LocalDate mostRecent = daysDescending.get(0);
        int currentStreak = 0;
        if (mostRecent.equals(today) || mostRecent.equals(today.minusDays(1))) {
            currentStreak = 1;
            for (int i = 1; i < daysDescending.size(); i++) {
                if (!daysDescending.get(i - 1).minusDays(1).equals(daysDescending.get(i))) {
                    break;
                }
                currentStreak++;
            }
        }
        return new CodingStreaks(currentStreak, maxStreak);
    }

    private Map<String, Long> groupedDistribution(LocalDateTime start, LocalDateTime end,
                                                  Function<CodingSession, String> key) {
        Optional<TimeInterval> resolved = resolveRange(start, end);
        if (resolved.isEmpty()) {
            return Map.of();
        }
        Map<String, Long> sums = new HashMap<>();
        for (CodingSession session : candidates(resolved.get(), null)) {
            intervalOf(session).clip(resolved.get())
                    .ifPresent(overlap -> sums.merge(key.apply(session), overlap.seconds(), Long::sum));
        }
        return sums;
    }

    private Map<LocalDate, Long> secondsPerDay(TimeInterval range) {
        Map<LocalDate, Long> perDay = new TreeMap<>();
        for (TimeInterval overlap : overlaps(range, null)) {
            for (TimeInterval fragment : overlap.splitByDay()) {
                perDay.merge(fragment.start().toLocalDate(), fragment.seconds(), Long::sum);
            }
        }
        return perDay;
    }

    private List<TimeInterval> overlaps(TimeInterval range, String projectName) {
        List<TimeInterval> result = new ArrayList<>();
        for (CodingSession session : candidates(range, projectName)) {
            intervalOf(session).clip(range).ifPresent(result::add);
        }
        return result;
    }

    private List<CodingSession> candidates(TimeInterval range, String projectName) {
        try {
            return store.findOverlapping(range.start(), range.end(), projectName);
        } catch (StorageException ex) {
            log.error("Failed to load sessions between {} and {}", range.start(), range.end(), ex);
            return List.of();
        }
    }

    private Optional<TimeInterval> resolveRange(LocalDateTime start, LocalDateTime end) {
        if (start == null && end == null) {
            return implicitRange();
        }
        return Optional.of(requireRange(start, end));
    }

    private Optional<TimeInterval> implicitRange() {
        return timeBounds().map(bounds -> TimeInterval.of(bounds.earliestStart(), bounds.latestEnd()));
    }

    private static TimeInterval intervalOf(CodingSession session) {
        return TimeInterval.of(session.startTime(), session.endTime());
    }

    private static TimeInterval requireRange(LocalDateTime start, LocalDateTime end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " is before start " + start);
        }
        return TimeInterval.of(start, end);
    }

    private static long calendarDays(TimeInterval range) {
        return ChronoUnit.DAYS.between(range.start().toLocalDate(), TimeRanges.lastDayOf(range)) + 1;
    }

    private static Map<DayOfWeek, Long> weekdayOccurrences(TimeInterval range) {
        Map<DayOfWeek, Long> occurrences = new EnumMap<>(DayOfWeek.class);
        LocalDate last = TimeRanges.lastDayOf(range);
        for (LocalDate date = range.start().toLocalDate(); !date.isAfter(last); date = date.plusDays(1)) {
            occurrences.merge(date.getDayOfWeek(), 1L, Long::sum);
        }
        return occurrences;
    }
}
