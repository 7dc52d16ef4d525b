package com.codetracker;

import com.codetracker.aggregation.CodingStatistics;
import com.codetracker.config.FileConfigManager;
import com.codetracker.exchange.ImportResult;
import com.codetracker.lifecycle.CodeTrackerService;
import com.codetracker.model.CodingStreaks;
import com.codetracker.model.DailySummary;
import com.codetracker.model.HourOfDayUsage;
import com.codetracker.model.LanguageUsage;
import com.codetracker.model.ProjectUsage;
import com.codetracker.model.SummaryData;
import com.codetracker.model.TimeOfDayUsage;
import com.codetracker.util.PathUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;

public final class CodeTrackerMain {

    private static final Logger log = LoggerFactory.getLogger(CodeTrackerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = """
            Usage: code-time-tracker [--config <path>] <command>
              run <projectDir>...           track edits below the directories until interrupted
              summary                       today, week, month, year, total and daily average
              stats [days]                  activity, streaks and distributions for the last days (default 30)
              export <file> [<from> <to>]   write sessions as JSON, optionally only those overlapping [from, to)
              import <file>                 add sessions from an export file, skipping known ones
            """;

    private CodeTrackerMain() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out) {
        List<String> arguments = new ArrayList<>(Arrays.asList(args == null ? new String[0] : args));
        Path configPath = PathUtils.defaultDataRoot().resolve("config.json");
        if (!arguments.isEmpty() && arguments.get(0).equals("--config")) {
            if (arguments.size() < 2) {
                out.print(USAGE);
                return EXIT_USAGE;
            }
            configPath = PathUtils.resolve(arguments.get(1));
            arguments = arguments.subList(2, arguments.size());
        }
        if (arguments.isEmpty()) {
            out.print(USAGE);
            return EXIT_USAGE;
        }
        String command = arguments.get(0).toLowerCase(Locale.ROOT);
        List<String> rest = arguments.subList(1, arguments.size());
        try {
            return switch (command) {
                case "run" -> runTracker(configPath, rest, out);
                case "summary" -> withService(configPath, service -> printSummary(service, out));
                case "stats" -> withService(configPath, service -> printStats(service, rest, out));
                case "export" -> withService(configPath, service -> export(service, rest, out));
                case "import" -> withService(configPath, service -> importFile(service, rest, out));
                default -> {
                    out.print(USAGE);
                    yield EXIT_USAGE;
                }
            };
        } catch (Exception ex) {
            log.error("Command {} failed", command, ex);
            out.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int runTracker(Path configPath, List<String> directories, PrintStream out) throws Exception {
        if (directories.isEmpty()) {
            out.print(USAGE);
            return EXIT_USAGE;
        }
        List<Path> projects = directories.stream().map(PathUtils::resolve).toList();
        FileConfigManager configManager = new FileConfigManager();
        CodeTrackerService service = new CodeTrackerService(configPath, configManager, Clock.systemDefaultZone());
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                service.stop();
            } catch (Exception ex) {
                log.error("Error during shutdown", ex);
            } finally {
                latch.countDown();
            }
        }, "codetracker-shutdown"));

        service.start();
        service.watchProjects(projects);
        out.println("Tracking " + projects.size() + " project(s). Press Ctrl+C to stop.");
        latch.await();
        return EXIT_OK;
    }

    private static int withService(Path configPath, ServiceCommand command) throws Exception {
        try (CodeTrackerService service = new CodeTrackerService(configPath, new FileConfigManager(),
                Clock.systemDefaultZone())) {
            service.open();
            return command.execute(service);
        }
    }

    private static int printSummary(CodeTrackerService service, PrintStream out) {
        SummaryData summary = service.summaryCalculator().computeSummary();
        out.println("Today          " + formatDuration(summary.today()));
        out.println("This week      " + formatDuration(summary.thisWeek()));
        out.println("This month     " + formatDuration(summary.thisMonth()));
        out.println("This year      " + formatDuration(summary.thisYear()));
        out.println("Total          " + formatDuration(summary.total()));
        out.println("Daily average  " + formatDuration(summary.dailyAverage()));
        return EXIT_OK;
    }

    private static int printStats(CodeTrackerService service, List<String> args, PrintStream out) {
        int days = CodingStatistics.DEFAULT_RECENT_DAYS;
        if (!args.isEmpty()) {
            try {
                days = Integer.parseInt(args.get(0));
            } catch (NumberFormatException ex) {
                out.println("Not a number of days: " + args.get(0));
                return EXIT_USAGE;
            }
            if (days <= 0) {
                out.println("Number of days must be positive");
                return EXIT_USAGE;
            }
        }
        CodingStatistics statistics = service.statistics();
        LocalDate today = LocalDate.now();
        LocalDateTime start = today.minusDays(days - 1L).atStartOfDay();
        LocalDateTime end = today.plusDays(1).atStartOfDay();

        out.println("Daily activity");
        for (DailySummary day : statistics.recentActivity(days)) {
            out.println("  " + day.date() + "  " + formatDuration(day.totalDuration()));
        }
        CodingStreaks streaks = statistics.codingStreaks();
        out.println("Streaks: current " + streaks.currentStreak() + " day(s), longest " + streaks.maxStreak() + " day(s)");

        out.println("Languages");
        for (LanguageUsage usage : statistics.languageDistribution(start, end)) {
            out.println("  " + StringUtils.rightPad(usage.language(), 20) + formatDuration(usage.duration()));
        }
        out.println("Projects");
        for (ProjectUsage usage : statistics.projectDistribution(start, end)) {
            out.println("  " + StringUtils.rightPad(usage.projectName(), 20) + formatDuration(usage.duration()));
        }
        out.println("Time of day");
        for (TimeOfDayUsage usage : statistics.timeOfDayDistribution(start, end)) {
            out.println("  " + StringUtils.rightPad(StringUtils.capitalize(usage.timeOfDay().name().toLowerCase(Locale.ROOT)), 20)
                    + formatDuration(usage.duration()));
        }
        out.println("Average per hour of day");
        for (HourOfDayUsage usage : statistics.overallHourlyDistribution(start, end)) {
            out.println("  " + String.format(Locale.ROOT, "%02d:00", usage.hourOfDay()) + "  "
                    + formatDuration(usage.averageDuration()));
        }
        return EXIT_OK;
    }

    private static int export(CodeTrackerService service, List<String> args, PrintStream out) throws Exception {
        if (args.size() != 1 && args.size() != 3) {
            out.print(USAGE);
            return EXIT_USAGE;
        }
        LocalDateTime from = null;
        LocalDateTime to = null;
        if (args.size() == 3) {
            try {
                from = parseBound(args.get(1), false);
                to = parseBound(args.get(2), true);
            } catch (DateTimeParseException ex) {
                out.println("Invalid date: " + ex.getParsedString());
                return EXIT_USAGE;
            }
            if (to.isBefore(from)) {
                out.println("The end of the range is before its start");
                return EXIT_USAGE;
            }
        }
        Path target = PathUtils.resolve(args.get(0));
        int exported = service.exchangeService().exportToFile(target, from, to);
        out.println("Exported " + exported + " session(s) to " + target);
        return EXIT_OK;
    }

    private static int importFile(CodeTrackerService service, List<String> args, PrintStream out) {
        if (args.size() != 1) {
            out.print(USAGE);
            return EXIT_USAGE;
        }
        ImportResult result = service.exchangeService().importFromFile(PathUtils.resolve(args.get(0)));
        if (!result.success()) {
            out.println("Import failed: " + result.errorMessage().orElse("unknown error"));
            return EXIT_FAILURE;
        }
        out.println("Imported " + result.imported() + ", skipped " + result.skipped()
                + " of " + result.totalInFile() + " session(s)");
        return EXIT_OK;
    }

    static LocalDateTime parseBound(String text, boolean endOfRange) {
        String trimmed = text.trim();
        if (trimmed.contains("T")) {
            return LocalDateTime.parse(trimmed);
        }
        LocalDate date = LocalDate.parse(trimmed);
        return endOfRange ? date.plusDays(1).atStartOfDay() : date.atStartOfDay();
    }

    static String formatDuration(Duration duration) {
        long totalMinutes = duration.toMinutes();
        return String.format(Locale.ROOT, "%dh %02dm", totalMinutes / 60, totalMinutes % 60);
    }

    @FunctionalInterface
    private interface ServiceCommand {
        int execute(CodeTrackerService service) throws Exception;
    }
}
