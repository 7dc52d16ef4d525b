package com.codetracker.lifecycle;

import com.codetracker.activity.ActivityGate;
import com.codetracker.activity.FileActivityWatcher;
import com.codetracker.activity.LanguageResolver;
import com.codetracker.activity.TargetResolver;
import com.codetracker.aggregation.CodingStatistics;
import com.codetracker.aggregation.SummaryCalculator;
import com.codetracker.aggregation.TimeInterval;
import com.codetracker.aggregation.TimeRanges;
import com.codetracker.config.AppConfig;
import com.codetracker.config.ConfigManager;
import com.codetracker.exchange.DataExchangeService;
import com.codetracker.logging.LoggingConfigurator;
import com.codetracker.model.TimePeriod;
import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;
import com.codetracker.storage.sqlite.SqliteSessionStore;
import com.codetracker.tracking.LivePeriodCounters;
import com.codetracker.tracking.PeriodManager;
import com.codetracker.tracking.PeriodMonitor;
import com.codetracker.tracking.SessionContext;
import com.codetracker.tracking.SessionTracker;
import com.codetracker.tracking.TrackerEvents;
import com.codetracker.user.UserIdProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires storage, tracking, statistics and configuration together.
 * <p>
 * {@link #open()} prepares everything needed to query and exchange data; {@link #start()}
 * additionally starts live tracking with its idle and period tickers.
 */
public class CodeTrackerService implements CodeTrackerApplication {

    private static final Logger log = LoggerFactory.getLogger(CodeTrackerService.class);

    private final Path configPath;
    private final ConfigManager configManager;
    private final Clock clock;

    private final AtomicBoolean opened = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile AppConfig config;
    private SessionStore store;
    private CodingStatistics statistics;
    private SummaryCalculator summaryCalculator;
    private DataExchangeService exchangeService;

    private ActivityGate activityGate;
    private LanguageResolver languageResolver;
    private TrackerEvents events;
    private LivePeriodCounters counters;
    private SessionTracker tracker;
    private PeriodMonitor periodMonitor;
    private FileActivityWatcher fileWatcher;

    public CodeTrackerService(Path configPath, ConfigManager configManager, Clock clock) {
        this.configPath = configPath.toAbsolutePath().normalize();
        this.configManager = Objects.requireNonNull(configManager, "configManager");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void open() throws IOException, StorageException {
        if (!opened.compareAndSet(false, true)) {
            return;
        }
        this.config = configManager.load(configPath);
        LoggingConfigurator.apply(config.logging());
        this.store = new SqliteSessionStore(config.storage(), config.shutdownTimeout());
        this.statistics = new CodingStatistics(store, clock);
        this.summaryCalculator = new SummaryCalculator(store, clock, config.summaryInMemoryThreshold());
        this.exchangeService = new DataExchangeService(store, clock);
        log.info("Opened coding database {}", config.storage().databasePath());
    }

    @Override
    public void start() throws Exception {
        open();
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting code time tracking");
        UserIdProvider userIdProvider = new UserIdProvider(store, dataRoot(config));
        SessionContext context = new SessionContext(
                userIdProvider.userId(),
                SessionContext.currentPlatform(),
                config.ideName());

        this.activityGate = new ActivityGate(config.excludedPaths());
        this.languageResolver = new LanguageResolver(config.languages());
        this.events = new TrackerEvents();
        this.counters = new LivePeriodCounters();
        seedCounters();

        this.tracker = new SessionTracker(
                store,
                activityGate,
                new TargetResolver(languageResolver),
                context,
                clock,
                config.idleThreshold(),
                config.shutdownTimeout(),
                counters,
                events);
        tracker.start(Duration.ofSeconds(config.idleCheckIntervalSeconds()));

        this.periodMonitor = new PeriodMonitor(new PeriodManager(clock), counters, events, clock);
        periodMonitor.start(Duration.ofSeconds(config.periodCheckIntervalSeconds()));

        configManager.registerListener(this::applyConfigReload);
        try {
            configManager.startWatching(configPath);
        } catch (Exception ex) {
            log.warn("Failed to start configuration watcher", ex);
        }
    }

    public synchronized void watchProjects(List<Path> projectDirectories) throws IOException {
        if (!started.get()) {
            throw new IllegalStateException("service is not started");
        }
        if (fileWatcher != null) {
            fileWatcher.close();
        }
        fileWatcher = new FileActivityWatcher(tracker::onActivity);
        fileWatcher.start(projectDirectories);
    }

    private void seedCounters() {
        LocalDate today = LocalDate.now(clock);
        for (TimePeriod period : TimePeriod.values()) {
            TimeInterval range = TimeRanges.rangeOf(period, today);
            counters.set(period, statistics.codingTimeForPeriod(range.start(), range.end(), null));
        }
    }

    void applyConfigReload(AppConfig newConfig) {
        AppConfig previous = this.config;
        this.config = newConfig;
        if (previous.equals(newConfig)) {
            log.debug("Configuration reload detected but no changes applied.");
            return;
        }
        log.info("Configuration reloaded from {}", configPath);

        try {
            LoggingConfigurator.apply(newConfig.logging());
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to apply logging configuration after reload", ex);
        }

        summaryCalculator.updateThreshold(newConfig.summaryInMemoryThreshold());
        if (tracker != null) {
            activityGate.updateExclusions(newConfig.excludedPaths());
            languageResolver.updateRules(newConfig.languages());
            tracker.updateIdleThreshold(newConfig.idleThreshold());
        }

        if (!previous.storage().equals(newConfig.storage())) {
            log.warn("Storage configuration changed; restart to apply.");
        }
        if (!previous.ideName().equals(newConfig.ideName())
                || previous.idleCheckIntervalSeconds() != newConfig.idleCheckIntervalSeconds()
                || previous.periodCheckIntervalSeconds() != newConfig.periodCheckIntervalSeconds()) {
            log.warn("Tracker settings changed; restart to apply.");
        }
    }

    @Override
    public void stop() throws Exception {
        if (!opened.get() || !stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping code time tracker");
        synchronized (this) {
            if (fileWatcher != null) {
                fileWatcher.close();
            }
        }
        if (periodMonitor != null) {
            periodMonitor.close();
        }
        if (tracker != null) {
            tracker.stopTracking();
        }
        if (store != null) {
            store.close();
        }
        configManager.close();
    }

    @Override
    public void close() throws Exception {
        stop();
    }

    public AppConfig config() {
        return config;
    }

    public CodingStatistics statistics() {
        return requireOpen(statistics);
    }

    public SummaryCalculator summaryCalculator() {
        return requireOpen(summaryCalculator);
    }

    public DataExchangeService exchangeService() {
        return requireOpen(exchangeService);
    }

    public SessionTracker tracker() {
        return requireOpen(tracker);
    }

    public TrackerEvents events() {
        return requireOpen(events);
    }

    private static <T> T requireOpen(T component) {
        if (component == null) {
            throw new IllegalStateException("service is not open");
        }
        return component;
    }

    private static Path dataRoot(AppConfig configuration) {
        Path databasePath = Path.of(configuration.storage().databasePath()).toAbsolutePath();
        Path parent = databasePath.getParent();
        return parent != null ? parent : databasePath;
    }
}
