package com.codetracker.storage.sqlite;

import com.codetracker.config.SqliteStorageConfig;
import com.codetracker.model.CodingSession;
import com.codetracker.model.SessionTimeRange;
import com.codetracker.model.TimeBounds;
import com.codetracker.storage.ConnectionFactory;
import com.codetracker.storage.DriverManagerConnectionFactory;
import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;
import com.codetracker.util.DaemonThreadFactory;
import com.codetracker.util.Timestamps;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * SQLite implementation of {@link SessionStore}.
 * <p>
 * Every operation opens its own connection from the {@link ConnectionFactory}; writes are queued on one
 * writer thread so batches never interleave.
 */
public class SqliteSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteSessionStore.class);

    private static final String SELECT_COLUMNS = """
            SELECT session_uuid, user_id, project_name, language, platform, ide_name,
                   start_time, end_time, last_modified, is_deleted, is_synced, synced_at, sync_version
            FROM coding_sessions
            """;

    private static final String INSERT_SQL = """
            INSERT INTO coding_sessions
                (session_uuid, user_id, project_name, language, platform, ide_name,
                 start_time, end_time, last_modified, is_deleted, is_synced, synced_at, sync_version)
            VALUES
                (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final Map<String, String> MIGRATED_COLUMNS = new LinkedHashMap<>();

    static {
        MIGRATED_COLUMNS.put("ide_name", "ide_name TEXT NOT NULL DEFAULT ''");
        MIGRATED_COLUMNS.put("is_synced", "is_synced INTEGER NOT NULL DEFAULT 0");
        MIGRATED_COLUMNS.put("synced_at", "synced_at TEXT");
        MIGRATED_COLUMNS.put("sync_version", "sync_version INTEGER NOT NULL DEFAULT 0");
    }

    private final ConnectionFactory connectionFactory;
    private final int busyTimeoutMillis;
    private final Duration shutdownTimeout;
    private final ExecutorService writer;

    public SqliteSessionStore(SqliteStorageConfig config, Duration shutdownTimeout) throws StorageException {
        this(createFactory(config), config.journalMode(), config.busyTimeoutMillis(), shutdownTimeout);
    }

    public SqliteSessionStore(ConnectionFactory connectionFactory,
                              String journalMode,
                              Integer busyTimeoutMillis,
                              Duration shutdownTimeout) throws StorageException {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.busyTimeoutMillis = busyTimeoutMillis == null ? 0 : Math.max(0, busyTimeoutMillis);
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        try (Connection connection = openConnection()) {
            configureJournal(connection, journalMode);
            SchemaInitializer.apply(connection);
        } catch (SQLException ex) {
            throw new StorageException("Failed to initialise SQLite storage", ex);
        }
        this.writer = Executors.newSingleThreadExecutor(new DaemonThreadFactory("session-writer"));
    }

    private static ConnectionFactory createFactory(SqliteStorageConfig config) throws StorageException {
        Objects.requireNonNull(config, "config");
        try {
            Path databasePath = Path.of(config.databasePath()).toAbsolutePath();
            if (databasePath.getParent() != null) {
                Files.createDirectories(databasePath.getParent());
            }
            log.info("Using session database at {}", databasePath);
        } catch (Exception ex) {
            throw new StorageException("Failed to prepare database directory for " + config.databasePath(), ex);
        }
        return new DriverManagerConnectionFactory(config.jdbcUrl());
    }

    @Override
    public CompletableFuture<Integer> saveSessions(List<CodingSession> sessions) {
        Objects.requireNonNull(sessions, "sessions");
        if (sessions.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        List<CodingSession> batch = List.copyOf(sessions);
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return insertBatch(batch);
                } catch (StorageException ex) {
                    throw new CompletionException(ex);
                }
            }, writer);
        } catch (RejectedExecutionException ex) {
            log.error("Session store is closed; dropping {} session(s)", batch.size());
            return CompletableFuture.failedFuture(new StorageException("Session store is closed", ex));
        }
    }

    private int insertBatch(List<CodingSession> batch) throws StorageException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
                for (CodingSession session : batch) {
                    bindSession(statement, session);
                    statement.addBatch();
                }
                statement.executeBatch();
                connection.commit();
            } catch (SQLException ex) {
                rollbackQuietly(connection);
                log.error("Failed to save {} session(s); batch rolled back", batch.size(), ex);
                throw new StorageException("Failed to save sessions to SQLite", ex);
            }
        } catch (SQLException ex) {
            log.error("Failed to open connection for saving {} session(s)", batch.size(), ex);
            throw new StorageException("Failed to open SQLite connection", ex);
        }
        log.info("Saved {} session(s) to the database", batch.size());
        return batch.size();
    }

    @Override
    public List<CodingSession> findOverlapping(LocalDateTime start, LocalDateTime end, String projectName)
            throws StorageException {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        String sql = SELECT_COLUMNS + """
                WHERE is_deleted = 0 AND end_time > ? AND start_time < ?
                """ + projectClause(projectName) + " ORDER BY start_time";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, Timestamps.format(start));
            statement.setString(2, Timestamps.format(end));
            if (projectName != null) {
                statement.setString(3, projectName);
            }
            return readSessions(statement);
        } catch (SQLException ex) {
            throw new StorageException("Failed to query sessions overlapping " + start + " - " + end, ex);
        }
    }

    @Override
    public List<CodingSession> findSessions(LocalDateTime start, LocalDateTime end) throws StorageException {
        if (start != null && end != null) {
            return findOverlapping(start, end, null);
        }
        if (start != null || end != null) {
            throw new IllegalArgumentException("start and end must be given together");
        }
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     SELECT_COLUMNS + " WHERE is_deleted = 0 ORDER BY start_time")) {
            return readSessions(statement);
        } catch (SQLException ex) {
            throw new StorageException("Failed to query sessions", ex);
        }
    }

    @Override
    public List<SessionTimeRange> findAllSessionTimes() throws StorageException {
        List<SessionTimeRange> ranges = new ArrayList<>();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT start_time, end_time FROM coding_sessions WHERE is_deleted = 0");
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                ranges.add(new SessionTimeRange(
                        Timestamps.parse(resultSet.getString(1)),
                        Timestamps.parse(resultSet.getString(2))));
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to query session times", ex);
        }
        return ranges;
    }

    @Override
    public Optional<TimeBounds> findTimeBounds() throws StorageException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT MIN(start_time), MAX(end_time) FROM coding_sessions WHERE is_deleted = 0");
             ResultSet resultSet = statement.executeQuery()) {
            if (resultSet.next()) {
                String earliest = resultSet.getString(1);
                String latest = resultSet.getString(2);
                if (earliest != null && latest != null) {
                    return Optional.of(new TimeBounds(Timestamps.parse(earliest), Timestamps.parse(latest)));
                }
            }
            return Optional.empty();
        } catch (SQLException ex) {
            throw new StorageException("Failed to query session time bounds", ex);
        }
    }

    @Override
    public long countSessions() throws StorageException {
        return queryLong("SELECT COUNT(*) FROM coding_sessions WHERE is_deleted = 0", List.of());
    }

    @Override
    public long totalSeconds(String projectName) throws StorageException {
        String sql = """
                SELECT COALESCE(SUM(strftime('%s', end_time) - strftime('%s', start_time)), 0)
                FROM coding_sessions
                WHERE is_deleted = 0
                """ + projectClause(projectName);
        return queryLong(sql, projectName == null ? List.of() : List.of(projectName));
    }

    @Override
    public long overlapSeconds(LocalDateTime start, LocalDateTime end, String projectName) throws StorageException {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        String from = Timestamps.format(start);
        String to = Timestamps.format(end);
        // Scalar MIN/MAX compare the fixed-width text timestamps.
        String sql = """
                SELECT COALESCE(SUM(strftime('%s', MIN(end_time, ?)) - strftime('%s', MAX(start_time, ?))), 0)
                FROM coding_sessions
                WHERE is_deleted = 0 AND end_time > ? AND start_time < ?
                """ + projectClause(projectName);
        List<String> parameters = new ArrayList<>(List.of(to, from, from, to));
        if (projectName != null) {
            parameters.add(projectName);
        }
        return queryLong(sql, parameters);
    }

    @Override
    public Optional<LocalDate> firstRecordDate() throws StorageException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT MIN(start_time) FROM coding_sessions WHERE is_deleted = 0");
             ResultSet resultSet = statement.executeQuery()) {
            if (resultSet.next() && resultSet.getString(1) != null) {
                return Optional.of(Timestamps.parse(resultSet.getString(1)).toLocalDate());
            }
            return Optional.empty();
        } catch (SQLException ex) {
            throw new StorageException("Failed to query first record date", ex);
        }
    }

    @Override
    public Set<String> findAllSessionUuids() throws StorageException {
        Set<String> uuids = new HashSet<>();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT session_uuid FROM coding_sessions");
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                uuids.add(resultSet.getString(1));
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to query session UUIDs", ex);
        }
        return uuids;
    }

    @Override
    public Optional<String> findAnyUserId() throws StorageException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT user_id FROM coding_sessions ORDER BY id LIMIT 1");
             ResultSet resultSet = statement.executeQuery()) {
            if (resultSet.next()) {
                return Optional.ofNullable(resultSet.getString(1)).filter(StringUtils::isNotBlank);
            }
            return Optional.empty();
        } catch (SQLException ex) {
            throw new StorageException("Failed to query user id", ex);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down session store");
        writer.shutdown();
        try {
            if (!writer.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> abandoned = writer.shutdownNow();
                log.warn("Session writer did not finish within {}; abandoned {} pending batch(es)",
                        shutdownTimeout, abandoned.size());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            List<Runnable> abandoned = writer.shutdownNow();
            log.warn("Interrupted while draining session writer; abandoned {} pending batch(es)", abandoned.size());
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = connectionFactory.getConnection();
        if (busyTimeoutMillis > 0) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA busy_timeout=" + busyTimeoutMillis);
            } catch (SQLException ex) {
                connection.close();
                throw ex;
            }
        }
        return connection;
    }

    private long queryLong(String sql, List<String> parameters) throws StorageException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < parameters.size(); i++) {
                statement.setString(i + 1, parameters.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getLong(1) : 0L;
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to run aggregate query", ex);
        }
    }

    private static String projectClause(String projectName) {
        return projectName == null ? "" : " AND project_name = ?";
    }

    private static List<CodingSession> readSessions(PreparedStatement statement) throws SQLException {
        List<CodingSession> sessions = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                sessions.add(mapRow(resultSet));
            }
        }
        return sessions;
    }

    private static CodingSession mapRow(ResultSet resultSet) throws SQLException {
        String syncedAt = resultSet.getString("synced_at");
        return new CodingSession(
                resultSet.getString("session_uuid"),
                resultSet.getString("user_id"),
                resultSet.getString("project_name"),
                resultSet.getString("language"),
                resultSet.getString("platform"),
                Objects.toString(resultSet.getString("ide_name"), ""),
                Timestamps.parse(resultSet.getString("start_time")),
                Timestamps.parse(resultSet.getString("end_time")),
                Timestamps.parse(resultSet.getString("last_modified")),
                resultSet.getInt("is_deleted") != 0,
                resultSet.getInt("is_synced") != 0,
                StringUtils.isBlank(syncedAt) ? Optional.empty() : Optional.of(Timestamps.parse(syncedAt)),
                resultSet.getInt("sync_version")
        );
    }

    private static void bindSession(PreparedStatement statement, CodingSession session) throws SQLException {
        statement.setString(1, session.sessionUuid());
        statement.setString(2, session.userId());
        statement.setString(3, session.projectName());
        statement.setString(4, session.language());
        statement.setString(5, session.platform());
        statement.setString(6, session.ideName());
        statement.setString(7, Timestamps.format(session.startTime()));
        statement.setString(8, Timestamps.format(session.endTime()));
        statement.setString(9, Timestamps.format(session.lastModified()));
        statement.setInt(10, session.deleted() ? 1 : 0);
        statement.setInt(11, session.synced() ? 1 : 0);
        if (session.syncedAt().isPresent()) {
            statement.setString(12, Timestamps.format(session.syncedAt().get()));
        } else {
            statement.setNull(12, Types.VARCHAR);
        }
        statement.setInt(13, session.syncVersion());
    }

    private static void rollbackQuietly(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("SQLite rollback failed", rollbackEx);
        }
    }

    private static void configureJournal(Connection connection, String journalMode) throws SQLException {
        if (StringUtils.isNotBlank(journalMode)) {
            String mode = journalMode.trim().toUpperCase(Locale.ROOT);
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA journal_mode=" + mode);
            }
        }
    }

    /**
     * Idempotent schema creation and additive migration.
     */
    static final class SchemaInitializer {

        private SchemaInitializer() {
        }

        static void apply(Connection connection) throws SQLException {
            try (Statement statement = connection.createStatement()) {
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS coding_sessions (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            session_uuid TEXT NOT NULL UNIQUE,
                            user_id TEXT NOT NULL,
                            project_name TEXT NOT NULL,
                            language TEXT NOT NULL,
                            platform TEXT NOT NULL,
                            ide_name TEXT NOT NULL DEFAULT '',
                            start_time TEXT NOT NULL,
                            end_time TEXT NOT NULL,
                            last_modified TEXT NOT NULL,
                            is_deleted INTEGER NOT NULL DEFAULT 0,
                            is_synced INTEGER NOT NULL DEFAULT 0,
                            synced_at TEXT,
                            sync_version INTEGER NOT NULL DEFAULT 0
                        )
                        """);
            }
            migrateColumns(connection);
            try (Statement statement = connection.createStatement()) {
                statement.execute("""
                        CREATE UNIQUE INDEX IF NOT EXISTS idx_session_uuid
                        ON coding_sessions(session_uuid)
                        """);
                statement.execute("""
                        CREATE INDEX IF NOT EXISTS idx_sessions_range
                        ON coding_sessions(is_deleted, start_time, end_time)
                        """);
                statement.execute("""
                        CREATE INDEX IF NOT EXISTS idx_sessions_start
                        ON coding_sessions(is_deleted, start_time)
                        """);
            }
            log.debug("Table 'coding_sessions' is ready");
        }

        private static void migrateColumns(Connection connection) throws SQLException {
            Set<String> existing = new HashSet<>();
            try (Statement statement = connection.createStatement();
                 ResultSet resultSet = statement.executeQuery("PRAGMA table_info(coding_sessions)")) {
                while (resultSet.next()) {
                    existing.add(resultSet.getString("name").toLowerCase(Locale.ROOT));
                }
            }
            for (Map.Entry<String, String> column : MIGRATED_COLUMNS.entrySet()) {
                if (!existing.contains(column.getKey())) {
                    try (Statement statement = connection.createStatement()) {
                        statement.execute("ALTER TABLE coding_sessions ADD COLUMN " + column.getValue());
                    }
                    log.info("Migrated table 'coding_sessions': added column {}", column.getKey());
                }
            }
        }
    }
}
