package io.reminor.core.annotation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteAnnotationStore implements AnnotationStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteAnnotationStore.class);

    private final String jdbcUrl;
    private final Clock clock;
    private final AnnotationCodec codec = new AnnotationCodec();
    private final Map<LocalDate, Object> locks = new ConcurrentHashMap<>();

    public SqliteAnnotationStore(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteAnnotationStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        init();
    }

    @Override
    public AnnotationRecord save(LocalDate date, Map<String, Double> emotions, Map<String, Object> insights) throws IOException {
        Objects.requireNonNull(date, "date must not be null");
        String sql = """
            INSERT INTO annotations (date, format, revision, updated_at, emotions_json, insights_json)
            VALUES (?, ?, 1, ?, ?, ?)
            ON CONFLICT(date) DO UPDATE SET
                format = excluded.format,
                revision = annotations.revision + 1,
                updated_at = excluded.updated_at,
                emotions_json = excluded.emotions_json,
                insights_json = excluded.insights_json
            """;
        synchronized (lockFor(date)) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, date.toString());
                statement.setInt(2, AnnotationCodec.FORMAT);
                statement.setString(3, clock.instant().toString());
                statement.setString(4, codec.encodeEmotions(emotions));
                statement.setString(5, codec.encodeInsights(insights));
                statement.executeUpdate();
            } catch (SQLException e) {
                throw new IOException("Failed to save annotation for " + date, e);
            }
            return load(date).orElseThrow(() -> new IOException("Annotation for " + date + " unreadable after save"));
        }
    }

    @Override
    public Optional<AnnotationRecord> load(LocalDate date) {
        if (date == null) {
            return Optional.empty();
        }
        String sql = """
            SELECT revision, updated_at, emotions_json, insights_json
            FROM annotations
            WHERE date = ?
            """;
        synchronized (lockFor(date)) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, date.toString());
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    return codec.toRecord(
                        date,
                        resultSet.getLong("revision"),
                        updatedAt(resultSet.getString("updated_at")),
                        resultSet.getString("emotions_json"),
                        resultSet.getString("insights_json")
                    );
                }
            } catch (SQLException e) {
                LOG.warn("Failed to load annotation for {}: {}", date, e.getMessage());
                return Optional.empty();
            }
        }
    }

    @Override
    public List<LocalDate> dates() {
        String sql = "SELECT date FROM annotations ORDER BY date ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<LocalDate> dates = new ArrayList<>();
            while (resultSet.next()) {
                dates.add(LocalDate.parse(resultSet.getString("date")));
            }
            return dates;
        } catch (SQLException | DateTimeParseException e) {
            LOG.warn("Failed to list annotations: {}", e.getMessage());
            return List.of();
        }
    }

    /** Overwrites the raw emotions column; used to reproduce records written by older clients. */
    void writeRawEmotions(LocalDate date, String raw) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("UPDATE annotations SET emotions_json = ? WHERE date = ?")) {
            statement.setString(1, raw);
            statement.setString(2, date.toString());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to overwrite annotation for " + date, e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS annotations (
                date TEXT PRIMARY KEY,
                format INTEGER NOT NULL,
                revision INTEGER NOT NULL,
                updated_at TEXT NOT NULL,
                emotions_json TEXT NOT NULL,
                insights_json TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite annotation store", e);
        }
    }

    private static Instant updatedAt(String raw) {
        try {
            return raw == null ? null : Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Object lockFor(LocalDate date) {
        return locks.computeIfAbsent(date, ignored -> new Object());
    }
}
