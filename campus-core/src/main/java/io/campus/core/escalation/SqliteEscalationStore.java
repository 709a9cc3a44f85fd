package io.campus.core.escalation;

import io.campus.core.session.SqliteSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class SqliteEscalationStore implements EscalationSink {
    private final String jdbcUrl;
    private final Clock clock;

    public SqliteEscalationStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        init();
    }

    @Override
    public EscalationRecord create(String sessionId, EscalationReason reason) throws IOException {
        EscalationRecord record = new EscalationRecord(
            UUID.randomUUID().toString(), sessionId, reason, EscalationStatus.PENDING, null, clock.instant()
        );
        String sql = """
            INSERT INTO escalations (id, session_id, reason, status, assignee, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = SqliteSupport.open(jdbcUrl);
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, record.id());
            statement.setString(2, record.sessionId());
            statement.setString(3, record.reason().code());
            statement.setString(4, record.status().code());
            statement.setString(5, record.assignee());
            statement.setString(6, record.createdAt().toString());
            statement.executeUpdate();
            return record;
        } catch (SQLException e) {
            throw new IOException("Failed to create escalation for session " + sessionId, e);
        }
    }

    @Override
    public List<EscalationRecord> pending() throws IOException {
        String sql = """
            SELECT id, session_id, reason, status, assignee, created_at
            FROM escalations
            WHERE status = 'pending'
            ORDER BY created_at ASC, rowid ASC
            """;
        try (Connection connection = SqliteSupport.open(jdbcUrl);
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<EscalationRecord> out = new ArrayList<>();
            while (resultSet.next()) {
                out.add(read(resultSet));
            }
            return out;
        } catch (SQLException e) {
            throw new IOException("Failed to list pending escalations", e);
        }
    }

    @Override
    public Optional<EscalationRecord> resolve(String id, String assignee) throws IOException {
        String update = "UPDATE escalations SET status = 'resolved', assignee = ? WHERE id = ?";
        String select = "SELECT id, session_id, reason, status, assignee, created_at FROM escalations WHERE id = ?";
        try (Connection connection = SqliteSupport.open(jdbcUrl);
             PreparedStatement updateStatement = connection.prepareStatement(update);
             PreparedStatement selectStatement = connection.prepareStatement(select)) {
            updateStatement.setString(1, assignee);
            updateStatement.setString(2, id);
            if (updateStatement.executeUpdate() == 0) {
                return Optional.empty();
            }
            selectStatement.setString(1, id);
            try (ResultSet resultSet = selectStatement.executeQuery()) {
                return resultSet.next() ? Optional.of(read(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to resolve escalation " + id, e);
        }
    }

    private EscalationRecord read(ResultSet resultSet) throws SQLException {
        return new EscalationRecord(
            resultSet.getString("id"),
            resultSet.getString("session_id"),
            EscalationReason.fromCode(resultSet.getString("reason")),
            EscalationStatus.fromCode(resultSet.getString("status")),
            resultSet.getString("assignee"),
            Instant.parse(resultSet.getString("created_at"))
        );
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS escalations (
                id TEXT PRIMARY KEY,
                session_id TEXT NOT NULL,
                reason TEXT NOT NULL,
                status TEXT NOT NULL,
                assignee TEXT,
                created_at TEXT NOT NULL
            )
            """;
        String idx = "CREATE INDEX IF NOT EXISTS idx_escalations_status ON escalations(status, created_at)";
        try (Connection connection = SqliteSupport.open(jdbcUrl);
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite escalation store", e);
        }
    }
}
