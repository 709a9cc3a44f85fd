package io.campus.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.campus.core.model.Degradation;
import io.campus.core.model.Turn;
import io.campus.core.model.TurnRole;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class SqliteSessionStore implements SessionHistory {
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteSessionStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public Optional<Session> find(String sessionId) throws IOException {
        String sql = "SELECT id, language, created_at, last_activity FROM sessions WHERE id = ?";
        try (Connection connection = SqliteSupport.open(jdbcUrl);
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Session(
                    resultSet.getString("id"),
                    resultSet.getString("language"),
                    Instant.parse(resultSet.getString("created_at")),
                    Instant.parse(resultSet.getString("last_activity"))
                ));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read session " + sessionId, e);
        }
    }

    @Override
    public List<Turn> loadHistory(String sessionId, int limit) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        String sql = """
            SELECT role, content, pivot_content, language, intent, confidence, sources_json, escalated,
                   degradations, created_at
            FROM turns
            WHERE session_id = ?
            ORDER BY seq DESC
            LIMIT ?
            """;
        try (Connection connection = SqliteSupport.open(jdbcUrl);
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            statement.setInt(2, limit);
            List<Turn> turns = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    turns.add(readTurn(resultSet));
                }
            }
            Collections.reverse(turns);
            return turns;
        } catch (SQLException e) {
            throw new IOException("Failed to load history for session " + sessionId, e);
        }
    }

    @Override
    public void appendTurns(Session session, List<Turn> turns) throws IOException {
        String upsert = """
            INSERT INTO sessions (id, language, created_at, last_activity) VALUES (?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET language = excluded.language, last_activity = excluded.last_activity
            """;
        String insert = """
            INSERT INTO turns (session_id, role, content, pivot_content, language, intent, confidence,
                               sources_json, escalated, degradations, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = SqliteSupport.open(jdbcUrl)) {
            connection.setAutoCommit(false);
            try (PreparedStatement sessionStatement = connection.prepareStatement(upsert);
                 PreparedStatement turnStatement = connection.prepareStatement(insert)) {
                sessionStatement.setString(1, session.id());
                sessionStatement.setString(2, session.language());
                sessionStatement.setString(3, session.createdAt().toString());
                sessionStatement.setString(4, session.lastActivity().toString());
                sessionStatement.executeUpdate();

                for (Turn turn : turns) {
                    bindTurn(turnStatement, session.id(), turn);
                    turnStatement.addBatch();
                }
                turnStatement.executeBatch();
                connection.commit();
            } catch (SQLException | IOException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to append turns for session " + session.id(), e);
        }
    }

    private void bindTurn(PreparedStatement statement, String sessionId, Turn turn) throws SQLException, IOException {
        statement.setString(1, sessionId);
        statement.setString(2, turn.role().wireName());
        statement.setString(3, turn.content());
        statement.setString(4, turn.pivotContent());
        statement.setString(5, turn.language());
        statement.setString(6, turn.intent());
        if (turn.confidence() == null) {
            statement.setNull(7, Types.REAL);
        } else {
            statement.setDouble(7, turn.confidence());
        }
        statement.setString(8, mapper.writeValueAsString(turn.sources()));
        statement.setInt(9, turn.escalated() ? 1 : 0);
        statement.setString(10, encode(turn.degradations()));
        statement.setString(11, turn.createdAt().toString());
    }

    private Turn readTurn(ResultSet resultSet) throws SQLException, IOException {
        double confidence = resultSet.getDouble("confidence");
        Double nullableConfidence = resultSet.wasNull() ? null : confidence;
        return new Turn(
            TurnRole.fromWire(resultSet.getString("role")),
            resultSet.getString("content"),
            resultSet.getString("pivot_content"),
            resultSet.getString("language"),
            resultSet.getString("intent"),
            nullableConfidence,
            mapper.readValue(resultSet.getString("sources_json"), STRINGS),
            resultSet.getInt("escalated") == 1,
            decode(resultSet.getString("degradations")),
            Instant.parse(resultSet.getString("created_at"))
        );
    }

    private String encode(Set<Degradation> degradations) {
        List<String> codes = new ArrayList<>();
        for (Degradation degradation : degradations) {
            codes.add(degradation.code());
        }
        return String.join(",", codes);
    }

    private Set<Degradation> decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        Set<Degradation> out = EnumSet.noneOf(Degradation.class);
        for (String code : raw.split(",")) {
            out.add(Degradation.fromCode(code.trim()));
        }
        return out;
    }

    private void init() throws IOException {
        String sessions = """
            CREATE TABLE IF NOT EXISTS sessions (
                id TEXT PRIMARY KEY,
                language TEXT NOT NULL,
                created_at TEXT NOT NULL,
                last_activity TEXT NOT NULL
            )
            """;
        String turns = """
            CREATE TABLE IF NOT EXISTS turns (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                session_id TEXT NOT NULL REFERENCES sessions(id),
                role TEXT NOT NULL,
                content TEXT NOT NULL,
                pivot_content TEXT NOT NULL,
                language TEXT,
                intent TEXT,
                confidence REAL,
                sources_json TEXT NOT NULL,
                escalated INTEGER NOT NULL,
                degradations TEXT NOT NULL,
                created_at TEXT NOT NULL
            )
            """;
        String idx = "CREATE INDEX IF NOT EXISTS idx_turns_session ON turns(session_id, seq)";
        try (Connection connection = SqliteSupport.open(jdbcUrl);
             Statement statement = connection.createStatement()) {
            statement.execute(sessions);
            statement.execute(turns);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite session store", e);
        }
    }
}
