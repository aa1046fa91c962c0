package com.groupdispatch.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupdispatch.core.model.ChatInfo;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.model.NewMessages;
import com.groupdispatch.core.model.SandboxSettings;
import com.groupdispatch.core.model.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link DispatchStore}.
 * <p>
 * The SQL sticks to the dialect shared by SQLite and PostgreSQL ({@code ON CONFLICT}
 * upserts, {@code TEXT}/{@code INTEGER} columns) so either database can back it.
 * Tables are created via {@link #createTables()}.
 */
public class JdbcDispatchStore implements DispatchStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDispatchStore.class);

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS conversations (
                id               TEXT PRIMARY KEY,
                name             TEXT NOT NULL,
                folder           TEXT NOT NULL UNIQUE,
                trigger_text     TEXT NOT NULL,
                requires_trigger INTEGER NOT NULL DEFAULT 1,
                added_at         TEXT NOT NULL,
                sandbox_settings TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS chats (
                id                TEXT PRIMARY KEY,
                name              TEXT,
                last_message_time TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS messages (
                id              TEXT NOT NULL,
                conversation_id TEXT NOT NULL,
                sender          TEXT,
                sender_name     TEXT,
                content         TEXT,
                timestamp       TEXT NOT NULL,
                from_assistant  INTEGER NOT NULL DEFAULT 0,
                PRIMARY KEY (id, conversation_id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_messages_timestamp ON messages (timestamp)",
            """
            CREATE TABLE IF NOT EXISTS router_state (
                state_key   TEXT PRIMARY KEY,
                state_value TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS sessions (
                folder     TEXT PRIMARY KEY,
                session_id TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS scheduled_tasks (
                id             TEXT PRIMARY KEY,
                folder         TEXT NOT NULL,
                chat_id        TEXT NOT NULL,
                prompt         TEXT NOT NULL,
                schedule_type  TEXT NOT NULL,
                schedule_value TEXT NOT NULL,
                context_mode   TEXT NOT NULL,
                next_run       TEXT,
                last_run       TEXT,
                last_result    TEXT,
                status         TEXT NOT NULL,
                created_at     TEXT NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_tasks_next_run ON scheduled_tasks (next_run)"
    );

    private static final String UPSERT_CONVERSATION_SQL = """
            INSERT INTO conversations (id, name, folder, trigger_text, requires_trigger, added_at, sandbox_settings)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET name = excluded.name,
                          folder = excluded.folder,
                          trigger_text = excluded.trigger_text,
                          requires_trigger = excluded.requires_trigger,
                          sandbox_settings = excluded.sandbox_settings
            """;

    private static final String SELECT_CONVERSATIONS_SQL = """
            SELECT id, name, folder, trigger_text, requires_trigger, added_at, sandbox_settings
            FROM conversations
            """;

    private static final String UPSERT_CHAT_SQL = """
            INSERT INTO chats (id, name, last_message_time)
            VALUES (?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET name = COALESCE(excluded.name, chats.name),
                          last_message_time = CASE
                              WHEN chats.last_message_time IS NULL
                                   OR excluded.last_message_time > chats.last_message_time
                              THEN excluded.last_message_time
                              ELSE chats.last_message_time
                          END
            """;

    private static final String INSERT_MESSAGE_SQL = """
            INSERT INTO messages (id, conversation_id, sender, sender_name, content, timestamp, from_assistant)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id, conversation_id) DO NOTHING
            """;

    private static final String SELECT_MESSAGES_SINCE_SQL = """
            SELECT id, conversation_id, sender, sender_name, content, timestamp, from_assistant
            FROM messages
            WHERE conversation_id = ? AND timestamp > ?
              AND from_assistant = 0 AND content NOT LIKE ?
            ORDER BY timestamp
            """;

    private static final String UPSERT_ROUTER_STATE_SQL = """
            INSERT INTO router_state (state_key, state_value)
            VALUES (?, ?)
            ON CONFLICT (state_key) DO UPDATE SET state_value = excluded.state_value
            """;

    private static final String UPSERT_SESSION_SQL = """
            INSERT INTO sessions (folder, session_id)
            VALUES (?, ?)
            ON CONFLICT (folder) DO UPDATE SET session_id = excluded.session_id
            """;

    private static final String UPSERT_TASK_SQL = """
            INSERT INTO scheduled_tasks (id, folder, chat_id, prompt, schedule_type, schedule_value,
                                         context_mode, next_run, last_run, last_result, status, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET prompt = excluded.prompt,
                          schedule_type = excluded.schedule_type,
                          schedule_value = excluded.schedule_value,
                          context_mode = excluded.context_mode,
                          next_run = excluded.next_run,
                          last_run = excluded.last_run,
                          last_result = excluded.last_result,
                          status = excluded.status
            """;

    private static final String SELECT_TASKS_SQL = """
            SELECT id, folder, chat_id, prompt, schedule_type, schedule_value, context_mode,
                   next_run, last_run, last_result, status, created_at
            FROM scheduled_tasks
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcDispatchStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : CREATE_TABLES_SQL) {
                stmt.execute(sql);
            }
            log.info("Dispatch tables ensured");
        } catch (SQLException e) {
            throw new StoreException("Failed to create dispatch tables", e);
        }
    }

    // ── Conversations ───────────────────────────────────────────────────

    @Override
    public Map<String, Conversation> getAllConversations() {
        Map<String, Conversation> result = new LinkedHashMap<>();
        for (Conversation c : query(SELECT_CONVERSATIONS_SQL + " ORDER BY added_at", stmt -> {}, this::toConversation)) {
            result.put(c.id(), c);
        }
        return result;
    }

    @Override
    public Optional<Conversation> getConversation(String id) {
        return query(SELECT_CONVERSATIONS_SQL + " WHERE id = ?", stmt -> stmt.setString(1, id), this::toConversation)
                .stream().findFirst();
    }

    @Override
    public void saveConversation(Conversation c) {
        update("save conversation " + c.id(), UPSERT_CONVERSATION_SQL, stmt -> {
            stmt.setString(1, c.id());
            stmt.setString(2, c.name());
            stmt.setString(3, c.folder());
            stmt.setString(4, c.trigger());
            stmt.setInt(5, c.requiresTrigger() ? 1 : 0);
            stmt.setString(6, c.addedAt());
            stmt.setString(7, writeJson(c.sandboxSettings()));
        });
    }

    @Override
    public void deleteConversation(String id) {
        update("delete conversation " + id, "DELETE FROM conversations WHERE id = ?",
                stmt -> stmt.setString(1, id));
    }

    // ── Chats ───────────────────────────────────────────────────────────

    @Override
    public void storeChatMetadata(String id, String name, String timestamp) {
        update("store chat " + id, UPSERT_CHAT_SQL, stmt -> {
            stmt.setString(1, id);
            stmt.setString(2, name);
            stmt.setString(3, timestamp);
        });
    }

    @Override
    public List<ChatInfo> getAllChats() {
        return query("SELECT id, name, last_message_time FROM chats ORDER BY last_message_time DESC",
                stmt -> {},
                rs -> new ChatInfo(rs.getString("id"), rs.getString("name"), rs.getString("last_message_time")));
    }

    // ── Messages ────────────────────────────────────────────────────────

    @Override
    public void storeMessage(InboundMessage m) {
        update("store message " + m.id(), INSERT_MESSAGE_SQL, stmt -> {
            stmt.setString(1, m.id());
            stmt.setString(2, m.conversationId());
            stmt.setString(3, m.sender());
            stmt.setString(4, m.senderName());
            stmt.setString(5, m.content());
            stmt.setString(6, m.timestamp());
            stmt.setInt(7, m.fromAssistant() ? 1 : 0);
        });
    }

    @Override
    public NewMessages getNewMessages(Collection<String> conversationIds, String sinceTimestamp, String botPrefix) {
        if (conversationIds.isEmpty()) {
            return new NewMessages(List.of(), sinceTimestamp);
        }
        String placeholders = String.join(",", Collections.nCopies(conversationIds.size(), "?"));
        String sql = """
                SELECT id, conversation_id, sender, sender_name, content, timestamp, from_assistant
                FROM messages
                WHERE timestamp > ? AND conversation_id IN (%s)
                  AND from_assistant = 0 AND content NOT LIKE ?
                ORDER BY timestamp
                """.formatted(placeholders);

        List<InboundMessage> messages = query(sql, stmt -> {
            int i = 1;
            stmt.setString(i++, nullToEmpty(sinceTimestamp));
            for (String id : conversationIds) {
                stmt.setString(i++, id);
            }
            stmt.setString(i, botPrefix + ":%");
        }, this::toMessage);

        String newest = messages.isEmpty() ? sinceTimestamp : messages.get(messages.size() - 1).timestamp();
        return new NewMessages(messages, newest);
    }

    @Override
    public List<InboundMessage> getMessagesSince(String conversationId, String sinceTimestamp, String botPrefix) {
        return query(SELECT_MESSAGES_SINCE_SQL, stmt -> {
            stmt.setString(1, conversationId);
            stmt.setString(2, nullToEmpty(sinceTimestamp));
            stmt.setString(3, botPrefix + ":%");
        }, this::toMessage);
    }

    // ── Router state ────────────────────────────────────────────────────

    @Override
    public Optional<String> getRouterState(String key) {
        return query("SELECT state_value FROM router_state WHERE state_key = ?",
                stmt -> stmt.setString(1, key),
                rs -> rs.getString("state_value"))
                .stream().findFirst();
    }

    @Override
    public void setRouterState(String key, String value) {
        update("set router state " + key, UPSERT_ROUTER_STATE_SQL, stmt -> {
            stmt.setString(1, key);
            stmt.setString(2, value);
        });
    }

    // ── Sessions ────────────────────────────────────────────────────────

    @Override
    public Map<String, String> getAllSessions() {
        Map<String, String> sessions = new LinkedHashMap<>();
        query("SELECT folder, session_id FROM sessions", stmt -> {},
                rs -> Map.entry(rs.getString("folder"), rs.getString("session_id")))
                .forEach(e -> sessions.put(e.getKey(), e.getValue()));
        return sessions;
    }

    @Override
    public void setSession(String folder, String token) {
        update("set session " + folder, UPSERT_SESSION_SQL, stmt -> {
            stmt.setString(1, folder);
            stmt.setString(2, token);
        });
    }

    // ── Scheduled tasks ─────────────────────────────────────────────────

    @Override
    public void saveTask(ScheduledTask t) {
        update("save task " + t.id(), UPSERT_TASK_SQL, stmt -> {
            stmt.setString(1, t.id());
            stmt.setString(2, t.folder());
            stmt.setString(3, t.chatId());
            stmt.setString(4, t.prompt());
            stmt.setString(5, t.scheduleType().name());
            stmt.setString(6, t.scheduleValue());
            stmt.setString(7, t.contextMode().name());
            stmt.setString(8, t.nextRun());
            stmt.setString(9, t.lastRun());
            stmt.setString(10, t.lastResult());
            stmt.setString(11, t.status().name());
            stmt.setString(12, t.createdAt());
        });
    }

    @Override
    public Optional<ScheduledTask> getTask(String id) {
        return query(SELECT_TASKS_SQL + " WHERE id = ?", stmt -> stmt.setString(1, id), this::toTask)
                .stream().findFirst();
    }

    @Override
    public List<ScheduledTask> getAllTasks() {
        return query(SELECT_TASKS_SQL + " ORDER BY created_at DESC", stmt -> {}, this::toTask);
    }

    @Override
    public List<ScheduledTask> getDueTasks(String now) {
        return query(SELECT_TASKS_SQL + " WHERE status = 'ACTIVE' AND next_run IS NOT NULL AND next_run <= ? ORDER BY next_run",
                stmt -> stmt.setString(1, now), this::toTask);
    }

    @Override
    public void deleteTask(String id) {
        update("delete task " + id, "DELETE FROM scheduled_tasks WHERE id = ?", stmt -> stmt.setString(1, id));
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private void update(String description, String sql, Binder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to {}", description, e);
            throw new StoreException("Failed to " + description, e);
        }
    }

    private <T> List<T> query(String sql, Binder binder, RowMapper<T> mapper) {
        List<T> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Query failed: {}", sql.strip().lines().findFirst().orElse(sql), e);
            throw new StoreException("Query failed", e);
        }
        return rows;
    }

    private Conversation toConversation(ResultSet rs) throws SQLException {
        return new Conversation(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("folder"),
                rs.getString("trigger_text"),
                rs.getInt("requires_trigger") != 0,
                rs.getString("added_at"),
                readSettings(rs.getString("sandbox_settings")));
    }

    private InboundMessage toMessage(ResultSet rs) throws SQLException {
        return new InboundMessage(
                rs.getString("id"),
                rs.getString("conversation_id"),
                rs.getString("sender"),
                rs.getString("sender_name"),
                rs.getString("content"),
                rs.getString("timestamp"),
                rs.getInt("from_assistant") != 0);
    }

    private ScheduledTask toTask(ResultSet rs) throws SQLException {
        return new ScheduledTask(
                rs.getString("id"),
                rs.getString("folder"),
                rs.getString("chat_id"),
                rs.getString("prompt"),
                ScheduledTask.ScheduleType.valueOf(rs.getString("schedule_type")),
                rs.getString("schedule_value"),
                ScheduledTask.ContextMode.valueOf(rs.getString("context_mode")),
                rs.getString("next_run"),
                rs.getString("last_run"),
                rs.getString("last_result"),
                ScheduledTask.Status.valueOf(rs.getString("status")),
                rs.getString("created_at"));
    }

    private String writeJson(SandboxSettings settings) {
        if (settings == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sandbox settings", e);
        }
    }

    private SandboxSettings readSettings(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, SandboxSettings.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable sandbox settings: {}", e.getMessage());
            return null;
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
