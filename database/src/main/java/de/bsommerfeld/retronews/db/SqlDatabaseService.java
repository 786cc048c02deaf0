package de.bsommerfeld.retronews.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.retronews.core.config.DatabaseConfig;
import de.bsommerfeld.retronews.core.domain.Message;
import de.bsommerfeld.retronews.core.domain.MessageFlags;
import de.bsommerfeld.retronews.core.util.StorageUtils;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite-backed {@link DatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level, and the reader issues at
 * most a handful of statements per key press.
 *
 * <h3>Id lists</h3>
 * Lookups for a set of ids bind the whole set as one JSON array parameter and
 * expand it with {@code JSON_EACH}, so every statement stays a static file
 * regardless of the number of ids.
 *
 * <h3>Failure policy</h3>
 * Schema failures abort construction. Failures of individual reads and writes
 * are logged and degrade to "nothing stored": the reader stays usable, it only
 * forgets read and starred state.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final String dbUrl;

    @Inject
    public SqlDatabaseService(DatabaseConfig config) {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve(config.getFileName()));
    }

    public SqlDatabaseService(Path dbFile) {
        Path parent = dbFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            LOG.error("Failed to create database directory {}", parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + dbFile.toAbsolutePath();
        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new IllegalStateException("Database initialization failed", e);
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, statement by statement, in one
     * transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (in == null)
                throw new SQLException("schema.sql not found on classpath");
            schemaSql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                String statement = stripComments(sql);
                if (!statement.isEmpty())
                    stmt.execute(statement);
            }
            conn.commit();
            LOG.debug("Database schema applied");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    private static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        for (String line : sql.split("\\r?\\n")) {
            if (!line.trim().startsWith("--"))
                sb.append(line).append('\n');
        }
        return sb.toString().trim();
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public void saveMessage(Message message) {
        String flagsJson;
        try {
            flagsJson = JSON.writeValueAsString(message.getFlags());
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize flags of {}", message.getMsgId(), e);
            return;
        }

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-message"))) {
            ps.setString(1, message.getMsgId());
            ps.setString(2, message.getThreadId());
            ps.setLong(3, message.getDate().getEpochSecond());
            ps.setString(4, flagsJson);
            ps.executeUpdate();
            LOG.debug("Saved flags of {}: {}", message.getMsgId(), flagsJson);
        } catch (SQLException e) {
            LOG.error("Failed to save message {}", message.getMsgId(), e);
        }
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Override
    public Map<String, MessageFlags> loadFlags(Collection<String> msgIds) {
        Map<String, MessageFlags> result = new HashMap<>();
        if (msgIds.isEmpty())
            return result;

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-flags"))) {
            ps.setString(1, toJsonArray(msgIds));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String msgId = rs.getString("msg_id");
                    try {
                        result.put(msgId, JSON.readValue(rs.getString("flags"), MessageFlags.class));
                    } catch (JsonProcessingException e) {
                        LOG.warn("Ignoring unreadable flags of {}: {}", msgId, e.getOriginalMessage());
                    }
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            LOG.error("Failed to load flags for {} messages", msgIds.size(), e);
        }
        return result;
    }

    @Override
    public Map<String, Integer> countReadComments(Collection<String> threadIds) {
        Map<String, Integer> result = new HashMap<>();
        if (threadIds.isEmpty())
            return result;

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-read-comments"))) {
            ps.setString(1, toJsonArray(threadIds));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.put(rs.getString("thread_id"), rs.getInt("count"));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            LOG.error("Failed to count read comments for {} threads", threadIds.size(), e);
        }
        return result;
    }

    @Override
    public List<String> getStarredThreadIds(int page) {
        if (page < 1)
            throw new IllegalArgumentException("page must be >= 1: " + page);

        List<String> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-starred-thread-ids"))) {
            ps.setInt(1, STARRED_PAGE_SIZE);
            ps.setInt(2, (page - 1) * STARRED_PAGE_SIZE);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString("thread_id"));
                }
            }
        } catch (SQLException e) {
            LOG.error("Failed to load starred threads (page {})", page, e);
        }
        return result;
    }

    private static String toJsonArray(Collection<String> ids) throws JsonProcessingException {
        return JSON.writeValueAsString(ids);
    }
}
