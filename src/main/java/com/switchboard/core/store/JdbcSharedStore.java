package com.switchboard.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-based {@link SharedStore} that persists entries to a relational table.
 * <p>
 * Each entry is one row keyed by {@code (category, entry_key)}; the document value and tags are
 * stored as JSON text. Writes select the existing row and then update or insert it inside one
 * transaction. The table {@code switchboard_store} is created automatically via
 * {@link #createTables()}.
 */
public class JdbcSharedStore implements SharedStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSharedStore.class);

    private static final String TABLE_NAME = "switchboard_store";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                category     VARCHAR(32)  NOT NULL,
                entry_key    VARCHAR(512) NOT NULL,
                id           VARCHAR(64)  NOT NULL,
                entry_value  TEXT         NOT NULL,
                created_by   VARCHAR(255),
                created_at   TIMESTAMP    NOT NULL,
                updated_at   TIMESTAMP    NOT NULL,
                priority     VARCHAR(16)  NOT NULL,
                tags         TEXT         NOT NULL,
                version      BIGINT       NOT NULL,
                PRIMARY KEY (category, entry_key)
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_COLUMNS =
            "category, entry_key, id, entry_value, created_by, created_at, updated_at, priority, tags, version";

    private static final String SELECT_ONE_SQL = """
            SELECT %s FROM %s WHERE category = ? AND entry_key = ?
            """.formatted(SELECT_COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_CATEGORY_SQL = """
            SELECT %s FROM %s WHERE category = ? ORDER BY created_at ASC
            """.formatted(SELECT_COLUMNS, TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT %s FROM %s ORDER BY created_at ASC
            """.formatted(SELECT_COLUMNS, TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (category, entry_key, id, entry_value, created_by, created_at, updated_at, priority, tags, version)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET entry_value = ?, updated_at = ?, priority = ?, tags = ?, version = ?
            WHERE category = ? AND entry_key = ?
            """.formatted(TABLE_NAME);

    private static final TypeReference<Map<String, Object>> VALUE_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int defaultLimit;

    public JdbcSharedStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock, int defaultLimit) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultLimit = defaultLimit;
    }

    /**
     * Creates the store table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Store table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public StoreEntry write(StoreCategory category, String key, Map<String, Object> value,
                            String writer, WriteOptions options) {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(key, "key must not be null");
        WriteOptions opts = options != null ? options : WriteOptions.defaults();
        Instant now = clock.instant();

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                Optional<StoreEntry> existing = selectOne(conn, category, key);
                StoreEntry stored;
                if (existing.isPresent()) {
                    StoreEntry prev = existing.get();
                    stored = new StoreEntry(prev.id(), category, key, value, prev.createdBy(),
                            prev.createdAt(), now,
                            opts.priority() != null ? opts.priority() : prev.priority(),
                            opts.tags() != null ? opts.tags() : prev.tags(),
                            prev.version() + 1);
                    update(conn, stored);
                } else {
                    stored = new StoreEntry("entry_" + UUID.randomUUID(), category, key, value, writer,
                            now, now, opts.priority(), opts.tags(), 1);
                    insert(conn, stored);
                }
                conn.commit();
                log.debug("Wrote {}:{} by {} (v{})", category, key, writer, stored.version());
                return stored;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to write " + category + ":" + key, e);
        }
    }

    @Override
    public Optional<StoreEntry> read(StoreCategory category, String key, String reader) {
        try (Connection conn = dataSource.getConnection()) {
            return selectOne(conn, category, key);
        } catch (SQLException e) {
            throw new StoreException("Failed to read " + category + ":" + key, e);
        }
    }

    @Override
    public List<StoreEntry> query(String reader, StoreQuery filter) {
        StoreQuery query = filter != null ? filter : StoreQuery.builder().build();
        List<StoreEntry> matched = new ArrayList<>();

        String sql = query.category() != null ? SELECT_BY_CATEGORY_SQL : SELECT_ALL_SQL;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (query.category() != null) {
                stmt.setString(1, query.category().name());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    StoreEntry entry = fromResultSet(rs);
                    if (query.matches(entry)) {
                        matched.add(entry);
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query store for " + reader, e);
        }
        return StoreQueries.sortAndLimit(matched, query, defaultLimit);
    }

    @Override
    public String backend() {
        return "jdbc";
    }

    // -- Internal helpers ---------------------------------------------------

    private Optional<StoreEntry> selectOne(Connection conn, StoreCategory category, String key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_ONE_SQL)) {
            stmt.setString(1, category.name());
            stmt.setString(2, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        }
    }

    private void insert(Connection conn, StoreEntry entry) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, entry.category().name());
            stmt.setString(2, entry.key());
            stmt.setString(3, entry.id());
            stmt.setString(4, toJson(entry.value()));
            stmt.setString(5, entry.createdBy());
            stmt.setTimestamp(6, Timestamp.from(entry.createdAt()));
            stmt.setTimestamp(7, Timestamp.from(entry.updatedAt()));
            stmt.setString(8, entry.priority().name());
            stmt.setString(9, toJson(entry.tags()));
            stmt.setLong(10, entry.version());
            stmt.executeUpdate();
        }
    }

    private void update(Connection conn, StoreEntry entry) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, toJson(entry.value()));
            stmt.setTimestamp(2, Timestamp.from(entry.updatedAt()));
            stmt.setString(3, entry.priority().name());
            stmt.setString(4, toJson(entry.tags()));
            stmt.setLong(5, entry.version());
            stmt.setString(6, entry.category().name());
            stmt.setString(7, entry.key());
            stmt.executeUpdate();
        }
    }

    private StoreEntry fromResultSet(ResultSet rs) throws SQLException {
        try {
            return new StoreEntry(
                    rs.getString("id"),
                    StoreCategory.valueOf(rs.getString("category")),
                    rs.getString("entry_key"),
                    objectMapper.readValue(rs.getString("entry_value"), VALUE_TYPE),
                    rs.getString("created_by"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant(),
                    StorePriority.valueOf(rs.getString("priority")),
                    objectMapper.readValue(rs.getString("tags"), TAGS_TYPE),
                    rs.getLong("version"));
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt store row " + rs.getString("entry_key"), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize store value", e);
        }
    }
}
