package com.taskflow.core.persistence;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link TaskStore}.
 * <p>
 * Each task is one row holding the whole aggregate as a JSON document plus the
 * version column used for the compare-and-set update. The table
 * {@code taskflow_tasks} is created by {@link #createTables()}.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private static final String TABLE_NAME = "taskflow_tasks";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          VARCHAR(64)  NOT NULL PRIMARY KEY,
                version     BIGINT       NOT NULL,
                status      VARCHAR(40)  NOT NULL,
                parent_id   VARCHAR(64),
                document    TEXT         NOT NULL,
                created_at  TIMESTAMP    NOT NULL,
                updated_at  TIMESTAMP    NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, version, status, parent_id, document, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET version = ?, status = ?, document = ?, updated_at = ?
            WHERE id = ? AND version = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT document FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_VERSION_SQL = """
            SELECT version FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT document FROM %s ORDER BY created_at ASC, id ASC
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final TaskDocumentCodec codec;
    private final Clock clock;

    public JdbcTaskStore(DataSource dataSource, TaskDocumentCodec codec, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Creates the task table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Task table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Task create(TaskSpec spec) {
        var now = clock.instant();
        var task = Task.draft(TaskStore.newTaskId(), spec, now).withVersion(1L, now);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, task.id());
            stmt.setLong(2, task.version());
            stmt.setString(3, task.status().name());
            stmt.setString(4, task.parentTaskId());
            stmt.setString(5, codec.encode(task));
            stmt.setTimestamp(6, Timestamp.from(task.createdAt()));
            stmt.setTimestamp(7, Timestamp.from(task.updatedAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to create task " + task.id(), e);
        }

        log.info("Created task {} ({})", task.id(), task.title());
        return task;
    }

    @Override
    public Task load(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return codec.decode(rs.getString("document"));
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to load task " + taskId, e);
        }
        throw new TaskNotFoundException(taskId);
    }

    @Override
    public List<Task> list() {
        List<Task> tasks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tasks.add(codec.decode(rs.getString("document")));
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list tasks", e);
        }
        return tasks;
    }

    @Override
    public Task save(Task task) {
        var saved = task.withVersion(task.version() + 1, clock.instant());

        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setLong(1, saved.version());
            stmt.setString(2, saved.status().name());
            stmt.setString(3, codec.encode(saved));
            stmt.setTimestamp(4, Timestamp.from(saved.updatedAt()));
            stmt.setString(5, task.id());
            stmt.setLong(6, task.version());
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to save task " + task.id(), e);
        }

        if (updated == 0) {
            long stored = storedVersion(task.id())
                    .orElseThrow(() -> new TaskNotFoundException(task.id()));
            throw new ConcurrentTaskModificationException(task.id(), task.version(), stored);
        }
        log.debug("Saved task {} at version {}", saved.id(), saved.version());
        return saved;
    }

    private Optional<Long> storedVersion(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_VERSION_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong("version")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to read version of task " + taskId, e);
        }
    }
}
