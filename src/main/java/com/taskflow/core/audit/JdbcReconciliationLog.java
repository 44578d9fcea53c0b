package com.taskflow.core.audit;

import com.taskflow.core.model.ExternalSyncRecord;
import com.taskflow.core.model.SyncOperation;
import com.taskflow.core.model.SyncResult;
import com.taskflow.core.model.SyncTarget;
import com.taskflow.core.persistence.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-backed {@link ReconciliationLog} writing to {@code taskflow_sync_records}.
 * A sequence column keeps insertion order stable when timestamps collide.
 */
public class JdbcReconciliationLog implements ReconciliationLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcReconciliationLog.class);

    private static final String TABLE_NAME = "taskflow_sync_records";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                id            VARCHAR(64)   NOT NULL,
                task_id       VARCHAR(64)   NOT NULL,
                target_system VARCHAR(32)   NOT NULL,
                operation     VARCHAR(32)   NOT NULL,
                payload_hash  VARCHAR(64)   NOT NULL,
                result        VARCHAR(16)   NOT NULL,
                detail        TEXT,
                recorded_at   TIMESTAMP     NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, task_id, target_system, operation, payload_hash, result, detail, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_TASK_SQL = """
            SELECT id, task_id, target_system, operation, payload_hash, result, detail, recorded_at
            FROM %s
            WHERE task_id = ?
            ORDER BY seq ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT id, task_id, target_system, operation, payload_hash, result, detail, recorded_at
            FROM %s
            ORDER BY seq ASC
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcReconciliationLog(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Sync record table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void append(ExternalSyncRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, record.id());
            stmt.setString(2, record.taskId());
            stmt.setString(3, record.targetSystem().name());
            stmt.setString(4, record.operation().name());
            stmt.setString(5, record.requestPayloadHash());
            stmt.setString(6, record.result().name());
            stmt.setString(7, record.detail());
            stmt.setTimestamp(8, Timestamp.from(record.timestamp()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to append sync record for task " + record.taskId(), e);
        }
    }

    @Override
    public List<ExternalSyncRecord> recordsFor(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_TASK_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                return readAll(rs);
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to read sync records for task " + taskId, e);
        }
    }

    @Override
    public List<ExternalSyncRecord> all() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return readAll(rs);
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to read sync records", e);
        }
    }

    private List<ExternalSyncRecord> readAll(ResultSet rs) throws SQLException {
        List<ExternalSyncRecord> records = new ArrayList<>();
        while (rs.next()) {
            records.add(new ExternalSyncRecord(
                    rs.getString("id"),
                    rs.getString("task_id"),
                    SyncTarget.valueOf(rs.getString("target_system")),
                    SyncOperation.valueOf(rs.getString("operation")),
                    rs.getString("payload_hash"),
                    SyncResult.valueOf(rs.getString("result")),
                    rs.getString("detail"),
                    rs.getTimestamp("recorded_at").toInstant()));
        }
        return records;
    }
}
