package skytiles.acquisition.store;

import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.model.TaskRecord;
import skytiles.acquisition.model.TaskStatus;
import skytiles.acquisition.repository.ConflictException;
import skytiles.acquisition.repository.StateStoreException;
import skytiles.acquisition.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRecordRepository.
 * Claims use row locking plus an in-process lock stripe per timestamp, so concurrent
 * claims for the same key serialize both inside this JVM and across processes sharing the file.
 */
public class JdbcTaskRecordRepository implements TaskRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRecordRepository.class);

    static final String STALE_ERROR = "stale: run never reported completion";
    private static final int MAX_ERROR_LENGTH = 2048;
    private static final int LOCK_STRIPES = 64;

    private final Database db;
    private final Clock clock;
    private final Object[] claimLocks = new Object[LOCK_STRIPES];

    public JdbcTaskRecordRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcTaskRecordRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            claimLocks[i] = new Object();
        }
    }

    @Override
    public Optional<TaskRecord> get(ImageTimestamp timestamp) {
        String sql = "SELECT * FROM task_records WHERE ts = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, timestamp.id());
            try (ResultSet rs = ps.executeQuery()) {
                Optional<TaskRecord> result = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return result;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to read record: " + timestamp, e);
        }
    }

    @Override
    public TaskRecord markRunning(ImageTimestamp timestamp) {
        return markRunning(timestamp, false);
    }

    @Override
    public TaskRecord markRunning(ImageTimestamp timestamp, boolean force) {
        synchronized (claimLocks[Math.floorMod(timestamp.hashCode(), LOCK_STRIPES)]) {
            try (Connection conn = db.getConnection()) {
                try {
                    TaskRecord claimed = claim(conn, timestamp, force);
                    conn.commit();
                    log.debug("Timestamp {} claimed (attempt {})", timestamp, claimed.attempts() + 1);
                    return claimed;
                } catch (SQLException | RuntimeException e) {
                    conn.rollback();
                    throw e;
                }
            } catch (SQLException e) {
                if ("23505".equals(e.getSQLState())) {
                    // Another process inserted the row first; inserts are always RUNNING
                    throw new ConflictException(timestamp, ConflictException.Reason.ALREADY_RUNNING);
                }
                throw new StateStoreException("Failed to claim timestamp: " + timestamp, e);
            }
        }
    }

    private TaskRecord claim(Connection conn, ImageTimestamp timestamp, boolean force) throws SQLException {
        Instant now = clock.instant();
        Optional<TaskRecord> existing;

        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM task_records WHERE ts = ? FOR UPDATE")) {
            ps.setString(1, timestamp.id());
            try (ResultSet rs = ps.executeQuery()) {
                existing = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }

        if (existing.isEmpty()) {
            String insert = """
                        INSERT INTO task_records (ts, status, attempts, last_attempt_at, created_at)
                        VALUES (?, 'RUNNING', 0, ?, ?)
                    """;
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                ps.setString(1, timestamp.id());
                setInstant(ps, 2, now);
                setInstant(ps, 3, now);
                ps.executeUpdate();
            }
            return TaskRecord.builder()
                    .timestamp(timestamp)
                    .status(TaskStatus.RUNNING)
                    .lastAttemptAt(now)
                    .createdAt(now)
                    .build();
        }

        TaskRecord record = existing.get();
        if (record.status() == TaskStatus.RUNNING) {
            throw new ConflictException(timestamp, ConflictException.Reason.ALREADY_RUNNING);
        }
        if (record.status() == TaskStatus.SUCCEEDED && !force) {
            throw new ConflictException(timestamp, ConflictException.Reason.ALREADY_SUCCEEDED);
        }

        String update = """
                    UPDATE task_records
                    SET status = 'RUNNING', last_attempt_at = ?, finished_at = NULL
                    WHERE ts = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(update)) {
            setInstant(ps, 1, now);
            ps.setString(2, timestamp.id());
            ps.executeUpdate();
        }

        return record.toBuilder()
                .status(TaskStatus.RUNNING)
                .lastAttemptAt(now)
                .finishedAt(null)
                .build();
    }

    @Override
    public TaskRecord markSucceeded(ImageTimestamp timestamp, String artifactPath) {
        String sql = """
                    UPDATE task_records
                    SET status = 'SUCCEEDED', attempts = attempts + 1, finished_at = ?, artifact_path = ?,
                        last_error = NULL
                    WHERE ts = ? AND status <> 'SUCCEEDED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, clock.instant());
            ps.setString(2, artifactPath);
            ps.setString(3, timestamp.id());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Timestamp {} marked SUCCEEDED", timestamp);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to mark succeeded: " + timestamp, e);
        }

        return get(timestamp).orElseThrow(() -> new IllegalStateException("No record for " + timestamp));
    }

    @Override
    public TaskRecord markFailed(ImageTimestamp timestamp, String error) {
        String sql = """
                    UPDATE task_records
                    SET status = 'FAILED', attempts = attempts + 1, finished_at = ?, last_error = ?
                    WHERE ts = ? AND status <> 'SUCCEEDED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, clock.instant());
            ps.setString(2, truncate(error));
            ps.setString(3, timestamp.id());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.warn("Timestamp {} not marked FAILED: record absent or already SUCCEEDED", timestamp);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to mark failed: " + timestamp, e);
        }

        return get(timestamp).orElseThrow(() -> new IllegalStateException("No record for " + timestamp));
    }

    @Override
    public List<TaskRecord> listIncomplete(Instant now, Duration livenessTimeout) {
        String reclassify = """
                    UPDATE task_records
                    SET status = 'FAILED', attempts = attempts + 1, finished_at = ?, last_error = ?
                    WHERE status = 'RUNNING' AND last_attempt_at < ?
                """;
        String select = "SELECT * FROM task_records WHERE status = 'FAILED' ORDER BY ts";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement update = conn.prepareStatement(reclassify);
                    PreparedStatement query = conn.prepareStatement(select)) {

                setInstant(update, 1, now);
                update.setString(2, STALE_ERROR);
                setInstant(update, 3, now.minus(livenessTimeout));
                int stale = update.executeUpdate();

                List<TaskRecord> incomplete = executeQuery(query);
                conn.commit();

                if (stale > 0) {
                    log.info("Reclassified {} stale RUNNING records as FAILED", stale);
                }
                return incomplete;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list incomplete records", e);
        }
    }

    @Override
    public List<TaskRecord> findStaleRunning(Instant cutoff) {
        String sql = """
                    SELECT * FROM task_records
                    WHERE status = 'RUNNING' AND last_attempt_at < ?
                    ORDER BY last_attempt_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, cutoff);
            List<TaskRecord> result = executeQuery(ps);
            conn.commit();
            return result;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to find stale records", e);
        }
    }

    @Override
    public Optional<TaskRecord> markStale(ImageTimestamp timestamp, Instant cutoff) {
        String sql = """
                    UPDATE task_records
                    SET status = 'FAILED', attempts = attempts + 1, finished_at = ?, last_error = ?
                    WHERE ts = ? AND status = 'RUNNING' AND last_attempt_at < ?
                """;

        int updated;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, clock.instant());
            ps.setString(2, STALE_ERROR);
            ps.setString(3, timestamp.id());
            setInstant(ps, 4, cutoff);

            updated = ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to reclassify stale record: " + timestamp, e);
        }

        return updated > 0 ? get(timestamp) : Optional.empty();
    }

    @Override
    public List<TaskRecord> findRecent(int limit) {
        String sql = "SELECT * FROM task_records ORDER BY ts DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<TaskRecord> result = executeQuery(ps);
            conn.commit();
            return result;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to find recent records", e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM task_records WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                int count = rs.next() ? rs.getInt(1) : 0;
                conn.commit();
                return count;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to count records", e);
        }
    }

    // ==================== Helpers ====================

    private List<TaskRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<TaskRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private TaskRecord mapRow(ResultSet rs) throws SQLException {
        return TaskRecord.builder()
                .timestamp(ImageTimestamp.parse(rs.getString("ts")))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .lastError(rs.getString("last_error"))
                .lastAttemptAt(getInstant(rs, "last_attempt_at"))
                .createdAt(getInstant(rs, "created_at"))
                .finishedAt(getInstant(rs, "finished_at"))
                .artifactPath(rs.getString("artifact_path"))
                .build();
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, instant.atOffset(ZoneOffset.UTC));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
