package net.ogimage.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.ogimage.application.render.TaskLedger;
import net.ogimage.domain.render.RenderTarget;
import net.ogimage.domain.render.RenderTask;
import net.ogimage.domain.render.RenderTaskState;
import net.ogimage.domain.render.TaskTransition;
import net.ogimage.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Postgres adapter for the {@code render_tasks} table.
 *
 * <p>The partial unique index on {@code fingerprint} for pending and processing rows makes
 * {@link #createIfAbsent(RenderTask)} a single atomic check-and-create. Claims use
 * {@code FOR UPDATE SKIP LOCKED} so concurrent workers never receive the same row.</p>
 */
@Repository
@ConditionalOnProperty(prefix = "og.pipeline", name = "ledger", havingValue = "jdbc", matchIfMissing = true)
public class JdbcTaskLedger implements TaskLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskLedger.class);
    private static final String BACKEND = "task-ledger";

    private static final String COLUMNS = """
        id, fingerprint, target_url, width, height, ttl_seconds, state,
        image_url, error_message, owner_id, created_at, updated_at
        """;

    private static final RowMapper<RenderTask> ROW_MAPPER = JdbcTaskLedger::mapRow;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcTaskLedger(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<RenderTask> createIfAbsent(RenderTask pendingTask) {
        if (pendingTask.state() != RenderTaskState.PENDING) {
            throw new IllegalArgumentException("Only pending tasks can be created, got " + pendingTask.state());
        }
        String sql = """
            INSERT INTO render_tasks
              (id, fingerprint, target_url, width, height, ttl_seconds, state, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, 'PENDING', ?, ?)
            ON CONFLICT (fingerprint) WHERE state IN ('PENDING', 'PROCESSING') DO NOTHING
            """;
        try {
            int inserted = jdbcTemplate.update(
                sql,
                pendingTask.id(),
                pendingTask.fingerprint(),
                pendingTask.target().url(),
                pendingTask.target().width(),
                pendingTask.target().height(),
                pendingTask.ttlSeconds(),
                Timestamp.from(pendingTask.createdAt()),
                Timestamp.from(pendingTask.updatedAt())
            );
            return inserted == 1 ? Optional.of(pendingTask) : Optional.empty();
        } catch (DuplicateKeyException ex) {
            log.debug("Render task insert for fingerprint {} lost a race: {}", pendingTask.fingerprint(), ex.getMessage());
            return Optional.empty();
        } catch (DataAccessException ex) {
            log.error("Failed to insert render task for fingerprint {}", pendingTask.fingerprint(), ex);
            throw new StorageUnavailableException(BACKEND, "Failed to insert render task", ex);
        }
    }

    @Override
    public Optional<RenderTask> findActive(String fingerprint) {
        String sql = "SELECT " + COLUMNS + """
            FROM render_tasks
            WHERE fingerprint = ? AND state IN ('PENDING', 'PROCESSING')
            LIMIT 1
            """;
        return queryForOptional(sql, "find active render task for fingerprint " + fingerprint, fingerprint);
    }

    @Override
    public Optional<RenderTask> get(UUID taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        String sql = "SELECT " + COLUMNS + " FROM render_tasks WHERE id = ?";
        return queryForOptional(sql, "load render task " + taskId, taskId);
    }

    @Override
    public Optional<RenderTask> claimNextPending(String workerId) {
        String sql = """
            UPDATE render_tasks
            SET state = 'PROCESSING', owner_id = ?, updated_at = ?
            WHERE id = (
                SELECT id FROM render_tasks
                WHERE state = 'PENDING'
                ORDER BY created_at ASC, id ASC
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING
            """ + COLUMNS;
        return queryForOptional(sql, "claim pending render task for " + workerId,
            workerId, Timestamp.from(clock.instant()));
    }

    @Override
    public Optional<RenderTask> transition(TaskTransition transition) {
        String sql = """
            UPDATE render_tasks
            SET state = ?, image_url = ?, error_message = ?, updated_at = ?
            WHERE id = ? AND state = ? AND owner_id = ?
            RETURNING
            """ + COLUMNS;
        return queryForOptional(
            sql,
            "transition render task " + transition.taskId() + " to " + transition.targetState(),
            transition.targetState().name(),
            transition.imageUrl(),
            transition.errorMessage(),
            Timestamp.from(clock.instant()),
            transition.taskId(),
            transition.expectedState().name(),
            transition.ownerId()
        );
    }

    @Override
    public Optional<RenderTask> heartbeat(UUID taskId, String ownerId) {
        String sql = """
            UPDATE render_tasks
            SET updated_at = ?
            WHERE id = ? AND state = 'PROCESSING' AND owner_id = ?
            RETURNING
            """ + COLUMNS;
        return queryForOptional(sql, "refresh render task " + taskId,
            Timestamp.from(clock.instant()), taskId, ownerId);
    }

    @Override
    public List<RenderTask> findProcessingUpdatedBefore(Instant cutoff) {
        String sql = "SELECT " + COLUMNS + """
            FROM render_tasks
            WHERE state = 'PROCESSING' AND updated_at < ?
            ORDER BY updated_at ASC
            """;
        try {
            return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(cutoff));
        } catch (DataAccessException ex) {
            log.error("Failed to list stale processing render tasks", ex);
            throw new StorageUnavailableException(BACKEND, "Failed to list stale processing render tasks", ex);
        }
    }

    private Optional<RenderTask> queryForOptional(String sql, String operation, Object... args) {
        try {
            List<RenderTask> rows = jdbcTemplate.query(sql, ROW_MAPPER, args);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException ex) {
            log.error("Failed to {}", operation, ex);
            throw new StorageUnavailableException(BACKEND, "Failed to " + operation, ex);
        }
    }

    private static RenderTask mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new RenderTask(
            (UUID) rs.getObject("id"),
            rs.getString("fingerprint"),
            new RenderTarget(rs.getString("target_url"), rs.getInt("width"), rs.getInt("height")),
            rs.getLong("ttl_seconds"),
            RenderTaskState.fromStorageValue(rs.getString("state")),
            rs.getString("image_url"),
            rs.getString("error_message"),
            rs.getString("owner_id"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        if (timestamp == null) {
            throw new IllegalStateException("render_tasks row is missing a timestamp");
        }
        return timestamp.toInstant();
    }
}
