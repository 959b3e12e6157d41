package com.concierge.engine.persistence.jdbc;

import com.concierge.core.queue.QueueDelivery;
import com.concierge.core.queue.TaskDescriptor;
import com.concierge.core.queue.TaskQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable task queue on a PostgreSQL table.
 *
 * Polling claims rows with {@code FOR UPDATE SKIP LOCKED}, so concurrent workers in
 * any number of processes never receive the same entry at once. A claim moves the
 * row's availability forward by the visibility timeout; a worker that dies before
 * acknowledging leaves the row to be picked up again once the timeout passes.
 */
@Repository("jdbcTaskQueue")
public class JdbcTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskQueue.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcTaskQueue(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this(jdbcTemplate, objectMapper, Clock.systemUTC());
    }

    public JdbcTaskQueue(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String enqueue(TaskDescriptor descriptor, Duration delay) {
        String handle = UUID.randomUUID().toString();
        Instant now = clock.instant();

        String sql = """
            INSERT INTO task_queue (handle, task_id, descriptor, available_at, delivery_count, enqueued_at)
            VALUES (?, ?, ?::jsonb, ?, 0, ?)
            """;
        jdbcTemplate.update(sql,
            handle,
            descriptor.taskId(),
            toJson(descriptor),
            Timestamp.from(now.plus(delay)),
            Timestamp.from(now)
        );

        log.debug("Enqueued task {} as {} (delay {})", descriptor.taskId(), handle, delay);
        return handle;
    }

    @Override
    @Transactional
    public List<QueueDelivery> poll(int maxItems, Duration visibilityTimeout) {
        Instant now = clock.instant();

        String sql = """
            UPDATE task_queue SET
                available_at = ?,
                delivery_count = delivery_count + 1
            WHERE handle IN (
                SELECT handle FROM task_queue
                WHERE available_at <= ?
                ORDER BY available_at
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            RETURNING handle, descriptor, delivery_count
            """;

        return jdbcTemplate.query(sql,
            (rs, rowNum) -> new QueueDelivery(
                rs.getString("handle"),
                fromJson(rs.getString("descriptor")),
                rs.getInt("delivery_count")
            ),
            Timestamp.from(now.plus(visibilityTimeout)),
            Timestamp.from(now),
            maxItems
        );
    }

    @Override
    public void acknowledge(String handle) {
        jdbcTemplate.update("DELETE FROM task_queue WHERE handle = ?", handle);
    }

    @Override
    public boolean cancel(String taskId) {
        String sql = """
            INSERT INTO task_cancellations (task_id, cancelled_at)
            VALUES (?, ?)
            ON CONFLICT (task_id) DO NOTHING
            """;
        return jdbcTemplate.update(sql, taskId, Timestamp.from(clock.instant())) > 0;
    }

    @Override
    public boolean isCancelled(String taskId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM task_cancellations WHERE task_id = ?)", Boolean.class, taskId);
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public void clearCancellation(String taskId) {
        jdbcTemplate.update("DELETE FROM task_cancellations WHERE task_id = ?", taskId);
    }

    @Override
    public int size() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM task_queue", Integer.class);
        return count != null ? count : 0;
    }

    // ========== Helper Methods ==========

    private String toJson(TaskDescriptor descriptor) {
        try {
            return objectMapper.writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize descriptor of task " + descriptor.taskId(), e);
        }
    }

    private TaskDescriptor fromJson(String json) {
        try {
            return objectMapper.readValue(json, TaskDescriptor.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read queued descriptor", e);
        }
    }
}
