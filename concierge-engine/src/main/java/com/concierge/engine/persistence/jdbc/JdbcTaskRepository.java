package com.concierge.engine.persistence.jdbc;

import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.repository.TaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed implementation of TaskRepository.
 *
 * Status changes are conditional updates ({@code WHERE status IN (...)}), so two
 * processes racing on the same task cannot both win, and a terminal row is never
 * written again.
 */
@Repository("jdbcTaskRepository")
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRowMapper rowMapper;

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TaskRowMapper();
    }

    @Override
    @Transactional
    public void save(Task task) {
        String sql = """
            INSERT INTO tasks (
                id, title, user_id, input_data, agent_slug, workflow_id,
                source_event_id, source_channel, status, retry_count,
                error, output_data, queue_handle, created_at, updated_at
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            task.id(),
            task.title(),
            task.userId(),
            toJson(task.inputData()),
            task.agentSlug(),
            task.workflowId(),
            task.sourceEventId(),
            task.sourceChannel(),
            task.status().wireValue(),
            task.retryCount(),
            task.error(),
            toJson(task.outputData()),
            task.queueHandle(),
            toTimestamp(task.createdAt()),
            toTimestamp(task.updatedAt())
        );

        if (rows == 0) {
            log.debug("Task already exists: {}", task.id());
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";
        List<Task> results = jdbcTemplate.query(sql, rowMapper, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Task> findByUser(String userId, int limit) {
        String sql = "SELECT * FROM tasks WHERE user_id = ? ORDER BY created_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, userId, limit);
    }

    @Override
    public List<Task> findByStatus(TaskStatus status, int limit) {
        String sql = "SELECT * FROM tasks WHERE status = ? ORDER BY created_at LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, status.wireValue(), limit);
    }

    @Override
    @Transactional
    public boolean compareAndSet(Task updated, Set<TaskStatus> expectedStatuses) {
        List<String> expected = expectedStatuses.stream()
            .filter(s -> !s.isTerminal())
            .map(TaskStatus::wireValue)
            .collect(Collectors.toList());
        if (expected.isEmpty()) {
            return false;
        }

        String placeholders = String.join(", ", Collections.nCopies(expected.size(), "?"));
        String sql = """
            UPDATE tasks SET
                status = ?,
                agent_slug = ?,
                retry_count = ?,
                error = ?,
                output_data = ?::jsonb,
                updated_at = ?
            WHERE id = ? AND status IN (%s)
            """.formatted(placeholders);

        List<Object> args = new ArrayList<>();
        args.add(updated.status().wireValue());
        args.add(updated.agentSlug());
        args.add(updated.retryCount());
        args.add(updated.error());
        args.add(toJson(updated.outputData()));
        args.add(toTimestamp(updated.updatedAt()));
        args.add(updated.id());
        args.addAll(expected);

        int rows = jdbcTemplate.update(sql, args.toArray());
        if (rows == 0) {
            log.debug("Conditional update of task {} to {} not applied", updated.id(), updated.status());
        }
        return rows > 0;
    }

    @Override
    public boolean recordQueueHandle(String taskId, String queueHandle) {
        return jdbcTemplate.update("UPDATE tasks SET queue_handle = ? WHERE id = ?", queueHandle, taskId) > 0;
    }

    @Override
    public boolean delete(String taskId) {
        return jdbcTemplate.update("DELETE FROM tasks WHERE id = ?", taskId) > 0;
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new Task(
                    rs.getString("id"),
                    rs.getString("title"),
                    rs.getString("user_id"),
                    parseJsonNode(rs.getString("input_data")),
                    rs.getString("agent_slug"),
                    rs.getString("workflow_id"),
                    rs.getString("source_event_id"),
                    rs.getString("source_channel"),
                    TaskStatus.fromWireValue(rs.getString("status")),
                    rs.getInt("retry_count"),
                    rs.getString("error"),
                    parseJsonNode(rs.getString("output_data")),
                    rs.getString("queue_handle"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map task row", e);
            }
        }

        private JsonNode parseJsonNode(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return null;
            return objectMapper.readTree(json);
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
