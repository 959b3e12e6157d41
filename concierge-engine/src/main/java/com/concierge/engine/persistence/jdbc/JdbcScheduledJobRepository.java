package com.concierge.engine.persistence.jdbc;

import com.concierge.core.exception.DuplicateScheduleException;
import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.ScheduledJob;
import com.concierge.core.repository.ScheduledJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of ScheduledJobRepository.
 * The (user_id, name) unique constraint backs the duplicate-name check.
 */
@Repository("jdbcScheduledJobRepository")
public class JdbcScheduledJobRepository implements ScheduledJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduledJobRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ScheduledJobRowMapper rowMapper;

    public JdbcScheduledJobRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new ScheduledJobRowMapper();
    }

    @Override
    @Transactional
    public void save(ScheduledJob job) {
        String sql = """
            INSERT INTO scheduled_jobs (
                id, user_id, name, description, cron_expression, agent_slug,
                task_payload, is_enabled, last_run_at, next_run_at, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
            ON CONFLICT ON CONSTRAINT uq_scheduled_job_user_name DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            job.id(),
            job.userId(),
            job.name(),
            job.description(),
            job.cronExpression(),
            job.agentSlug(),
            toJson(job.taskPayload()),
            job.enabled(),
            toTimestamp(job.lastRunAt()),
            toTimestamp(job.nextRunAt()),
            toTimestamp(job.createdAt()),
            toTimestamp(job.updatedAt())
        );

        if (rows == 0) {
            String existingId = findByUserAndName(job.userId(), job.name())
                .map(ScheduledJob::id)
                .orElse(null);
            throw new DuplicateScheduleException(job.userId(), job.name(), existingId);
        }
        log.debug("Saved scheduled job {} ({})", job.id(), job.name());
    }

    @Override
    @Transactional
    public void update(ScheduledJob job) {
        String sql = """
            UPDATE scheduled_jobs SET
                name = ?,
                description = ?,
                cron_expression = ?,
                agent_slug = ?,
                task_payload = ?::jsonb,
                is_enabled = ?,
                next_run_at = ?,
                updated_at = ?
            WHERE id = ?
            """;

        Optional<ScheduledJob> clash = findByUserAndName(job.userId(), job.name())
            .filter(other -> !other.id().equals(job.id()));
        if (clash.isPresent()) {
            throw new DuplicateScheduleException(job.userId(), job.name(), clash.get().id());
        }

        int rows;
        try {
            rows = jdbcTemplate.update(sql,
                job.name(),
                job.description(),
                job.cronExpression(),
                job.agentSlug(),
                toJson(job.taskPayload()),
                job.enabled(),
                toTimestamp(job.nextRunAt()),
                toTimestamp(job.updatedAt()),
                job.id()
            );
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent rename to the same name
            throw new DuplicateScheduleException(job.userId(), job.name(), null);
        }
        if (rows == 0) {
            throw new NotFoundException("ScheduledJob", job.id());
        }
    }

    @Override
    public Optional<ScheduledJob> findById(String jobId) {
        List<ScheduledJob> results = jdbcTemplate.query(
            "SELECT * FROM scheduled_jobs WHERE id = ?", rowMapper, jobId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<ScheduledJob> findByUserAndName(String userId, String name) {
        List<ScheduledJob> results = jdbcTemplate.query(
            "SELECT * FROM scheduled_jobs WHERE user_id = ? AND name = ?", rowMapper, userId, name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ScheduledJob> findByUser(String userId) {
        return jdbcTemplate.query(
            "SELECT * FROM scheduled_jobs WHERE user_id = ? ORDER BY created_at", rowMapper, userId);
    }

    @Override
    public List<ScheduledJob> findEnabled() {
        return jdbcTemplate.query(
            "SELECT * FROM scheduled_jobs WHERE is_enabled ORDER BY created_at", rowMapper);
    }

    @Override
    public void recordRun(String jobId, Instant lastRunAt, Instant nextRunAt) {
        String sql = """
            UPDATE scheduled_jobs SET last_run_at = ?, next_run_at = ?, updated_at = ?
            WHERE id = ?
            """;
        jdbcTemplate.update(sql, toTimestamp(lastRunAt), toTimestamp(nextRunAt), Timestamp.from(Instant.now()), jobId);
    }

    @Override
    public void updateNextRun(String jobId, Instant nextRunAt) {
        jdbcTemplate.update("UPDATE scheduled_jobs SET next_run_at = ? WHERE id = ?",
            toTimestamp(nextRunAt), jobId);
    }

    @Override
    public boolean delete(String jobId) {
        return jdbcTemplate.update("DELETE FROM scheduled_jobs WHERE id = ?", jobId) > 0;
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

    private class ScheduledJobRowMapper implements RowMapper<ScheduledJob> {
        @Override
        public ScheduledJob mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new ScheduledJob(
                    rs.getString("id"),
                    rs.getString("user_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getString("cron_expression"),
                    rs.getString("agent_slug"),
                    objectMapper.readTree(rs.getString("task_payload")),
                    rs.getBoolean("is_enabled"),
                    toInstant(rs.getTimestamp("last_run_at")),
                    toInstant(rs.getTimestamp("next_run_at")),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map scheduled job row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
