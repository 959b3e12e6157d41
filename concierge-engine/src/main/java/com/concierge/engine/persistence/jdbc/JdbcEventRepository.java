package com.concierge.engine.persistence.jdbc;

import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.core.repository.EventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of EventRepository.
 * Saving is idempotent on the event id.
 */
@Repository("jdbcEventRepository")
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EventRecordRowMapper rowMapper;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EventRecordRowMapper();
    }

    @Override
    public void save(Event event) {
        String sql = """
            INSERT INTO events (id, kind, payload, source_channel, user_id, processed, created_at)
            VALUES (?, ?, ?::jsonb, ?, ?, FALSE, ?)
            ON CONFLICT (id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            event.id(),
            event.kind().wireValue(),
            serializePayload(event),
            event.sourceChannel(),
            event.userId(),
            Timestamp.from(event.createdAt())
        );

        if (rows == 0) {
            log.debug("Event already stored: {}", event.id());
        }
    }

    @Override
    public Optional<EventRecord> findById(String eventId) {
        List<EventRecord> results = jdbcTemplate.query("SELECT * FROM events WHERE id = ?", rowMapper, eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean linkTask(String eventId, String taskId) {
        return jdbcTemplate.update("UPDATE events SET task_id = ? WHERE id = ?", taskId, eventId) > 0;
    }

    @Override
    public boolean markProcessed(String eventId) {
        return jdbcTemplate.update("UPDATE events SET processed = TRUE WHERE id = ?", eventId) > 0;
    }

    @Override
    public List<EventRecord> findUnprocessed(int limit) {
        String sql = """
            SELECT * FROM events
            WHERE NOT processed
            ORDER BY created_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, limit);
    }

    @Override
    public boolean delete(String eventId) {
        return jdbcTemplate.update("DELETE FROM events WHERE id = ?", eventId) > 0;
    }

    private String serializePayload(Event event) {
        try {
            return objectMapper.writeValueAsString(event.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload of event " + event.id(), e);
        }
    }

    private class EventRecordRowMapper implements RowMapper<EventRecord> {
        @Override
        public EventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                Event event = new Event(
                    rs.getString("id"),
                    EventKind.fromWireValue(rs.getString("kind")),
                    objectMapper.readTree(rs.getString("payload")),
                    rs.getString("source_channel"),
                    rs.getString("user_id"),
                    rs.getTimestamp("created_at").toInstant()
                );
                return new EventRecord(event, rs.getBoolean("processed"), rs.getString("task_id"));
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map event row", e);
            }
        }
    }
}
