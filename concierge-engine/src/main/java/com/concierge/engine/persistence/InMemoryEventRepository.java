package com.concierge.engine.persistence;

import com.concierge.core.model.Event;
import com.concierge.core.repository.EventRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EventRepository.
 */
@Repository
public class InMemoryEventRepository implements EventRepository {

    private final Map<String, EventRecord> events = new ConcurrentHashMap<>();

    @Override
    public void save(Event event) {
        events.putIfAbsent(event.id(), new EventRecord(event, false, null));
    }

    @Override
    public Optional<EventRecord> findById(String eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public boolean linkTask(String eventId, String taskId) {
        return events.computeIfPresent(eventId,
            (id, r) -> new EventRecord(r.event(), r.processed(), taskId)) != null;
    }

    @Override
    public boolean markProcessed(String eventId) {
        return events.computeIfPresent(eventId,
            (id, r) -> new EventRecord(r.event(), true, r.taskId())) != null;
    }

    @Override
    public List<EventRecord> findUnprocessed(int limit) {
        return events.values().stream()
            .filter(r -> !r.processed())
            .sorted(Comparator.comparing(r -> r.event().createdAt()))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String eventId) {
        return events.remove(eventId) != null;
    }
}
