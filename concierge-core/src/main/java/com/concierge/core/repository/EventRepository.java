package com.concierge.core.repository;

import com.concierge.core.model.Event;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the persistent counterpart of events.
 * The core itself never requires events to be stored; when they are, workers
 * mark them processed once the derived task succeeds.
 */
public interface EventRepository {

    /**
     * Stored event plus its processing bookkeeping.
     */
    record EventRecord(Event event, boolean processed, String taskId) {}

    /**
     * Save an event. Saving the same event id twice is a no-op.
     */
    void save(Event event);

    /**
     * Find a stored event by ID.
     */
    Optional<EventRecord> findById(String eventId);

    /**
     * Link an event to the task derived from it.
     *
     * @return true if the event exists
     */
    boolean linkTask(String eventId, String taskId);

    /**
     * Mark an event processed.
     *
     * @return true if the event exists
     */
    boolean markProcessed(String eventId);

    /**
     * Find events not yet processed, oldest first.
     */
    List<EventRecord> findUnprocessed(int limit);

    /**
     * Delete an event.
     */
    boolean delete(String eventId);
}
