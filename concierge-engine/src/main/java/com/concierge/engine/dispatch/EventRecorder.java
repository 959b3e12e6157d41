package com.concierge.engine.dispatch;

import com.concierge.core.model.Event;
import com.concierge.core.repository.EventRepository;
import com.concierge.engine.bus.EventHandler;

/**
 * Handler that stores dispatchable events so the task derived from each one can be traced back.
 * Register it ahead of {@link DefaultDispatchHandler}.
 */
public class EventRecorder implements EventHandler {

    private final EventRepository eventRepository;

    public EventRecorder(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    @Override
    public void handle(Event event) {
        if (event.kind().isDispatchable()) {
            eventRepository.save(event);
        }
    }
}
