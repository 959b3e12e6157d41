package com.concierge.engine.dispatch;

import com.concierge.core.model.Event;
import com.concierge.core.model.Task;
import com.concierge.core.repository.EventRepository;
import com.concierge.engine.bus.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catch-all handler that turns every dispatchable event into a task.
 *
 * Dispatchable kinds are user messages, channel messages, cron firings and webhooks.
 * An {@code agent_slug} in the payload pins the task to that agent; otherwise
 * the worker routes it. When the event was recorded, it is linked to the task.
 */
public class DefaultDispatchHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(DefaultDispatchHandler.class);

    static final String AGENT_SLUG_FIELD = "agent_slug";

    private final TaskDispatcher dispatcher;
    private final EventRepository eventRepository;

    public DefaultDispatchHandler(TaskDispatcher dispatcher, EventRepository eventRepository) {
        this.dispatcher = dispatcher;
        this.eventRepository = eventRepository;
    }

    @Override
    public void handle(Event event) {
        if (!event.kind().isDispatchable()) {
            return;
        }

        String agentSlug = event.payloadText(AGENT_SLUG_FIELD);
        if (agentSlug != null && agentSlug.isBlank()) {
            agentSlug = null;
        }

        Task task = dispatcher.dispatchFromEvent(event, agentSlug);
        if (eventRepository.linkTask(event.id(), task.id())) {
            log.debug("Linked event {} to task {}", event.id(), task.id());
        }
    }
}
