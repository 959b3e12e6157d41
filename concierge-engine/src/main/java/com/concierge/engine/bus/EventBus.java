package com.concierge.engine.bus;

import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.engine.logging.LoggingContext;
import com.concierge.engine.metrics.ConciergeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process event router.
 *
 * Delivery order for one publish:
 * 1. Handlers subscribed to the event's kind, in subscription order
 * 2. Catch-all handlers, in subscription order
 *
 * A handler that throws is logged and counted; the remaining handlers still run.
 * Registration is thread-safe and may happen while events are being published.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<EventKind, List<EventHandler>> handlersByKind = new EnumMap<>(EventKind.class);
    private final List<EventHandler> catchAllHandlers = new CopyOnWriteArrayList<>();
    private final ConciergeMetrics metrics;

    public EventBus(ConciergeMetrics metrics) {
        this.metrics = metrics;
        for (EventKind kind : EventKind.values()) {
            handlersByKind.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Register a handler for one event kind.
     */
    public void subscribe(EventKind kind, EventHandler handler) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        handlersByKind.get(kind).add(handler);
        log.debug("Subscribed handler to {}", kind.wireValue());
    }

    /**
     * Register one handler for several kinds.
     */
    public void subscribe(EventHandler handler, EventKind... kinds) {
        for (EventKind kind : kinds) {
            subscribe(kind, handler);
        }
    }

    /**
     * Register a handler invoked for every event, after the kind-specific ones.
     */
    public void subscribeAny(EventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        catchAllHandlers.add(handler);
        log.debug("Subscribed catch-all handler");
    }

    /**
     * Deliver an event to its handlers.
     *
     * @param event The event
     * @return How many handlers ran and how many of them threw
     */
    public PublishResult publish(Event event) {
        Objects.requireNonNull(event, "event");
        metrics.eventPublished(event.kind().wireValue());

        int invoked = 0;
        int faults = 0;

        try (var ctx = LoggingContext.forEvent(event.id(), event.kind().wireValue())) {
            log.debug("Publishing event from channel {}", event.sourceChannel());

            for (EventHandler handler : handlersByKind.get(event.kind())) {
                invoked++;
                if (!invoke(handler, event)) {
                    faults++;
                }
            }
            for (EventHandler handler : catchAllHandlers) {
                invoked++;
                if (!invoke(handler, event)) {
                    faults++;
                }
            }
        }

        return new PublishResult(event.id(), invoked, faults);
    }

    /**
     * Total registrations, kind-specific and catch-all.
     */
    public int handlerCount() {
        int count = catchAllHandlers.size();
        for (List<EventHandler> handlers : handlersByKind.values()) {
            count += handlers.size();
        }
        return count;
    }

    private boolean invoke(EventHandler handler, Event event) {
        try {
            handler.handle(event);
            return true;
        } catch (Exception e) {
            log.error("Event handler {} failed for {} event {}",
                handler.getClass().getSimpleName(), event.kind().wireValue(), event.id(), e);
            metrics.handlerFault(event.kind().wireValue());
            return false;
        }
    }
}
