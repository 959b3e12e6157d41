package com.concierge.engine.subscription;

import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.engine.bus.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of lifecycle listeners, e.g. "tell me when a task completes".
 *
 * Unlike the event bus this is a simple fan-out keyed by kind: callbacks run in
 * registration order and a failing callback does not prevent the others.
 */
public class SubscriptionManager {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    private final Map<EventKind, List<EventHandler>> subscriptions = new EnumMap<>(EventKind.class);

    public SubscriptionManager() {
        for (EventKind kind : EventKind.values()) {
            subscriptions.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    public void subscribe(EventKind kind, EventHandler callback) {
        subscriptions.get(kind).add(callback);
    }

    /**
     * Remove one registration of a callback.
     *
     * @return true if the callback was registered for the kind
     */
    public boolean unsubscribe(EventKind kind, EventHandler callback) {
        return subscriptions.get(kind).remove(callback);
    }

    /**
     * Invoke every callback registered for the event's kind.
     *
     * @return number of callbacks that completed without throwing
     */
    public int notify(Event event) {
        int succeeded = 0;
        for (EventHandler callback : subscriptions.get(event.kind())) {
            try {
                callback.handle(event);
                succeeded++;
            } catch (Exception e) {
                log.error("Subscription callback failed for {} event {}",
                    event.kind().wireValue(), event.id(), e);
            }
        }
        return succeeded;
    }

    public int subscriptionCount(EventKind kind) {
        return subscriptions.get(kind).size();
    }

    public int subscriptionCount() {
        return subscriptions.values().stream().mapToInt(List::size).sum();
    }
}
