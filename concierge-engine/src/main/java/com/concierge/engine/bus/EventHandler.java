package com.concierge.engine.bus;

import com.concierge.core.model.Event;

/**
 * Callback invoked for each published event it is subscribed to.
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handle an event. Throwing does not stop delivery to the remaining handlers.
     *
     * @param event The published event
     * @throws Exception if handling fails
     */
    void handle(Event event) throws Exception;
}
