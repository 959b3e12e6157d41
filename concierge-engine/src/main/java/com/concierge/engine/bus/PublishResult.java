package com.concierge.engine.bus;

/**
 * Outcome of one publish call.
 *
 * @param eventId the published event
 * @param invoked handlers invoked, faulted ones included
 * @param faults handlers that threw
 */
public record PublishResult(String eventId, int invoked, int faults) {

    public boolean hasFaults() {
        return faults > 0;
    }
}
