package com.concierge.app.rest;

import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.engine.bus.EventBus;
import com.concierge.engine.bus.PublishResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for channel adapters and API callers to publish events.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventBus eventBus;

    public EventController(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * Publish an inbound event. Lifecycle kinds are internal and refused.
     */
    @PostMapping
    public ResponseEntity<PublishResponse> publish(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @RequestBody PublishRequest request) {

        EventKind kind = EventKind.fromWireValue(request.kind());
        if (kind.isLifecycle()) {
            throw new IllegalArgumentException("Lifecycle events cannot be published externally: " + request.kind());
        }

        Event event = Event.create(kind, request.payload(), request.sourceChannel(), userId);
        PublishResult result = eventBus.publish(event);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new PublishResponse(result.eventId(), result.invoked(), result.faults()));
    }

    // ========== DTOs ==========

    public record PublishRequest(
        String kind,
        JsonNode payload,
        String sourceChannel
    ) {}

    public record PublishResponse(
        String eventId,
        int handlersInvoked,
        int handlerFaults
    ) {}
}
