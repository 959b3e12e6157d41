package com.concierge.engine.bus;

import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.engine.metrics.ConciergeMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    private ConciergeMetrics metrics;
    private EventBus bus;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        metrics = ConciergeMetrics.standalone();
        bus = new EventBus(metrics);
        calls = new CopyOnWriteArrayList<>();
    }

    @Test
    @DisplayName("Kind handlers run in subscription order before catch-all handlers")
    void publish_shouldRunKindHandlersThenCatchAll() {
        bus.subscribeAny(e -> calls.add("any-1"));
        bus.subscribe(EventKind.USER_MESSAGE, e -> calls.add("kind-1"));
        bus.subscribe(EventKind.USER_MESSAGE, e -> calls.add("kind-2"));
        bus.subscribeAny(e -> calls.add("any-2"));

        PublishResult result = bus.publish(Event.of(EventKind.USER_MESSAGE));

        assertThat(calls).containsExactly("kind-1", "kind-2", "any-1", "any-2");
        assertThat(result.invoked()).isEqualTo(4);
        assertThat(result.hasFaults()).isFalse();
    }

    @Test
    @DisplayName("A throwing handler does not stop the others")
    void publish_shouldIsolateHandlerFaults() {
        bus.subscribe(EventKind.WEBHOOK, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(EventKind.WEBHOOK, e -> calls.add("second"));
        bus.subscribeAny(e -> calls.add("any"));

        PublishResult result = bus.publish(Event.of(EventKind.WEBHOOK));

        assertThat(calls).containsExactly("second", "any");
        assertThat(result.faults()).isEqualTo(1);
        assertThat(metrics.registry().counter(ConciergeMetrics.HANDLER_FAULTS, "kind", "webhook").count())
            .isEqualTo(1.0);
    }

    @Test
    void publish_shouldOnlyReachHandlersOfTheEventKind() {
        bus.subscribe(EventKind.CRON, e -> calls.add("cron"));

        PublishResult result = bus.publish(Event.of(EventKind.SYSTEM));

        assertThat(calls).isEmpty();
        assertThat(result.invoked()).isZero();
    }

    @Test
    void subscribe_withSeveralKinds_shouldRegisterEach() {
        bus.subscribe(e -> calls.add(e.kind().wireValue()), EventKind.TASK_COMPLETE, EventKind.TASK_FAILED);

        bus.publish(Event.of(EventKind.TASK_COMPLETE));
        bus.publish(Event.of(EventKind.TASK_FAILED));

        assertThat(calls).containsExactly("task_complete", "task_failed");
        assertThat(bus.handlerCount()).isEqualTo(2);
    }

    @Test
    void handlerCount_shouldCountKindAndCatchAllRegistrations() {
        assertThat(bus.handlerCount()).isZero();

        bus.subscribe(EventKind.CRON, e -> { });
        bus.subscribeAny(e -> { });

        assertThat(bus.handlerCount()).isEqualTo(2);
    }
}
