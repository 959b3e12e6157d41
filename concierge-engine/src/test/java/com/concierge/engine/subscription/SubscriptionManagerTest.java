package com.concierge.engine.subscription;

import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.engine.bus.EventHandler;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionManagerTest {

    private final SubscriptionManager manager = new SubscriptionManager();

    @Test
    void notify_shouldInvokeCallbacksInOrderAndSurviveFailures() {
        List<String> calls = new ArrayList<>();
        manager.subscribe(EventKind.TASK_COMPLETE, e -> calls.add("first"));
        manager.subscribe(EventKind.TASK_COMPLETE, e -> {
            throw new RuntimeException("listener down");
        });
        manager.subscribe(EventKind.TASK_COMPLETE, e -> calls.add("third"));
        manager.subscribe(EventKind.TASK_FAILED, e -> calls.add("other-kind"));

        int succeeded = manager.notify(Event.of(EventKind.TASK_COMPLETE));

        assertThat(calls).containsExactly("first", "third");
        assertThat(succeeded).isEqualTo(2);
    }

    @Test
    void notify_withSameCallbackRegisteredTwice_shouldInvokeItTwice() {
        List<Event> received = new ArrayList<>();
        EventHandler callback = received::add;
        manager.subscribe(EventKind.TASK_COMPLETE, callback);
        manager.subscribe(EventKind.TASK_COMPLETE, callback);
        Event event = Event.of(EventKind.TASK_COMPLETE);

        int succeeded = manager.notify(event);

        assertThat(received).containsExactly(event, event);
        assertThat(succeeded).isEqualTo(2);
        assertThat(manager.subscriptionCount(EventKind.TASK_COMPLETE)).isEqualTo(2);
    }

    @Test
    void unsubscribe_shouldRemoveCallback() {
        EventHandler callback = e -> { };
        manager.subscribe(EventKind.TASK_FAILED, callback);
        assertThat(manager.subscriptionCount(EventKind.TASK_FAILED)).isEqualTo(1);

        assertThat(manager.unsubscribe(EventKind.TASK_FAILED, callback)).isTrue();
        assertThat(manager.unsubscribe(EventKind.TASK_FAILED, callback)).isFalse();
        assertThat(manager.subscriptionCount()).isZero();
    }
}
