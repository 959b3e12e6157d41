package com.concierge.engine.dispatch;

import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.queue.QueueDelivery;
import com.concierge.engine.metrics.ConciergeMetrics;
import com.concierge.engine.persistence.InMemoryTaskQueue;
import com.concierge.engine.persistence.InMemoryTaskRepository;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskDispatcherTest {

    private InMemoryTaskRepository taskRepository;
    private InMemoryTaskQueue queue;
    private TaskDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        taskRepository = new InMemoryTaskRepository();
        queue = new InMemoryTaskQueue();
        dispatcher = new TaskDispatcher(taskRepository, queue, ConciergeMetrics.standalone());
    }

    @Test
    @DisplayName("Dispatch persists the task as queued and places exactly one entry on the queue")
    void dispatch_shouldPersistAndEnqueue() {
        Task task = Task.create("Check email", "user-1", JsonNodeFactory.instance.objectNode());

        String handle = dispatcher.dispatch(task);

        Task stored = taskRepository.findById(task.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(stored.queueHandle()).isEqualTo(handle);

        List<QueueDelivery> deliveries = queue.poll(10, Duration.ofSeconds(30));
        assertThat(deliveries).hasSize(1);
        assertThat(deliveries.get(0).handle()).isEqualTo(handle);
        assertThat(deliveries.get(0).descriptor().taskId()).isEqualTo(task.id());
    }

    @Test
    void dispatch_withNonPendingTask_shouldReject() {
        Task task = Task.create("x", "u", null).withStatus(TaskStatus.RUNNING);

        assertThatThrownBy(() -> dispatcher.dispatch(task))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(queue.size()).isZero();
    }

    @Test
    void dispatchFromEvent_shouldCopyEventFieldsAndDefaultUser() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("text", "play jazz");
        Event event = Event.create(EventKind.USER_MESSAGE, payload, "web", null);

        Task task = dispatcher.dispatchFromEvent(event, "spotify");

        assertThat(task.title()).isEqualTo("Task from user_message event");
        assertThat(task.userId()).isEqualTo(Task.SYSTEM_USER);
        assertThat(task.agentSlug()).isEqualTo("spotify");
        assertThat(task.sourceEventId()).isEqualTo(event.id());
        assertThat(task.sourceChannel()).isEqualTo("web");
        assertThat(task.inputText("text")).isEqualTo("play jazz");
        assertThat(task.queueHandle()).isNotNull();
        assertThat(taskRepository.findById(task.id())).isPresent();
    }

    @Test
    void titleFor_channelMessage_shouldUseTruncatedText() {
        String longText = "a".repeat(200);
        Event event = Event.create(EventKind.CHANNEL_MESSAGE,
            JsonNodeFactory.instance.objectNode().put("text", longText), "slack", "u");

        assertThat(TaskDispatcher.titleFor(event)).hasSize(TaskDispatcher.MAX_TITLE_LENGTH);
        assertThat(TaskDispatcher.titleFor(Event.of(EventKind.CHANNEL_MESSAGE))).isEqualTo("Channel message");
    }

    @Test
    void titleFor_channelMessage_shouldNotSplitEmoji() {
        String text = "a".repeat(TaskDispatcher.MAX_TITLE_LENGTH - 1) + "\uD83C\uDFB5 more";
        Event event = Event.create(EventKind.CHANNEL_MESSAGE,
            JsonNodeFactory.instance.objectNode().put("text", text), "slack", "u");

        String title = TaskDispatcher.titleFor(event);

        assertThat(title).endsWith("a\uD83C\uDFB5");
        assertThat(title.codePointCount(0, title.length())).isEqualTo(TaskDispatcher.MAX_TITLE_LENGTH);
    }

    @Test
    void cancel_queuedTask_shouldMarkCancelledAndSignalQueue() {
        Task task = Task.create("Later", "user-1", null);
        dispatcher.dispatch(task);

        assertThat(dispatcher.cancel(task.id())).isTrue();

        assertThat(taskRepository.findById(task.id()).orElseThrow().status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(queue.isCancelled(task.id())).isTrue();
    }

    @Test
    void cancel_terminalTask_shouldBeNoOp() {
        Task task = Task.create("Done", "user-1", null);
        dispatcher.dispatch(task);
        dispatcher.cancel(task.id());

        assertThat(dispatcher.cancel(task.id())).isFalse();
    }

    @Test
    void cancel_unknownTask_shouldThrow() {
        assertThatThrownBy(() -> dispatcher.cancel("missing"))
            .isInstanceOf(NotFoundException.class);
    }
}
