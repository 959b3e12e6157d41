package com.concierge.engine.persistence;

import com.concierge.core.queue.QueueDelivery;
import com.concierge.core.queue.TaskDescriptor;
import com.concierge.core.queue.TaskQueue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TaskQueue with delayed delivery and visibility timeouts.
 *
 * An entry is deliverable once its availability time has passed. Polling pushes the
 * availability time forward by the visibility timeout, so an unacknowledged entry
 * comes back after the timeout, just as it would from a broker.
 */
public class InMemoryTaskQueue implements TaskQueue {

    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    public InMemoryTaskQueue() {
        this(Clock.systemUTC());
    }

    public InMemoryTaskQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized String enqueue(TaskDescriptor descriptor, Duration delay) {
        String handle = UUID.randomUUID().toString();
        entries.put(handle, new Entry(descriptor, clock.instant().plus(delay), 0));
        return handle;
    }

    @Override
    public synchronized List<QueueDelivery> poll(int maxItems, Duration visibilityTimeout) {
        Instant now = clock.instant();
        List<Map.Entry<String, Entry>> ready = entries.entrySet().stream()
            .filter(e -> !e.getValue().availableAt().isAfter(now))
            .sorted(Comparator.comparing(e -> e.getValue().availableAt()))
            .limit(maxItems)
            .toList();

        List<QueueDelivery> deliveries = new ArrayList<>(ready.size());
        for (Map.Entry<String, Entry> e : ready) {
            Entry claimed = new Entry(
                e.getValue().descriptor(), now.plus(visibilityTimeout), e.getValue().deliveryCount() + 1);
            entries.put(e.getKey(), claimed);
            deliveries.add(new QueueDelivery(e.getKey(), claimed.descriptor(), claimed.deliveryCount()));
        }
        return deliveries;
    }

    @Override
    public synchronized void acknowledge(String handle) {
        entries.remove(handle);
    }

    @Override
    public boolean cancel(String taskId) {
        return cancelled.add(taskId);
    }

    @Override
    public boolean isCancelled(String taskId) {
        return cancelled.contains(taskId);
    }

    @Override
    public void clearCancellation(String taskId) {
        cancelled.remove(taskId);
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    private record Entry(TaskDescriptor descriptor, Instant availableAt, int deliveryCount) {
    }
}
