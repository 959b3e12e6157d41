package com.concierge.engine.persistence;

import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.repository.TaskRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRepository.
 * For single-process deployments and tests.
 */
@Repository
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findByUser(String userId, int limit) {
        return tasks.values().stream()
            .filter(t -> t.userId().equals(userId))
            .sorted(Comparator.comparing(Task::createdAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<Task> findByStatus(TaskStatus status, int limit) {
        return tasks.values().stream()
            .filter(t -> t.status() == status)
            .sorted(Comparator.comparing(Task::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean compareAndSet(Task updated, Set<TaskStatus> expectedStatuses) {
        AtomicBoolean applied = new AtomicBoolean(false);
        tasks.computeIfPresent(updated.id(), (id, current) -> {
            if (current.isTerminal() || !expectedStatuses.contains(current.status())) {
                return current;
            }
            applied.set(true);
            return updated.toBuilder().queueHandle(current.queueHandle()).build();
        });
        return applied.get();
    }

    @Override
    public boolean recordQueueHandle(String taskId, String queueHandle) {
        return tasks.computeIfPresent(taskId,
            (id, current) -> current.toBuilder().queueHandle(queueHandle).build()) != null;
    }

    @Override
    public boolean delete(String taskId) {
        return tasks.remove(taskId) != null;
    }
}
