package com.concierge.agents;

import com.concierge.core.agent.AgentResult;
import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.repository.TaskRepository;
import com.concierge.engine.dispatch.TaskDispatcher;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lets users inspect and control their own tasks.
 *
 * Input fields:
 * <ul>
 *   <li>{@code action}: {@code list} (default), {@code cancel} or {@code retry}</li>
 *   <li>list: optional {@code status} filter and {@code limit}</li>
 *   <li>cancel / retry: {@code task_id}</li>
 * </ul>
 *
 * Retrying dispatches a fresh task with the same input and agent; the failed
 * task keeps its terminal state.
 */
public class TaskManagerAgent extends ActionAgent {

    public static final String SLUG = "task-manager";

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private static final List<String> ACTIONS = List.of("list", "cancel", "retry");
    private static final Set<TaskStatus> RETRYABLE = EnumSet.of(TaskStatus.FAILURE, TaskStatus.CANCELLED);

    private final TaskRepository taskRepository;
    private final TaskDispatcher dispatcher;

    public TaskManagerAgent(TaskRepository taskRepository, TaskDispatcher dispatcher) {
        this.taskRepository = taskRepository;
        this.dispatcher = dispatcher;
    }

    @Override
    public String slug() {
        return SLUG;
    }

    @Override
    public String name() {
        return "Task Manager";
    }

    @Override
    public String description() {
        return "List, cancel, and retry tasks.";
    }

    @Override
    public List<String> capabilities() {
        return List.of("task", "cancel task", "retry task", "list tasks");
    }

    @Override
    protected List<String> actions() {
        return ACTIONS;
    }

    @Override
    protected AgentResult perform(String action, Task task) {
        return switch (action) {
            case "cancel" -> cancel(task);
            case "retry" -> retry(task);
            default -> list(task);
        };
    }

    private AgentResult list(Task task) {
        TaskStatus filter = null;
        String status = firstText(task, "status");
        if (status != null) {
            try {
                filter = TaskStatus.fromWireValue(status.toLowerCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return AgentResult.permanentFailure(e.getMessage());
            }
        }

        int limit = Math.max(1, Math.min(task.inputData().path("limit").asInt(DEFAULT_LIMIT), MAX_LIMIT));
        TaskStatus wanted = filter;
        List<Task> tasks = taskRepository.findByUser(task.userId(), filter == null ? limit : MAX_LIMIT).stream()
            .filter(t -> !t.id().equals(task.id()))
            .filter(t -> wanted == null || t.status() == wanted)
            .limit(limit)
            .toList();

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        ArrayNode items = output.putArray("tasks");
        for (Task t : tasks) {
            items.addObject()
                .put("id", t.id())
                .put("title", t.title())
                .put("status", t.status().wireValue())
                .put("agent_slug", t.agentSlug())
                .put("retry_count", t.retryCount())
                .put("error", t.error())
                .put("created_at", t.createdAt().toString());
        }

        if (tasks.isEmpty()) {
            output.put("summary", "No tasks found.");
        } else {
            output.put("summary", tasks.stream()
                .map(t -> "- [" + t.status().wireValue() + "] " + t.title())
                .collect(Collectors.joining("\n")));
        }
        return AgentResult.success(output);
    }

    private AgentResult cancel(Task task) {
        String targetId = firstText(task, "task_id");
        if (targetId == null) {
            return AgentResult.permanentFailure("'task_id' is required");
        }
        if (targetId.equals(task.id())) {
            return AgentResult.permanentFailure("A task cannot cancel itself");
        }

        Task target;
        boolean cancelled;
        try {
            target = ownedTask(task.userId(), targetId);
            cancelled = dispatcher.cancel(targetId);
        } catch (NotFoundException e) {
            return AgentResult.permanentFailure("No task found: " + targetId);
        }

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put("cancelled", cancelled);
        output.put("task_id", targetId);
        if (cancelled) {
            output.put("summary", "Cancelled task '" + target.title() + "'.");
        } else {
            String finalStatus = taskRepository.findById(targetId).map(t -> t.status().wireValue()).orElse("unknown");
            output.put("summary", "Task '" + target.title() + "' already finished (" + finalStatus + ").");
        }
        return AgentResult.success(output);
    }

    private AgentResult retry(Task task) {
        String targetId = firstText(task, "task_id");
        if (targetId == null) {
            return AgentResult.permanentFailure("'task_id' is required");
        }

        Task original;
        try {
            original = ownedTask(task.userId(), targetId);
        } catch (NotFoundException e) {
            return AgentResult.permanentFailure("No task found: " + targetId);
        }
        if (!RETRYABLE.contains(original.status())) {
            return AgentResult.permanentFailure(
                "Only failed or cancelled tasks can be retried; task is " + original.status().wireValue());
        }

        Task copy = Task.create(original.title(), original.userId(), original.inputData())
            .toBuilder()
            .agentSlug(original.agentSlug())
            .sourceChannel(original.sourceChannel())
            .build();
        dispatcher.dispatch(copy);

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put("retried", true);
        output.put("task_id", copy.id());
        output.put("original_task_id", original.id());
        output.put("summary", "Retrying '" + original.title() + "' as a new task.");
        return AgentResult.success(output);
    }

    private Task ownedTask(String userId, String taskId) {
        return taskRepository.findById(taskId)
            .filter(t -> t.userId().equals(userId))
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }
}
