package com.concierge.app.rest;

import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.repository.TaskRepository;
import com.concierge.engine.dispatch.TaskDispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for the caller's tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final int MAX_LIMIT = 200;

    private final TaskRepository taskRepository;
    private final TaskDispatcher dispatcher;

    public TaskController(TaskRepository taskRepository, TaskDispatcher dispatcher) {
        this.taskRepository = taskRepository;
        this.dispatcher = dispatcher;
    }

    /**
     * List the caller's tasks, newest first.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "50") int limit) {

        TaskStatus filter = status != null ? TaskStatus.fromWireValue(status) : null;
        int capped = Math.max(1, Math.min(limit, MAX_LIMIT));

        List<TaskResponse> responses = taskRepository.findByUser(ApiHeaders.userOrDefault(userId), MAX_LIMIT).stream()
            .filter(task -> filter == null || task.status() == filter)
            .limit(capped)
            .map(TaskResponse::from)
            .toList();

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @PathVariable String taskId) {

        return ResponseEntity.ok(TaskResponse.from(owned(userId, taskId)));
    }

    /**
     * Cancel a task. Answers {@code cancelled=false} when it had already finished.
     */
    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelTask(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @PathVariable String taskId) {

        owned(userId, taskId);
        boolean cancelled = dispatcher.cancel(taskId);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    private Task owned(String userId, String taskId) {
        return taskRepository.findById(taskId)
            .filter(task -> task.userId().equals(ApiHeaders.userOrDefault(userId)))
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    // ========== DTOs ==========

    public record TaskResponse(
        String id,
        String title,
        String status,
        String agentSlug,
        String sourceChannel,
        int retryCount,
        String error,
        JsonNode inputData,
        JsonNode outputData,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static TaskResponse from(Task task) {
            return new TaskResponse(
                task.id(),
                task.title(),
                task.status().wireValue(),
                task.agentSlug(),
                task.sourceChannel(),
                task.retryCount(),
                task.error(),
                task.inputData(),
                task.outputData(),
                task.createdAt(),
                task.updatedAt()
            );
        }
    }
}
