package com.concierge.agents;

import com.concierge.core.agent.AgentResult;
import com.concierge.core.exception.DuplicateScheduleException;
import com.concierge.core.exception.InvalidCronExpressionException;
import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.ErrorKind;
import com.concierge.core.model.ScheduledJob;
import com.concierge.core.model.Task;
import com.concierge.scheduler.ScheduleRequest;
import com.concierge.scheduler.ScheduleService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lets users create, delete and list their own cron schedules from a message.
 *
 * Input fields:
 * <ul>
 *   <li>{@code action}: {@code list} (default), {@code create} or {@code delete}</li>
 *   <li>create: {@code expression}, {@code task_name}, optional {@code agent_slug},
 *       {@code task_payload}, {@code description}, and {@code next_run_at} for {@code @once}</li>
 *   <li>delete: {@code cron_id} or {@code task_name}</li>
 * </ul>
 */
public class ScheduleAgent extends ActionAgent {

    public static final String SLUG = "cron";

    private static final List<String> ACTIONS = List.of("list", "create", "delete");

    private final ScheduleService scheduleService;

    public ScheduleAgent(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @Override
    public String slug() {
        return SLUG;
    }

    @Override
    public String name() {
        return "Cron Manager";
    }

    @Override
    public String description() {
        return "Create, delete, and list cron scheduled tasks.";
    }

    @Override
    public List<String> capabilities() {
        return List.of("cron", "schedule", "recurring", "scheduled task");
    }

    @Override
    protected List<String> actions() {
        return ACTIONS;
    }

    @Override
    protected AgentResult perform(String action, Task task) {
        return switch (action) {
            case "create" -> create(task);
            case "delete" -> delete(task);
            default -> list(task);
        };
    }

    private AgentResult create(Task task) {
        String expression = firstText(task, "expression", "cron_expression");
        String name = firstText(task, "task_name", "name");
        if (expression == null || name == null) {
            return AgentResult.permanentFailure("Both 'expression' and 'task_name' are required");
        }

        ScheduleRequest.Builder request = ScheduleRequest.builder()
            .name(name)
            .cronExpression(expression)
            .agentSlug(firstText(task, "agent_slug"))
            .description(firstText(task, "description"));

        JsonNode payload = task.inputData().get("task_payload");
        if (payload != null && payload.isObject()) {
            request.taskPayload(payload);
        }

        String nextRunAt = firstText(task, "next_run_at");
        if (nextRunAt != null) {
            try {
                request.nextRunAt(Instant.parse(nextRunAt));
            } catch (DateTimeParseException e) {
                return AgentResult.permanentFailure("next_run_at is not an ISO-8601 instant: " + nextRunAt);
            }
        }

        ScheduledJob job;
        try {
            job = scheduleService.create(task.userId(), request.build());
        } catch (InvalidCronExpressionException e) {
            return AgentResult.failure(ErrorKind.MALFORMED_SCHEDULE, e.getMessage());
        } catch (DuplicateScheduleException e) {
            return AgentResult.failure(ErrorKind.DUPLICATE_SCHEDULE,
                "A schedule named '" + name + "' already exists");
        } catch (IllegalArgumentException e) {
            return AgentResult.permanentFailure(e.getMessage());
        }

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put("created", true);
        output.put("cron_id", job.id());
        output.put("task_name", job.name());
        output.put("expression", job.cronExpression());
        output.put("next_run_at", instantText(job.nextRunAt()));
        output.put("summary", "Scheduled '" + job.name() + "': " + ScheduleService.describe(job) + ".");
        return AgentResult.success(output);
    }

    private AgentResult delete(Task task) {
        String id = firstText(task, "cron_id", "job_id");
        String name = firstText(task, "task_name", "name");
        if (id == null && name == null) {
            return AgentResult.permanentFailure("Either 'cron_id' or 'task_name' is required");
        }

        ScheduledJob job;
        try {
            job = id != null
                ? scheduleService.get(task.userId(), id)
                : scheduleService.getByName(task.userId(), name);
            scheduleService.delete(task.userId(), job.id());
        } catch (NotFoundException e) {
            return AgentResult.permanentFailure("No schedule found: " + (id != null ? id : name));
        }

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put("deleted", true);
        output.put("cron_id", job.id());
        output.put("summary", "Deleted schedule '" + job.name() + "'.");
        return AgentResult.success(output);
    }

    private AgentResult list(Task task) {
        List<ScheduledJob> jobs = scheduleService.list(task.userId());

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        ArrayNode crons = output.putArray("crons");
        for (ScheduledJob job : jobs) {
            crons.addObject()
                .put("id", job.id())
                .put("name", job.name())
                .put("expression", job.cronExpression())
                .put("description", ScheduleService.describe(job))
                .put("agent_slug", job.agentSlug())
                .put("enabled", job.enabled())
                .put("next_run_at", instantText(job.nextRunAt()))
                .put("last_run_at", instantText(job.lastRunAt()));
        }

        if (jobs.isEmpty()) {
            output.put("summary", "You have no scheduled jobs.");
        } else {
            output.put("summary", "You have " + jobs.size() + " scheduled job(s):\n" + jobs.stream()
                .map(job -> "- " + job.name() + ": " + ScheduleService.describe(job)
                    + (job.enabled() ? "" : " (disabled)"))
                .collect(Collectors.joining("\n")));
        }
        return AgentResult.success(output);
    }

    private static String instantText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
