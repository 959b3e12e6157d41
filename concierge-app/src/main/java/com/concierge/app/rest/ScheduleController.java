package com.concierge.app.rest;

import com.concierge.core.model.ScheduledJob;
import com.concierge.scheduler.CronEngine;
import com.concierge.scheduler.LiveJob;
import com.concierge.scheduler.RejectedJob;
import com.concierge.scheduler.ScheduleRequest;
import com.concierge.scheduler.ScheduleService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST API for the caller's cron schedules.
 */
@RestController
@RequestMapping("/api/v1/schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final CronEngine cronEngine;

    public ScheduleController(ScheduleService scheduleService, CronEngine cronEngine) {
        this.scheduleService = scheduleService;
        this.cronEngine = cronEngine;
    }

    @GetMapping
    public ResponseEntity<List<ScheduleResponse>> listSchedules(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {

        return ResponseEntity.ok(scheduleService.list(ApiHeaders.userOrDefault(userId)).stream()
            .map(ScheduleResponse::from)
            .toList());
    }

    @PostMapping
    public ResponseEntity<ScheduleResponse> createSchedule(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @RequestBody ScheduleBody body) {

        ScheduledJob job = scheduleService.create(ApiHeaders.userOrDefault(userId), body.toRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleResponse.from(job));
    }

    @GetMapping("/{scheduleId}")
    public ResponseEntity<ScheduleResponse> getSchedule(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @PathVariable String scheduleId) {

        return ResponseEntity.ok(ScheduleResponse.from(
            scheduleService.get(ApiHeaders.userOrDefault(userId), scheduleId)));
    }

    /**
     * Partial update: absent fields keep their stored values.
     */
    @PatchMapping("/{scheduleId}")
    public ResponseEntity<ScheduleResponse> updateSchedule(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @PathVariable String scheduleId,
            @RequestBody ScheduleBody body) {

        ScheduledJob job = scheduleService.update(ApiHeaders.userOrDefault(userId), scheduleId, body.toRequest());
        return ResponseEntity.ok(ScheduleResponse.from(job));
    }

    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<Void> deleteSchedule(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @PathVariable String scheduleId) {

        scheduleService.delete(ApiHeaders.userOrDefault(userId), scheduleId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Cron engine view across all users: live triggers and rejected rows.
     */
    @GetMapping("/engine")
    public ResponseEntity<EngineStatus> engineStatus() {
        return ResponseEntity.ok(new EngineStatus(
            cronEngine.isRunning(), cronEngine.liveJobs(), cronEngine.rejectedJobs()));
    }

    // ========== DTOs ==========

    public record ScheduleBody(
        String name,
        String description,
        String cronExpression,
        String agentSlug,
        JsonNode taskPayload,
        Boolean enabled,
        Instant nextRunAt
    ) {
        ScheduleRequest toRequest() {
            return new ScheduleRequest(name, description, cronExpression, agentSlug, taskPayload, enabled, nextRunAt);
        }
    }

    public record ScheduleResponse(
        String id,
        String userId,
        String name,
        String description,
        String cronExpression,
        String cronHuman,
        String agentSlug,
        JsonNode taskPayload,
        boolean enabled,
        Instant lastRunAt,
        Instant nextRunAt,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static ScheduleResponse from(ScheduledJob job) {
            return new ScheduleResponse(
                job.id(),
                job.userId(),
                job.name(),
                job.description(),
                job.cronExpression(),
                ScheduleService.describe(job),
                job.agentSlug(),
                job.taskPayload(),
                job.enabled(),
                job.lastRunAt(),
                job.nextRunAt(),
                job.createdAt(),
                job.updatedAt()
            );
        }
    }

    public record EngineStatus(
        boolean running,
        List<LiveJob> live,
        List<RejectedJob> rejected
    ) {}
}
