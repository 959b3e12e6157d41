package com.concierge.scheduler;

/**
 * A stored job the cron engine refused to register, with the reason.
 */
public record RejectedJob(String jobId, String name, String expression, String reason) {
}
