package com.concierge.scheduler;

import java.time.Instant;

/**
 * Snapshot of a trigger currently registered with the cron engine.
 *
 * @param nextRunAt next fire time at the moment of the snapshot, null if none
 * @param persistent false for triggers added programmatically rather than synced from the store
 */
public record LiveJob(
    String jobId,
    String name,
    String expression,
    String description,
    String agentSlug,
    Instant nextRunAt,
    boolean persistent
) {
}
