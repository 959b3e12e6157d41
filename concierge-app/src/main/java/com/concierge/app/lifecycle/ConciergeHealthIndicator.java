package com.concierge.app.lifecycle;

import com.concierge.app.config.ConciergeProperties;
import com.concierge.core.queue.TaskQueue;
import com.concierge.engine.agent.AgentCatalog;
import com.concierge.scheduler.CronEngine;
import com.concierge.scheduler.RejectedJob;
import com.concierge.worker.WorkerPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports on:
 * <ul>
 *     <li>Worker pool and cron engine state</li>
 *     <li>Queue depth and processed deliveries</li>
 *     <li>Live and rejected cron jobs</li>
 * </ul>
 * Rejected cron jobs are listed but do not make the service unhealthy.
 */
@Component("concierge")
public class ConciergeHealthIndicator implements HealthIndicator {

    private final ConciergeLifecycle lifecycle;
    private final AgentCatalog catalog;
    private final TaskQueue taskQueue;
    private final WorkerPool workerPool;
    private final CronEngine cronEngine;
    private final ConciergeProperties properties;

    public ConciergeHealthIndicator(ConciergeLifecycle lifecycle, AgentCatalog catalog, TaskQueue taskQueue,
                                    WorkerPool workerPool, CronEngine cronEngine, ConciergeProperties properties) {
        this.lifecycle = lifecycle;
        this.catalog = catalog;
        this.taskQueue = taskQueue;
        this.workerPool = workerPool;
        this.cronEngine = cronEngine;
        this.properties = properties;
    }

    @Override
    public Health health() {
        if (!lifecycle.isStarted()) {
            return Health.outOfService().withDetail("reason", "not started").build();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        boolean healthy = true;

        details.put("agents", catalog.slugs());

        if (properties.getWorker().isEnabled()) {
            details.put("workers.running", workerPool.isRunning());
            details.put("workers.processed", workerPool.processedCount());
            healthy = workerPool.isRunning();
        }

        try {
            details.put("queue.size", taskQueue.size());
        } catch (RuntimeException e) {
            healthy = false;
            details.put("queue.error", e.getMessage());
        }

        if (properties.getCron().isEnabled()) {
            details.put("cron.running", cronEngine.isRunning());
            details.put("cron.live", cronEngine.liveJobs().size());
            Map<String, String> rejected = new LinkedHashMap<>();
            for (RejectedJob job : cronEngine.rejectedJobs()) {
                rejected.put(job.jobId(), job.reason());
            }
            details.put("cron.rejected", rejected);
            healthy = healthy && cronEngine.isRunning();
        }

        return (healthy ? Health.up() : Health.down()).withDetails(details).build();
    }
}
