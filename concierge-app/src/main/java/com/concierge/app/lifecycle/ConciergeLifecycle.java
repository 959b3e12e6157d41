package com.concierge.app.lifecycle;

import com.concierge.app.config.ConciergeProperties;
import com.concierge.core.model.EventKind;
import com.concierge.engine.agent.AgentCatalog;
import com.concierge.engine.bus.EventBus;
import com.concierge.engine.dispatch.DefaultDispatchHandler;
import com.concierge.engine.dispatch.EventRecorder;
import com.concierge.engine.subscription.SubscriptionManager;
import com.concierge.scheduler.CronEngine;
import com.concierge.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Brings the core up once the context is ready and down before it closes.
 *
 * Startup order:
 * 1. Load the agent catalog
 * 2. Subscribe the event recorder, then the dispatch handler, as catch-all bus handlers
 * 3. Route task lifecycle events to the subscription manager
 * 4. Start cron reconciliation and the worker pool
 *
 * Shutdown stops the workers first (in-flight deliveries finish or are redelivered later),
 * then the cron engine.
 */
@Component
public class ConciergeLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ConciergeLifecycle.class);

    private final AgentCatalog catalog;
    private final EventBus eventBus;
    private final EventRecorder eventRecorder;
    private final DefaultDispatchHandler dispatchHandler;
    private final SubscriptionManager subscriptions;
    private final CronEngine cronEngine;
    private final WorkerPool workerPool;
    private final ConciergeProperties properties;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public ConciergeLifecycle(AgentCatalog catalog, EventBus eventBus, EventRecorder eventRecorder,
                              DefaultDispatchHandler dispatchHandler, SubscriptionManager subscriptions,
                              CronEngine cronEngine, WorkerPool workerPool, ConciergeProperties properties) {
        this.catalog = catalog;
        this.eventBus = eventBus;
        this.eventRecorder = eventRecorder;
        this.dispatchHandler = dispatchHandler;
        this.subscriptions = subscriptions;
        this.cronEngine = cronEngine;
        this.workerPool = workerPool;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        catalog.load();
        log.info("Loaded {} agents: {}", catalog.list().size(), catalog.slugs());

        eventBus.subscribeAny(eventRecorder);
        eventBus.subscribeAny(dispatchHandler);
        eventBus.subscribe(subscriptions::notify, EventKind.TASK_COMPLETE, EventKind.TASK_FAILED);

        if (properties.getCron().isEnabled()) {
            cronEngine.start();
        } else {
            log.info("Cron engine disabled");
        }

        if (properties.getWorker().isEnabled()) {
            workerPool.start();
        } else {
            log.info("Worker pool disabled");
        }

        log.info("Concierge started with {} persistence", properties.getPersistence());
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping concierge");
        workerPool.stop();
        cronEngine.stop();
        log.info("Concierge stopped");
    }

    public boolean isStarted() {
        return started.get();
    }
}
