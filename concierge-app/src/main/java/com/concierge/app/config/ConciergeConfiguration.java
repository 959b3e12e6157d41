package com.concierge.app.config;

import com.concierge.advisory.ArbitrationService;
import com.concierge.advisory.ArbitrationSettings;
import com.concierge.advisory.LlmArbitrationService;
import com.concierge.agents.ScheduleAgent;
import com.concierge.agents.TaskManagerAgent;
import com.concierge.app.delivery.LoggingDeliveryChannel;
import com.concierge.core.agent.Agent;
import com.concierge.core.delivery.DeliveryChannel;
import com.concierge.core.model.RetryPolicy;
import com.concierge.core.queue.TaskQueue;
import com.concierge.core.repository.EventRepository;
import com.concierge.core.repository.ScheduledJobRepository;
import com.concierge.core.repository.TaskRepository;
import com.concierge.engine.agent.AgentCatalog;
import com.concierge.engine.agent.AgentRouter;
import com.concierge.engine.agent.AgentSource;
import com.concierge.engine.bus.EventBus;
import com.concierge.engine.dispatch.DefaultDispatchHandler;
import com.concierge.engine.dispatch.EventRecorder;
import com.concierge.engine.dispatch.TaskDispatcher;
import com.concierge.engine.feedback.FeedbackManager;
import com.concierge.engine.metrics.ConciergeMetrics;
import com.concierge.engine.subscription.SubscriptionManager;
import com.concierge.scheduler.CronEngine;
import com.concierge.scheduler.ScheduleService;
import com.concierge.worker.TaskWorker;
import com.concierge.worker.WorkerPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.List;

/**
 * Wires the orchestration core: bus, catalog, routing, dispatch, workers and cron.
 *
 * Starting and stopping the background loops is left to {@code ConciergeLifecycle}.
 */
@Configuration
public class ConciergeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConciergeConfiguration.class);

    // ========== Metrics ==========

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "concierge");
    }

    @Bean
    public ConciergeMetrics conciergeMetrics(MeterRegistry meterRegistry, TaskQueue taskQueue) {
        ConciergeMetrics metrics = new ConciergeMetrics(meterRegistry);
        metrics.registerQueueSize(taskQueue::size);
        return metrics;
    }

    // ========== Events ==========

    @Bean
    public EventBus eventBus(ConciergeMetrics metrics) {
        return new EventBus(metrics);
    }

    @Bean
    public SubscriptionManager subscriptionManager() {
        return new SubscriptionManager();
    }

    @Bean
    public EventRecorder eventRecorder(EventRepository eventRepository) {
        return new EventRecorder(eventRepository);
    }

    @Bean
    public DefaultDispatchHandler defaultDispatchHandler(TaskDispatcher dispatcher, EventRepository eventRepository) {
        return new DefaultDispatchHandler(dispatcher, eventRepository);
    }

    // ========== Agents ==========

    @Bean
    public ScheduleAgent scheduleAgent(ScheduleService scheduleService) {
        return new ScheduleAgent(scheduleService);
    }

    @Bean
    public TaskManagerAgent taskManagerAgent(TaskRepository taskRepository, TaskDispatcher dispatcher) {
        return new TaskManagerAgent(taskRepository, dispatcher);
    }

    /**
     * Every {@link Agent} bean in the context, built-in or contributed.
     */
    @Bean
    public AgentSource contextAgents(List<Agent> agents) {
        return () -> agents;
    }

    @Bean
    public AgentCatalog agentCatalog(List<AgentSource> sources) {
        return new AgentCatalog(sources);
    }

    @Bean
    public ArbitrationService arbitrationService(ConciergeProperties properties, ObjectMapper objectMapper) {
        ConciergeProperties.Arbitration arbitration = properties.getArbitration();
        if (!arbitration.isEnabled()) {
            return ArbitrationService.none();
        }
        ArbitrationSettings settings = new ArbitrationSettings(
            arbitration.getBaseUrl(),
            arbitration.getApiKey(),
            arbitration.getModel(),
            arbitration.getTimeout()
        );
        if (!settings.isConfigured()) {
            log.warn("Arbitration enabled without an API key; routing falls back to keywords only");
        }
        return new LlmArbitrationService(settings, objectMapper);
    }

    @Bean
    public AgentRouter agentRouter(AgentCatalog catalog, ArbitrationService arbitrationService) {
        return new AgentRouter(catalog, arbitrationService);
    }

    // ========== Dispatch & Execution ==========

    @Bean
    public TaskDispatcher taskDispatcher(TaskRepository taskRepository, TaskQueue taskQueue, ConciergeMetrics metrics) {
        return new TaskDispatcher(taskRepository, taskQueue, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryChannel deliveryChannel() {
        return new LoggingDeliveryChannel();
    }

    @Bean
    public FeedbackManager feedbackManager(DeliveryChannel deliveryChannel, ConciergeMetrics metrics) {
        return new FeedbackManager(deliveryChannel, metrics);
    }

    /**
     * Fixed at {@link RetryPolicy#MAX_RETRIES} retries with base-{@link RetryPolicy#BACKOFF_BASE_SECONDS} backoff.
     */
    @Bean
    public RetryPolicy retryPolicy() {
        return RetryPolicy.defaultPolicy();
    }

    @Bean
    public TaskWorker taskWorker(TaskRepository taskRepository, EventRepository eventRepository, TaskQueue taskQueue,
                                 AgentCatalog catalog, AgentRouter router, EventBus eventBus,
                                 FeedbackManager feedback, RetryPolicy retryPolicy, ConciergeMetrics metrics) {
        return TaskWorker.builder()
            .taskRepository(taskRepository)
            .eventRepository(eventRepository)
            .taskQueue(taskQueue)
            .catalog(catalog)
            .router(router)
            .eventBus(eventBus)
            .feedback(feedback)
            .retryPolicy(retryPolicy)
            .metrics(metrics)
            .clock(Clock.systemUTC())
            .build();
    }

    @Bean
    public WorkerPool workerPool(TaskQueue taskQueue, TaskWorker taskWorker, ConciergeProperties properties) {
        ConciergeProperties.Worker worker = properties.getWorker();
        return new WorkerPool(taskQueue, taskWorker, worker.getThreads(),
            worker.getPollInterval(), worker.getVisibilityTimeout(), worker.getShutdownTimeout());
    }

    // ========== Cron ==========

    @Bean
    public ThreadPoolTaskScheduler cronTaskScheduler(ConciergeProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getCron().getPoolSize());
        scheduler.setThreadNamePrefix("concierge-cron-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public CronEngine cronEngine(ScheduledJobRepository jobRepository, EventBus eventBus,
                                 ThreadPoolTaskScheduler cronTaskScheduler, ConciergeMetrics metrics,
                                 ConciergeProperties properties) {
        return new CronEngine(jobRepository, eventBus, cronTaskScheduler, metrics,
            Clock.systemUTC(), properties.getCron().getSyncInterval());
    }

    @Bean
    public ScheduleService scheduleService(ScheduledJobRepository jobRepository, CronEngine cronEngine) {
        return new ScheduleService(jobRepository, cronEngine);
    }
}
