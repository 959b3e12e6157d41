package com.concierge.scheduler;

import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.core.model.ScheduledJob;
import com.concierge.engine.bus.EventBus;
import com.concierge.engine.metrics.ConciergeMetrics;
import com.concierge.engine.persistence.InMemoryScheduledJobRepository;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CronEngineTest {

    // Friday
    private static final Instant NOW = Instant.parse("2024-01-05T10:00:00Z");

    private InMemoryScheduledJobRepository jobRepository;
    private ConciergeMetrics metrics;
    private EventBus eventBus;
    private ThreadPoolTaskScheduler taskScheduler;
    private CronEngine engine;
    private List<Event> published;

    @BeforeEach
    void setUp() {
        jobRepository = new InMemoryScheduledJobRepository();
        metrics = ConciergeMetrics.standalone();
        eventBus = new EventBus(metrics);
        published = new CopyOnWriteArrayList<>();
        eventBus.subscribe(EventKind.CRON, published::add);

        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.setThreadNamePrefix("cron-test-");
        taskScheduler.initialize();

        engine = new CronEngine(jobRepository, eventBus, taskScheduler, metrics,
            Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        engine.stop();
        taskScheduler.shutdown();
    }

    @Test
    @DisplayName("Registering the same expression twice keeps a single trigger")
    void add_sameExpressionTwice_shouldKeepOneTrigger() {
        assertThat(engine.add("job-1", "*/5 * * * *", "user-1", "echo", null)).isTrue();
        assertThat(engine.add("job-1", "*/5 * * * *", "user-1", "echo", null)).isFalse();

        assertThat(engine.liveJobs()).hasSize(1);
        assertThat(engine.liveJobs().get(0).nextRunAt()).isEqualTo(Instant.parse("2024-01-05T10:05:00Z"));
        assertThat(metrics.registry().get(ConciergeMetrics.CRON_LIVE_TRIGGERS).gauge().value()).isEqualTo(1.0);
    }

    @Test
    void add_withChangedExpression_shouldReplaceTrigger() {
        engine.add("job-1", "*/5 * * * *", "user-1", "echo", null);

        assertThat(engine.add("job-1", "0 9 * * 1-5", "user-1", "echo", null)).isTrue();

        assertThat(engine.liveJobs()).singleElement()
            .satisfies(live -> {
                assertThat(live.expression()).isEqualTo("0 9 * * 1-5");
                assertThat(live.description()).isEqualTo("Weekdays at 9:00 UTC");
                assertThat(live.nextRunAt()).isEqualTo(Instant.parse("2024-01-08T09:00:00Z"));
            });
    }

    @Test
    @DisplayName("Sync registers enabled jobs, stores their next run and rejects malformed ones")
    void syncFromStore_shouldRegisterValidAndRejectMalformed() {
        ScheduledJob good = ScheduledJob.create("user-1", "standup", "0 9 * * 1-5", "echo", null);
        ScheduledJob bad = ScheduledJob.create("user-1", "broken", "0 25 * * *", "echo", null);
        ScheduledJob off = ScheduledJob.create("user-1", "paused", "0 8 * * *", "echo", null).withEnabled(false);
        jobRepository.save(good);
        jobRepository.save(bad);
        jobRepository.save(off);

        engine.syncFromStore();

        assertThat(engine.liveJobs()).extracting(LiveJob::jobId).containsExactly(good.id());
        assertThat(engine.rejectedJobs()).singleElement()
            .satisfies(rejected -> {
                assertThat(rejected.jobId()).isEqualTo(bad.id());
                assertThat(rejected.reason()).contains("hour");
            });
        assertThat(jobRepository.findById(good.id()).orElseThrow().nextRunAt())
            .isEqualTo(Instant.parse("2024-01-08T09:00:00Z"));
        assertThat(metrics.registry().get(ConciergeMetrics.CRON_REJECTED).counter().count()).isEqualTo(1.0);

        // a repeat sync neither re-registers nor re-counts
        engine.syncFromStore();
        assertThat(engine.liveJobs()).hasSize(1);
        assertThat(metrics.registry().get(ConciergeMetrics.CRON_REJECTED).counter().count()).isEqualTo(1.0);
    }

    @Test
    void syncFromStore_shouldDropDisabledAndDeletedJobs() {
        ScheduledJob first = ScheduledJob.create("user-1", "a", "0 9 * * *", null, null);
        ScheduledJob second = ScheduledJob.create("user-1", "b", "0 10 * * *", null, null);
        jobRepository.save(first);
        jobRepository.save(second);
        engine.add("adhoc", "*/5 * * * *", "user-1", null, null);
        engine.syncFromStore();
        assertThat(engine.liveJobs()).hasSize(3);

        jobRepository.update(first.withEnabled(false));
        jobRepository.delete(second.id());
        engine.syncFromStore();

        assertThat(engine.liveJobs()).extracting(LiveJob::jobId).containsExactly("adhoc");
    }

    @Test
    void syncFromStore_withChangedExpression_shouldReschedule() {
        ScheduledJob job = ScheduledJob.create("user-1", "report", "0 9 * * *", null, null);
        jobRepository.save(job);
        engine.syncFromStore();

        jobRepository.update(job.withExpression("0 18 * * *"));
        engine.syncFromStore();

        assertThat(engine.liveJobs()).singleElement()
            .extracting(LiveJob::nextRunAt)
            .isEqualTo(Instant.parse("2024-01-05T18:00:00Z"));
    }

    @Test
    @DisplayName("A firing publishes a CRON event carrying the job payload and records the run")
    void fire_shouldPublishCronEventAndRecordRun() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("text", "summarize my inbox");
        ScheduledJob job = ScheduledJob.create("user-7", "inbox digest", "0 9 * * 1-5", "email", payload);
        jobRepository.save(job);
        engine.syncFromStore();

        engine.fire(job.id());

        assertThat(published).singleElement().satisfies(event -> {
            assertThat(event.kind()).isEqualTo(EventKind.CRON);
            assertThat(event.sourceChannel()).isEqualTo(CronEngine.CRON_CHANNEL);
            assertThat(event.userId()).isEqualTo("user-7");
            assertThat(event.payloadText("task_name")).isEqualTo("inbox digest");
            assertThat(event.payloadText("job_id")).isEqualTo(job.id());
            assertThat(event.payloadText("agent_slug")).isEqualTo("email");
            assertThat(event.payloadText("text")).isEqualTo("summarize my inbox");
        });

        ScheduledJob stored = jobRepository.findById(job.id()).orElseThrow();
        assertThat(stored.lastRunAt()).isEqualTo(NOW);
        assertThat(stored.nextRunAt()).isEqualTo(Instant.parse("2024-01-08T09:00:00Z"));
        assertThat(metrics.registry().get(ConciergeMetrics.CRON_FIRINGS).counter().count()).isEqualTo(1.0);
    }

    @Test
    void fire_forAddedTrigger_shouldOmitTaskName() {
        engine.add("adhoc", "0 9 * * *", "user-1", "echo", null);

        engine.fire("adhoc");

        assertThat(published).singleElement().satisfies(event -> {
            assertThat(event.payload().has("task_name")).isFalse();
            assertThat(event.payloadText("job_id")).isEqualTo("adhoc");
        });
    }

    @Test
    @DisplayName("A one-shot job fires once at its time and is then disabled")
    void onceJob_shouldFireAndDisable() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        eventBus.subscribe(EventKind.CRON, event -> fired.countDown());
        CronEngine realTime = new CronEngine(jobRepository, eventBus, taskScheduler, ConciergeMetrics.standalone());

        ScheduledJob job = ScheduledJob.once("user-1", "reminder", Instant.now().plusMillis(200), "echo", null);
        jobRepository.save(job);
        realTime.start();

        try {
            assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();

            long deadline = System.currentTimeMillis() + 5_000;
            while (jobRepository.findById(job.id()).orElseThrow().enabled() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            ScheduledJob stored = jobRepository.findById(job.id()).orElseThrow();
            assertThat(stored.enabled()).isFalse();
            assertThat(stored.lastRunAt()).isNotNull();
            assertThat(stored.nextRunAt()).isNull();
            assertThat(realTime.isLive(job.id())).isFalse();
        } finally {
            realTime.stop();
        }
    }

    @Test
    void startAndStop_shouldManageTriggers() {
        jobRepository.save(ScheduledJob.create("user-1", "a", "0 9 * * *", null, null));

        engine.start();
        engine.start();
        assertThat(engine.isRunning()).isTrue();
        assertThat(engine.liveJobs()).hasSize(1);

        engine.stop();
        assertThat(engine.isRunning()).isFalse();
        assertThat(engine.liveJobs()).isEmpty();
    }
}
