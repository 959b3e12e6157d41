package com.concierge.engine.persistence.jdbc;

import com.concierge.core.exception.DuplicateScheduleException;
import com.concierge.core.model.Event;
import com.concierge.core.model.EventKind;
import com.concierge.core.model.ScheduledJob;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.queue.QueueDelivery;
import com.concierge.core.queue.TaskDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Repository and queue behavior against a real PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcPersistenceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("concierge_test")
        .withUsername("test")
        .withPassword("test");

    private JdbcTemplate jdbcTemplate;
    private JdbcTaskRepository taskRepository;
    private JdbcEventRepository eventRepository;
    private JdbcScheduledJobRepository jobRepository;
    private JdbcTaskQueue queue;

    @BeforeAll
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/concierge-schema.sql")).execute(dataSource);

        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        jdbcTemplate = new JdbcTemplate(dataSource);
        taskRepository = new JdbcTaskRepository(jdbcTemplate, objectMapper);
        eventRepository = new JdbcEventRepository(jdbcTemplate, objectMapper);
        jobRepository = new JdbcScheduledJobRepository(jdbcTemplate, objectMapper);
        queue = new JdbcTaskQueue(jdbcTemplate, objectMapper);
    }

    // ========== Tasks ==========

    @Test
    @DisplayName("Task round-trips with its JSON input")
    void testTaskSaveAndFind() {
        Task task = Task.create("Check email", "jdbc-user",
                JsonNodeFactory.instance.objectNode().put("text", "any unread?"))
            .toBuilder().sourceChannel("slack").build();

        taskRepository.save(task);

        Task stored = taskRepository.findById(task.id()).orElseThrow();
        assertThat(stored.title()).isEqualTo("Check email");
        assertThat(stored.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(stored.inputText("text")).isEqualTo("any unread?");
        assertThat(stored.sourceChannel()).isEqualTo("slack");
    }

    @Test
    @DisplayName("Conditional update applies only from the expected status and never after terminal")
    void testTaskCompareAndSet() {
        Task task = Task.create("t", "jdbc-user", null);
        taskRepository.save(task);

        assertThat(taskRepository.compareAndSet(task.withRunning(), Set.of(TaskStatus.QUEUED))).isFalse();
        assertThat(taskRepository.compareAndSet(task.withStatus(TaskStatus.QUEUED), Set.of(TaskStatus.PENDING)))
            .isTrue();
        assertThat(taskRepository.compareAndSet(task.withCancelled(), Set.of(TaskStatus.QUEUED))).isTrue();
        assertThat(taskRepository.compareAndSet(
            task.withSuccess(JsonNodeFactory.instance.objectNode()), Set.of(TaskStatus.CANCELLED))).isFalse();

        assertThat(taskRepository.findById(task.id()).orElseThrow().status()).isEqualTo(TaskStatus.CANCELLED);
    }

    @Test
    void testRecordQueueHandle() {
        Task task = Task.create("t", "jdbc-user", null);
        taskRepository.save(task);

        assertThat(taskRepository.recordQueueHandle(task.id(), "h-1")).isTrue();
        assertThat(taskRepository.recordQueueHandle("missing", "h-2")).isFalse();
        assertThat(taskRepository.findById(task.id()).orElseThrow().queueHandle()).isEqualTo("h-1");
    }

    // ========== Events ==========

    @Test
    void testEventLifecycle() {
        Event event = Event.create(EventKind.WEBHOOK,
            JsonNodeFactory.instance.objectNode().put("source", "github"), "webhook", "jdbc-user");

        eventRepository.save(event);
        eventRepository.save(event);
        eventRepository.linkTask(event.id(), "task-1");

        assertThat(eventRepository.findUnprocessed(100))
            .extracting(r -> r.event().id())
            .contains(event.id());

        eventRepository.markProcessed(event.id());

        var stored = eventRepository.findById(event.id()).orElseThrow();
        assertThat(stored.processed()).isTrue();
        assertThat(stored.taskId()).isEqualTo("task-1");
        assertThat(stored.event().payloadText("source")).isEqualTo("github");
    }

    // ========== Scheduled Jobs ==========

    @Test
    @DisplayName("A second job with the same user and name is rejected")
    void testDuplicateScheduleName() {
        ScheduledJob job = ScheduledJob.create("jdbc-user", "standup", "0 9 * * 1-5", "slack", null);
        jobRepository.save(job);

        assertThatThrownBy(() -> jobRepository.save(
                ScheduledJob.create("jdbc-user", "standup", "0 10 * * *", null, null)))
            .isInstanceOf(DuplicateScheduleException.class)
            .satisfies(e -> assertThat(((DuplicateScheduleException) e).getExistingJobId()).isEqualTo(job.id()));
    }

    @Test
    void testRecordRun() {
        ScheduledJob job = ScheduledJob.create("jdbc-user", "digest-" + System.nanoTime(), "0 8 * * *", null, null);
        jobRepository.save(job);
        Instant last = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        Instant next = last.plus(Duration.ofDays(1));

        jobRepository.recordRun(job.id(), last, next);

        ScheduledJob stored = jobRepository.findById(job.id()).orElseThrow();
        assertThat(stored.lastRunAt()).isEqualTo(last);
        assertThat(stored.nextRunAt()).isEqualTo(next);
        assertThat(jobRepository.findEnabled()).extracting(ScheduledJob::id).contains(job.id());
    }

    // ========== Queue ==========

    @Test
    @DisplayName("A claimed entry is invisible to other pollers until acknowledged or timed out")
    void testQueueClaimAndAcknowledge() {
        jdbcTemplate.update("DELETE FROM task_queue");
        TaskDescriptor descriptor = TaskDescriptor.of(Task.create("queued", "jdbc-user", null));
        String handle = queue.enqueue(descriptor, Duration.ZERO);

        List<QueueDelivery> first = queue.poll(10, Duration.ofMinutes(5));
        assertThat(first).hasSize(1);
        assertThat(first.get(0).handle()).isEqualTo(handle);
        assertThat(first.get(0).descriptor().taskId()).isEqualTo(descriptor.taskId());
        assertThat(first.get(0).deliveryCount()).isEqualTo(1);

        assertThat(queue.poll(10, Duration.ofMinutes(5))).isEmpty();

        queue.acknowledge(handle);
        assertThat(queue.size()).isZero();
    }

    @Test
    void testQueueDelayedEntry() {
        jdbcTemplate.update("DELETE FROM task_queue");
        queue.enqueue(TaskDescriptor.of(Task.create("later", "jdbc-user", null)), Duration.ofHours(1));

        assertThat(queue.poll(10, Duration.ofMinutes(5))).isEmpty();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void testQueueCancellationSignal() {
        assertThat(queue.cancel("jdbc-task")).isTrue();
        assertThat(queue.cancel("jdbc-task")).isFalse();
        assertThat(queue.isCancelled("jdbc-task")).isTrue();

        queue.clearCancellation("jdbc-task");
        assertThat(queue.isCancelled("jdbc-task")).isFalse();
    }
}
