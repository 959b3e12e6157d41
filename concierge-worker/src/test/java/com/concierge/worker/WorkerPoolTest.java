package com.concierge.worker;

import com.concierge.advisory.ArbitrationService;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.engine.agent.AgentCatalog;
import com.concierge.engine.agent.AgentRouter;
import com.concierge.engine.bus.EventBus;
import com.concierge.engine.dispatch.TaskDispatcher;
import com.concierge.engine.feedback.FeedbackManager;
import com.concierge.engine.metrics.ConciergeMetrics;
import com.concierge.engine.persistence.InMemoryEventRepository;
import com.concierge.engine.persistence.InMemoryTaskQueue;
import com.concierge.engine.persistence.InMemoryTaskRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

    private InMemoryTaskRepository taskRepository;
    private InMemoryTaskQueue queue;
    private TaskDispatcher dispatcher;
    private ScriptedAgent agent;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        ConciergeMetrics metrics = ConciergeMetrics.standalone();
        taskRepository = new InMemoryTaskRepository();
        queue = new InMemoryTaskQueue();
        dispatcher = new TaskDispatcher(taskRepository, queue, metrics);

        AgentCatalog catalog = new AgentCatalog();
        agent = ScriptedAgent.succeeding("echo", "done");
        catalog.register(agent);

        TaskWorker worker = TaskWorker.builder()
            .taskRepository(taskRepository)
            .eventRepository(new InMemoryEventRepository())
            .taskQueue(queue)
            .catalog(catalog)
            .router(new AgentRouter(catalog, ArbitrationService.none()))
            .eventBus(new EventBus(metrics))
            .feedback(new FeedbackManager((u, t, h, c) -> { }, metrics))
            .metrics(metrics)
            .build();

        pool = new WorkerPool(queue, worker, 3, Duration.ofMillis(10), Duration.ofMinutes(1));
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    @Test
    void pool_shouldDrainQueueAndRunEachTaskOnce() throws InterruptedException {
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            Task task = Task.create("task " + i, "user-1", null).toBuilder().agentSlug("echo").build();
            dispatcher.dispatch(task);
            tasks.add(task);
        }

        pool.start();

        long deadline = System.currentTimeMillis() + 10_000;
        while (pool.processedCount() < 20 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertThat(queue.size()).isZero();
        assertThat(tasks).allSatisfy(t ->
            assertThat(taskRepository.findById(t.id()).orElseThrow().status()).isEqualTo(TaskStatus.SUCCESS));
        assertThat(agent.executions()).isEqualTo(20);
        assertThat(pool.processedCount()).isEqualTo(20);
    }

    @Test
    void startAndStop_shouldBeIdempotent() {
        pool.start();
        pool.start();
        assertThat(pool.isRunning()).isTrue();

        pool.stop();
        pool.stop();
        assertThat(pool.isRunning()).isFalse();
    }

    @Test
    void constructor_shouldRejectEmptyPool() {
        assertThatThrownBy(() -> new WorkerPool(queue, null, 0, Duration.ofSeconds(1), Duration.ofMinutes(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
