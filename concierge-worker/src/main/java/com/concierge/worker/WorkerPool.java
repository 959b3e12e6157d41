package com.concierge.worker;

import com.concierge.core.queue.QueueDelivery;
import com.concierge.core.queue.TaskQueue;
import com.concierge.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pool of poll loops feeding queue deliveries to a {@link TaskWorker}.
 *
 * Usage:
 * <pre>
 * WorkerPool pool = new WorkerPool(queue, worker, 4, Duration.ofSeconds(1), Duration.ofMinutes(5));
 * pool.start();
 * ...
 * pool.stop();
 * </pre>
 *
 * Each thread claims one delivery at a time. An idle loop sleeps for the poll
 * interval; a failing loop backs off for twice that and keeps going.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final TaskQueue taskQueue;
    private final TaskWorker worker;
    private final int threads;
    private final Duration pollInterval;
    private final Duration visibilityTimeout;
    private final Duration shutdownTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private ExecutorService executorService;

    public WorkerPool(TaskQueue taskQueue, TaskWorker worker, int threads,
                      Duration pollInterval, Duration visibilityTimeout) {
        this(taskQueue, worker, threads, pollInterval, visibilityTimeout, Duration.ofSeconds(30));
    }

    public WorkerPool(TaskQueue taskQueue, TaskWorker worker, int threads,
                      Duration pollInterval, Duration visibilityTimeout, Duration shutdownTimeout) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        this.taskQueue = taskQueue;
        this.worker = worker;
        this.threads = threads;
        this.pollInterval = pollInterval;
        this.visibilityTimeout = visibilityTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Start the poll loops.
     */
    public synchronized void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting worker pool with {} threads", threads);
            AtomicInteger sequence = new AtomicInteger();
            executorService = Executors.newFixedThreadPool(threads, r -> {
                Thread thread = new Thread(r, "concierge-worker-" + sequence.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            for (int i = 1; i <= threads; i++) {
                String workerId = "worker-" + i;
                executorService.submit(() -> pollLoop(workerId));
            }
        }
    }

    /**
     * Stop the worker pool gracefully. In-flight deliveries get the shutdown timeout to finish;
     * anything still unacknowledged after that is redelivered by the queue.
     */
    public synchronized void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping worker pool after {} deliveries", processed.get());
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Deliveries processed since start.
     */
    public long processedCount() {
        return processed.get();
    }

    private void pollLoop(String workerId) {
        try (var ctx = LoggingContext.forWorker(workerId)) {
            while (running.get()) {
                try {
                    List<QueueDelivery> deliveries = taskQueue.poll(1, visibilityTimeout);

                    for (QueueDelivery delivery : deliveries) {
                        TaskOutcome outcome = worker.process(delivery);
                        processed.incrementAndGet();
                        log.debug("Delivery {} finished as {}", delivery.handle(), outcome);
                    }

                    if (deliveries.isEmpty()) {
                        Thread.sleep(pollInterval.toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    log.error("Error in poll loop of {}", workerId, e);
                    try {
                        Thread.sleep(pollInterval.toMillis() * 2);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
    }
}
