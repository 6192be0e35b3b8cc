package io.querymesh.runtime;

import io.querymesh.bus.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * N independent worker loops in this process, plus a periodic sweep that returns abandoned
 * deliveries to the inbox.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);
    private static final long MAX_RECLAIM_INTERVAL_MS = 60_000L;

    private final QueryMeshRuntime runtime;
    private final int workerCount;
    private final String workerIdPrefix;
    private final long pollIntervalMs;
    private final List<Thread> threads = new ArrayList<>();
    private final List<Worker> workers = new ArrayList<>();
    private final AtomicInteger busy = new AtomicInteger();
    private final AtomicInteger processed = new AtomicInteger();
    private ScheduledExecutorService reclaimer;
    private volatile boolean running;

    public WorkerPool(QueryMeshRuntime runtime, int workerCount, String workerIdPrefix) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("worker count must be > 0, got " + workerCount);
        }
        this.runtime = runtime;
        this.workerCount = workerCount;
        this.workerIdPrefix = workerIdPrefix == null || workerIdPrefix.isBlank() ? "worker" : workerIdPrefix.trim();
        this.pollIntervalMs = runtime.settings().workerPollIntervalMs();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        for (int i = 0; i < workerCount; i++) {
            Worker worker = runtime.newWorker(workerIdPrefix + "-" + i);
            workers.add(worker);
            Thread thread = new Thread(() -> loop(worker), "querymesh-" + worker.workerId());
            thread.setDaemon(true);
            threads.add(thread);
            thread.start();
        }
        long reclaimAfterMs = runtime.settings().reclaimAfterMs();
        long sweepMs = Math.min(reclaimAfterMs, MAX_RECLAIM_INTERVAL_MS);
        reclaimer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "querymesh-" + workerIdPrefix + "-reclaimer");
            thread.setDaemon(true);
            return thread;
        });
        reclaimer.scheduleWithFixedDelay(() -> {
            try {
                runtime.reclaimStale(reclaimAfterMs);
            } catch (RuntimeException e) {
                logger.error("Reclaim sweep failed", e);
            }
        }, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        logger.info("Started {} workers with prefix {}", workerCount, workerIdPrefix);
    }

    private void loop(Worker worker) {
        while (running) {
            boolean didWork = false;
            busy.incrementAndGet();
            try {
                Worker.WorkerOutcome outcome = worker.runOnce();
                didWork = outcome.processed();
                if (didWork) {
                    processed.incrementAndGet();
                    logger.debug("{}: {} {}", worker.workerId(), outcome.disposition(), outcome.taskId());
                }
            } catch (RuntimeException e) {
                // The delivery stays claimed; the reclaim sweep hands it back later.
                logger.error("Worker {} failed while handling a delivery", worker.workerId(), e);
            } finally {
                busy.decrementAndGet();
            }
            if (!didWork && !sleepQuietly(pollIntervalMs)) {
                return;
            }
        }
    }

    /**
     * Blocks until the queue holds no pending, claimed or retrying task and no worker is busy.
     *
     * @return false if {@code timeout} elapsed first
     */
    public boolean drainUntilIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        TaskQueue queue = runtime.taskQueue();
        // Queue directories are read one after another; a single reading can miss a file in flight.
        int idleReadings = 0;
        while (System.nanoTime() < deadline) {
            if (busy.get() == 0 && queue.depth().drained()) {
                idleReadings++;
                if (idleReadings >= 2) {
                    return true;
                }
            } else {
                idleReadings = 0;
            }
            if (!sleepQuietly(Math.min(pollIntervalMs, 200L))) {
                return false;
            }
        }
        return false;
    }

    public int processedCount() {
        return processed.get();
    }

    @Override
    public synchronized void close() {
        running = false;
        if (reclaimer != null) {
            reclaimer.shutdownNow();
        }
        for (Thread thread : threads) {
            try {
                thread.join(Math.max(1_000L, pollIntervalMs * 2));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        for (Worker worker : workers) {
            worker.close();
        }
        threads.clear();
        workers.clear();
        logger.info("Worker pool {} stopped", workerIdPrefix);
    }

    private static boolean sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
