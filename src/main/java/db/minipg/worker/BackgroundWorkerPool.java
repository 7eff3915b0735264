package db.minipg.worker;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fire-and-forget executor for work that must not block the calling query
 * (sequence flushes, statistics refreshes).
 *
 * The queue is bounded; when it is full the submitting thread runs the task itself.
 * {@link #drain()} waits for everything submitted so far, {@link #close()} stops accepting
 * tasks, drains and shuts the threads down.
 */
public class BackgroundWorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackgroundWorkerPool.class);

    private final ThreadPoolExecutor executor;
    // one party per in-flight task plus one for the pool itself
    private final Phaser inFlight = new Phaser(1);
    private volatile boolean closed;

    public BackgroundWorkerPool(int workers, int queueCapacity) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
            workers, workers,
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            r -> {
                Thread t = new Thread(r);
                t.setName("minipg-bg-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    /**
     * Schedule a task. Failures are logged, never propagated to the submitter.
     *
     * @throws IllegalStateException if the pool is closed
     */
    public void submit(String name, Runnable task) {
        if (closed) throw new IllegalStateException("Background pool is closed; rejected task " + name);
        inFlight.register();
        try {
            executor.execute(() -> runTask(name, task));
        } catch (RejectedExecutionException e) {
            inFlight.arriveAndDeregister();
            throw new IllegalStateException("Background pool rejected task " + name, e);
        }
    }

    private void runTask(String name, Runnable task) {
        try {
            log.debug("Running background task {}", name);
            task.run();
        } catch (RuntimeException e) {
            log.warn("Background task {} failed", name, e);
        } finally {
            inFlight.arriveAndDeregister();
        }
    }

    /** Block until every task submitted before this call has finished. */
    public synchronized void drain() {
        // the pool's own party arrives and stays registered for the next phase
        int phase = inFlight.arrive();
        try {
            inFlight.awaitAdvanceInterruptibly(phase);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public int pendingTasks() {
        return inFlight.getRegisteredParties() - 1;
    }

    public boolean isClosed() { return closed; }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        drain();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Background pool did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Background pool stopped");
    }
}
