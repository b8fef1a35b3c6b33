package stealwork.scheduler.execution;

import stealwork.scheduler.config.SchedulerConfig;
import stealwork.scheduler.model.Task;
import stealwork.scheduler.model.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Execution unit that simulates work by sleeping for the task's cost.
 * Each dispatch runs on a pooled thread: sleep -> reply TaskComplete.
 * Stops cleanly on close(); interrupted tasks still report completion.
 */
public final class SimulatedExecutionUnit implements ExecutionUnit {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionUnit.class);

    private final ExecutorService executor;
    private final double costScale;
    private volatile boolean closed;

    /**
     * @param threads   pool size; use at least the worker count so no dispatch
     *                  waits behind another worker's task
     * @param costScale milliseconds slept per unit of cost estimate
     */
    public SimulatedExecutionUnit(int threads, double costScale) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive");
        }
        if (costScale < 0) {
            throw new IllegalArgumentException("costScale must be non-negative");
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "stealwork-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.costScale = costScale;
    }

    public static SimulatedExecutionUnit create(SchedulerConfig config) {
        return new SimulatedExecutionUnit(config.executionThreads(), config.costScale());
    }

    @Override
    public void dispatch(WorkerMessage.TaskDispatch dispatch, Mailbox replyTo) {
        if (closed) {
            throw new IllegalStateException("Execution unit is closed");
        }
        executor.execute(() -> run(dispatch, replyTo));
    }

    private void run(WorkerMessage.TaskDispatch dispatch, Mailbox replyTo) {
        Task task = dispatch.task();
        long startedAt = System.nanoTime();
        long delayMs = Math.round(task.costEstimate() * costScale);

        try {
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Task {} interrupted after {}ms, reporting completion", task.id(),
                    elapsedMs(startedAt));
        }

        long durationMs = elapsedMs(startedAt);
        try {
            replyTo.deliver(new WorkerMessage.TaskComplete(dispatch.workerId(), task.id(), durationMs));
        } catch (Exception e) {
            log.error("Completion of task {} on worker {} could not be delivered",
                    task.id(), dispatch.workerId(), e);
        }
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Execution unit forcefully stopped");
            } else {
                log.debug("Execution unit stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
