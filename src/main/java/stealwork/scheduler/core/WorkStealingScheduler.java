package stealwork.scheduler.core;

import stealwork.scheduler.api.dto.SchedulerSnapshot;
import stealwork.scheduler.api.dto.WorkerSnapshot;
import stealwork.scheduler.config.SchedulerConfig;
import stealwork.scheduler.config.ShutdownPolicy;
import stealwork.scheduler.execution.ExecutionUnit;
import stealwork.scheduler.model.SchedulerStats;
import stealwork.scheduler.model.Task;
import stealwork.scheduler.model.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Coordinates a fixed pool of {@link WorkerNode}s.
 *
 * Lifecycle of a task:
 * 1. addTask() allocates an id and pushes the task onto the target worker's queue
 * 2. idle workers are woken; the target drains its queue, the others steal
 * 3. the execution unit reports completion and the worker picks its next task
 *
 * Victim selection is greedy: a thief always takes the back task of the peer
 * with the longest queue, lowest worker id on ties.
 *
 * The scheduler exclusively owns its workers and its task id counter. The
 * execution unit is owned by the caller and is not closed here.
 */
public final class WorkStealingScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkStealingScheduler.class);

    private final SchedulerConfig config;
    private final List<WorkerNode> workers;
    private final Instant startedAt = Instant.now();

    private final AtomicLong nextTaskId = new AtomicLong();
    private final AtomicLong totalAdded = new AtomicLong();
    private final AtomicLong totalCompleted = new AtomicLong();
    private final AtomicLong totalStolen = new AtomicLong();
    private final AtomicLong totalDropped = new AtomicLong();
    private final AtomicLong totalExecutionMs = new AtomicLong();
    private final AtomicLong outstanding = new AtomicLong();

    // admission holds the read side; shutdown takes the write side once
    private final ReadWriteLock admission = new ReentrantReadWriteLock();
    private final Object quiescence = new Object();
    private volatile boolean closed = false;

    public WorkStealingScheduler(SchedulerConfig config, ExecutionUnit executionUnit) {
        this.config = Objects.requireNonNull(config, "config is required");
        Objects.requireNonNull(executionUnit, "executionUnit is required");

        StealCoordinator coordinator = new Coordinator();
        List<WorkerNode> nodes = new ArrayList<>(config.workerCount());
        for (int i = 0; i < config.workerCount(); i++) {
            nodes.add(new WorkerNode(i, coordinator, executionUnit));
        }
        this.workers = List.copyOf(nodes);

        log.info("Scheduler created with {} workers ({} shutdown)", workers.size(), config.shutdownPolicy());
    }

    /**
     * Admit a new task onto a worker's queue and wake idle workers.
     *
     * @param workerId     worker whose queue receives the task
     * @param costEstimate opaque weight passed to the execution unit
     * @return the new task id
     * @throws InvalidWorkerIdException if the worker id is outside the pool
     * @throws SchedulerClosedException after shutdown
     * @throws TaskDispatchException    if the execution unit refused a dispatch
     *                                  triggered by this admission; the task stays
     *                                  scheduled
     */
    public long addTask(int workerId, long costEstimate) {
        checkWorkerId(workerId);
        if (costEstimate < 0) {
            throw new IllegalArgumentException("costEstimate must be non-negative");
        }

        WorkerNode target = workers.get(workerId);
        TaskDispatchException dispatchFailure = null;
        Task task;

        admission.readLock().lock();
        try {
            if (closed) {
                throw new SchedulerClosedException();
            }
            task = Task.builder()
                    .id(nextTaskId.incrementAndGet())
                    .costEstimate(costEstimate)
                    .originWorkerId(workerId)
                    .build();
            totalAdded.incrementAndGet();
            outstanding.incrementAndGet();
            log.debug("Added task {} (cost {}) to worker {}", task.id(), costEstimate, workerId);

            try {
                target.pushTask(task);
            } catch (TaskDispatchException e) {
                dispatchFailure = e;
            }
        } finally {
            admission.readLock().unlock();
        }

        try {
            notifyIdleWorkers();
        } catch (TaskDispatchException e) {
            if (dispatchFailure == null) {
                dispatchFailure = e;
            } else {
                dispatchFailure.addSuppressed(e);
            }
        }

        if (dispatchFailure != null) {
            throw dispatchFailure;
        }
        return task.id();
    }

    /**
     * Run process() on every idle worker, in ascending id order.
     *
     * @throws TaskDispatchException if any dispatch was refused; the remaining
     *                               workers are still processed first
     */
    public void notifyIdleWorkers() {
        TaskDispatchException failure = null;
        for (WorkerNode worker : workers) {
            if (worker.isBusy()) {
                continue;
            }
            try {
                worker.process();
            } catch (TaskDispatchException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Take one task from the back of the longest peer queue.
     * Workers call this when their own queue is empty; the returned task is
     * marked stolen and no longer in any queue, so the caller must execute it.
     * Only workers reach this, through their {@link StealCoordinator}.
     *
     * @param thiefId the worker asking for work
     * @return the stolen task, or empty if no other worker has queued tasks
     */
    Optional<Task> stealWork(int thiefId) {
        checkWorkerId(thiefId);

        while (true) {
            WorkerNode victim = null;
            int longest = 0;
            for (WorkerNode worker : workers) {
                if (worker.id() == thiefId) {
                    continue;
                }
                int length = worker.queueLength();
                if (length > longest) {
                    longest = length;
                    victim = worker;
                }
            }

            if (victim == null) {
                return Optional.empty();
            }

            Task task = victim.deque().popBack();
            if (task == null) {
                // the owner or another thief emptied it first; rescan
                continue;
            }

            totalStolen.incrementAndGet();
            log.debug("Worker {} stole task {} from worker {} (queue length {})",
                    thiefId, task.id(), victim.id(), longest);
            return Optional.of(task.asStolen());
        }
    }

    /**
     * Block until every admitted task has completed or been dropped.
     *
     * @return true if quiescent, false if the timeout elapsed first
     */
    public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (quiescence) {
            while (outstanding.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(quiescence, remaining);
            }
            return true;
        }
    }

    /**
     * Stop admitting tasks and stop all workers.
     *
     * With {@link ShutdownPolicy#DRAIN} the workers keep running until the
     * queues are empty or the shutdown timeout elapses; with
     * {@link ShutdownPolicy#DROP} queued tasks are removed at once. Running
     * tasks always complete. Calling this again has no effect.
     *
     * @return the queued tasks that were dropped, per worker in queue order
     */
    public List<Task> shutdown() {
        admission.writeLock().lock();
        try {
            if (closed) {
                return List.of();
            }
            closed = true;
        } finally {
            admission.writeLock().unlock();
        }

        SchedulerStats before = stats();
        log.info("Shutting down scheduler ({} policy, {} queued, {} in flight)",
                config.shutdownPolicy(), before.queued(), before.inFlight());

        if (config.shutdownPolicy() == ShutdownPolicy.DRAIN) {
            try {
                if (!awaitQuiescence(config.shutdownTimeout())) {
                    log.warn("Drain did not finish within {}ms", config.shutdownTimeout().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining, dropping remaining tasks");
            }
        }

        for (WorkerNode worker : workers) {
            worker.deliver(new WorkerMessage.Shutdown(worker.id()));
        }

        List<Task> dropped = new ArrayList<>();
        for (WorkerNode worker : workers) {
            dropped.addAll(worker.drainQueue());
        }

        if (!dropped.isEmpty()) {
            totalDropped.addAndGet(dropped.size());
            markSettled(dropped.size());
            log.warn("Dropped {} queued tasks on shutdown: {}", dropped.size(),
                    dropped.stream().map(Task::id).toList());
        }

        log.info("Scheduler stopped: {}", stats());
        return dropped;
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isClosed() {
        return closed;
    }

    public int workerCount() {
        return workers.size();
    }

    public WorkerNode worker(int workerId) {
        checkWorkerId(workerId);
        return workers.get(workerId);
    }

    /** Workers in ascending id order */
    public List<WorkerNode> workers() {
        return workers;
    }

    public SchedulerConfig config() {
        return config;
    }

    /**
     * Current counters.
     *
     * Queue lengths and busy flags are read worker by worker without a global
     * lock. While workers are active a task moving from a queue to execution
     * may be counted in neither {@code queued} nor {@code inFlight}, or in
     * both. {@code totalAdded == queued + inFlight + totalCompleted + totalDropped}
     * holds whenever the scheduler is quiescent.
     */
    public SchedulerStats stats() {
        int queued = 0;
        int inFlight = 0;
        for (WorkerNode worker : workers) {
            queued += worker.queueLength();
            if (worker.isBusy()) {
                inFlight++;
            }
        }

        long completed = totalCompleted.get();
        double averageMs = completed > 0 ? (double) totalExecutionMs.get() / completed : 0.0;
        double elapsedSec = Duration.between(startedAt, Instant.now()).toMillis() / 1000.0;
        double throughput = elapsedSec > 0 ? completed / elapsedSec : 0.0;

        return new SchedulerStats(
                workers.size(),
                totalAdded.get(),
                completed,
                totalStolen.get(),
                totalDropped.get(),
                queued,
                inFlight,
                averageMs,
                throughput);
    }

    /**
     * Read-only view of every worker for rendering or logging.
     * Each worker view is consistent on its own; the views are taken one
     * after another, with the same caveat as {@link #stats()}.
     */
    public SchedulerSnapshot snapshot() {
        List<WorkerSnapshot> views = new ArrayList<>(workers.size());
        for (WorkerNode worker : workers) {
            views.add(worker.snapshot());
        }
        return new SchedulerSnapshot(Instant.now(), stats(), views);
    }

    private void checkWorkerId(int workerId) {
        if (workerId < 0 || workerId >= workers.size()) {
            throw new InvalidWorkerIdException(workerId, workers.size());
        }
    }

    private void markSettled(long count) {
        if (outstanding.addAndGet(-count) == 0) {
            synchronized (quiescence) {
                quiescence.notifyAll();
            }
        }
    }

    /** Non-owning handle given to each worker */
    private final class Coordinator implements StealCoordinator {

        @Override
        public Optional<Task> stealWork(int thiefId) {
            return WorkStealingScheduler.this.stealWork(thiefId);
        }

        @Override
        public void taskCompleted(int workerId, Task task, long durationMs) {
            totalCompleted.incrementAndGet();
            totalExecutionMs.addAndGet(durationMs);
            markSettled(1);
        }
    }

    @Override
    public String toString() {
        return "WorkStealingScheduler{workers=" + workers.size() + ", closed=" + closed + "}";
    }
}
