package stealwork.scheduler.core;

import stealwork.scheduler.api.dto.WorkerSnapshot;
import stealwork.scheduler.execution.ExecutionUnit;
import stealwork.scheduler.execution.Mailbox;
import stealwork.scheduler.model.Task;
import stealwork.scheduler.model.WorkerMessage;
import stealwork.scheduler.model.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One execution slot of the pool.
 *
 * Owns a {@link TaskDeque} and runs at most one task at a time:
 * - process(): drain own queue from the front, otherwise ask the scheduler
 * to steal from a peer, otherwise stay IDLE
 * - completion of the running task triggers process() again, so a worker
 * never idles while a task is queued anywhere
 *
 * State transitions are serialized on this object's monitor. The monitor is
 * never held while a task executes; dispatch only hands the task off.
 */
public final class WorkerNode implements Mailbox {

    private static final Logger log = LoggerFactory.getLogger(WorkerNode.class);

    private final int id;
    private final TaskDeque deque = new TaskDeque();
    private final StealCoordinator coordinator;
    private final ExecutionUnit executionUnit;

    private volatile WorkerState state = WorkerState.IDLE;
    private volatile Task currentTask;
    private volatile boolean stopped;

    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong stolenCount = new AtomicLong();
    private final AtomicLong busyTimeMs = new AtomicLong();

    WorkerNode(int id, StealCoordinator coordinator, ExecutionUnit executionUnit) {
        this.id = id;
        this.coordinator = coordinator;
        this.executionUnit = executionUnit;
    }

    public int id() {
        return id;
    }

    public WorkerState state() {
        return state;
    }

    public boolean isBusy() {
        return state == WorkerState.BUSY;
    }

    public boolean isStopped() {
        return stopped;
    }

    /** Task currently executing, or null when idle */
    public Task currentTask() {
        return currentTask;
    }

    public int queueLength() {
        return deque.size();
    }

    /** Queued tasks, front first */
    public List<Task> queuedTasks() {
        return deque.snapshot();
    }

    public long completedCount() {
        return completedCount.get();
    }

    /** Tasks this worker took from a peer's queue */
    public long stolenCount() {
        return stolenCount.get();
    }

    public long busyTimeMs() {
        return busyTimeMs.get();
    }

    TaskDeque deque() {
        return deque;
    }

    /**
     * Append a task to the local queue and try to run something.
     */
    void pushTask(Task task) {
        deque.pushBack(task);
        process();
    }

    /**
     * Pick the next task if idle: own queue first (FIFO), then a steal.
     * No-op while a task is running or after shutdown.
     *
     * @throws TaskDispatchException if the execution unit refused the task
     */
    synchronized void process() {
        if (stopped || state == WorkerState.BUSY) {
            return;
        }

        Task task = deque.popFront();
        if (task == null) {
            task = coordinator.stealWork(id).orElse(null);
            if (task == null) {
                return;
            }
            stolenCount.incrementAndGet();
        }

        execute(task);
    }

    private void execute(Task task) {
        state = WorkerState.BUSY;
        currentTask = task;
        log.debug("Worker {} executing task {} (stolen={})", id, task.id(), task.stolen());

        try {
            executionUnit.dispatch(new WorkerMessage.TaskDispatch(id, task), this);
        } catch (RuntimeException e) {
            // back to the head of our own queue so the task is not lost
            currentTask = null;
            state = WorkerState.IDLE;
            deque.pushFront(task);
            log.error("Worker {} failed to dispatch task {}", id, task.id(), e);
            throw new TaskDispatchException(id, task.id(), e);
        }
    }

    /**
     * Completion signal from the execution unit.
     * A completion for anything but the current task is ignored.
     */
    synchronized void onTaskComplete(long taskId, long durationMs) {
        Task task = currentTask;
        if (task == null || task.id() != taskId) {
            log.warn("Worker {} ignoring completion of task {} (current: {})",
                    id, taskId, task != null ? task.id() : "none");
            return;
        }

        currentTask = null;
        state = WorkerState.IDLE;
        completedCount.incrementAndGet();
        busyTimeMs.addAndGet(durationMs);
        log.debug("Worker {} completed task {} in {}ms", id, taskId, durationMs);

        coordinator.taskCompleted(id, task, durationMs);
        try {
            process();
        } catch (TaskDispatchException e) {
            // the completion is accounted; the refused task waits at our queue head for the next wake-up
            log.warn("Worker {} completed task {} but its next task {} stays queued",
                    id, taskId, e.taskId());
        }
    }

    /**
     * Mark the worker stopped. A running task still completes; nothing new
     * is dispatched afterwards.
     */
    synchronized void stop() {
        stopped = true;
    }

    /** Remove every queued task, front first */
    synchronized List<Task> drainQueue() {
        return deque.drain();
    }

    @Override
    public void deliver(WorkerMessage message) {
        if (message.workerId() != id) {
            throw new IllegalArgumentException(
                    "Message for worker " + message.workerId() + " delivered to worker " + id);
        }

        // one branch per type in WorkerMessage's permits clause
        if (message instanceof WorkerMessage.TaskComplete complete) {
            onTaskComplete(complete.taskId(), complete.durationMs());
        } else if (message instanceof WorkerMessage.Shutdown) {
            stop();
            log.debug("Worker {} stopped", id);
        } else if (message instanceof WorkerMessage.TaskDispatch dispatch) {
            // dispatches flow from workers to the execution unit, never back
            throw new IllegalArgumentException("Worker " + id + " cannot accept dispatch of task "
                    + dispatch.task().id() + "; tasks are admitted through the scheduler");
        } else {
            throw new IllegalStateException("Unknown worker message: " + message);
        }
    }

    synchronized WorkerSnapshot snapshot() {
        return WorkerSnapshot.of(id, state, currentTask, deque.snapshot(),
                completedCount.get(), stolenCount.get());
    }

    @Override
    public String toString() {
        return "WorkerNode{id=" + id + ", state=" + state + ", queued=" + deque.size() + "}";
    }
}
