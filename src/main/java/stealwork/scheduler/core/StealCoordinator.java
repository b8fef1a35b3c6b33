package stealwork.scheduler.core;

import stealwork.scheduler.model.Task;

import java.util.Optional;

/**
 * The handle a worker holds back to its scheduler.
 * It grants steal requests and completion accounting only; the scheduler
 * remains the sole owner of the worker collection.
 */
interface StealCoordinator {

    /**
     * Remove one task from the most loaded peer of {@code thiefId}.
     *
     * @return the stolen task, or empty when no peer has queued work
     */
    Optional<Task> stealWork(int thiefId);

    /**
     * Record that a worker finished a task.
     */
    void taskCompleted(int workerId, Task task, long durationMs);
}
