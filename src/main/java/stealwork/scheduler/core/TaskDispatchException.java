package stealwork.scheduler.core;

/**
 * The execution unit refused a dispatch.
 * The task is back at the head of the dispatching worker's queue when this
 * is thrown, so it is still scheduled.
 */
public class TaskDispatchException extends RuntimeException {

    private final int workerId;
    private final long taskId;

    public TaskDispatchException(int workerId, long taskId, Throwable cause) {
        super("Worker " + workerId + " could not dispatch task " + taskId, cause);
        this.workerId = workerId;
        this.taskId = taskId;
    }

    public int workerId() {
        return workerId;
    }

    public long taskId() {
        return taskId;
    }
}
