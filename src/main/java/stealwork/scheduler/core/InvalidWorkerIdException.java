package stealwork.scheduler.core;

/**
 * A worker id outside the configured pool.
 */
public class InvalidWorkerIdException extends IllegalArgumentException {

    private final int workerId;
    private final int workerCount;

    public InvalidWorkerIdException(int workerId, int workerCount) {
        super("Invalid worker id " + workerId + ": pool has workers 0.." + (workerCount - 1));
        this.workerId = workerId;
        this.workerCount = workerCount;
    }

    public int workerId() {
        return workerId;
    }

    public int workerCount() {
        return workerCount;
    }
}
