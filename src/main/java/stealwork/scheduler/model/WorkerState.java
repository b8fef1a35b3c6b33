package stealwork.scheduler.model;

/**
 * Worker execution state.
 */
public enum WorkerState {
    /** No task executing; the worker drains or steals on the next process() */
    IDLE,
    /** Exactly one task handed to the execution unit and not yet completed */
    BUSY
}
