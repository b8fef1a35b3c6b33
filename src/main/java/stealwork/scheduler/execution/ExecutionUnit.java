package stealwork.scheduler.execution;

import stealwork.scheduler.model.WorkerMessage;

/**
 * The component that actually runs tasks.
 * What a task does is opaque to the scheduler; it only relies on the
 * completion contract below.
 */
public interface ExecutionUnit extends AutoCloseable {

    /**
     * Hand a task over for execution.
     * Must return without waiting for the task to finish. For every accepted
     * dispatch exactly one {@link WorkerMessage.TaskComplete} carrying the
     * dispatched task id is later delivered to {@code replyTo}.
     *
     * @param dispatch the task and the worker it runs for
     * @param replyTo  mailbox of the dispatching worker
     * @throws RuntimeException if the dispatch cannot be accepted; no
     *                          completion follows in that case
     */
    void dispatch(WorkerMessage.TaskDispatch dispatch, Mailbox replyTo);

    @Override
    default void close() {
    }
}
