package stealwork.scheduler.model;

import java.util.Objects;

/**
 * Messages exchanged between a worker and its execution unit.
 * The set is closed: every handler covers all three variants.
 */
public sealed interface WorkerMessage
        permits WorkerMessage.TaskDispatch, WorkerMessage.TaskComplete, WorkerMessage.Shutdown {

    /** Worker the message belongs to */
    int workerId();

    /** Worker -> execution unit: run this task. */
    record TaskDispatch(int workerId, Task task) implements WorkerMessage {
        public TaskDispatch {
            Objects.requireNonNull(task, "task is required");
        }
    }

    /** Execution unit -> worker: the dispatched task finished. */
    record TaskComplete(int workerId, long taskId, long durationMs) implements WorkerMessage {
        public TaskComplete {
            if (durationMs < 0) {
                throw new IllegalArgumentException("durationMs must be non-negative");
            }
        }
    }

    /** Scheduler -> worker: stop taking new work. */
    record Shutdown(int workerId) implements WorkerMessage {
    }
}
