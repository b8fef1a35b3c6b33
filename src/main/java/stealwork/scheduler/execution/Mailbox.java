package stealwork.scheduler.execution;

import stealwork.scheduler.model.WorkerMessage;

/**
 * Receiving end of the message channel between a worker and its execution unit.
 */
@FunctionalInterface
public interface Mailbox {

    void deliver(WorkerMessage message);
}
