package stealwork.scheduler.core;

/**
 * Task admission attempted after the scheduler was shut down.
 */
public class SchedulerClosedException extends IllegalStateException {

    public SchedulerClosedException() {
        super("Scheduler is shut down");
    }
}
