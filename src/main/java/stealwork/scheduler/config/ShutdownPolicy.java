package stealwork.scheduler.config;

/**
 * What happens to queued, undispatched tasks when the scheduler shuts down.
 * In-flight tasks always run to completion.
 */
public enum ShutdownPolicy {
    /** Keep workers draining and stealing until every queue is empty or the shutdown timeout elapses */
    DRAIN,
    /** Remove queued tasks immediately and hand them back to the caller */
    DROP
}
