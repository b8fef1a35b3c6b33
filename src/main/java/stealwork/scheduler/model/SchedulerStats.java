package stealwork.scheduler.model;

/**
 * Aggregate counters of one scheduler instance.
 * At any quiescent point
 * {@code totalAdded == queued + inFlight + totalCompleted + totalDropped}.
 */
public record SchedulerStats(
        int workerCount,
        long totalAdded,
        long totalCompleted,
        long totalStolen,
        long totalDropped,
        int queued,
        int inFlight,
        double averageExecutionMs,
        double throughputPerSecond) {

    /** Tasks admitted but neither completed nor dropped */
    public long outstanding() {
        return totalAdded - totalCompleted - totalDropped;
    }
}
