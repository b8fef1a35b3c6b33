package stealwork.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import stealwork.scheduler.model.SchedulerStats;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the whole scheduler for rendering or logging.
 * Workers are listed in ascending id order.
 */
public record SchedulerSnapshot(
        @JsonProperty("capturedAt") Instant capturedAt,
        @JsonProperty("stats") SchedulerStats stats,
        @JsonProperty("workers") List<WorkerSnapshot> workers) {

    public SchedulerSnapshot {
        workers = List.copyOf(workers);
    }

    public WorkerSnapshot worker(int id) {
        return workers.get(id);
    }

    public int totalQueued() {
        return workers.stream().mapToInt(WorkerSnapshot::queueLength).sum();
    }

    public long busyWorkers() {
        return workers.stream().filter(WorkerSnapshot::busy).count();
    }
}
