package stealwork.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import stealwork.scheduler.model.Task;
import stealwork.scheduler.model.WorkerState;

import java.util.List;

/**
 * Read-only view of one worker.
 * {@code currentTaskId} is omitted from JSON while the worker is idle.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerSnapshot(
        @JsonProperty("id") int id,
        @JsonProperty("state") String state,
        @JsonProperty("busy") boolean busy,
        @JsonProperty("queueLength") int queueLength,
        @JsonProperty("queuedTasks") List<QueuedTaskInfo> queuedTasks,
        @JsonProperty("currentTaskId") Long currentTaskId,
        @JsonProperty("currentTaskStolen") Boolean currentTaskStolen,
        @JsonProperty("completedCount") long completedCount,
        @JsonProperty("stolenCount") long stolenCount) {

    public WorkerSnapshot {
        queuedTasks = List.copyOf(queuedTasks);
    }

    /** Create snapshot from a worker's state */
    public static WorkerSnapshot of(int id,
            WorkerState state,
            Task currentTask,
            List<Task> queued,
            long completedCount,
            long stolenCount) {
        return new WorkerSnapshot(
                id,
                state.name(),
                state == WorkerState.BUSY,
                queued.size(),
                queued.stream().map(QueuedTaskInfo::from).toList(),
                currentTask != null ? currentTask.id() : null,
                currentTask != null ? currentTask.stolen() : null,
                completedCount,
                stolenCount);
    }
}
