package stealwork.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import stealwork.scheduler.model.Task;

/**
 * One queued task as seen by an observer.
 */
public record QueuedTaskInfo(
        @JsonProperty("id") long id,
        @JsonProperty("stolen") boolean stolen,
        @JsonProperty("costEstimate") long costEstimate) {

    public static QueuedTaskInfo from(Task task) {
        return new QueuedTaskInfo(task.id(), task.stolen(), task.costEstimate());
    }
}
