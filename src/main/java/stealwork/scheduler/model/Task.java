package stealwork.scheduler.model;

import java.util.Objects;

/**
 * Immutable unit of schedulable work.
 * Ids are allocated by the owning scheduler; a steal produces the
 * stolen view of the same task via {@link #asStolen()}.
 */
public final class Task {
    private final long id;
    private final long costEstimate; // opaque weight, read by the execution unit only
    private final int originWorkerId;
    private final boolean stolen;

    private Task(Builder builder) {
        if (builder.id <= 0) {
            throw new IllegalArgumentException("id must be positive");
        }
        if (builder.costEstimate < 0) {
            throw new IllegalArgumentException("costEstimate must be non-negative");
        }
        if (builder.originWorkerId < 0) {
            throw new IllegalArgumentException("originWorkerId must be non-negative");
        }
        this.id = builder.id;
        this.costEstimate = builder.costEstimate;
        this.originWorkerId = builder.originWorkerId;
        this.stolen = builder.stolen;
    }

    // Getters
    public long id() {
        return id;
    }

    public long costEstimate() {
        return costEstimate;
    }

    public int originWorkerId() {
        return originWorkerId;
    }

    public boolean stolen() {
        return stolen;
    }

    /** Same task as seen after a thief removed it from a peer's queue */
    public Task asStolen() {
        if (stolen) {
            return this;
        }
        return toBuilder().stolen(true).build();
    }

    /** Create a builder from this task */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .costEstimate(costEstimate)
                .originWorkerId(originWorkerId)
                .stolen(stolen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private long costEstimate = 0;
        private int originWorkerId = 0;
        private boolean stolen = false;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder costEstimate(long costEstimate) {
            this.costEstimate = costEstimate;
            return this;
        }

        public Builder originWorkerId(int originWorkerId) {
            this.originWorkerId = originWorkerId;
            return this;
        }

        public Builder stolen(boolean stolen) {
            this.stolen = stolen;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return id == task.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", cost=" + costEstimate + ", origin=" + originWorkerId + ", stolen=" + stolen + "}";
    }
}
