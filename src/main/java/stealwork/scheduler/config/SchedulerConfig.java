package stealwork.scheduler.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for the scheduler and its simulation.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    // Pool settings
    private int workerCount = 4;
    private ShutdownPolicy shutdownPolicy = ShutdownPolicy.DRAIN;
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    // Simulated execution unit
    private int executionThreads = 0; // 0 = one thread per worker
    private double costScale = 1.0; // milliseconds slept per unit of cost

    // Task generator
    private Duration taskInterval = Duration.ofMillis(200);
    private long costMin = 100;
    private long costMax = 1000;

    // Snapshot reporter
    private Duration snapshotInterval = Duration.ofSeconds(2);

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        return from(System.getenv());
    }

    /**
     * Build a config from STEALWORK_* variables; absent or blank entries keep
     * their defaults.
     */
    public static SchedulerConfig from(Map<String, String> env) {
        SchedulerConfig config = new SchedulerConfig();

        String workers = value(env, "STEALWORK_WORKERS");
        if (workers != null) {
            config.withWorkerCount(parseInt("STEALWORK_WORKERS", workers));
        }

        String policy = value(env, "STEALWORK_SHUTDOWN_POLICY");
        if (policy != null) {
            try {
                config.withShutdownPolicy(ShutdownPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("STEALWORK_SHUTDOWN_POLICY must be DRAIN or DROP, got: " + policy);
            }
        }

        String shutdownTimeout = value(env, "STEALWORK_SHUTDOWN_TIMEOUT_MS");
        if (shutdownTimeout != null) {
            config.withShutdownTimeout(Duration.ofMillis(parseLong("STEALWORK_SHUTDOWN_TIMEOUT_MS", shutdownTimeout)));
        }

        String threads = value(env, "STEALWORK_EXECUTION_THREADS");
        if (threads != null) {
            config.withExecutionThreads(parseInt("STEALWORK_EXECUTION_THREADS", threads));
        }

        String scale = value(env, "STEALWORK_COST_SCALE");
        if (scale != null) {
            try {
                config.withCostScale(Double.parseDouble(scale.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("STEALWORK_COST_SCALE is not a number: " + scale);
            }
        }

        String interval = value(env, "STEALWORK_TASK_INTERVAL_MS");
        if (interval != null) {
            config.withTaskInterval(Duration.ofMillis(parseLong("STEALWORK_TASK_INTERVAL_MS", interval)));
        }

        String costMin = value(env, "STEALWORK_COST_MIN");
        String costMax = value(env, "STEALWORK_COST_MAX");
        if (costMin != null || costMax != null) {
            config.withCostRange(
                    costMin != null ? parseLong("STEALWORK_COST_MIN", costMin) : config.costMin,
                    costMax != null ? parseLong("STEALWORK_COST_MAX", costMax) : config.costMax);
        }

        String snapshot = value(env, "STEALWORK_SNAPSHOT_INTERVAL_MS");
        if (snapshot != null) {
            config.withSnapshotInterval(Duration.ofMillis(parseLong("STEALWORK_SNAPSHOT_INTERVAL_MS", snapshot)));
        }

        return config;
    }

    private static String value(Map<String, String> env, String key) {
        String v = env.get(key);
        return v == null || v.isBlank() ? null : v;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + value);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + value);
        }
    }

    // Getters
    public int workerCount() {
        return workerCount;
    }

    public ShutdownPolicy shutdownPolicy() {
        return shutdownPolicy;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    /** Threads of the simulated execution unit, never fewer than the worker count */
    public int executionThreads() {
        return executionThreads > 0 ? executionThreads : workerCount;
    }

    public double costScale() {
        return costScale;
    }

    public Duration taskInterval() {
        return taskInterval;
    }

    public long costMin() {
        return costMin;
    }

    public long costMax() {
        return costMax;
    }

    public Duration snapshotInterval() {
        return snapshotInterval;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.workerCount = workerCount;
        return this;
    }

    public SchedulerConfig withShutdownPolicy(ShutdownPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("shutdownPolicy is required");
        }
        this.shutdownPolicy = policy;
        return this;
    }

    public SchedulerConfig withShutdownTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
        this.shutdownTimeout = timeout;
        return this;
    }

    public SchedulerConfig withExecutionThreads(int threads) {
        if (threads < 0) {
            throw new IllegalArgumentException("executionThreads must be non-negative");
        }
        this.executionThreads = threads;
        return this;
    }

    public SchedulerConfig withCostScale(double scale) {
        if (scale < 0 || Double.isNaN(scale) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("costScale must be a non-negative number");
        }
        this.costScale = scale;
        return this;
    }

    public SchedulerConfig withTaskInterval(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("taskInterval must be positive");
        }
        this.taskInterval = interval;
        return this;
    }

    public SchedulerConfig withCostRange(long min, long max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("cost range is invalid: " + min + ".." + max);
        }
        this.costMin = min;
        this.costMax = max;
        return this;
    }

    public SchedulerConfig withSnapshotInterval(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("snapshotInterval must be positive");
        }
        this.snapshotInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "workers=" + workerCount +
                ", shutdownPolicy=" + shutdownPolicy +
                ", shutdownTimeout=" + shutdownTimeout.toMillis() + "ms" +
                ", executionThreads=" + executionThreads() +
                ", costScale=" + costScale +
                ", taskInterval=" + taskInterval.toMillis() + "ms" +
                ", cost=" + costMin + ".." + costMax +
                '}';
    }
}
