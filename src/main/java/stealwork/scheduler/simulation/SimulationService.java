package stealwork.scheduler.simulation;

import stealwork.scheduler.api.SnapshotJson;
import stealwork.scheduler.config.SchedulerConfig;
import stealwork.scheduler.core.WorkStealingScheduler;
import stealwork.scheduler.execution.SimulatedExecutionUnit;
import stealwork.scheduler.model.SchedulerStats;
import stealwork.scheduler.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Service running a scheduler against the simulated execution unit.
 * Call start() to create the pool and background tasks, stop() to shut
 * everything down and collect the final stats.
 *
 * Background tasks run on one scheduled thread:
 * - TaskGenerator: admits random tasks at the configured interval
 * - snapshot reporter: logs the scheduler snapshot as JSON
 */
public final class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final SchedulerConfig config;

    private SimulatedExecutionUnit executionUnit;
    private WorkStealingScheduler scheduler;
    private ScheduledExecutorService timer;
    private TaskGenerator generator;
    private SchedulerStats finalStats;
    private volatile boolean running;

    public SimulationService(SchedulerConfig config) {
        this.config = config;
    }

    /**
     * Start the pool with the task generator running.
     */
    public void start() {
        start(true);
    }

    /**
     * Start the pool.
     *
     * @param generateTasks whether to schedule the random task generator;
     *                      without it tasks only arrive through burst() or
     *                      the scheduler itself
     */
    public synchronized void start(boolean generateTasks) {
        if (running) {
            log.warn("Simulation already running");
            return;
        }

        executionUnit = SimulatedExecutionUnit.create(config);
        scheduler = new WorkStealingScheduler(config, executionUnit);
        generator = new TaskGenerator(scheduler, config);
        finalStats = null;

        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stealwork-simulation");
            t.setDaemon(true);
            return t;
        });

        if (generateTasks) {
            long intervalMs = config.taskInterval().toMillis();
            timer.scheduleAtFixedRate(generator, 0, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Task generator scheduled every {}ms", intervalMs);
        }

        long snapshotMs = config.snapshotInterval().toMillis();
        timer.scheduleAtFixedRate(
                wrapRunnable("snapshot-reporter", this::reportSnapshot),
                snapshotMs,
                snapshotMs,
                TimeUnit.MILLISECONDS);

        running = true;
        log.info("Simulation started: {}", config);
    }

    /**
     * Admit {@code count} tasks of the same cost onto one worker.
     * The other workers pick them up by stealing.
     *
     * @return the ids of the admitted tasks, in admission order
     */
    public synchronized List<Long> burst(int workerId, int count, long cost) {
        if (!running) {
            throw new IllegalStateException("Simulation is not running");
        }
        List<Long> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add(scheduler.addTask(workerId, cost));
        }
        log.info("Burst of {} tasks admitted to worker {}", count, workerId);
        return ids;
    }

    /**
     * Stop background tasks, shut the scheduler down and close the execution unit.
     *
     * @return final stats, or the stats of the last run if already stopped
     */
    public synchronized SchedulerStats stop() {
        if (!running) {
            return finalStats;
        }

        running = false;

        timer.shutdownNow();
        try {
            timer.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        List<Task> dropped = scheduler.shutdown();
        if (!dropped.isEmpty()) {
            log.warn("{} tasks were not executed", dropped.size());
        }
        executionUnit.close();

        finalStats = scheduler.stats();
        log.info("Simulation stopped: {} tasks generated, {}", generator.generatedCount(), finalStats);
        return finalStats;
    }

    public boolean isRunning() {
        return running;
    }

    /** Scheduler of the current (or last) run; null before the first start() */
    public WorkStealingScheduler scheduler() {
        return scheduler;
    }

    public TaskGenerator generator() {
        return generator;
    }

    private void reportSnapshot() {
        log.info("Snapshot: {}", SnapshotJson.toJson(scheduler.snapshot()));
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
