package stealwork.scheduler.simulation;

import stealwork.scheduler.config.SchedulerConfig;
import stealwork.scheduler.core.SchedulerClosedException;
import stealwork.scheduler.core.WorkStealingScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background producer that admits one task per run.
 *
 * Each run picks a random worker and a random cost in
 * [costMin, costMax], so queues fill unevenly and idle workers have to
 * steal to keep up.
 */
public class TaskGenerator implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskGenerator.class);

    private final WorkStealingScheduler scheduler;
    private final long costMin;
    private final long costMax;
    private final AtomicLong generated = new AtomicLong();

    public TaskGenerator(WorkStealingScheduler scheduler, SchedulerConfig config) {
        this.scheduler = scheduler;
        this.costMin = config.costMin();
        this.costMax = config.costMax();
    }

    @Override
    public void run() {
        try {
            generateOne();
        } catch (SchedulerClosedException e) {
            log.debug("Scheduler closed, skipping generation");
        } catch (Exception e) {
            log.error("Task generator error", e);
        }
    }

    /**
     * Admit one random task.
     *
     * @return the new task id
     */
    public long generateOne() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        int workerId = random.nextInt(scheduler.workerCount());
        long cost = costMin >= costMax ? costMin : random.nextLong(costMin, costMax + 1);

        long taskId = scheduler.addTask(workerId, cost);
        generated.incrementAndGet();
        log.debug("Generated task {} for worker {} with cost {}", taskId, workerId, cost);
        return taskId;
    }

    public long generatedCount() {
        return generated.get();
    }
}
