package stealwork.scheduler.core;

import stealwork.scheduler.config.SchedulerConfig;
import stealwork.scheduler.model.SchedulerStats;
import stealwork.scheduler.model.Task;
import stealwork.scheduler.model.WorkerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for task admission, stealing and victim selection.
 * Uses a manual execution unit so every completion happens on the test thread.
 */
class WorkStealingSchedulerTest {

    private ManualExecutionUnit unit;

    @BeforeEach
    void setUp() {
        unit = new ManualExecutionUnit();
    }

    private WorkStealingScheduler scheduler(int workers) {
        return new WorkStealingScheduler(SchedulerConfig.defaults().withWorkerCount(workers), unit);
    }

    private static List<Long> ids(List<Task> tasks) {
        List<Long> ids = new ArrayList<>();
        for (Task t : tasks) {
            ids.add(t.id());
        }
        return ids;
    }

    @Test
    void addTask_runsOnIdleTargetWorker() {
        WorkStealingScheduler scheduler = scheduler(4);

        long id = scheduler.addTask(2, 100);

        assertEquals(1, id);
        WorkerNode target = scheduler.worker(2);
        assertEquals(WorkerState.BUSY, target.state());
        assertEquals(1, target.currentTask().id());
        assertFalse(target.currentTask().stolen());
        assertEquals(2, target.currentTask().originWorkerId());
        assertEquals(100, target.currentTask().costEstimate());

        assertFalse(scheduler.worker(0).isBusy());
        assertFalse(scheduler.worker(1).isBusy());
        assertFalse(scheduler.worker(3).isBusy());
    }

    @Test
    void taskIdsAreMonotonicPerScheduler() {
        WorkStealingScheduler first = scheduler(2);
        WorkStealingScheduler second = scheduler(2);

        assertEquals(1, first.addTask(0, 10));
        assertEquals(2, first.addTask(1, 10));
        assertEquals(3, first.addTask(0, 10));

        // a second instance has its own counter
        assertEquals(1, second.addTask(0, 10));
    }

    /** Makes every worker busy, then queues the given number of tasks per worker. */
    private WorkStealingScheduler loaded(int... queueLengths) {
        WorkStealingScheduler scheduler = scheduler(queueLengths.length);
        for (int w = 0; w < queueLengths.length; w++) {
            scheduler.addTask(w, 1000);
        }
        for (int w = 0; w < queueLengths.length; w++) {
            for (int i = 0; i < queueLengths[w]; i++) {
                scheduler.addTask(w, 1000);
            }
        }
        for (int w = 0; w < queueLengths.length; w++) {
            assertEquals(queueLengths[w], scheduler.worker(w).queueLength());
        }
        return scheduler;
    }

    @Test
    void stealWork_picksLongestQueueAndTakesItsBack() {
        WorkStealingScheduler scheduler = loaded(3, 0, 5, 1);
        long lastOnWorker2 = scheduler.worker(2).queuedTasks().get(4).id();

        Optional<Task> stolen = scheduler.stealWork(1);

        assertTrue(stolen.isPresent());
        assertEquals(lastOnWorker2, stolen.get().id());
        assertTrue(stolen.get().stolen());
        assertEquals(2, stolen.get().originWorkerId());
        assertEquals(4, scheduler.worker(2).queueLength());
        assertEquals(3, scheduler.worker(0).queueLength());
        assertEquals(1, scheduler.worker(3).queueLength());
        assertEquals(1, scheduler.stats().totalStolen());
    }

    @Test
    void completionTriggersStealFromLongestQueue() {
        WorkStealingScheduler scheduler = loaded(3, 0, 5, 1);
        List<Long> worker2Queue = ids(scheduler.worker(2).queuedTasks());

        assertTrue(unit.completeOn(1));

        WorkerNode thief = scheduler.worker(1);
        assertTrue(thief.isBusy());
        assertEquals(worker2Queue.get(4), thief.currentTask().id());
        assertTrue(thief.currentTask().stolen());
        assertEquals(1, thief.stolenCount());
        assertEquals(worker2Queue.subList(0, 4), ids(scheduler.worker(2).queuedTasks()));
    }

    @Test
    void stealWork_tieGoesToLowestWorkerId() {
        WorkStealingScheduler scheduler = loaded(2, 0, 2);
        long backOfWorker0 = scheduler.worker(0).queuedTasks().get(1).id();

        Task stolen = scheduler.stealWork(1).orElseThrow();

        assertEquals(backOfWorker0, stolen.id());
        assertEquals(0, stolen.originWorkerId());
        assertEquals(1, scheduler.worker(0).queueLength());
        assertEquals(2, scheduler.worker(2).queueLength());
    }

    @Test
    void stealWork_neverTakesFromThiefsOwnQueue() {
        WorkStealingScheduler scheduler = loaded(0, 4);

        assertTrue(scheduler.stealWork(1).isEmpty());
        assertEquals(4, scheduler.worker(1).queueLength());
    }

    @Test
    void stealWork_returnsEmptyWhenNoPeerHasWork() {
        WorkStealingScheduler scheduler = scheduler(4);
        scheduler.addTask(0, 1000);

        assertTrue(scheduler.stealWork(1).isEmpty());
        assertEquals(0, scheduler.stats().totalStolen());
    }

    @Test
    void threeTasksOnOneWorker_twoAreStolenByIdlePeers() {
        WorkStealingScheduler scheduler = scheduler(4);

        scheduler.addTask(0, 1000);
        scheduler.addTask(0, 1000);
        scheduler.addTask(0, 1000);

        assertEquals(1, scheduler.worker(0).currentTask().id());
        assertFalse(scheduler.worker(0).currentTask().stolen());
        assertEquals(2, scheduler.worker(1).currentTask().id());
        assertTrue(scheduler.worker(1).currentTask().stolen());
        assertEquals(3, scheduler.worker(2).currentTask().id());
        assertTrue(scheduler.worker(2).currentTask().stolen());
        assertFalse(scheduler.worker(3).isBusy());
        assertEquals(0, scheduler.worker(0).queueLength());
        assertEquals(2, scheduler.stats().totalStolen());

        assertEquals(3, unit.completeAll());

        SchedulerStats stats = scheduler.stats();
        assertEquals(3, stats.totalCompleted());
        assertEquals(0, stats.queued());
        assertEquals(0, stats.inFlight());
        for (WorkerNode worker : scheduler.workers()) {
            assertEquals(WorkerState.IDLE, worker.state());
            assertNull(worker.currentTask());
        }
    }

    @Test
    void busyOwner_everyIdlePeerStealsOneTask() {
        WorkStealingScheduler scheduler = scheduler(4);
        scheduler.addTask(0, 5000); // keeps worker 0 busy

        scheduler.addTask(0, 1000);
        scheduler.addTask(0, 1000);
        scheduler.addTask(0, 1000);

        for (int w = 1; w <= 3; w++) {
            WorkerNode peer = scheduler.worker(w);
            assertTrue(peer.isBusy(), "worker " + w + " should have stolen");
            assertTrue(peer.currentTask().stolen());
            assertEquals(0, peer.currentTask().originWorkerId());
        }
        assertEquals(3, scheduler.stats().totalStolen());

        assertEquals(4, unit.completeAll());
        assertEquals(4, scheduler.stats().totalCompleted());
        assertEquals(0, scheduler.stats().queued());
        assertTrue(scheduler.workers().stream().noneMatch(WorkerNode::isBusy));
    }

    @Test
    void addTask_invalidWorkerIdLeavesStateUnchanged() {
        WorkStealingScheduler scheduler = loaded(1, 2, 0, 1);
        List<List<Long>> before = new ArrayList<>();
        for (WorkerNode worker : scheduler.workers()) {
            before.add(ids(worker.queuedTasks()));
        }
        long addedBefore = scheduler.stats().totalAdded();

        InvalidWorkerIdException e = assertThrows(InvalidWorkerIdException.class,
                () -> scheduler.addTask(99, 500));
        assertEquals(99, e.workerId());
        assertEquals(4, e.workerCount());
        assertThrows(InvalidWorkerIdException.class, () -> scheduler.addTask(-1, 500));

        for (WorkerNode worker : scheduler.workers()) {
            assertEquals(before.get(worker.id()), ids(worker.queuedTasks()));
        }
        assertEquals(addedBefore, scheduler.stats().totalAdded());
        // no id was consumed by the rejected calls
        assertEquals(addedBefore + 1, scheduler.addTask(0, 500));
    }

    @Test
    void addTask_negativeCostRejected() {
        WorkStealingScheduler scheduler = scheduler(2);

        assertThrows(IllegalArgumentException.class, () -> scheduler.addTask(0, -1));
        assertEquals(0, scheduler.stats().totalAdded());
        assertEquals(1, scheduler.addTask(0, 0));
    }

    @Test
    void stealWork_invalidThiefRejected() {
        WorkStealingScheduler scheduler = scheduler(2);
        assertThrows(InvalidWorkerIdException.class, () -> scheduler.stealWork(2));
    }

    @Test
    void stealWork_isReservedForWorkers() throws NoSuchMethodException {
        Method steal = WorkStealingScheduler.class.getDeclaredMethod("stealWork", int.class);

        // a task popped by an outside caller would never run
        assertFalse(Modifier.isPublic(steal.getModifiers()));
    }

    @Test
    void stolenTaskRunsOnThiefAndIsAccounted() throws InterruptedException {
        WorkStealingScheduler scheduler = scheduler(2);
        scheduler.addTask(0, 10);
        scheduler.addTask(1, 10);
        scheduler.addTask(0, 10);

        // worker 1 finishes task 2 and takes task 3 from worker 0
        assertTrue(unit.completeOn(1));
        assertEquals(3, scheduler.worker(1).currentTask().id());
        assertEquals(2, unit.completeAll());

        SchedulerStats stats = scheduler.stats();
        assertEquals(3, stats.totalAdded());
        assertEquals(3, stats.totalCompleted());
        assertEquals(0, stats.queued());
        assertEquals(0, stats.inFlight());
        assertEquals(0, stats.outstanding());
        assertTrue(scheduler.awaitQuiescence(Duration.ofMillis(200)));
        assertTrue(scheduler.shutdown().isEmpty());
    }

    @Test
    void unstolenTasksRunInPushOrder() {
        WorkStealingScheduler scheduler = scheduler(2);
        scheduler.addTask(1, 5000); // worker 1 stays busy, so nothing is stolen from worker 0

        List<Long> pushed = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            pushed.add(scheduler.addTask(0, 100));
        }

        while (scheduler.worker(0).isBusy()) {
            assertTrue(unit.completeOn(0));
        }

        assertEquals(pushed, unit.dispatchedOn(0));
        assertEquals(0, scheduler.stats().totalStolen());
    }

    @Test
    void invariantsHoldThroughRandomAdmissionsAndCompletions() {
        WorkStealingScheduler scheduler = scheduler(4);
        Random random = new Random(42);

        for (int step = 0; step < 500; step++) {
            List<Task> running = unit.running();
            if (running.isEmpty() || random.nextDouble() < 0.55) {
                scheduler.addTask(random.nextInt(4), random.nextInt(1000));
            } else {
                unit.complete(running.get(random.nextInt(running.size())).id());
            }
            assertInvariants(scheduler);
        }

        unit.completeAll();
        SchedulerStats stats = scheduler.stats();
        assertEquals(stats.totalAdded(), stats.totalCompleted());
        assertEquals(0, stats.queued());
        assertEquals(0, stats.inFlight());
        assertTrue(stats.totalStolen() > 0);
    }

    private static void assertInvariants(WorkStealingScheduler scheduler) {
        SchedulerStats stats = scheduler.stats();

        // conservation
        assertEquals(stats.totalAdded(), stats.queued() + stats.inFlight() + stats.totalCompleted());

        // no duplication
        Set<Long> seen = new HashSet<>();
        boolean anyIdle = false;
        boolean anyQueued = false;
        for (WorkerNode worker : scheduler.workers()) {
            for (Task task : worker.queuedTasks()) {
                assertTrue(seen.add(task.id()), "task " + task.id() + " appears twice");
                anyQueued = true;
            }
            Task current = worker.currentTask();
            if (current != null) {
                assertTrue(seen.add(current.id()), "task " + current.id() + " appears twice");
            } else {
                anyIdle = true;
            }
        }
        assertEquals(stats.queued() + stats.inFlight(), seen.size());

        // work conservation
        assertFalse(anyIdle && anyQueued, "a worker is idle while tasks are queued");
    }
}
