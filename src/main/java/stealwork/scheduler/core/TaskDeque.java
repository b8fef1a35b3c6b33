package stealwork.scheduler.core;

import stealwork.scheduler.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-worker double-ended task queue.
 * The owner pops the front, thieves pop the back. Every operation holds
 * the lock only for the queue mutation itself, never across execution.
 */
final class TaskDeque {

    private final ArrayDeque<Task> tasks = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    void pushBack(Task task) {
        lock.lock();
        try {
            tasks.addLast(task);
        } finally {
            lock.unlock();
        }
    }

    /** Put a task back at the head, used when a dispatch could not be handed off */
    void pushFront(Task task) {
        lock.lock();
        try {
            tasks.addFirst(task);
        } finally {
            lock.unlock();
        }
    }

    /** Owner removal; null when empty */
    Task popFront() {
        lock.lock();
        try {
            return tasks.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /** Thief removal; null when empty */
    Task popBack() {
        lock.lock();
        try {
            return tasks.pollLast();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isEmpty() {
        return size() == 0;
    }

    /** Copy of the queue, front first */
    List<Task> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(tasks);
        } finally {
            lock.unlock();
        }
    }

    /** Remove and return everything, front first */
    List<Task> drain() {
        lock.lock();
        try {
            List<Task> drained = new ArrayList<>(tasks);
            tasks.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }
}
