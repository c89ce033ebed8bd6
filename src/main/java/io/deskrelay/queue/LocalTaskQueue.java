package io.deskrelay.queue;

import io.deskrelay.error.QueueClosedException;
import io.deskrelay.model.Task;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

public final class LocalTaskQueue {
    private final Deque<Task> tasks = new ArrayDeque<>();
    private boolean closed;

    public synchronized void enqueue(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (closed) {
            throw new QueueClosedException();
        }
        tasks.addLast(task);
        notifyAll();
    }

    public synchronized Optional<Task> dequeue() throws InterruptedException {
        while (!closed && tasks.isEmpty()) {
            wait();
        }
        if (closed) {
            return Optional.empty();
        }
        return Optional.of(tasks.pollFirst());
    }

    public synchronized Optional<Task> dequeue(long timeout, TimeUnit unit) throws InterruptedException {
        long deadlineNanos = System.nanoTime() + unit.toNanos(Math.max(0L, timeout));
        while (!closed && tasks.isEmpty()) {
            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0L) {
                return Optional.empty();
            }
            TimeUnit.NANOSECONDS.timedWait(this, remainingNanos);
        }
        if (closed) {
            return Optional.empty();
        }
        return Optional.of(tasks.pollFirst());
    }

    public synchronized int size() {
        return tasks.size();
    }

    public synchronized void close() {
        closed = true;
        notifyAll();
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
