package io.deskrelay.storage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

public final class TaskWatch implements Iterator<TaskChange>, AutoCloseable {
    private final Poller poller;
    private final long pollIntervalMs;
    private final Deque<TaskChange> buffer = new ArrayDeque<>();
    private volatile boolean closed;
    private long fetchCursor;
    private long deliveredCursor;

    public TaskWatch(Poller poller, long fromVersion, long pollIntervalMs) {
        this.poller = poller;
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
        this.fetchCursor = Math.max(0L, fromVersion);
        this.deliveredCursor = this.fetchCursor;
    }

    @Override
    public boolean hasNext() {
        while (buffer.isEmpty()) {
            if (closed) {
                return false;
            }
            List<TaskChange> batch = poller.poll(fetchCursor);
            if (!batch.isEmpty()) {
                buffer.addAll(batch);
                fetchCursor = batch.get(batch.size() - 1).version();
                break;
            }
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                closed = true;
                return false;
            }
        }
        return true;
    }

    @Override
    public TaskChange next() {
        if (!hasNext()) {
            throw new NoSuchElementException("task watch is closed");
        }
        TaskChange change = buffer.pollFirst();
        deliveredCursor = change.version();
        return change;
    }

    public List<TaskChange> drainAvailable() {
        if (buffer.isEmpty() && !closed) {
            List<TaskChange> batch = poller.poll(fetchCursor);
            if (!batch.isEmpty()) {
                buffer.addAll(batch);
                fetchCursor = batch.get(batch.size() - 1).version();
            }
        }
        List<TaskChange> out = List.copyOf(buffer);
        buffer.clear();
        if (!out.isEmpty()) {
            deliveredCursor = out.get(out.size() - 1).version();
        }
        return out;
    }

    public long cursor() {
        return deliveredCursor;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    @FunctionalInterface
    public interface Poller {
        List<TaskChange> poll(long afterVersion);
    }
}
