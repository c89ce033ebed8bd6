package io.deskrelay.runtime;

import io.deskrelay.error.StoreUnavailableException;
import io.deskrelay.model.Task;
import io.deskrelay.observability.AuditLogger;
import io.deskrelay.storage.RemoteTaskStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public final class StorePublisher {
    private final RemoteTaskStore store;
    private final ScheduledExecutorService scheduler;
    private final AuditLogger auditLogger;
    private final long retryBaseMs;
    private final long retryMaxMs;
    private final ConcurrentMap<String, Task> deferred = new ConcurrentHashMap<>();
    private int retryRound;
    private boolean retryScheduled;
    private boolean closed;

    public StorePublisher(
            RemoteTaskStore store,
            ScheduledExecutorService scheduler,
            AuditLogger auditLogger,
            long retryBaseMs,
            long retryMaxMs
    ) {
        this.store = store;
        this.scheduler = scheduler;
        this.auditLogger = auditLogger;
        this.retryBaseMs = Math.max(1L, retryBaseMs);
        this.retryMaxMs = Math.max(this.retryBaseMs, retryMaxMs);
    }

    public boolean publish(Task task) {
        try {
            store.put(task);
            deferred.computeIfPresent(task.id(), (id, parked) -> parked.updatedAtMs() <= task.updatedAtMs() ? null : parked);
            return true;
        } catch (StoreUnavailableException e) {
            deferred.merge(task.id(), task, (parked, incoming) ->
                    incoming.updatedAtMs() >= parked.updatedAtMs() ? incoming : parked);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "store.publish",
                    "publisher",
                    "task/" + task.id(),
                    "deferred",
                    task.id(),
                    Map.of("status", task.status().name(), "error", String.valueOf(e.getMessage()))
            ));
            scheduleRetry();
            return false;
        }
    }

    public int deferredCount() {
        return deferred.size();
    }

    public int flush() {
        List<Task> snapshot = new ArrayList<>(deferred.values());
        int recovered = 0;
        for (Task task : snapshot) {
            try {
                store.put(task);
                deferred.remove(task.id(), task);
                recovered++;
            } catch (StoreUnavailableException e) {
                break;
            }
        }
        if (recovered > 0) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "store.publish",
                    "publisher",
                    "store",
                    "recovered",
                    null,
                    Map.of("recovered", recovered, "remaining", deferred.size())
            ));
        }
        return deferred.size();
    }

    public synchronized void close() {
        closed = true;
    }

    private synchronized void scheduleRetry() {
        if (retryScheduled || closed) {
            return;
        }
        long delay = retryBaseMs;
        for (int i = 0; i < retryRound && delay < retryMaxMs; i++) {
            delay = Math.min(retryMaxMs, delay * 2L);
        }
        try {
            scheduler.schedule(this::retryDeferred, delay, TimeUnit.MILLISECONDS);
            retryScheduled = true;
        } catch (RejectedExecutionException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "store.publish",
                    "publisher",
                    "store",
                    "retry_not_scheduled",
                    null,
                    Map.of("remaining", deferred.size())
            ));
        }
    }

    private void retryDeferred() {
        synchronized (this) {
            retryScheduled = false;
        }
        int remaining = flush();
        synchronized (this) {
            retryRound = remaining == 0 ? 0 : retryRound + 1;
        }
        if (remaining > 0) {
            scheduleRetry();
        }
    }
}
