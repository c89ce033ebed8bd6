package io.deskrelay.runtime;

import io.deskrelay.error.HandlerExecutionException;
import io.deskrelay.error.HandlerTimeoutException;
import io.deskrelay.error.QueueClosedException;
import io.deskrelay.error.RetryExhaustedException;
import io.deskrelay.error.StoreUnavailableException;
import io.deskrelay.error.UnknownTypeException;
import io.deskrelay.handler.HandlerContext;
import io.deskrelay.handler.HandlerRegistry;
import io.deskrelay.handler.HandlerResult;
import io.deskrelay.model.Task;
import io.deskrelay.model.TaskStatus;
import io.deskrelay.observability.AuditLogger;
import io.deskrelay.queue.LocalTaskQueue;
import io.deskrelay.storage.RemoteTaskStore;
import io.deskrelay.storage.TaskChange;
import io.deskrelay.storage.TaskWatch;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public final class TaskProcessor implements AutoCloseable {
    private static final long SHUTDOWN_WAIT_MS = 60_000L;

    private final String nodeId;
    private final HandlerRegistry registry;
    private final LocalTaskQueue queue;
    private final RemoteTaskStore store;
    private final StorePublisher publisher;
    private final ScheduledExecutorService scheduler;
    private final AuditLogger auditLogger;
    private final RetryPolicy retryPolicy;
    private final int concurrencyLimit;
    private final long watchRetryMs;
    private final Clock clock;

    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger peakRunning = new AtomicInteger();
    private final AtomicInteger workersAlive = new AtomicInteger();
    private final AtomicInteger workerErrors = new AtomicInteger();
    private final AtomicInteger auditFailures = new AtomicInteger();
    private final Semaphore handlerSlots;

    private ExecutorService workers;
    private ExecutorService handlerPool;
    private Thread watcher;
    private volatile TaskWatch activeWatch;
    private volatile long watchCursor;
    private volatile boolean started;
    private volatile boolean stopping;

    public TaskProcessor(
            String nodeId,
            HandlerRegistry registry,
            LocalTaskQueue queue,
            RemoteTaskStore store,
            StorePublisher publisher,
            ScheduledExecutorService scheduler,
            AuditLogger auditLogger,
            RetryPolicy retryPolicy,
            int concurrencyLimit,
            long watchRetryMs,
            Clock clock
    ) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrency limit must be >= 1");
        }
        this.nodeId = nodeId;
        this.registry = registry;
        this.queue = queue;
        this.store = store;
        this.publisher = publisher;
        this.scheduler = scheduler;
        this.auditLogger = auditLogger;
        this.retryPolicy = retryPolicy;
        this.concurrencyLimit = concurrencyLimit;
        this.handlerSlots = new Semaphore(concurrencyLimit);
        this.watchRetryMs = Math.max(10L, watchRetryMs);
        this.clock = clock;
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        handlerPool = Executors.newCachedThreadPool(namedThreads("deskrelay-handler-"));
        workers = Executors.newFixedThreadPool(concurrencyLimit, namedThreads("deskrelay-worker-"));
        for (int i = 0; i < concurrencyLimit; i++) {
            workers.submit(this::workerLoop);
        }
        watcher = new Thread(this::watchLoop, "deskrelay-watcher");
        watcher.setDaemon(true);
        watcher.start();
        audit(AuditLogger.AuditEvent.of(
                "processor.start",
                "processor",
                "node/" + nodeId,
                "ok",
                null,
                Map.of("concurrency", concurrencyLimit, "maxAttempts", retryPolicy.maxAttempts())
        ));
    }

    public void submit(Task task) {
        if (!task.isOwnedBy(nodeId)) {
            throw new IllegalArgumentException("task " + task.id() + " is owned by " + task.owner() + ", not " + nodeId);
        }
        admit(task);
    }

    public Optional<Task> cancel(String taskId) {
        Task current = tasks.get(taskId);
        if (current == null) {
            return Optional.empty();
        }
        cancelRequests.add(taskId);
        if (current.status() == TaskStatus.PENDING) {
            Task cancelled = current.cancel(clock.millis());
            if (commit(current, cancelled, "cancel")) {
                return Optional.of(cancelled);
            }
            return Optional.ofNullable(tasks.get(taskId));
        }
        return Optional.of(current);
    }

    public Optional<Task> localTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public int forgetTerminalBefore(long cutoffMs) {
        int removed = 0;
        for (Task task : tasks.values()) {
            if (task.status().isTerminal() && task.updatedAtMs() < cutoffMs && tasks.remove(task.id(), task)) {
                cancelRequests.remove(task.id());
                removed++;
            }
        }
        return removed;
    }

    public boolean isStarted() {
        return started && !stopping;
    }

    public int queueDepth() {
        return queue.size();
    }

    public int runningHandlers() {
        return running.get();
    }

    public int peakRunningHandlers() {
        return peakRunning.get();
    }

    public long watchCursor() {
        return watchCursor;
    }

    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("nodeId", nodeId);
        out.put("started", isStarted());
        out.put("workers", workersAlive.get());
        out.put("queueDepth", queueDepth());
        out.put("runningHandlers", runningHandlers());
        out.put("peakRunningHandlers", peakRunningHandlers());
        out.put("deferredWrites", publisher.deferredCount());
        out.put("watchCursor", watchCursor);
        out.put("workerErrors", workerErrors.get());
        out.put("auditFailures", auditFailures.get());
        return out;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (!started || stopping) {
                return;
            }
            stopping = true;
        }
        queue.close();
        TaskWatch watch = activeWatch;
        if (watch != null) {
            watch.close();
        }
        watcher.interrupt();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
            watcher.join(SHUTDOWN_WAIT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        handlerPool.shutdownNow();
        publisher.close();
        int remaining = publisher.flush();
        audit(AuditLogger.AuditEvent.of(
                "processor.stop",
                "processor",
                "node/" + nodeId,
                remaining == 0 ? "ok" : "deferred_writes_left",
                null,
                Map.of("deferredWrites", remaining, "peakRunningHandlers", peakRunning.get())
        ));
    }

    private void admit(Task incoming) {
        long nowMs = clock.millis();
        Task[] admitted = new Task[1];
        tasks.compute(incoming.id(), (id, current) -> {
            if (current != null) {
                return current;
            }
            if (incoming.status() == TaskStatus.PENDING) {
                admitted[0] = incoming;
                return incoming;
            }
            if (incoming.status() == TaskStatus.IN_PROGRESS) {
                // Left running by a previous process on this node; its outcome is unknown.
                Task recovered = retryPolicy.canRetry(incoming.attempt())
                        ? incoming.retryAt(nowMs, nowMs)
                        : incoming.fail(new RetryExhaustedException(incoming.attempt(),
                                new HandlerExecutionException("interrupted while in progress")).getMessage(), nowMs);
                admitted[0] = recovered;
                return recovered;
            }
            return null;
        });
        Task task = admitted[0];
        if (task == null) {
            return;
        }
        if (task != incoming) {
            publisher.publish(task);
            auditTransition(incoming, task, "recover");
        }
        if (task.status() == TaskStatus.PENDING) {
            enqueueWhenDue(task);
        }
    }

    private void enqueueWhenDue(Task task) {
        long delayMs = task.notBeforeMs() - clock.millis();
        if (delayMs <= 0L) {
            enqueue(task);
            return;
        }
        try {
            scheduler.schedule(() -> requeue(task.id()), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            audit(AuditLogger.AuditEvent.of(
                    "task.requeue", "processor", "task/" + task.id(), "left_pending", task.id(),
                    Map.of("reason", "scheduler stopped")
            ));
        }
    }

    private void requeue(String taskId) {
        Task current = tasks.get(taskId);
        if (current != null && current.status() == TaskStatus.PENDING) {
            enqueue(current);
        }
    }

    private void enqueue(Task task) {
        try {
            queue.enqueue(task);
        } catch (QueueClosedException e) {
            audit(AuditLogger.AuditEvent.of(
                    "task.requeue", "processor", "task/" + task.id(), "left_pending", task.id(),
                    Map.of("reason", e.getMessage())
            ));
        }
    }

    private void workerLoop() {
        workersAlive.incrementAndGet();
        try {
            while (!stopping) {
                Optional<Task> next = queue.dequeue();
                if (next.isEmpty()) {
                    return;
                }
                String taskId = next.get().id();
                try {
                    process(taskId);
                } catch (RuntimeException e) {
                    workerErrors.incrementAndGet();
                    audit(AuditLogger.AuditEvent.of(
                            "task.process", "processor", "task/" + taskId, "worker_error", taskId,
                            Map.of("error", String.valueOf(e.getMessage()), "exception", e.getClass().getSimpleName())
                    ));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            workersAlive.decrementAndGet();
        }
    }

    private void process(String taskId) throws InterruptedException {
        Task current = tasks.get(taskId);
        if (current == null || current.status() != TaskStatus.PENDING) {
            return;
        }
        long nowMs = clock.millis();
        if (!current.isDue(nowMs)) {
            enqueueWhenDue(current);
            return;
        }
        if (isCancelRequested(taskId)) {
            commit(current, current.cancel(nowMs), "cancel");
            return;
        }
        HandlerRegistry.Registration registration;
        try {
            registration = registry.resolve(current.type());
        } catch (UnknownTypeException e) {
            // No handler here: the task stays PENDING with its attempt untouched.
            audit(AuditLogger.AuditEvent.of(
                    "task.requeue", "processor", "task/" + taskId, "unsupported_type", taskId,
                    Map.of("type", current.type(), "error", String.valueOf(e.getMessage()))
            ));
            return;
        }
        handlerSlots.acquire();
        Task started = current.start(clock.millis());
        boolean committed = false;
        try {
            committed = commit(current, started, "start");
        } finally {
            if (!committed) {
                handlerSlots.release();
            }
        }
        if (!committed) {
            return;
        }
        HandlerExecutionException error = null;
        String output = null;
        try {
            HandlerResult result = invoke(registration, started);
            if (result == null) {
                error = new HandlerExecutionException("handler returned no result");
            } else if (result.success()) {
                output = result.output() == null ? "" : result.output();
            } else {
                error = new HandlerExecutionException(result.error() == null ? "handler reported failure" : result.error());
            }
        } catch (HandlerExecutionException e) {
            error = e;
        }
        finish(started, output, error);
    }

    // The caller holds one handler slot. It is given back when the handler body returns,
    // which for a timed-out handler that ignores interrupts is after the worker moved on.
    private HandlerResult invoke(HandlerRegistry.Registration registration, Task task) {
        HandlerContext context = new HandlerContext(task.id(), task.type(), task.attempt(), task.origin(), task.payload());
        AtomicBoolean claimed = new AtomicBoolean();
        Future<HandlerResult> future;
        try {
            future = handlerPool.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                peakRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    return registration.handler().execute(context);
                } finally {
                    running.decrementAndGet();
                    handlerSlots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            handlerSlots.release();
            throw new HandlerExecutionException("handler pool is shut down", e);
        }
        try {
            return future.get(registration.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(future, claimed);
            throw new HandlerTimeoutException(task.type(), registration.timeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            throw new HandlerExecutionException(message, cause);
        } catch (InterruptedException e) {
            abandon(future, claimed);
            Thread.currentThread().interrupt();
            throw new HandlerExecutionException("interrupted while waiting for handler", e);
        }
    }

    private void abandon(Future<HandlerResult> future, AtomicBoolean claimed) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            // never started, so the slot is still ours
            handlerSlots.release();
        }
    }

    private void finish(Task started, String output, HandlerExecutionException error) {
        long nowMs = clock.millis();
        if (error == null) {
            commit(started, started.complete(output, nowMs), "complete");
            return;
        }
        if (retryPolicy.canRetry(started.attempt())) {
            long backoffMs = retryPolicy.backoffMs(started.attempt());
            Task retry = started.retryAt(nowMs + backoffMs, nowMs);
            if (commit(started, retry, "retry")) {
                audit(AuditLogger.AuditEvent.of(
                        "task.retry", "processor", "task/" + started.id(), "scheduled", started.id(),
                        Map.of("attempt", started.attempt(), "backoffMs", backoffMs, "error", String.valueOf(error.getMessage()))
                ));
                enqueueWhenDue(retry);
            }
            return;
        }
        RetryExhaustedException exhausted = new RetryExhaustedException(started.attempt(), error);
        commit(started, started.fail(exhausted.getMessage(), nowMs), "fail");
    }

    private boolean commit(Task expected, Task next, String reason) {
        if (!tasks.replace(expected.id(), expected, next)) {
            return false;
        }
        publisher.publish(next);
        auditTransition(expected, next, reason);
        return true;
    }

    private boolean isCancelRequested(String taskId) {
        if (cancelRequests.contains(taskId)) {
            return true;
        }
        try {
            return store.cancelRequested(taskId);
        } catch (StoreUnavailableException e) {
            // The watch delivers the request once the store is back.
            return false;
        }
    }

    private void watchLoop() {
        while (!stopping) {
            try (TaskWatch watch = store.watch(nodeId, watchCursor)) {
                activeWatch = watch;
                if (stopping) {
                    return;
                }
                while (watch.hasNext()) {
                    TaskChange change = watch.next();
                    onChange(change);
                    watchCursor = watch.cursor();
                }
            } catch (StoreUnavailableException e) {
                audit(AuditLogger.AuditEvent.of(
                        "store.watch", "processor", "node/" + nodeId, "disconnected", null,
                        Map.of("cursor", watchCursor, "error", String.valueOf(e.getMessage()))
                ));
                try {
                    Thread.sleep(watchRetryMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
        }
    }

    private void onChange(TaskChange change) {
        Task task = change.task();
        if (!task.isOwnedBy(nodeId)) {
            return;
        }
        admit(task);
        if (change.cancelRequested() && cancelRequests.add(task.id())) {
            cancel(task.id());
        }
    }

    private void auditTransition(Task from, Task to, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", from.status().name());
        details.put("to", to.status().name());
        details.put("attempt", to.attempt());
        details.put("reason", reason);
        if (to.result() != null && to.result().hasError()) {
            details.put("error", to.result().error());
        }
        audit(AuditLogger.AuditEvent.of(
                "task.transition",
                "processor",
                "task/" + to.id(),
                to.status().name().toLowerCase(),
                to.id(),
                details
        ));
    }

    private void audit(AuditLogger.AuditEvent event) {
        try {
            auditLogger.log(event);
        } catch (RuntimeException e) {
            // A broken audit log must not stop task processing; the count shows up in stats.
            auditFailures.incrementAndGet();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
