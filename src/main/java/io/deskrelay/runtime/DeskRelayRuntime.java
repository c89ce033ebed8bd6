package io.deskrelay.runtime;

import io.deskrelay.config.DeskRelayConfig;
import io.deskrelay.config.RuntimeSettings;
import io.deskrelay.error.DeskRelayException;
import io.deskrelay.error.StoreUnavailableException;
import io.deskrelay.handler.EchoHandler;
import io.deskrelay.handler.FailHandler;
import io.deskrelay.handler.HandlerRegistry;
import io.deskrelay.handler.PayloadShape;
import io.deskrelay.handler.RunCommandHandler;
import io.deskrelay.model.Task;
import io.deskrelay.model.TaskFactory;
import io.deskrelay.model.TaskStatus;
import io.deskrelay.observability.AuditLogger;
import io.deskrelay.queue.LocalTaskQueue;
import io.deskrelay.routing.DelegationRouter;
import io.deskrelay.routing.LeastLoadedRoutingPolicy;
import io.deskrelay.routing.PeerDirectory;
import io.deskrelay.storage.Database;
import io.deskrelay.storage.NodeInfo;
import io.deskrelay.storage.RemoteTaskStore;
import io.deskrelay.storage.SqliteRemoteTaskStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

public final class DeskRelayRuntime implements AutoCloseable {
    private static final long AWAIT_POLL_MS = 50L;

    private final DeskRelayConfig config;
    private final RuntimeSettings settings;
    private final Clock clock;
    private final Database database;
    private final RemoteTaskStore store;
    private final HandlerRegistry registry;
    private final TaskFactory taskFactory;
    private final AuditLogger auditLogger;
    private final PeerDirectory peerDirectory;
    private final DelegationRouter router;
    private final ScheduledExecutorService scheduler;
    private final StorePublisher publisher;
    private final TaskProcessor processor;
    private boolean running;

    public DeskRelayRuntime(DeskRelayConfig config) {
        this(config, RuntimeSettings.load(config.settingsFile()), builder -> {
        });
    }

    public DeskRelayRuntime(DeskRelayConfig config, RuntimeSettings settings, Consumer<HandlerRegistry.Builder> extraHandlers) {
        this(config, settings, extraHandlers, UnaryOperator.identity(), Clock.systemUTC());
    }

    DeskRelayRuntime(
            DeskRelayConfig config,
            RuntimeSettings settings,
            Consumer<HandlerRegistry.Builder> extraHandlers,
            UnaryOperator<RemoteTaskStore> storeDecorator,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config.storeFile());
        this.store = storeDecorator.apply(new SqliteRemoteTaskStore(
                database,
                settings.watchBatchSize(),
                settings.watchPollIntervalMs()
        ));
        HandlerRegistry.Builder builder = defaultHandlers(settings);
        if (extraHandlers != null) {
            extraHandlers.accept(builder);
        }
        this.registry = builder.build();
        this.taskFactory = new TaskFactory(registry, clock);
        this.auditLogger = new AuditLogger(config.auditFile(), settings.nodeId());
        this.peerDirectory = new PeerDirectory(store, settings.nodeId(), settings.peers(), settings.peerHealthWindowMs(), clock);
        this.router = new DelegationRouter(store, peerDirectory, new LeastLoadedRoutingPolicy(settings.routeToSelfWithPeers()));
        this.scheduler = Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable, "deskrelay-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        this.publisher = new StorePublisher(store, scheduler, auditLogger,
                settings.publishRetryBaseMs(), settings.publishRetryMaxMs());
        this.processor = new TaskProcessor(
                settings.nodeId(),
                registry,
                new LocalTaskQueue(),
                store,
                publisher,
                scheduler,
                auditLogger,
                new RetryPolicy(settings.maxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs()),
                settings.handlerConcurrencyLimit(),
                settings.watchPollIntervalMs(),
                clock
        );
    }

    public static HandlerRegistry.Builder defaultHandlers(RuntimeSettings settings) {
        HandlerRegistry.Builder builder = HandlerRegistry.builder(settings.defaultHandlerTimeout())
                .register(EchoHandler.TYPE, EchoHandler.SHAPE, new EchoHandler())
                .register(FailHandler.TYPE, FailHandler.SHAPE, new FailHandler());
        if (!settings.runCommand().isEmpty()) {
            RunCommandHandler handler = new RunCommandHandler(settings.runCommand(), settings.runCommandTimeoutMs());
            // The process timeout fires first so the child gets killed rather than orphaned.
            builder.register(RunCommandHandler.TYPE, RunCommandHandler.SHAPE, handler,
                    Duration.ofMillis(handler.timeoutMs() + 1_000L));
        }
        return builder;
    }

    public void init() {
        database.init();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "runtime.settings.load",
                "runtime",
                config.settingsFile().toString(),
                "ok",
                null,
                settingsDetails()
        ));
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public String nodeId() {
        return settings.nodeId();
    }

    public HandlerRegistry registry() {
        return registry;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public Task createTask(String type, Map<String, Object> payload) {
        return createTask(type, payload, null);
    }

    public Task createTask(String type, Map<String, Object> payload, String target) {
        Task task = taskFactory.create(type, payload, settings.nodeId());
        Task owned;
        try {
            owned = router.route(task, target);
        } catch (DeskRelayException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "task.route", "runtime", "task/" + task.id(), "failed", task.id(),
                    Map.of("type", task.type(), "error", String.valueOf(e.getMessage()))
            ));
            throw e;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", owned.type());
        details.put("owner", owned.owner());
        details.put("explicitTarget", target != null && !target.isBlank());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "task.create", "runtime", "task/" + owned.id(), "ok", owned.id(), details
        ));
        if (owned.isOwnedBy(settings.nodeId()) && processor.isStarted()) {
            processor.submit(owned);
        }
        return owned;
    }

    public Optional<Task> getTask(String taskId) {
        Optional<Task> local = processor.localTask(taskId);
        Optional<Task> stored;
        try {
            stored = store.get(taskId);
        } catch (StoreUnavailableException e) {
            if (local.isPresent()) {
                return local;
            }
            throw e;
        }
        if (local.isPresent() && (stored.isEmpty() || local.get().updatedAtMs() > stored.get().updatedAtMs())) {
            return local;
        }
        return stored;
    }

    public List<Task> tasks(String statusRaw, int limit) {
        TaskStatus status = statusRaw == null || statusRaw.isBlank() ? null : TaskStatus.fromString(statusRaw);
        return store.list(status, Math.max(1, limit));
    }

    public Optional<Task> awaitTerminal(String taskId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<Task> task = getTask(taskId);
            if (task.isPresent() && task.get().status().isTerminal()) {
                return task;
            }
            if (System.nanoTime() >= deadline) {
                return Optional.empty();
            }
            Thread.sleep(AWAIT_POLL_MS);
        }
    }

    public CancelOutcome cancelTask(String taskId) {
        Optional<Task> found = getTask(taskId);
        if (found.isEmpty()) {
            return new CancelOutcome(taskId, "not_found", null);
        }
        Task task = found.get();
        if (task.status().isTerminal()) {
            return new CancelOutcome(taskId, "already_terminal", task.status());
        }
        boolean ownedHere = task.isOwnedBy(settings.nodeId()) && processor.isStarted();
        try {
            store.requestCancel(taskId, settings.nodeId(), clock.millis());
        } catch (StoreUnavailableException e) {
            if (!ownedHere) {
                throw e;
            }
        }
        CancelOutcome outcome;
        if (ownedHere) {
            Task local = processor.cancel(taskId).orElse(task);
            outcome = new CancelOutcome(taskId, local.status() == TaskStatus.CANCELLED ? "cancelled" : "requested", local.status());
        } else {
            outcome = new CancelOutcome(taskId, "requested", task.status());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "task.cancel", "runtime", "task/" + taskId, outcome.result(), taskId,
                Map.of("owner", String.valueOf(task.owner()), "status", outcome.status().name())
        ));
        return outcome;
    }

    public List<PeerView> peers() {
        long nowMs = clock.millis();
        List<PeerView> out = new ArrayList<>();
        for (NodeInfo node : store.listNodes()) {
            out.add(new PeerView(
                    node.nodeId(),
                    node.status().name().toLowerCase(),
                    node.descriptor(),
                    List.copyOf(new TreeSet<>(node.handlerTypes())),
                    node.lastSeenMs(),
                    node.isHealthy(nowMs, settings.peerHealthWindowMs()),
                    node.nodeId().equals(settings.nodeId())
            ));
        }
        return out;
    }

    public List<HandlerView> handlerTypes() {
        List<HandlerView> out = new ArrayList<>();
        for (String type : registry.types()) {
            HandlerRegistry.Registration registration = registry.resolve(type);
            Map<String, String> params = new LinkedHashMap<>();
            for (Map.Entry<String, PayloadShape.ParamSpec> e : registration.shape().params().entrySet()) {
                params.put(e.getKey(), e.getValue().kind().label() + (e.getValue().required() ? "" : "?"));
            }
            out.add(new HandlerView(type, params, registration.timeout().toMillis()));
        }
        return out;
    }

    public PurgeOutcome purge() {
        return purge(settings.terminalRetentionMs());
    }

    public PurgeOutcome purge(long retentionMs) {
        long cutoff = clock.millis() - Math.max(0L, retentionMs);
        int removed = store.purgeTerminalBefore(cutoff);
        int forgotten = processor.forgetTerminalBefore(cutoff);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "maintenance.purge", "runtime", "store", "ok", null,
                Map.of("cutoffMs", cutoff, "removed", removed, "forgotten", forgotten)
        ));
        return new PurgeOutcome(cutoff, removed, forgotten);
    }

    public Map<String, Object> stats() {
        return processor.stats();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        processor.start();
        heartbeat();
        scheduler.scheduleAtFixedRate(this::heartbeat,
                settings.heartbeatIntervalMs(), settings.heartbeatIntervalMs(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::maintenanceTick,
                settings.maintenanceIntervalMs(), settings.maintenanceIntervalMs(), TimeUnit.MILLISECONDS);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized void shutdown() {
        if (running) {
            processor.close();
            try {
                store.markOffline(settings.nodeId(), clock.millis());
            } catch (StoreUnavailableException e) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "node.offline", "runtime", "node/" + settings.nodeId(), "store_unavailable", null,
                        Map.of("error", String.valueOf(e.getMessage()))
                ));
            }
            running = false;
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        shutdown();
    }

    private void heartbeat() {
        try {
            store.heartbeat(settings.nodeId(), settings.descriptor(), registry.types(), clock.millis());
        } catch (StoreUnavailableException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "node.heartbeat", "runtime", "node/" + settings.nodeId(), "store_unavailable", null,
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
        }
    }

    private void maintenanceTick() {
        try {
            purge();
        } catch (DeskRelayException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "maintenance.purge", "runtime", "store", "failed", null,
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
        }
    }

    private Map<String, Object> settingsDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("nodeId", settings.nodeId());
        details.put("store", config.storeFile().toString());
        details.put("maxAttempts", settings.maxAttempts());
        details.put("handlerConcurrencyLimit", settings.handlerConcurrencyLimit());
        details.put("peers", settings.peers());
        details.put("handlers", List.copyOf(registry.types()));
        return details;
    }

    public record CancelOutcome(String taskId, String result, TaskStatus status) {
    }

    public record PeerView(
            String nodeId,
            String status,
            String descriptor,
            List<String> handlerTypes,
            long lastSeenMs,
            boolean healthy,
            boolean self
    ) {
    }

    public record HandlerView(String type, Map<String, String> parameters, long timeoutMs) {
    }

    public record PurgeOutcome(long cutoffMs, int tasksRemoved, int localEntriesForgotten) {
    }
}
