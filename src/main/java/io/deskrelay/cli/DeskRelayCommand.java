package io.deskrelay.cli;

import io.deskrelay.config.DeskRelayConfig;
import io.deskrelay.config.RuntimeSettings;
import io.deskrelay.error.DelegationException;
import io.deskrelay.error.ValidationException;
import io.deskrelay.model.Task;
import io.deskrelay.runtime.DeskRelayRuntime;
import io.deskrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "deskrelay",
        mixinStandardHelpOptions = true,
        description = "DeskRelay task delegation CLI",
        subcommands = {
                DeskRelayCommand.InitCommand.class,
                DeskRelayCommand.CreateCommand.class,
                DeskRelayCommand.TaskCommand.class,
                DeskRelayCommand.TasksCommand.class,
                DeskRelayCommand.CancelCommand.class,
                DeskRelayCommand.HandlersCommand.class,
                DeskRelayCommand.PeersCommand.class,
                DeskRelayCommand.RunCommand.class,
                DeskRelayCommand.PurgeCommand.class
        }
)
public final class DeskRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Local data root (settings, audit log)", defaultValue = DeskRelayConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--store"}, description = "Shared store file; defaults to <root>/deskrelay.db")
    String store;

    @Option(names = {"--node"}, description = "Node id override; defaults to settings nodeId or the host name")
    String node;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create | task | tasks | cancel | handlers | peers | run | purge");
    }

    DeskRelayRuntime runtime() {
        DeskRelayConfig config = DeskRelayConfig.fromRoot(root, store);
        RuntimeSettings settings = RuntimeSettings.load(config.settingsFile());
        if (node != null && !node.isBlank()) {
            settings = settings.withNodeId(node);
        }
        return new DeskRelayRuntime(config, settings, null);
    }

    static Map<String, Object> error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        return out;
    }

    @Command(name = "init", description = "Initialize the data root and store schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Override
        public Integer call() {
            try (DeskRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println("Initialized DeskRelay node " + runtime.nodeId()
                        + " at: " + DeskRelayConfig.fromRoot(parent.root, parent.store).rootDir());
            }
            return 0;
        }
    }

    @Command(name = "create", description = "Create a task and delegate it to a machine")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Option(names = {"--type"}, required = true, description = "Handler type")
        String type;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "Payload as a JSON object")
        String payload;

        @Option(names = {"--target"}, description = "Deliver to this node instead of letting routing pick")
        String target;

        @Option(names = {"--wait-ms"}, defaultValue = "0", description = "Wait up to this long for a terminal state")
        long waitMs;

        @Override
        public Integer call() throws InterruptedException {
            try (DeskRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                Task task;
                try {
                    task = runtime.createTask(type, Jsons.readMap(payload), target);
                } catch (ValidationException e) {
                    Map<String, Object> out = error(e.getMessage());
                    out.put("field", e.field());
                    System.out.println(Jsons.toJson(out));
                    return 2;
                } catch (IllegalArgumentException | DelegationException e) {
                    System.out.println(Jsons.toJson(error(e.getMessage())));
                    return 1;
                }
                if (waitMs > 0L) {
                    Optional<Task> done = runtime.awaitTerminal(task.id(), Duration.ofMillis(waitMs));
                    if (done.isPresent()) {
                        task = done.get();
                    }
                }
                System.out.println(Jsons.toJson(task));
            }
            return 0;
        }
    }

    @Command(name = "task", description = "Show one task")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (DeskRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                Optional<Task> task = runtime.getTask(taskId);
                if (task.isEmpty()) {
                    System.out.println("{\"error\":\"task not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(task.get()));
            }
            return 0;
        }
    }

    @Command(name = "tasks", description = "List tasks, newest first")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Option(names = {"--status"}, description = "pending|in_progress|completed|failed|cancelled")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (DeskRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                List<Task> tasks = runtime.tasks(status, limit);
                System.out.println(Jsons.toJson(tasks));
            }
            return 0;
        }
    }

    @Command(name = "cancel", description = "Cancel a task that has not started")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (DeskRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                DeskRelayRuntime.CancelOutcome outcome = runtime.cancelTask(taskId);
                System.out.println(Jsons.toJson(outcome));
                return "not_found".equals(outcome.result()) ? 1 : 0;
            }
        }
    }

    @Command(name = "handlers", description = "List registered task types and their parameters")
    static final class HandlersCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Override
        public Integer call() {
            try (DeskRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.handlerTypes()));
            }
            return 0;
        }
    }

    @Command(name = "peers", description = "List known machines and their health")
    static final class PeersCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Override
        public Integer call() {
            try (DeskRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.peers()));
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Process tasks owned by this machine until interrupted")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Option(names = {"--stats-interval-ms"}, defaultValue = "0",
                description = "Print processor stats at this interval; 0 disables")
        long statsIntervalMs;

        @Override
        public Integer call() throws InterruptedException {
            DeskRelayRuntime runtime = parent.runtime();
            runtime.init();
            runtime.start();
            System.out.println("DeskRelay node " + runtime.nodeId() + " processing; Ctrl+C to stop");
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.close();
                stopped.countDown();
            }, "deskrelay-shutdown-hook"));
            if (statsIntervalMs <= 0L) {
                stopped.await();
                return 0;
            }
            while (!stopped.await(statsIntervalMs, TimeUnit.MILLISECONDS)) {
                System.out.println(Jsons.toCompactJson(runtime.stats()));
            }
            return 0;
        }
    }

    @Command(name = "purge", description = "Delete terminal tasks older than the retention window")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        DeskRelayCommand parent;

        @Option(names = {"--older-than-ms"}, description = "Retention override; defaults to terminalRetentionMs")
        Long olderThanMs;

        @Override
        public Integer call() {
            try (DeskRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                DeskRelayRuntime.PurgeOutcome outcome = olderThanMs == null
                        ? runtime.purge()
                        : runtime.purge(olderThanMs);
                System.out.println(Jsons.toJson(outcome));
            }
            return 0;
        }
    }
}
