package io.deskrelay.routing;

import io.deskrelay.error.DelegationException;
import io.deskrelay.model.Task;
import io.deskrelay.model.TaskStatus;
import io.deskrelay.storage.Database;
import io.deskrelay.storage.SqliteRemoteTaskStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class DelegationRouterTest {
    private static final long NOW = 1_000_000L;
    private static final Set<String> ECHO_ONLY = Set.of("echo");
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);

    @Test
    void keepsTaskLocalWhenNoPeerIsHealthy() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-solo-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            store.heartbeat("bravo", "", ECHO_ONLY, NOW - 120_000L);
            DelegationRouter router = router(store, List.of(), false);

            Task owned = router.route(newTask("tsk_solo"));
            Assertions.assertEquals("alpha", owned.owner());
            Assertions.assertEquals(owned, store.get("tsk_solo").orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void picksTheLeastLoadedHealthyPeer() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-load-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            store.heartbeat("bravo", "", ECHO_ONLY, NOW);
            store.heartbeat("charlie", "", ECHO_ONLY, NOW);
            store.put(newTask("tsk_b1").withOwner("bravo"));
            store.put(newTask("tsk_b2").withOwner("bravo"));
            DelegationRouter router = router(store, List.of(), false);

            Task owned = router.route(newTask("tsk_next"));
            Assertions.assertEquals("charlie", owned.owner());
            Assertions.assertEquals(TaskStatus.PENDING, store.get("tsk_next").orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void equalLoadGoesToTheLexicallySmallestPeer() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-tie-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            store.heartbeat("delta", "", ECHO_ONLY, NOW);
            store.heartbeat("bravo", "", ECHO_ONLY, NOW);
            DelegationRouter router = router(store, List.of(), false);

            Assertions.assertEquals("bravo", router.route(newTask("tsk_tie")).owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void selfCompetesWhenConfiguredTo() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-self-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            store.heartbeat("bravo", "", ECHO_ONLY, NOW);
            store.put(newTask("tsk_b1").withOwner("bravo"));
            DelegationRouter router = router(store, List.of(), true);

            Assertions.assertEquals("alpha", router.route(newTask("tsk_self")).owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ignoresStaleOfflineAndNonAllowlistedPeers() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-filter-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            store.heartbeat("bravo", "", ECHO_ONLY, NOW - 61_000L);
            store.heartbeat("charlie", "", ECHO_ONLY, NOW);
            store.markOffline("charlie", NOW);
            store.heartbeat("delta", "", ECHO_ONLY, NOW);
            store.heartbeat("echo", "", ECHO_ONLY, NOW);

            PeerDirectory everyone = new PeerDirectory(store, "alpha", List.of(), 60_000L, clock);
            Assertions.assertEquals(List.of("delta", "echo"), everyone.healthyPeers());

            PeerDirectory allowlisted = new PeerDirectory(store, "alpha", List.of("echo"), 60_000L, clock);
            Assertions.assertEquals(List.of("echo"), allowlisted.healthyPeers());
            Assertions.assertEquals("echo", router(store, List.of("echo"), false).route(newTask("tsk_allow")).owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void explicitTargetBypassesThePolicy() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-target-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            store.heartbeat("bravo", "", ECHO_ONLY, NOW);
            DelegationRouter router = router(store, List.of(), false);

            Task owned = router.route(newTask("tsk_target"), " alpha ");
            Assertions.assertEquals("alpha", owned.owner());
            Assertions.assertEquals("alpha", store.get("tsk_target").orElseThrow().owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void skipsPeersWithoutAHandlerForTheType() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-capability-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            store.heartbeat("bravo", "", Set.of("fail"), NOW);
            store.heartbeat("charlie", "", Set.of("echo", "fail"), NOW);
            store.put(newTask("tsk_c1").withOwner("charlie"));
            DelegationRouter router = router(store, List.of(), false);

            Assertions.assertEquals("charlie", router.route(newTask("tsk_cap")).owner());

            store.heartbeat("charlie", "", Set.of("fail"), NOW);
            Assertions.assertEquals("alpha", router.route(newTask("tsk_cap_local")).owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void explicitTargetWithoutTheHandlerIsRefused() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-target-cap-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            store.heartbeat("bravo", "", Set.of("fail"), NOW);
            DelegationRouter router = router(store, List.of(), false);

            DelegationException e = Assertions.assertThrows(DelegationException.class,
                    () -> router.route(newTask("tsk_refused"), "bravo"));
            Assertions.assertTrue(e.getMessage().contains("echo"), e.getMessage());
            Assertions.assertTrue(store.get("tsk_refused").isEmpty());

            Assertions.assertEquals("zulu", router.route(newTask("tsk_unknown_node"), "zulu").owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void refusesAlreadyOwnedTasks() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-owned-");
        try {
            SqliteRemoteTaskStore store = openStore(root);
            DelegationRouter router = router(store, List.of(), false);
            Task owned = newTask("tsk_owned").withOwner("bravo");
            Assertions.assertThrows(IllegalArgumentException.class, () -> router.route(owned));
            Assertions.assertTrue(store.get("tsk_owned").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storeFailureFailsCreationInsteadOfRunningLocally() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-router-down-");
        try {
            Path blocker = Files.createFile(root.resolve("blocker"));
            SqliteRemoteTaskStore store = new SqliteRemoteTaskStore(new Database(blocker.resolve("deskrelay.db")));
            DelegationRouter router = router(store, List.of(), false);

            DelegationException e = Assertions.assertThrows(DelegationException.class,
                    () -> router.route(newTask("tsk_down")));
            Assertions.assertNotNull(e.getCause());
            Assertions.assertThrows(DelegationException.class, () -> router.route(newTask("tsk_down2"), "alpha"));
        } finally {
            deleteRecursively(root);
        }
    }

    private DelegationRouter router(SqliteRemoteTaskStore store, List<String> allowlist, boolean includeSelf) {
        PeerDirectory peers = new PeerDirectory(store, "alpha", allowlist, 60_000L, clock);
        return new DelegationRouter(store, peers, new LeastLoadedRoutingPolicy(includeSelf));
    }

    private static Task newTask(String id) {
        return Task.newPending(id, "echo", Map.of("msg", id), "alpha", NOW);
    }

    private static SqliteRemoteTaskStore openStore(Path root) {
        Database database = new Database(root.resolve("deskrelay.db"));
        database.init();
        return new SqliteRemoteTaskStore(database);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
