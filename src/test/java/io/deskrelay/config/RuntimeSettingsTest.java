package io.deskrelay.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class RuntimeSettingsTest {

    @Test
    void missingFileMeansDefaults() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-settings-missing-");
        try {
            DeskRelayConfig config = DeskRelayConfig.fromRoot(root.toString());
            RuntimeSettings settings = RuntimeSettings.load(config.settingsFile());
            Assertions.assertEquals(RuntimeSettings.defaults(), settings);
            Assertions.assertEquals(3, settings.maxAttempts());
            Assertions.assertEquals(4, settings.handlerConcurrencyLimit());
            Assertions.assertFalse(settings.nodeId().isBlank());
            Assertions.assertTrue(settings.peers().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesOverrideAndAreClamped() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-settings-file-");
        try {
            DeskRelayConfig config = DeskRelayConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "nodeId": "  study-pc ",
                      "peers": ["laptop", " laptop ", "", "nas"],
                      "maxAttempts": 0,
                      "baseBackoffMs": 2000,
                      "maxBackoffMs": 500,
                      "handlerConcurrencyLimit": 8,
                      "watchPollIntervalMs": 1,
                      "runCommand": ["notify-send", "DeskRelay"],
                      "somethingFromANewerVersion": true
                    }
                    """, StandardCharsets.UTF_8);

            RuntimeSettings settings = RuntimeSettings.load(config.settingsFile());
            Assertions.assertEquals("study-pc", settings.nodeId());
            Assertions.assertEquals(List.of("laptop", "nas"), settings.peers());
            Assertions.assertEquals(1, settings.maxAttempts());
            Assertions.assertEquals(2_000L, settings.baseBackoffMs());
            Assertions.assertEquals(2_000L, settings.maxBackoffMs());
            Assertions.assertEquals(8, settings.handlerConcurrencyLimit());
            Assertions.assertEquals(10L, settings.watchPollIntervalMs());
            Assertions.assertEquals(List.of("notify-send", "DeskRelay"), settings.runCommand());
            Assertions.assertEquals(RuntimeSettings.DEFAULT_HANDLER_TIMEOUT_MS, settings.defaultHandlerTimeoutMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedFileIsReported() throws Exception {
        Path root = Files.createTempDirectory("deskrelay-settings-bad-");
        try {
            DeskRelayConfig config = DeskRelayConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{ not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalStateException.class, () -> RuntimeSettings.load(config.settingsFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nodeIdOverrideKeepsEverythingElse() {
        RuntimeSettings base = RuntimeSettings.defaults();
        RuntimeSettings renamed = base.withNodeId(" kitchen ");
        Assertions.assertEquals("kitchen", renamed.nodeId());
        Assertions.assertEquals(base.maxAttempts(), renamed.maxAttempts());
        Assertions.assertEquals(base.nodeId(), base.withNodeId(" ").nodeId());
    }

    @Test
    void storeFileDefaultsUnderRoot() {
        DeskRelayConfig config = DeskRelayConfig.fromRoot("some-root");
        Assertions.assertTrue(config.rootDir().isAbsolute());
        Assertions.assertEquals(config.rootDir().resolve("deskrelay.db"), config.storeFile());
        Assertions.assertEquals(config.rootDir().resolve("audit").resolve("audit.log"), config.auditFile());

        DeskRelayConfig shared = DeskRelayConfig.fromRoot("some-root", "shared/relay.db");
        Assertions.assertTrue(shared.storeFile().isAbsolute());
        Assertions.assertTrue(shared.storeFile().endsWith(Path.of("shared", "relay.db")));
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
