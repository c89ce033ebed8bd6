package io.deskrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.deskrelay.util.Jsons;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record RuntimeSettings(
        String nodeId,
        String descriptor,
        List<String> peers,
        boolean routeToSelfWithPeers,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        int handlerConcurrencyLimit,
        long defaultHandlerTimeoutMs,
        long watchPollIntervalMs,
        int watchBatchSize,
        long peerHealthWindowMs,
        long heartbeatIntervalMs,
        long publishRetryBaseMs,
        long publishRetryMaxMs,
        long terminalRetentionMs,
        long maintenanceIntervalMs,
        List<String> runCommand,
        long runCommandTimeoutMs
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final int DEFAULT_HANDLER_CONCURRENCY = 4;
    public static final long DEFAULT_HANDLER_TIMEOUT_MS = 30_000L;

    public RuntimeSettings {
        peers = peers == null ? List.of() : List.copyOf(peers);
        runCommand = runCommand == null ? List.of() : List.copyOf(runCommand);
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                localHostName(),
                "",
                List.of(),
                false,
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_BASE_BACKOFF_MS,
                DEFAULT_MAX_BACKOFF_MS,
                DEFAULT_HANDLER_CONCURRENCY,
                DEFAULT_HANDLER_TIMEOUT_MS,
                500L,
                64,
                60_000L,
                15_000L,
                500L,
                30_000L,
                7L * 24L * 60L * 60L * 1000L,
                60_000L,
                List.of(),
                60_000L
        );
    }

    public static RuntimeSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load runtime settings: " + settingsFile, e);
        }
    }

    static RuntimeSettings fromFile(SettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        long publishBase = sanitizeLong(file.publishRetryBaseMs(), defaults.publishRetryBaseMs(), 1L);
        long publishMax = sanitizeLong(file.publishRetryMaxMs(), defaults.publishRetryMaxMs(), publishBase);
        return new RuntimeSettings(
                sanitizeString(file.nodeId(), defaults.nodeId()),
                sanitizeString(file.descriptor(), defaults.descriptor()),
                file.peers() == null ? defaults.peers() : file.peers().stream()
                        .filter(p -> p != null && !p.isBlank())
                        .map(String::trim)
                        .distinct()
                        .toList(),
                file.routeToSelfWithPeers() == null ? defaults.routeToSelfWithPeers() : file.routeToSelfWithPeers(),
                sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeInt(file.handlerConcurrencyLimit(), defaults.handlerConcurrencyLimit(), 1),
                sanitizeLong(file.defaultHandlerTimeoutMs(), defaults.defaultHandlerTimeoutMs(), 1L),
                sanitizeLong(file.watchPollIntervalMs(), defaults.watchPollIntervalMs(), 10L),
                sanitizeInt(file.watchBatchSize(), defaults.watchBatchSize(), 1),
                sanitizeLong(file.peerHealthWindowMs(), defaults.peerHealthWindowMs(), 1_000L),
                sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 100L),
                publishBase,
                publishMax,
                sanitizeLong(file.terminalRetentionMs(), defaults.terminalRetentionMs(), 0L),
                sanitizeLong(file.maintenanceIntervalMs(), defaults.maintenanceIntervalMs(), 1_000L),
                file.runCommand() == null ? defaults.runCommand() : file.runCommand(),
                sanitizeLong(file.runCommandTimeoutMs(), defaults.runCommandTimeoutMs(), 1_000L)
        );
    }

    public RuntimeSettings withNodeId(String id) {
        return new RuntimeSettings(sanitizeString(id, nodeId), descriptor, peers, routeToSelfWithPeers, maxAttempts,
                baseBackoffMs, maxBackoffMs, handlerConcurrencyLimit, defaultHandlerTimeoutMs, watchPollIntervalMs,
                watchBatchSize, peerHealthWindowMs, heartbeatIntervalMs, publishRetryBaseMs, publishRetryMaxMs,
                terminalRetentionMs, maintenanceIntervalMs, runCommand, runCommandTimeoutMs);
    }

    public Duration defaultHandlerTimeout() {
        return Duration.ofMillis(defaultHandlerTimeoutMs);
    }

    private static String localHostName() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            return host == null || host.isBlank() ? "localhost" : host;
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeString(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String nodeId,
            String descriptor,
            List<String> peers,
            Boolean routeToSelfWithPeers,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Integer handlerConcurrencyLimit,
            Long defaultHandlerTimeoutMs,
            Long watchPollIntervalMs,
            Integer watchBatchSize,
            Long peerHealthWindowMs,
            Long heartbeatIntervalMs,
            Long publishRetryBaseMs,
            Long publishRetryMaxMs,
            Long terminalRetentionMs,
            Long maintenanceIntervalMs,
            List<String> runCommand,
            Long runCommandTimeoutMs
    ) {
    }
}
