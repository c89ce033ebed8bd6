package io.deskrelay.observability;

import io.deskrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private final Path auditFile;
    private final String nodeId;

    public AuditLogger(Path auditFile, String nodeId) {
        this.auditFile = auditFile;
        this.nodeId = nodeId == null || nodeId.isBlank() ? "unknown" : nodeId.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("node", nodeId);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public List<String> tail(int lines) {
        int safe = Math.max(1, lines);
        try {
            List<String> all = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            List<String> out = new ArrayList<>(all.subList(Math.max(0, all.size() - safe), all.size()));
            out.removeIf(String::isBlank);
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String taskId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String taskId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, taskId, details == null ? Map.of() : details);
        }
    }
}
