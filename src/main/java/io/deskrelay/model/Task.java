package io.deskrelay.model;

import io.deskrelay.error.InvalidTransitionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Task(
        String id,
        String type,
        Map<String, Object> payload,
        String owner,
        String origin,
        TaskStatus status,
        int attempt,
        long createdAtMs,
        long updatedAtMs,
        long notBeforeMs,
        TaskResult result
) {
    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task id cannot be empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("task status cannot be null: " + id);
        }
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        owner = owner == null || owner.isBlank() ? null : owner;
        attempt = Math.max(0, attempt);
    }

    public static Task newPending(String id, String type, Map<String, Object> payload, String origin, long nowMs) {
        return new Task(id, type, payload, null, origin, TaskStatus.PENDING, 0, nowMs, nowMs, 0L, null);
    }

    public boolean isOwned() {
        return owner != null;
    }

    public boolean isOwnedBy(String nodeId) {
        return owner != null && owner.equals(nodeId);
    }

    public boolean isDue(long nowMs) {
        return status == TaskStatus.PENDING && notBeforeMs <= nowMs;
    }

    public Task withOwner(String newOwner) {
        if (owner != null) {
            throw new IllegalStateException("task " + id + " is already owned by " + owner);
        }
        if (newOwner == null || newOwner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be empty for task " + id);
        }
        return new Task(id, type, payload, newOwner, origin, status, attempt, createdAtMs, updatedAtMs, notBeforeMs, result);
    }

    public Task start(long nowMs) {
        requireTransition(TaskStatus.IN_PROGRESS);
        return new Task(id, type, payload, owner, origin, TaskStatus.IN_PROGRESS, attempt + 1,
                createdAtMs, nextUpdatedAt(nowMs), 0L, null);
    }

    public Task complete(String output, long nowMs) {
        requireTransition(TaskStatus.COMPLETED);
        return new Task(id, type, payload, owner, origin, TaskStatus.COMPLETED, attempt,
                createdAtMs, nextUpdatedAt(nowMs), 0L, TaskResult.ok(output));
    }

    public Task fail(String error, long nowMs) {
        requireTransition(TaskStatus.FAILED);
        return new Task(id, type, payload, owner, origin, TaskStatus.FAILED, attempt,
                createdAtMs, nextUpdatedAt(nowMs), 0L, TaskResult.failed(error));
    }

    public Task retryAt(long notBefore, long nowMs) {
        requireTransition(TaskStatus.PENDING);
        return new Task(id, type, payload, owner, origin, TaskStatus.PENDING, attempt,
                createdAtMs, nextUpdatedAt(nowMs), Math.max(0L, notBefore), null);
    }

    public Task cancel(long nowMs) {
        requireTransition(TaskStatus.CANCELLED);
        return new Task(id, type, payload, owner, origin, TaskStatus.CANCELLED, attempt,
                createdAtMs, nextUpdatedAt(nowMs), 0L, null);
    }

    private void requireTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidTransitionException(id, status, next);
        }
    }

    private long nextUpdatedAt(long nowMs) {
        return Math.max(nowMs, updatedAtMs + 1L);
    }
}
