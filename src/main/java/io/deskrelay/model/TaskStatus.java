package io.deskrelay.model;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public Set<TaskStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, CANCELLED);
            // IN_PROGRESS -> PENDING is the retry edge.
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED, PENDING);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus next) {
        return next != null && allowedNext().contains(next);
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status cannot be empty");
        }
        String normalized = raw.trim().replace('-', '_');
        for (TaskStatus value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
