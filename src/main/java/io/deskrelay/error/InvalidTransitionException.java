package io.deskrelay.error;

import io.deskrelay.model.TaskStatus;

public final class InvalidTransitionException extends DeskRelayException {
    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("illegal transition for task " + taskId + ": " + from + " -> " + to);
    }
}
