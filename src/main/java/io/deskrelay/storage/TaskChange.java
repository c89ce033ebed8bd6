package io.deskrelay.storage;

import io.deskrelay.model.Task;

public record TaskChange(
        Task task,
        long version,
        boolean cancelRequested
) {
}
