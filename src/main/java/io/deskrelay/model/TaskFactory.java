package io.deskrelay.model;

import io.deskrelay.error.ValidationException;
import io.deskrelay.handler.HandlerRegistry;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

public final class TaskFactory {
    private final HandlerRegistry registry;
    private final Clock clock;

    public TaskFactory(HandlerRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public Task create(String type, Map<String, Object> payload, String origin) {
        if (type == null || type.isBlank()) {
            throw new ValidationException("type", "task type cannot be empty");
        }
        HandlerRegistry.Registration registration = registry.resolve(type);
        registration.shape().validate(payload);
        return Task.newPending(newTaskId(), type, payload, origin, clock.millis());
    }

    static String newTaskId() {
        return "tsk_" + UUID.randomUUID();
    }
}
