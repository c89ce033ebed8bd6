package io.deskrelay.handler;

import io.deskrelay.error.DuplicateTypeException;
import io.deskrelay.error.UnknownTypeException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class HandlerRegistry {
    private final Map<String, Registration> registrations;

    private HandlerRegistry(Map<String, Registration> registrations) {
        this.registrations = Collections.unmodifiableMap(new LinkedHashMap<>(registrations));
    }

    public static Builder builder(Duration defaultTimeout) {
        return new Builder(defaultTimeout);
    }

    public Registration resolve(String type) {
        Registration registration = type == null ? null : registrations.get(type);
        if (registration == null) {
            throw new UnknownTypeException(type);
        }
        return registration;
    }

    public boolean contains(String type) {
        return type != null && registrations.containsKey(type);
    }

    public Set<String> types() {
        return registrations.keySet();
    }

    public record Registration(
            String type,
            PayloadShape shape,
            Handler handler,
            Duration timeout
    ) {
    }

    public static final class Builder {
        private final Duration defaultTimeout;
        private final Map<String, Registration> registrations = new LinkedHashMap<>();

        private Builder(Duration defaultTimeout) {
            if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
                throw new IllegalArgumentException("default handler timeout must be positive");
            }
            this.defaultTimeout = defaultTimeout;
        }

        public Builder register(String type, PayloadShape shape, Handler handler) {
            return register(type, shape, handler, null);
        }

        public Builder register(String type, PayloadShape shape, Handler handler, Duration timeout) {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("handler type cannot be empty");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null: " + type);
            }
            if (registrations.containsKey(type)) {
                throw new DuplicateTypeException(type);
            }
            Duration effective = timeout == null || timeout.isZero() || timeout.isNegative()
                    ? defaultTimeout
                    : timeout;
            registrations.put(type, new Registration(
                    type,
                    shape == null ? PayloadShape.empty() : shape,
                    handler,
                    effective
            ));
            return this;
        }

        public boolean contains(String type) {
            return registrations.containsKey(type);
        }

        public HandlerRegistry build() {
            return new HandlerRegistry(registrations);
        }
    }
}
