package io.deskrelay.handler;

import io.deskrelay.error.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class PayloadShape {
    private static final PayloadShape EMPTY = new PayloadShape(Map.of());

    private final Map<String, ParamSpec> params;

    private PayloadShape(Map<String, ParamSpec> params) {
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static PayloadShape empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ParamSpec> params() {
        return params;
    }

    public void validate(Map<String, Object> payload) {
        Map<String, Object> safe = payload == null ? Map.of() : payload;
        for (Map.Entry<String, ParamSpec> entry : params.entrySet()) {
            String name = entry.getKey();
            ParamSpec spec = entry.getValue();
            Object value = safe.get(name);
            if (value == null) {
                if (spec.required()) {
                    throw new ValidationException("payload." + name, "required parameter is missing");
                }
                continue;
            }
            if (!spec.kind().accepts(value)) {
                throw new ValidationException(
                        "payload." + name,
                        "expected " + spec.kind().label() + " but got " + value.getClass().getSimpleName()
                );
            }
        }
        for (String key : safe.keySet()) {
            if (!params.containsKey(key)) {
                throw new ValidationException("payload." + key, "undeclared parameter");
            }
        }
    }

    public record ParamSpec(ParamKind kind, boolean required) {
    }

    public static final class Builder {
        private final Map<String, ParamSpec> params = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder required(String name, ParamKind kind) {
            return add(name, kind, true);
        }

        public Builder optional(String name, ParamKind kind) {
            return add(name, kind, false);
        }

        private Builder add(String name, ParamKind kind, boolean required) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("parameter name cannot be empty");
            }
            if (kind == null) {
                throw new IllegalArgumentException("parameter kind cannot be null: " + name);
            }
            if (params.putIfAbsent(name, new ParamSpec(kind, required)) != null) {
                throw new IllegalArgumentException("parameter declared twice: " + name);
            }
            return this;
        }

        public PayloadShape build() {
            return params.isEmpty() ? EMPTY : new PayloadShape(params);
        }
    }
}
