package io.deskrelay.handler;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

public enum ParamKind {
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    ANY;

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map<?, ?>;
            case ARRAY -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
            case ANY -> true;
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
