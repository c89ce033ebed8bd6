package io.deskrelay.handler;

import java.util.Map;

public record HandlerContext(
        String taskId,
        String type,
        int attempt,
        String origin,
        Map<String, Object> payload
) {
    public HandlerContext {
        payload = payload == null ? Map.of() : payload;
    }

    public String string(String name) {
        Object value = payload.get(name);
        return value == null ? null : value.toString();
    }
}
