package io.deskrelay.storage;

import java.util.Set;

public record NodeInfo(
        String nodeId,
        NodeStatus status,
        String descriptor,
        Set<String> handlerTypes,
        long lastSeenMs
) {
    public NodeInfo {
        handlerTypes = handlerTypes == null ? Set.of() : Set.copyOf(handlerTypes);
    }

    public boolean canServe(String type) {
        return handlerTypes.contains(type);
    }

    public boolean isHealthy(long nowMs, long healthWindowMs) {
        return status == NodeStatus.ONLINE && (nowMs - lastSeenMs) <= healthWindowMs;
    }

    public enum NodeStatus {
        ONLINE,
        OFFLINE
    }
}
