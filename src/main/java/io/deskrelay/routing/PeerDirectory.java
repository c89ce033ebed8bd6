package io.deskrelay.routing;

import io.deskrelay.storage.NodeInfo;
import io.deskrelay.storage.RemoteTaskStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class PeerDirectory {
    private final RemoteTaskStore store;
    private final String selfId;
    private final Set<String> allowlist;
    private final long healthWindowMs;
    private final Clock clock;

    public PeerDirectory(RemoteTaskStore store, String selfId, List<String> allowlist, long healthWindowMs, Clock clock) {
        this.store = store;
        this.selfId = selfId;
        this.allowlist = allowlist == null ? Set.of() : Set.copyOf(allowlist);
        this.healthWindowMs = healthWindowMs;
        this.clock = clock;
    }

    public String selfId() {
        return selfId;
    }

    public List<String> healthyPeers() {
        return healthyPeers(null);
    }

    // Peers that last advertised a handler for taskType; any type when taskType is null.
    public List<String> healthyPeers(String taskType) {
        long nowMs = clock.millis();
        List<String> out = new ArrayList<>();
        for (NodeInfo node : store.listNodes()) {
            if (node.nodeId().equals(selfId)) {
                continue;
            }
            if (!allowlist.isEmpty() && !allowlist.contains(node.nodeId())) {
                continue;
            }
            if (taskType != null && !node.canServe(taskType)) {
                continue;
            }
            if (node.isHealthy(nowMs, healthWindowMs)) {
                out.add(node.nodeId());
            }
        }
        out.sort(String::compareTo);
        return out;
    }

    public Optional<NodeInfo> node(String nodeId) {
        for (NodeInfo node : store.listNodes()) {
            if (node.nodeId().equals(nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
}
