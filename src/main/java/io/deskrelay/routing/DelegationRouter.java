package io.deskrelay.routing;

import io.deskrelay.error.DelegationException;
import io.deskrelay.error.StoreUnavailableException;
import io.deskrelay.model.Task;
import io.deskrelay.storage.NodeInfo;
import io.deskrelay.storage.RemoteTaskStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class DelegationRouter {
    private final RemoteTaskStore store;
    private final PeerDirectory peers;
    private final RoutingPolicy policy;

    public DelegationRouter(RemoteTaskStore store, PeerDirectory peers, RoutingPolicy policy) {
        this.store = store;
        this.peers = peers;
        this.policy = policy;
    }

    public Task route(Task task) {
        return route(task, null);
    }

    public Task route(Task task, String explicitTarget) {
        if (task.isOwned()) {
            throw new IllegalArgumentException("task " + task.id() + " already has owner " + task.owner());
        }
        String selfId = peers.selfId();
        Task owned;
        try {
            String owner;
            if (explicitTarget != null && !explicitTarget.isBlank()) {
                owner = explicitTarget.trim();
                if (!owner.equals(selfId)) {
                    Optional<NodeInfo> known = peers.node(owner);
                    if (known.isPresent() && !known.get().canServe(task.type())) {
                        throw new DelegationException("node " + owner + " has no handler for type '" + task.type() + "'", null);
                    }
                }
            } else {
                List<String> healthy = peers.healthyPeers(task.type());
                List<String> candidates = new ArrayList<>(healthy);
                candidates.add(selfId);
                Map<String, Integer> load = healthy.isEmpty() ? Map.of() : store.countActiveByOwner(candidates);
                owner = policy.chooseOwner(task, selfId, healthy, load);
            }
            if (owner == null || owner.isBlank()) {
                throw new DelegationException("routing policy chose no owner for task " + task.id(), null);
            }
            owned = task.withOwner(owner);
        } catch (StoreUnavailableException e) {
            throw new DelegationException("could not observe peer load for task " + task.id(), e);
        }
        try {
            store.put(owned);
        } catch (StoreUnavailableException e) {
            throw new DelegationException("could not publish owner assignment for task " + task.id(), e);
        }
        return owned;
    }
}
