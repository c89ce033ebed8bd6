package io.deskrelay.routing;

import io.deskrelay.model.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class LeastLoadedRoutingPolicy implements RoutingPolicy {
    private final boolean includeSelf;

    public LeastLoadedRoutingPolicy() {
        this(false);
    }

    public LeastLoadedRoutingPolicy(boolean includeSelf) {
        this.includeSelf = includeSelf;
    }

    @Override
    public String chooseOwner(Task task, String selfId, List<String> peers, Map<String, Integer> activeLoad) {
        if (peers == null || peers.isEmpty()) {
            return selfId;
        }
        List<String> candidates = new ArrayList<>(peers);
        if (includeSelf) {
            candidates.add(selfId);
        }
        String best = null;
        int bestLoad = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int load = activeLoad.getOrDefault(candidate, 0);
            if (best == null || load < bestLoad || (load == bestLoad && candidate.compareTo(best) < 0)) {
                best = candidate;
                bestLoad = load;
            }
        }
        return best;
    }
}
