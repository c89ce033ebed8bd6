package io.deskrelay.routing;

import io.deskrelay.model.Task;

import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface RoutingPolicy {
    String chooseOwner(Task task, String selfId, List<String> peers, Map<String, Integer> activeLoad);
}
