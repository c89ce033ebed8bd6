package io.deskrelay.routing;

import io.deskrelay.model.Task;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class LeastLoadedRoutingPolicyTest {
    private final Task task = Task.newPending("tsk_p", "echo", Map.of("msg", "x"), "alpha", 1L);

    @Test
    void noPeersMeansSelf() {
        Assertions.assertEquals("alpha", new LeastLoadedRoutingPolicy().chooseOwner(task, "alpha", List.of(), Map.of()));
        Assertions.assertEquals("alpha", new LeastLoadedRoutingPolicy(true).chooseOwner(task, "alpha", null, Map.of()));
    }

    @Test
    void missingLoadCountsAsIdle() {
        String owner = new LeastLoadedRoutingPolicy().chooseOwner(task, "alpha", List.of("charlie", "bravo"),
                Map.of("bravo", 3));
        Assertions.assertEquals("charlie", owner);
    }

    @Test
    void selfWinsTiesOnlyByName() {
        Map<String, Integer> load = Map.of("alpha", 1, "bravo", 1);
        Assertions.assertEquals("alpha", new LeastLoadedRoutingPolicy(true).chooseOwner(task, "alpha", List.of("bravo"), load));
        Assertions.assertEquals("bravo", new LeastLoadedRoutingPolicy(false).chooseOwner(task, "alpha", List.of("bravo"), load));
    }
}
