package io.deskrelay.storage;

import io.deskrelay.model.Task;
import io.deskrelay.model.TaskStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface RemoteTaskStore {

    // Last writer wins on updatedAtMs, equal timestamps go to the lexically smaller owner.
    // Returns false when the stored record did not change.
    boolean put(Task task);

    Optional<Task> get(String taskId);

    List<Task> list(TaskStatus status, int limit);

    Map<String, Integer> countActiveByOwner(Collection<String> owners);

    // Changes with version > fromVersion; a null filter means every owner.
    TaskWatch watch(String ownerFilter, long fromVersion);

    void requestCancel(String taskId, String requestedBy, long nowMs);

    boolean cancelRequested(String taskId);

    void heartbeat(String nodeId, String descriptor, Collection<String> handlerTypes, long nowMs);

    void markOffline(String nodeId, long nowMs);

    List<NodeInfo> listNodes();

    int purgeTerminalBefore(long cutoffMs);
}
