package io.deskrelay.runtime;

import io.deskrelay.error.StoreUnavailableException;
import io.deskrelay.model.Task;
import io.deskrelay.model.TaskStatus;
import io.deskrelay.storage.NodeInfo;
import io.deskrelay.storage.RemoteTaskStore;
import io.deskrelay.storage.TaskWatch;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** Store wrapper whose writes can be switched off to simulate losing the shared store. */
final class FlakyStore implements RemoteTaskStore {
    private final RemoteTaskStore delegate;
    private final AtomicInteger rejectedPuts = new AtomicInteger();
    private volatile boolean failPuts;

    FlakyStore(RemoteTaskStore delegate) {
        this.delegate = delegate;
    }

    RemoteTaskStore delegate() {
        return delegate;
    }

    void failPuts(boolean fail) {
        this.failPuts = fail;
    }

    int rejectedPuts() {
        return rejectedPuts.get();
    }

    @Override
    public boolean put(Task task) {
        if (failPuts) {
            rejectedPuts.incrementAndGet();
            throw new StoreUnavailableException("simulated outage writing " + task.id(), null);
        }
        return delegate.put(task);
    }

    @Override
    public Optional<Task> get(String taskId) {
        return delegate.get(taskId);
    }

    @Override
    public List<Task> list(TaskStatus status, int limit) {
        return delegate.list(status, limit);
    }

    @Override
    public Map<String, Integer> countActiveByOwner(Collection<String> owners) {
        return delegate.countActiveByOwner(owners);
    }

    @Override
    public TaskWatch watch(String ownerFilter, long fromVersion) {
        return delegate.watch(ownerFilter, fromVersion);
    }

    @Override
    public void requestCancel(String taskId, String requestedBy, long nowMs) {
        delegate.requestCancel(taskId, requestedBy, nowMs);
    }

    @Override
    public boolean cancelRequested(String taskId) {
        return delegate.cancelRequested(taskId);
    }

    @Override
    public void heartbeat(String nodeId, String descriptor, Collection<String> handlerTypes, long nowMs) {
        delegate.heartbeat(nodeId, descriptor, handlerTypes, nowMs);
    }

    @Override
    public void markOffline(String nodeId, long nowMs) {
        delegate.markOffline(nodeId, nowMs);
    }

    @Override
    public List<NodeInfo> listNodes() {
        return delegate.listNodes();
    }

    @Override
    public int purgeTerminalBefore(long cutoffMs) {
        return delegate.purgeTerminalBefore(cutoffMs);
    }
}
