package io.deskrelay.storage;

import io.deskrelay.error.StoreUnavailableException;
import io.deskrelay.model.Task;
import io.deskrelay.model.TaskResult;
import io.deskrelay.model.TaskStatus;
import io.deskrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

public final class SqliteRemoteTaskStore implements RemoteTaskStore {
    private static final String TASK_COLUMNS =
            "t.task_id,t.type,t.payload,t.owner,t.origin,t.status,t.attempt,t.result_output,t.result_error,"
                    + "t.created_at_ms,t.updated_at_ms,t.not_before_ms,t.version";

    private final Database database;
    private final int watchBatchSize;
    private final long watchPollIntervalMs;

    public SqliteRemoteTaskStore(Database database) {
        this(database, 64, 500L);
    }

    public SqliteRemoteTaskStore(Database database, int watchBatchSize, long watchPollIntervalMs) {
        this.database = database;
        this.watchBatchSize = Math.max(1, watchBatchSize);
        this.watchPollIntervalMs = Math.max(1L, watchPollIntervalMs);
    }

    @Override
    public boolean put(Task task) {
        if (task == null || !task.isOwned()) {
            throw new IllegalArgumentException("only owned tasks can be stored");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                boolean applied = false;
                Optional<StoredHeader> current = loadHeader(c, task.id());
                if (current.isEmpty() || wins(task, current.get())) {
                    long version = nextVersion(c);
                    upsertRow(c, task, version);
                    applied = true;
                }
                c.commit();
                return applied;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to put task " + task.id(), e);
        }
    }

    static boolean wins(Task incoming, StoredHeader current) {
        if (incoming.updatedAtMs() != current.updatedAtMs()) {
            return incoming.updatedAtMs() > current.updatedAtMs();
        }
        return incoming.owner().compareTo(current.owner()) < 0;
    }

    @Override
    public Optional<Task> get(String taskId) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks t WHERE t.task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readTask(rs));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to get task " + taskId, e);
        }
    }

    @Override
    public List<Task> list(TaskStatus status, int limit) {
        String sql = status == null
                ? "SELECT " + TASK_COLUMNS + " FROM tasks t ORDER BY t.updated_at_ms DESC, t.task_id ASC LIMIT ?"
                : "SELECT " + TASK_COLUMNS + " FROM tasks t WHERE t.status=? ORDER BY t.updated_at_ms DESC, t.task_id ASC LIMIT ?";
        List<Task> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list tasks", e);
        }
    }

    @Override
    public Map<String, Integer> countActiveByOwner(Collection<String> owners) {
        Map<String, Integer> out = new LinkedHashMap<>();
        if (owners == null || owners.isEmpty()) {
            return out;
        }
        for (String owner : owners) {
            out.put(owner, 0);
        }
        String placeholders = String.join(",", Collections.nCopies(out.size(), "?"));
        String sql = "SELECT owner, COUNT(*) AS active FROM tasks WHERE status IN ('PENDING','IN_PROGRESS') AND owner IN ("
                + placeholders + ") GROUP BY owner";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            for (String owner : out.keySet()) {
                ps.setString(idx++, owner);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("owner"), rs.getInt("active"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count active tasks by owner", e);
        }
    }

    @Override
    public TaskWatch watch(String ownerFilter, long fromVersion) {
        return new TaskWatch(after -> pollChanges(ownerFilter, after), fromVersion, watchPollIntervalMs);
    }

    private List<TaskChange> pollChanges(String ownerFilter, long afterVersion) {
        String sql = ownerFilter == null
                ? "SELECT " + TASK_COLUMNS + ", c.task_id AS cancel_id FROM tasks t "
                + "LEFT JOIN cancel_requests c ON c.task_id=t.task_id "
                + "WHERE t.version>? ORDER BY t.version ASC LIMIT ?"
                : "SELECT " + TASK_COLUMNS + ", c.task_id AS cancel_id FROM tasks t "
                + "LEFT JOIN cancel_requests c ON c.task_id=t.task_id "
                + "WHERE t.owner=? AND t.version>? ORDER BY t.version ASC LIMIT ?";
        List<TaskChange> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (ownerFilter != null) {
                ps.setString(idx++, ownerFilter);
            }
            ps.setLong(idx++, afterVersion);
            ps.setInt(idx, watchBatchSize);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TaskChange(readTask(rs), rs.getLong("version"), rs.getString("cancel_id") != null));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to poll task changes after version " + afterVersion, e);
        }
    }

    @Override
    public void requestCancel(String taskId, String requestedBy, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ins = c.prepareStatement(
                        "INSERT OR IGNORE INTO cancel_requests(task_id,requested_by,requested_at_ms) VALUES(?,?,?)")) {
                    ins.setString(1, taskId);
                    ins.setString(2, requestedBy == null ? "" : requestedBy);
                    ins.setLong(3, nowMs);
                    ins.executeUpdate();
                }
                // A fresh version makes the request visible to the owner's watch.
                long version = nextVersion(c);
                try (PreparedStatement bump = c.prepareStatement("UPDATE tasks SET version=? WHERE task_id=?")) {
                    bump.setLong(1, version);
                    bump.setString(2, taskId);
                    bump.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to request cancellation of task " + taskId, e);
        }
    }

    @Override
    public boolean cancelRequested(String taskId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM cancel_requests WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read cancel request for task " + taskId, e);
        }
    }

    @Override
    public void heartbeat(String nodeId, String descriptor, Collection<String> handlerTypes, long nowMs) {
        String sql = """
                INSERT INTO nodes(node_id,status,descriptor,handler_types,last_seen_ms,updated_at_ms) VALUES(?,?,?,?,?,?)
                ON CONFLICT(node_id) DO UPDATE SET
                    status=excluded.status,
                    descriptor=excluded.descriptor,
                    handler_types=excluded.handler_types,
                    last_seen_ms=MAX(nodes.last_seen_ms, excluded.last_seen_ms),
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, nodeId);
            ps.setString(2, NodeInfo.NodeStatus.ONLINE.name());
            ps.setString(3, descriptor == null ? "" : descriptor);
            ps.setString(4, Jsons.toCompactJson(handlerTypes == null ? List.of() : new TreeSet<>(handlerTypes)));
            ps.setLong(5, nowMs);
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to record heartbeat for node " + nodeId, e);
        }
    }

    @Override
    public void markOffline(String nodeId, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE nodes SET status=?, updated_at_ms=? WHERE node_id=?")) {
            ps.setString(1, NodeInfo.NodeStatus.OFFLINE.name());
            ps.setLong(2, nowMs);
            ps.setString(3, nodeId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to mark node offline " + nodeId, e);
        }
    }

    @Override
    public List<NodeInfo> listNodes() {
        List<NodeInfo> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT node_id,status,descriptor,handler_types,last_seen_ms FROM nodes ORDER BY node_id ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new NodeInfo(
                        rs.getString("node_id"),
                        NodeInfo.NodeStatus.valueOf(rs.getString("status")),
                        rs.getString("descriptor"),
                        new LinkedHashSet<>(Jsons.readStringList(rs.getString("handler_types"))),
                        rs.getLong("last_seen_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list nodes", e);
        }
    }

    @Override
    public int purgeTerminalBefore(long cutoffMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int deleted;
                try (PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM tasks WHERE status IN ('COMPLETED','FAILED','CANCELLED') AND updated_at_ms<?")) {
                    ps.setLong(1, cutoffMs);
                    deleted = ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM cancel_requests WHERE task_id NOT IN (SELECT task_id FROM tasks)")) {
                    ps.executeUpdate();
                }
                c.commit();
                return deleted;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to purge terminal tasks", e);
        }
    }

    public long headVersion() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT value FROM store_sequence WHERE name='task_version'");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read store version", e);
        }
    }

    private Optional<StoredHeader> loadHeader(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT owner, updated_at_ms FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StoredHeader(rs.getString("owner"), rs.getLong("updated_at_ms")));
            }
        }
    }

    private long nextVersion(Connection c) throws SQLException {
        try (PreparedStatement up = c.prepareStatement(
                "UPDATE store_sequence SET value=value+1 WHERE name='task_version'")) {
            up.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT value FROM store_sequence WHERE name='task_version'");
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("task_version sequence row is missing");
            }
            return rs.getLong(1);
        }
    }

    private void upsertRow(Connection c, Task task, long version) throws SQLException {
        String sql = """
                INSERT INTO tasks(task_id,type,payload,owner,origin,status,attempt,result_output,result_error,
                                  created_at_ms,updated_at_ms,not_before_ms,version)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(task_id) DO UPDATE SET
                    type=excluded.type,
                    payload=excluded.payload,
                    owner=excluded.owner,
                    origin=excluded.origin,
                    status=excluded.status,
                    attempt=excluded.attempt,
                    result_output=excluded.result_output,
                    result_error=excluded.result_error,
                    created_at_ms=excluded.created_at_ms,
                    updated_at_ms=excluded.updated_at_ms,
                    not_before_ms=excluded.not_before_ms,
                    version=excluded.version
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            TaskResult result = task.result();
            ps.setString(1, task.id());
            ps.setString(2, task.type());
            ps.setString(3, Jsons.toCompactJson(task.payload()));
            ps.setString(4, task.owner());
            ps.setString(5, task.origin());
            ps.setString(6, task.status().name());
            ps.setInt(7, task.attempt());
            ps.setString(8, result == null ? null : result.output());
            ps.setString(9, result == null ? null : result.error());
            ps.setLong(10, task.createdAtMs());
            ps.setLong(11, task.updatedAtMs());
            ps.setLong(12, task.notBeforeMs());
            ps.setLong(13, version);
            ps.executeUpdate();
        }
    }

    private Task readTask(ResultSet rs) throws SQLException {
        String output = rs.getString("result_output");
        String error = rs.getString("result_error");
        TaskResult result = output == null && error == null ? null : new TaskResult(output, error);
        return new Task(
                rs.getString("task_id"),
                rs.getString("type"),
                Jsons.readMap(rs.getString("payload")),
                rs.getString("owner"),
                rs.getString("origin"),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getInt("attempt"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                rs.getLong("not_before_ms"),
                result
        );
    }

    record StoredHeader(String owner, long updatedAtMs) {
    }
}
