package io.agentwarden.storage;

import io.agentwarden.model.Message;
import io.agentwarden.model.MessageStatus;
import io.agentwarden.model.MetricSample;
import io.agentwarden.model.MetricSummary;
import io.agentwarden.model.NewMessage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class SqliteWorkQueue implements WorkQueue {
    static final int MAX_BUSY_ATTEMPTS = 5;
    private static final long BUSY_BACKOFF_MS = 50L;
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final String COLUMNS =
            "msg_id,sender,recipient,msg_type,payload,priority,status,claimed_by,created_at_ms,claimed_at_ms,completed_at_ms,error";

    private final Database database;

    public SqliteWorkQueue(Database database) {
        this.database = database;
    }

    @Override
    public String enqueue(NewMessage message, long nowMs) {
        String id = "msg_" + UUID.randomUUID();
        String sql = "INSERT INTO messages(msg_id,sender,recipient,msg_type,payload,priority,status,created_at_ms) VALUES(?,?,?,?,?,?,?,?)";
        withBusyRetry("enqueue message", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, id);
                ps.setString(2, message.sender());
                ps.setString(3, message.recipient());
                ps.setString(4, message.type());
                ps.setString(5, message.payload());
                ps.setInt(6, message.priority());
                ps.setString(7, MessageStatus.PENDING.name());
                ps.setLong(8, nowMs);
                return ps.executeUpdate();
            }
        });
        return id;
    }

    @Override
    public List<Message> dequeue(String recipient, long consumerPid, int limit, long nowMs) {
        String select = "SELECT " + COLUMNS + " FROM messages WHERE recipient=? AND status=? "
                + "ORDER BY priority ASC, created_at_ms ASC, rowid ASC LIMIT ?";
        String claim = "UPDATE messages SET status=?,claimed_by=?,claimed_at_ms=? WHERE msg_id=? AND status=?";
        return withBusyRetry("dequeue messages for " + recipient, c -> {
            c.setAutoCommit(false);
            try (PreparedStatement s = c.prepareStatement(select); PreparedStatement up = c.prepareStatement(claim)) {
                s.setString(1, recipient);
                s.setString(2, MessageStatus.PENDING.name());
                s.setInt(3, Math.max(1, limit));
                List<Message> candidates = new ArrayList<>();
                try (ResultSet rs = s.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(read(rs));
                    }
                }
                List<Message> claimed = new ArrayList<>();
                for (Message m : candidates) {
                    up.setString(1, MessageStatus.IN_PROGRESS.name());
                    up.setLong(2, consumerPid);
                    up.setLong(3, nowMs);
                    up.setString(4, m.id());
                    up.setString(5, MessageStatus.PENDING.name());
                    if (up.executeUpdate() == 1) {
                        claimed.add(new Message(m.id(), m.sender(), m.recipient(), m.type(), m.payload(), m.priority(),
                                MessageStatus.IN_PROGRESS, consumerPid, m.createdAtMs(), nowMs, null, null));
                    }
                }
                c.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        });
    }

    @Override
    public void complete(String messageId, Outcome outcome, String error, long nowMs) {
        String sql = "UPDATE messages SET status=?,completed_at_ms=?,error=? WHERE msg_id=? AND status=?";
        int updated = withBusyRetry("complete message " + messageId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, outcome.status().name());
                ps.setLong(2, nowMs);
                if (error == null) {
                    ps.setNull(3, Types.VARCHAR);
                } else {
                    ps.setString(3, error);
                }
                ps.setString(4, messageId);
                ps.setString(5, MessageStatus.IN_PROGRESS.name());
                return ps.executeUpdate();
            }
        });
        if (updated != 1) {
            MessageStatus actual = find(messageId).map(Message::status).orElse(null);
            throw new IllegalMessageTransitionException(messageId, actual, outcome.status());
        }
    }

    @Override
    public Optional<Message> find(String messageId) {
        String sql = "SELECT " + COLUMNS + " FROM messages WHERE msg_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed read message: " + messageId, e);
        }
    }

    @Override
    public int failInFlight(String recipient, long consumerPid, String reason, long nowMs) {
        String sql = "UPDATE messages SET status=?,completed_at_ms=?,error=? WHERE recipient=? AND claimed_by=? AND status=?";
        return withBusyRetry("fail in-flight messages for " + recipient, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, MessageStatus.FAILED.name());
                ps.setLong(2, nowMs);
                ps.setString(3, reason);
                ps.setString(4, recipient);
                ps.setLong(5, consumerPid);
                ps.setString(6, MessageStatus.IN_PROGRESS.name());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public int failPending(String recipient, String reason, long nowMs) {
        String sql = "UPDATE messages SET status=?,completed_at_ms=?,error=? WHERE recipient=? AND status=?";
        return withBusyRetry("fail pending messages for " + recipient, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, MessageStatus.FAILED.name());
                ps.setLong(2, nowMs);
                ps.setString(3, reason);
                ps.setString(4, recipient);
                ps.setString(5, MessageStatus.PENDING.name());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public int reroutePending(String recipient, String newRecipient) {
        String sql = "UPDATE messages SET recipient=? WHERE recipient=? AND status=?";
        return withBusyRetry("reroute pending messages for " + recipient, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, newRecipient);
                ps.setString(2, recipient);
                ps.setString(3, MessageStatus.PENDING.name());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public int purgeFinishedBefore(long cutoffMs) {
        String sql = "DELETE FROM messages WHERE status IN (?,?) AND completed_at_ms IS NOT NULL AND completed_at_ms < ?";
        return withBusyRetry("purge finished messages", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, MessageStatus.COMPLETED.name());
                ps.setString(2, MessageStatus.FAILED.name());
                ps.setLong(3, cutoffMs);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Map<String, Integer> stats(String recipient) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (MessageStatus status : MessageStatus.values()) {
            out.put(status.name(), 0);
        }
        String sql = recipient == null
                ? "SELECT status, COUNT(*) AS n FROM messages GROUP BY status"
                : "SELECT status, COUNT(*) AS n FROM messages WHERE recipient=? GROUP BY status";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (recipient != null) {
                ps.setString(1, recipient);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("status"), rs.getInt("n"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed read message stats", e);
        }
    }

    @Override
    public List<Message> list(String recipient, MessageStatus status, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM messages WHERE 1=1");
        if (recipient != null) {
            sql.append(" AND recipient=?");
        }
        if (status != null) {
            sql.append(" AND status=?");
        }
        sql.append(" ORDER BY created_at_ms DESC, rowid DESC LIMIT ?");
        List<Message> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            if (recipient != null) {
                ps.setString(idx++, recipient);
            }
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(read(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed list messages", e);
        }
    }

    @Override
    public void recordMetric(MetricSample sample) {
        String sql = "INSERT INTO metrics(role,operation_type,duration_ms,timestamp_ms) VALUES(?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sample.role());
            ps.setString(2, sample.operationType());
            ps.setLong(3, sample.durationMs());
            ps.setLong(4, sample.timestampMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed record metric", e);
        }
    }

    @Override
    public List<MetricSample> metrics(String role, long sinceMs, int limit) {
        String sql = role == null
                ? "SELECT role,operation_type,duration_ms,timestamp_ms FROM metrics WHERE timestamp_ms>=? ORDER BY timestamp_ms DESC, id DESC LIMIT ?"
                : "SELECT role,operation_type,duration_ms,timestamp_ms FROM metrics WHERE timestamp_ms>=? AND role=? ORDER BY timestamp_ms DESC, id DESC LIMIT ?";
        List<MetricSample> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, sinceMs);
            if (role == null) {
                ps.setInt(2, Math.max(1, limit));
            } else {
                ps.setString(2, role);
                ps.setInt(3, Math.max(1, limit));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MetricSample(
                            rs.getString("role"),
                            rs.getString("operation_type"),
                            rs.getLong("duration_ms"),
                            rs.getLong("timestamp_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed list metrics", e);
        }
    }

    @Override
    public List<MetricSummary> metricSummary(long sinceMs) {
        String sql = """
                SELECT role, operation_type, COUNT(*) AS n, AVG(duration_ms) AS avg_ms, MAX(duration_ms) AS max_ms
                FROM metrics
                WHERE timestamp_ms>=?
                GROUP BY role, operation_type
                ORDER BY role ASC, operation_type ASC
                """;
        List<MetricSummary> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, sinceMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MetricSummary(
                            rs.getString("role"),
                            rs.getString("operation_type"),
                            rs.getLong("n"),
                            rs.getDouble("avg_ms"),
                            rs.getLong("max_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed summarize metrics", e);
        }
    }

    private <T> T withBusyRetry(String operation, SqlWork<T> work) {
        SQLException last = null;
        for (int attempt = 1; attempt <= MAX_BUSY_ATTEMPTS; attempt++) {
            try (Connection c = database.openConnection()) {
                return work.run(c);
            } catch (SQLException e) {
                if (!isBusy(e)) {
                    throw new RuntimeException("Failed " + operation, e);
                }
                last = e;
                pause(BUSY_BACKOFF_MS * attempt);
            }
        }
        throw new QueueTransactionConflictException(
                "Queue stayed busy after " + MAX_BUSY_ATTEMPTS + " attempts: " + operation, last);
    }

    static boolean isBusy(SQLException e) {
        int code = e.getErrorCode() & 0xff;
        return code == SQLITE_BUSY || code == SQLITE_LOCKED;
    }

    private static void pause(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueTransactionConflictException("Interrupted while waiting for the queue", e);
        }
    }

    private static Message read(ResultSet rs) throws SQLException {
        long claimedBy = rs.getLong("claimed_by");
        Long claimedByValue = rs.wasNull() ? null : claimedBy;
        long claimedAt = rs.getLong("claimed_at_ms");
        Long claimedAtValue = rs.wasNull() ? null : claimedAt;
        long completedAt = rs.getLong("completed_at_ms");
        Long completedAtValue = rs.wasNull() ? null : completedAt;
        return new Message(
                rs.getString("msg_id"),
                rs.getString("sender"),
                rs.getString("recipient"),
                rs.getString("msg_type"),
                rs.getString("payload"),
                rs.getInt("priority"),
                MessageStatus.fromString(rs.getString("status")),
                claimedByValue,
                rs.getLong("created_at_ms"),
                claimedAtValue,
                completedAtValue,
                rs.getString("error")
        );
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }
}
