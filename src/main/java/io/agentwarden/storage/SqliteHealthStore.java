package io.agentwarden.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.agentwarden.model.Alert;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.model.WorkerStatusSnapshot;
import io.agentwarden.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteHealthStore implements HealthStore {
    private final Database database;

    public SqliteHealthStore(Database database) {
        this.database = database;
    }

    @Override
    public void heartbeat(HeartbeatRecord heartbeat) {
        String sql = """
                INSERT INTO heartbeats(role,pid,timestamp_ms,cpu_percent,memory_bytes) VALUES(?,?,?,?,?)
                ON CONFLICT(role) DO UPDATE SET
                    pid=excluded.pid,
                    timestamp_ms=excluded.timestamp_ms,
                    cpu_percent=excluded.cpu_percent,
                    memory_bytes=excluded.memory_bytes
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, heartbeat.role());
            ps.setLong(2, heartbeat.pid());
            ps.setLong(3, heartbeat.timestampMs());
            ps.setDouble(4, heartbeat.cpuPercent());
            ps.setLong(5, heartbeat.memoryBytes());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (SqliteWorkQueue.isBusy(e)) {
                throw new QueueTransactionConflictException("Database busy while writing heartbeat: "
                        + heartbeat.role(), e);
            }
            throw new RuntimeException("Failed write heartbeat: " + heartbeat.role(), e);
        }
    }

    @Override
    public Optional<HeartbeatRecord> latest(String role) {
        String sql = "SELECT role,pid,timestamp_ms,cpu_percent,memory_bytes FROM heartbeats WHERE role=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, role);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readHeartbeat(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed read heartbeat: " + role, e);
        }
    }

    @Override
    public List<HeartbeatRecord> all() {
        String sql = "SELECT role,pid,timestamp_ms,cpu_percent,memory_bytes FROM heartbeats ORDER BY role ASC";
        List<HeartbeatRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readHeartbeat(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed list heartbeats", e);
        }
    }

    @Override
    public void clear(String role) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM heartbeats WHERE role=?")) {
            ps.setString(1, role);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed clear heartbeat: " + role, e);
        }
    }

    @Override
    public void publishStatus(List<WorkerStatusSnapshot> snapshots) {
        String upsert = """
                INSERT INTO worker_status(role,snapshot_json,updated_at_ms) VALUES(?,?,?)
                ON CONFLICT(role) DO UPDATE SET snapshot_json=excluded.snapshot_json, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (Statement clear = c.createStatement(); PreparedStatement ps = c.prepareStatement(upsert)) {
                clear.executeUpdate("DELETE FROM worker_status");
                for (WorkerStatusSnapshot s : snapshots) {
                    ps.setString(1, s.role());
                    ps.setString(2, Jsons.toCompactJson(s));
                    ps.setLong(3, s.updatedAtMs());
                    ps.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed publish worker status", e);
        }
    }

    @Override
    public List<WorkerStatusSnapshot> listStatus() {
        String sql = "SELECT snapshot_json FROM worker_status ORDER BY role ASC";
        List<WorkerStatusSnapshot> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(Jsons.mapper().readValue(rs.getString("snapshot_json"), WorkerStatusSnapshot.class));
            }
            return out;
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Failed list worker status", e);
        }
    }

    @Override
    public Alert raiseAlert(Alert alert) {
        String sql = "INSERT INTO alerts(role,kind,severity,message,created_at_ms) VALUES(?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, alert.role());
            ps.setString(2, alert.kind());
            ps.setString(3, alert.severity());
            ps.setString(4, alert.message());
            ps.setLong(5, alert.createdAtMs());
            ps.executeUpdate();
            long id = 0L;
            try (Statement st = c.createStatement(); ResultSet keys = st.executeQuery("SELECT last_insert_rowid()")) {
                if (keys.next()) {
                    id = keys.getLong(1);
                }
            }
            return new Alert(id, alert.role(), alert.kind(), alert.severity(), alert.message(), alert.createdAtMs());
        } catch (SQLException e) {
            throw new RuntimeException("Failed raise alert: " + alert.kind(), e);
        }
    }

    @Override
    public List<Alert> listAlerts(int limit) {
        String sql = "SELECT id,role,kind,severity,message,created_at_ms FROM alerts ORDER BY created_at_ms DESC, id DESC LIMIT ?";
        List<Alert> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Alert(
                            rs.getLong("id"),
                            rs.getString("role"),
                            rs.getString("kind"),
                            rs.getString("severity"),
                            rs.getString("message"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed list alerts", e);
        }
    }

    private static HeartbeatRecord readHeartbeat(ResultSet rs) throws SQLException {
        return new HeartbeatRecord(
                rs.getString("role"),
                rs.getLong("pid"),
                rs.getLong("timestamp_ms"),
                rs.getDouble("cpu_percent"),
                rs.getLong("memory_bytes")
        );
    }
}
