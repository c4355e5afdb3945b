package io.agentwarden.storage;

import io.agentwarden.model.RoleLockRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.LongPredicate;

public final class SqliteRoleLockStore implements RoleLockStore {
    private final Database database;

    public SqliteRoleLockStore(Database database) {
        this.database = database;
    }

    @Override
    public boolean claim(String role, long holderPid, long nowMs) {
        String sql = "INSERT OR IGNORE INTO role_locks(role,holder_pid,acquired_at_ms) VALUES(?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, role);
            ps.setLong(2, holderPid);
            ps.setLong(3, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed claim role lock: " + role, e);
        }
    }

    @Override
    public boolean release(String role, long holderPid) {
        String sql = "DELETE FROM role_locks WHERE role=? AND holder_pid=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, role);
            ps.setLong(2, holderPid);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed release role lock: " + role, e);
        }
    }

    @Override
    public boolean handover(String role, long fromPid, long toPid) {
        String sql = "UPDATE role_locks SET holder_pid=? WHERE role=? AND holder_pid=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, toPid);
            ps.setString(2, role);
            ps.setLong(3, fromPid);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed hand over role lock: " + role, e);
        }
    }

    @Override
    public List<RoleLockRecord> reclaimStale(long nowMs, long maxAgeMs, LongPredicate holderAlive) {
        String delete = "DELETE FROM role_locks WHERE role=? AND holder_pid=? AND acquired_at_ms=?";
        long cutoff = nowMs - Math.max(0L, maxAgeMs);
        List<RoleLockRecord> reclaimed = new ArrayList<>();
        // Liveness is probed outside any transaction; the conditional delete
        // skips rows that were released or re-claimed in the meantime.
        for (RoleLockRecord lock : list()) {
            if (lock.acquiredAtMs() > cutoff || holderAlive.test(lock.holderPid())) {
                continue;
            }
            try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(delete)) {
                ps.setString(1, lock.role());
                ps.setLong(2, lock.holderPid());
                ps.setLong(3, lock.acquiredAtMs());
                if (ps.executeUpdate() == 1) {
                    reclaimed.add(lock);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed reclaim role lock: " + lock.role(), e);
            }
        }
        return reclaimed;
    }

    @Override
    public Optional<RoleLockRecord> find(String role) {
        String sql = "SELECT role,holder_pid,acquired_at_ms FROM role_locks WHERE role=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, role);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(read(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed read role lock: " + role, e);
        }
    }

    @Override
    public List<RoleLockRecord> list() {
        String sql = "SELECT role,holder_pid,acquired_at_ms FROM role_locks ORDER BY role ASC";
        List<RoleLockRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(read(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed list role locks", e);
        }
    }

    private static RoleLockRecord read(ResultSet rs) throws SQLException {
        return new RoleLockRecord(rs.getString("role"), rs.getLong("holder_pid"), rs.getLong("acquired_at_ms"));
    }
}
