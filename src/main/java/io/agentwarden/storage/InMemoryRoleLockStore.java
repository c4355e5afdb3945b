package io.agentwarden.storage;

import io.agentwarden.model.RoleLockRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.LongPredicate;

/**
 * Process-local lock table for tests and single-JVM embedding.
 */
public final class InMemoryRoleLockStore implements RoleLockStore {
    private final TreeMap<String, RoleLockRecord> locks = new TreeMap<>();

    @Override
    public synchronized boolean claim(String role, long holderPid, long nowMs) {
        if (locks.containsKey(role)) {
            return false;
        }
        locks.put(role, new RoleLockRecord(role, holderPid, nowMs));
        return true;
    }

    @Override
    public synchronized boolean release(String role, long holderPid) {
        RoleLockRecord current = locks.get(role);
        if (current == null || current.holderPid() != holderPid) {
            return false;
        }
        locks.remove(role);
        return true;
    }

    @Override
    public synchronized boolean handover(String role, long fromPid, long toPid) {
        RoleLockRecord current = locks.get(role);
        if (current == null || current.holderPid() != fromPid) {
            return false;
        }
        locks.put(role, new RoleLockRecord(role, toPid, current.acquiredAtMs()));
        return true;
    }

    @Override
    public List<RoleLockRecord> reclaimStale(long nowMs, long maxAgeMs, LongPredicate holderAlive) {
        long cutoff = nowMs - Math.max(0L, maxAgeMs);
        List<RoleLockRecord> reclaimed = new ArrayList<>();
        for (RoleLockRecord lock : list()) {
            if (lock.acquiredAtMs() > cutoff || holderAlive.test(lock.holderPid())) {
                continue;
            }
            synchronized (this) {
                if (lock.equals(locks.get(lock.role()))) {
                    locks.remove(lock.role());
                    reclaimed.add(lock);
                }
            }
        }
        return reclaimed;
    }

    @Override
    public synchronized Optional<RoleLockRecord> find(String role) {
        return Optional.ofNullable(locks.get(role));
    }

    @Override
    public synchronized List<RoleLockRecord> list() {
        return new ArrayList<>(locks.values());
    }
}
