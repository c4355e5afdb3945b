package io.agentwarden.storage;

import io.agentwarden.model.RoleLockRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * Exclusive per-role locks. At most one holder per role at any instant; a
 * failed claim returns immediately instead of waiting.
 */
public interface RoleLockStore {
    /**
     * Atomically records {@code holderPid} as the holder of {@code role}.
     *
     * @return {@code false} if another holder already owns the role
     */
    boolean claim(String role, long holderPid, long nowMs);

    /**
     * Releases {@code role} only if {@code holderPid} currently holds it.
     */
    boolean release(String role, long holderPid);

    /**
     * Moves an existing lock from {@code fromPid} to {@code toPid}, keeping the
     * original acquisition time. Used once a worker has been spawned so the
     * lock names the live worker process rather than the supervisor.
     */
    boolean handover(String role, long fromPid, long toPid);

    /**
     * Force-releases locks older than {@code maxAgeMs} whose holder is not
     * alive according to {@code holderAlive}. A live holder is never touched.
     *
     * @return the locks that were removed
     */
    List<RoleLockRecord> reclaimStale(long nowMs, long maxAgeMs, LongPredicate holderAlive);

    Optional<RoleLockRecord> find(String role);

    List<RoleLockRecord> list();
}
