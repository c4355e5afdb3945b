package io.agentwarden.supervisor;

import io.agentwarden.config.WorkerRole;

/**
 * Exponential backoff with a hard restart cap. With the default base of one
 * minute and three restarts, the waits are 60s, 120s and 240s and the fourth
 * crash is final.
 */
public final class RestartPolicy {
    private RestartPolicy() {
    }

    /**
     * @param restartCount restarts already performed for the role
     */
    public static RestartDecision decide(int restartCount, WorkerRole role) {
        if (restartCount >= role.maxRestarts()) {
            return RestartDecision.giveUp();
        }
        long waitMs = backoffMs(role.backoffBaseMs(), restartCount);
        return waitMs <= 0L ? RestartDecision.restartNow() : RestartDecision.waitFor(waitMs);
    }

    /**
     * {@code baseMs * 2^restartCount}, saturating at {@link Long#MAX_VALUE}.
     */
    public static long backoffMs(long baseMs, int restartCount) {
        if (baseMs <= 0L) {
            return 0L;
        }
        int shift = Math.max(0, restartCount);
        if (shift >= 63 || baseMs > (Long.MAX_VALUE >> shift)) {
            return Long.MAX_VALUE;
        }
        return baseMs << shift;
    }

    /**
     * Milliseconds until a crashed worker is due for respawn, 0 if due or not
     * scheduled.
     */
    public static long remainingMs(WorkerProcess worker, long nowMs) {
        Long next = worker.nextRestartAtMs();
        if (next == null) {
            return 0L;
        }
        return Math.max(0L, next - nowMs);
    }
}
