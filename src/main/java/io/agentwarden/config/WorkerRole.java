package io.agentwarden.config;

import java.util.List;
import java.util.Map;

/**
 * Static definition of a supervised role. Loaded once from settings and never
 * mutated afterwards.
 */
public record WorkerRole(
        String id,
        int priority,
        List<String> command,
        String workingDir,
        Map<String, String> env,
        long healthCheckIntervalMs,
        long heartbeatStaleAfterMs,
        long heartbeatDeadAfterMs,
        int maxRestarts,
        long backoffBaseMs,
        double maxCpuPercent,
        long maxMemoryBytes
) {
    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_HEARTBEAT_STALE_AFTER_MS = 300_000L;
    public static final long DEFAULT_HEARTBEAT_DEAD_AFTER_MS = 900_000L;
    public static final int DEFAULT_MAX_RESTARTS = 3;
    public static final long DEFAULT_BACKOFF_BASE_MS = 60_000L;
    public static final double DEFAULT_MAX_CPU_PERCENT = 90.0d;
    public static final long DEFAULT_MAX_MEMORY_BYTES = 2L * 1024L * 1024L * 1024L;

    public WorkerRole {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("role id must not be blank");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("role " + id + ": command must not be empty");
        }
        requirePositive(id, "healthCheckIntervalMs", healthCheckIntervalMs);
        requirePositive(id, "heartbeatStaleAfterMs", heartbeatStaleAfterMs);
        requirePositive(id, "heartbeatDeadAfterMs", heartbeatDeadAfterMs);
        if (heartbeatDeadAfterMs <= heartbeatStaleAfterMs) {
            throw new IllegalArgumentException(
                    "role " + id + ": heartbeatDeadAfterMs must be greater than heartbeatStaleAfterMs");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("role " + id + ": maxRestarts must be >= 0");
        }
        if (backoffBaseMs < 0) {
            throw new IllegalArgumentException("role " + id + ": backoffBaseMs must be >= 0");
        }
        command = List.copyOf(command);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static WorkerRole withDefaults(String id, int priority, List<String> command) {
        return new WorkerRole(
                id,
                priority,
                command,
                null,
                Map.of(),
                DEFAULT_HEALTH_CHECK_INTERVAL_MS,
                DEFAULT_HEARTBEAT_STALE_AFTER_MS,
                DEFAULT_HEARTBEAT_DEAD_AFTER_MS,
                DEFAULT_MAX_RESTARTS,
                DEFAULT_BACKOFF_BASE_MS,
                DEFAULT_MAX_CPU_PERCENT,
                DEFAULT_MAX_MEMORY_BYTES
        );
    }

    private static void requirePositive(String id, String field, long value) {
        if (value <= 0L) {
            throw new IllegalArgumentException("role " + id + ": " + field + " must be > 0");
        }
    }
}
