package io.agentwarden.model;

import java.util.List;

/**
 * Point-in-time view of one supervised role, published by the supervisor on
 * every tick and read by {@code status} without touching the live process.
 */
public record WorkerStatusSnapshot(
        String role,
        WorkerState state,
        String displayState,
        Long pid,
        Long startedAtMs,
        long uptimeMs,
        int restartCount,
        int maxRestarts,
        Long lastHeartbeatMs,
        Long heartbeatAgeMs,
        Double cpuPercent,
        Long memoryBytes,
        List<String> warnings,
        long updatedAtMs
) {
    public WorkerStatusSnapshot {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
