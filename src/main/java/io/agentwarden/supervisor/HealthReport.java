package io.agentwarden.supervisor;

import io.agentwarden.model.HealthStatus;
import io.agentwarden.model.HeartbeatRecord;

import java.util.List;

/**
 * Outcome of one health check.
 *
 * @param heartbeat      latest heartbeat of the tracked pid, or {@code null}
 * @param heartbeatAgeMs age of the reference time (heartbeat or start), or
 *                       {@code null} when the process was not running
 */
public record HealthReport(
        String role,
        HealthStatus status,
        HeartbeatRecord heartbeat,
        Long heartbeatAgeMs,
        List<String> warnings,
        String reason
) {
    public HealthReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
