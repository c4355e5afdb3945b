package io.agentwarden.model;

public record HeartbeatRecord(
        String role,
        long pid,
        long timestampMs,
        double cpuPercent,
        long memoryBytes
) {
}
