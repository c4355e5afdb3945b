package io.agentwarden.model;

public enum HealthStatus {
    HEALTHY,
    STALE,
    DEAD
}
