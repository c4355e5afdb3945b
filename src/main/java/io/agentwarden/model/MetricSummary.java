package io.agentwarden.model;

public record MetricSummary(String role, String operationType, long count, double avgDurationMs, long maxDurationMs) {
}
