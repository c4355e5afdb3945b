package io.agentwarden.model;

public record MetricSample(String role, String operationType, long durationMs, long timestampMs) {
}
