package io.agentwarden.model;

public record Alert(long id, String role, String kind, String severity, String message, long createdAtMs) {
    public static Alert critical(String role, String kind, String message, long createdAtMs) {
        return new Alert(0L, role, kind, "CRITICAL", message, createdAtMs);
    }

    public static Alert warning(String role, String kind, String message, long createdAtMs) {
        return new Alert(0L, role, kind, "WARNING", message, createdAtMs);
    }
}
