package io.agentwarden.model;

public enum MessageStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }

    public static MessageStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("message status must not be blank");
        }
        String normalized = raw.trim().replace('-', '_');
        for (MessageStatus value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message status: " + raw);
    }
}
