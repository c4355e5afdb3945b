package io.agentwarden.model;

import java.util.Objects;

public record NewMessage(String sender, String recipient, String type, String payload, int priority) {
    public NewMessage {
        requireText(sender, "sender");
        requireText(recipient, "recipient");
        requireText(type, "type");
        payload = payload == null ? "{}" : payload;
    }

    public static NewMessage of(String sender, String recipient, String type, String payload) {
        return new NewMessage(sender, recipient, type, payload, MessagePriority.NORMAL.value());
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
