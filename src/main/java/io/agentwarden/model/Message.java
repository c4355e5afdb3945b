package io.agentwarden.model;

public record Message(
        String id,
        String sender,
        String recipient,
        String type,
        String payload,
        int priority,
        MessageStatus status,
        Long claimedBy,
        long createdAtMs,
        Long claimedAtMs,
        Long completedAtMs,
        String error
) {
}
