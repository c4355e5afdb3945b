package io.agentwarden.storage;

import io.agentwarden.model.MessageStatus;

public final class IllegalMessageTransitionException extends RuntimeException {
    private final String messageId;
    private final MessageStatus actual;

    public IllegalMessageTransitionException(String messageId, MessageStatus actual, MessageStatus target) {
        super(actual == null
                ? "Unknown message: " + messageId
                : "Message " + messageId + " cannot move from " + actual + " to " + target);
        this.messageId = messageId;
        this.actual = actual;
    }

    public String messageId() {
        return messageId;
    }

    public MessageStatus actual() {
        return actual;
    }
}
