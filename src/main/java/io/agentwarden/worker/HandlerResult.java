package io.agentwarden.worker;

/**
 * Outcome of handling one message, optionally with a reply addressed to the
 * sender.
 */
public record HandlerResult(
        boolean success,
        String replyType,
        String replyPayload,
        String error
) {
    public static HandlerResult ok() {
        return new HandlerResult(true, null, null, null);
    }

    public static HandlerResult reply(String type, String payload) {
        return new HandlerResult(true, type, payload, null);
    }

    public static HandlerResult fail(String error) {
        return new HandlerResult(false, null, null, error);
    }

    public boolean hasReply() {
        return replyType != null;
    }
}
