package io.agentwarden.config;

/**
 * What happens to pending messages addressed to a role once that role has
 * exhausted its restarts.
 */
public enum TerminalRecipientPolicy {
    /** Leave them pending until an operator restarts the role. */
    HOLD,
    /** Fail them with a "recipient terminal" error. */
    EXPIRE,
    /** Move them to the configured fallback recipient. */
    REROUTE;

    public static TerminalRecipientPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return HOLD;
        }
        for (TerminalRecipientPolicy value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown terminalRecipientPolicy: " + raw);
    }
}
