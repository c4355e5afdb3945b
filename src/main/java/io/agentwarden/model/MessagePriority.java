package io.agentwarden.model;

/**
 * Named priority levels accepted on the command line. The queue itself stores
 * plain integers where a lower value is delivered first.
 */
public enum MessagePriority {
    URGENT(1),
    NORMAL(5),
    LOW(9);

    private final int value;

    MessagePriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static int parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL.value;
        }
        String trimmed = raw.trim();
        for (MessagePriority level : values()) {
            if (level.name().equalsIgnoreCase(trimmed)) {
                return level.value;
            }
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown priority: " + raw);
        }
    }
}
