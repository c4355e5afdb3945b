package io.agentwarden.supervisor;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentwarden.util.Jsons;

public enum ShutdownMode {
    GRACEFUL,
    IMMEDIATE;

    /**
     * Reads the mode of a {@code shutdown_request} payload such as
     * {@code {"mode":"immediate"}}. Anything unrecognised means graceful.
     */
    public static ShutdownMode fromPayload(String payload) {
        JsonNode node;
        try {
            node = Jsons.readTree(payload);
        } catch (IllegalArgumentException e) {
            return GRACEFUL;
        }
        return "immediate".equalsIgnoreCase(node.path("mode").asText("")) ? IMMEDIATE : GRACEFUL;
    }
}
