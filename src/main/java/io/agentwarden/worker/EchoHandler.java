package io.agentwarden.worker;

import io.agentwarden.model.Message;
import io.agentwarden.util.Jsons;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handler of the built-in worker: answers {@code ping} with {@code pong} and
 * acknowledges everything else.
 */
public final class EchoHandler implements MessageHandler {
    public static final String PING = "ping";
    public static final String PONG = "pong";

    private final String role;

    public EchoHandler(String role) {
        this.role = role;
    }

    @Override
    public HandlerResult handle(Message message) {
        if (!PING.equals(message.type())) {
            return HandlerResult.ok();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("role", role);
        body.put("timestamp", Instant.now().toString());
        body.put("inReplyTo", message.id());
        body.put("received", Jsons.readTree(message.payload()));
        return HandlerResult.reply(PONG, Jsons.toCompactJson(body));
    }
}
