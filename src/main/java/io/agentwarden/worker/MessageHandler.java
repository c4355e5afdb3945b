package io.agentwarden.worker;

import io.agentwarden.model.Message;

/**
 * Domain logic of a worker role. Throwing marks the message failed.
 */
public interface MessageHandler {
    HandlerResult handle(Message message) throws Exception;
}
