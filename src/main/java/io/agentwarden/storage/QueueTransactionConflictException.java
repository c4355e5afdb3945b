package io.agentwarden.storage;

/**
 * The queue stayed locked by other writers through every retry. Transient;
 * callers may simply try again on their next poll.
 */
public final class QueueTransactionConflictException extends RuntimeException {
    public QueueTransactionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
