package io.agentwarden.storage;

import io.agentwarden.model.Message;
import io.agentwarden.model.MessageStatus;
import io.agentwarden.model.MetricSample;
import io.agentwarden.model.MetricSummary;
import io.agentwarden.model.NewMessage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable prioritized messages between workers, plus an append-only stream of
 * operation metrics. Delivery is at-most-once per dequeue: a message handed
 * to one consumer is never handed to another.
 */
public interface WorkQueue {
    String enqueue(NewMessage message, long nowMs);

    /**
     * Claims up to {@code limit} pending messages for {@code recipient}, lowest
     * priority value first, then oldest first. Claimed messages move to
     * {@link MessageStatus#IN_PROGRESS} owned by {@code consumerPid}.
     *
     * @throws QueueTransactionConflictException if the store stayed busy
     */
    List<Message> dequeue(String recipient, long consumerPid, int limit, long nowMs);

    /**
     * @throws IllegalMessageTransitionException if the message is unknown or
     *                                           not in progress
     */
    void complete(String messageId, Outcome outcome, String error, long nowMs);

    Optional<Message> find(String messageId);

    /**
     * Fails every message that {@code consumerPid} claimed for {@code recipient}
     * but never completed.
     */
    int failInFlight(String recipient, long consumerPid, String reason, long nowMs);

    int failPending(String recipient, String reason, long nowMs);

    int reroutePending(String recipient, String newRecipient);

    /**
     * Deletes completed and failed messages finished before {@code cutoffMs}.
     */
    int purgeFinishedBefore(long cutoffMs);

    /**
     * Message counts keyed by status name; every status is present.
     */
    Map<String, Integer> stats(String recipient);

    List<Message> list(String recipient, MessageStatus status, int limit);

    void recordMetric(MetricSample sample);

    List<MetricSample> metrics(String role, long sinceMs, int limit);

    List<MetricSummary> metricSummary(long sinceMs);

    enum Outcome {
        COMPLETED,
        FAILED;

        public MessageStatus status() {
            return this == COMPLETED ? MessageStatus.COMPLETED : MessageStatus.FAILED;
        }
    }
}
