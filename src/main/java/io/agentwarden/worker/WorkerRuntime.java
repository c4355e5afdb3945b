package io.agentwarden.worker;

import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.model.Message;
import io.agentwarden.model.MessagePriority;
import io.agentwarden.model.MetricSample;
import io.agentwarden.model.NewMessage;
import io.agentwarden.storage.HealthStore;
import io.agentwarden.storage.QueueTransactionConflictException;
import io.agentwarden.storage.WorkQueue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Poll loop of a worker process: heartbeat, claim a batch from the role's
 * inbox, handle each message and record how long it took.
 */
public final class WorkerRuntime {
    public static final String OPERATION_PREFIX = "message.";

    private final String role;
    private final long pid;
    private final WorkQueue queue;
    private final HealthStore healthStore;
    private final MessageHandler handler;
    private final ResourceSampler sampler;
    private final Clock clock;
    private final int batchSize;
    private final List<Finish> deferred = new ArrayList<>();

    public WorkerRuntime(
            String role,
            long pid,
            WorkQueue queue,
            HealthStore healthStore,
            MessageHandler handler,
            ResourceSampler sampler,
            Clock clock,
            int batchSize
    ) {
        this.role = role;
        this.pid = pid;
        this.queue = queue;
        this.healthStore = healthStore;
        this.handler = handler;
        this.sampler = sampler;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * One poll. A queue conflict never escapes: the poll reports
     * {@code queueBusy} and any message whose completion could not be written
     * is finished on a later poll.
     */
    public WorkerOutcome runOnce() {
        long now = clock.millis();
        boolean busy = false;
        try {
            heartbeat(now);
        } catch (QueueTransactionConflictException e) {
            System.err.println("WARN " + role + " heartbeat skipped, database busy: " + e.getMessage());
            busy = true;
        }
        int processed = 0;
        int failed = 0;
        int replies = 0;
        if (!finishDeferred()) {
            return new WorkerOutcome(role, pid, now, 0, 0, 0, true);
        }
        List<Message> batch;
        try {
            batch = queue.dequeue(role, pid, batchSize, now);
        } catch (QueueTransactionConflictException e) {
            System.err.println("WARN " + role + " inbox busy, retrying next poll: " + e.getMessage());
            return new WorkerOutcome(role, pid, now, 0, 0, 0, true);
        }
        for (Message message : batch) {
            long startedAt = clock.millis();
            HandlerResult result;
            try {
                result = handler.handle(message);
            } catch (Exception e) {
                result = HandlerResult.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            long finishedAt = clock.millis();
            if (result.success()) {
                processed++;
                if (result.hasReply()) {
                    replies++;
                }
            } else {
                failed++;
            }
            Finish finish = new Finish(message, result, finishedAt, Math.max(0L, finishedAt - startedAt));
            try {
                finish.apply();
            } catch (QueueTransactionConflictException e) {
                System.err.println("WARN " + role + " could not finish " + message.id()
                        + ", retrying next poll: " + e.getMessage());
                deferred.add(finish);
                busy = true;
            }
        }
        return new WorkerOutcome(role, pid, now, processed, failed, replies, busy);
    }

    public void heartbeat(long nowMs) {
        ResourceSampler.Sample sample = sampler.sample();
        healthStore.heartbeat(new HeartbeatRecord(role, pid, nowMs, sample.cpuPercent(), sample.memoryBytes()));
    }

    /**
     * Messages handled but not yet marked finished in the queue.
     */
    public int deferredCount() {
        return deferred.size();
    }

    private boolean finishDeferred() {
        Iterator<Finish> it = deferred.iterator();
        while (it.hasNext()) {
            Finish finish = it.next();
            try {
                finish.apply();
                it.remove();
            } catch (QueueTransactionConflictException e) {
                System.err.println("WARN " + role + " still cannot finish " + finish.message.id() + ": " + e.getMessage());
                return false;
            }
        }
        return true;
    }

    /**
     * Queue writes that close out one handled message. Each step runs once, so
     * a retry after a conflict resumes where the previous attempt stopped.
     */
    private final class Finish {
        private final Message message;
        private final HandlerResult result;
        private final long finishedAt;
        private final long durationMs;
        private boolean replySent;
        private boolean completed;

        private Finish(Message message, HandlerResult result, long finishedAt, long durationMs) {
            this.message = message;
            this.result = result;
            this.finishedAt = finishedAt;
            this.durationMs = durationMs;
        }

        private void apply() {
            if (result.success() && result.hasReply() && !replySent) {
                queue.enqueue(new NewMessage(role, message.sender(), result.replyType(), result.replyPayload(),
                        MessagePriority.NORMAL.value()), finishedAt);
                replySent = true;
            }
            if (!completed) {
                if (result.success()) {
                    queue.complete(message.id(), WorkQueue.Outcome.COMPLETED, null, finishedAt);
                } else {
                    queue.complete(message.id(), WorkQueue.Outcome.FAILED, result.error(), finishedAt);
                }
                completed = true;
            }
            try {
                queue.recordMetric(new MetricSample(role, OPERATION_PREFIX + message.type(), durationMs, finishedAt));
            } catch (QueueTransactionConflictException e) {
                System.err.println("WARN " + role + " metric for " + message.id() + " dropped: " + e.getMessage());
            }
        }
    }

    public record WorkerOutcome(
            String role,
            long pid,
            long heartbeatAtMs,
            int processed,
            int failed,
            int replies,
            boolean queueBusy
    ) {
    }
}
