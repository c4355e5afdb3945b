package io.agentwarden.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentwarden.model.Alert;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.model.Message;
import io.agentwarden.model.MessageStatus;
import io.agentwarden.model.MetricSample;
import io.agentwarden.model.MetricSummary;
import io.agentwarden.model.NewMessage;
import io.agentwarden.model.WorkerStatusSnapshot;
import io.agentwarden.storage.HealthStore;
import io.agentwarden.storage.InMemoryHealthStore;
import io.agentwarden.storage.InMemoryWorkQueue;
import io.agentwarden.storage.QueueTransactionConflictException;
import io.agentwarden.storage.WorkQueue;
import io.agentwarden.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class WorkerRuntimeTest {
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(50_000L), ZoneOffset.UTC);

    @Test
    void pingIsAnsweredWithPongToTheSender() {
        InMemoryWorkQueue queue = new InMemoryWorkQueue();
        InMemoryHealthStore health = new InMemoryHealthStore();
        WorkerRuntime worker = new WorkerRuntime("assistant", 77L, queue, health, new EchoHandler("assistant"),
                new ResourceSampler(), CLOCK, 10);
        String ping = queue.enqueue(NewMessage.of("architect", "assistant", EchoHandler.PING, "{\"n\":7}"), 1L);

        WorkerRuntime.WorkerOutcome outcome = worker.runOnce();

        Assertions.assertEquals(1, outcome.processed());
        Assertions.assertEquals(1, outcome.replies());
        Assertions.assertFalse(outcome.queueBusy());
        Assertions.assertEquals(MessageStatus.COMPLETED, queue.find(ping).orElseThrow().status());

        List<Message> replies = queue.dequeue("architect", 1L, 10, 60_000L);
        Assertions.assertEquals(1, replies.size());
        Assertions.assertEquals(EchoHandler.PONG, replies.get(0).type());
        Assertions.assertEquals("assistant", replies.get(0).sender());
        JsonNode body = Jsons.readTree(replies.get(0).payload());
        Assertions.assertEquals(ping, body.path("inReplyTo").asText());
        Assertions.assertEquals(7, body.path("received").path("n").asInt());

        HeartbeatRecord heartbeat = health.latest("assistant").orElseThrow();
        Assertions.assertEquals(77L, heartbeat.pid());
        Assertions.assertEquals(50_000L, heartbeat.timestampMs());

        List<MetricSample> samples = queue.metrics("assistant", 0L, 10);
        Assertions.assertEquals(1, samples.size());
        Assertions.assertEquals("message.ping", samples.get(0).operationType());
    }

    @Test
    void handlerFailureMarksTheMessageFailed() {
        InMemoryWorkQueue queue = new InMemoryWorkQueue();
        MessageHandler handler = message -> {
            if ("explode".equals(message.type())) {
                throw new IllegalStateException("handler exploded");
            }
            return HandlerResult.fail("not supported");
        };
        WorkerRuntime worker = new WorkerRuntime("architect", 5L, queue, new InMemoryHealthStore(), handler,
                new ResourceSampler(), CLOCK, 10);
        String explode = queue.enqueue(NewMessage.of("cli", "architect", "explode", "{}"), 1L);
        String refused = queue.enqueue(NewMessage.of("cli", "architect", "plan", "{}"), 2L);

        WorkerRuntime.WorkerOutcome outcome = worker.runOnce();

        Assertions.assertEquals(0, outcome.processed());
        Assertions.assertEquals(2, outcome.failed());
        Message exploded = queue.find(explode).orElseThrow();
        Assertions.assertEquals(MessageStatus.FAILED, exploded.status());
        Assertions.assertEquals("IllegalStateException: handler exploded", exploded.error());
        Assertions.assertEquals("not supported", queue.find(refused).orElseThrow().error());
        Assertions.assertEquals(2, queue.metrics("architect", 0L, 10).size());
    }

    @Test
    void batchSizeLimitsMessagesPerPoll() {
        InMemoryWorkQueue queue = new InMemoryWorkQueue();
        WorkerRuntime worker = new WorkerRuntime("assistant", 9L, queue, new InMemoryHealthStore(),
                new EchoHandler("assistant"), new ResourceSampler(), CLOCK, 2);
        for (int i = 0; i < 5; i++) {
            queue.enqueue(NewMessage.of("cli", "assistant", "note", "{}"), i);
        }

        Assertions.assertEquals(2, worker.runOnce().processed());
        Assertions.assertEquals(2, worker.runOnce().processed());
        Assertions.assertEquals(1, worker.runOnce().processed());
        Assertions.assertEquals(0, worker.runOnce().processed());
        Assertions.assertEquals(5, queue.stats("assistant").get("COMPLETED"));
    }

    @Test
    void busyQueueOnCompleteIsRetriedOnTheNextPoll() {
        InMemoryWorkQueue inner = new InMemoryWorkQueue();
        FlakyQueue queue = new FlakyQueue(inner);
        WorkerRuntime worker = new WorkerRuntime("assistant", 11L, queue, new InMemoryHealthStore(),
                new EchoHandler("assistant"), new ResourceSampler(), CLOCK, 10);
        String ping = inner.enqueue(NewMessage.of("architect", "assistant", EchoHandler.PING, "{}"), 1L);

        queue.failCompletes = 1;
        WorkerRuntime.WorkerOutcome busy = worker.runOnce();
        Assertions.assertTrue(busy.queueBusy());
        Assertions.assertEquals(1, worker.deferredCount());
        Assertions.assertEquals(MessageStatus.IN_PROGRESS, inner.find(ping).orElseThrow().status());

        WorkerRuntime.WorkerOutcome next = worker.runOnce();
        Assertions.assertFalse(next.queueBusy());
        Assertions.assertEquals(0, worker.deferredCount());
        Assertions.assertEquals(MessageStatus.COMPLETED, inner.find(ping).orElseThrow().status());
        Assertions.assertEquals(1, inner.dequeue("architect", 1L, 10, 60_000L).size());
        Assertions.assertEquals(1, inner.metrics("assistant", 0L, 10).size());

        inner.enqueue(NewMessage.of("cli", "assistant", "note", "{}"), 2L);
        Assertions.assertEquals(1, worker.runOnce().processed());
    }

    @Test
    void busyHeartbeatDoesNotStopThePoll() {
        InMemoryWorkQueue queue = new InMemoryWorkQueue();
        InMemoryHealthStore health = new InMemoryHealthStore();
        HealthStore busyHealth = new BusyHeartbeatStore(health);
        WorkerRuntime worker = new WorkerRuntime("assistant", 12L, queue, busyHealth, new EchoHandler("assistant"),
                new ResourceSampler(), CLOCK, 10);
        queue.enqueue(NewMessage.of("cli", "assistant", "note", "{}"), 1L);

        WorkerRuntime.WorkerOutcome outcome = worker.runOnce();

        Assertions.assertTrue(outcome.queueBusy());
        Assertions.assertEquals(1, outcome.processed());
        Assertions.assertTrue(health.latest("assistant").isEmpty());
    }

    private static QueueTransactionConflictException busy() {
        return new QueueTransactionConflictException("database is locked", new SQLException("SQLITE_BUSY", null, 5));
    }

    private static final class FlakyQueue implements WorkQueue {
        private final WorkQueue delegate;
        private int failCompletes;

        private FlakyQueue(WorkQueue delegate) {
            this.delegate = delegate;
        }

        @Override
        public String enqueue(NewMessage message, long nowMs) {
            return delegate.enqueue(message, nowMs);
        }

        @Override
        public List<Message> dequeue(String recipient, long consumerPid, int limit, long nowMs) {
            return delegate.dequeue(recipient, consumerPid, limit, nowMs);
        }

        @Override
        public void complete(String messageId, Outcome outcome, String error, long nowMs) {
            if (failCompletes > 0) {
                failCompletes--;
                throw busy();
            }
            delegate.complete(messageId, outcome, error, nowMs);
        }

        @Override
        public Optional<Message> find(String messageId) {
            return delegate.find(messageId);
        }

        @Override
        public int failInFlight(String recipient, long consumerPid, String reason, long nowMs) {
            return delegate.failInFlight(recipient, consumerPid, reason, nowMs);
        }

        @Override
        public int failPending(String recipient, String reason, long nowMs) {
            return delegate.failPending(recipient, reason, nowMs);
        }

        @Override
        public int reroutePending(String recipient, String newRecipient) {
            return delegate.reroutePending(recipient, newRecipient);
        }

        @Override
        public int purgeFinishedBefore(long cutoffMs) {
            return delegate.purgeFinishedBefore(cutoffMs);
        }

        @Override
        public Map<String, Integer> stats(String recipient) {
            return delegate.stats(recipient);
        }

        @Override
        public List<Message> list(String recipient, MessageStatus status, int limit) {
            return delegate.list(recipient, status, limit);
        }

        @Override
        public void recordMetric(MetricSample sample) {
            delegate.recordMetric(sample);
        }

        @Override
        public List<MetricSample> metrics(String role, long sinceMs, int limit) {
            return delegate.metrics(role, sinceMs, limit);
        }

        @Override
        public List<MetricSummary> metricSummary(long sinceMs) {
            return delegate.metricSummary(sinceMs);
        }
    }

    private static final class BusyHeartbeatStore implements HealthStore {
        private final HealthStore delegate;

        private BusyHeartbeatStore(HealthStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public void heartbeat(HeartbeatRecord heartbeat) {
            throw busy();
        }

        @Override
        public Optional<HeartbeatRecord> latest(String role) {
            return delegate.latest(role);
        }

        @Override
        public List<HeartbeatRecord> all() {
            return delegate.all();
        }

        @Override
        public void clear(String role) {
            delegate.clear(role);
        }

        @Override
        public void publishStatus(List<WorkerStatusSnapshot> snapshots) {
            delegate.publishStatus(snapshots);
        }

        @Override
        public List<WorkerStatusSnapshot> listStatus() {
            return delegate.listStatus();
        }

        @Override
        public Alert raiseAlert(Alert alert) {
            return delegate.raiseAlert(alert);
        }

        @Override
        public List<Alert> listAlerts(int limit) {
            return delegate.listAlerts(limit);
        }
    }
}
