package io.agentwarden.storage;

import io.agentwarden.model.Message;
import io.agentwarden.model.MessageStatus;
import io.agentwarden.model.MetricSample;
import io.agentwarden.model.MetricSummary;
import io.agentwarden.model.NewMessage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Queue held in memory, ordered by insertion for equal priority and creation
 * time. Every operation is serialized on the instance.
 */
public final class InMemoryWorkQueue implements WorkQueue {
    private final Map<String, Message> messages = new LinkedHashMap<>();
    private final List<MetricSample> samples = new ArrayList<>();

    @Override
    public synchronized String enqueue(NewMessage message, long nowMs) {
        String id = "msg_" + UUID.randomUUID();
        messages.put(id, new Message(id, message.sender(), message.recipient(), message.type(), message.payload(),
                message.priority(), MessageStatus.PENDING, null, nowMs, null, null, null));
        return id;
    }

    @Override
    public synchronized List<Message> dequeue(String recipient, long consumerPid, int limit, long nowMs) {
        // LinkedHashMap iteration is insertion order and the sort is stable.
        List<Message> pending = new ArrayList<>();
        for (Message m : messages.values()) {
            if (m.recipient().equals(recipient) && m.status() == MessageStatus.PENDING) {
                pending.add(m);
            }
        }
        pending.sort(Comparator.comparingInt(Message::priority).thenComparingLong(Message::createdAtMs));
        List<Message> claimed = new ArrayList<>();
        for (Message m : pending.subList(0, Math.min(Math.max(1, limit), pending.size()))) {
            Message next = new Message(m.id(), m.sender(), m.recipient(), m.type(), m.payload(), m.priority(),
                    MessageStatus.IN_PROGRESS, consumerPid, m.createdAtMs(), nowMs, null, null);
            messages.put(m.id(), next);
            claimed.add(next);
        }
        return claimed;
    }

    @Override
    public synchronized void complete(String messageId, Outcome outcome, String error, long nowMs) {
        Message m = messages.get(messageId);
        if (m == null || m.status() != MessageStatus.IN_PROGRESS) {
            throw new IllegalMessageTransitionException(messageId, m == null ? null : m.status(), outcome.status());
        }
        messages.put(messageId, finish(m, outcome.status(), error, nowMs));
    }

    @Override
    public synchronized Optional<Message> find(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public synchronized int failInFlight(String recipient, long consumerPid, String reason, long nowMs) {
        int n = 0;
        for (Message m : new ArrayList<>(messages.values())) {
            if (m.recipient().equals(recipient) && m.status() == MessageStatus.IN_PROGRESS
                    && m.claimedBy() != null && m.claimedBy() == consumerPid) {
                messages.put(m.id(), finish(m, MessageStatus.FAILED, reason, nowMs));
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized int failPending(String recipient, String reason, long nowMs) {
        int n = 0;
        for (Message m : new ArrayList<>(messages.values())) {
            if (m.recipient().equals(recipient) && m.status() == MessageStatus.PENDING) {
                messages.put(m.id(), finish(m, MessageStatus.FAILED, reason, nowMs));
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized int reroutePending(String recipient, String newRecipient) {
        int n = 0;
        for (Message m : new ArrayList<>(messages.values())) {
            if (m.recipient().equals(recipient) && m.status() == MessageStatus.PENDING) {
                messages.put(m.id(), new Message(m.id(), m.sender(), newRecipient, m.type(), m.payload(), m.priority(),
                        m.status(), null, m.createdAtMs(), null, null, null));
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized int purgeFinishedBefore(long cutoffMs) {
        int n = 0;
        Iterator<Message> it = messages.values().iterator();
        while (it.hasNext()) {
            Message m = it.next();
            if (m.status().isFinished() && m.completedAtMs() != null && m.completedAtMs() < cutoffMs) {
                it.remove();
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized Map<String, Integer> stats(String recipient) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (MessageStatus status : MessageStatus.values()) {
            out.put(status.name(), 0);
        }
        for (Message m : messages.values()) {
            if (recipient == null || recipient.equals(m.recipient())) {
                out.merge(m.status().name(), 1, Integer::sum);
            }
        }
        return out;
    }

    @Override
    public synchronized List<Message> list(String recipient, MessageStatus status, int limit) {
        List<Message> all = new ArrayList<>(messages.values());
        List<Message> out = new ArrayList<>();
        for (int i = all.size() - 1; i >= 0 && out.size() < Math.max(1, limit); i--) {
            Message m = all.get(i);
            if ((recipient == null || recipient.equals(m.recipient())) && (status == null || status == m.status())) {
                out.add(m);
            }
        }
        out.sort(Comparator.comparingLong(Message::createdAtMs).reversed());
        return out;
    }

    @Override
    public synchronized void recordMetric(MetricSample sample) {
        samples.add(sample);
    }

    @Override
    public synchronized List<MetricSample> metrics(String role, long sinceMs, int limit) {
        List<MetricSample> out = new ArrayList<>();
        for (int i = samples.size() - 1; i >= 0 && out.size() < Math.max(1, limit); i--) {
            MetricSample s = samples.get(i);
            if (s.timestampMs() >= sinceMs && (role == null || role.equals(s.role()))) {
                out.add(s);
            }
        }
        out.sort(Comparator.comparingLong(MetricSample::timestampMs).reversed());
        return out;
    }

    @Override
    public synchronized List<MetricSummary> metricSummary(long sinceMs) {
        Map<String, List<MetricSample>> groups = new TreeMap<>();
        for (MetricSample s : samples) {
            if (s.timestampMs() >= sinceMs) {
                groups.computeIfAbsent(s.role() + '\u0000' + s.operationType(), k -> new ArrayList<>()).add(s);
            }
        }
        List<MetricSummary> out = new ArrayList<>();
        for (List<MetricSample> group : groups.values()) {
            long total = 0L;
            long max = 0L;
            for (MetricSample s : group) {
                total += s.durationMs();
                max = Math.max(max, s.durationMs());
            }
            MetricSample first = group.get(0);
            out.add(new MetricSummary(first.role(), first.operationType(), group.size(),
                    (double) total / group.size(), max));
        }
        return out;
    }

    private static Message finish(Message m, MessageStatus status, String error, long nowMs) {
        return new Message(m.id(), m.sender(), m.recipient(), m.type(), m.payload(), m.priority(), status,
                m.claimedBy(), m.createdAtMs(), m.claimedAtMs(), nowMs, error);
    }
}
