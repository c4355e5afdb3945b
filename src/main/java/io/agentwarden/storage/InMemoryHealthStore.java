package io.agentwarden.storage;

import io.agentwarden.model.Alert;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.model.WorkerStatusSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

public final class InMemoryHealthStore implements HealthStore {
    private final TreeMap<String, HeartbeatRecord> heartbeats = new TreeMap<>();
    private final TreeMap<String, WorkerStatusSnapshot> status = new TreeMap<>();
    private final List<Alert> alerts = new ArrayList<>();
    private long nextAlertId = 1L;

    @Override
    public synchronized void heartbeat(HeartbeatRecord heartbeat) {
        heartbeats.put(heartbeat.role(), heartbeat);
    }

    @Override
    public synchronized Optional<HeartbeatRecord> latest(String role) {
        return Optional.ofNullable(heartbeats.get(role));
    }

    @Override
    public synchronized List<HeartbeatRecord> all() {
        return new ArrayList<>(heartbeats.values());
    }

    @Override
    public synchronized void clear(String role) {
        heartbeats.remove(role);
    }

    @Override
    public synchronized void publishStatus(List<WorkerStatusSnapshot> snapshots) {
        status.clear();
        for (WorkerStatusSnapshot s : snapshots) {
            status.put(s.role(), s);
        }
    }

    @Override
    public synchronized List<WorkerStatusSnapshot> listStatus() {
        return new ArrayList<>(status.values());
    }

    @Override
    public synchronized Alert raiseAlert(Alert alert) {
        Alert stored = new Alert(nextAlertId++, alert.role(), alert.kind(), alert.severity(), alert.message(),
                alert.createdAtMs());
        alerts.add(stored);
        return stored;
    }

    @Override
    public synchronized List<Alert> listAlerts(int limit) {
        List<Alert> out = new ArrayList<>();
        for (int i = alerts.size() - 1; i >= 0 && out.size() < Math.max(1, limit); i--) {
            out.add(alerts.get(i));
        }
        return out;
    }
}
