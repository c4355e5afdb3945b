package io.agentwarden.storage;

import io.agentwarden.model.Alert;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.model.WorkerStatusSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Latest heartbeat per role, the supervisor's published status snapshot and
 * the alert log.
 */
public interface HealthStore {
    void heartbeat(HeartbeatRecord heartbeat);

    Optional<HeartbeatRecord> latest(String role);

    List<HeartbeatRecord> all();

    void clear(String role);

    void publishStatus(List<WorkerStatusSnapshot> snapshots);

    List<WorkerStatusSnapshot> listStatus();

    Alert raiseAlert(Alert alert);

    List<Alert> listAlerts(int limit);
}
