package io.agentwarden.supervisor;

import io.agentwarden.config.WorkerRole;
import io.agentwarden.model.HealthStatus;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.storage.HealthStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Classifies a worker from OS liveness and its latest heartbeat. Resource
 * usage over the role's limits only produces warnings.
 */
public final class HealthMonitor {
    private final HealthStore healthStore;
    private final ProcessProbe probe;

    public HealthMonitor(HealthStore healthStore, ProcessProbe probe) {
        this.healthStore = healthStore;
        this.probe = probe;
    }

    public HealthReport check(WorkerProcess worker, long nowMs) {
        return check(worker, worker.role(), nowMs);
    }

    public HealthReport check(WorkerProcess worker, WorkerRole role, long nowMs) {
        Long pid = worker.pid();
        if (pid == null || !worker.isProcessAlive(probe)) {
            return new HealthReport(role.id(), HealthStatus.DEAD, null, null, List.of(),
                    pid == null ? "no process" : "process " + pid + " is not running");
        }
        HeartbeatRecord heartbeat = healthStore.latest(role.id())
                .filter(hb -> hb.pid() == pid)
                .orElse(null);
        long reference = heartbeat != null
                ? heartbeat.timestampMs()
                : (worker.startedAtMs() == null ? nowMs : worker.startedAtMs());
        long age = Math.max(0L, nowMs - reference);
        List<String> warnings = heartbeat == null ? List.of() : resourceWarnings(heartbeat, role);
        String source = heartbeat == null ? "no heartbeat since start " : "last heartbeat ";
        if (age > role.heartbeatDeadAfterMs()) {
            return new HealthReport(role.id(), HealthStatus.DEAD, heartbeat, age, warnings,
                    source + age + "ms ago exceeds " + role.heartbeatDeadAfterMs() + "ms");
        }
        if (age > role.heartbeatStaleAfterMs()) {
            return new HealthReport(role.id(), HealthStatus.STALE, heartbeat, age, warnings,
                    source + age + "ms ago exceeds " + role.heartbeatStaleAfterMs() + "ms");
        }
        return new HealthReport(role.id(), HealthStatus.HEALTHY, heartbeat, age, warnings, null);
    }

    public List<HealthReport> checkAll(Collection<WorkerProcess> workers, long nowMs) {
        List<HealthReport> out = new ArrayList<>();
        for (WorkerProcess worker : workers) {
            out.add(check(worker, nowMs));
        }
        return out;
    }

    private static List<String> resourceWarnings(HeartbeatRecord heartbeat, WorkerRole role) {
        List<String> warnings = new ArrayList<>();
        if (heartbeat.cpuPercent() > role.maxCpuPercent()) {
            warnings.add(String.format(Locale.ROOT, "cpu %.1f%% above limit %.1f%%",
                    heartbeat.cpuPercent(), role.maxCpuPercent()));
        }
        if (heartbeat.memoryBytes() > role.maxMemoryBytes()) {
            warnings.add("memory " + heartbeat.memoryBytes() + " bytes above limit " + role.maxMemoryBytes() + " bytes");
        }
        return warnings;
    }
}
