package io.agentwarden.supervisor;

import io.agentwarden.config.WorkerRole;
import io.agentwarden.model.WorkerState;

import java.util.List;

/**
 * Supervisor-side lifecycle record of one role. Only the supervisor's control
 * thread mutates it.
 */
public final class WorkerProcess {
    private final WorkerRole role;
    private WorkerHandle handle;
    private Long pid;
    private Long startedAtMs;
    private WorkerState state = WorkerState.UNSTARTED;
    private int restartCount;
    private Long lastRestartAtMs;
    private Long crashedAtMs;
    private Long nextRestartAtMs;
    private Long lastCheckedAtMs;
    private boolean forcedStop;
    private HealthReport lastReport;
    private List<String> lastWarnings = List.of();

    public WorkerProcess(WorkerRole role) {
        this.role = role;
    }

    public WorkerRole role() {
        return role;
    }

    public String roleId() {
        return role.id();
    }

    public WorkerHandle handle() {
        return handle;
    }

    public Long pid() {
        return pid;
    }

    public Long startedAtMs() {
        return startedAtMs;
    }

    public WorkerState state() {
        return state;
    }

    public int restartCount() {
        return restartCount;
    }

    public Long lastRestartAtMs() {
        return lastRestartAtMs;
    }

    public Long crashedAtMs() {
        return crashedAtMs;
    }

    public Long nextRestartAtMs() {
        return nextRestartAtMs;
    }

    public Long lastCheckedAtMs() {
        return lastCheckedAtMs;
    }

    public boolean forcedStop() {
        return forcedStop;
    }

    public HealthReport lastReport() {
        return lastReport;
    }

    public boolean isProcessAlive(ProcessProbe probe) {
        if (handle != null) {
            return handle.isAlive();
        }
        return pid != null && probe.isAlive(pid);
    }

    void started(WorkerHandle newHandle, long nowMs) {
        this.handle = newHandle;
        this.pid = newHandle.pid();
        this.startedAtMs = nowMs;
        this.state = WorkerState.STARTING;
        this.crashedAtMs = null;
        this.nextRestartAtMs = null;
        this.lastCheckedAtMs = null;
        this.lastReport = null;
        this.lastWarnings = List.of();
    }

    void restarting(long nowMs) {
        this.restartCount++;
        this.lastRestartAtMs = nowMs;
    }

    void crashed(long nowMs) {
        this.state = WorkerState.CRASHED;
        this.crashedAtMs = nowMs;
        this.handle = null;
    }

    void scheduleRestart(Long atMs) {
        this.nextRestartAtMs = atMs;
    }

    void state(WorkerState next) {
        this.state = next;
    }

    void checked(long nowMs, HealthReport report) {
        this.lastCheckedAtMs = nowMs;
        this.lastReport = report;
    }

    void stopped(boolean forced) {
        this.forcedStop = forced;
        this.handle = null;
        this.nextRestartAtMs = null;
        if (state != WorkerState.TERMINAL) {
            this.state = WorkerState.STOPPED;
        }
    }

    /**
     * Records the current resource warnings and reports whether they differ
     * from the previous check.
     */
    boolean warningsChanged(List<String> warnings) {
        if (lastWarnings.equals(warnings)) {
            return false;
        }
        lastWarnings = List.copyOf(warnings);
        return true;
    }

    public String displayState() {
        return switch (state) {
            case RUNNING -> "running";
            case STALE -> "stale";
            case STARTING -> "starting";
            case CRASHED -> "crashed-retrying(" + Math.min(restartCount + 1, role.maxRestarts()) + "/" + role.maxRestarts() + ")";
            case TERMINAL -> "terminal";
            case STOPPING -> "stopping";
            case STOPPED -> "stopped";
            case UNSTARTED -> "unstarted";
        };
    }
}
