package io.agentwarden.supervisor;

import io.agentwarden.config.SupervisorSettings;
import io.agentwarden.config.WorkerRole;
import io.agentwarden.model.Alert;
import io.agentwarden.model.HealthStatus;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.model.Message;
import io.agentwarden.model.MessagePriority;
import io.agentwarden.model.NewMessage;
import io.agentwarden.model.RoleLockRecord;
import io.agentwarden.model.WorkerState;
import io.agentwarden.model.WorkerStatusSnapshot;
import io.agentwarden.observability.AuditLogger;
import io.agentwarden.observability.AuditLogger.AuditEvent;
import io.agentwarden.storage.HealthStore;
import io.agentwarden.storage.RoleLockStore;
import io.agentwarden.storage.WorkQueue;
import io.agentwarden.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Launches the configured worker roles, keeps them alive and stops them.
 *
 * <p>All lifecycle changes happen on one control thread: either the caller of
 * {@link #tick()} and {@link #shutdown(ShutdownMode)}, or the monitor thread
 * started by {@link #run()}. {@link #requestShutdown(ShutdownMode)} is the only
 * entry point meant for other threads.
 */
public final class ProcessSupervisor {
    public static final String SUPERVISOR_ROLE = "supervisor";
    public static final String SHUTDOWN_REQUEST = "shutdown_request";
    public static final String STATUS_QUERY = "status_query";
    public static final String STATUS_RESPONSE = "status_response";
    static final long SHUTDOWN_POLL_MS = 100L;
    private static final int CONTROL_BATCH = 10;

    private final SupervisorSettings settings;
    private final RoleLockStore locks;
    private final WorkQueue queue;
    private final HealthStore healthStore;
    private final ProcessLauncher launcher;
    private final ProcessProbe probe;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AuditLogger audit;
    private final long selfPid;
    private final Path statusFile;
    private final HealthMonitor monitor;

    private final Map<String, WorkerProcess> workers = new LinkedHashMap<>();
    private final AtomicReference<ShutdownMode> shutdownRequested = new AtomicReference<>();
    private final AtomicReference<ShutdownReport> report = new AtomicReference<>();
    private final AtomicReference<ScheduledExecutorService> executor = new AtomicReference<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private boolean started;
    private long tickCount;

    public ProcessSupervisor(
            SupervisorSettings settings,
            RoleLockStore locks,
            WorkQueue queue,
            HealthStore healthStore,
            ProcessLauncher launcher,
            ProcessProbe probe,
            Clock clock,
            Sleeper sleeper,
            AuditLogger audit,
            long selfPid,
            Path statusFile
    ) {
        this.settings = settings;
        this.locks = locks;
        this.queue = queue;
        this.healthStore = healthStore;
        this.launcher = launcher;
        this.probe = probe;
        this.clock = clock;
        this.sleeper = sleeper;
        this.audit = audit;
        this.selfPid = selfPid;
        this.statusFile = statusFile;
        this.monitor = new HealthMonitor(healthStore, probe);
    }

    /**
     * Claims the supervisor lock and launches {@code roleIds} (all configured
     * roles when empty) in ascending priority order.
     *
     * @throws RoleAlreadyRunningException if another supervisor holds the lock
     */
    public synchronized void start(Set<String> roleIds) throws InterruptedException {
        if (started) {
            throw new IllegalStateException("supervisor already started");
        }
        List<WorkerRole> selected = selectRoles(roleIds);
        long now = clock.millis();
        reclaimStaleLocks(now);
        if (!locks.claim(SUPERVISOR_ROLE, selfPid, now)) {
            Long holder = locks.find(SUPERVISOR_ROLE).map(RoleLockRecord::holderPid).orElse(null);
            audit.log(AuditEvent.of("supervisor.start.rejected", SUPERVISOR_ROLE, holder, "rejected", Map.of()));
            throw new RoleAlreadyRunningException(SUPERVISOR_ROLE, holder);
        }
        started = true;
        audit.log(AuditEvent.of("supervisor.started", SUPERVISOR_ROLE, selfPid, "ok",
                Map.of("roles", selected.stream().map(WorkerRole::id).toList())));
        for (WorkerRole role : selected) {
            workers.put(role.id(), new WorkerProcess(role));
        }
        boolean first = true;
        for (WorkerProcess worker : workers.values()) {
            if (shutdownRequested.get() != null) {
                break;
            }
            if (!first && settings.launchDelayMs() > 0L) {
                sleeper.sleep(settings.launchDelayMs());
            }
            first = false;
            launch(worker, clock.millis());
        }
        publishStatus(clock.millis());
    }

    /**
     * Runs the monitor loop on a dedicated thread until the supervisor shuts
     * down, then returns the shutdown report.
     */
    public ShutdownReport run() throws InterruptedException {
        ScheduledExecutorService ex = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentwarden-monitor");
            t.setDaemon(true);
            return t;
        });
        executor.set(ex);
        try {
            ex.scheduleAtFixedRate(this::loopIteration, settings.monitorIntervalMs(), settings.monitorIntervalMs(),
                    TimeUnit.MILLISECONDS);
            if (shutdownRequested.get() != null) {
                ex.execute(this::loopIteration);
            }
            terminated.await();
            return report.get();
        } finally {
            executor.set(null);
            ex.shutdownNow();
        }
    }

    /**
     * Asks the control thread to shut down. Safe to call from any thread,
     * including a JVM shutdown hook. The first request wins.
     */
    public void requestShutdown(ShutdownMode mode) {
        if (!shutdownRequested.compareAndSet(null, mode)) {
            return;
        }
        ScheduledExecutorService ex = executor.get();
        if (ex != null) {
            try {
                ex.execute(this::loopIteration);
            } catch (RejectedExecutionException e) {
                System.err.println("WARN monitor loop already stopped: " + e.getMessage());
            }
        }
    }

    public ShutdownReport awaitTermination(long timeoutMs) throws InterruptedException {
        terminated.await(timeoutMs, TimeUnit.MILLISECONDS);
        return report.get();
    }

    public ShutdownReport report() {
        return report.get();
    }

    public boolean isTerminated() {
        return report.get() != null;
    }

    /**
     * One monitor iteration. Failures while handling one worker are audited and
     * never prevent the others from being checked.
     */
    public synchronized void tick() {
        if (!started || report.get() != null) {
            return;
        }
        long now = clock.millis();
        tickCount++;
        try {
            handleControlMessages(now);
        } catch (RuntimeException e) {
            tickError(SUPERVISOR_ROLE, "control", e);
        }
        if (shutdownRequested.get() != null) {
            return;
        }
        for (WorkerProcess worker : workers.values()) {
            try {
                checkWorker(worker, now);
            } catch (RuntimeException e) {
                tickError(worker.roleId(), "check", e);
            }
        }
        if (tickCount % settings.maintenanceEveryTicks() == 0) {
            try {
                runMaintenance(now);
            } catch (RuntimeException e) {
                tickError(SUPERVISOR_ROLE, "maintenance", e);
            }
        }
        try {
            publishStatus(now);
        } catch (RuntimeException e) {
            tickError(SUPERVISOR_ROLE, "status", e);
        }
    }

    /**
     * Signals every live worker, waits up to the mode's grace period, kills
     * stragglers and releases every lock this supervisor holds. Idempotent:
     * later calls return the first report.
     */
    public synchronized ShutdownReport shutdown(ShutdownMode mode) {
        ShutdownReport existing = report.get();
        if (existing != null) {
            return existing;
        }
        shutdownRequested.compareAndSet(null, mode);
        long graceMs = mode == ShutdownMode.IMMEDIATE ? settings.immediateGracePeriodMs() : settings.gracePeriodMs();
        audit.log(AuditEvent.of("supervisor.shutdown.begin", SUPERVISOR_ROLE, selfPid, "ok",
                Map.of("mode", mode.name(), "graceMs", graceMs)));

        List<WorkerProcess> live = new ArrayList<>();
        for (WorkerProcess worker : workers.values()) {
            if (worker.handle() != null && worker.state().isLive()) {
                worker.state(WorkerState.STOPPING);
                try {
                    worker.handle().terminate();
                } catch (RuntimeException e) {
                    tickError(worker.roleId(), "terminate", e);
                }
                live.add(worker);
            }
        }
        awaitExit(live, clock.millis() + graceMs);

        List<String> stopped = new ArrayList<>();
        List<String> forced = new ArrayList<>();
        long now = clock.millis();
        for (WorkerProcess worker : workers.values()) {
            if (!live.contains(worker)) {
                if (worker.state() == WorkerState.CRASHED) {
                    worker.stopped(false);
                }
                continue;
            }
            Long pid = worker.pid();
            boolean wasForced = worker.handle().isAlive();
            if (wasForced) {
                worker.handle().kill();
                forced.add(worker.roleId());
                int failed = queue.failInFlight(worker.roleId(), pid, "worker force-stopped during shutdown", now);
                audit.log(AuditEvent.of("worker.stop.forced", worker.roleId(), pid, "forced",
                        Map.of("graceMs", graceMs, "failedInFlight", failed)));
            } else {
                stopped.add(worker.roleId());
                audit.log(AuditEvent.of("worker.stopped", worker.roleId(), pid, "ok", Map.of()));
            }
            worker.stopped(wasForced);
            locks.release(worker.roleId(), pid);
        }
        List<String> terminal = new ArrayList<>();
        for (WorkerProcess worker : workers.values()) {
            if (worker.state() == WorkerState.TERMINAL) {
                terminal.add(worker.roleId());
            }
        }
        try {
            publishStatus(now);
        } catch (RuntimeException e) {
            tickError(SUPERVISOR_ROLE, "status", e);
        }
        if (started) {
            locks.release(SUPERVISOR_ROLE, selfPid);
        }
        int exitCode = ShutdownReport.exitCodeFor(forced, terminal);
        ShutdownReport result = new ShutdownReport(mode, forced.isEmpty() && terminal.isEmpty(),
                stopped, forced, terminal, exitCode);
        audit.log(AuditEvent.of("supervisor.shutdown.complete", SUPERVISOR_ROLE, selfPid,
                result.clean() ? "ok" : "degraded",
                Map.of("exitCode", exitCode, "forced", forced, "terminal", terminal)));
        report.set(result);
        terminated.countDown();
        return result;
    }

    public synchronized List<WorkerStatusSnapshot> snapshot() {
        return snapshot(clock.millis());
    }

    public synchronized Collection<WorkerProcess> workers() {
        return List.copyOf(workers.values());
    }

    private void loopIteration() {
        try {
            ShutdownMode mode = shutdownRequested.get();
            if (mode != null) {
                shutdown(mode);
                return;
            }
            tick();
            mode = shutdownRequested.get();
            if (mode != null) {
                shutdown(mode);
            }
        } catch (RuntimeException e) {
            tickError(SUPERVISOR_ROLE, "loop", e);
        }
    }

    private List<WorkerRole> selectRoles(Set<String> roleIds) {
        List<WorkerRole> selected = new ArrayList<>();
        if (roleIds == null || roleIds.isEmpty()) {
            selected.addAll(settings.roles());
        } else {
            for (String id : roleIds) {
                selected.add(settings.role(id));
            }
        }
        selected.sort(Comparator.comparingInt(WorkerRole::priority).thenComparing(WorkerRole::id));
        return selected;
    }

    private void launch(WorkerProcess worker, long now) {
        String role = worker.roleId();
        if (!locks.claim(role, selfPid, now)) {
            Long holder = locks.find(role).map(RoleLockRecord::holderPid).orElse(null);
            worker.state(WorkerState.UNSTARTED);
            audit.log(AuditEvent.of("worker.launch.rejected", role, holder, "rejected",
                    Map.of("reason", new RoleAlreadyRunningException(role, holder).getMessage())));
            System.err.println("WARN role " + role + " is already running elsewhere, not launching");
            return;
        }
        WorkerHandle handle;
        try {
            handle = launcher.launch(worker.role());
        } catch (ProcessSpawnException e) {
            locks.release(role, selfPid);
            audit.log(AuditEvent.of("worker.spawn.failed", role, null, "error",
                    Map.of("error", String.valueOf(e.getMessage()))));
            System.err.println("WARN " + e.getMessage());
            worker.crashed(now);
            scheduleRestart(worker, now);
            return;
        }
        if (!locks.handover(role, selfPid, handle.pid())) {
            System.err.println("WARN role lock for " + role + " was lost before handover to pid " + handle.pid());
        }
        worker.started(handle, now);
        audit.log(AuditEvent.of("worker.started", role, handle.pid(), "ok",
                Map.of("restartCount", worker.restartCount(), "priority", worker.role().priority())));
    }

    private void checkWorker(WorkerProcess worker, long now) {
        switch (worker.state()) {
            case CRASHED -> {
                Long due = worker.nextRestartAtMs();
                if (due != null && now >= due) {
                    worker.restarting(now);
                    audit.log(AuditEvent.of("worker.restarting", worker.roleId(), null, "ok",
                            Map.of("restartCount", worker.restartCount())));
                    launch(worker, now);
                }
            }
            case STARTING, RUNNING, STALE -> {
                Long last = worker.lastCheckedAtMs();
                boolean due = last == null || now - last >= worker.role().healthCheckIntervalMs();
                if (!due && worker.isProcessAlive(probe)) {
                    return;
                }
                HealthReport health = monitor.check(worker, now);
                worker.checked(now, health);
                applyHealth(worker, health, now);
            }
            default -> {
                // UNSTARTED, STOPPING, STOPPED and TERMINAL workers are not monitored.
            }
        }
    }

    private void applyHealth(WorkerProcess worker, HealthReport health, long now) {
        String role = worker.roleId();
        if (worker.warningsChanged(health.warnings()) && !health.warnings().isEmpty()) {
            audit.log(AuditEvent.of("worker.resource.warning", role, worker.pid(), "warning",
                    Map.of("warnings", health.warnings())));
            System.err.println("WARN " + role + ": " + String.join("; ", health.warnings()));
        }
        switch (health.status()) {
            case HEALTHY -> {
                if (worker.state() == WorkerState.STARTING && health.heartbeat() != null) {
                    worker.state(WorkerState.RUNNING);
                    audit.log(AuditEvent.of("worker.running", role, worker.pid(), "ok", Map.of()));
                } else if (worker.state() == WorkerState.STALE) {
                    worker.state(WorkerState.RUNNING);
                    audit.log(AuditEvent.of("worker.heartbeat.recovered", role, worker.pid(), "ok", Map.of()));
                }
            }
            case STALE -> {
                if (worker.state() != WorkerState.STALE) {
                    worker.state(WorkerState.STALE);
                    audit.log(AuditEvent.of("worker.heartbeat.stale", role, worker.pid(), "warning",
                            Map.of("reason", health.reason())));
                    System.err.println("WARN " + role + " heartbeat is stale: " + health.reason());
                }
            }
            case DEAD -> handleDeath(worker, health.reason(), now);
        }
    }

    private void handleDeath(WorkerProcess worker, String reason, long now) {
        String role = worker.roleId();
        Long pid = worker.pid();
        WorkerHandle handle = worker.handle();
        if (handle != null && handle.isAlive()) {
            handle.kill();
        }
        int failed = 0;
        if (pid != null) {
            locks.release(role, pid);
            if (settings.failInFlightOnCrash()) {
                failed = queue.failInFlight(role, pid, "worker crashed: " + reason, now);
            }
        }
        audit.log(AuditEvent.of("worker.dead", role, pid, "error",
                Map.of("reason", String.valueOf(reason), "failedInFlight", failed)));
        System.err.println("WARN worker " + role + " (pid " + pid + ") is dead: " + reason);
        worker.crashed(now);
        scheduleRestart(worker, now);
    }

    private void scheduleRestart(WorkerProcess worker, long now) {
        String role = worker.roleId();
        RestartDecision decision = RestartPolicy.decide(worker.restartCount(), worker.role());
        switch (decision.action()) {
            case RESTART_NOW -> {
                worker.restarting(now);
                audit.log(AuditEvent.of("worker.restarting", role, null, "ok",
                        Map.of("restartCount", worker.restartCount())));
                launch(worker, now);
            }
            case WAIT -> {
                long at = now + Math.min(decision.waitMs(), Long.MAX_VALUE - now);
                worker.scheduleRestart(at);
                audit.log(AuditEvent.of("worker.restart.scheduled", role, null, "ok",
                        Map.of("waitMs", decision.waitMs(), "restartCount", worker.restartCount())));
            }
            case GIVE_UP -> {
                worker.state(WorkerState.TERMINAL);
                worker.scheduleRestart(null);
                String message = "role " + role + " crashed after " + worker.restartCount()
                        + " restarts, max " + worker.role().maxRestarts();
                healthStore.raiseAlert(Alert.critical(role, "worker.max_restarts_exceeded", message, now));
                audit.log(AuditEvent.of("worker.max_restarts_exceeded", role, null, "critical",
                        Map.of("restartCount", worker.restartCount())));
                System.err.println("CRITICAL " + message);
                applyTerminalRecipientPolicy(role, now);
            }
        }
    }

    private void applyTerminalRecipientPolicy(String role, long now) {
        int affected = switch (settings.terminalRecipientPolicy()) {
            case HOLD -> 0;
            case EXPIRE -> queue.failPending(role, "recipient " + role + " is terminal", now);
            case REROUTE -> queue.reroutePending(role, settings.fallbackRecipient());
        };
        audit.log(AuditEvent.of("queue.terminal_recipient", role, null, "ok",
                Map.of("policy", settings.terminalRecipientPolicy().name(), "messages", affected)));
    }

    private void handleControlMessages(long now) {
        List<Message> messages = queue.dequeue(SUPERVISOR_ROLE, selfPid, CONTROL_BATCH, now);
        for (Message m : messages) {
            try {
                switch (m.type()) {
                    case SHUTDOWN_REQUEST -> {
                        ShutdownMode mode = ShutdownMode.fromPayload(m.payload());
                        audit.log(AuditEvent.byActor("supervisor.shutdown.requested", m.sender(), SUPERVISOR_ROLE,
                                selfPid, "ok", Map.of("mode", mode.name(), "messageId", m.id())));
                        shutdownRequested.compareAndSet(null, mode);
                        queue.complete(m.id(), WorkQueue.Outcome.COMPLETED, null, now);
                    }
                    case STATUS_QUERY -> {
                        String body = Jsons.toCompactJson(Map.of("workers", snapshot(now)));
                        queue.enqueue(new NewMessage(SUPERVISOR_ROLE, m.sender(), STATUS_RESPONSE, body,
                                MessagePriority.URGENT.value()), now);
                        queue.complete(m.id(), WorkQueue.Outcome.COMPLETED, null, now);
                    }
                    default -> queue.complete(m.id(), WorkQueue.Outcome.FAILED,
                            "unsupported control message type: " + m.type(), now);
                }
            } catch (RuntimeException e) {
                queue.complete(m.id(), WorkQueue.Outcome.FAILED, String.valueOf(e.getMessage()), now);
                tickError(SUPERVISOR_ROLE, "control." + m.type(), e);
            }
        }
    }

    private void runMaintenance(long now) {
        reclaimStaleLocks(now);
        int purged = queue.purgeFinishedBefore(now - settings.messageRetentionMs());
        if (purged > 0) {
            audit.log(AuditEvent.of("queue.purged", SUPERVISOR_ROLE, selfPid, "ok", Map.of("messages", purged)));
        }
    }

    private void reclaimStaleLocks(long now) {
        for (RoleLockRecord lock : locks.reclaimStale(now, settings.lockStaleAfterMs(), probe::isAlive)) {
            audit.log(AuditEvent.of("lock.stale_reclaimed", lock.role(), lock.holderPid(), "ok",
                    Map.of("acquiredAtMs", lock.acquiredAtMs(), "ageMs", now - lock.acquiredAtMs())));
            System.err.println("WARN reclaimed stale lock " + lock.role() + " held by dead pid " + lock.holderPid());
        }
    }

    private void awaitExit(List<WorkerProcess> live, long deadlineMs) {
        try {
            while (anyAlive(live) && clock.millis() < deadlineMs) {
                sleeper.sleep(Math.min(SHUTDOWN_POLL_MS, Math.max(1L, deadlineMs - clock.millis())));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean anyAlive(List<WorkerProcess> live) {
        for (WorkerProcess worker : live) {
            if (worker.handle().isAlive()) {
                return true;
            }
        }
        return false;
    }

    private void publishStatus(long now) {
        List<WorkerStatusSnapshot> snapshots = snapshot(now);
        healthStore.publishStatus(snapshots);
        if (statusFile != null) {
            writeStatusFile(snapshots, now);
        }
    }

    private List<WorkerStatusSnapshot> snapshot(long now) {
        List<WorkerStatusSnapshot> out = new ArrayList<>();
        for (WorkerProcess worker : workers.values()) {
            HeartbeatRecord heartbeat = null;
            if (worker.pid() != null) {
                long pid = worker.pid();
                heartbeat = healthStore.latest(worker.roleId()).filter(hb -> hb.pid() == pid).orElse(null);
            }
            boolean live = worker.state().isLive();
            HealthReport last = worker.lastReport();
            out.add(new WorkerStatusSnapshot(
                    worker.roleId(),
                    worker.state(),
                    worker.displayState(),
                    live ? worker.pid() : null,
                    worker.startedAtMs(),
                    live && worker.startedAtMs() != null ? Math.max(0L, now - worker.startedAtMs()) : 0L,
                    worker.restartCount(),
                    worker.role().maxRestarts(),
                    heartbeat == null ? null : heartbeat.timestampMs(),
                    heartbeat == null ? null : Math.max(0L, now - heartbeat.timestampMs()),
                    heartbeat == null ? null : heartbeat.cpuPercent(),
                    heartbeat == null ? null : heartbeat.memoryBytes(),
                    last == null || last.status() == HealthStatus.DEAD ? List.of() : last.warnings(),
                    now
            ));
        }
        return out;
    }

    private void writeStatusFile(List<WorkerStatusSnapshot> snapshots, long now) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("supervisorPid", selfPid);
        doc.put("updatedAtMs", now);
        doc.put("shutdownRequested", shutdownRequested.get() == null ? null : shutdownRequested.get().name());
        doc.put("workers", snapshots);
        try {
            Files.createDirectories(statusFile.toAbsolutePath().getParent());
            Path tmp = statusFile.resolveSibling(statusFile.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(doc), StandardCharsets.UTF_8);
            Files.move(tmp, statusFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write status file: " + statusFile, e);
        }
    }

    private void tickError(String role, String stage, RuntimeException e) {
        System.err.println("WARN supervisor " + stage + " failed for " + role + ": " + e.getMessage());
        try {
            audit.log(AuditEvent.of("supervisor.tick.error", role, null, "error",
                    Map.of("stage", stage, "error", String.valueOf(e.getMessage()))));
        } catch (RuntimeException auditFailure) {
            System.err.println("WARN audit write failed: " + auditFailure.getMessage());
        }
    }
}
