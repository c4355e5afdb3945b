package io.agentwarden.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentwarden.config.AgentWardenConfig;
import io.agentwarden.config.SupervisorSettings;
import io.agentwarden.model.Alert;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.model.Message;
import io.agentwarden.model.MessagePriority;
import io.agentwarden.model.MessageStatus;
import io.agentwarden.model.MetricSample;
import io.agentwarden.model.MetricSummary;
import io.agentwarden.model.NewMessage;
import io.agentwarden.model.RoleLockRecord;
import io.agentwarden.model.WorkerState;
import io.agentwarden.model.WorkerStatusSnapshot;
import io.agentwarden.observability.AuditLogger;
import io.agentwarden.observability.AuditLogger.AuditEvent;
import io.agentwarden.observability.PrometheusFormatter;
import io.agentwarden.storage.Database;
import io.agentwarden.storage.HealthStore;
import io.agentwarden.storage.RoleLockStore;
import io.agentwarden.storage.SqliteHealthStore;
import io.agentwarden.storage.SqliteRoleLockStore;
import io.agentwarden.storage.SqliteWorkQueue;
import io.agentwarden.storage.WorkQueue;
import io.agentwarden.supervisor.OsProcessLauncher;
import io.agentwarden.supervisor.ProcessLauncher;
import io.agentwarden.supervisor.ProcessProbe;
import io.agentwarden.supervisor.ProcessSupervisor;
import io.agentwarden.supervisor.Sleeper;
import io.agentwarden.util.Jsons;
import io.agentwarden.worker.EchoHandler;
import io.agentwarden.worker.ResourceSampler;
import io.agentwarden.worker.WorkerRuntime;

import java.nio.file.Files;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wires the SQLite stores, audit log and settings of one runtime root and
 * exposes the operations behind each CLI command.
 */
public final class AgentWardenRuntime {
    public static final String CLI_SENDER = "cli";
    private static final long STOP_POLL_MS = 200L;

    private final AgentWardenConfig config;
    private final Database database;
    private final RoleLockStore locks;
    private final WorkQueue queue;
    private final HealthStore healthStore;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final ProcessProbe probe;

    public AgentWardenRuntime(AgentWardenConfig config) {
        this(config, Clock.systemUTC(), ProcessProbe.system());
    }

    public AgentWardenRuntime(AgentWardenConfig config, Clock clock, ProcessProbe probe) {
        this.config = config;
        this.database = new Database(config);
        this.locks = new SqliteRoleLockStore(database);
        this.queue = new SqliteWorkQueue(database);
        this.healthStore = new SqliteHealthStore(database);
        this.auditLogger = new AuditLogger(config.auditFile());
        this.clock = clock;
        this.probe = probe;
    }

    public void init() {
        database.init();
    }

    /**
     * Creates the schema and, unless one already exists, a starter settings
     * file whose roles run the built-in worker through {@code workerCommandPrefix}.
     */
    public InitOutcome initialize(List<String> workerCommandPrefix, boolean overwrite) {
        init();
        boolean exists = Files.exists(config.settingsFile());
        boolean written = false;
        if (!exists || overwrite) {
            SupervisorSettings.starter(workerCommandPrefix).write(config.settingsFile());
            written = true;
        }
        auditLogger.log(AuditEvent.byActor("runtime.init", CLI_SENDER, null, null, "ok",
                Map.of("settingsWritten", written)));
        return new InitOutcome(config.rootDir().toString(), config.settingsFile().toString(), written);
    }

    public SupervisorSettings settings() {
        return SupervisorSettings.load(config.settingsFile());
    }

    public ProcessSupervisor newSupervisor(SupervisorSettings settings, long selfPid) {
        return newSupervisor(settings, selfPid, new OsProcessLauncher(config));
    }

    public ProcessSupervisor newSupervisor(SupervisorSettings settings, long selfPid, ProcessLauncher launcher) {
        return new ProcessSupervisor(settings, locks, queue, healthStore, launcher, probe, clock,
                Sleeper.system(), auditLogger, selfPid, config.statusFile());
    }

    public WorkerRuntime newWorker(String role, long pid, int batchSize) {
        return new WorkerRuntime(role, pid, queue, healthStore, new EchoHandler(role), new ResourceSampler(), clock,
                batchSize);
    }

    public HeartbeatRecord heartbeat(String role, long pid, double cpuPercent, long memoryBytes) {
        HeartbeatRecord record = new HeartbeatRecord(role, pid, clock.millis(), cpuPercent, memoryBytes);
        healthStore.heartbeat(record);
        return record;
    }

    public SendOutcome send(String from, String to, String type, String payload, String priorityRaw) {
        Jsons.readTree(payload);
        int priority = MessagePriority.parse(priorityRaw);
        String id = queue.enqueue(new NewMessage(from, to, type, payload, priority), clock.millis());
        auditLogger.log(AuditEvent.byActor("message.sent", from, to, null, "ok",
                Map.of("messageId", id, "type", type, "priority", priority)));
        return new SendOutcome(id, from, to, type, priority);
    }

    public List<Message> messages(String recipient, String statusRaw, int limit) {
        MessageStatus status = statusRaw == null || statusRaw.isBlank() ? null : MessageStatus.fromString(statusRaw);
        return queue.list(recipient, status, limit);
    }

    public Map<String, Integer> messageStats(String recipient) {
        return queue.stats(recipient);
    }

    public List<RoleLockRecord> locks() {
        return locks.list();
    }

    public List<RoleLockRecord> reclaimLocks(long maxAgeMs) {
        long now = clock.millis();
        List<RoleLockRecord> reclaimed = locks.reclaimStale(now, maxAgeMs, probe::isAlive);
        for (RoleLockRecord lock : reclaimed) {
            auditLogger.log(AuditEvent.byActor("lock.stale_reclaimed", CLI_SENDER, lock.role(), lock.holderPid(), "ok",
                    Map.of("acquiredAtMs", lock.acquiredAtMs(), "ageMs", now - lock.acquiredAtMs())));
        }
        return reclaimed;
    }

    public PurgeOutcome purge(long olderThanMs) {
        long cutoff = clock.millis() - Math.max(0L, olderThanMs);
        int purged = queue.purgeFinishedBefore(cutoff);
        auditLogger.log(AuditEvent.byActor("queue.purged", CLI_SENDER, null, null, "ok",
                Map.of("messages", purged, "cutoffMs", cutoff)));
        return new PurgeOutcome(purged, cutoff);
    }

    public String metricsText() {
        return PrometheusFormatter.format(healthStore.listStatus(), queue.stats(null), queue.metricSummary(0L));
    }

    public MetricsOutcome metrics(String role, long sinceMs, int limit) {
        return new MetricsOutcome(queue.metricSummary(sinceMs), queue.metrics(role, sinceMs, limit));
    }

    public List<Alert> alerts(int limit) {
        return healthStore.listAlerts(limit);
    }

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    public int verifyAudit() {
        return auditLogger.verify();
    }

    /**
     * Last status published by the running (or last) supervisor.
     */
    public StatusOutcome status() {
        Optional<RoleLockRecord> lock = locks.find(ProcessSupervisor.SUPERVISOR_ROLE);
        boolean running = lock.isPresent() && probe.isAlive(lock.get().holderPid());
        List<WorkerStatusSnapshot> workers = healthStore.listStatus();
        boolean anyTerminal = false;
        for (WorkerStatusSnapshot w : workers) {
            if (w.state() == WorkerState.TERMINAL) {
                anyTerminal = true;
                break;
            }
        }
        return new StatusOutcome(running, lock.map(RoleLockRecord::holderPid).orElse(null), anyTerminal, workers);
    }

    /**
     * Sends a {@code shutdown_request} to the running supervisor and waits for
     * it to release its lock. After {@code waitMs} the supervisor process is
     * sent a termination signal instead.
     */
    public StopOutcome stop(boolean immediate, long waitMs, Sleeper sleeper) throws InterruptedException {
        Optional<RoleLockRecord> lock = locks.find(ProcessSupervisor.SUPERVISOR_ROLE);
        if (lock.isEmpty() || !probe.isAlive(lock.get().holderPid())) {
            return new StopOutcome(false, lock.map(RoleLockRecord::holderPid).orElse(null), null, true, false);
        }
        long pid = lock.get().holderPid();
        String payload = immediate ? "{\"mode\":\"immediate\"}" : "{\"mode\":\"graceful\"}";
        String id = queue.enqueue(new NewMessage(CLI_SENDER, ProcessSupervisor.SUPERVISOR_ROLE,
                ProcessSupervisor.SHUTDOWN_REQUEST, payload, MessagePriority.URGENT.value()), clock.millis());
        auditLogger.log(AuditEvent.byActor("supervisor.stop.requested", CLI_SENDER, ProcessSupervisor.SUPERVISOR_ROLE,
                pid, "ok", Map.of("messageId", id, "immediate", immediate)));
        long deadline = clock.millis() + Math.max(0L, waitMs);
        while (clock.millis() < deadline) {
            if (!holds(pid)) {
                return new StopOutcome(true, pid, id, true, false);
            }
            sleeper.sleep(STOP_POLL_MS);
        }
        if (!holds(pid)) {
            return new StopOutcome(true, pid, id, true, false);
        }
        boolean signalled = ProcessHandle.of(pid).map(ProcessHandle::destroy).orElse(false);
        auditLogger.log(AuditEvent.byActor("supervisor.stop.signalled", CLI_SENDER, ProcessSupervisor.SUPERVISOR_ROLE,
                pid, signalled ? "ok" : "error", Map.of("waitMs", waitMs)));
        return new StopOutcome(true, pid, id, false, signalled);
    }

    private boolean holds(long pid) {
        Optional<RoleLockRecord> current = locks.find(ProcessSupervisor.SUPERVISOR_ROLE);
        return current.isPresent() && current.get().holderPid() == pid && probe.isAlive(pid);
    }

    public AgentWardenConfig config() {
        return config;
    }

    public RoleLockStore lockStore() {
        return locks;
    }

    public WorkQueue queue() {
        return queue;
    }

    public HealthStore healthStore() {
        return healthStore;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public record InitOutcome(String root, String settingsFile, boolean settingsWritten) {
    }

    public record SendOutcome(String messageId, String from, String to, String type, int priority) {
    }

    public record PurgeOutcome(int messagesPurged, long cutoffMs) {
    }

    public record MetricsOutcome(List<MetricSummary> summary, List<MetricSample> samples) {
    }

    public record StatusOutcome(
            boolean supervisorRunning,
            Long supervisorPid,
            boolean anyTerminal,
            List<WorkerStatusSnapshot> workers
    ) {
    }

    public record StopOutcome(
            boolean supervisorWasRunning,
            Long supervisorPid,
            String requestMessageId,
            boolean stopped,
            boolean signalled
    ) {
    }
}
