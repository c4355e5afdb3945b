package io.agentwarden.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentwarden.Main;
import io.agentwarden.config.AgentWardenConfig;
import io.agentwarden.config.SupervisorSettings;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.model.RoleLockRecord;
import io.agentwarden.model.WorkerStatusSnapshot;
import io.agentwarden.runtime.AgentWardenRuntime;
import io.agentwarden.supervisor.ProcessProbe;
import io.agentwarden.supervisor.ProcessSupervisor;
import io.agentwarden.supervisor.RoleAlreadyRunningException;
import io.agentwarden.supervisor.ShutdownMode;
import io.agentwarden.supervisor.ShutdownReport;
import io.agentwarden.supervisor.Sleeper;
import io.agentwarden.supervisor.SupervisorExitCodes;
import io.agentwarden.util.Jsons;
import io.agentwarden.worker.WorkerRuntime;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "agentwarden",
        mixinStandardHelpOptions = true,
        description = "AgentWarden worker supervisor CLI",
        subcommands = {
                AgentWardenCommand.InitCommand.class,
                AgentWardenCommand.StartCommand.class,
                AgentWardenCommand.StopCommand.class,
                AgentWardenCommand.StatusCommand.class,
                AgentWardenCommand.HeartbeatCommand.class,
                AgentWardenCommand.RunWorkerCommand.class,
                AgentWardenCommand.SendCommand.class,
                AgentWardenCommand.MessagesCommand.class,
                AgentWardenCommand.MessageStatsCommand.class,
                AgentWardenCommand.LocksCommand.class,
                AgentWardenCommand.ReclaimLocksCommand.class,
                AgentWardenCommand.PurgeCommand.class,
                AgentWardenCommand.MetricsCommand.class,
                AgentWardenCommand.AlertsCommand.class,
                AgentWardenCommand.AuditTailCommand.class,
                AgentWardenCommand.AuditVerifyCommand.class
        }
)
public final class AgentWardenCommand implements Runnable {
    static final long SHUTDOWN_HOOK_MARGIN_MS = 15_000L;

    @Option(names = {"--root"}, description = "Runtime data root directory",
            defaultValue = "${env:AGENTWARDEN_ROOT:-data}")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | start | stop | status | heartbeat | run-worker | send | messages | messages-stats | locks | reclaim-locks | purge | metrics | alerts | audit-tail | audit-verify");
    }

    AgentWardenConfig config() {
        return AgentWardenConfig.fromRoot(root);
    }

    AgentWardenRuntime runtime() {
        return new AgentWardenRuntime(config());
    }

    /**
     * Command line that re-invokes this CLI from the current JVM, used as the
     * prefix of every starter role.
     */
    static List<String> selfCommand(AgentWardenConfig config) {
        List<String> command = new ArrayList<>();
        command.add(ProcessHandle.current().info().command().orElse("java"));
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(Main.class.getName());
        command.add("--root");
        command.add(config.rootDir().toString());
        return command;
    }

    @Command(name = "init", description = "Create the SQLite schema and a starter settings file")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--force"}, defaultValue = "false", description = "Overwrite an existing settings file")
        boolean force;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            AgentWardenRuntime.InitOutcome outcome = runtime.initialize(selfCommand(parent.config()), force);
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(
            name = "start",
            description = "Run the supervisor in the foreground",
            exitCodeListHeading = "Exit codes:%n",
            exitCodeList = {
                    "0:all workers stopped within the grace period",
                    "1:a worker exceeded its restart budget (terminal)",
                    "2:another supervisor holds the supervisor lock",
                    "3:one or more workers were force-killed after the grace period"
            }
    )
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--roles"}, split = ",", description = "Roles to launch (default: all configured)")
        List<String> roles;

        @Override
        public Integer call() throws Exception {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            SupervisorSettings settings = runtime.settings();
            if (settings.roles().isEmpty()) {
                System.err.println("No roles configured in " + parent.config().settingsFile() + ", run init first");
                return SupervisorExitCodes.TERMINAL_WORKERS;
            }
            Set<String> selected = new LinkedHashSet<>();
            if (roles != null) {
                for (String role : roles) {
                    if (role != null && !role.isBlank()) {
                        selected.add(role.trim());
                    }
                }
            }
            long selfPid = ProcessHandle.current().pid();
            ProcessSupervisor supervisor = runtime.newSupervisor(settings, selfPid);
            long hookWaitMs = settings.gracePeriodMs() + SHUTDOWN_HOOK_MARGIN_MS;
            // SIGTERM and SIGINT both land here; the hook decides the exit status.
            Thread hook = new Thread(() -> {
                supervisor.requestShutdown(ShutdownMode.GRACEFUL);
                try {
                    ShutdownReport report = supervisor.awaitTermination(hookWaitMs);
                    System.out.flush();
                    Runtime.getRuntime().halt(report == null
                            ? SupervisorExitCodes.FORCED_TERMINATION
                            : report.exitCode());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "agentwarden-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                supervisor.start(selected);
            } catch (RoleAlreadyRunningException e) {
                Runtime.getRuntime().removeShutdownHook(hook);
                System.err.println("Supervisor already running: " + e.getMessage());
                return SupervisorExitCodes.LOCK_HELD;
            } catch (RuntimeException e) {
                Runtime.getRuntime().removeShutdownHook(hook);
                supervisor.shutdown(ShutdownMode.IMMEDIATE);
                throw e;
            }
            Map<String, Object> started = new LinkedHashMap<>();
            started.put("supervisorPid", selfPid);
            started.put("root", parent.config().rootDir().toString());
            started.put("workers", supervisor.snapshot());
            System.out.println(Jsons.toJson(started));

            ShutdownReport report = supervisor.run();
            System.out.println(Jsons.toJson(report));
            return report.exitCode();
        }
    }

    @Command(name = "stop", description = "Ask the running supervisor to shut down")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--immediate"}, defaultValue = "false", description = "Use the short grace period")
        boolean immediate;

        @Option(names = {"--wait-ms"}, defaultValue = "45000",
                description = "How long to wait for the supervisor before signalling it")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            AgentWardenRuntime.StopOutcome outcome = runtime.stop(immediate, waitMs, Sleeper.system());
            System.out.println(Jsons.toJson(outcome));
            if (!outcome.supervisorWasRunning() || outcome.stopped()) {
                return 0;
            }
            return outcome.signalled() ? 0 : 1;
        }
    }

    @Command(
            name = "status",
            description = "Show per-role state, pid, uptime, restarts and heartbeat age",
            exitCodeListHeading = "Exit codes:%n",
            exitCodeList = {
                    "0:no worker is terminal",
                    "1:at least one worker is terminal"
            },
            footer = "See 'start --help' for the supervisor's exit codes, including 3 for forced termination."
    )
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print JSON instead of a table")
        boolean json;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            AgentWardenRuntime.StatusOutcome status = runtime.status();
            if (json) {
                System.out.println(Jsons.toJson(status));
            } else {
                System.out.println("supervisor: " + (status.supervisorRunning()
                        ? "running (pid " + status.supervisorPid() + ")"
                        : "not running"));
                System.out.println(StatusTable.render(status.workers()));
            }
            return status.anyTerminal() ? SupervisorExitCodes.TERMINAL_WORKERS : SupervisorExitCodes.CLEAN;
        }
    }

    @Command(name = "heartbeat", description = "Record a heartbeat on behalf of a worker process")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--role"}, required = true, description = "Worker role")
        String role;

        @Option(names = {"--pid"}, required = true, description = "Worker process id")
        long pid;

        @Option(names = {"--cpu"}, defaultValue = "0", description = "CPU usage in percent")
        double cpu;

        @Option(names = {"--mem"}, defaultValue = "0", description = "Memory usage in bytes")
        long memoryBytes;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            HeartbeatRecord record = runtime.heartbeat(role, pid, cpu, memoryBytes);
            System.out.println(Jsons.toJson(record));
            return 0;
        }
    }

    @Command(name = "run-worker", description = "Run the built-in worker loop for one role")
    static final class RunWorkerCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--role"}, defaultValue = "${env:AGENTWARDEN_ROLE}",
                description = "Role served by this worker (default: $AGENTWARDEN_ROLE)")
        String role;

        @Option(names = {"--interval-ms"}, defaultValue = "1000", description = "Poll interval in ms")
        long intervalMs;

        @Option(names = {"--batch"}, defaultValue = "10", description = "Messages claimed per poll")
        int batch;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one poll cycle")
        boolean once;

        @Override
        public Integer call() throws Exception {
            if (role == null || role.isBlank()) {
                System.err.println("--role is required when AGENTWARDEN_ROLE is not set");
                return 2;
            }
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            WorkerRuntime worker = runtime.newWorker(role, ProcessHandle.current().pid(), batch);
            if (once) {
                System.out.println(Jsons.toJson(worker.runOnce()));
                return 0;
            }
            AtomicBoolean running = new AtomicBoolean(true);
            CountDownLatch finished = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                try {
                    finished.await(Math.max(1_000L, intervalMs * 2), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "agentwarden-worker-shutdown"));
            try {
                while (running.get()) {
                    try {
                        WorkerRuntime.WorkerOutcome outcome = worker.runOnce();
                        if (outcome.processed() + outcome.failed() > 0) {
                            System.out.println(Jsons.toCompactJson(outcome));
                        }
                    } catch (RuntimeException e) {
                        // Transient store failures; the next poll retries.
                        System.err.println("WARN worker " + role + " poll failed: " + e.getMessage());
                    }
                    Thread.sleep(intervalMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                finished.countDown();
            }
            return 0;
        }
    }

    @Command(name = "send", description = "Enqueue a message for a role")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--from"}, defaultValue = AgentWardenRuntime.CLI_SENDER, description = "Sender role")
        String from;

        @Option(names = {"--to"}, required = true, description = "Recipient role")
        String to;

        @Option(names = {"--type"}, required = true, description = "Message type")
        String type;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON payload")
        String payload;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "urgent|normal|low or an integer")
        String priority;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.send(from, to, type, payload, priority)));
            return 0;
        }
    }

    @Command(name = "messages", description = "List queued messages, newest first")
    static final class MessagesCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--recipient"}, description = "Filter by recipient role")
        String recipient;

        @Option(names = {"--status"}, description = "Filter by status (pending|in_progress|completed|failed)")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.messages(recipient, status, limit)));
            return 0;
        }
    }

    @Command(name = "messages-stats", description = "Message counts by status")
    static final class MessageStatsCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--recipient"}, description = "Restrict to one recipient role")
        String recipient;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.messageStats(recipient)));
            return 0;
        }
    }

    @Command(name = "locks", description = "List role locks and whether their holders are alive")
    static final class LocksCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            ProcessProbe probe = ProcessProbe.system();
            List<Map<String, Object>> rows = new ArrayList<>();
            for (RoleLockRecord lock : runtime.locks()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("role", lock.role());
                row.put("holderPid", lock.holderPid());
                row.put("acquiredAtMs", lock.acquiredAtMs());
                row.put("holderAlive", probe.isAlive(lock.holderPid()));
                rows.add(row);
            }
            System.out.println(Jsons.toJson(rows));
            return 0;
        }
    }

    @Command(name = "reclaim-locks", description = "Release locks held by dead processes")
    static final class ReclaimLocksCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--max-age-ms"}, defaultValue = "-1",
                description = "Minimum lock age; negative uses lockStaleAfterMs from settings")
        long maxAgeMs;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            long effective = maxAgeMs >= 0 ? maxAgeMs : runtime.settings().lockStaleAfterMs();
            System.out.println(Jsons.toJson(runtime.reclaimLocks(effective)));
            return 0;
        }
    }

    @Command(name = "purge", description = "Delete finished messages older than the retention window")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--older-than-ms"}, defaultValue = "-1",
                description = "Retention window; negative uses messageRetentionMs from settings")
        long olderThanMs;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            long effective = olderThanMs >= 0 ? olderThanMs : runtime.settings().messageRetentionMs();
            System.out.println(Jsons.toJson(runtime.purge(effective)));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Show recorded worker metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--prometheus"}, defaultValue = "false", description = "Print Prometheus metrics text")
        boolean prometheus;

        @Option(names = {"--role"}, description = "Restrict samples to one role")
        String role;

        @Option(names = {"--since-ms"}, defaultValue = "0", description = "Only samples at or after this epoch ms")
        long sinceMs;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max samples")
        int limit;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            if (prometheus) {
                System.out.print(runtime.metricsText());
            } else {
                System.out.println(Jsons.toJson(runtime.metrics(role, sinceMs, limit)));
            }
            return 0;
        }
    }

    @Command(name = "alerts", description = "Show raised alerts, newest first")
    static final class AlertsCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.alerts(limit)));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Number of latest lines")
        int limit;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            for (JsonNode row : runtime.auditTail(limit)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentWardenCommand parent;

        @Override
        public Integer call() {
            AgentWardenRuntime runtime = parent.runtime();
            runtime.init();
            Map<String, Object> out = new LinkedHashMap<>();
            try {
                out.put("valid", true);
                out.put("rows", runtime.verifyAudit());
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (IllegalStateException e) {
                out.put("valid", false);
                out.put("error", e.getMessage());
                System.out.println(Jsons.toJson(out));
                return 1;
            }
        }
    }

    static final class StatusTable {
        private static final String FORMAT = "%-18s %-24s %8s %12s %10s %12s %7s %12s";

        private StatusTable() {
        }

        static String render(List<WorkerStatusSnapshot> workers) {
            StringBuilder sb = new StringBuilder();
            sb.append(String.format(Locale.ROOT, FORMAT,
                    "ROLE", "STATE", "PID", "UPTIME", "RESTARTS", "HEARTBEAT", "CPU%", "MEMORY"));
            for (WorkerStatusSnapshot w : workers) {
                sb.append('\n').append(String.format(Locale.ROOT, FORMAT,
                        w.role(),
                        w.displayState(),
                        w.pid() == null ? "-" : w.pid().toString(),
                        duration(w.uptimeMs()),
                        w.restartCount() + "/" + w.maxRestarts(),
                        w.heartbeatAgeMs() == null ? "-" : duration(w.heartbeatAgeMs()) + " ago",
                        w.cpuPercent() == null ? "-" : String.format(Locale.ROOT, "%.1f", w.cpuPercent()),
                        w.memoryBytes() == null ? "-" : megabytes(w.memoryBytes())));
                for (String warning : w.warnings()) {
                    sb.append("\n  ! ").append(warning);
                }
            }
            return sb.toString();
        }

        static String duration(long ms) {
            long seconds = Math.max(0L, ms) / 1000L;
            if (seconds < 60L) {
                return seconds + "s";
            }
            if (seconds < 3600L) {
                return (seconds / 60L) + "m" + (seconds % 60L) + "s";
            }
            return (seconds / 3600L) + "h" + ((seconds % 3600L) / 60L) + "m";
        }

        static String megabytes(long bytes) {
            return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0d * 1024.0d));
        }
    }
}
