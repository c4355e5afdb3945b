package io.agentwarden.config;

import io.agentwarden.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effective supervisor settings, resolved from {@code agentwarden.json} with
 * per-field fallback to defaults.
 */
public record SupervisorSettings(
        long monitorIntervalMs,
        long launchDelayMs,
        long gracePeriodMs,
        long immediateGracePeriodMs,
        long lockStaleAfterMs,
        long messageRetentionMs,
        int maintenanceEveryTicks,
        TerminalRecipientPolicy terminalRecipientPolicy,
        String fallbackRecipient,
        boolean failInFlightOnCrash,
        List<WorkerRole> roles
) {
    public static final long DEFAULT_MONITOR_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_LAUNCH_DELAY_MS = 1_000L;
    public static final long DEFAULT_GRACE_PERIOD_MS = 10_000L;
    public static final long DEFAULT_IMMEDIATE_GRACE_PERIOD_MS = 2_000L;
    public static final long DEFAULT_LOCK_STALE_AFTER_MS = 60_000L;
    public static final long DEFAULT_MESSAGE_RETENTION_MS = Duration.ofDays(30).toMillis();
    public static final int DEFAULT_MAINTENANCE_EVERY_TICKS = 10;

    public SupervisorSettings {
        if (monitorIntervalMs <= 0L) {
            throw new IllegalArgumentException("monitorIntervalMs must be > 0");
        }
        if (launchDelayMs < 0L) {
            throw new IllegalArgumentException("launchDelayMs must be >= 0");
        }
        if (gracePeriodMs < 0L || immediateGracePeriodMs < 0L) {
            throw new IllegalArgumentException("grace periods must be >= 0");
        }
        if (lockStaleAfterMs < 0L) {
            throw new IllegalArgumentException("lockStaleAfterMs must be >= 0");
        }
        if (messageRetentionMs <= 0L) {
            throw new IllegalArgumentException("messageRetentionMs must be > 0");
        }
        if (maintenanceEveryTicks <= 0) {
            throw new IllegalArgumentException("maintenanceEveryTicks must be > 0");
        }
        terminalRecipientPolicy = terminalRecipientPolicy == null ? TerminalRecipientPolicy.HOLD : terminalRecipientPolicy;
        if (terminalRecipientPolicy == TerminalRecipientPolicy.REROUTE
                && (fallbackRecipient == null || fallbackRecipient.isBlank())) {
            throw new IllegalArgumentException("fallbackRecipient is required when terminalRecipientPolicy=REROUTE");
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
        Set<String> seen = new HashSet<>();
        for (WorkerRole role : roles) {
            if (!seen.add(role.id())) {
                throw new IllegalArgumentException("duplicate role id: " + role.id());
            }
        }
    }

    public static SupervisorSettings defaults() {
        return new SupervisorSettings(
                DEFAULT_MONITOR_INTERVAL_MS,
                DEFAULT_LAUNCH_DELAY_MS,
                DEFAULT_GRACE_PERIOD_MS,
                DEFAULT_IMMEDIATE_GRACE_PERIOD_MS,
                DEFAULT_LOCK_STALE_AFTER_MS,
                DEFAULT_MESSAGE_RETENTION_MS,
                DEFAULT_MAINTENANCE_EVERY_TICKS,
                TerminalRecipientPolicy.HOLD,
                null,
                true,
                List.of()
        );
    }

    public SupervisorSettings withRoles(List<WorkerRole> newRoles) {
        return new SupervisorSettings(
                monitorIntervalMs,
                launchDelayMs,
                gracePeriodMs,
                immediateGracePeriodMs,
                lockStaleAfterMs,
                messageRetentionMs,
                maintenanceEveryTicks,
                terminalRecipientPolicy,
                fallbackRecipient,
                failInFlightOnCrash,
                newRoles
        );
    }

    /**
     * Loads settings from {@code file}. A missing file yields {@link #defaults()}.
     */
    public static SupervisorSettings load(Path file) {
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load supervisor settings: " + file, e);
        }
    }

    public void write(Path file) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, Jsons.toJson(this), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write supervisor settings: " + file, e);
        }
    }

    /**
     * Settings for the six-role team the supervisor was originally built for,
     * every role running the built-in worker through {@code workerCommandPrefix}.
     */
    public static SupervisorSettings starter(List<String> workerCommandPrefix) {
        List<WorkerRole> roles = new ArrayList<>();
        roles.add(starterRole("architect", 1, workerCommandPrefix));
        roles.add(starterRole("code_developer", 2, workerCommandPrefix));
        roles.add(starterRole("project_manager", 3, workerCommandPrefix));
        roles.add(starterRole("assistant", 3, workerCommandPrefix));
        roles.add(starterRole("code_searcher", 4, workerCommandPrefix));
        roles.add(starterRole("ux_design_expert", 4, workerCommandPrefix));
        return defaults().withRoles(roles);
    }

    public WorkerRole role(String id) {
        for (WorkerRole role : roles) {
            if (role.id().equals(id)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + id);
    }

    private static WorkerRole starterRole(String id, int priority, List<String> prefix) {
        List<String> command = new ArrayList<>(prefix);
        command.add("run-worker");
        command.add("--role");
        command.add(id);
        return WorkerRole.withDefaults(id, priority, command);
    }

    static SupervisorSettings fromFile(SettingsFile file, SupervisorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        List<WorkerRole> roles = new ArrayList<>();
        if (file.roles() != null) {
            for (RoleFile role : file.roles()) {
                if (role == null) {
                    continue;
                }
                roles.add(role.toRole());
            }
        }
        return new SupervisorSettings(
                pick(file.monitorIntervalMs(), defaults.monitorIntervalMs()),
                pick(file.launchDelayMs(), defaults.launchDelayMs()),
                pick(file.gracePeriodMs(), defaults.gracePeriodMs()),
                pick(file.immediateGracePeriodMs(), defaults.immediateGracePeriodMs()),
                pick(file.lockStaleAfterMs(), defaults.lockStaleAfterMs()),
                pick(file.messageRetentionMs(), defaults.messageRetentionMs()),
                file.maintenanceEveryTicks() == null ? defaults.maintenanceEveryTicks() : file.maintenanceEveryTicks(),
                file.terminalRecipientPolicy() == null
                        ? defaults.terminalRecipientPolicy()
                        : TerminalRecipientPolicy.fromString(file.terminalRecipientPolicy()),
                file.fallbackRecipient() == null ? defaults.fallbackRecipient() : file.fallbackRecipient().trim(),
                file.failInFlightOnCrash() == null ? defaults.failInFlightOnCrash() : file.failInFlightOnCrash(),
                roles
        );
    }

    private static long pick(Long value, long fallback) {
        return value == null ? fallback : value;
    }

    record SettingsFile(
            Long monitorIntervalMs,
            Long launchDelayMs,
            Long gracePeriodMs,
            Long immediateGracePeriodMs,
            Long lockStaleAfterMs,
            Long messageRetentionMs,
            Integer maintenanceEveryTicks,
            String terminalRecipientPolicy,
            String fallbackRecipient,
            Boolean failInFlightOnCrash,
            List<RoleFile> roles
    ) {
    }

    record RoleFile(
            String id,
            Integer priority,
            List<String> command,
            String workingDir,
            Map<String, String> env,
            Long healthCheckIntervalMs,
            Long heartbeatStaleAfterMs,
            Long heartbeatDeadAfterMs,
            Integer maxRestarts,
            Long backoffBaseMs,
            Double maxCpuPercent,
            Long maxMemoryBytes
    ) {
        WorkerRole toRole() {
            return new WorkerRole(
                    id == null ? null : id.trim(),
                    priority == null ? 100 : priority,
                    command,
                    workingDir,
                    env,
                    pick(healthCheckIntervalMs, WorkerRole.DEFAULT_HEALTH_CHECK_INTERVAL_MS),
                    pick(heartbeatStaleAfterMs, WorkerRole.DEFAULT_HEARTBEAT_STALE_AFTER_MS),
                    pick(heartbeatDeadAfterMs, WorkerRole.DEFAULT_HEARTBEAT_DEAD_AFTER_MS),
                    maxRestarts == null ? WorkerRole.DEFAULT_MAX_RESTARTS : maxRestarts,
                    pick(backoffBaseMs, WorkerRole.DEFAULT_BACKOFF_BASE_MS),
                    maxCpuPercent == null ? WorkerRole.DEFAULT_MAX_CPU_PERCENT : maxCpuPercent,
                    pick(maxMemoryBytes, WorkerRole.DEFAULT_MAX_MEMORY_BYTES)
            );
        }
    }
}
