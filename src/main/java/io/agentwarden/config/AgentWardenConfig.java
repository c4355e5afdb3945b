package io.agentwarden.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AgentWardenConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "agentwarden.json";

    private final Path rootDir;

    public AgentWardenConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AgentWardenConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new AgentWardenConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("agentwarden.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path statusRoot() {
        return rootDir.resolve("status");
    }

    public Path statusFile() {
        return statusRoot().resolve("supervisor-status.json");
    }

    public Path logsRoot() {
        return rootDir.resolve("logs");
    }

    public Path workerLogFile(String role) {
        return logsRoot().resolve(role + ".log");
    }
}
