package io.agentwarden.supervisor;

import io.agentwarden.config.AgentWardenConfig;
import io.agentwarden.config.WorkerRole;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Spawns workers as child processes. Output and errors of each role are
 * appended to {@code logs/<role>.log} under the runtime root.
 */
public final class OsProcessLauncher implements ProcessLauncher {
    public static final String ENV_ROLE = "AGENTWARDEN_ROLE";
    public static final String ENV_ROOT = "AGENTWARDEN_ROOT";
    private static final long KILL_WAIT_MS = 1_000L;

    private final AgentWardenConfig config;

    public OsProcessLauncher(AgentWardenConfig config) {
        this.config = config;
    }

    @Override
    public WorkerHandle launch(WorkerRole role) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(role.command()));
        if (role.workingDir() != null && !role.workingDir().isBlank()) {
            pb.directory(new File(role.workingDir()));
        }
        pb.environment().putAll(role.env());
        pb.environment().put(ENV_ROLE, role.id());
        pb.environment().put(ENV_ROOT, config.rootDir().toString());
        pb.redirectErrorStream(true);
        Process process;
        try {
            Files.createDirectories(config.logsRoot());
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(config.workerLogFile(role.id()).toFile()));
            process = pb.start();
        } catch (IOException e) {
            throw new ProcessSpawnException(role.id(), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            System.err.println("WARN could not close stdin of worker " + role.id() + ": " + e.getMessage());
        }
        return new OsWorkerHandle(process);
    }

    static final class OsWorkerHandle implements WorkerHandle {
        private final Process process;

        OsWorkerHandle(Process process) {
            this.process = process;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate() {
            process.destroy();
        }

        @Override
        public void kill() {
            process.destroyForcibly();
            try {
                process.waitFor(KILL_WAIT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
