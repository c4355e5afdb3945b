package io.agentwarden.supervisor;

/**
 * Answers whether an operating-system process is still running.
 */
@FunctionalInterface
public interface ProcessProbe {
    boolean isAlive(long pid);

    static ProcessProbe system() {
        return pid -> ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
