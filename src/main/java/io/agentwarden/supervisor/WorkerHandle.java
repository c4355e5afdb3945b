package io.agentwarden.supervisor;

/**
 * Supervisor-side handle on one spawned worker process.
 */
public interface WorkerHandle {
    long pid();

    boolean isAlive();

    /**
     * Asks the process to exit (SIGTERM on Unix). Returns immediately.
     */
    void terminate();

    /**
     * Kills the process without giving it a chance to clean up.
     */
    void kill();
}
