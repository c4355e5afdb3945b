package io.agentwarden.supervisor;

import io.agentwarden.config.WorkerRole;

@FunctionalInterface
public interface ProcessLauncher {
    /**
     * Spawns one process for {@code role}.
     *
     * @throws ProcessSpawnException if the operating system refused to start it
     */
    WorkerHandle launch(WorkerRole role);
}
