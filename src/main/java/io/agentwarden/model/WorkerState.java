package io.agentwarden.model;

public enum WorkerState {
    UNSTARTED,
    STARTING,
    RUNNING,
    STALE,
    CRASHED,
    STOPPING,
    STOPPED,
    TERMINAL;

    public boolean isLive() {
        return this == STARTING || this == RUNNING || this == STALE || this == STOPPING;
    }
}
